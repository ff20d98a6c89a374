package io.github.reugn.tsdef4j.descriptor;

import io.github.reugn.tsdef4j.ir.TypeDef;

import java.util.Optional;

/**
 * Resolves member types to IR, recursing into nested and referenced declarations.
 */
@FunctionalInterface
public interface MemberTypeResolver {

    /**
     * Resolves a member type.
     *
     * @param type the member type reference
     * @return the IR for the type
     */
    TypeDef resolve(MemberType type);

    /**
     * Looks up the declaration of a named type, used to materialize inlined generic references.
     *
     * @param name the declared (qualified) name
     * @return the declaration, or empty if unknown to this resolver
     */
    default Optional<TypeDef.Named> lookup(String name) {
        return Optional.empty();
    }

    /**
     * A resolver that only understands {@link MemberType.Resolved} references.
     */
    static MemberTypeResolver direct() {
        return type -> {
            if (type instanceof MemberType.Resolved resolved) {
                return resolved.type();
            }
            throw new IllegalArgumentException("Cannot resolve member type " + type.describe());
        };
    }
}
