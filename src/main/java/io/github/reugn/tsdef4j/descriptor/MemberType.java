package io.github.reugn.tsdef4j.descriptor;

import io.github.reugn.tsdef4j.ir.TypeDef;

import java.util.Objects;

/**
 * An opaque reference to the type of a member, resolved to a {@link TypeDef} by a
 * {@link MemberTypeResolver}.
 *
 * <p>Reflection adapters supply their own implementations (e.g. wrapping a compiler type
 * mirror); {@link #of(TypeDef)} covers descriptors built by hand.
 */
public interface MemberType {

    /**
     * Returns a human-readable description of the type for diagnostics.
     */
    String describe();

    /**
     * Wraps an already-resolved type.
     */
    static MemberType of(TypeDef type) {
        return new Resolved(type);
    }

    /**
     * A member type that is already expressed in the IR.
     *
     * @param type the resolved type
     */
    record Resolved(TypeDef type) implements MemberType {
        public Resolved {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String describe() {
            return type.toString();
        }
    }
}
