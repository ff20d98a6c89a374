package io.github.reugn.tsdef4j.external;

import java.util.List;
import java.util.Objects;

/**
 * A top-level TypeScript type declaration.
 */
public sealed interface TsDeclaration permits TsDeclaration.Interface, TsDeclaration.TypeAlias,
        TsDeclaration.Enum {

    String name();

    /**
     * {@code interface Name<T> { ... }}.
     */
    record Interface(String name, List<String> typeParams, List<TsTypeElement> body) implements TsDeclaration {
        public Interface {
            Objects.requireNonNull(name, "name");
            typeParams = List.copyOf(typeParams);
            body = List.copyOf(body);
        }
    }

    /**
     * {@code type Name<T> = type;}.
     */
    record TypeAlias(String name, List<String> typeParams, TsTypeNode type) implements TsDeclaration {
        public TypeAlias {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
            typeParams = List.copyOf(typeParams);
        }
    }

    /**
     * {@code enum Name { ... }}.
     */
    record Enum(String name, List<EnumMember> members) implements TsDeclaration {
        public Enum {
            Objects.requireNonNull(name, "name");
            members = List.copyOf(members);
        }
    }

    /**
     * An enum member. At most one initializer is set; a computed initializer sets neither.
     *
     * @param name         the member name
     * @param stringValue  a string literal initializer, or {@code null}
     * @param numberValue  a numeric literal initializer, or {@code null}
     */
    record EnumMember(String name, String stringValue, Double numberValue) {
        public EnumMember {
            Objects.requireNonNull(name, "name");
        }

        public static EnumMember of(String name) {
            return new EnumMember(name, null, null);
        }
    }
}
