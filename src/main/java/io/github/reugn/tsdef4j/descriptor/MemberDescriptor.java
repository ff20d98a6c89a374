package io.github.reugn.tsdef4j.descriptor;

import java.util.Objects;

/**
 * A member of a record or record-shaped variant.
 *
 * @param name       the source member name, or {@code null} for a positional member
 * @param type       the member type reference
 * @param attributes conversion attributes
 */
public record MemberDescriptor(String name, MemberType type, FieldAttributes attributes) {

    public MemberDescriptor {
        Objects.requireNonNull(type, "type");
        attributes = attributes == null ? FieldAttributes.none() : attributes;
    }

    public static MemberDescriptor named(String name, MemberType type) {
        return new MemberDescriptor(Objects.requireNonNull(name, "name"), type, FieldAttributes.none());
    }

    public static MemberDescriptor named(String name, MemberType type, FieldAttributes attributes) {
        return new MemberDescriptor(Objects.requireNonNull(name, "name"), type, attributes);
    }

    public static MemberDescriptor positional(MemberType type) {
        return new MemberDescriptor(null, type, FieldAttributes.none());
    }

    public boolean isPositional() {
        return name == null;
    }
}
