package io.github.reugn.tsdef4j.ir;

import java.util.Objects;

/**
 * A named member of an object type or a function parameter.
 *
 * @param name     the property name as it appears in the output
 * @param type     the property type
 * @param optional {@code true} to render the property with a {@code ?} marker
 * @param readonly {@code true} to render the property with a {@code readonly} prefix
 */
public record Field(String name, TypeDef type, boolean optional, boolean readonly) {

    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Creates a required, mutable field.
     */
    public static Field of(String name, TypeDef type) {
        return new Field(name, type, false, false);
    }

    /**
     * Creates an optional field ({@code name?: type}).
     */
    public static Field optional(String name, TypeDef type) {
        return new Field(name, type, true, false);
    }

    public Field withName(String newName) {
        return new Field(newName, type, optional, readonly);
    }

    public Field withType(TypeDef newType) {
        return new Field(name, newType, optional, readonly);
    }

    public Field withOptional(boolean isOptional) {
        return new Field(name, type, isOptional, readonly);
    }

    public Field withReadonly(boolean isReadonly) {
        return new Field(name, type, optional, isReadonly);
    }
}
