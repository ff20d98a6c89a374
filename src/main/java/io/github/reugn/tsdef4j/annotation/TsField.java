package io.github.reugn.tsdef4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Customizes how a record component or field is converted.
 * <p>
 * Modifiers are applied in a fixed order: {@link #skip()}, {@link #flatten()}, {@link #type()},
 * {@link #index()}/{@link #key()}, {@link #pattern()}, {@link #defaulted()}/{@link #optional()},
 * then {@link #inline()}.
 *
 * <pre>
 * {@code
 * @TypeScript
 * public record Release(
 *         @TsField(pattern = "v${number}.${number}") String version,
 *         @TsField(index = "User", key = "id") String ownerId,
 *         @TsField(skip = true) String internalNote) {}
 *
 * // Generated:
 * export type Release = { version: `v${number}.${number}`; ownerId: User["id"] };
 * }
 * </pre>
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.SOURCE)
public @interface TsField {

    /**
     * Property name, overriding {@link TypeScript#renameAll()}.
     *
     * @return the property name
     */
    String rename() default "";

    /**
     * Omit the property.
     *
     * @return true to skip
     */
    boolean skip() default false;

    /**
     * Splice the properties of the member's object type into the enclosing type.
     *
     * @return true to flatten
     */
    boolean flatten() default false;

    /**
     * Mark the property optional and unwrap {@code Optional<T>} / {@code T | null} to {@code T}.
     *
     * @return true for an optional property
     */
    boolean optional() default false;

    /**
     * Mark the property optional, keeping its type.
     *
     * @return true for a defaulted property
     */
    boolean defaulted() default false;

    /**
     * Replace a reference to a named type with its definition.
     *
     * @return true to inline
     */
    boolean inline() default false;

    /**
     * Raw TypeScript type used instead of the converted one.
     *
     * @return the type override
     */
    String type() default "";

    /**
     * Base type of an indexed access type; requires {@link #key()}.
     *
     * @return the indexed type name
     */
    String index() default "";

    /**
     * Property key of an indexed access type; requires {@link #index()}.
     *
     * @return the indexed property key
     */
    String key() default "";

    /**
     * Template literal pattern, e.g. {@code "vm-${string}"}.
     *
     * @return the pattern
     */
    String pattern() default "";

    /**
     * Render the property {@code readonly}.
     *
     * @return true for a readonly property
     */
    boolean readonly() default false;
}
