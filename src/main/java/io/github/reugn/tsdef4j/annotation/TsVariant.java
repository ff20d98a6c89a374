package io.github.reugn.tsdef4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Customizes a variant: a permitted subclass of a sealed type or an enum constant.
 *
 * <pre>
 * {@code
 * @TypeScript
 * public sealed interface Shape permits Point, Circle {}
 *
 * @TsVariant(tuple = true)
 * record Point(double x, double y) implements Shape {}
 *
 * @TsVariant(rename = "circle")
 * record Circle(double radius) implements Shape {}
 *
 * // Generated:
 * export type Shape = { type: "Point"; value: [number, number] } | { type: "circle"; radius: number };
 * }
 * </pre>
 */
@Target({ElementType.TYPE, ElementType.FIELD})
@Retention(RetentionPolicy.SOURCE)
public @interface TsVariant {

    /**
     * Variant name, overriding {@link TypeScript#renameAll()}.
     *
     * @return the variant name
     */
    String rename() default "";

    /**
     * Omit the variant.
     *
     * @return true to skip
     */
    boolean skip() default false;

    /**
     * Encode the record components positionally: one component as the bare value, several as
     * a tuple.
     *
     * @return true for a positional payload
     */
    boolean tuple() default false;

    /**
     * Case policy applied to the variant's property names.
     *
     * @return the rename policy token
     */
    String renameAll() default "";
}
