package io.github.reugn.tsdef4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a TypeScript type for a Java type.
 * <p>
 * This annotation can be applied to:
 * <ul>
 *   <li><b>Records</b>: each component becomes a property</li>
 *   <li><b>Classes</b>: each instance field becomes a property</li>
 *   <li><b>Enums</b>: the constants become a union of string literals</li>
 *   <li><b>Sealed interfaces and sealed abstract classes</b>: the permitted subclasses become
 *       the variants of a discriminated union</li>
 * </ul>
 *
 * <p><b>Record example:</b>
 * <pre>
 * {@code
 * @TypeScript(renameAll = "camelCase")
 * public record User(String user_id, @TsField(optional = true) Optional<String> email) {}
 *
 * // Generated:
 * export type User = { userId: string; email?: string };
 * }
 * </pre>
 *
 * <p><b>Sealed hierarchy example:</b>
 * <pre>
 * {@code
 * @TypeScript
 * public sealed interface Message permits Message.Ping, Message.Text {
 *     record Ping() implements Message {}
 *     record Text(String body) implements Message {}
 * }
 *
 * // Generated:
 * export type Message = { type: "Ping" } | { type: "Text"; body: string };
 * }
 * </pre>
 *
 * @see TsField
 * @see TsVariant
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface TypeScript {

    /**
     * The TypeScript type name. Defaults to the Java simple name.
     *
     * @return the declared name
     */
    String rename() default "";

    /**
     * Case policy applied to property and variant names: {@code camelCase},
     * {@code PascalCase}, {@code snake_case}, {@code SCREAMING_SNAKE_CASE},
     * {@code kebab-case} or {@code SCREAMING-KEBAB-CASE}.
     *
     * @return the rename policy token
     */
    String renameAll() default "";

    /**
     * Dotted namespace path, e.g. {@code "Api.V1"}; the type is declared inside a
     * {@code namespace} block and referenced by its qualified name.
     *
     * @return the namespace path
     */
    String namespace() default "";

    /**
     * Origin module used to partition output into files. Defaults to the Java package.
     *
     * @return the module name
     */
    String module() default "";

    /**
     * Discriminant field of tagged variants. Defaults to {@code "type"}.
     * <p>
     * <b>Applies to:</b> sealed types.
     *
     * @return the tag field name
     */
    String tag() default "";

    /**
     * Payload field name; setting it switches to adjacent tagging:
     * {@code { type: "Text"; data: string }}.
     * <p>
     * <b>Applies to:</b> sealed types.
     *
     * @return the content field name
     */
    String content() default "";

    /**
     * Encode variants without a discriminant.
     * <p>
     * <b>Applies to:</b> sealed types.
     *
     * @return true for untagged variants
     */
    boolean untagged() default false;

    /**
     * Expose the single component's type instead of declaring a named type. Useful for
     * identifier wrappers such as {@code record UserId(String value)}.
     * <p>
     * <b>Applies to:</b> records with exactly one component.
     *
     * @return true for a transparent type
     */
    boolean transparent() default false;

    /**
     * Generic utility type wrapping the declaration body, e.g. {@code "Prettify"}.
     *
     * @return the wrapper type name
     */
    String wrapper() default "";

    /**
     * Names of types the declaration is intersected with:
     * {@code type Admin = User & { level: number };}.
     *
     * @return the extended type names
     */
    String[] extendsTypes() default {};
}
