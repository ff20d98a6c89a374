package io.github.reugn.tsdef4j.render;

import java.util.Locale;

/**
 * How generated declarations are exported.
 */
public enum ExportStyle {
    /**
     * No export keyword: {@code type Foo = ...;}
     */
    NONE,
    /**
     * Per-type exports: {@code export type Foo = ...;}
     */
    NAMED,
    /**
     * One aggregate statement after all declarations: {@code export { Foo, Bar };}
     */
    GROUPED;

    /**
     * Parses a case-insensitive style name ({@code none}, {@code named}, {@code grouped}).
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static ExportStyle parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown export style '" + value
                    + "'. Expected one of: none, named, grouped", e);
        }
    }
}
