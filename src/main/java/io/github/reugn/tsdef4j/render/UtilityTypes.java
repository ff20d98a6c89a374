package io.github.reugn.tsdef4j.render;

/**
 * Helper types that can be emitted ahead of the generated declarations.
 */
public final class UtilityTypes {

    /** Name of the utility that flattens intersections for readable hover output. */
    public static final String PRETTIFY = "Prettify";

    private static final String PRETTIFY_DECLARATION = "type Prettify<T> = { [K in keyof T]: T[K] } & {};";

    private UtilityTypes() {
    }

    /**
     * Renders the utility declarations.
     *
     * @param exported {@code true} to prefix each declaration with {@code export}
     * @param declare  {@code true} to prefix non-exported declarations with {@code declare}
     * @return the declarations, one per line, without a trailing newline
     */
    public static String render(boolean exported, boolean declare) {
        String prefix = exported ? "export " : declare ? "declare " : "";
        return prefix + PRETTIFY_DECLARATION;
    }
}
