package io.github.reugn.tsdef4j.descriptor;

/**
 * The payload shape of a single variant in a variant set.
 */
public enum VariantShape {
    /**
     * No payload.
     */
    UNIT,
    /**
     * Positional payload; one member is a single-field variant, several form a tuple.
     */
    TUPLE,
    /**
     * Named fields.
     */
    RECORD
}
