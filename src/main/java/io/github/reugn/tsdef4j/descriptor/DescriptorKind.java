package io.github.reugn.tsdef4j.descriptor;

/**
 * The shape of a source type declaration.
 */
public enum DescriptorKind {
    /**
     * A product type: a Java record or class, converted to an object, tuple or newtype.
     */
    RECORD,
    /**
     * A sum type: a sealed hierarchy or an enum, converted to a union of variants.
     */
    VARIANT_SET,
    /**
     * A type alias with exactly one member whose type is the alias body.
     */
    ALIAS
}
