package io.github.reugn.tsdef4j.descriptor;

/**
 * Per-variant conversion attributes.
 *
 * @param rename    explicit variant name, overriding the container rename rule
 * @param skip      drop the variant
 * @param renameAll rename rule token for the fields of a record-shaped variant
 */
public record VariantAttributes(String rename, boolean skip, String renameAll) {

    private static final VariantAttributes NONE = new VariantAttributes(null, false, null);

    public VariantAttributes {
        rename = FieldAttributes.blankToNull(rename);
        renameAll = FieldAttributes.blankToNull(renameAll);
    }

    public static VariantAttributes none() {
        return NONE;
    }

    public static VariantAttributes renamed(String name) {
        return new VariantAttributes(name, false, null);
    }
}
