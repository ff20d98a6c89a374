package io.github.reugn.tsdef4j.descriptor;

/**
 * Per-member conversion attributes.
 *
 * <p>String attributes are {@code null} when absent; empty strings are normalized to
 * {@code null}.
 *
 * @param rename       explicit output name, overriding any container rename rule
 * @param skip         drop the member entirely
 * @param flatten      splice the fields of the member's object type in place of the member
 * @param optional     mark the field optional and unwrap a nullable ("maybe") type
 * @param defaulted    mark the field optional, keeping its type as is
 * @param inline       replace a named type reference with its definition
 * @param typeOverride raw TypeScript type name used instead of the converted type
 * @param index        base type of an indexed access type; must be paired with {@code key}
 * @param key          property key of an indexed access type; must be paired with {@code index}
 * @param pattern      template literal pattern, e.g. {@code "v${number}"}
 * @param readonly     render the field with a {@code readonly} prefix
 */
public record FieldAttributes(String rename, boolean skip, boolean flatten, boolean optional, boolean defaulted,
                              boolean inline, String typeOverride, String index, String key, String pattern,
                              boolean readonly) {

    private static final FieldAttributes NONE = builder().build();

    public FieldAttributes {
        rename = blankToNull(rename);
        typeOverride = blankToNull(typeOverride);
        index = blankToNull(index);
        key = blankToNull(key);
        pattern = blankToNull(pattern);
    }

    public static FieldAttributes none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Fluent builder for {@link FieldAttributes}.
     */
    public static final class Builder {
        private String rename;
        private boolean skip;
        private boolean flatten;
        private boolean optional;
        private boolean defaulted;
        private boolean inline;
        private String typeOverride;
        private String index;
        private String key;
        private String pattern;
        private boolean readonly;

        private Builder() {
        }

        public Builder rename(String value) {
            this.rename = value;
            return this;
        }

        public Builder skip(boolean value) {
            this.skip = value;
            return this;
        }

        public Builder flatten(boolean value) {
            this.flatten = value;
            return this;
        }

        public Builder optional(boolean value) {
            this.optional = value;
            return this;
        }

        public Builder defaulted(boolean value) {
            this.defaulted = value;
            return this;
        }

        public Builder inline(boolean value) {
            this.inline = value;
            return this;
        }

        public Builder typeOverride(String value) {
            this.typeOverride = value;
            return this;
        }

        public Builder index(String value) {
            this.index = value;
            return this;
        }

        public Builder key(String value) {
            this.key = value;
            return this;
        }

        public Builder pattern(String value) {
            this.pattern = value;
            return this;
        }

        public Builder readonly(boolean value) {
            this.readonly = value;
            return this;
        }

        public FieldAttributes build() {
            return new FieldAttributes(rename, skip, flatten, optional, defaulted, inline, typeOverride,
                    index, key, pattern, readonly);
        }
    }
}
