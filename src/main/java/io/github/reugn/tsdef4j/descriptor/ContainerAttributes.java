package io.github.reugn.tsdef4j.descriptor;

import java.util.List;

/**
 * Type-level conversion attributes.
 *
 * @param rename       output name of the type
 * @param renameAll    rename rule token applied to member (or variant) names, e.g. {@code "camelCase"}
 * @param tag          discriminant field name for tagged variant sets; {@code "type"} when absent
 * @param content      payload field name; enables adjacent tagging
 * @param untagged     encode variants without a discriminant
 * @param transparent  expose the single member's type directly, without a named declaration
 * @param wrapper      generic utility type wrapping the declared body, e.g. {@code "Prettify"}
 * @param extendsTypes names of types the declared body is intersected with
 */
public record ContainerAttributes(String rename, String renameAll, String tag, String content, boolean untagged,
                                  boolean transparent, String wrapper, List<String> extendsTypes) {

    private static final ContainerAttributes NONE = builder().build();

    public ContainerAttributes {
        rename = FieldAttributes.blankToNull(rename);
        renameAll = FieldAttributes.blankToNull(renameAll);
        tag = FieldAttributes.blankToNull(tag);
        content = FieldAttributes.blankToNull(content);
        wrapper = FieldAttributes.blankToNull(wrapper);
        extendsTypes = extendsTypes == null ? List.of() : List.copyOf(extendsTypes);
    }

    public static ContainerAttributes none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ContainerAttributes}.
     */
    public static final class Builder {
        private String rename;
        private String renameAll;
        private String tag;
        private String content;
        private boolean untagged;
        private boolean transparent;
        private String wrapper;
        private List<String> extendsTypes = List.of();

        private Builder() {
        }

        public Builder rename(String value) {
            this.rename = value;
            return this;
        }

        public Builder renameAll(String value) {
            this.renameAll = value;
            return this;
        }

        public Builder tag(String value) {
            this.tag = value;
            return this;
        }

        public Builder content(String value) {
            this.content = value;
            return this;
        }

        public Builder untagged(boolean value) {
            this.untagged = value;
            return this;
        }

        public Builder transparent(boolean value) {
            this.transparent = value;
            return this;
        }

        public Builder wrapper(String value) {
            this.wrapper = value;
            return this;
        }

        public Builder extendsTypes(List<String> value) {
            this.extendsTypes = value;
            return this;
        }

        public ContainerAttributes build() {
            return new ContainerAttributes(rename, renameAll, tag, content, untagged, transparent, wrapper,
                    extendsTypes);
        }
    }
}
