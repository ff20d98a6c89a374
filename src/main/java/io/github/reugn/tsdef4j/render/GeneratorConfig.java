package io.github.reugn.tsdef4j.render;

import java.util.Objects;

/**
 * Output settings for {@link TypeScriptGenerator}.
 *
 * <p>Defaults: output file {@code types.ts}, {@link ExportStyle#NAMED} exports, full
 * {@code .ts} output, the default banner, no utility types, lenient references and
 * extension-less imports.
 *
 * <pre>{@code
 * GeneratorConfig config = GeneratorConfig.builder()
 *         .output("api.ts")
 *         .exportStyle(ExportStyle.GROUPED)
 *         .includeUtilities(true)
 *         .build();
 * }</pre>
 */
public final class GeneratorConfig {

    public static final String DEFAULT_OUTPUT = "types.ts";

    private final String output;
    private final ExportStyle exportStyle;
    private final boolean declarationOnly;
    private final String header;
    private final boolean includeUtilities;
    private final boolean strict;
    private final boolean esmExtensions;

    private GeneratorConfig(Builder builder) {
        this.output = builder.output;
        this.exportStyle = builder.exportStyle;
        this.declarationOnly = builder.declarationOnly;
        this.header = builder.header;
        this.includeUtilities = builder.includeUtilities;
        this.strict = builder.strict;
        this.esmExtensions = builder.esmExtensions;
    }

    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String output() {
        return output;
    }

    /**
     * Returns the output file name, using the {@code .d.ts} extension in declaration-only mode.
     */
    public String outputFile() {
        return withExtension(stripExtension(output));
    }

    public ExportStyle exportStyle() {
        return exportStyle;
    }

    public boolean declarationOnly() {
        return declarationOnly;
    }

    /**
     * Returns the custom header, or {@code null} for the default banner.
     */
    public String header() {
        return header;
    }

    public boolean includeUtilities() {
        return includeUtilities;
    }

    public boolean strict() {
        return strict;
    }

    /**
     * Returns {@code true} if module imports end in {@code .js}, as ESM resolution requires.
     */
    public boolean esmExtensions() {
        return esmExtensions;
    }

    /**
     * Appends the configured file extension ({@code .ts} or {@code .d.ts}) to a base path.
     */
    String withExtension(String basePath) {
        return basePath + (declarationOnly ? ".d.ts" : ".ts");
    }

    static String stripExtension(String path) {
        if (path.endsWith(".d.ts")) {
            return path.substring(0, path.length() - 5);
        }
        if (path.endsWith(".ts")) {
            return path.substring(0, path.length() - 3);
        }
        return path;
    }

    /**
     * Fluent builder for {@link GeneratorConfig}.
     */
    public static final class Builder {
        private String output = DEFAULT_OUTPUT;
        private ExportStyle exportStyle = ExportStyle.NAMED;
        private boolean declarationOnly;
        private String header;
        private boolean includeUtilities;
        private boolean strict;
        private boolean esmExtensions;

        private Builder() {
        }

        public Builder output(String value) {
            this.output = Objects.requireNonNull(value, "output");
            return this;
        }

        public Builder exportStyle(ExportStyle value) {
            this.exportStyle = Objects.requireNonNull(value, "exportStyle");
            return this;
        }

        public Builder declarationOnly(boolean value) {
            this.declarationOnly = value;
            return this;
        }

        public Builder header(String value) {
            this.header = value == null || value.isEmpty() ? null : value;
            return this;
        }

        public Builder includeUtilities(boolean value) {
            this.includeUtilities = value;
            return this;
        }

        public Builder strict(boolean value) {
            this.strict = value;
            return this;
        }

        public Builder esmExtensions(boolean value) {
            this.esmExtensions = value;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(this);
        }
    }
}
