package io.github.reugn.tsdef4j.processor;

import io.github.reugn.tsdef4j.render.ExportStyle;
import io.github.reugn.tsdef4j.render.GeneratorConfig;

import java.util.Map;
import java.util.Set;

/**
 * Processor options passed with {@code -A}.
 *
 * <table border="1">
 *   <caption>Supported options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Meaning</th></tr>
 *   <tr><td>{@code tsdef4j.output}</td><td>{@code types.ts}</td><td>output file, relative to the
 *       generated sources directory</td></tr>
 *   <tr><td>{@code tsdef4j.exportStyle}</td><td>{@code named}</td><td>{@code none}, {@code named}
 *       or {@code grouped}</td></tr>
 *   <tr><td>{@code tsdef4j.header}</td><td>banner</td><td>custom header comment</td></tr>
 *   <tr><td>{@code tsdef4j.declarationOnly}</td><td>{@code false}</td><td>write {@code .d.ts}
 *       files</td></tr>
 *   <tr><td>{@code tsdef4j.utilities}</td><td>{@code false}</td><td>emit utility types such as
 *       {@code Prettify}</td></tr>
 *   <tr><td>{@code tsdef4j.splitModules}</td><td>{@code false}</td><td>one file per origin
 *       module</td></tr>
 *   <tr><td>{@code tsdef4j.esmExtensions}</td><td>{@code false}</td><td>add {@code .js} to
 *       module import paths</td></tr>
 *   <tr><td>{@code tsdef4j.strict}</td><td>{@code false}</td><td>fail on references to unknown
 *       types</td></tr>
 *   <tr><td>{@code tsdef4j.providers}</td><td>{@code true}</td><td>generate {@code TsDefinitions}
 *       provider classes</td></tr>
 * </table>
 */
record ProcessorOptions(String output, ExportStyle exportStyle, String header, boolean declarationOnly,
                        boolean utilities, boolean splitModules, boolean esmExtensions, boolean strict,
                        boolean providers) {

    static final String OUTPUT = "tsdef4j.output";
    static final String EXPORT_STYLE = "tsdef4j.exportStyle";
    static final String HEADER = "tsdef4j.header";
    static final String DECLARATION_ONLY = "tsdef4j.declarationOnly";
    static final String UTILITIES = "tsdef4j.utilities";
    static final String SPLIT_MODULES = "tsdef4j.splitModules";
    static final String ESM_EXTENSIONS = "tsdef4j.esmExtensions";
    static final String STRICT = "tsdef4j.strict";
    static final String PROVIDERS = "tsdef4j.providers";

    static final Set<String> NAMES = Set.of(OUTPUT, EXPORT_STYLE, HEADER, DECLARATION_ONLY, UTILITIES,
            SPLIT_MODULES, ESM_EXTENSIONS, STRICT, PROVIDERS);

    /**
     * Parses the processor options.
     *
     * @throws IllegalArgumentException for an unknown export style
     */
    static ProcessorOptions parse(Map<String, String> options) {
        return new ProcessorOptions(
                options.getOrDefault(OUTPUT, GeneratorConfig.DEFAULT_OUTPUT),
                options.containsKey(EXPORT_STYLE) ? ExportStyle.parse(options.get(EXPORT_STYLE)) : ExportStyle.NAMED,
                options.get(HEADER),
                flag(options, DECLARATION_ONLY, false),
                flag(options, UTILITIES, false),
                flag(options, SPLIT_MODULES, false),
                flag(options, ESM_EXTENSIONS, false),
                flag(options, STRICT, false),
                flag(options, PROVIDERS, true));
    }

    /**
     * A boolean option; a bare {@code -Aname} counts as {@code true}.
     */
    private static boolean flag(Map<String, String> options, String name, boolean defaultValue) {
        if (!options.containsKey(name)) {
            return defaultValue;
        }
        String value = options.get(name);
        return value == null || value.isEmpty() || Boolean.parseBoolean(value);
    }

    GeneratorConfig toGeneratorConfig() {
        return GeneratorConfig.builder()
                .output(output)
                .exportStyle(exportStyle)
                .header(header)
                .declarationOnly(declarationOnly)
                .includeUtilities(utilities)
                .esmExtensions(esmExtensions)
                .strict(strict)
                .build();
    }
}
