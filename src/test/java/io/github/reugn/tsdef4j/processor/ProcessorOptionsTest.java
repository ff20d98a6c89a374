package io.github.reugn.tsdef4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import io.github.reugn.tsdef4j.render.ExportStyle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;
import java.util.HashMap;
import java.util.Map;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.tsdef4j.util.CompileHelper.compile;
import static io.github.reugn.tsdef4j.util.CompileHelper.generatedTypeScript;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Processor Options Tests")
class ProcessorOptionsTest {

    private static final JavaFileObject USER = JavaFileObjects.forSourceString("com.acme.users.User",
            """
                    package com.acme.users;
                    
                    import io.github.reugn.tsdef4j.annotation.TypeScript;
                    import com.acme.common.Address;
                    
                    @TypeScript
                    public record User(String id, Address address) {}
                    """);

    private static final JavaFileObject ADDRESS = JavaFileObjects.forSourceString("com.acme.common.Address",
            """
                    package com.acme.common;
                    
                    import io.github.reugn.tsdef4j.annotation.TypeScript;
                    
                    @TypeScript
                    public record Address(String city) {}
                    """);

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("No options yield the defaults")
        void defaults() {
            ProcessorOptions options = ProcessorOptions.parse(Map.of());

            assertThat(options.output()).isEqualTo("types.ts");
            assertThat(options.exportStyle()).isEqualTo(ExportStyle.NAMED);
            assertThat(options.header()).isNull();
            assertThat(options.declarationOnly()).isFalse();
            assertThat(options.utilities()).isFalse();
            assertThat(options.splitModules()).isFalse();
            assertThat(options.esmExtensions()).isFalse();
            assertThat(options.strict()).isFalse();
            assertThat(options.providers()).isTrue();
        }

        @Test
        @DisplayName("A bare flag counts as true")
        void bareFlag() {
            Map<String, String> raw = new HashMap<>();
            raw.put(ProcessorOptions.STRICT, null);
            raw.put(ProcessorOptions.UTILITIES, "");
            raw.put(ProcessorOptions.PROVIDERS, "false");

            ProcessorOptions options = ProcessorOptions.parse(raw);

            assertThat(options.strict()).isTrue();
            assertThat(options.utilities()).isTrue();
            assertThat(options.providers()).isFalse();
        }

        @Test
        @DisplayName("Export style is case-insensitive")
        void exportStyle() {
            assertThat(ProcessorOptions.parse(Map.of(ProcessorOptions.EXPORT_STYLE, "GROUPED")).exportStyle())
                    .isEqualTo(ExportStyle.GROUPED);
        }

        @Test
        @DisplayName("Unknown export style is rejected")
        void invalidExportStyle() {
            assertThatThrownBy(() -> ProcessorOptions.parse(Map.of(ProcessorOptions.EXPORT_STYLE, "fancy")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown export style 'fancy'");
        }

        @Test
        @DisplayName("Options carry over to the generator config")
        void generatorConfig() {
            ProcessorOptions options = ProcessorOptions.parse(Map.of(
                    ProcessorOptions.OUTPUT, "api.ts",
                    ProcessorOptions.DECLARATION_ONLY, "true",
                    ProcessorOptions.ESM_EXTENSIONS, "true"));

            assertThat(options.toGeneratorConfig().outputFile()).isEqualTo("api.d.ts");
            assertThat(options.toGeneratorConfig().declarationOnly()).isTrue();
            assertThat(options.toGeneratorConfig().esmExtensions()).isTrue();
        }
    }

    @Nested
    @DisplayName("Output")
    class Output {

        @Test
        @DisplayName("Custom output file")
        void outputFile() {
            Compilation compilation = compile(Map.of(ProcessorOptions.OUTPUT, "api.ts"), ADDRESS);
            assertThat(compilation).succeeded();

            assertThat(generatedTypeScript(compilation, "api.ts"))
                    .endsWith("export type Address = { city: string };\n");
        }

        @Test
        @DisplayName("Declaration-only output uses .d.ts and declare")
        void declarationOnly() {
            Compilation compilation = compile(Map.of(
                    ProcessorOptions.DECLARATION_ONLY, "true",
                    ProcessorOptions.EXPORT_STYLE, "none"), ADDRESS);
            assertThat(compilation).succeeded();

            assertThat(generatedTypeScript(compilation, "types.d.ts"))
                    .contains("declare type Address = { city: string };");
        }

        @Test
        @DisplayName("Grouped export statement")
        void grouped() {
            Compilation compilation = compile(Map.of(ProcessorOptions.EXPORT_STYLE, "grouped"), USER, ADDRESS);
            assertThat(compilation).succeeded();

            assertThat(generatedTypeScript(compilation))
                    .contains("type Address = { city: string };\n\ntype User = { id: string; address: Address };")
                    .endsWith("export { Address, User };\n");
        }

        @Test
        @DisplayName("Custom header replaces the banner")
        void header() {
            Compilation compilation = compile(Map.of(ProcessorOptions.HEADER, "Acme API types"), ADDRESS);
            assertThat(compilation).succeeded();

            assertThat(generatedTypeScript(compilation))
                    .startsWith("// Acme API types\n\nexport type Address")
                    .doesNotContain("Generated by tsdef4j");
        }

        @Test
        @DisplayName("Bare utilities flag emits Prettify")
        void utilities() {
            JavaFileObject view = JavaFileObjects.forSourceString("test.View",
                    """
                            package test;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript(wrapper = "Prettify")
                            public record View(String title) {}
                            """);

            Compilation compilation = compile(Map.of(ProcessorOptions.UTILITIES, ""), view);
            assertThat(compilation).succeeded();

            assertThat(generatedTypeScript(compilation))
                    .contains("export type Prettify<T> = { [K in keyof T]: T[K] } & {};")
                    .contains("export type View = Prettify<{ title: string }>;");
        }
    }

    @Nested
    @DisplayName("Modules")
    class Modules {

        @Test
        @DisplayName("One file per package with relative imports")
        void splitModules() {
            Compilation compilation = compile(Map.of(ProcessorOptions.SPLIT_MODULES, "true"), USER, ADDRESS);
            assertThat(compilation).succeeded();

            assertThat(generatedTypeScript(compilation, "acme/common.ts"))
                    .contains("// Module: com.acme.common\n")
                    .contains("export type Address = { city: string };");
            assertThat(generatedTypeScript(compilation, "acme/users.ts"))
                    .contains("// Module: com.acme.users\n")
                    .contains("import type { Address } from \"../common\";\n")
                    .contains("export type User = { id: string; address: Address };")
                    .doesNotContain("type Address =");
        }
    }

    @Nested
    @DisplayName("Providers")
    class Providers {

        @Test
        @DisplayName("Disabled providers skip the generated class and service file")
        void disabled() {
            Compilation compilation = compile(Map.of(ProcessorOptions.PROVIDERS, "false"), ADDRESS);
            assertThat(compilation).succeeded();

            assertThat(compilation.generatedSourceFile("com.acme.common.TsDefinitions")).isEmpty();
            assertThat(compilation.generatedFile(StandardLocation.CLASS_OUTPUT,
                    TypeScriptProcessor.SERVICE_FILE)).isEmpty();
            assertThat(generatedTypeScript(compilation)).contains("export type Address");
        }
    }

    @Nested
    @DisplayName("Strict Mode")
    class Strict {

        @Test
        @DisplayName("Resolved references pass in strict mode")
        void resolved() {
            Compilation compilation = compile(Map.of(ProcessorOptions.STRICT, "true"), USER, ADDRESS);
            assertThat(compilation).succeeded();
        }

        @Test
        @DisplayName("Dangling references are tolerated without strict mode")
        void lenient() {
            JavaFileObject upload = JavaFileObjects.forSourceString("test.Upload",
                    """
                            package test;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            import java.io.File;
                            
                            @TypeScript
                            public record Upload(File file) {}
                            """);

            Compilation compilation = compile(upload);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Upload = { file: File };");
        }
    }
}
