package io.github.reugn.tsdef4j.render;

import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.TypeDef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TypeScriptGenerator")
class TypeScriptGeneratorTest {

    private static final TypeDef.Named ADDRESS = TypeDef.named("Address", TypeDef.object(
            Field.of("city", TypeDef.string())));

    private static final TypeDef.Named USER = TypeDef.named("User", TypeDef.object(
            Field.of("id", TypeDef.string()),
            Field.of("address", TypeDef.ref("Address"))));

    private static TypeScriptGenerator generator(GeneratorConfig.Builder config) {
        return new TypeScriptGenerator(config.build()).add(USER).add(ADDRESS);
    }

    @Nested
    @DisplayName("Single unit")
    class SingleUnit {

        @Test
        @DisplayName("Default banner and dependency order")
        void defaults() {
            assertThat(generator(GeneratorConfig.builder()).generate()).isEqualTo(
                    "// Generated by tsdef4j\n"
                            + "// Do not edit manually\n"
                            + "\n"
                            + "export type Address = { city: string };\n"
                            + "\n"
                            + "export type User = { id: string; address: Address };\n");
        }

        @Test
        @DisplayName("Custom header lines are commented")
        void customHeader() {
            String output = generator(GeneratorConfig.builder().header("API types\nv2")).generate();
            assertThat(output).startsWith("// API types\n// v2\n\nexport type Address");
        }

        @Test
        @DisplayName("Declaration-only output uses declare and .d.ts")
        void declarationOnly() {
            TypeScriptGenerator generator = generator(GeneratorConfig.builder()
                    .declarationOnly(true)
                    .exportStyle(ExportStyle.NONE));
            assertThat(generator.config().outputFile()).isEqualTo("types.d.ts");
            assertThat(generator.generate()).contains("declare type Address = { city: string };");
        }

        @Test
        @DisplayName("Utility types precede the declarations")
        void utilities() {
            String output = generator(GeneratorConfig.builder().includeUtilities(true)).generate();
            assertThat(output).contains("export type Prettify<T> = { [K in keyof T]: T[K] } & {};\n\n"
                    + "export type Address");
        }

        @Test
        @DisplayName("Grouped exports")
        void grouped() {
            String output = generator(GeneratorConfig.builder().exportStyle(ExportStyle.GROUPED)).generate();
            assertThat(output).contains("type Address = { city: string };")
                    .doesNotContain("export type")
                    .endsWith("export { Address, User };\n");
        }
    }

    @Nested
    @DisplayName("Strict references")
    class Strict {

        @Test
        @DisplayName("Dangling reference fails in strict mode")
        void dangling() {
            TypeScriptGenerator generator = new TypeScriptGenerator(GeneratorConfig.builder().strict(true).build())
                    .add(USER);
            assertThatThrownBy(generator::generate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Unresolved type references: Address");
        }

        @Test
        @DisplayName("Dangling reference is kept in lenient mode")
        void lenient() {
            String output = new TypeScriptGenerator(GeneratorConfig.defaults()).add(USER).generate();
            assertThat(output).contains("address: Address");
        }

        @Test
        @DisplayName("Utility types count as declared when emitted")
        void prettifyDeclared() {
            TypeDef.Named view = TypeDef.named("UserView", TypeDef.generic(UtilityTypes.PRETTIFY, ADDRESS));
            TypeScriptGenerator generator = new TypeScriptGenerator(GeneratorConfig.builder()
                    .strict(true)
                    .includeUtilities(true)
                    .build()).add(view);
            assertThat(generator.generate()).contains("export type UserView = Prettify<Address>;");

            TypeScriptGenerator withoutUtilities = new TypeScriptGenerator(GeneratorConfig.builder()
                    .strict(true)
                    .build()).add(view);
            assertThatThrownBy(withoutUtilities::generate).hasMessageContaining("Prettify");
        }
    }

    @Nested
    @DisplayName("Modules")
    class Modules {

        @Test
        @DisplayName("Module names map to relative paths")
        void modulePath() {
            TypeScriptGenerator generator = new TypeScriptGenerator(GeneratorConfig.defaults());
            assertThat(generator.modulePath("com.acme.models")).isEqualTo("acme/models.ts");
            assertThat(generator.modulePath("crate::api::users")).isEqualTo("api/users.ts");
            assertThat(generator.modulePath("models")).isEqualTo("models.ts");
            assertThat(generator.modulePath("default")).isEqualTo("types.ts");
        }

        @Test
        @DisplayName("Declaration-only module paths use .d.ts")
        void declarationModulePath() {
            TypeScriptGenerator generator = new TypeScriptGenerator(
                    GeneratorConfig.builder().declarationOnly(true).build());
            assertThat(generator.modulePath("com.acme.models")).isEqualTo("acme/models.d.ts");
        }

        @Test
        @DisplayName("Relative imports between unit paths")
        void relativeImport() {
            assertThat(TypeScriptGenerator.relativeImport("acme/users.ts", "acme/common.ts")).isEqualTo("./common");
            assertThat(TypeScriptGenerator.relativeImport("types.ts", "acme/common.ts")).isEqualTo("./acme/common");
            assertThat(TypeScriptGenerator.relativeImport("a/b/c.ts", "x/y.d.ts")).isEqualTo("../../x/y");
        }

        @Test
        @DisplayName("One unit per module with cross-module imports")
        void generateModules() {
            TypeScriptGenerator generator = new TypeScriptGenerator(GeneratorConfig.defaults())
                    .add(USER.withOriginModule("com.acme.users"))
                    .add(ADDRESS.withOriginModule("com.acme.common"));

            Map<String, String> units = generator.generateModules();
            assertThat(units).containsOnlyKeys("acme/common.ts", "acme/users.ts");
            assertThat(units.keySet()).containsExactly("acme/common.ts", "acme/users.ts");

            assertThat(units.get("acme/common.ts")).isEqualTo(
                    "// Generated by tsdef4j\n"
                            + "// Do not edit manually\n"
                            + "// Module: com.acme.common\n"
                            + "\n"
                            + "export type Address = { city: string };\n");
            assertThat(units.get("acme/users.ts")).isEqualTo(
                    "// Generated by tsdef4j\n"
                            + "// Do not edit manually\n"
                            + "// Module: com.acme.users\n"
                            + "\n"
                            + "import type { Address } from \"./common\";\n"
                            + "\n"
                            + "export type User = { id: string; address: Address };\n");
        }

        @Test
        @DisplayName("Modules sharing a path are merged into one unit")
        void collidingModules() {
            TypeScriptGenerator generator = new TypeScriptGenerator(GeneratorConfig.defaults())
                    .add(TypeDef.named("Invoice", TypeDef.object()).withOriginModule("com.acme.models"))
                    .add(TypeDef.named("Receipt", TypeDef.object()).withOriginModule("org.acme.models"))
                    .add(TypeDef.named("Settings", TypeDef.object()).withOriginModule("app.types"))
                    .add(TypeDef.named("Health", TypeDef.object()));

            Map<String, String> units = generator.generateModules();
            assertThat(units.keySet()).containsExactly("acme/models.ts", "types.ts");

            assertThat(units.get("acme/models.ts"))
                    .contains("// Module: com.acme.models, org.acme.models\n")
                    .contains("export type Invoice = {};\n\nexport type Receipt = {};\n");
            assertThat(units.get("types.ts"))
                    .contains("export type Settings = {};")
                    .contains("export type Health = {};");
        }

        @Test
        @DisplayName("No import between modules merged into the same unit")
        void mergedUnitImports() {
            TypeDef.Named line = TypeDef.named("Line", TypeDef.object()).withOriginModule("org.acme.models");
            TypeDef.Named order = TypeDef.named("Order", TypeDef.object(Field.of("line", line)))
                    .withOriginModule("com.acme.models");

            String unit = new TypeScriptGenerator(GeneratorConfig.defaults()).add(order)
                    .generateModules().get("acme/models.ts");
            assertThat(unit)
                    .doesNotContain("import")
                    .contains("export type Line = {};\n\nexport type Order = { line: Line };\n");
        }

        @Test
        @DisplayName("ESM imports carry a .js extension")
        void esmExtensions() {
            TypeScriptGenerator generator = new TypeScriptGenerator(GeneratorConfig.builder()
                    .esmExtensions(true)
                    .build())
                    .add(USER.withOriginModule("com.acme.users"))
                    .add(ADDRESS.withOriginModule("com.acme.common"));

            assertThat(generator.generateModules().get("acme/users.ts"))
                    .contains("import type { Address } from \"./common.js\";\n");
        }

        @Test
        @DisplayName("Module unit for a subset of names")
        void generateForModule() {
            TypeScriptGenerator generator = generator(GeneratorConfig.builder().exportStyle(ExportStyle.NONE));
            String output = generator.generateForModule("default", List.of("User"));
            assertThat(output).contains("type User").doesNotContain("type Address").doesNotContain("import");
        }
    }
}
