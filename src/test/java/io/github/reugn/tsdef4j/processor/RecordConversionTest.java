package io.github.reugn.tsdef4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.tsdef4j.util.CompileHelper.compile;
import static io.github.reugn.tsdef4j.util.CompileHelper.generatedTypeScript;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Records and classes annotated with {@code @TypeScript}.
 */
@DisplayName("Record Conversion")
class RecordConversionTest {

    private static final String BANNER = "// Generated by tsdef4j\n// Do not edit manually\n\n";

    @Nested
    @DisplayName("Type Mapping")
    class TypeMapping {

        @Test
        @DisplayName("Java types map to TypeScript types")
        void javaTypes() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Everything",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            import java.math.BigInteger;
                            import java.time.Instant;
                            import java.util.List;
                            import java.util.Map;
                            import java.util.Optional;
                            import java.util.OptionalInt;
                            import java.util.Set;
                            import java.util.UUID;
                            
                            @TypeScript
                            public record Everything(
                                    int count, long total, double ratio, boolean active, char initial,
                                    String name, UUID id, Instant createdAt, BigInteger big,
                                    Optional<String> nickname, OptionalInt rank,
                                    List<String> tags, Set<Integer> scores, String[] aliases,
                                    Map<String, Long> counters, Object payload) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).isEqualTo(BANNER
                    + "export type Everything = { count: number; total: number; ratio: number; active: boolean;"
                    + " initial: string; name: string; id: string; createdAt: string; big: bigint;"
                    + " nickname: string | null; rank: number | null; tags: string[]; scores: number[];"
                    + " aliases: string[]; counters: Record<string, number>; payload: unknown };\n");
        }

        @Test
        @DisplayName("Referenced types are declared first")
        void nestedReferences() {
            JavaFileObject user = JavaFileObjects.forSourceString("com.acme.models.User",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            import java.util.List;
                            
                            @TypeScript
                            public record User(String id, Address address, List<Address> previous) {}
                            """);
            JavaFileObject address = JavaFileObjects.forSourceString("com.acme.models.Address",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public record Address(String city) {}
                            """);

            Compilation compilation = compile(user, address);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).isEqualTo(BANNER
                    + "export type Address = { city: string };\n"
                    + "\n"
                    + "export type User = { id: string; address: Address; previous: Address[] };\n");
        }

        @Test
        @DisplayName("Recursive type references itself")
        void recursive() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.TreeNode",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            import java.util.List;
                            
                            @TypeScript
                            public record TreeNode(String label, List<TreeNode> children) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation))
                    .contains("export type TreeNode = { label: string; children: TreeNode[] };");
        }

        @Test
        @DisplayName("Generic records keep parameters; uses pass arguments")
        void generics() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Page",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            import java.util.List;
                            
                            @TypeScript
                            public record Page<T>(List<T> items, int total) {
                            
                                @TypeScript
                                public record Item(String sku) {}
                            
                                @TypeScript
                                public record ItemPage(Page<Item> page) {}
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation))
                    .contains("export type Page<T> = { items: T[]; total: number };")
                    .contains("export type ItemPage = { page: Page<Item> };");
        }

        @Test
        @DisplayName("Unknown Java types become references to their simple name")
        void unknownTypes() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Upload",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            import java.io.File;
                            
                            @TypeScript
                            public record Upload(File file) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Upload = { file: File };");
        }
    }

    @Nested
    @DisplayName("Field Attributes")
    class FieldAttributes {

        @Test
        @DisplayName("Rename, skip, optional, readonly, type override and pattern")
        void modifiers() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Account",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TsField;
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            import java.util.Optional;
                            
                            @TypeScript(renameAll = "camelCase")
                            public record Account(
                                    @TsField(rename = "accountId") String account_ref,
                                    String display_name,
                                    @TsField(skip = true) String password,
                                    @TsField(optional = true) Optional<String> email,
                                    @TsField(defaulted = true) int retries,
                                    @TsField(readonly = true) long created_at,
                                    @TsField(type = "Date") String updated_at,
                                    @TsField(pattern = "acct-${string}") String slug) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Account = { accountId: string;"
                    + " displayName: string; email?: string; retries?: number; readonly createdAt: number;"
                    + " updatedAt: Date; slug: `acct-${string}` };");
        }

        @Test
        @DisplayName("Flatten and inline reuse another declaration's fields")
        void flattenAndInline() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Doc",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TsField;
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public record Doc(
                                    String id,
                                    @TsField(flatten = true) Audit audit,
                                    @TsField(inline = true) Audit copy) {
                            
                                @TypeScript
                                public record Audit(String by, long at) {}
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Doc = { id: string; by: string;"
                    + " at: number; copy: { by: string; at: number } };");
        }

        @Test
        @DisplayName("Index and key give an indexed access type")
        void indexedAccess() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Post",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TsField;
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public record Post(@TsField(index = "User", key = "id") String authorId) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Post = { authorId: User[\"id\"] };");
        }
    }

    @Nested
    @DisplayName("Container Attributes")
    class ContainerAttributes {

        @Test
        @DisplayName("Classes use their instance fields")
        void classFields() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Settings",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public class Settings {
                                static final int VERSION = 1;
                                private String theme;
                                private int fontSize;
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation))
                    .contains("export type Settings = { theme: string; fontSize: number };");
        }

        @Test
        @DisplayName("Rename and namespace")
        void renameAndNamespace() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.TokenDto",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript(rename = "Token", namespace = "Api.V1")
                            public record TokenDto(String value) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation))
                    .contains("export namespace Api.V1 {\n    export type Token = { value: string };\n}");
        }

        @Test
        @DisplayName("Transparent wrappers are replaced by their member type")
        void transparent() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Contact",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public record Contact(Email email) {
                            
                                @TypeScript(transparent = true)
                                public record Email(String value) {}
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation))
                    .contains("export type Contact = { email: string };")
                    .doesNotContain("Email");
        }

        @Test
        @DisplayName("Extended types and wrapper")
        void extendsAndWrapper() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Admin",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript(extendsTypes = "BaseUser", wrapper = "Prettify")
                            public record Admin(int level) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation))
                    .contains("export type Admin = Prettify<BaseUser & { level: number }>;");
        }
    }

    @Nested
    @DisplayName("Generated Provider")
    class GeneratedProvider {

        @Test
        @DisplayName("One TsDefinitions class per package plus a service registration")
        void providerClass() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Address",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public record Address(String city) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(compilation).hadNoteContaining("tsdef4j: wrote types.ts");
            assertThat(compilation).generatedSourceFile("com.acme.models.TsDefinitions")
                    .contentsAsUtf8String()
                    .contains("public final class TsDefinitions implements TypeDefinitionProvider");
            assertThat(compilation).generatedFile(StandardLocation.CLASS_OUTPUT,
                            TypeScriptProcessor.SERVICE_FILE)
                    .contentsAsUtf8String()
                    .isEqualTo("com.acme.models.TsDefinitions\n");
        }
    }
}
