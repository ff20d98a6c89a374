package io.github.reugn.tsdef4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.tsdef4j.util.CompileHelper.compile;
import static io.github.reugn.tsdef4j.util.CompileHelper.generatedTypeScript;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Enums and sealed hierarchies annotated with {@code @TypeScript}.
 */
@DisplayName("Variant Conversion")
class VariantConversionTest {

    @Nested
    @DisplayName("Enums")
    class Enums {

        @Test
        @DisplayName("Constants become a string literal union")
        void constants() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Status",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TsVariant;
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public enum Status {
                                ACTIVE,
                                @TsVariant(rename = "off") INACTIVE,
                                @TsVariant(skip = true) LEGACY
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Status = \"ACTIVE\" | \"off\";");
        }

        @Test
        @DisplayName("renameAll applies to constant names")
        void renameAll() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Tier",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript(renameAll = "kebab-case")
                            public enum Tier { FREE_TRIAL, PRO }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Tier = \"free-trial\" | \"pro\";");
        }
    }

    @Nested
    @DisplayName("Sealed Types")
    class SealedTypes {

        private static final String MESSAGE = """
                package com.acme.chat;
                
                import io.github.reugn.tsdef4j.annotation.TsVariant;
                import io.github.reugn.tsdef4j.annotation.TypeScript;
                
                @TypeScript%s
                public sealed interface Message {
                    record Ping() implements Message {}
                
                    @TsVariant(tuple = true)
                    record Text(String value) implements Message {}
                
                    record Error(int code, String message) implements Message {}
                }
                """;

        private Compilation compileMessage(String attributes) {
            return compile(JavaFileObjects.forSourceString("com.acme.chat.Message", MESSAGE.formatted(attributes)));
        }

        @Test
        @DisplayName("Internally tagged by default")
        void internal() {
            Compilation compilation = compileMessage("");
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Message = { type: \"Ping\" }"
                    + " | { type: \"Text\"; value: string }"
                    + " | { type: \"Error\"; code: number; message: string };");
        }

        @Test
        @DisplayName("Adjacently tagged with a content field")
        void adjacent() {
            Compilation compilation = compileMessage("(tag = \"kind\", content = \"data\")");
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Message = { kind: \"Ping\" }"
                    + " | { kind: \"Text\"; data: string }"
                    + " | { kind: \"Error\"; data: { code: number; message: string } };");
        }

        @Test
        @DisplayName("Untagged variants are their payloads")
        void untagged() {
            Compilation compilation = compileMessage("(untagged = true)");
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation))
                    .contains("export type Message = \"Ping\" | string | { code: number; message: string };");
        }

        @Test
        @DisplayName("Sealed abstract class with field-carrying subclasses")
        void sealedClass() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.geo.Shape",
                    """
                            package com.acme.geo;
                            
                            import io.github.reugn.tsdef4j.annotation.TsVariant;
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript(tag = "shape", renameAll = "snake_case")
                            public abstract sealed class Shape permits Shape.Circle, Shape.Rect, Shape.Nothing {
                            
                                public static final class Circle extends Shape {
                                    double radius;
                                }
                            
                                @TsVariant(renameAll = "camelCase")
                                public static final class Rect extends Shape {
                                    double side_a;
                                    double side_b;
                                }
                            
                                public static final class Nothing extends Shape {
                                }
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Shape = { shape: \"circle\"; radius: number }"
                    + " | { shape: \"rect\"; sideA: number; sideB: number }"
                    + " | { shape: \"nothing\" };");
        }

        @Test
        @DisplayName("Unit-only sealed hierarchy collapses to literals")
        void unitOnly() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.models.Answer",
                    """
                            package com.acme.models;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public sealed interface Answer {
                                record Yes() implements Answer {}
                                record No() implements Answer {}
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(generatedTypeScript(compilation)).contains("export type Answer = \"Yes\" | \"No\";");
        }

        @Test
        @DisplayName("Variant payloads reference other declarations")
        void payloadReferences() {
            JavaFileObject source = JavaFileObjects.forSourceString("com.acme.events.Event",
                    """
                            package com.acme.events;
                            
                            import io.github.reugn.tsdef4j.annotation.TypeScript;
                            
                            @TypeScript
                            public sealed interface Event {
                                record Created(Item item) implements Event {}
                                record Deleted(String id) implements Event {}
                            
                                @TypeScript
                                record Item(String id, String name) {}
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            String output = generatedTypeScript(compilation);
            assertThat(output).contains("export type Event = { type: \"Created\"; item: Item }"
                    + " | { type: \"Deleted\"; id: string };");
            assertThat(output.indexOf("export type Item")).isLessThan(output.indexOf("export type Event"));
        }
    }
}
