package io.github.reugn.tsdef4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.registry.TypeDefinitionProvider;
import io.github.reugn.tsdef4j.registry.TypeRegistrations;

import javax.annotation.processing.Filer;
import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.util.List;

/**
 * Generates the {@code TsDefinitions} provider class of a package.
 *
 * <p><b>Generated Class Structure:</b>
 * <pre>
 * {@code @Generated("io.github.reugn.tsdef4j.processor.TypeScriptProcessor")
 * public final class TsDefinitions implements TypeDefinitionProvider {
 *     private static final TsDefinitions INSTANCE = new TsDefinitions();
 *
 *     public TsDefinitions() { }
 *
 *     // Adds this package's types to TypeRegistrations
 *     public static void register() { ... }
 *
 *     public List<TypeDef> typeDefinitions() {
 *         return List.of(new TypeDef.Named(...), ...);
 *     }
 * }}
 * </pre>
 *
 * <p>The public no-arg constructor lets {@link java.util.ServiceLoader} instantiate the class.
 */
final class DefinitionsClassGenerator {

    static final String CLASS_NAME = "TsDefinitions";

    private final Filer filer;

    DefinitionsClassGenerator(Filer filer) {
        this.filer = filer;
    }

    /**
     * Writes the provider class for a package.
     *
     * @param packageName the package, empty for the unnamed package
     * @param types       the converted root types, in declaration order
     * @return the qualified name of the generated class
     * @throws IOException if the source file cannot be written
     */
    String generate(String packageName, List<TypeDef> types) throws IOException {
        ClassName generatedType = ClassName.get(packageName, CLASS_NAME);
        ParameterizedTypeName typeDefList = ParameterizedTypeName.get(ClassName.get(List.class),
                ClassName.get(TypeDef.class));

        FieldSpec instance = FieldSpec.builder(generatedType, "INSTANCE",
                        Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                .initializer("new $T()", generatedType)
                .build();

        MethodSpec constructor = MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PUBLIC)
                .build();

        MethodSpec register = MethodSpec.methodBuilder("register")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addJavadoc("Adds the types of this package to {@link $T}.\n", TypeRegistrations.class)
                .addStatement("$T.register(INSTANCE)", TypeRegistrations.class)
                .build();

        CodeBlock.Builder body = CodeBlock.builder().add("return $T.of(", List.class);
        for (int i = 0; i < types.size(); i++) {
            body.add(i == 0 ? "\n$>$>$L" : ",\n$L", TypeDefCodeEmitter.emit(types.get(i)));
        }
        body.add(types.isEmpty() ? ");\n" : ");\n$<$<");

        MethodSpec typeDefinitions = MethodSpec.methodBuilder("typeDefinitions")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(typeDefList)
                .addCode(body.build())
                .build();

        TypeSpec generatedClass = TypeSpec.classBuilder(CLASS_NAME)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addSuperinterface(TypeDefinitionProvider.class)
                .addField(instance)
                .addMethod(constructor)
                .addMethod(register)
                .addMethod(typeDefinitions)
                .addAnnotation(AnnotationSpec.builder(ClassName.get("javax.annotation.processing", "Generated"))
                        .addMember("value", "$S", TypeScriptProcessor.class.getCanonicalName())
                        .build())
                .addJavadoc("TypeScript type definitions declared in this package.\n")
                .addJavadoc("<p>Generated by tsdef4j annotation processor.\n")
                .build();

        JavaFile.builder(packageName, generatedClass)
                .addFileComment("Generated by tsdef4j annotation processor. Do not modify.")
                .build()
                .writeTo(filer);
        return generatedType.canonicalName();
    }
}
