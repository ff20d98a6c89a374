package io.github.reugn.tsdef4j.processor;

import com.google.auto.service.AutoService;
import io.github.reugn.tsdef4j.annotation.TsField;
import io.github.reugn.tsdef4j.annotation.TsVariant;
import io.github.reugn.tsdef4j.annotation.TypeScript;
import io.github.reugn.tsdef4j.convert.ConversionException;
import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.registry.TypeDefinitionProvider;
import io.github.reugn.tsdef4j.registry.TypeRegistry;
import io.github.reugn.tsdef4j.render.GeneratorConfig;
import io.github.reugn.tsdef4j.render.TypeScriptGenerator;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import javax.tools.FileObject;
import javax.tools.StandardLocation;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Annotation processor for tsdef4j: generates TypeScript declarations for {@link TypeScript}
 * types.
 *
 * <p>This is the entry point for the tsdef4j annotation processor, registered via
 * {@link com.google.auto.service.AutoService} for automatic discovery by the Java compiler.
 *
 * <p><b>Supported Annotations:</b>
 * <table border="1">
 *   <caption>Annotations processed by this processor</caption>
 *   <tr><th>Annotation</th><th>Target</th><th>Purpose</th></tr>
 *   <tr>
 *     <td>{@link TypeScript}</td>
 *     <td>Record, Class, Enum, Sealed type</td>
 *     <td>Declares a TypeScript type</td>
 *   </tr>
 *   <tr>
 *     <td>{@link TsField}</td>
 *     <td>Record component, Field</td>
 *     <td>Customizes a property</td>
 *   </tr>
 *   <tr>
 *     <td>{@link TsVariant}</td>
 *     <td>Permitted subclass, Enum constant</td>
 *     <td>Customizes a variant</td>
 *   </tr>
 * </table>
 *
 * <p><b>Generated Output:</b>
 * <ul>
 *   <li>{@code types.ts} (or one file per module) in the generated sources directory, holding
 *       every converted type in dependency order</li>
 *   <li>a {@code TsDefinitions} class per package implementing {@link TypeDefinitionProvider},
 *       listed in {@code META-INF/services} so the same types can be assembled at runtime</li>
 * </ul>
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Describe</b> - {@link DescriptorReader} reads each annotated type</li>
 *   <li><b>Convert</b> - {@link MirrorTypeResolver} converts it, recursing into member types</li>
 *   <li><b>Register</b> - converted types are added to a {@link TypeRegistry}</li>
 *   <li><b>Generate</b> - provider classes per round; TypeScript output in the last round</li>
 * </ol>
 *
 * <p><b>Error Handling:</b>
 * A type that cannot be converted is reported as an error on its element; the remaining types
 * are still converted, so one compilation reports as many errors as possible.
 *
 * @see ProcessorOptions
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("io.github.reugn.tsdef4j.annotation.TypeScript")
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class TypeScriptProcessor extends AbstractProcessor {

    static final String SERVICE_FILE = "META-INF/services/" + TypeDefinitionProvider.class.getName();

    private Messager messager;
    private ErrorReporter errorReporter;
    private ProcessorOptions options;
    private MirrorTypeResolver resolver;
    private DefinitionsClassGenerator definitionsGenerator;

    private final TypeRegistry registry = new TypeRegistry();
    private final Set<String> providerClasses = new LinkedHashSet<>();
    private final Set<String> generatedPackages = new HashSet<>();

    /**
     * Creates a new TypeScriptProcessor instance.
     *
     * <p>This no-arg constructor is required for annotation processor discovery via
     * {@link java.util.ServiceLoader}. The processor is not usable until
     * {@link #init(ProcessingEnvironment)} is called by the compiler.
     */
    public TypeScriptProcessor() {
        // Required for ServiceLoader-based processor discovery
    }

    @Override
    public Set<String> getSupportedOptions() {
        return ProcessorOptions.NAMES;
    }

    /**
     * Initializes the processor with the processing environment.
     *
     * @param processingEnv the environment providing access to compiler facilities
     */
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.messager = processingEnv.getMessager();
        this.errorReporter = ErrorReporter.forMessager(messager);
        this.resolver = new MirrorTypeResolver(processingEnv.getTypeUtils(), processingEnv.getElementUtils(),
                new DescriptorReader(processingEnv.getElementUtils()));
        this.definitionsGenerator = new DefinitionsClassGenerator(processingEnv.getFiler());
        try {
            this.options = ProcessorOptions.parse(processingEnv.getOptions());
        } catch (IllegalArgumentException e) {
            errorReporter.error(null, "Invalid tsdef4j option: " + e.getMessage());
        }
    }

    /**
     * Converts the {@code @TypeScript} types of a round and, in the last round, writes the
     * TypeScript output.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (options == null) {
            return true;
        }

        Map<String, List<TypeDef>> byPackage = new LinkedHashMap<>();
        for (Element element : roundEnv.getElementsAnnotatedWith(TypeScript.class)) {
            if (!(element instanceof TypeElement type)) {
                continue;
            }
            try {
                TypeDef converted = resolver.declare(type);
                registry.add(converted);
                byPackage.computeIfAbsent(packageName(type), k -> new ArrayList<>()).add(converted);
            } catch (ConversionException e) {
                errorReporter.error(type, e);
            }
        }

        if (options.providers()) {
            generateProviders(byPackage);
        }

        if (roundEnv.processingOver()) {
            writeTypeScript();
            if (options.providers()) {
                writeServiceFile();
            }
        }
        return true;
    }

    // ==================== GENERATION ====================

    private void generateProviders(Map<String, List<TypeDef>> byPackage) {
        for (Map.Entry<String, List<TypeDef>> entry : byPackage.entrySet()) {
            String pkg = entry.getKey();
            if (!generatedPackages.add(pkg)) {
                messager.printMessage(Diagnostic.Kind.WARNING, "tsdef4j: " + DefinitionsClassGenerator.CLASS_NAME
                        + " for package '" + pkg + "' was generated in an earlier round; types from later"
                        + " rounds are only written to the TypeScript output");
                continue;
            }
            try {
                providerClasses.add(definitionsGenerator.generate(pkg, entry.getValue()));
            } catch (IOException e) {
                errorReporter.error(null, "Failed to generate " + DefinitionsClassGenerator.CLASS_NAME
                        + " for package '" + pkg + "': " + e.getMessage());
            }
        }
    }

    private void writeTypeScript() {
        if (registry.isEmpty()) {
            return;
        }
        GeneratorConfig config = options.toGeneratorConfig();
        TypeScriptGenerator generator = new TypeScriptGenerator(config, registry);

        Map<String, String> units;
        try {
            units = options.splitModules()
                    ? generator.generateModules()
                    : Map.of(config.outputFile(), generator.generate());
        } catch (IllegalStateException e) {
            errorReporter.error(null, "tsdef4j: " + e.getMessage());
            return;
        }

        for (Map.Entry<String, String> unit : units.entrySet()) {
            writeResource(StandardLocation.SOURCE_OUTPUT, unit.getKey(), unit.getValue());
        }
    }

    private void writeServiceFile() {
        if (providerClasses.isEmpty()) {
            return;
        }
        writeResource(StandardLocation.CLASS_OUTPUT, SERVICE_FILE, String.join("\n", providerClasses) + "\n");
    }

    private void writeResource(StandardLocation location, String path, String content) {
        try {
            FileObject file = processingEnv.getFiler().createResource(location, "", path);
            try (Writer writer = file.openWriter()) {
                writer.write(content);
            }
            messager.printMessage(Diagnostic.Kind.NOTE, "tsdef4j: wrote " + path);
        } catch (IOException e) {
            errorReporter.error(null, "Failed to write " + path + ": " + e.getMessage());
        }
    }

    private String packageName(TypeElement element) {
        PackageElement pkg = processingEnv.getElementUtils().getPackageOf(element);
        return pkg.isUnnamed() ? "" : pkg.getQualifiedName().toString();
    }
}
