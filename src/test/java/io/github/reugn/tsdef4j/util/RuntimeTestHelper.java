package io.github.reugn.tsdef4j.util;

import com.google.testing.compile.Compilation;
import io.github.reugn.tsdef4j.registry.TypeDefinitionProvider;

import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads the classes and resources a processor run generated, so tests can call the
 * generated {@code TsDefinitions} providers.
 *
 * <p>Usage:
 * <pre>{@code
 * RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
 * TypeDefinitionProvider provider = helper.provider("example.TsDefinitions");
 * List<TypeDef> types = provider.typeDefinitions();
 * }</pre>
 */
public final class RuntimeTestHelper {

    private final Compilation compilation;
    private final Map<String, JavaFileObject> classFiles = new HashMap<>();
    private final GeneratedClassLoader classLoader = new GeneratedClassLoader();

    private RuntimeTestHelper(Compilation compilation) {
        this.compilation = compilation;
        for (JavaFileObject file : compilation.generatedFiles()) {
            if (file.getKind() == JavaFileObject.Kind.CLASS) {
                classFiles.put(binaryName(file), file);
            }
        }
    }

    /**
     * Compiles the sources with the TypeScriptProcessor.
     *
     * @throws AssertionError if compilation fails
     */
    public static RuntimeTestHelper compile(JavaFileObject... sources) {
        Compilation compilation = CompileHelper.compile(sources);
        if (compilation.status() != Compilation.Status.SUCCESS) {
            throw new AssertionError("Compilation failed: " + compilation.diagnostics());
        }
        return new RuntimeTestHelper(compilation);
    }

    /**
     * Instantiates a generated provider through its public no-arg constructor.
     *
     * @param className fully qualified class name, e.g. {@code example.TsDefinitions}
     */
    public TypeDefinitionProvider provider(String className) {
        try {
            return (TypeDefinitionProvider) loadClass(className).getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to instantiate " + className, e);
        }
    }

    /**
     * Calls a public static no-arg method, such as the generated {@code register()}.
     */
    public void invokeStatic(String className, String methodName) {
        try {
            loadClass(className).getMethod(methodName).invoke(null);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to invoke " + className + "." + methodName + "()", e);
        }
    }

    public Class<?> loadClass(String className) {
        try {
            return Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Not generated: " + className, e);
        }
    }

    /**
     * Reads a resource written to the class output, such as the provider service file.
     *
     * @param path the path relative to the class output root
     */
    public String classOutputResource(String path) {
        JavaFileObject file = compilation.generatedFile(StandardLocation.CLASS_OUTPUT, path)
                .orElseThrow(() -> new AssertionError("Not generated: " + path));
        try {
            return file.getCharContent(true).toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Compilation getCompilation() {
        return compilation;
    }

    /**
     * Maps {@code /CLASS_OUTPUT/a/b/C.class} to {@code a.b.C}.
     */
    private static String binaryName(JavaFileObject file) {
        String path = file.toUri().getPath();
        String prefix = "/" + StandardLocation.CLASS_OUTPUT.getName() + "/";
        int start = path.indexOf(prefix);
        String relative = start >= 0 ? path.substring(start + prefix.length()) : path.substring(1);
        return relative.substring(0, relative.length() - ".class".length()).replace('/', '.');
    }

    /**
     * Defines generated classes; everything else, including the tsdef4j runtime types,
     * comes from the test class path.
     */
    private final class GeneratedClassLoader extends ClassLoader {

        GeneratedClassLoader() {
            super(RuntimeTestHelper.class.getClassLoader());
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            JavaFileObject file = classFiles.get(name);
            if (file == null) {
                throw new ClassNotFoundException(name);
            }
            try (InputStream in = file.openInputStream()) {
                byte[] bytes = in.readAllBytes();
                return defineClass(name, bytes, 0, bytes.length);
            } catch (IOException e) {
                throw new ClassNotFoundException(name, e);
            }
        }
    }
}
