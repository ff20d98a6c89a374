package io.github.reugn.tsdef4j.render;

import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.registry.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles complete TypeScript output units from a {@link TypeRegistry}.
 *
 * <p>An output unit consists of:
 * <ol>
 *   <li>a header comment: the custom header with every line prefixed by {@code //}, or a
 *       default banner</li>
 *   <li>import statements for types declared in other units (module mode only)</li>
 *   <li>utility types, when enabled</li>
 *   <li>the declarations in dependency order</li>
 *   <li>an aggregate {@code export { ... };} statement for {@link ExportStyle#GROUPED}</li>
 * </ol>
 *
 * <p>In module mode ({@link #generateModules()}) types are partitioned by origin module. A
 * module such as {@code com.acme.models} maps to {@code acme/models.ts}: the first segment is
 * dropped and the rest become directories. Types without a module go to the configured output
 * file.
 *
 * <p>With {@link GeneratorConfig#strict()} enabled, every {@code generate} method fails when a
 * declaration references a name that is not registered.
 */
public final class TypeScriptGenerator {

    private static final Logger log = LoggerFactory.getLogger(TypeScriptGenerator.class);

    private static final String BANNER = "// Generated by tsdef4j\n// Do not edit manually\n";

    private final GeneratorConfig config;
    private final TypeRegistry registry;

    public TypeScriptGenerator(GeneratorConfig config) {
        this(config, new TypeRegistry());
    }

    public TypeScriptGenerator(GeneratorConfig config, TypeRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public GeneratorConfig config() {
        return config;
    }

    public TypeRegistry registry() {
        return registry;
    }

    /**
     * Registers a type and every named type it reaches.
     *
     * @return this generator
     */
    public TypeScriptGenerator add(TypeDef type) {
        registry.add(type);
        return this;
    }

    public TypeScriptGenerator addAll(Collection<? extends TypeDef> types) {
        registry.addAll(types);
        return this;
    }

    // ==================== SINGLE UNIT ====================

    /**
     * Generates a single output unit holding every registered type.
     *
     * @throws IllegalStateException in strict mode, if a reference is dangling
     */
    public String generate() {
        checkReferences();
        StringBuilder sb = new StringBuilder(header(null));
        appendBody(sb, registry.sortedNames());
        return sb.toString();
    }

    // ==================== MODULE UNITS ====================

    /**
     * Groups registered names by origin module; see {@link TypeRegistry#typesByModule()}.
     */
    public Map<String, List<String>> typesByModule() {
        return registry.typesByModule();
    }

    /**
     * Maps a module to the relative path of its output unit.
     *
     * <p>The module is split on {@code ::} if present, on {@code .} otherwise; the first segment
     * is dropped when there are several. The default module maps to
     * {@link GeneratorConfig#outputFile()}.
     *
     * @param module the module name
     * @return e.g. {@code models/user.ts} for {@code app.models.user}
     */
    public String modulePath(String module) {
        if (TypeRegistry.DEFAULT_MODULE.equals(module)) {
            return config.outputFile();
        }
        String[] parts = module.contains("::") ? module.split("::") : module.split("\\.");
        List<String> segments = Arrays.asList(parts);
        if (segments.size() > 1) {
            segments = segments.subList(1, segments.size());
        }
        return config.withExtension(String.join("/", segments));
    }

    /**
     * Generates the output unit of one module.
     *
     * @param module the module name, used in the banner and for import paths
     * @param names  the names belonging to the unit; emitted in dependency order
     * @throws IllegalStateException in strict mode, if a reference is dangling
     */
    public String generateForModule(String module, List<String> names) {
        checkReferences();
        return renderUnit(modulePath(module), List.of(module), names, pathIndex());
    }

    /**
     * Generates one output unit per module path.
     *
     * <p>Modules that map to the same path, such as {@code com.acme.models} and
     * {@code org.acme.models}, share one unit holding the types of all of them.
     *
     * @return relative path to unit content, in module emission order
     * @throws IllegalStateException in strict mode, if a reference is dangling
     */
    public Map<String, String> generateModules() {
        checkReferences();
        Map<String, List<String>> modulesByPath = new LinkedHashMap<>();
        Map<String, List<String>> namesByPath = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : typesByModule().entrySet()) {
            String path = modulePath(entry.getKey());
            modulesByPath.computeIfAbsent(path, k -> new ArrayList<>()).add(entry.getKey());
            namesByPath.computeIfAbsent(path, k -> new ArrayList<>()).addAll(entry.getValue());
        }

        Map<String, String> pathOf = pathIndex();
        Map<String, String> units = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : namesByPath.entrySet()) {
            String path = entry.getKey();
            List<String> modules = modulesByPath.get(path);
            if (modules.size() > 1) {
                log.debug("Modules {} share unit {}", modules, path);
            }
            units.put(path, renderUnit(path, modules, entry.getValue(), pathOf));
            log.debug("Generated unit {} with {} type(s)", path, entry.getValue().size());
        }
        return units;
    }

    private String renderUnit(String path, List<String> modules, List<String> names, Map<String, String> pathOf) {
        StringBuilder sb = new StringBuilder(header(String.join(", ", modules)));
        Set<String> members = new HashSet<>(names);
        List<String> ordered = new ArrayList<>();
        for (String name : registry.sortedNames()) {
            if (members.contains(name)) {
                ordered.add(name);
            }
        }
        String imports = imports(path, ordered, pathOf);
        if (!imports.isEmpty()) {
            sb.append(imports).append('\n');
        }
        appendBody(sb, ordered);
        return sb.toString();
    }

    /**
     * Renders {@code import type} statements for registered types declared in other units.
     * Nothing is imported when declarations are not exported.
     */
    private String imports(String path, List<String> names, Map<String, String> pathOf) {
        if (config.exportStyle() == ExportStyle.NONE) {
            return "";
        }
        Map<String, Set<String>> byPath = new LinkedHashMap<>();
        for (String name : names) {
            for (String dependency : registry.dependencies(name)) {
                String target = pathOf.get(dependency);
                if (target != null && !target.equals(path)) {
                    byPath.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(importedName(dependency));
                }
            }
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Set<String>> entry : byPath.entrySet()) {
            sb.append("import type { ").append(String.join(", ", entry.getValue())).append(" } from \"")
                    .append(importSpecifier(path, entry.getKey())).append("\";\n");
        }
        return sb.toString();
    }

    private String importedName(String name) {
        return registry.get(name)
                .map(named -> named.namespace().isEmpty() ? named.name() : named.namespace().get(0))
                .orElse(name);
    }

    private String importSpecifier(String from, String target) {
        String specifier = relativeImport(from, target);
        return config.esmExtensions() ? specifier + ".js" : specifier;
    }

    /**
     * Computes the import specifier of {@code target} relative to {@code from}, without extension.
     */
    static String relativeImport(String from, String target) {
        Path fromDir = Paths.get(from).getParent();
        Path targetPath = Paths.get(GeneratorConfig.stripExtension(target));
        String relative = (fromDir == null ? targetPath : fromDir.relativize(targetPath))
                .toString().replace('\\', '/');
        return relative.startsWith(".") ? relative : "./" + relative;
    }

    /**
     * Maps every registered name to the path of the unit it is emitted in.
     */
    private Map<String, String> pathIndex() {
        Map<String, String> pathOf = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : typesByModule().entrySet()) {
            String path = modulePath(entry.getKey());
            for (String name : entry.getValue()) {
                pathOf.put(name, path);
            }
        }
        return pathOf;
    }

    // ==================== SHARED ====================

    private String header(String module) {
        if (config.header() != null) {
            StringBuilder sb = new StringBuilder();
            for (String line : config.header().split("\n", -1)) {
                sb.append("// ").append(line).append('\n');
            }
            return sb.append('\n').toString();
        }
        if (module == null) {
            return BANNER + "\n";
        }
        return BANNER + "// Module: " + module + "\n\n";
    }

    private void appendBody(StringBuilder sb, List<String> names) {
        ExportStyle style = config.exportStyle();
        if (config.includeUtilities()) {
            sb.append(UtilityTypes.render(style != ExportStyle.NONE, config.declarationOnly())).append("\n\n");
        }
        sb.append(registry.renderDeclarations(names, style, config.declarationOnly()));
    }

    private void checkReferences() {
        if (!config.strict()) {
            return;
        }
        Set<String> dangling = new LinkedHashSet<>(registry.danglingReferences());
        if (config.includeUtilities()) {
            dangling.remove(UtilityTypes.PRETTIFY);
        }
        if (!dangling.isEmpty()) {
            throw new IllegalStateException("Unresolved type references: " + String.join(", ", dangling));
        }
    }
}
