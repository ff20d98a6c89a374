package io.github.reugn.tsdef4j.registry;

import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.ir.TypeDefVisitor;
import io.github.reugn.tsdef4j.render.ExportStyle;
import io.github.reugn.tsdef4j.render.TypeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects named types, deduplicates them and orders them for emission.
 *
 * <p><b>Registration:</b> {@link #add(TypeDef)} walks the whole tree and registers every
 * {@link TypeDef.Named} it reaches, keyed by its qualified name. A name that is already
 * registered is left untouched, so adding the same type twice is a no-op.
 *
 * <p><b>Ordering:</b> {@link #sortedNames()} orders declarations so that every type appears
 * after the registered types it references. Ties are broken by registration order. Types on
 * a reference cycle cannot be ordered; they are appended in registration order instead of
 * failing. References to names that were never registered are kept as bare identifiers and
 * take no part in the ordering.
 *
 * <p><b>Thread safety:</b> a registry has a single writer. Populate it, then render it; it
 * performs no locking.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * TypeRegistry registry = new TypeRegistry();
 * registry.add(TypeDef.named("User", TypeDef.object(
 *         Field.of("address", TypeDef.ref("Address")))));
 * registry.add(TypeDef.named("Address", TypeDef.object(
 *         Field.of("city", TypeDef.string()))));
 *
 * registry.sortedNames();  // [Address, User]
 * }</pre>
 */
public final class TypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    /** Module bucket for types without an origin module. */
    public static final String DEFAULT_MODULE = "default";

    private final Map<String, TypeDef.Named> types = new LinkedHashMap<>();

    /**
     * Registers every named type reachable from {@code type}.
     *
     * @param type the root type; non-named roots are walked but not registered themselves
     * @return this registry
     */
    public TypeRegistry add(TypeDef type) {
        type.accept(new Registrar());
        return this;
    }

    /**
     * Registers every named type reachable from each of {@code roots}, in iteration order.
     *
     * @return this registry
     */
    public TypeRegistry addAll(Collection<? extends TypeDef> roots) {
        for (TypeDef root : roots) {
            add(root);
        }
        return this;
    }

    public Optional<TypeDef.Named> get(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public boolean contains(String name) {
        return types.containsKey(name);
    }

    public int size() {
        return types.size();
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    /**
     * Returns the registered names in registration order.
     */
    public List<String> typeNames() {
        return List.copyOf(types.keySet());
    }

    /**
     * Returns every name the given type references, registered or not.
     *
     * @param name a registered type name
     * @return the referenced names in first-seen order; empty if {@code name} is unknown
     */
    public Set<String> dependencies(String name) {
        TypeDef.Named declaration = types.get(name);
        if (declaration == null) {
            return Set.of();
        }
        return DependencyCollector.collect(declaration);
    }

    /**
     * Returns the registered names in dependency order.
     *
     * <p>Kahn's algorithm: types without registered dependencies seed a FIFO queue in
     * registration order; emitting a type releases its dependents, again in registration
     * order. Names left over by a cycle are appended in registration order.
     */
    public List<String> sortedNames() {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String name : types.keySet()) {
            dependents.put(name, new ArrayList<>());
        }
        for (String name : types.keySet()) {
            int degree = 0;
            for (String dependency : dependencies(name)) {
                if (types.containsKey(dependency)) {
                    dependents.get(dependency).add(name);
                    degree++;
                }
            }
            inDegree.put(name, degree);
        }

        Deque<String> queue = new ArrayDeque<>();
        for (String name : types.keySet()) {
            if (inDegree.get(name) == 0) {
                queue.add(name);
            }
        }

        List<String> sorted = new ArrayList<>(types.size());
        Set<String> emitted = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String name = queue.poll();
            sorted.add(name);
            emitted.add(name);
            for (String dependent : dependents.get(name)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (sorted.size() < types.size()) {
            List<String> cyclic = new ArrayList<>();
            for (String name : types.keySet()) {
                if (!emitted.contains(name)) {
                    cyclic.add(name);
                }
            }
            log.debug("Reference cycle among {}; appending in registration order", cyclic);
            sorted.addAll(cyclic);
        }
        return sorted;
    }

    /**
     * Returns referenced names that are not registered, in dependency order of the
     * referencing types. Generic parameters are not references.
     */
    public Set<String> danglingReferences() {
        Set<String> dangling = new LinkedHashSet<>();
        for (String name : sortedNames()) {
            for (String dependency : dependencies(name)) {
                if (!types.containsKey(dependency)) {
                    dangling.add(dependency);
                }
            }
        }
        return dangling;
    }

    /**
     * Groups the registered names by origin module.
     *
     * @return module name to names in dependency order; modules appear in the order their
     * first type is emitted, types without a module fall into {@value #DEFAULT_MODULE}
     */
    public Map<String, List<String>> typesByModule() {
        Map<String, List<String>> modules = new LinkedHashMap<>();
        for (String name : sortedNames()) {
            String module = types.get(name).originModule();
            String key = module == null || module.isEmpty() ? DEFAULT_MODULE : module;
            modules.computeIfAbsent(key, k -> new ArrayList<>()).add(name);
        }
        return modules;
    }

    /**
     * Renders every registered declaration in dependency order.
     *
     * @param style the export style
     * @return the declarations separated by blank lines, plus the aggregate export statement
     * for {@link ExportStyle#GROUPED}
     */
    public String renderAll(ExportStyle style) {
        return renderDeclarations(sortedNames(), style, false);
    }

    /**
     * Renders the declarations of the given names, in the given order.
     *
     * @param names   registered names; unknown names are ignored
     * @param style   the export style
     * @param declare {@code true} to prefix non-exported declarations with {@code declare}
     * @return the declarations separated by blank lines, ending with a newline
     */
    public String renderDeclarations(List<String> names, ExportStyle style, boolean declare) {
        StringBuilder sb = new StringBuilder();
        Set<String> exported = new LinkedHashSet<>();
        for (String name : names) {
            TypeDef.Named declaration = types.get(name);
            if (declaration == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(TypeRenderer.renderDeclaration(declaration, style == ExportStyle.NAMED, declare));
            exported.add(declaration.namespace().isEmpty() ? declaration.name() : declaration.namespace().get(0));
        }
        if (sb.length() == 0) {
            return "";
        }
        sb.append('\n');
        if (style == ExportStyle.GROUPED) {
            sb.append("\nexport { ").append(String.join(", ", exported)).append(" };\n");
        }
        return sb.toString();
    }

    // ==================== REGISTRATION ====================

    /**
     * Walks a tree and registers each named type the first time it is seen.
     */
    private final class Registrar implements TypeDefVisitor<Void> {

        private void all(List<TypeDef> list) {
            for (TypeDef type : list) {
                type.accept(this);
            }
        }

        private void fields(List<Field> fields) {
            for (Field field : fields) {
                field.type().accept(this);
            }
        }

        @Override
        public Void visitPrimitive(TypeDef.PrimitiveType type) {
            return null;
        }

        @Override
        public Void visitArray(TypeDef.ArrayType type) {
            return type.element().accept(this);
        }

        @Override
        public Void visitTuple(TypeDef.TupleType type) {
            all(type.elements());
            return null;
        }

        @Override
        public Void visitObject(TypeDef.ObjectType type) {
            fields(type.fields());
            return null;
        }

        @Override
        public Void visitUnion(TypeDef.UnionType type) {
            all(type.members());
            return null;
        }

        @Override
        public Void visitIntersection(TypeDef.IntersectionType type) {
            all(type.members());
            return null;
        }

        @Override
        public Void visitRecord(TypeDef.RecordType type) {
            type.key().accept(this);
            return type.value().accept(this);
        }

        @Override
        public Void visitNamed(TypeDef.Named type) {
            String name = type.qualifiedName();
            if (types.containsKey(name)) {
                return null;
            }
            types.put(name, type);
            log.debug("Registered type {}", name);
            return type.def().accept(this);
        }

        @Override
        public Void visitRef(TypeDef.Ref type) {
            return null;
        }

        @Override
        public Void visitLiteral(TypeDef.LiteralType type) {
            return null;
        }

        @Override
        public Void visitFunction(TypeDef.FunctionType type) {
            fields(type.params());
            return type.returns().accept(this);
        }

        @Override
        public Void visitGeneric(TypeDef.GenericType type) {
            all(type.args());
            return null;
        }

        @Override
        public Void visitTemplateLiteral(TypeDef.TemplateLiteralType type) {
            all(type.types());
            return null;
        }

        @Override
        public Void visitIndexedAccess(TypeDef.IndexedAccessType type) {
            return null;
        }
    }
}
