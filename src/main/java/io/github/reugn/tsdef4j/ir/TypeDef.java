package io.github.reugn.tsdef4j.ir;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The intermediate representation of a TypeScript type.
 *
 * <p>A {@code TypeDef} tree is built once (by the converter, the AST importer or generated
 * provider code) and is immutable afterwards. Every variant is a record; consumers dispatch
 * exhaustively through {@link TypeDefVisitor}.
 *
 * <p><b>Variants:</b>
 * <table border="1">
 *   <caption>IR variants and their TypeScript rendering</caption>
 *   <tr><th>Variant</th><th>Renders as</th></tr>
 *   <tr><td>{@link PrimitiveType}</td><td>{@code string}, {@code number}, ...</td></tr>
 *   <tr><td>{@link ArrayType}</td><td>{@code T[]}</td></tr>
 *   <tr><td>{@link TupleType}</td><td>{@code [A, B]}</td></tr>
 *   <tr><td>{@link ObjectType}</td><td>{@code { a: A; b?: B }}</td></tr>
 *   <tr><td>{@link UnionType}</td><td>{@code A | B}</td></tr>
 *   <tr><td>{@link IntersectionType}</td><td>{@code A & B}</td></tr>
 *   <tr><td>{@link RecordType}</td><td>{@code Record<K, V>}</td></tr>
 *   <tr><td>{@link Named}</td><td>its name inline, {@code type Name = ...;} when declared</td></tr>
 *   <tr><td>{@link Ref}</td><td>the referenced name</td></tr>
 *   <tr><td>{@link LiteralType}</td><td>{@code "a"}, {@code 42}, {@code true}</td></tr>
 *   <tr><td>{@link FunctionType}</td><td>{@code (a: A) => R}</td></tr>
 *   <tr><td>{@link GenericType}</td><td>{@code Base<A, B>}</td></tr>
 *   <tr><td>{@link TemplateLiteralType}</td><td>{@code `v${number}`}</td></tr>
 *   <tr><td>{@link IndexedAccessType}</td><td>{@code Base["key"]}</td></tr>
 * </table>
 *
 * @see TypeDefVisitor
 */
public sealed interface TypeDef permits TypeDef.PrimitiveType, TypeDef.ArrayType, TypeDef.TupleType,
        TypeDef.ObjectType, TypeDef.UnionType, TypeDef.IntersectionType, TypeDef.RecordType,
        TypeDef.Named, TypeDef.Ref, TypeDef.LiteralType, TypeDef.FunctionType, TypeDef.GenericType,
        TypeDef.TemplateLiteralType, TypeDef.IndexedAccessType {

    <R> R accept(TypeDefVisitor<R> visitor);

    // ==================== FACTORIES ====================

    static TypeDef primitive(Primitive kind) {
        return new PrimitiveType(kind);
    }

    static TypeDef string() {
        return new PrimitiveType(Primitive.STRING);
    }

    static TypeDef number() {
        return new PrimitiveType(Primitive.NUMBER);
    }

    static TypeDef bool() {
        return new PrimitiveType(Primitive.BOOLEAN);
    }

    static TypeDef nullType() {
        return new PrimitiveType(Primitive.NULL);
    }

    static TypeDef array(TypeDef element) {
        return new ArrayType(element);
    }

    static TypeDef tuple(TypeDef... elements) {
        return new TupleType(Arrays.asList(elements));
    }

    static TypeDef object(Field... fields) {
        return new ObjectType(Arrays.asList(fields));
    }

    static TypeDef union(TypeDef... members) {
        return new UnionType(Arrays.asList(members));
    }

    static TypeDef intersection(TypeDef... members) {
        return new IntersectionType(Arrays.asList(members));
    }

    static TypeDef record(TypeDef key, TypeDef value) {
        return new RecordType(key, value);
    }

    static TypeDef ref(String name) {
        return new Ref(name);
    }

    static TypeDef literal(String value) {
        return new LiteralType(Literal.of(value));
    }

    static TypeDef literal(double value) {
        return new LiteralType(Literal.of(value));
    }

    static TypeDef literal(boolean value) {
        return new LiteralType(Literal.of(value));
    }

    static TypeDef generic(String base, TypeDef... args) {
        return new GenericType(base, Arrays.asList(args));
    }

    static Named named(String name, TypeDef def) {
        return new Named(List.of(), name, List.of(), def, null, null);
    }

    // ==================== VARIANTS ====================

    record PrimitiveType(Primitive kind) implements TypeDef {
        public PrimitiveType {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitPrimitive(this);
        }
    }

    record ArrayType(TypeDef element) implements TypeDef {
        public ArrayType {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    record TupleType(List<TypeDef> elements) implements TypeDef {
        public TupleType {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    record ObjectType(List<Field> fields) implements TypeDef {
        public ObjectType {
            fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    record UnionType(List<TypeDef> members) implements TypeDef {
        public UnionType {
            members = List.copyOf(members);
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitUnion(this);
        }
    }

    record IntersectionType(List<TypeDef> members) implements TypeDef {
        public IntersectionType {
            members = List.copyOf(members);
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitIntersection(this);
        }
    }

    record RecordType(TypeDef key, TypeDef value) implements TypeDef {
        public RecordType {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitRecord(this);
        }
    }

    /**
     * A declared type. Registries deduplicate named types by {@link #qualifiedName()}.
     *
     * @param namespace    enclosing TypeScript namespace path, empty for top-level types
     * @param name         the declared type name
     * @param typeParams   generic parameter names; the body refers to them via {@link Ref}
     * @param def          the type body
     * @param originModule the source module the type was declared in, or {@code null}
     * @param wrapper      a generic utility type wrapping the body (e.g. {@code Prettify}), or {@code null}
     */
    record Named(List<String> namespace, String name, List<String> typeParams, TypeDef def,
                 String originModule, String wrapper) implements TypeDef {
        public Named {
            namespace = List.copyOf(namespace);
            typeParams = List.copyOf(typeParams);
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(def, "def");
        }

        /**
         * Returns the name including the namespace path, e.g. {@code Api.User}.
         */
        public String qualifiedName() {
            if (namespace.isEmpty()) {
                return name;
            }
            return String.join(".", namespace) + "." + name;
        }

        public boolean isGeneric() {
            return !typeParams.isEmpty();
        }

        public Named withDef(TypeDef newDef) {
            return new Named(namespace, name, typeParams, newDef, originModule, wrapper);
        }

        public Named withTypeParams(List<String> params) {
            return new Named(namespace, name, params, def, originModule, wrapper);
        }

        public Named withNamespace(List<String> path) {
            return new Named(path, name, typeParams, def, originModule, wrapper);
        }

        public Named withOriginModule(String module) {
            return new Named(namespace, name, typeParams, def, module, wrapper);
        }

        public Named withWrapper(String wrapperName) {
            return new Named(namespace, name, typeParams, def, originModule, wrapperName);
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitNamed(this);
        }
    }

    record Ref(String name) implements TypeDef {
        public Ref {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitRef(this);
        }
    }

    record LiteralType(Literal literal) implements TypeDef {
        public LiteralType {
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record FunctionType(List<Field> params, TypeDef returns) implements TypeDef {
        public FunctionType {
            params = List.copyOf(params);
            Objects.requireNonNull(returns, "returns");
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    record GenericType(String base, List<TypeDef> args) implements TypeDef {
        public GenericType {
            Objects.requireNonNull(base, "base");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitGeneric(this);
        }
    }

    /**
     * A template literal type; literal parts and placeholder types alternate, so there is
     * always exactly one more string than there are types.
     */
    record TemplateLiteralType(List<String> strings, List<TypeDef> types) implements TypeDef {
        public TemplateLiteralType {
            strings = List.copyOf(strings);
            types = List.copyOf(types);
            if (strings.size() != types.size() + 1) {
                throw new IllegalArgumentException("Template literal needs " + (types.size() + 1)
                        + " string parts for " + types.size() + " placeholders, got " + strings.size());
            }
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitTemplateLiteral(this);
        }
    }

    record IndexedAccessType(String base, String key) implements TypeDef {
        public IndexedAccessType {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(key, "key");
        }

        @Override
        public <R> R accept(TypeDefVisitor<R> visitor) {
            return visitor.visitIndexedAccess(this);
        }
    }
}
