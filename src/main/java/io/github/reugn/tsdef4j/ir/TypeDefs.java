package io.github.reugn.tsdef4j.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural helpers over {@link TypeDef} trees.
 */
public final class TypeDefs {

    private TypeDefs() {
    }

    /**
     * Returns the body of a {@link TypeDef.Named}, or the type itself for any other variant.
     */
    public static TypeDef unwrapNamed(TypeDef type) {
        TypeDef current = type;
        while (current instanceof TypeDef.Named named) {
            current = named.def();
        }
        return current;
    }

    /**
     * Materializes a generic declaration with concrete type arguments.
     *
     * <p>Every {@code Ref} to one of the declaration's type parameters is replaced by the
     * corresponding argument. The result carries no type parameters.
     *
     * @param generic the generic declaration, e.g. {@code Container<T>}
     * @param args    the concrete arguments, one per type parameter
     * @return the instantiated declaration
     * @throws IllegalArgumentException if the argument count does not match
     */
    public static TypeDef.Named instantiate(TypeDef.Named generic, List<TypeDef> args) {
        List<String> params = generic.typeParams();
        if (params.size() != args.size()) {
            throw new IllegalArgumentException("Type '" + generic.qualifiedName() + "' expects "
                    + params.size() + " type argument(s), got " + args.size());
        }
        Map<String, TypeDef> bindings = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            bindings.put(params.get(i), args.get(i));
        }
        return generic.withDef(substitute(generic.def(), bindings)).withTypeParams(List.of());
    }

    /**
     * Replaces {@code Ref} nodes whose name is bound in {@code bindings}.
     *
     * <p>Substitution does not descend into nested {@link TypeDef.Named} bodies; those are
     * separate declarations with their own parameter scope.
     */
    public static TypeDef substitute(TypeDef type, Map<String, TypeDef> bindings) {
        if (bindings.isEmpty()) {
            return type;
        }
        return type.accept(new Substitution(bindings));
    }

    private static final class Substitution implements TypeDefVisitor<TypeDef> {
        private final Map<String, TypeDef> bindings;

        Substitution(Map<String, TypeDef> bindings) {
            this.bindings = bindings;
        }

        private List<TypeDef> all(List<TypeDef> types) {
            List<TypeDef> result = new ArrayList<>(types.size());
            for (TypeDef type : types) {
                result.add(type.accept(this));
            }
            return result;
        }

        private List<Field> fields(List<Field> fields) {
            List<Field> result = new ArrayList<>(fields.size());
            for (Field field : fields) {
                result.add(field.withType(field.type().accept(this)));
            }
            return result;
        }

        @Override
        public TypeDef visitPrimitive(TypeDef.PrimitiveType type) {
            return type;
        }

        @Override
        public TypeDef visitArray(TypeDef.ArrayType type) {
            return new TypeDef.ArrayType(type.element().accept(this));
        }

        @Override
        public TypeDef visitTuple(TypeDef.TupleType type) {
            return new TypeDef.TupleType(all(type.elements()));
        }

        @Override
        public TypeDef visitObject(TypeDef.ObjectType type) {
            return new TypeDef.ObjectType(fields(type.fields()));
        }

        @Override
        public TypeDef visitUnion(TypeDef.UnionType type) {
            return new TypeDef.UnionType(all(type.members()));
        }

        @Override
        public TypeDef visitIntersection(TypeDef.IntersectionType type) {
            return new TypeDef.IntersectionType(all(type.members()));
        }

        @Override
        public TypeDef visitRecord(TypeDef.RecordType type) {
            return new TypeDef.RecordType(type.key().accept(this), type.value().accept(this));
        }

        @Override
        public TypeDef visitNamed(TypeDef.Named type) {
            return type;
        }

        @Override
        public TypeDef visitRef(TypeDef.Ref type) {
            return bindings.getOrDefault(type.name(), type);
        }

        @Override
        public TypeDef visitLiteral(TypeDef.LiteralType type) {
            return type;
        }

        @Override
        public TypeDef visitFunction(TypeDef.FunctionType type) {
            return new TypeDef.FunctionType(fields(type.params()), type.returns().accept(this));
        }

        @Override
        public TypeDef visitGeneric(TypeDef.GenericType type) {
            return new TypeDef.GenericType(type.base(), all(type.args()));
        }

        @Override
        public TypeDef visitTemplateLiteral(TypeDef.TemplateLiteralType type) {
            return new TypeDef.TemplateLiteralType(type.strings(), all(type.types()));
        }

        @Override
        public TypeDef visitIndexedAccess(TypeDef.IndexedAccessType type) {
            return type;
        }
    }
}
