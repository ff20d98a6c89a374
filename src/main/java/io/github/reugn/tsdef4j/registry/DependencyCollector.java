package io.github.reugn.tsdef4j.registry;

import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.ir.TypeDefVisitor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the names a declaration depends on.
 *
 * <p>A dependency is any name reached through a {@code Ref}, the base of a {@code GenericType}
 * or {@code IndexedAccessType}, or an embedded {@code Named} node. The walk does not enter an
 * embedded {@code Named}'s body: that body belongs to its own declaration. The declaration's
 * own name and type parameters are excluded. Names are returned in first-seen order.
 */
final class DependencyCollector implements TypeDefVisitor<Void> {

    private final Set<String> names = new LinkedHashSet<>();

    private DependencyCollector() {
    }

    static Set<String> collect(TypeDef.Named declaration) {
        DependencyCollector collector = new DependencyCollector();
        declaration.def().accept(collector);
        collector.names.remove(declaration.qualifiedName());
        collector.names.removeAll(declaration.typeParams());
        return collector.names;
    }

    private void all(List<TypeDef> types) {
        for (TypeDef type : types) {
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
        names.add(type.qualifiedName());
        return null;
    }

    @Override
    public Void visitRef(TypeDef.Ref type) {
        names.add(type.name());
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
        names.add(type.base());
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
        names.add(type.base());
        return null;
    }
}
