package io.github.reugn.tsdef4j.ir;

/**
 * Visitor over the {@link TypeDef} variants, one method per variant.
 *
 * @param <R> the result type
 */
public interface TypeDefVisitor<R> {
    R visitPrimitive(TypeDef.PrimitiveType type);

    R visitArray(TypeDef.ArrayType type);

    R visitTuple(TypeDef.TupleType type);

    R visitObject(TypeDef.ObjectType type);

    R visitUnion(TypeDef.UnionType type);

    R visitIntersection(TypeDef.IntersectionType type);

    R visitRecord(TypeDef.RecordType type);

    R visitNamed(TypeDef.Named type);

    R visitRef(TypeDef.Ref type);

    R visitLiteral(TypeDef.LiteralType type);

    R visitFunction(TypeDef.FunctionType type);

    R visitGeneric(TypeDef.GenericType type);

    R visitTemplateLiteral(TypeDef.TemplateLiteralType type);

    R visitIndexedAccess(TypeDef.IndexedAccessType type);
}
