package io.github.reugn.tsdef4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.Literal;
import io.github.reugn.tsdef4j.ir.Primitive;
import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.ir.TypeDefVisitor;

import java.util.List;
import java.util.function.Function;

/**
 * Emits Java expressions that rebuild a {@link TypeDef} tree at runtime.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * // Object([Field("id", string)]) is emitted as:
 * new TypeDef.ObjectType(List.of(new Field("id", TypeDef.primitive(Primitive.STRING), false, false)))
 * }</pre>
 */
final class TypeDefCodeEmitter implements TypeDefVisitor<CodeBlock> {

    private static final ClassName TYPE_DEF = ClassName.get(TypeDef.class);
    private static final ClassName FIELD = ClassName.get(Field.class);
    private static final ClassName PRIMITIVE = ClassName.get(Primitive.class);
    private static final ClassName LIST = ClassName.get(List.class);

    private static final TypeDefCodeEmitter INSTANCE = new TypeDefCodeEmitter();

    private TypeDefCodeEmitter() {
    }

    /**
     * Returns an expression of type {@code TypeDef} equal to {@code type}.
     */
    static CodeBlock emit(TypeDef type) {
        return type.accept(INSTANCE);
    }

    private static <T> CodeBlock list(List<T> items, Function<T, CodeBlock> element) {
        if (items.isEmpty()) {
            return CodeBlock.of("$T.of()", LIST);
        }
        return CodeBlock.of("$T.of($L)", LIST, items.stream()
                .map(element)
                .collect(CodeBlock.joining(", ")));
    }

    private static CodeBlock strings(List<String> values) {
        return list(values, value -> CodeBlock.of("$S", value));
    }

    private static CodeBlock types(List<TypeDef> types) {
        return list(types, TypeDefCodeEmitter::emit);
    }

    private static CodeBlock fields(List<Field> fields) {
        return list(fields, field -> CodeBlock.of("new $T($S, $L, $L, $L)",
                FIELD, field.name(), emit(field.type()), field.optional(), field.readonly()));
    }

    @Override
    public CodeBlock visitPrimitive(TypeDef.PrimitiveType type) {
        return CodeBlock.of("$T.primitive($T.$L)", TYPE_DEF, PRIMITIVE, type.kind().name());
    }

    @Override
    public CodeBlock visitArray(TypeDef.ArrayType type) {
        return CodeBlock.of("$T.array($L)", TYPE_DEF, emit(type.element()));
    }

    @Override
    public CodeBlock visitTuple(TypeDef.TupleType type) {
        return CodeBlock.of("new $T.TupleType($L)", TYPE_DEF, types(type.elements()));
    }

    @Override
    public CodeBlock visitObject(TypeDef.ObjectType type) {
        return CodeBlock.of("new $T.ObjectType($L)", TYPE_DEF, fields(type.fields()));
    }

    @Override
    public CodeBlock visitUnion(TypeDef.UnionType type) {
        return CodeBlock.of("new $T.UnionType($L)", TYPE_DEF, types(type.members()));
    }

    @Override
    public CodeBlock visitIntersection(TypeDef.IntersectionType type) {
        return CodeBlock.of("new $T.IntersectionType($L)", TYPE_DEF, types(type.members()));
    }

    @Override
    public CodeBlock visitRecord(TypeDef.RecordType type) {
        return CodeBlock.of("$T.record($L, $L)", TYPE_DEF, emit(type.key()), emit(type.value()));
    }

    @Override
    public CodeBlock visitNamed(TypeDef.Named type) {
        return CodeBlock.of("new $T.Named($L, $S, $L, $L, $S, $S)", TYPE_DEF,
                strings(type.namespace()), type.name(), strings(type.typeParams()), emit(type.def()),
                type.originModule(), type.wrapper());
    }

    @Override
    public CodeBlock visitRef(TypeDef.Ref type) {
        return CodeBlock.of("$T.ref($S)", TYPE_DEF, type.name());
    }

    @Override
    public CodeBlock visitLiteral(TypeDef.LiteralType type) {
        Literal literal = type.literal();
        if (literal instanceof Literal.StringLiteral s) {
            return CodeBlock.of("$T.literal($S)", TYPE_DEF, s.value());
        }
        if (literal instanceof Literal.NumberLiteral n) {
            return CodeBlock.of("$T.literal($Ld)", TYPE_DEF, Double.toString(n.value()));
        }
        return CodeBlock.of("$T.literal($L)", TYPE_DEF, ((Literal.BooleanLiteral) literal).value());
    }

    @Override
    public CodeBlock visitFunction(TypeDef.FunctionType type) {
        return CodeBlock.of("new $T.FunctionType($L, $L)", TYPE_DEF, fields(type.params()), emit(type.returns()));
    }

    @Override
    public CodeBlock visitGeneric(TypeDef.GenericType type) {
        return CodeBlock.of("new $T.GenericType($S, $L)", TYPE_DEF, type.base(), types(type.args()));
    }

    @Override
    public CodeBlock visitTemplateLiteral(TypeDef.TemplateLiteralType type) {
        return CodeBlock.of("new $T.TemplateLiteralType($L, $L)", TYPE_DEF,
                strings(type.strings()), types(type.types()));
    }

    @Override
    public CodeBlock visitIndexedAccess(TypeDef.IndexedAccessType type) {
        return CodeBlock.of("new $T.IndexedAccessType($S, $S)", TYPE_DEF, type.base(), type.key());
    }
}
