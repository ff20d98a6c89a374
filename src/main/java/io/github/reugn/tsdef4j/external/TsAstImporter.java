package io.github.reugn.tsdef4j.external;

import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.Primitive;
import io.github.reugn.tsdef4j.ir.TypeDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Imports parsed TypeScript declarations into the type IR.
 *
 * <p><b>Declarations:</b>
 * <ul>
 *   <li>interfaces become named object types; only property signatures are kept</li>
 *   <li>type aliases become named types of the converted alias body</li>
 *   <li>enums become named unions of literals: the string or numeric initializer, or the
 *       member name when there is none or it is computed</li>
 * </ul>
 * Generic parameters are kept on the declaration.
 *
 * <p><b>Type nodes:</b>
 * <table border="1">
 *   <caption>TypeScript to IR</caption>
 *   <tr><th>TypeScript</th><th>IR</th></tr>
 *   <tr><td>keywords</td><td>primitives; {@code object} is {@code {}}, {@code symbol} and
 *       {@code intrinsic} are {@code any}</td></tr>
 *   <tr><td>{@code T[]}, {@code Array<T>}</td><td>array</td></tr>
 *   <tr><td>{@code Record<K, V>}</td><td>record</td></tr>
 *   <tr><td>{@code Promise}, {@code Map}, {@code Set}, {@code WeakMap}, {@code WeakSet} and
 *       user generics</td><td>generic</td></tr>
 *   <tr><td>other references</td><td>ref</td></tr>
 *   <tr><td>tuple {@code T?} / {@code ...T}</td><td>{@code T | null} / {@code T[]}</td></tr>
 *   <tr><td>{@code T["key"]}</td><td>indexed access; other index forms are {@code any}</td></tr>
 *   <tr><td>mapped, conditional, {@code typeof} and similar</td><td>{@code any}</td></tr>
 * </table>
 */
public final class TsAstImporter {

    private static final Logger log = LoggerFactory.getLogger(TsAstImporter.class);

    private static final Set<String> GENERIC_BUILTINS = Set.of("Promise", "Map", "Set", "WeakMap", "WeakSet");

    private TsAstImporter() {
    }

    /**
     * Imports declarations in order.
     *
     * @param declarations the parsed declarations
     * @return one named type per declaration
     */
    public static List<TypeDef.Named> importAll(List<? extends TsDeclaration> declarations) {
        List<TypeDef.Named> types = new ArrayList<>(declarations.size());
        for (TsDeclaration declaration : declarations) {
            types.add(importDeclaration(declaration));
        }
        return types;
    }

    /**
     * Imports a single declaration.
     */
    public static TypeDef.Named importDeclaration(TsDeclaration declaration) {
        if (declaration instanceof TsDeclaration.Interface iface) {
            return named(iface.name(), iface.typeParams(), new TypeDef.ObjectType(fields(iface.body())));
        }
        if (declaration instanceof TsDeclaration.TypeAlias alias) {
            return named(alias.name(), alias.typeParams(), convertType(alias.type()));
        }
        TsDeclaration.Enum tsEnum = (TsDeclaration.Enum) declaration;
        List<TypeDef> literals = new ArrayList<>();
        for (TsDeclaration.EnumMember member : tsEnum.members()) {
            if (member.stringValue() != null) {
                literals.add(TypeDef.literal(member.stringValue()));
            } else if (member.numberValue() != null) {
                literals.add(TypeDef.literal(member.numberValue()));
            } else {
                literals.add(TypeDef.literal(member.name()));
            }
        }
        return named(tsEnum.name(), List.of(), new TypeDef.UnionType(literals));
    }

    /**
     * Converts a type expression.
     */
    public static TypeDef convertType(TsTypeNode node) {
        if (node instanceof TsTypeNode.Keyword keyword) {
            return keyword(keyword.name());
        }
        if (node instanceof TsTypeNode.ArrayType array) {
            return TypeDef.array(convertType(array.element()));
        }
        if (node instanceof TsTypeNode.UnionType union) {
            return new TypeDef.UnionType(convertAll(union.types()));
        }
        if (node instanceof TsTypeNode.IntersectionType intersection) {
            return new TypeDef.IntersectionType(convertAll(intersection.types()));
        }
        if (node instanceof TsTypeNode.TypeReference reference) {
            return reference(reference);
        }
        if (node instanceof TsTypeNode.TypeLiteral literal) {
            return new TypeDef.ObjectType(fields(literal.members()));
        }
        if (node instanceof TsTypeNode.StringLiteral s) {
            return TypeDef.literal(s.value());
        }
        if (node instanceof TsTypeNode.NumberLiteral n) {
            return TypeDef.literal(n.value());
        }
        if (node instanceof TsTypeNode.BooleanLiteral b) {
            return TypeDef.literal(b.value());
        }
        if (node instanceof TsTypeNode.BigIntLiteral) {
            return TypeDef.primitive(Primitive.BIGINT);
        }
        if (node instanceof TsTypeNode.TemplateLiteral) {
            return TypeDef.string();
        }
        if (node instanceof TsTypeNode.TupleType tuple) {
            return new TypeDef.TupleType(convertAll(tuple.elements()));
        }
        if (node instanceof TsTypeNode.OptionalType optional) {
            return TypeDef.union(convertType(optional.type()), TypeDef.nullType());
        }
        if (node instanceof TsTypeNode.RestType rest) {
            return TypeDef.array(convertType(rest.type()));
        }
        if (node instanceof TsTypeNode.Parenthesized parenthesized) {
            return convertType(parenthesized.type());
        }
        if (node instanceof TsTypeNode.FunctionType function) {
            return function(function);
        }
        if (node instanceof TsTypeNode.IndexedAccess indexed) {
            return indexedAccess(indexed);
        }
        if (node instanceof TsTypeNode.TypePredicate) {
            return TypeDef.bool();
        }
        log.debug("Importing unsupported construct {} as any", node);
        return TypeDef.primitive(Primitive.ANY);
    }

    // ==================== HELPERS ====================

    private static TypeDef.Named named(String name, List<String> typeParams, TypeDef def) {
        return new TypeDef.Named(List.of(), name, typeParams, def, null, null);
    }

    private static List<TypeDef> convertAll(List<TsTypeNode> nodes) {
        List<TypeDef> types = new ArrayList<>(nodes.size());
        for (TsTypeNode node : nodes) {
            types.add(convertType(node));
        }
        return types;
    }

    private static List<Field> fields(List<TsTypeElement> members) {
        List<Field> fields = new ArrayList<>();
        for (TsTypeElement member : members) {
            if (!(member instanceof TsPropertySignature property) || property.computed()) {
                log.debug("Skipping member {}", member);
                continue;
            }
            TypeDef type = property.type() == null
                    ? TypeDef.primitive(Primitive.ANY)
                    : convertType(property.type());
            fields.add(new Field(property.key(), type, property.optional(), property.readonly()));
        }
        return fields;
    }

    private static TypeDef keyword(String name) {
        if ("object".equals(name)) {
            return new TypeDef.ObjectType(List.of());
        }
        Primitive primitive = Primitive.fromKeyword(name);
        return TypeDef.primitive(primitive != null ? primitive : Primitive.ANY);
    }

    private static TypeDef reference(TsTypeNode.TypeReference reference) {
        String name = reference.name();
        List<TypeDef> args = convertAll(reference.typeArgs());
        if ("Array".equals(name)) {
            return TypeDef.array(args.isEmpty() ? TypeDef.primitive(Primitive.ANY) : args.get(0));
        }
        if ("Record".equals(name)) {
            if (args.size() >= 2) {
                return TypeDef.record(args.get(0), args.get(1));
            }
            return TypeDef.record(TypeDef.string(), TypeDef.primitive(Primitive.ANY));
        }
        if (GENERIC_BUILTINS.contains(name) || !args.isEmpty()) {
            return new TypeDef.GenericType(name, args);
        }
        return TypeDef.ref(name);
    }

    private static TypeDef function(TsTypeNode.FunctionType function) {
        List<Field> params = new ArrayList<>();
        for (int i = 0; i < function.params().size(); i++) {
            TsTypeNode.Param param = function.params().get(i);
            TypeDef type;
            if (param.type() != null) {
                type = convertType(param.type());
            } else {
                type = param.rest()
                        ? TypeDef.array(TypeDef.primitive(Primitive.ANY))
                        : TypeDef.primitive(Primitive.ANY);
            }
            String name = param.name() != null ? param.name() : (param.rest() ? "rest" : "arg") + i;
            params.add(Field.of(name, type));
        }
        return new TypeDef.FunctionType(params, convertType(function.returns()));
    }

    private static TypeDef indexedAccess(TsTypeNode.IndexedAccess indexed) {
        if (indexed.object() instanceof TsTypeNode.TypeReference base
                && indexed.index() instanceof TsTypeNode.StringLiteral key) {
            return new TypeDef.IndexedAccessType(base.name(), key.value());
        }
        log.debug("Importing indexed access {} as any", indexed);
        return TypeDef.primitive(Primitive.ANY);
    }
}
