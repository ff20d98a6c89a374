package io.github.reugn.tsdef4j.external;

import java.util.List;
import java.util.Objects;

/**
 * A TypeScript type expression as produced by a TypeScript parser.
 *
 * <p>This is the input model of {@link TsAstImporter}; it mirrors the type nodes of common
 * TypeScript ASTs and carries no source positions.
 */
public sealed interface TsTypeNode permits TsTypeNode.Keyword, TsTypeNode.ArrayType, TsTypeNode.UnionType,
        TsTypeNode.IntersectionType, TsTypeNode.TypeReference, TsTypeNode.TypeLiteral, TsTypeNode.StringLiteral,
        TsTypeNode.NumberLiteral, TsTypeNode.BooleanLiteral, TsTypeNode.BigIntLiteral, TsTypeNode.TemplateLiteral,
        TsTypeNode.TupleType, TsTypeNode.OptionalType, TsTypeNode.RestType, TsTypeNode.Parenthesized,
        TsTypeNode.FunctionType, TsTypeNode.ConstructorType, TsTypeNode.IndexedAccess, TsTypeNode.TypePredicate,
        TsTypeNode.Other {

    /** A keyword type such as {@code string}, {@code object} or {@code symbol}. */
    record Keyword(String name) implements TsTypeNode {
        public Keyword {
            Objects.requireNonNull(name, "name");
        }
    }

    /** {@code T[]}. */
    record ArrayType(TsTypeNode element) implements TsTypeNode {
    }

    record UnionType(List<TsTypeNode> types) implements TsTypeNode {
        public UnionType {
            types = List.copyOf(types);
        }
    }

    record IntersectionType(List<TsTypeNode> types) implements TsTypeNode {
        public IntersectionType {
            types = List.copyOf(types);
        }
    }

    /**
     * A reference to a named type, possibly qualified ({@code Api.User}) and possibly with
     * type arguments.
     */
    record TypeReference(String name, List<TsTypeNode> typeArgs) implements TsTypeNode {
        public TypeReference {
            Objects.requireNonNull(name, "name");
            typeArgs = List.copyOf(typeArgs);
        }

        public static TypeReference of(String name, TsTypeNode... args) {
            return new TypeReference(name, List.of(args));
        }
    }

    /** An inline object type {@code { ... }}. */
    record TypeLiteral(List<TsTypeElement> members) implements TsTypeNode {
        public TypeLiteral {
            members = List.copyOf(members);
        }
    }

    record StringLiteral(String value) implements TsTypeNode {
    }

    record NumberLiteral(double value) implements TsTypeNode {
    }

    record BooleanLiteral(boolean value) implements TsTypeNode {
    }

    record BigIntLiteral(String digits) implements TsTypeNode {
    }

    /** A template literal type; its parts are not modeled. */
    record TemplateLiteral(String raw) implements TsTypeNode {
    }

    record TupleType(List<TsTypeNode> elements) implements TsTypeNode {
        public TupleType {
            elements = List.copyOf(elements);
        }
    }

    /** An optional tuple member {@code T?}. */
    record OptionalType(TsTypeNode type) implements TsTypeNode {
    }

    /** A rest tuple member {@code ...T}. */
    record RestType(TsTypeNode type) implements TsTypeNode {
    }

    record Parenthesized(TsTypeNode type) implements TsTypeNode {
    }

    /**
     * {@code (a: A, ...rest: B[]) => R}.
     *
     * @param params  the parameters
     * @param returns the return type
     */
    record FunctionType(List<Param> params, TsTypeNode returns) implements TsTypeNode {
        public FunctionType {
            params = List.copyOf(params);
        }
    }

    /**
     * A function parameter.
     *
     * @param name the identifier, or {@code null} for destructuring patterns
     * @param type the annotated type, or {@code null} if unannotated
     * @param rest {@code true} for a rest parameter
     */
    record Param(String name, TsTypeNode type, boolean rest) {

        public static Param of(String name, TsTypeNode type) {
            return new Param(name, type, false);
        }
    }

    /** {@code new (...) => T}. */
    record ConstructorType() implements TsTypeNode {
    }

    /** {@code T["key"]}. */
    record IndexedAccess(TsTypeNode object, TsTypeNode index) implements TsTypeNode {
    }

    /** {@code x is T}. */
    record TypePredicate() implements TsTypeNode {
    }

    /**
     * Any construct without an IR counterpart: {@code typeof}, mapped, conditional,
     * {@code infer}, {@code this}, type operators and {@code import()} types.
     *
     * @param construct a short description of the construct, used for diagnostics
     */
    record Other(String construct) implements TsTypeNode {
    }
}
