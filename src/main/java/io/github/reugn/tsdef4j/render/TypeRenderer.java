package io.github.reugn.tsdef4j.render;

import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.Literal;
import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.ir.TypeDefVisitor;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Serializes {@link TypeDef} trees to TypeScript type syntax.
 *
 * <p><b>Rendering Rules:</b>
 * <ul>
 *   <li>Primitives render as their keyword</li>
 *   <li>Arrays render {@code T[]}; union, intersection and function element types are
 *       parenthesized first, so {@code Array(Union(A, B))} renders {@code (A | B)[]}</li>
 *   <li>Objects render {@code { a: A; b?: B; readonly c: C }}, the empty object {@code {}};
 *       property names that are not identifiers are quoted</li>
 *   <li>Unions and intersections join members with {@code " | "} / {@code " & "}; function
 *       members, and unions directly inside an intersection, are parenthesized</li>
 *   <li>Named types render as their (namespace-qualified) name; use
 *       {@link #renderDeclaration(TypeDef.Named)} for the full declaration</li>
 *   <li>String literals escape backslashes and double quotes; integral numbers render without
 *       a fractional part</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * TypeDef user = TypeDef.named("User", TypeDef.object(
 *         Field.of("id", TypeDef.string()),
 *         Field.optional("tags", TypeDef.array(TypeDef.string()))));
 *
 * TypeRenderer.render(user);             // User
 * TypeRenderer.renderDeclaration(user);  // type User = { id: string; tags?: string[] };
 * }</pre>
 */
public final class TypeRenderer implements TypeDefVisitor<String> {

    private static final TypeRenderer INSTANCE = new TypeRenderer();

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private static final String INDENT = "    ";

    private TypeRenderer() {
    }

    /**
     * Renders a type in an inline (reference) position.
     *
     * @param type the type to render
     * @return the TypeScript type expression
     */
    public static String render(TypeDef type) {
        return type.accept(INSTANCE);
    }

    /**
     * Renders the declaration of a named type without an export keyword.
     *
     * @param named the declared type
     * @return e.g. {@code type User = { id: string };}
     */
    public static String renderDeclaration(TypeDef.Named named) {
        return renderDeclaration(named, false, false);
    }

    /**
     * Renders the declaration of a named type.
     *
     * <p>Types with a namespace are wrapped in a {@code namespace} block whose inner
     * declaration is always exported, so that qualified references resolve.
     *
     * @param named    the declared type
     * @param exported {@code true} to prefix the declaration with {@code export}
     * @param declare  {@code true} to prefix non-exported declarations with {@code declare}
     *                 (ambient {@code .d.ts} output)
     * @return the declaration statement
     */
    public static String renderDeclaration(TypeDef.Named named, boolean exported, boolean declare) {
        String body = render(named.def());
        if (named.wrapper() != null && !named.wrapper().isEmpty()) {
            body = named.wrapper() + "<" + body + ">";
        }
        String params = named.typeParams().isEmpty() ? "" : "<" + String.join(", ", named.typeParams()) + ">";
        String prefix = exported ? "export " : declare ? "declare " : "";

        if (named.namespace().isEmpty()) {
            return prefix + "type " + named.name() + params + " = " + body + ";";
        }
        return prefix + "namespace " + String.join(".", named.namespace()) + " {\n"
                + INDENT + "export type " + named.name() + params + " = " + body + ";\n"
                + "}";
    }

    /**
     * Renders a string literal with surrounding double quotes.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '"') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    /**
     * Formats a numeric literal; integral values have no fractional part and no exponent.
     *
     * @throws IllegalArgumentException for {@code NaN} and the infinities
     */
    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Numeric literal must be finite, got " + value);
        }
        if (value == Math.rint(value)) {
            return new BigDecimal(value).toPlainString();
        }
        return Double.toString(value);
    }

    /**
     * Renders a property name, quoting it when it is not a valid identifier.
     */
    public static String propertyName(String name) {
        return IDENTIFIER.matcher(name).matches() ? name : quote(name);
    }

    // ==================== VISITOR ====================

    @Override
    public String visitPrimitive(TypeDef.PrimitiveType type) {
        return type.kind().keyword();
    }

    @Override
    public String visitArray(TypeDef.ArrayType type) {
        TypeDef element = type.element();
        String inner = render(element);
        if (element instanceof TypeDef.UnionType
                || element instanceof TypeDef.IntersectionType
                || element instanceof TypeDef.FunctionType) {
            return "(" + inner + ")[]";
        }
        return inner + "[]";
    }

    @Override
    public String visitTuple(TypeDef.TupleType type) {
        return "[" + join(type.elements(), ", ") + "]";
    }

    @Override
    public String visitObject(TypeDef.ObjectType type) {
        if (type.fields().isEmpty()) {
            return "{}";
        }
        return "{ " + type.fields().stream()
                .map(TypeRenderer::renderField)
                .collect(Collectors.joining("; ")) + " }";
    }

    @Override
    public String visitUnion(TypeDef.UnionType type) {
        return type.members().stream()
                .map(member -> member instanceof TypeDef.FunctionType ? parenthesized(member) : render(member))
                .collect(Collectors.joining(" | "));
    }

    @Override
    public String visitIntersection(TypeDef.IntersectionType type) {
        return type.members().stream()
                .map(member -> member instanceof TypeDef.UnionType || member instanceof TypeDef.FunctionType
                        ? parenthesized(member)
                        : render(member))
                .collect(Collectors.joining(" & "));
    }

    @Override
    public String visitRecord(TypeDef.RecordType type) {
        return "Record<" + render(type.key()) + ", " + render(type.value()) + ">";
    }

    @Override
    public String visitNamed(TypeDef.Named type) {
        return type.qualifiedName();
    }

    @Override
    public String visitRef(TypeDef.Ref type) {
        return type.name();
    }

    @Override
    public String visitLiteral(TypeDef.LiteralType type) {
        Literal literal = type.literal();
        if (literal instanceof Literal.StringLiteral s) {
            return quote(s.value());
        }
        if (literal instanceof Literal.NumberLiteral n) {
            return formatNumber(n.value());
        }
        return String.valueOf(((Literal.BooleanLiteral) literal).value());
    }

    @Override
    public String visitFunction(TypeDef.FunctionType type) {
        String params = type.params().stream()
                .map(TypeRenderer::renderParam)
                .collect(Collectors.joining(", "));
        return "(" + params + ") => " + render(type.returns());
    }

    @Override
    public String visitGeneric(TypeDef.GenericType type) {
        if (type.args().isEmpty()) {
            return type.base();
        }
        return type.base() + "<" + join(type.args(), ", ") + ">";
    }

    @Override
    public String visitTemplateLiteral(TypeDef.TemplateLiteralType type) {
        StringBuilder sb = new StringBuilder("`");
        List<String> strings = type.strings();
        for (int i = 0; i < type.types().size(); i++) {
            sb.append(escapeTemplate(strings.get(i)));
            sb.append("${").append(render(type.types().get(i))).append('}');
        }
        sb.append(escapeTemplate(strings.get(strings.size() - 1)));
        return sb.append('`').toString();
    }

    @Override
    public String visitIndexedAccess(TypeDef.IndexedAccessType type) {
        return type.base() + "[" + quote(type.key()) + "]";
    }

    // ==================== HELPERS ====================

    private static String renderField(Field field) {
        return (field.readonly() ? "readonly " : "")
                + propertyName(field.name())
                + (field.optional() ? "?" : "")
                + ": " + render(field.type());
    }

    private static String renderParam(Field param) {
        return param.name() + (param.optional() ? "?" : "") + ": " + render(param.type());
    }

    private static String parenthesized(TypeDef type) {
        return "(" + render(type) + ")";
    }

    private static String join(List<TypeDef> types, String separator) {
        return types.stream().map(TypeRenderer::render).collect(Collectors.joining(separator));
    }

    private static String escapeTemplate(String text) {
        return text.replace("\\", "\\\\").replace("`", "\\`").replace("${", "\\${");
    }
}
