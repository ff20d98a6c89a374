package io.github.reugn.tsdef4j.convert;

import io.github.reugn.tsdef4j.convert.ConversionException.ErrorKind;
import io.github.reugn.tsdef4j.descriptor.ContainerAttributes;
import io.github.reugn.tsdef4j.descriptor.DescriptorKind;
import io.github.reugn.tsdef4j.descriptor.FieldAttributes;
import io.github.reugn.tsdef4j.descriptor.MemberDescriptor;
import io.github.reugn.tsdef4j.descriptor.MemberTypeResolver;
import io.github.reugn.tsdef4j.descriptor.SourceDescriptor;
import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.Primitive;
import io.github.reugn.tsdef4j.ir.TypeDef;
import io.github.reugn.tsdef4j.ir.TypeDefs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts {@link SourceDescriptor}s to the type IR.
 *
 * <p><b>Naming:</b> a member's output name is its explicit {@code rename}, else the container's
 * {@code renameAll} policy applied to the source name, else the source name unchanged.
 *
 * <p><b>Field modifiers</b> are applied per member in a fixed order:
 * <ol>
 *   <li>{@code skip} drops the member</li>
 *   <li>{@code flatten} splices the fields of the member's object type in place</li>
 *   <li>{@code typeOverride} uses a raw type reference, bypassing the resolver</li>
 *   <li>{@code index} + {@code key} produce an indexed access type</li>
 *   <li>{@code pattern} produces a template literal type</li>
 *   <li>{@code defaulted} / {@code optional} mark the field optional; {@code optional} also
 *       strips {@code null} from a nullable type</li>
 *   <li>{@code inline} replaces a named type with its definition</li>
 * </ol>
 *
 * <p><b>Declarations:</b>
 * <table border="1">
 *   <caption>Record conversion</caption>
 *   <tr><th>Members</th><th>Body</th></tr>
 *   <tr><td>none</td><td>{@code {}}</td></tr>
 *   <tr><td>one positional</td><td>the member type (newtype)</td></tr>
 *   <tr><td>several positional</td><td>a tuple</td></tr>
 *   <tr><td>named</td><td>an object type</td></tr>
 * </table>
 *
 * <p>Variant sets are encoded by {@link VariantEncoder}. Every declaration is returned as a
 * {@link TypeDef.Named}, except {@code transparent} records, which return their single
 * member's type directly.
 */
public final class TypeConverter {

    private static final List<String> KEYWORD_PLACEHOLDERS =
            List.of("string", "number", "boolean", "bigint", "any", "unknown");

    private TypeConverter() {
    }

    /**
     * Converts a source descriptor.
     *
     * @param descriptor the source type
     * @param resolver   resolves member types, recursing into referenced declarations
     * @return the declared type, or the inner type of a transparent record
     * @throws ConversionException if the descriptor cannot be expressed
     */
    public static TypeDef convert(SourceDescriptor descriptor, MemberTypeResolver resolver) {
        ContainerAttributes attributes = descriptor.attributes();
        if (attributes.transparent()) {
            return convertTransparent(descriptor, resolver);
        }

        TypeDef body = switch (descriptor.kind()) {
            case RECORD -> convertRecord(descriptor, resolver);
            case VARIANT_SET -> VariantEncoder.encode(descriptor, resolver);
            case ALIAS -> convertAlias(descriptor, resolver);
        };

        if (!attributes.extendsTypes().isEmpty()) {
            List<TypeDef> parts = new ArrayList<>();
            for (String parent : attributes.extendsTypes()) {
                parts.add(TypeDef.ref(parent));
            }
            parts.add(body);
            body = new TypeDef.IntersectionType(parts);
        }

        String name = attributes.rename() != null ? attributes.rename() : descriptor.name();
        return new TypeDef.Named(descriptor.namespace(), name, descriptor.typeParams(), body,
                descriptor.originModule(), attributes.wrapper());
    }

    // ==================== DECLARATION KINDS ====================

    private static TypeDef convertRecord(SourceDescriptor descriptor, MemberTypeResolver resolver) {
        List<MemberDescriptor> active = activeMembers(descriptor.members());
        if (active.isEmpty()) {
            return new TypeDef.ObjectType(List.of());
        }

        long positional = active.stream().filter(MemberDescriptor::isPositional).count();
        if (positional == active.size()) {
            if (active.size() == 1) {
                return memberType(descriptor.name(), active.get(0), resolver);
            }
            List<TypeDef> elements = new ArrayList<>();
            for (MemberDescriptor member : active) {
                elements.add(memberType(descriptor.name(), member, resolver));
            }
            return new TypeDef.TupleType(elements);
        }
        if (positional > 0) {
            throw new ConversionException(ErrorKind.UNSUPPORTED_TARGET,
                    "Type '" + descriptor.name() + "' mixes named and positional members");
        }

        RenameRule rule = renameRule(descriptor.attributes().renameAll());
        return new TypeDef.ObjectType(convertFields(descriptor.name(), descriptor.members(), rule, resolver));
    }

    private static TypeDef convertAlias(SourceDescriptor descriptor, MemberTypeResolver resolver) {
        if (descriptor.members().size() != 1) {
            throw new ConversionException(ErrorKind.UNSUPPORTED_TARGET,
                    "Alias '" + descriptor.name() + "' must have exactly one member, found "
                            + descriptor.members().size());
        }
        return memberType(descriptor.name(), descriptor.members().get(0), resolver);
    }

    private static TypeDef convertTransparent(SourceDescriptor descriptor, MemberTypeResolver resolver) {
        List<MemberDescriptor> active = activeMembers(descriptor.members());
        if (descriptor.kind() == DescriptorKind.VARIANT_SET
                || active.size() != 1) {
            throw new ConversionException(ErrorKind.UNSUPPORTED_TARGET,
                    "Transparent type '" + descriptor.name() + "' must be a record with exactly one member");
        }
        return memberType(descriptor.name(), active.get(0), resolver);
    }

    // ==================== FIELDS ====================

    /**
     * Runs the field modifier pipeline over named members.
     *
     * @param owner    the declaring type name, for diagnostics
     * @param members  the members, skipped ones included
     * @param rule     the rename policy, or {@code null}
     * @param resolver the member type resolver
     * @return the resulting fields, flattened members spliced in place
     */
    static List<Field> convertFields(String owner, List<MemberDescriptor> members, RenameRule rule,
                                     MemberTypeResolver resolver) {
        List<Field> fields = new ArrayList<>();
        for (MemberDescriptor member : members) {
            FieldAttributes attributes = member.attributes();
            if (attributes.skip()) {
                continue;
            }
            if (attributes.flatten()) {
                fields.addAll(flattenedFields(owner, member, resolver));
                continue;
            }
            if (member.isPositional()) {
                throw new ConversionException(ErrorKind.UNSUPPORTED_TARGET,
                        "Type '" + owner + "' mixes named and positional members");
            }
            String name = effectiveName(member.name(), attributes.rename(), rule);
            TypeDef type = memberType(owner, member, resolver);
            boolean optional = attributes.optional() || attributes.defaulted();
            fields.add(new Field(name, type, optional, attributes.readonly()));
        }
        return fields;
    }

    /**
     * Computes a member's type: steps three to seven of the modifier pipeline.
     */
    static TypeDef memberType(String owner, MemberDescriptor member, MemberTypeResolver resolver) {
        FieldAttributes attributes = member.attributes();
        String label = owner + "." + (member.name() != null ? member.name() : "<positional>");

        if ((attributes.index() == null) != (attributes.key() == null)) {
            throw new ConversionException(ErrorKind.UNPAIRED_INDEX_KEY,
                    "Member '" + label + "' must declare both 'index' and 'key', or neither");
        }

        TypeDef type;
        if (attributes.typeOverride() != null) {
            type = TypeDef.ref(attributes.typeOverride());
        } else if (attributes.index() != null) {
            type = new TypeDef.IndexedAccessType(attributes.index(), attributes.key());
        } else if (attributes.pattern() != null) {
            type = templateLiteral(attributes.pattern());
        } else {
            type = resolver.resolve(member.type());
        }

        if (attributes.optional()) {
            type = stripNull(type);
        }
        if (attributes.inline()) {
            type = inline(type, resolver);
        }
        return type;
    }

    static String effectiveName(String name, String rename, RenameRule rule) {
        if (rename != null) {
            return rename;
        }
        return rule != null ? rule.apply(name) : name;
    }

    static RenameRule renameRule(String token) {
        return token == null ? null : RenameRule.fromToken(token);
    }

    static List<MemberDescriptor> activeMembers(List<MemberDescriptor> members) {
        return members.stream().filter(m -> !m.attributes().skip()).toList();
    }

    private static List<Field> flattenedFields(String owner, MemberDescriptor member, MemberTypeResolver resolver) {
        TypeDef resolved = resolver.resolve(member.type());
        TypeDef declared = materialize(resolved, resolver).<TypeDef>map(named -> named).orElse(resolved);
        TypeDef body = TypeDefs.unwrapNamed(declared);
        if (body instanceof TypeDef.ObjectType object) {
            return object.fields();
        }
        throw new ConversionException(ErrorKind.FLATTEN_NON_OBJECT,
                "Cannot flatten member '" + owner + "." + member.name() + "' of non-object type "
                        + member.type().describe());
    }

    // ==================== TYPE MODIFIERS ====================

    /**
     * Builds a template literal type from a pattern; keyword placeholders become primitives,
     * other names become references.
     */
    static TypeDef templateLiteral(String pattern) {
        ParsedPattern parsed = PatternParser.parse(pattern);
        List<TypeDef> types = new ArrayList<>();
        for (String placeholder : parsed.types()) {
            if (KEYWORD_PLACEHOLDERS.contains(placeholder)) {
                types.add(TypeDef.primitive(Primitive.fromKeyword(placeholder)));
            } else {
                types.add(TypeDef.ref(placeholder));
            }
        }
        return new TypeDef.TemplateLiteralType(parsed.strings(), types);
    }

    /**
     * Removes {@code null} from a nullable union; other types are returned unchanged.
     */
    static TypeDef stripNull(TypeDef type) {
        if (!(type instanceof TypeDef.UnionType union)) {
            return type;
        }
        List<TypeDef> remaining = union.members().stream()
                .filter(member -> !isNull(member))
                .toList();
        if (remaining.size() == union.members().size() || remaining.isEmpty()) {
            return type;
        }
        return remaining.size() == 1 ? remaining.get(0) : new TypeDef.UnionType(remaining);
    }

    private static boolean isNull(TypeDef type) {
        return type instanceof TypeDef.PrimitiveType primitive && primitive.kind() == Primitive.NULL;
    }

    /**
     * Replaces a named type with its definition. Generic references and references known to
     * the resolver are materialized first.
     */
    static TypeDef inline(TypeDef type, MemberTypeResolver resolver) {
        if (type instanceof TypeDef.Named named) {
            return named.def();
        }
        return materialize(type, resolver).map(TypeDef.Named::def).orElse(type);
    }

    private static Optional<TypeDef.Named> materialize(TypeDef type, MemberTypeResolver resolver) {
        if (type instanceof TypeDef.GenericType generic) {
            return resolver.lookup(generic.base())
                    .map(declaration -> TypeDefs.instantiate(declaration, generic.args()));
        }
        if (type instanceof TypeDef.Ref ref) {
            return resolver.lookup(ref.name()).filter(declaration -> !declaration.isGeneric());
        }
        return Optional.empty();
    }
}
