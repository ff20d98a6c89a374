package io.github.reugn.tsdef4j.convert;

import io.github.reugn.tsdef4j.convert.ConversionException.ErrorKind;
import io.github.reugn.tsdef4j.descriptor.MemberDescriptor;
import io.github.reugn.tsdef4j.descriptor.MemberTypeResolver;
import io.github.reugn.tsdef4j.descriptor.SourceDescriptor;
import io.github.reugn.tsdef4j.descriptor.VariantDescriptor;
import io.github.reugn.tsdef4j.descriptor.VariantShape;
import io.github.reugn.tsdef4j.ir.Field;
import io.github.reugn.tsdef4j.ir.TypeDef;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes variant sets as unions.
 *
 * <p>A set whose variants are all unit collapses to a union of string literals under every
 * policy. Otherwise each variant is encoded according to its shape and the
 * {@link VariantTagging} policy ({@code T} is the tag field, {@code C} the content field):
 *
 * <table border="1">
 *   <caption>Variant encodings</caption>
 *   <tr><th>Policy</th><th>Unit</th><th>Single value</th><th>Several values</th><th>Record</th></tr>
 *   <tr><td>internal</td><td>{@code { T: "N" }}</td><td>{@code { T: "N"; value: V }}</td>
 *       <td>{@code { T: "N"; value: [A, B] }}</td><td>{@code { T: "N"; ...fields }}</td></tr>
 *   <tr><td>adjacent</td><td>{@code { T: "N" }}</td><td>{@code { T: "N"; C: V }}</td>
 *       <td>{@code { T: "N"; C: [A, B] }}</td><td>{@code { T: "N"; C: { ...fields } }}</td></tr>
 *   <tr><td>untagged</td><td>{@code "N"}</td><td>{@code V}</td>
 *       <td>{@code [A, B]}</td><td>{@code { ...fields }}</td></tr>
 * </table>
 */
final class VariantEncoder {

    private VariantEncoder() {
    }

    static TypeDef encode(SourceDescriptor descriptor, MemberTypeResolver resolver) {
        if (descriptor.variants().isEmpty()) {
            throw new ConversionException(ErrorKind.EMPTY_VARIANT_SET,
                    "Variant set '" + descriptor.name() + "' has no variants");
        }
        List<VariantDescriptor> active = descriptor.variants().stream()
                .filter(variant -> !variant.attributes().skip())
                .toList();
        if (active.isEmpty()) {
            throw new ConversionException(ErrorKind.EMPTY_VARIANT_SET,
                    "All variants of '" + descriptor.name() + "' are skipped");
        }

        RenameRule rule = TypeConverter.renameRule(descriptor.attributes().renameAll());
        boolean allUnit = active.stream().allMatch(variant -> variant.shape() == VariantShape.UNIT);
        if (allUnit) {
            List<TypeDef> literals = new ArrayList<>();
            for (VariantDescriptor variant : active) {
                literals.add(TypeDef.literal(variantName(variant, rule)));
            }
            return new TypeDef.UnionType(literals);
        }

        VariantTagging tagging = VariantTagging.from(descriptor.attributes());
        List<TypeDef> members = new ArrayList<>();
        for (VariantDescriptor variant : active) {
            members.add(encodeVariant(descriptor.name(), variant, variantName(variant, rule), tagging, resolver));
        }
        return new TypeDef.UnionType(members);
    }

    private static String variantName(VariantDescriptor variant, RenameRule rule) {
        return TypeConverter.effectiveName(variant.name(), variant.attributes().rename(), rule);
    }

    private static TypeDef encodeVariant(String owner, VariantDescriptor variant, String name,
                                         VariantTagging tagging, MemberTypeResolver resolver) {
        String label = owner + "." + variant.name();
        List<MemberDescriptor> positional = TypeConverter.activeMembers(variant.members());
        return switch (variant.shape()) {
            case UNIT -> encodeUnit(tagging, name);
            // a tuple variant whose members are all skipped carries no payload
            case TUPLE -> positional.isEmpty()
                    ? encodeUnit(tagging, name)
                    : encodePayload(tagging, name, tuplePayload(label, positional, resolver));
            case RECORD -> encodeRecord(label, variant, name, tagging, resolver);
        };
    }

    private static TypeDef encodeUnit(VariantTagging tagging, String name) {
        return tagging.policy() == VariantTagging.Policy.UNTAGGED
                ? TypeDef.literal(name)
                : TypeDef.object(tagField(tagging, name));
    }

    private static TypeDef tuplePayload(String label, List<MemberDescriptor> members, MemberTypeResolver resolver) {
        if (members.size() == 1) {
            return TypeConverter.memberType(label, members.get(0), resolver);
        }
        List<TypeDef> elements = new ArrayList<>();
        for (MemberDescriptor member : members) {
            elements.add(TypeConverter.memberType(label, member, resolver));
        }
        return new TypeDef.TupleType(elements);
    }

    private static TypeDef encodePayload(VariantTagging tagging, String name, TypeDef payload) {
        return switch (tagging.policy()) {
            case INTERNAL -> TypeDef.object(tagField(tagging, name), Field.of(VariantTagging.VALUE_FIELD, payload));
            case ADJACENT -> TypeDef.object(tagField(tagging, name), Field.of(tagging.content(), payload));
            case UNTAGGED -> payload;
        };
    }

    private static TypeDef encodeRecord(String label, VariantDescriptor variant, String name,
                                        VariantTagging tagging, MemberTypeResolver resolver) {
        RenameRule fieldRule = TypeConverter.renameRule(variant.attributes().renameAll());
        List<Field> fields = TypeConverter.convertFields(label, variant.members(), fieldRule, resolver);
        return switch (tagging.policy()) {
            case INTERNAL -> {
                List<Field> tagged = new ArrayList<>(fields.size() + 1);
                tagged.add(tagField(tagging, name));
                tagged.addAll(fields);
                yield new TypeDef.ObjectType(tagged);
            }
            case ADJACENT -> TypeDef.object(tagField(tagging, name),
                    Field.of(tagging.content(), new TypeDef.ObjectType(fields)));
            case UNTAGGED -> new TypeDef.ObjectType(fields);
        };
    }

    private static Field tagField(VariantTagging tagging, String name) {
        return Field.of(tagging.tag(), TypeDef.literal(name));
    }
}
