package io.github.reugn.tsdef4j.descriptor;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One variant of a variant set.
 *
 * @param name       the source variant name
 * @param shape      the payload shape
 * @param members    payload members; empty for unit variants
 * @param attributes conversion attributes
 */
public record VariantDescriptor(String name, VariantShape shape, List<MemberDescriptor> members,
                                VariantAttributes attributes) {

    public VariantDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shape, "shape");
        members = List.copyOf(members);
        attributes = attributes == null ? VariantAttributes.none() : attributes;
    }

    public static VariantDescriptor unit(String name) {
        return new VariantDescriptor(name, VariantShape.UNIT, List.of(), VariantAttributes.none());
    }

    public static VariantDescriptor tuple(String name, MemberType... types) {
        return new VariantDescriptor(name, VariantShape.TUPLE,
                Arrays.stream(types).map(MemberDescriptor::positional).toList(),
                VariantAttributes.none());
    }

    public static VariantDescriptor record(String name, List<MemberDescriptor> members) {
        return new VariantDescriptor(name, VariantShape.RECORD, members, VariantAttributes.none());
    }

    public VariantDescriptor withAttributes(VariantAttributes newAttributes) {
        return new VariantDescriptor(name, shape, members, newAttributes);
    }
}
