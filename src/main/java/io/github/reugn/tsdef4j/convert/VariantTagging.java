package io.github.reugn.tsdef4j.convert;

import io.github.reugn.tsdef4j.descriptor.ContainerAttributes;

/**
 * How a variant set encodes which variant a value holds.
 *
 * @param policy  the encoding policy
 * @param tag     the discriminant field name; {@code null} for {@link Policy#UNTAGGED}
 * @param content the payload field name; only set for {@link Policy#ADJACENT}
 */
public record VariantTagging(Policy policy, String tag, String content) {

    /** Discriminant field name used when none is configured. */
    public static final String DEFAULT_TAG = "type";

    /** Payload field name of internally tagged tuple-shaped variants. */
    public static final String VALUE_FIELD = "value";

    public enum Policy {
        INTERNAL,
        ADJACENT,
        UNTAGGED
    }

    /**
     * Selects the tagging policy from container attributes: {@code untagged} wins, then a
     * {@code content} field selects adjacent tagging, otherwise internal tagging.
     */
    public static VariantTagging from(ContainerAttributes attributes) {
        if (attributes.untagged()) {
            return new VariantTagging(Policy.UNTAGGED, null, null);
        }
        String tag = attributes.tag() != null ? attributes.tag() : DEFAULT_TAG;
        if (attributes.content() != null) {
            return new VariantTagging(Policy.ADJACENT, tag, attributes.content());
        }
        return new VariantTagging(Policy.INTERNAL, tag, null);
    }
}
