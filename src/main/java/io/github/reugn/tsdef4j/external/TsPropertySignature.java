package io.github.reugn.tsdef4j.external;

import java.util.Objects;

/**
 * A property signature such as {@code readonly id?: string}.
 *
 * @param key      the property key text
 * @param computed {@code true} if the key is a computed expression ({@code [k]: T})
 * @param type     the annotated type, or {@code null} if unannotated
 * @param optional {@code true} for {@code ?} properties
 * @param readonly {@code true} for {@code readonly} properties
 */
public record TsPropertySignature(String key, boolean computed, TsTypeNode type, boolean optional,
                                  boolean readonly) implements TsTypeElement {

    public TsPropertySignature {
        Objects.requireNonNull(key, "key");
    }

    public static TsPropertySignature of(String key, TsTypeNode type) {
        return new TsPropertySignature(key, false, type, false, false);
    }

    public static TsPropertySignature optional(String key, TsTypeNode type) {
        return new TsPropertySignature(key, false, type, true, false);
    }
}
