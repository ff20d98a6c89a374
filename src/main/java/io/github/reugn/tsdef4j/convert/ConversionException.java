package io.github.reugn.tsdef4j.convert;

import java.util.Objects;

/**
 * Raised when a source descriptor cannot be converted to the type IR.
 *
 * <p>A conversion failure aborts the conversion of a single type; nothing is registered for
 * it, and other types are unaffected.
 */
public final class ConversionException extends RuntimeException {

    /**
     * Categories of conversion failures.
     */
    public enum ErrorKind {
        /** A variant set without (non-skipped) variants. */
        EMPTY_VARIANT_SET,
        /** A declaration shape the target syntax cannot express. */
        UNSUPPORTED_TARGET,
        /** An {@code index} attribute without {@code key}, or the reverse. */
        UNPAIRED_INDEX_KEY,
        /** A rename-all token that names no known case policy. */
        UNKNOWN_RENAME_RULE,
        /** A template pattern containing {@code ${}}. */
        EMPTY_PLACEHOLDER,
        /** A template pattern whose placeholder is never closed. */
        UNTERMINATED_PLACEHOLDER,
        /** A flattened member whose type is not an object type. */
        FLATTEN_NON_OBJECT
    }

    private final ErrorKind kind;

    public ConversionException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ConversionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
