package io.github.reugn.tsdef4j.ir;

import java.util.Objects;

/**
 * A TypeScript literal type value: a string, a number or a boolean.
 */
public sealed interface Literal permits Literal.StringLiteral, Literal.NumberLiteral, Literal.BooleanLiteral {

    static Literal of(String value) {
        return new StringLiteral(value);
    }

    static Literal of(double value) {
        return new NumberLiteral(value);
    }

    static Literal of(boolean value) {
        return new BooleanLiteral(value);
    }

    record StringLiteral(String value) implements Literal {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * A numeric literal; TypeScript has no literal type for {@code NaN} or the infinities.
     */
    record NumberLiteral(double value) implements Literal {
        public NumberLiteral {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Numeric literal must be finite, got " + value);
            }
        }
    }

    record BooleanLiteral(boolean value) implements Literal {
    }
}
