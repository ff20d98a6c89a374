package io.github.reugn.tsdef4j.convert;

import java.util.List;

/**
 * A template pattern split into literal parts and placeholder type expressions.
 *
 * <p>{@code strings} always holds exactly one more element than {@code types}: literal parts
 * surround every placeholder, empty where two placeholders touch or at either end.
 *
 * @param strings the literal parts, in order
 * @param types   the placeholder bodies, in order
 */
public record ParsedPattern(List<String> strings, List<String> types) {

    public ParsedPattern {
        strings = List.copyOf(strings);
        types = List.copyOf(types);
        if (strings.size() != types.size() + 1) {
            throw new IllegalArgumentException("Pattern needs " + (types.size() + 1) + " literal parts, got "
                    + strings.size());
        }
    }
}
