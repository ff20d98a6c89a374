package io.github.reugn.tsdef4j.convert;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits template patterns such as {@code v${number}.${number}} into literal parts and
 * placeholder types.
 *
 * <p>Placeholder bodies may contain their own braces ({@code ${{ a: string }}}); the scanner
 * tracks nesting depth to find the matching close brace.
 */
public final class PatternParser {

    private PatternParser() {
    }

    /**
     * Parses a template pattern.
     *
     * @param pattern the pattern text
     * @return the literal parts and placeholder bodies
     * @throws ConversionException with {@code EMPTY_PLACEHOLDER} for a {@code ${}} placeholder,
     *                             or {@code UNTERMINATED_PLACEHOLDER} if a placeholder is not closed
     */
    public static ParsedPattern parse(String pattern) {
        List<String> strings = new ArrayList<>();
        List<String> types = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '$' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '{') {
                strings.add(literal.toString());
                literal.setLength(0);

                int start = i + 2;
                int depth = 1;
                int j = start;
                while (j < pattern.length() && depth > 0) {
                    char inner = pattern.charAt(j);
                    if (inner == '{') {
                        depth++;
                    } else if (inner == '}') {
                        depth--;
                    }
                    j++;
                }
                if (depth > 0) {
                    throw new ConversionException(ConversionException.ErrorKind.UNTERMINATED_PLACEHOLDER,
                            "Unterminated placeholder at index " + i + " in pattern '" + pattern + "'");
                }
                String body = pattern.substring(start, j - 1).trim();
                if (body.isEmpty()) {
                    throw new ConversionException(ConversionException.ErrorKind.EMPTY_PLACEHOLDER,
                            "Empty placeholder at index " + i + " in pattern '" + pattern + "'");
                }
                types.add(body);
                i = j;
            } else {
                literal.append(c);
                i++;
            }
        }
        strings.add(literal.toString());
        return new ParsedPattern(strings, types);
    }
}
