package io.github.reugn.tsdef4j.convert;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Case conversion policies for member and variant names.
 *
 * <p>Every policy works on the snake_case normalization of the input: the name is split into
 * lowercase words at underscores, hyphens and uppercase transitions, and the words are joined
 * in the target style.
 *
 * <table border="1">
 *   <caption>Policies applied to {@code user_id}</caption>
 *   <tr><th>Token</th><th>Result</th></tr>
 *   <tr><td>{@code camelCase}</td><td>{@code userId}</td></tr>
 *   <tr><td>{@code PascalCase}</td><td>{@code UserId}</td></tr>
 *   <tr><td>{@code snake_case}</td><td>{@code user_id}</td></tr>
 *   <tr><td>{@code SCREAMING_SNAKE_CASE}</td><td>{@code USER_ID}</td></tr>
 *   <tr><td>{@code kebab-case}</td><td>{@code user-id}</td></tr>
 *   <tr><td>{@code SCREAMING-KEBAB-CASE}</td><td>{@code USER-ID}</td></tr>
 * </table>
 */
public enum RenameRule {

    CAMEL_CASE("camelCase") {
        @Override
        String join(List<String> words) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < words.size(); i++) {
                sb.append(i == 0 ? words.get(i) : capitalize(words.get(i)));
            }
            return sb.toString();
        }
    },
    PASCAL_CASE("PascalCase") {
        @Override
        String join(List<String> words) {
            return words.stream().map(RenameRule::capitalize).collect(Collectors.joining());
        }
    },
    SNAKE_CASE("snake_case") {
        @Override
        String join(List<String> words) {
            return String.join("_", words);
        }
    },
    SCREAMING_SNAKE_CASE("SCREAMING_SNAKE_CASE") {
        @Override
        String join(List<String> words) {
            return String.join("_", words).toUpperCase(Locale.ROOT);
        }
    },
    KEBAB_CASE("kebab-case") {
        @Override
        String join(List<String> words) {
            return String.join("-", words);
        }
    },
    SCREAMING_KEBAB_CASE("SCREAMING-KEBAB-CASE") {
        @Override
        String join(List<String> words) {
            return String.join("-", words).toUpperCase(Locale.ROOT);
        }
    };

    private final String token;

    RenameRule(String token) {
        this.token = token;
    }

    /**
     * Returns the attribute token selecting this policy, e.g. {@code camelCase}.
     */
    public String token() {
        return token;
    }

    /**
     * Looks up a policy by its token.
     *
     * @param token the token as written in a {@code renameAll} attribute
     * @return the matching policy
     * @throws ConversionException with {@link ConversionException.ErrorKind#UNKNOWN_RENAME_RULE}
     *                             if no policy matches
     */
    public static RenameRule fromToken(String token) {
        for (RenameRule rule : values()) {
            if (rule.token.equals(token)) {
                return rule;
            }
        }
        throw new ConversionException(ConversionException.ErrorKind.UNKNOWN_RENAME_RULE,
                "Unknown rename rule '" + token + "'; expected one of "
                        + Arrays.stream(values()).map(RenameRule::token).collect(Collectors.joining(", ")));
    }

    /**
     * Applies this policy to a name.
     */
    public String apply(String name) {
        List<String> words = words(name);
        if (words.isEmpty()) {
            return name;
        }
        return join(words);
    }

    abstract String join(List<String> words);

    /**
     * Splits a name into lowercase words.
     *
     * <p>{@code userId}, {@code UserId}, {@code user_id} and {@code USER_ID} all yield
     * {@code [user, id]}; an uppercase run followed by a lowercase letter ends one word before
     * the last capital, so {@code HTTPServer} yields {@code [http, server]}.
     */
    static List<String> words(String name) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_' || c == '-') {
                flush(words, current);
                continue;
            }
            if (Character.isUpperCase(c) && current.length() > 0) {
                char prev = name.charAt(i - 1);
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (!Character.isUpperCase(prev) || nextLower) {
                    flush(words, current);
                }
            }
            current.append(Character.toLowerCase(c));
        }
        flush(words, current);
        return words;
    }

    private static void flush(List<String> words, StringBuilder current) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
