package io.github.reugn.tsdef4j.ir;

/**
 * The closed set of TypeScript primitive type keywords.
 */
public enum Primitive {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    NULL("null"),
    UNDEFINED("undefined"),
    VOID("void"),
    NEVER("never"),
    ANY("any"),
    UNKNOWN("unknown"),
    BIGINT("bigint");

    private final String keyword;

    Primitive(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the TypeScript keyword for this primitive.
     *
     * @return the keyword, e.g. {@code "string"}
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a primitive by its TypeScript keyword.
     *
     * @param keyword the keyword to look up
     * @return the matching primitive, or {@code null} if the keyword is not a primitive
     */
    public static Primitive fromKeyword(String keyword) {
        for (Primitive primitive : values()) {
            if (primitive.keyword.equals(keyword)) {
                return primitive;
            }
        }
        return null;
    }
}
