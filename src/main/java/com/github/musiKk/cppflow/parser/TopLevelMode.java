package com.github.musiKk.cppflow.parser;

/** What the parser accepts outside of any function body. */
public enum TopLevelMode {
    /** Preprocessor lines and {@code using} declarations, then exactly one {@code int main()}. */
    STRICT_MAIN,
    /** Any sequence of statements and function definitions. */
    STATEMENTS;

    public static TopLevelMode fromConfig(String value) {
        return switch (value.strip().toLowerCase()) {
            case "strict" -> STRICT_MAIN;
            case "lenient" -> STATEMENTS;
            default -> throw new IllegalArgumentException("unknown top level mode '" + value + "', expected strict or lenient");
        };
    }
}
