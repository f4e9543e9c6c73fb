package com.github.musiKk.cppflow;

import com.github.musiKk.cppflow.Tokenizer.Token;

/**
 * A problem found while translating, anchored at a 1-based source position.
 * The position is {@code (-1, -1)} when no location applies.
 */
public record Diagnostic(int line, int column, String message) {

    public static final int NO_POSITION = -1;

    public static Diagnostic at(Token token, String message) {
        return new Diagnostic(token.line(), token.column(), message);
    }

    public static Diagnostic unpositioned(String message) {
        return new Diagnostic(NO_POSITION, NO_POSITION, message);
    }

    public boolean hasPosition() {
        return line != NO_POSITION;
    }

    public String format() {
        return hasPosition() ? "[" + line + ":" + column + "] " + message : message;
    }
}
