package com.github.musiKk.cppflow.parser;

public enum EntryKind {
    VAR, FUNC, PARAM, TYPE, STD;

    /** Builtins need no explicit initialization. */
    public boolean isBuiltin() {
        return this == TYPE || this == STD;
    }

    public String label() {
        return name().toLowerCase();
    }
}
