package com.github.musiKk.cppflow;

public enum Severity {
    ERROR, WARNING;

    // uninitialized reads are warnings, everything else is an error
    public static Severity of(Diagnostic diagnostic) {
        return diagnostic.message().contains("uninitialized variable") ? WARNING : ERROR;
    }

    public String label() {
        return name().toLowerCase();
    }
}
