package com.github.musiKk.cppflow.flowchart;

public enum NodeShape {
    TERMINATOR("([", "])"),
    PROCESS("[\"", "\"]"),
    IO("[/", "/]"),
    DECISION("{", "}");

    private final String open;
    private final String close;

    NodeShape(String open, String close) {
        this.open = open;
        this.close = close;
    }

    String wrap(String escapedLabel) {
        return open + escapedLabel + close;
    }
}
