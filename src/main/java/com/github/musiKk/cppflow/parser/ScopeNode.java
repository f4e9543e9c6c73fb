package com.github.musiKk.cppflow.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public class ScopeNode {

    private final ScopeNode parent;
    private final int depth;
    private final String label;
    private final List<ScopeNode> children = new ArrayList<>();
    // name -> entry handle
    private final Map<String, Integer> bindings = new LinkedHashMap<>();

    ScopeNode(ScopeNode parent, String label) {
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.label = label;
    }

    ScopeNode newChild(String label) {
        var child = new ScopeNode(this, label);
        children.add(child);
        return child;
    }

    OptionalInt binding(String name) {
        var handle = bindings.get(name);
        return handle == null ? OptionalInt.empty() : OptionalInt.of(handle);
    }

    void bind(String name, int handle) {
        bindings.put(name, handle);
    }

    public List<ScopeNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Map<String, Integer> bindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
