package com.github.musiKk.cppflow.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import com.github.musiKk.cppflow.Diagnostic;
import com.github.musiKk.cppflow.Tokenizer;
import com.github.musiKk.cppflow.parser.CompilationUnit.Position;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Tree of lexical scopes. The parser walks it with {@link #enter(String)} and
 * {@link #exit()}; scopes are never removed, so the finished tree records
 * every scope the program opened.
 */
public class ScopeTree implements Scopes {

    static final Set<String> LIBRARY_NAMES = Set.of(
            "nullptr", "NULL", "printf", "scanf", "puts", "gets", "getline", "getchar", "putchar",
            "sqrt", "pow", "abs", "max", "min", "swap", "sort", "rand", "srand", "exit", "strlen");

    private final Consumer<Diagnostic> reporter;
    private final List<Entry> entries = new ArrayList<>();
    private final Deque<ScopeNode> path = new ArrayDeque<>();

    @Getter
    @Accessors(fluent = true)
    private final ScopeNode root;

    public ScopeTree(Consumer<Diagnostic> reporter) {
        this.reporter = Objects.requireNonNull(reporter);
        this.root = new ScopeNode(null, "global");
        path.push(root);

        Tokenizer.STD_NAMES.stream().sorted()
                .forEach(name -> declare(name, EntryKind.STD, "std", false, Position.NONE));
        LIBRARY_NAMES.stream().sorted()
                .forEach(name -> declare(name, EntryKind.STD, "unknown", false, Position.NONE));
    }

    public ScopeNode current() {
        return path.peek();
    }

    @Override
    public void enter(String label) {
        path.push(current().newChild(label));
    }

    @Override
    public void exit() {
        if (path.size() == 1) {
            throw new IllegalStateException("cannot exit the global scope");
        }
        path.pop();
    }

    @Override
    public Entry declare(String name, EntryKind kind, String type, boolean constant, Position position) {
        var scope = current();
        var existing = scope.binding(name);
        if (existing.isPresent()) {
            var previous = entries.get(existing.getAsInt());
            // a user declaration replaces a library binding and shadows it
            if (!previous.kind().isBuiltin() || kind.isBuiltin()) {
                report(position, "redeclaration of '" + name + "' in the same scope");
                return previous;
            }
        }

        int shadowed = lookup(name).map(Entry::handle).orElse(Entry.NONE);
        var entry = new Entry(entries.size(), name, kind, type, scope.depth(), shadowed, constant, position);
        entry.initialized(kind.isBuiltin());
        entries.add(entry);
        scope.bind(name, entry.handle());
        return entry;
    }

    @Override
    public Optional<Entry> lookup(String name) {
        for (var scope = current(); scope != null; scope = scope.parent()) {
            var handle = scope.binding(name);
            if (handle.isPresent()) {
                return Optional.of(entries.get(handle.getAsInt()));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Entry> require(String name, Position position) {
        var entry = lookup(name);
        if (entry.isEmpty()) {
            report(position, "undeclared identifier '" + name + "'");
        } else {
            checkInitialized(entry.get(), name, position);
        }
        return entry;
    }

    @Override
    public void checkInitialized(Entry entry, String name, Position position) {
        if (!entry.initialized() && !entry.kind().isBuiltin()) {
            report(position, "use of uninitialized variable '" + name + "'");
        }
    }

    @Override
    public Entry entry(int handle) {
        return entries.get(handle);
    }

    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    private void report(Position position, String message) {
        reporter.accept(new Diagnostic(position.line(), position.column(), message));
    }

    @Override
    public String render() {
        var sb = new StringBuilder();
        render(root, 0, sb);
        return sb.toString();
    }

    private void render(ScopeNode scope, int indent, StringBuilder sb) {
        // an empty scope wrapping a single block shows the block's content under its own label
        var content = scope;
        while (content.bindings().isEmpty() && content.children().size() == 1
                && content.children().get(0).label().equals("block")) {
            content = content.children().get(0);
        }

        String pad = "  ".repeat(indent);
        sb.append(pad).append("[Scope Depth=").append(scope.depth()).append(' ').append(scope.label()).append("]\n");

        int builtins = 0;
        for (var handle : content.bindings().values()) {
            var entry = entries.get(handle);
            if (entry.kind().isBuiltin()) {
                builtins++;
                continue;
            }
            sb.append(pad).append(" - #").append(handle).append(' ').append(entry.describe()).append('\n');
        }
        if (builtins > 0) {
            sb.append(pad).append(" - (").append(builtins).append(" builtins)\n");
        }
        for (var child : content.children()) {
            render(child, indent + 1, sb);
        }
    }
}
