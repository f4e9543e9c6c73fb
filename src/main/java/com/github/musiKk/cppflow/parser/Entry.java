package com.github.musiKk.cppflow.parser;

import java.util.OptionalInt;

import com.github.musiKk.cppflow.parser.CompilationUnit.Position;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * One declared name. Entries live in the arena of a {@link ScopeTree} and are
 * addressed by {@link #handle()}; the shadowed entry is referenced by handle
 * as well, never directly.
 */
@ToString
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public class Entry {

    static final int NONE = -1;

    private final int handle;
    private final String name;
    private final EntryKind kind;
    private final String type;
    private final int scopeDepth;
    @Getter(AccessLevel.NONE)
    private final int shadowed;
    private final boolean constant;
    private final Position declaredAt;

    @Setter
    private boolean initialized;

    public OptionalInt shadowed() {
        return shadowed == NONE ? OptionalInt.empty() : OptionalInt.of(shadowed);
    }

    String describe() {
        var sb = new StringBuilder()
                .append(kind.label()).append(' ')
                .append(constant ? "const " : "")
                .append(type).append(' ').append(name);
        if (!kind.isBuiltin()) {
            sb.append(initialized ? " (initialized)" : " (uninitialized)");
        }
        if (shadowed != NONE) {
            sb.append(" shadows #").append(shadowed);
        }
        return sb.toString();
    }
}
