package com.github.musiKk.cppflow.parser;

import java.util.Optional;

import com.github.musiKk.cppflow.parser.CompilationUnit.Position;

/**
 * Name resolution as seen by the parser. Implementations report their
 * diagnostics to the sink they were created with.
 */
public interface Scopes {

    void enter(String label);

    void exit();

    /**
     * Binds {@code name} in the current scope. A name already bound in the
     * current scope is reported as a redeclaration and the existing entry is
     * returned.
     */
    Entry declare(String name, EntryKind kind, String type, boolean constant, Position position);

    Optional<Entry> lookup(String name);

    /** {@link #lookup(String)}, reporting undeclared and uninitialized names. */
    Optional<Entry> require(String name, Position position);

    /** Reports a read of a variable that has not been assigned yet. */
    void checkInitialized(Entry entry, String name, Position position);

    Entry entry(int handle);

    String render();
}
