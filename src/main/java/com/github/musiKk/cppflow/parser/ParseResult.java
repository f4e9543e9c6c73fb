package com.github.musiKk.cppflow.parser;

import java.util.List;
import java.util.Optional;

import com.github.musiKk.cppflow.Diagnostic;

/**
 * Outcome of {@link Parser#parseProgram}. The AST is empty only when parsing
 * failed fatally.
 */
public record ParseResult(Optional<CompilationUnit> compilationUnit, List<Diagnostic> diagnostics, Scopes scopes) {

    public boolean isFatal() {
        return compilationUnit.isEmpty();
    }
}
