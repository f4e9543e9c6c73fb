package com.github.musiKk.cppflow.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.cppflow.Diagnostic;
import com.github.musiKk.cppflow.Tokenizer;
import com.github.musiKk.cppflow.parser.CompilationUnit.AssignmentExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.Block;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declaration;
import com.github.musiKk.cppflow.parser.CompilationUnit.DoWhileStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ExpressionStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.FunctionDefinition;

public class ParserDiagnosticsTest {

    private static ParseResult lenient(String code) {
        return new Parser(TopLevelMode.STATEMENTS).parseProgram(new Tokenizer().tokenize(code));
    }

    private static ParseResult strict(String code) {
        return new Parser().parseProgram(new Tokenizer().tokenize(code));
    }

    @ParameterizedTest
    @MethodSource("diagnostics")
    public void testDiagnostics(String code, List<Diagnostic> expected) {
        var result = lenient(code);
        assertTrue(result.compilationUnit().isPresent(), "only internal errors are fatal");
        assertEquals(expected, result.diagnostics());
    }

    private static Object[][] diagnostics() {
        return new Object[][] {
            {
                "const int x = 1; x = 2;",
                List.of(new Diagnostic(1, 18, "cannot assign to const variable 'x'"))
            }, {
                "const int c = 1; c++;",
                List.of(new Diagnostic(1, 18, "cannot increment/decrement const variable 'c'"))
            }, {
                "const int k;",
                List.of(new Diagnostic(1, 11, "const variable 'k' must be initialized"))
            }, {
                "int n = \"text\";",
                List.of(new Diagnostic(1, 5, "type mismatch: cannot initialize 'n' of type 'int' with 'string'"))
            }, {
                "string s = \"a\"; int n = 0; n = s;",
                List.of(new Diagnostic(1, 30, "type mismatch: cannot assign 'string' to 'int'"))
            }, {
                "x = 1;",
                List.of(new Diagnostic(1, 1, "undeclared identifier 'x'"))
            }, {
                "foo(1);",
                List.of(new Diagnostic(1, 1, "undeclared identifier 'foo'"))
            }, {
                "int a = 1; int a = 2;",
                List.of(new Diagnostic(1, 16, "redeclaration of 'a' in the same scope"))
            }, {
                "int a = 1; { int a = 2; }",
                List.of()
            }, {
                "break;",
                List.of(new Diagnostic(1, 1, "'break' outside of a loop"))
            }, {
                "continue;",
                List.of(new Diagnostic(1, 1, "'continue' outside of a loop"))
            }, {
                "while (true) { if (true) break; else continue; }",
                List.of()
            }, {
                "int x; x += 1;",
                List.of(new Diagnostic(1, 8, "use of uninitialized variable 'x'"))
            }, {
                "int n; cin >> n; int m = n;",
                List.of()
            }, {
                "int x; scanf(\"%d\", &x); int y = x;",
                List.of()
            }, {
                "int arr[3]; arr[0] = 1; int first = arr[0];",
                List.of()
            }, {
                "int x = 1; 3 = x;",
                List.of(new Diagnostic(1, 14, "left-hand side of '=' is not assignable"))
            }, {
                "int x = ;",
                List.of(new Diagnostic(1, 9, "expected expression, found ';'"))
            }, {
                "const 5;",
                List.of(new Diagnostic(1, 1, "expected type after 'const'"))
            }, {
                "switch (x) {}",
                List.of(new Diagnostic(1, 1, "'switch' statements are not supported"))
            }, {
                "int x = 0; }",
                List.of(new Diagnostic(1, 12, "unexpected '}'"))
            }, {
                "int x = 0; x += \"abc\";",
                List.of(new Diagnostic(1, 14, "type mismatch: cannot assign 'string' to 'int'"))
            }, {
                "string s = \"ab\"; s += 'c'; s += \"d\"; double d = 1.5; d *= 2;",
                List.of()
            }, {
                "auto a;",
                List.of(new Diagnostic(1, 6, "'auto' variable 'a' requires an initializer"))
            }, {
                "{ int f() { return 1; } }",
                List.of(new Diagnostic(1, 7, "function definition is not allowed here"))
            }, {
                "{ int g(int); }",
                List.of()
            }, {
                "int max = 3; void swap(int a, int b) { } int y = max;",
                List.of()
            },
        };
    }

    @Test
    public void testUninitializedUseStillYieldsAssignment() {
        var result = lenient("int y = 0; int x; y = x;");
        assertEquals(List.of(new Diagnostic(1, 23, "use of uninitialized variable 'x'")), result.diagnostics());

        var statements = result.compilationUnit().orElseThrow().statements();
        var statement = assertInstanceOf(ExpressionStatement.class, statements.get(2));
        var assignment = assertInstanceOf(AssignmentExpression.class, statement.expression());
        assertEquals("y = x", ExpressionPrinter.print(assignment));
    }

    @Test
    public void testConstViolationKeepsVariableInitialized() {
        var result = lenient("const int x = 1; x = 2; int y = x;");
        assertEquals(1, result.diagnostics().size());
        var entry = result.scopes().lookup("x").orElseThrow();
        assertTrue(entry.initialized());
        assertTrue(entry.constant());
    }

    @Test
    public void testMissingSemicolonIsReportedOnce() {
        var result = lenient("int x = 1\nint y = 2;");
        assertEquals(List.of(new Diagnostic(2, 1, "expected ';' after declaration of 'x', found 'int'")), result.diagnostics());
        var statements = result.compilationUnit().orElseThrow().statements();
        assertEquals(2, statements.size());
        assertInstanceOf(Declaration.class, statements.get(1));
    }

    @Test
    public void testRecoverySkipsToStatementBoundary() {
        var result = lenient("int x = 0, y = 0; x = 1 y = 2; y = x;");
        assertEquals(List.of(new Diagnostic(1, 25, "expected ';' after expression, found 'y'")), result.diagnostics());
        assertEquals(3, result.compilationUnit().orElseThrow().statements().size());
    }

    @Test
    public void testMissingClosingBraceAtEndOfInput() {
        var result = lenient("while (true) { int x = 0;");
        assertEquals(List.of(new Diagnostic(1, 26, "expected '}' to close block, found end of input")), result.diagnostics());
    }

    @Test
    public void testStrictModeRequiresMain() {
        assertEquals(List.of(Diagnostic.unpositioned("expected 'int main()' entry point")),
                strict("#include <iostream>\nusing namespace std;\n").diagnostics());
        assertEquals(List.of(new Diagnostic(1, 1, "code outside 'int main()' is not allowed")),
                strict("int x = 0;").diagnostics());
    }

    @Test
    public void testStrictModeRejectsCodeAfterMain() {
        var result = strict("int main() { return 0; } int y;");
        assertEquals(List.of(new Diagnostic(1, 26, "code outside 'int main()' is not allowed")), result.diagnostics());
        var statements = result.compilationUnit().orElseThrow().statements();
        assertEquals(1, statements.size());
        assertTrue(((FunctionDefinition) statements.get(0)).isMain());
    }

    @Test
    public void testUserDeclarationsShadowLibraryNames() {
        var result = lenient("int max = 3; void swap(int a, int b) { } int y = max;");
        assertEquals(List.of(), result.diagnostics());

        var max = result.scopes().lookup("max").orElseThrow();
        assertEquals(EntryKind.VAR, max.kind());
        assertEquals("int", max.type());
        assertEquals(EntryKind.STD, result.scopes().entry(max.shadowed().getAsInt()).kind());
        assertEquals(EntryKind.FUNC, result.scopes().lookup("swap").orElseThrow().kind());

        var statements = result.compilationUnit().orElseThrow().statements();
        assertInstanceOf(FunctionDefinition.class, statements.get(1));
    }

    @Test
    public void testNestedFunctionDefinitionIsDropped() {
        var result = strict("int main() { int x = 0; do { int f() { return 1; } x++; } while (x < 3); return 0; }");
        assertEquals(List.of(new Diagnostic(1, 34, "function definition is not allowed here")), result.diagnostics());

        var main = (FunctionDefinition) result.compilationUnit().orElseThrow().statements().get(0);
        var doWhile = assertInstanceOf(DoWhileStatement.class, main.body().orElseThrow().statements().get(1));
        var body = assertInstanceOf(Block.class, doWhile.body());
        assertEquals(2, body.statements().size());
        assertEquals(Block.empty(), body.statements().get(0));
        var increment = assertInstanceOf(ExpressionStatement.class, body.statements().get(1));
        assertEquals("x++", ExpressionPrinter.print(increment.expression()));
    }

    @Test
    public void testInternalErrorIsFatal() {
        var parser = new Parser(TopLevelMode.STATEMENTS, reporter -> new ScopeTree(reporter) {
            @Override
            public void enter(String label) {
                throw new IllegalStateException("boom");
            }
        });
        var result = parser.parseProgram(new Tokenizer().tokenize("int x = 0; { x = 1; }"));
        assertTrue(result.isFatal());
        assertEquals(List.of(Diagnostic.unpositioned("internal parser error: boom")), result.diagnostics());
    }

}
