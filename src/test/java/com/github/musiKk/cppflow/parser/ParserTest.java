package com.github.musiKk.cppflow.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.cppflow.Tokenizer;
import com.github.musiKk.cppflow.parser.CompilationUnit.BreakStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declaration;
import com.github.musiKk.cppflow.parser.CompilationUnit.DoWhileStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ExpressionStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ForStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.FunctionDefinition;
import com.github.musiKk.cppflow.parser.CompilationUnit.IfStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ReturnStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Statement;
import com.github.musiKk.cppflow.parser.CompilationUnit.WhileStatement;

public class ParserTest {

    private static List<Statement> parseStatements(String code) {
        var result = new Parser(TopLevelMode.STATEMENTS).parseProgram(new Tokenizer().tokenize(code));
        assertEquals(List.of(), result.diagnostics(), code);
        return result.compilationUnit().orElseThrow().statements();
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testExpressionParse(String code, String expected) {
        var statements = parseStatements("int a = 1, b = 2, c = 3; " + code + ";");
        var last = assertInstanceOf(ExpressionStatement.class, statements.get(statements.size() - 1));
        assertEquals(expected, ExpressionPrinter.print(last.expression()));
    }

    private static Object[][] expressions() {
        return new Object[][] {
            { "a + b * c", "a + b * c" },
            { "(a + b) * c", "(a + b) * c" },
            { "a - b - c", "a - b - c" },
            { "a - (b - c)", "a - (b - c)" },
            { "((a))", "a" },
            { "a = b = c", "a = b = c" },
            { "b += c * 2", "b += c * 2" },
            { "a > b && !(a == b) || c", "a > b && !(a == b) || c" },
            { "a++ + --b", "a++ + --b" },
            { "- -a", "-(-a)" },
            { "std::cout << a << std::endl", "std::cout << a << std::endl" },
            { "max(a, b + 1)", "max(a, b + 1)" },
            { "a % 2 == 0", "a % 2 == 0" },
        };
    }

    @ParameterizedTest
    @MethodSource("declarations")
    public void testDeclarationParse(String code, String expected) {
        var statements = parseStatements(code);
        var declaration = assertInstanceOf(Declaration.class, statements.get(0));
        assertEquals(expected, ExpressionPrinter.print(declaration));
    }

    private static Object[][] declarations() {
        return new Object[][] {
            { "int x = 0;", "int x = 0" },
            { "const int k = 5;", "const int k = 5" },
            { "int *p = 0, q[3] = {1, 2, 3};", "int *p = 0, q[3] = {1, 2, 3}" },
            { "unsigned long long big = 1;", "unsigned long long big = 1" },
            { "vector<int> v;", "vector<int> v" },
            { "std::map<string, int> m;", "map<string, int> m" },
            { "double d = 1.5, e;", "double d = 1.5, e" },
        };
    }

    @Test
    public void testDeclaratorTypes() {
        var statements = parseStatements("int *p = 0, q[3] = {1, 2, 3};");
        var declaration = (Declaration) statements.get(0);
        assertEquals("int", declaration.type());
        assertEquals("int*", declaration.declarators().get(0).type());
        assertEquals("int[3]", declaration.declarators().get(1).type());
    }

    @Test
    public void testAutoInfersTypeFromInitializer() {
        var result = new Parser(TopLevelMode.STATEMENTS)
                .parseProgram(new Tokenizer().tokenize("auto d = 1.5; auto n = d * 2; auto s = \"hi\";"));
        assertEquals(List.of(), result.diagnostics());
        assertEquals("double", result.scopes().lookup("d").orElseThrow().type());
        assertEquals("double", result.scopes().lookup("n").orElseThrow().type());
        assertEquals("string", result.scopes().lookup("s").orElseThrow().type());
    }

    @Test
    public void testControlStatements() {
        var statements = parseStatements("""
                int i = 0;
                while (i < 10) i++;
                do { i--; } while (i > 0);
                for (int j = 0; j < 3; j++) { i += j; }
                for (;;) break;
                if (i) i = 1; else { i = 2; }
                """);
        assertEquals(6, statements.size());

        var whileStatement = assertInstanceOf(WhileStatement.class, statements.get(1));
        assertEquals("i < 10", ExpressionPrinter.print(whileStatement.condition()));

        var doWhile = assertInstanceOf(DoWhileStatement.class, statements.get(2));
        assertEquals("i > 0", ExpressionPrinter.print(doWhile.condition()));

        var forStatement = assertInstanceOf(ForStatement.class, statements.get(3));
        assertInstanceOf(Declaration.class, forStatement.init().orElseThrow());
        assertEquals("j < 3", ExpressionPrinter.print(forStatement.condition().orElseThrow()));
        assertEquals("j++", ExpressionPrinter.print(forStatement.update().orElseThrow()));

        var endless = assertInstanceOf(ForStatement.class, statements.get(4));
        assertTrue(endless.init().isEmpty());
        assertTrue(endless.condition().isEmpty());
        assertTrue(endless.update().isEmpty());
        assertInstanceOf(BreakStatement.class, endless.body());

        var ifStatement = assertInstanceOf(IfStatement.class, statements.get(5));
        assertInstanceOf(ExpressionStatement.class, ifStatement.thenBranch());
        assertTrue(ifStatement.elseBranch().isPresent());
    }

    @Test
    public void testFunctions() {
        var statements = parseStatements("""
                int add(int a, int b);
                int add(int a, int b) { return a + b; }
                void noop(void) {}
                int main() { int r = add(1, 2); noop(); return r; }
                """);
        assertEquals(4, statements.size());

        var prototype = assertInstanceOf(FunctionDefinition.class, statements.get(0));
        assertTrue(prototype.body().isEmpty());
        var add = assertInstanceOf(FunctionDefinition.class, statements.get(1));
        assertEquals("int add(int a, int b)", ExpressionPrinter.signature(add));
        var ret = assertInstanceOf(ReturnStatement.class, add.body().orElseThrow().statements().get(0));
        assertEquals("a + b", ExpressionPrinter.print(ret.value().orElseThrow()));

        var noop = (FunctionDefinition) statements.get(2);
        assertEquals(List.of(), noop.parameters());
        assertFalse(noop.isMain());
        assertTrue(((FunctionDefinition) statements.get(3)).isMain());
    }

    @Test
    public void testStrictMainProgram() {
        var code = """
                #include <iostream>
                using namespace std;

                int main() {
                    int x = 0;
                    cout << x << endl;
                    return 0;
                }
                """;
        var result = new Parser().parseProgram(new Tokenizer().tokenize(code));
        assertEquals(List.of(), result.diagnostics());

        var statements = result.compilationUnit().orElseThrow().statements();
        assertEquals(1, statements.size());
        var main = assertInstanceOf(FunctionDefinition.class, statements.get(0));
        assertTrue(main.isMain());
        assertEquals(3, main.body().orElseThrow().statements().size());
        assertEquals(EntryKind.FUNC, result.scopes().lookup("main").orElseThrow().kind());
    }

    @Test
    public void testAstRendering() {
        var statements = parseStatements("int x = 1; if (x > 0) { x = 2; } else x = 3;");
        var expected = """
                Program
                ├── Declaration int
                │   └── Declarator x : int
                │       └── Literal number 1
                └── If
                    ├── condition
                    │   └── Binary >
                    │       ├── Identifier x
                    │       └── Literal number 0
                    ├── then
                    │   └── Block
                    │       └── ExpressionStatement
                    │           └── Assign =
                    │               ├── Identifier x
                    │               └── Literal number 2
                    └── else
                        └── ExpressionStatement
                            └── Assign =
                                ├── Identifier x
                                └── Literal number 3
                """;
        assertEquals(expected, AstPrinter.render(new CompilationUnit(statements)));
    }

}
