package com.github.musiKk.cppflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.cppflow.Tokenizer.Token;
import com.github.musiKk.cppflow.Tokenizer.TokenType;

public class TokenizerTest {

    @ParameterizedTest
    @MethodSource("tokenTypes")
    public void testTokenTypes(String code, List<TokenType> expected) {
        var tokens = new Tokenizer().tokenize(code);
        var types = tokens.tokens().stream().map(Token::type).toList();
        assertEquals(expected, types);
        assertEquals(List.of(), tokens.diagnostics());
    }

    private static Object[][] tokenTypes() {
        return new Object[][] {
            {
                "int x = 0;",
                List.of(TokenType.INT, TokenType.IDENTIFIER, TokenType.EQUALS, TokenType.NUMBER, TokenType.SEMICOLON, TokenType.EOF)
            }, {
                "x += 1; y <= z >> 2",
                List.of(TokenType.IDENTIFIER, TokenType.PLUS_EQUALS, TokenType.NUMBER, TokenType.SEMICOLON,
                        TokenType.IDENTIFIER, TokenType.LE, TokenType.IDENTIFIER, TokenType.SHIFT_RIGHT,
                        TokenType.NUMBER, TokenType.EOF)
            }, {
                "std::cout << x;",
                List.of(TokenType.STD_IDENTIFIER, TokenType.COLON_COLON, TokenType.STD_IDENTIFIER,
                        TokenType.SHIFT_LEFT, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF)
            }, {
                "a && b or not c",
                List.of(TokenType.IDENTIFIER, TokenType.AND_AND, TokenType.IDENTIFIER, TokenType.OR_OR,
                        TokenType.BANG, TokenType.IDENTIFIER, TokenType.EOF)
            }, {
                "p->next; i++; --j",
                List.of(TokenType.IDENTIFIER, TokenType.ARROW, TokenType.IDENTIFIER, TokenType.SEMICOLON,
                        TokenType.IDENTIFIER, TokenType.PLUS_PLUS, TokenType.SEMICOLON,
                        TokenType.MINUS_MINUS, TokenType.IDENTIFIER, TokenType.EOF)
            }, {
                "x / y // trailing comment\n/* block */ z",
                List.of(TokenType.IDENTIFIER, TokenType.SLASH, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF)
            }, {
                "#include <iostream>\nusing namespace std;",
                List.of(TokenType.PREPROCESSOR, TokenType.USING, TokenType.NAMESPACE, TokenType.STD_IDENTIFIER,
                        TokenType.SEMICOLON, TokenType.EOF)
            }, {
                "\"a \\\" b\" 'c' true",
                List.of(TokenType.STRING, TokenType.CHAR_LITERAL, TokenType.TRUE, TokenType.EOF)
            }, {
                "const unsigned long v[3]",
                List.of(TokenType.CONST, TokenType.UNSIGNED, TokenType.LONG, TokenType.IDENTIFIER,
                        TokenType.LBRACKET, TokenType.NUMBER, TokenType.RBRACKET, TokenType.EOF)
            }
        };
    }

    @ParameterizedTest
    @MethodSource("numbers")
    public void testNumberImages(String code) {
        var tokens = new Tokenizer().tokenize(code);
        assertEquals(TokenType.NUMBER, tokens.peek().type());
        assertEquals(code, tokens.peek().image());
        assertEquals(List.of(), tokens.diagnostics());
    }

    private static String[] numbers() {
        return new String[] { "42", "3.14", "1e10", "2.5E-3", "0x1F", "0b101", "10UL", "1.0f" };
    }

    @Test
    public void testPositions() {
        var tokens = new Tokenizer().tokenize("int x;\n  x = 1;");
        var list = tokens.tokens();
        assertEquals(new Token(TokenType.INT, "int", 1, 1), list.get(0));
        assertEquals(new Token(TokenType.IDENTIFIER, "x", 1, 5), list.get(1));
        assertEquals(new Token(TokenType.IDENTIFIER, "x", 2, 3), list.get(3));
        assertEquals(new Token(TokenType.NUMBER, "1", 2, 7), list.get(5));
    }

    @Test
    public void testLexicalErrorsAreRecordedAndScanningContinues() {
        var tokens = new Tokenizer().tokenize("int a = 12ab;\nstring s = \"open\nint b = 1;");
        assertEquals(List.of(
                new Diagnostic(1, 9, "malformed numeric literal '12ab'"),
                new Diagnostic(2, 12, "unterminated string literal")),
                tokens.diagnostics());
        var last = tokens.tokens().get(tokens.tokens().size() - 2);
        assertEquals(TokenType.SEMICOLON, last.type());
        assertEquals(3, last.line());
    }

    @Test
    public void testUnexpectedCharacter() {
        var tokens = new Tokenizer().tokenize("int a = 1 @ 2;");
        assertEquals(List.of(new Diagnostic(1, 11, "unexpected character '@'")), tokens.diagnostics());
        assertTrue(tokens.tokens().stream().noneMatch(t -> t.image().equals("@")));
    }

    @Test
    public void testEndOfInputIsSticky() {
        var tokens = new Tokenizer().tokenize("x");
        tokens.next();
        assertTrue(tokens.atEnd());
        assertEquals(TokenType.EOF, tokens.next().type());
        assertEquals(TokenType.EOF, tokens.peek(5).type());
    }
}
