package com.github.musiKk.cppflow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

public class Tokenizer {

    private static final Logger LOG = Logger.getLogger(Tokenizer.class.getName());

    public static final Set<String> STD_NAMES = Set.of(
            "std", "cout", "cin", "cerr", "clog", "endl", "flush", "ws",
            "map", "set", "list", "deque", "queue", "stack", "array", "pair", "tuple",
            "optional", "variant", "iostream", "iomanip", "algorithm", "numeric");

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && Character.isLetter(tokenType.constantPattern.charAt(0))) {
                KEYWORDS.put(tokenType.constantPattern, tokenType);
            }
        }
        KEYWORDS.put("and", TokenType.AND_AND);
        KEYWORDS.put("or", TokenType.OR_OR);
        KEYWORDS.put("not", TokenType.BANG);
    }

    List<Pattern> patterns = new ArrayList<>();

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !KEYWORDS.containsKey(tokenType.constantPattern)) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new StringPattern('"', TokenType.STRING, "unterminated string literal"));
        patterns.add(new StringPattern('\'', TokenType.CHAR_LITERAL, "unterminated character literal"));
        patterns.add(new CommentPattern());
        patterns.add(new PreprocessorPattern());

        // comments before operators so that "//" never lexes as two slashes
        patterns.sort(Comparator.comparingInt(Tokenizer::priority).reversed());
    }

    private static int priority(Pattern pattern) {
        if (pattern instanceof CommentPattern) {
            return Integer.MAX_VALUE;
        }
        if (pattern instanceof StaticPattern sp) {
            return sp.pattern.length();
        }
        return Integer.MIN_VALUE;
    }

    public Tokens tokenize(String programString) {
        List<Token> tokens = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        int index = 0;
        int line = 1;
        int column = 1;
        while (index < programString.length()) {
            char c = programString.charAt(index);
            if (Character.isWhitespace(c)) {
                if (c == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
                index++;
                continue;
            }

            Optional<Match> match = Optional.empty();
            for (var pattern : patterns) {
                match = pattern.match(programString, index);
                if (match.isPresent()) {
                    break;
                }
            }

            int end;
            if (match.isPresent()) {
                var m = match.get();
                var token = new Token(m.type(), m.image(), line, column);
                tokens.add(token);
                m.error().ifPresent(message -> diagnostics.add(Diagnostic.at(token, message)));
                end = m.end();
            } else {
                diagnostics.add(new Diagnostic(line, column, "unexpected character '" + c + "'"));
                end = index + 1;
            }

            for (int i = index; i < end; i++) {
                if (programString.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            index = end;
        }

        tokens.add(new Token(TokenType.EOF, "", line, column));
        LOG.fine(() -> "tokenized " + tokens.size() + " tokens, " + diagnostics.size() + " lexical diagnostics");

        return new Tokens(tokens, diagnostics);
    }

    record Match(TokenType type, String image, int end, Optional<String> error) {
        Match(TokenType type, String image, int end) {
            this(type, image, end, Optional.empty());
        }
    }

    interface Pattern {
        Optional<Match> match(String programString, int index);
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Match> match(String programString, int index) {
            if (programString.startsWith(pattern, index)) {
                return Optional.of(new Match(tokenType, pattern, index + pattern.length()));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Match> match(String programString, int index) {
            if (!Character.isDigit(programString.charAt(index))) {
                return Optional.empty();
            }
            int start = index;
            int length = programString.length();

            if (programString.charAt(index) == '0' && index + 1 < length
                    && "xXbB".indexOf(programString.charAt(index + 1)) >= 0) {
                boolean hex = Character.toLowerCase(programString.charAt(index + 1)) == 'x';
                index += 2;
                while (index < length && (hex
                        ? Character.digit(programString.charAt(index), 16) >= 0
                        : programString.charAt(index) == '0' || programString.charAt(index) == '1')) {
                    index++;
                }
            } else {
                while (index < length && Character.isDigit(programString.charAt(index))) {
                    index++;
                }
                if (index + 1 < length && programString.charAt(index) == '.'
                        && Character.isDigit(programString.charAt(index + 1))) {
                    index++;
                    while (index < length && Character.isDigit(programString.charAt(index))) {
                        index++;
                    }
                }
                if (index < length && (programString.charAt(index) == 'e' || programString.charAt(index) == 'E')) {
                    int exponent = index + 1;
                    if (exponent < length && (programString.charAt(exponent) == '+' || programString.charAt(exponent) == '-')) {
                        exponent++;
                    }
                    if (exponent < length && Character.isDigit(programString.charAt(exponent))) {
                        index = exponent;
                        while (index < length && Character.isDigit(programString.charAt(index))) {
                            index++;
                        }
                    }
                }
            }

            int suffixStart = index;
            while (index < length && (Character.isLetterOrDigit(programString.charAt(index))
                    || programString.charAt(index) == '_')) {
                index++;
            }
            String image = programString.substring(start, index);
            String suffix = programString.substring(suffixStart, index);
            if (!suffix.chars().allMatch(ch -> "uUlLfF".indexOf(ch) >= 0)) {
                return Optional.of(new Match(TokenType.NUMBER, image, index,
                        Optional.of("malformed numeric literal '" + image + "'")));
            }
            return Optional.of(new Match(TokenType.NUMBER, image, index));
        }
    }

    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Match> match(String programString, int index) {
            char first = programString.charAt(index);
            if (Character.isLetter(first) || first == '_') {
                int start = index;
                while (index < programString.length()
                        && (Character.isLetterOrDigit(programString.charAt(index)) || programString.charAt(index) == '_')) {
                    index++;
                }
                String image = programString.substring(start, index);
                TokenType type = KEYWORDS.get(image);
                if (type == null) {
                    type = STD_NAMES.contains(image) ? TokenType.STD_IDENTIFIER : TokenType.IDENTIFIER;
                }
                return Optional.of(new Match(type, image, index));
            } else {
                return Optional.empty();
            }
        }
    }

    static class StringPattern implements Pattern {
        final char delimiter;
        final TokenType tokenType;
        final String unterminated;

        StringPattern(char delimiter, TokenType tokenType, String unterminated) {
            this.delimiter = delimiter;
            this.tokenType = tokenType;
            this.unterminated = unterminated;
        }

        @Override
        public Optional<Match> match(String programString, int index) {
            if (programString.charAt(index) != delimiter) {
                return Optional.empty();
            }
            int start = index;
            index++;
            while (index < programString.length()) {
                char cur = programString.charAt(index);
                if (cur == '\\' && index + 1 < programString.length()) {
                    index += 2;
                    continue;
                }
                if (cur == delimiter || cur == '\n') {
                    break;
                }
                index++;
            }
            if (index == programString.length() || programString.charAt(index) != delimiter) {
                return Optional.of(new Match(tokenType, programString.substring(start, index), index,
                        Optional.of(unterminated)));
            }
            index += 1;
            return Optional.of(new Match(tokenType, programString.substring(start, index), index));
        }
    }

    static class CommentPattern implements Pattern {
        @Override
        public Optional<Match> match(String programString, int index) {
            if (programString.startsWith("//", index)) {
                int start = index;
                index += 2;
                while (index < programString.length() && programString.charAt(index) != '\n') {
                    index++;
                }
                return Optional.of(new Match(TokenType.COMMENT, programString.substring(start, index), index));
            } else if (programString.startsWith("/*", index)) {
                int close = programString.indexOf("*/", index + 2);
                int end = close < 0 ? programString.length() : close + 2;
                return Optional.of(new Match(TokenType.COMMENT, programString.substring(index, end), end,
                        close < 0 ? Optional.of("unterminated block comment") : Optional.empty()));
            } else {
                return Optional.empty();
            }
        }
    }

    static class PreprocessorPattern implements Pattern {
        @Override
        public Optional<Match> match(String programString, int index) {
            if (programString.charAt(index) != '#') {
                return Optional.empty();
            }
            int end = programString.indexOf('\n', index);
            if (end < 0) {
                end = programString.length();
            }
            return Optional.of(new Match(TokenType.PREPROCESSOR, programString.substring(index, end).strip(), end));
        }
    }

    public record Token(TokenType type, String image, int line, int column) {
        public int length() {
            return image.length();
        }
    }

    public enum TokenType {
        INT("int"), FLOAT("float"), DOUBLE("double"), CHAR("char"), BOOL("bool"), VOID("void"),
        LONG("long"), SHORT("short"), UNSIGNED("unsigned"), SIGNED("signed"), AUTO("auto"),
        STRING_TYPE("string"), VECTOR("vector"),

        CONST("const"),
        IF("if"), ELSE("else"), FOR("for"), WHILE("while"), DO("do"),
        RETURN("return"), BREAK("break"), CONTINUE("continue"),
        SWITCH("switch"), CASE("case"), DEFAULT("default"),
        NEW("new"), DELETE("delete"),
        USING("using"), NAMESPACE("namespace"),
        TRUE("true"), FALSE("false"),

        NUMBER,
        STRING,
        CHAR_LITERAL,

        PLUS_EQUALS("+="), MINUS_EQUALS("-="), STAR_EQUALS("*="), SLASH_EQUALS("/="), PERCENT_EQUALS("%="),
        EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        LE("<="), GE(">="), LT("<"), GT(">"),
        SHIFT_LEFT("<<"), SHIFT_RIGHT(">>"),
        AND_AND("&&"), OR_OR("||"),
        PLUS_PLUS("++"), MINUS_MINUS("--"),
        ARROW("->"), COLON_COLON("::"),
        PLUS("+"), MINUS("-"),
        STAR("*"), SLASH("/"), PERCENT("%"),
        BANG("!"), AMPERSAND("&"), PIPE("|"), CARET("^"), TILDE("~"), QUESTION("?"),

        COMMENT,
        PREPROCESSOR,

        LBRACE("{"),
        RBRACE("}"),
        LPAREN("("),
        RPAREN(")"),
        LBRACKET("["),
        RBRACKET("]"),

        SEMICOLON(";"),
        COLON(":"),
        EQUALS("="),
        IDENTIFIER,
        STD_IDENTIFIER,
        DOT("."),
        COMMA(","),
        EOF;

        private static final Set<TokenType> TYPE_NAMES = EnumSet.of(
                INT, FLOAT, DOUBLE, CHAR, BOOL, VOID, LONG, SHORT, UNSIGNED, SIGNED, AUTO, STRING_TYPE, VECTOR);

        private static final Set<TokenType> STATEMENT_KEYWORDS = EnumSet.of(
                CONST, IF, ELSE, FOR, WHILE, DO, RETURN, BREAK, CONTINUE, SWITCH, CASE, DEFAULT, NEW, DELETE);

        String constantPattern;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this.constantPattern = constantPattern;
        }

        public boolean isTypeName() {
            return TYPE_NAMES.contains(this);
        }

        /** Types and statement keywords, the tokens error recovery resynchronizes on. */
        public boolean isKeywordLike() {
            return TYPE_NAMES.contains(this) || STATEMENT_KEYWORDS.contains(this);
        }

        public String text() {
            return constantPattern != null ? constantPattern : name();
        }
    }

    public static class Tokens {
        final List<Token> tokens;
        final List<Diagnostic> diagnostics;
        int index;

        public Tokens(List<Token> tokens, List<Diagnostic> diagnostics) {
            this.tokens = tokens.stream().filter(t -> t.type() != TokenType.COMMENT).toList();
            this.diagnostics = List.copyOf(diagnostics);
            if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).type() != TokenType.EOF) {
                throw new IllegalArgumentException("token stream must end with EOF");
            }
        }

        public List<Diagnostic> diagnostics() {
            return diagnostics;
        }

        public List<Token> tokens() {
            return tokens;
        }

        public int index() {
            return index;
        }

        public Token next() {
            var token = tokens.get(index);
            if (index < tokens.size() - 1) {
                index++;
            }
            return token;
        }

        public Token peek() {
            return tokens.get(index);
        }

        public Token peek(int ahead) {
            return tokens.get(Math.min(index + ahead, tokens.size() - 1));
        }

        public boolean atEnd() {
            return peek().type() == TokenType.EOF;
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public Token peek(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw new IllegalStateException("expected " + type + " but got " + token);
            }
            return token;
        }

        public Token next(TokenType type) {
            var token = next();
            if (token.type() != type) {
                throw new IllegalStateException("expected " + type + " but got " + token);
            }
            return token;
        }
    }

}
