package com.github.musiKk.cppflow.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.github.musiKk.cppflow.Diagnostic;
import com.github.musiKk.cppflow.Tokenizer.Token;
import com.github.musiKk.cppflow.Tokenizer.TokenType;
import com.github.musiKk.cppflow.Tokenizer.Tokens;
import com.github.musiKk.cppflow.parser.CompilationUnit.AssignmentExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.BinaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.Block;
import com.github.musiKk.cppflow.parser.CompilationUnit.BreakStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ContinueStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declaration;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declarator;
import com.github.musiKk.cppflow.parser.CompilationUnit.DeleteStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.DoWhileStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Expression;
import com.github.musiKk.cppflow.parser.CompilationUnit.ExpressionStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ForStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.FunctionDefinition;
import com.github.musiKk.cppflow.parser.CompilationUnit.FunctionEvaluationExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.IdentifierExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.IfStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.IndexExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.InitializerListExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.LiteralExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.LiteralKind;
import com.github.musiKk.cppflow.parser.CompilationUnit.MemberExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.NewExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.Parameter;
import com.github.musiKk.cppflow.parser.CompilationUnit.Position;
import com.github.musiKk.cppflow.parser.CompilationUnit.PostfixExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.ReturnStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Statement;
import com.github.musiKk.cppflow.parser.CompilationUnit.UnaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.WhileStatement;

/**
 * Recursive descent parser for the supported C++ subset. Builds the AST and
 * drives a {@link Scopes} resolver in the same pass, recording problems as
 * {@link Diagnostic}s instead of throwing.
 * <p>
 * An instance keeps per-call state and must not be shared between threads.
 */
public class Parser {

    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private static final Set<String> CONTAINERS = Set.of(
            "map", "set", "list", "deque", "queue", "stack", "array", "pair", "tuple", "optional", "variant");
    private static final Set<TokenType> MULTI_WORD_TYPES = EnumSet.of(
            TokenType.INT, TokenType.CHAR, TokenType.DOUBLE, TokenType.FLOAT,
            TokenType.LONG, TokenType.SHORT, TokenType.UNSIGNED, TokenType.SIGNED);
    // fundamental types start out uninitialized; class types are default constructed
    private static final Set<String> FUNDAMENTAL_WORDS = Set.of(
            "int", "char", "double", "float", "long", "short", "unsigned", "signed", "bool", "auto");
    private static final Set<TokenType> ASSIGNMENT_OPERATORS = EnumSet.of(
            TokenType.EQUALS, TokenType.PLUS_EQUALS, TokenType.MINUS_EQUALS,
            TokenType.STAR_EQUALS, TokenType.SLASH_EQUALS, TokenType.PERCENT_EQUALS);

    private final TopLevelMode topLevelMode;
    private final Function<Consumer<Diagnostic>, Scopes> scopesFactory;

    private List<Diagnostic> diagnostics;
    private Scopes scopes;
    private TypeRules types;
    // identifier uses whose read/write role is not known yet
    private List<PendingRead> pendingReads;
    private int loopDepth;
    private boolean inRecovery;
    private int recoveryIndex;

    public Parser() {
        this(TopLevelMode.STRICT_MAIN);
    }

    public Parser(TopLevelMode topLevelMode) {
        this(topLevelMode, ScopeTree::new);
    }

    public Parser(TopLevelMode topLevelMode, Function<Consumer<Diagnostic>, Scopes> scopesFactory) {
        this.topLevelMode = topLevelMode;
        this.scopesFactory = scopesFactory;
    }

    private record PendingRead(IdentifierExpression identifier, Entry entry) {}

    public ParseResult parseProgram(Tokens tokens) {
        diagnostics = new ArrayList<>();
        scopes = scopesFactory.apply(diagnostics::add);
        types = new TypeRules(scopes);
        pendingReads = new ArrayList<>();
        loopDepth = 0;
        inRecovery = false;
        recoveryIndex = -1;

        try {
            var statements = switch (topLevelMode) {
                case STRICT_MAIN -> parseMainProgram(tokens);
                case STATEMENTS -> parseStatementProgram(tokens);
            };
            LOG.fine(() -> "parsed " + statements.size() + " top level statements, " + diagnostics.size() + " diagnostics");
            return new ParseResult(Optional.of(new CompilationUnit(statements)), List.copyOf(diagnostics), scopes);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "parser failed at token " + tokens.peek(), e);
            diagnostics.add(Diagnostic.unpositioned("internal parser error: " + e.getMessage()));
            return new ParseResult(Optional.empty(), List.copyOf(diagnostics), scopes);
        }
    }

    // <> [preprocessor | using | ;]* int main "(" ... ")" block
    private List<Statement> parseMainProgram(Tokens tokens) {
        skipPreamble(tokens);

        if (tokens.atEnd()) {
            diagnostics.add(Diagnostic.unpositioned("expected 'int main()' entry point"));
            return List.of();
        }
        if (!looksLikeMain(tokens)) {
            rejectOutsideMain(tokens);
            return List.of();
        }

        tokens.next(TokenType.INT);
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        var main = parseFunction(tokens, "int", nameToken);

        if (!tokens.atEnd()) {
            rejectOutsideMain(tokens);
        }
        return List.of(main);
    }

    private boolean looksLikeMain(Tokens tokens) {
        return tokens.matches(TokenType.INT)
                && tokens.peek(1).type() == TokenType.IDENTIFIER
                && tokens.peek(1).image().equals("main")
                && tokens.peek(2).type() == TokenType.LPAREN;
    }

    private void rejectOutsideMain(Tokens tokens) {
        diagnostics.add(Diagnostic.at(tokens.peek(), "code outside 'int main()' is not allowed"));
        while (!tokens.atEnd()) {
            tokens.next();
        }
    }

    private void skipPreamble(Tokens tokens) {
        while (true) {
            if (tokens.matches(TokenType.PREPROCESSOR, TokenType.SEMICOLON)) {
                tokens.next();
            } else if (tokens.matches(TokenType.USING)) {
                parseUsing(tokens);
            } else {
                return;
            }
        }
    }

    private List<Statement> parseStatementProgram(Tokens tokens) {
        List<Statement> statements = new ArrayList<>();
        while (!tokens.atEnd()) {
            skipPreamble(tokens);
            if (tokens.atEnd()) {
                break;
            }
            if (tokens.matches(TokenType.RBRACE)) {
                diagnostics.add(Diagnostic.at(tokens.next(), "unexpected '}'"));
                continue;
            }
            statements.add(parseStatement(tokens, true));
        }
        return statements;
    }

    private void parseUsing(Tokens tokens) {
        tokens.next(TokenType.USING);
        if (tokens.matches(TokenType.NAMESPACE)) {
            tokens.next();
            if (tokens.matches(TokenType.IDENTIFIER, TokenType.STD_IDENTIFIER)) {
                tokens.next();
            } else {
                syntaxError(tokens, "expected namespace name after 'namespace', found " + describe(tokens.peek()));
            }
            expectSemicolon(tokens, "after using directive");
        } else {
            // using std::cout;
            while (!tokens.matches(TokenType.SEMICOLON) && !tokens.atEnd()) {
                tokens.next();
            }
            if (tokens.matches(TokenType.SEMICOLON)) {
                tokens.next();
            }
        }
    }

    private Statement parseStatement(Tokens tokens) {
        return parseStatement(tokens, false);
    }

    private Statement parseStatement(Tokens tokens, boolean topLevel) {
        inRecovery = false;
        int start = tokens.index();

        var statement = parseStatementKind(tokens, topLevel);
        flushReads(0);

        // never leave a statement without progress, but leave closing braces to the enclosing block
        if (tokens.index() == start && !tokens.atEnd() && !tokens.matches(TokenType.RBRACE)) {
            tokens.next();
        }
        return statement;
    }

    private Statement parseStatementKind(Tokens tokens, boolean topLevel) {
        var token = tokens.peek();

        return switch (token.type()) {
            case LBRACE -> {
                scopes.enter("block");
                var block = parseBlock(tokens);
                scopes.exit();
                yield block;
            }
            case IF -> parseIfStatement(tokens);
            case WHILE -> parseWhileStatement(tokens);
            case DO -> parseDoWhileStatement(tokens);
            case FOR -> parseForStatement(tokens);
            case BREAK -> {
                tokens.next();
                if (loopDepth == 0) {
                    diagnostics.add(Diagnostic.at(token, "'break' outside of a loop"));
                }
                expectSemicolon(tokens, "after 'break'");
                yield new BreakStatement(Position.of(token));
            }
            case CONTINUE -> {
                tokens.next();
                if (loopDepth == 0) {
                    diagnostics.add(Diagnostic.at(token, "'continue' outside of a loop"));
                }
                expectSemicolon(tokens, "after 'continue'");
                yield new ContinueStatement(Position.of(token));
            }
            case RETURN -> {
                tokens.next();
                Optional<Expression> value = Optional.empty();
                if (!tokens.matches(TokenType.SEMICOLON)) {
                    value = Optional.of(parseExpression(tokens));
                }
                expectSemicolon(tokens, "after return statement");
                yield new ReturnStatement(value, Position.of(token));
            }
            case DELETE -> {
                tokens.next();
                boolean array = false;
                if (tokens.matches(TokenType.LBRACKET)) {
                    tokens.next();
                    expect(tokens, TokenType.RBRACKET, "after 'delete['");
                    array = true;
                }
                var target = parseExpression(tokens);
                expectSemicolon(tokens, "after delete expression");
                yield new DeleteStatement(target, array);
            }
            case SEMICOLON -> {
                tokens.next();
                yield Block.empty();
            }
            case PREPROCESSOR -> {
                tokens.next();
                yield Block.empty();
            }
            case USING -> {
                parseUsing(tokens);
                yield Block.empty();
            }
            case SWITCH, CASE, DEFAULT -> {
                syntaxError(tokens, "'" + token.image() + "' statements are not supported");
                tokens.next();
                recover(tokens);
                yield Block.empty();
            }
            default -> {
                if (isDeclarationStart(tokens)) {
                    yield parseDeclarationStatement(tokens, topLevel);
                }
                yield parseExpressionStatement(tokens);
            }
        };
    }

    // <> "{" statement* "}", in the current scope
    private Block parseBlock(Tokens tokens) {
        if (!expect(tokens, TokenType.LBRACE, "to open block")) {
            recover(tokens);
            return Block.empty();
        }
        List<Statement> statements = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE) && !tokens.atEnd()) {
            statements.add(parseStatement(tokens));
        }
        expect(tokens, TokenType.RBRACE, "to close block");
        return new Block(statements);
    }

    private Statement parseScopedStatement(Tokens tokens, String label) {
        scopes.enter(label);
        var statement = parseStatement(tokens);
        scopes.exit();
        return statement;
    }

    private Statement parseIfStatement(Tokens tokens) {
        tokens.next(TokenType.IF);
        var condition = parseCondition(tokens, "if");
        var thenBranch = parseScopedStatement(tokens, "if-then");
        Optional<Statement> elseBranch = Optional.empty();
        if (tokens.matches(TokenType.ELSE)) {
            tokens.next();
            elseBranch = Optional.of(parseScopedStatement(tokens, "if-else"));
        }
        return new IfStatement(condition, thenBranch, elseBranch);
    }

    private Statement parseWhileStatement(Tokens tokens) {
        tokens.next(TokenType.WHILE);
        var condition = parseCondition(tokens, "while");
        var body = parseLoopBody(tokens, "while-body");
        return new WhileStatement(condition, body);
    }

    private Statement parseDoWhileStatement(Tokens tokens) {
        tokens.next(TokenType.DO);
        var body = parseLoopBody(tokens, "do-body");
        if (!expect(tokens, TokenType.WHILE, "after do-while body")) {
            recover(tokens);
            return new DoWhileStatement(body, new LiteralExpression(LiteralKind.ERROR, "", Position.of(tokens.peek())));
        }
        var condition = parseCondition(tokens, "while");
        expectSemicolon(tokens, "after do-while condition");
        return new DoWhileStatement(body, condition);
    }

    // <> for "(" [declaration | expression]? ";" expression? ";" expression? ")" statement
    private Statement parseForStatement(Tokens tokens) {
        tokens.next(TokenType.FOR);
        expect(tokens, TokenType.LPAREN, "after 'for'");
        scopes.enter("for-init");

        Optional<Statement> init = Optional.empty();
        if (tokens.matches(TokenType.SEMICOLON)) {
            tokens.next();
        } else if (isDeclarationStart(tokens)) {
            init = Optional.of(parseDeclarationStatement(tokens, false));
        } else {
            init = Optional.of(parseExpressionStatement(tokens));
        }

        Optional<Expression> condition = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON)) {
            condition = Optional.of(parseExpression(tokens));
        }
        expect(tokens, TokenType.SEMICOLON, "after for condition");

        Optional<Expression> update = Optional.empty();
        if (!tokens.matches(TokenType.RPAREN)) {
            update = Optional.of(parseExpression(tokens));
        }
        expect(tokens, TokenType.RPAREN, "after for clauses");

        var body = parseLoopBody(tokens, "for-body");
        scopes.exit();
        return new ForStatement(init, condition, update, body);
    }

    private Statement parseLoopBody(Tokens tokens, String label) {
        loopDepth++;
        var body = parseScopedStatement(tokens, label);
        loopDepth--;
        return body;
    }

    private Expression parseCondition(Tokens tokens, String keyword) {
        expect(tokens, TokenType.LPAREN, "after '" + keyword + "'");
        var condition = parseExpression(tokens);
        expect(tokens, TokenType.RPAREN, "after " + keyword + " condition");
        return condition;
    }

    private Statement parseExpressionStatement(Tokens tokens) {
        var expression = parseExpression(tokens);
        expectSemicolon(tokens, "after expression");
        return new ExpressionStatement(expression);
    }

    private boolean isDeclarationStart(Tokens tokens) {
        if (tokens.matches(TokenType.CONST) || isTypeStart(tokens, 0)) {
            return true;
        }
        // user type names such as size_t
        return tokens.matches(TokenType.IDENTIFIER) && tokens.peek(1).type() == TokenType.IDENTIFIER;
    }

    private boolean isTypeStart(Tokens tokens, int ahead) {
        var token = tokens.peek(ahead);
        if (token.type().isTypeName()) {
            return true;
        }
        if (token.type() == TokenType.STD_IDENTIFIER) {
            if (token.image().equals("std") && tokens.peek(ahead + 1).type() == TokenType.COLON_COLON) {
                return isTypeStart(tokens, ahead + 2);
            }
            return CONTAINERS.contains(token.image()) && tokens.peek(ahead + 1).type() == TokenType.LT;
        }
        return false;
    }

    // <> [std ::] type-word+ ["<" template-arguments ">"]
    private String parseType(Tokens tokens) {
        if (tokens.peek().image().equals("std") && tokens.peek(1).type() == TokenType.COLON_COLON) {
            tokens.next();
            tokens.next();
        }
        var first = tokens.next();
        var type = new StringBuilder(first.image());
        if (MULTI_WORD_TYPES.contains(first.type())) {
            while (tokens.matches(MULTI_WORD_TYPES.toArray(new TokenType[0]))) {
                type.append(' ').append(tokens.next().image());
            }
        }
        if (tokens.matches(TokenType.LT)) {
            type.append(parseTemplateArguments(tokens));
        }
        return type.toString();
    }

    private String parseTemplateArguments(Tokens tokens) {
        var text = new StringBuilder();
        int depth = 0;
        do {
            var token = tokens.next();
            switch (token.type()) {
                case LT -> depth++;
                case GT -> depth--;
                case SHIFT_RIGHT -> depth -= 2;
                default -> {
                }
            }
            if (token.type() == TokenType.COMMA) {
                text.append(", ");
            } else {
                if (!text.isEmpty() && Character.isLetterOrDigit(text.charAt(text.length() - 1))
                        && Character.isLetter(token.image().charAt(0))) {
                    text.append(' ');
                }
                text.append(token.image());
            }
        } while (depth > 0 && !tokens.atEnd());

        if (depth > 0) {
            syntaxError(tokens, "unterminated template argument list");
        }
        return text.toString();
    }

    private String parsePointers(Tokens tokens) {
        var pointers = new StringBuilder();
        while (tokens.matches(TokenType.STAR, TokenType.AMPERSAND)) {
            pointers.append(tokens.next().image());
        }
        return pointers.toString();
    }

    // <> [const] type declarator ("," declarator)* ";"  |  type name "(" parameters ")" (block | ";")
    private Statement parseDeclarationStatement(Tokens tokens, boolean allowFunction) {
        boolean constant = false;
        if (tokens.matches(TokenType.CONST)) {
            var constToken = tokens.next();
            constant = true;
            if (!isTypeStart(tokens, 0) && !tokens.matches(TokenType.IDENTIFIER)) {
                diagnostics.add(Diagnostic.at(constToken, "expected type after 'const'"));
                return parseExpressionStatement(tokens);
            }
        }

        var baseType = parseType(tokens);
        if (tokens.matches(TokenType.CONST)) {
            tokens.next();
            constant = true;
        }
        var pointers = parsePointers(tokens);

        if (!tokens.matches(TokenType.IDENTIFIER)) {
            syntaxError(tokens, "expected identifier after type '" + baseType + "', found " + describe(tokens.peek()));
            recover(tokens);
            return Block.empty();
        }
        var nameToken = tokens.next();

        if (tokens.matches(TokenType.LPAREN)) {
            if (constant) {
                diagnostics.add(Diagnostic.at(nameToken, "'const' cannot qualify function '" + nameToken.image() + "'"));
            }
            int firstDiagnostic = diagnostics.size();
            var function = parseFunction(tokens, baseType + pointers, nameToken);
            if (!allowFunction && function.body().isPresent()) {
                // local prototypes are fine, local definitions are dropped
                diagnostics.add(firstDiagnostic, Diagnostic.at(nameToken, "function definition is not allowed here"));
                return Block.empty();
            }
            return function;
        }

        List<Declarator> declarators = new ArrayList<>();
        declarators.add(parseDeclarator(tokens, baseType, pointers, nameToken, constant));
        while (tokens.matches(TokenType.COMMA)) {
            tokens.next();
            var nextPointers = parsePointers(tokens);
            if (!tokens.matches(TokenType.IDENTIFIER)) {
                syntaxError(tokens, "expected identifier after ',' in declaration, found " + describe(tokens.peek()));
                break;
            }
            declarators.add(parseDeclarator(tokens, baseType, nextPointers, tokens.next(), constant));
        }

        expectSemicolon(tokens, "after declaration of '" + nameToken.image() + "'");
        return new Declaration(baseType, constant, declarators);
    }

    private Declarator parseDeclarator(Tokens tokens, String baseType, String pointers, Token nameToken, boolean constant) {
        var name = nameToken.image();
        var position = Position.of(nameToken);

        var dimensions = new StringBuilder();
        while (tokens.matches(TokenType.LBRACKET)) {
            tokens.next();
            dimensions.append('[');
            if (!tokens.matches(TokenType.RBRACKET)) {
                dimensions.append(ExpressionPrinter.print(parseExpression(tokens)));
            }
            dimensions.append(']');
            expect(tokens, TokenType.RBRACKET, "in array declaration");
        }
        var type = baseType + pointers + dimensions;

        if (!tokens.matches(TokenType.EQUALS)) {
            var entry = scopes.declare(name, EntryKind.VAR, type, constant, position);
            if (constant) {
                diagnostics.add(Diagnostic.at(nameToken, "const variable '" + name + "' must be initialized"));
            }
            if (baseType.equals("auto")) {
                diagnostics.add(Diagnostic.at(nameToken, "'auto' variable '" + name + "' requires an initializer"));
            }
            if (!startsUninitialized(baseType, pointers, dimensions.length() > 0)) {
                entry.initialized(true);
            }
            return new Declarator(name, type, Optional.empty(), position);
        }

        tokens.next(TokenType.EQUALS);
        Entry entry;
        Expression initializer;
        if (baseType.equals("auto") && pointers.isEmpty() && dimensions.length() == 0) {
            initializer = parseExpression(tokens);
            var inferred = types.typeOf(initializer);
            entry = scopes.declare(name, EntryKind.VAR, inferred, constant, position);
            type = inferred;
        } else {
            // the name is in scope inside its own initializer
            entry = scopes.declare(name, EntryKind.VAR, type, constant, position);
            initializer = parseExpression(tokens);
            var initializerType = types.typeOf(initializer);
            if (!TypeRules.areCompatible(type, initializerType)) {
                diagnostics.add(Diagnostic.at(nameToken, "type mismatch: cannot initialize '" + name
                        + "' of type '" + type + "' with '" + initializerType + "'"));
            }
        }
        entry.initialized(true);
        return new Declarator(name, type, Optional.of(initializer), position);
    }

    private static boolean startsUninitialized(String baseType, String pointers, boolean array) {
        if (!pointers.isEmpty() && !array) {
            return !pointers.contains("&");
        }
        for (var word : baseType.split(" ")) {
            if (!FUNDAMENTAL_WORDS.contains(word)) {
                return false;
            }
        }
        return true;
    }

    // <> type name "(" [parameter ("," parameter)*] ")" (block | ";")
    private FunctionDefinition parseFunction(Tokens tokens, String returnType, Token nameToken) {
        var name = nameToken.image();
        var position = Position.of(nameToken);

        // a prototype and its definition share one entry
        var entry = scopes.lookup(name)
                .filter(existing -> existing.kind() == EntryKind.FUNC)
                .orElseGet(() -> scopes.declare(name, EntryKind.FUNC, returnType, false, position));
        entry.initialized(true);

        tokens.next(TokenType.LPAREN);
        List<Parameter> parameters = new ArrayList<>();
        if (tokens.matches(TokenType.VOID) && tokens.peek(1).type() == TokenType.RPAREN) {
            tokens.next();
        }
        while (!tokens.matches(TokenType.RPAREN) && !tokens.atEnd()) {
            if (tokens.matches(TokenType.CONST)) {
                tokens.next();
            }
            if (!isTypeStart(tokens, 0) && !tokens.matches(TokenType.IDENTIFIER)) {
                syntaxError(tokens, "expected parameter type, found " + describe(tokens.peek()));
                break;
            }
            var parameterType = parseType(tokens) + parsePointers(tokens);
            var parameterName = tokens.matches(TokenType.IDENTIFIER) ? tokens.next().image() : "";
            while (tokens.matches(TokenType.LBRACKET)) {
                tokens.next();
                expect(tokens, TokenType.RBRACKET, "in array parameter");
                parameterType += "[]";
            }
            parameters.add(new Parameter(parameterType, parameterName));
            if (!tokens.matches(TokenType.COMMA)) {
                break;
            }
            tokens.next();
        }
        if (!expect(tokens, TokenType.RPAREN, "after parameters of '" + name + "'")) {
            recover(tokens);
            return new FunctionDefinition(returnType, name, parameters, Optional.empty(), position);
        }

        if (tokens.matches(TokenType.SEMICOLON)) {
            tokens.next();
            return new FunctionDefinition(returnType, name, parameters, Optional.empty(), position);
        }

        scopes.enter("func-body " + name);
        for (var parameter : parameters) {
            if (!parameter.name().isEmpty()) {
                scopes.declare(parameter.name(), EntryKind.PARAM, parameter.type(), false, position)
                        .initialized(true);
            }
        }
        int outerLoopDepth = loopDepth;
        loopDepth = 0;
        var body = parseBlock(tokens);
        loopDepth = outerLoopDepth;
        scopes.exit();

        return new FunctionDefinition(returnType, name, parameters, Optional.of(body), position);
    }

    private Expression parseExpression(Tokens tokens) {
        return parseAssignment(tokens);
    }

    private Expression parseAssignment(Tokens tokens) {
        int mark = pendingReads.size();
        var expr = parseLogicalOr(tokens);

        if (tokens.matches(ASSIGNMENT_OPERATORS.toArray(new TokenType[0]))) {
            var operatorToken = tokens.next();
            var value = parseAssignment(tokens);
            var assignment = new AssignmentExpression(expr, operatorToken.type(), value);
            checkAssignment(assignment, operatorToken);
            expr = assignment;
        }
        flushReads(mark);
        return expr;
    }

    private void checkAssignment(AssignmentExpression assignment, Token operatorToken) {
        var target = assignment.target();
        if (!isAssignable(target)) {
            diagnostics.add(Diagnostic.at(operatorToken, "left-hand side of '" + operatorToken.image() + "' is not assignable"));
            return;
        }

        rootVariable(target).flatMap(this::takeRead).ifPresent(read -> {
            var entry = read.entry();
            var identifier = read.identifier();
            if (entry.constant()) {
                diagnostics.add(error(identifier.position(), "cannot assign to const variable '" + identifier.name() + "'"));
                return;
            }
            if (!assignment.isPlain()) {
                scopes.checkInitialized(entry, identifier.name(), identifier.position());
            }
            entry.initialized(true);
        });

        var targetType = types.typeOf(target);
        var valueType = types.typeOf(assignment.value());
        if (!TypeRules.areCompatible(targetType, valueType, assignment.operator())) {
            diagnostics.add(Diagnostic.at(operatorToken,
                    "type mismatch: cannot assign '" + valueType + "' to '" + targetType + "'"));
        }
    }

    private static boolean isAssignable(Expression expression) {
        return expression instanceof IdentifierExpression
                || expression instanceof IndexExpression
                || expression instanceof MemberExpression
                || (expression instanceof UnaryExpression ue && ue.operator() == TokenType.STAR);
    }

    /** The variable written through an assignment target: {@code x}, {@code x[i]}, {@code x.f}. */
    private static Optional<IdentifierExpression> rootVariable(Expression expression) {
        if (expression instanceof IdentifierExpression ie) {
            return Optional.of(ie);
        } else if (expression instanceof IndexExpression ie) {
            return rootVariable(ie.target());
        } else if (expression instanceof MemberExpression me) {
            return rootVariable(me.target());
        }
        return Optional.empty();
    }

    private Expression parseLogicalOr(Tokens tokens) {
        var expr = parseLogicalAnd(tokens);

        while (tokens.matches(TokenType.OR_OR)) {
            var operator = tokens.next().type();
            var right = parseLogicalAnd(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseLogicalAnd(Tokens tokens) {
        var expr = parseEquality(tokens);

        while (tokens.matches(TokenType.AND_AND)) {
            var operator = tokens.next().type();
            var right = parseEquality(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseEquality(Tokens tokens) {
        var expr = parseRelational(tokens);

        while (tokens.matches(TokenType.EQUALS_EQUALS, TokenType.NOT_EQUALS)) {
            var operator = tokens.next().type();
            var right = parseRelational(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    // stream operators share this level
    private Expression parseRelational(Tokens tokens) {
        var expr = parsePlus(tokens);

        while (tokens.matches(TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE,
                TokenType.SHIFT_LEFT, TokenType.SHIFT_RIGHT)) {
            var operator = tokens.next().type();
            var right = parsePlus(tokens);
            if (operator == TokenType.SHIFT_RIGHT && isInputStream(expr)) {
                markWritten(right);
            }
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private static boolean isInputStream(Expression expression) {
        while (expression instanceof BinaryExpression be && be.operator() == TokenType.SHIFT_RIGHT) {
            expression = be.left();
        }
        return expression instanceof IdentifierExpression ie
                && (ie.name().equals("cin") || ie.name().equals("std::cin"));
    }

    private void markWritten(Expression target) {
        rootVariable(target).flatMap(this::takeRead).ifPresent(read -> {
            if (read.entry().constant()) {
                diagnostics.add(error(read.identifier().position(),
                        "cannot assign to const variable '" + read.identifier().name() + "'"));
            } else {
                read.entry().initialized(true);
            }
        });
    }

    private Expression parsePlus(Tokens tokens) {
        var expr = parseTimes(tokens);

        while (tokens.matches(TokenType.PLUS, TokenType.MINUS)) {
            var operator = tokens.next().type();
            var right = parseTimes(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseTimes(Tokens tokens) {
        var expr = parseUnary(tokens);

        while (tokens.matches(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            var operator = tokens.next().type();
            var right = parseUnary(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseUnary(Tokens tokens) {
        if (tokens.matches(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS)) {
            var operatorToken = tokens.next();
            var operand = parseUnary(tokens);
            checkIncrement(operand, operatorToken);
            return new UnaryExpression(operatorToken.type(), operand);
        }
        if (tokens.matches(TokenType.AMPERSAND)) {
            // taking an address hands the variable out for writing
            var operator = tokens.next().type();
            var operand = parseUnary(tokens);
            rootVariable(operand).flatMap(this::takeRead).ifPresent(read -> read.entry().initialized(true));
            return new UnaryExpression(operator, operand);
        }
        if (tokens.matches(TokenType.PLUS, TokenType.MINUS, TokenType.BANG, TokenType.TILDE, TokenType.STAR)) {
            var operator = tokens.next().type();
            var operand = parseUnary(tokens);
            return new UnaryExpression(operator, operand);
        }
        return parsePostfix(tokens);
    }

    private void checkIncrement(Expression operand, Token operatorToken) {
        if (!isAssignable(operand)) {
            diagnostics.add(Diagnostic.at(operatorToken, "operand of '" + operatorToken.image() + "' is not assignable"));
            return;
        }
        rootVariable(operand).flatMap(this::takeRead).ifPresent(read -> {
            var identifier = read.identifier();
            scopes.checkInitialized(read.entry(), identifier.name(), identifier.position());
            if (read.entry().constant()) {
                diagnostics.add(error(identifier.position(),
                        "cannot increment/decrement const variable '" + identifier.name() + "'"));
            } else {
                read.entry().initialized(true);
            }
        });
    }

    private Expression parsePostfix(Tokens tokens) {
        var expression = parsePrimary(tokens);

        while (tokens.matches(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS, TokenType.LBRACKET,
                TokenType.LPAREN, TokenType.DOT, TokenType.ARROW)) {
            var postfixToken = tokens.next();
            expression = switch (postfixToken.type()) {
                case PLUS_PLUS, MINUS_MINUS -> {
                    checkIncrement(expression, postfixToken);
                    yield new PostfixExpression(expression, postfixToken.type());
                }
                case LBRACKET -> {
                    var index = parseExpression(tokens);
                    expect(tokens, TokenType.RBRACKET, "after index");
                    yield new IndexExpression(expression, index);
                }
                case LPAREN -> new FunctionEvaluationExpression(expression, parseArguments(tokens));
                case DOT, ARROW -> {
                    String member = "";
                    if (tokens.matches(TokenType.IDENTIFIER, TokenType.STD_IDENTIFIER)) {
                        member = tokens.next().image();
                    } else {
                        syntaxError(tokens, "expected member name after '" + postfixToken.image() + "', found "
                                + describe(tokens.peek()));
                    }
                    yield new MemberExpression(expression, member, postfixToken.type() == TokenType.ARROW);
                }
                default -> throw new IllegalStateException("unexpected postfix token " + postfixToken);
            };
        }
        return expression;
    }

    // "(" already consumed
    private List<Expression> parseArguments(Tokens tokens) {
        List<Expression> arguments = new ArrayList<>();
        if (tokens.matches(TokenType.RPAREN)) {
            tokens.next();
            return arguments;
        }
        while (true) {
            arguments.add(parseAssignment(tokens));
            if (tokens.matches(TokenType.COMMA)) {
                tokens.next();
                continue;
            }
            expect(tokens, TokenType.RPAREN, "after arguments");
            return arguments;
        }
    }

    private Expression parsePrimary(Tokens tokens) {
        var token = tokens.peek();
        var position = Position.of(token);

        return switch (token.type()) {
            case NUMBER -> new LiteralExpression(LiteralKind.NUMBER, tokens.next().image(), position);
            case STRING -> new LiteralExpression(LiteralKind.STRING, tokens.next().image(), position);
            case CHAR_LITERAL -> new LiteralExpression(LiteralKind.CHAR, tokens.next().image(), position);
            case TRUE, FALSE -> new LiteralExpression(LiteralKind.BOOL, tokens.next().image(), position);
            case LPAREN -> {
                tokens.next();
                var e = parseExpression(tokens);
                expect(tokens, TokenType.RPAREN, "to close parenthesized expression");
                yield e;
            }
            case LBRACE -> {
                tokens.next();
                List<Expression> elements = new ArrayList<>();
                while (!tokens.matches(TokenType.RBRACE) && !tokens.atEnd()) {
                    elements.add(parseAssignment(tokens));
                    if (!tokens.matches(TokenType.COMMA)) {
                        break;
                    }
                    tokens.next();
                }
                expect(tokens, TokenType.RBRACE, "to close initializer list");
                yield new InitializerListExpression(elements);
            }
            case NEW -> {
                tokens.next();
                if (!isTypeStart(tokens, 0) && !tokens.matches(TokenType.IDENTIFIER)) {
                    syntaxError(tokens, "expected type after 'new', found " + describe(tokens.peek()));
                    yield new LiteralExpression(LiteralKind.ERROR, "new", position);
                }
                var type = parseType(tokens) + parsePointers(tokens);
                Optional<Expression> size = Optional.empty();
                if (tokens.matches(TokenType.LBRACKET)) {
                    tokens.next();
                    size = Optional.of(parseExpression(tokens));
                    expect(tokens, TokenType.RBRACKET, "after array size");
                }
                yield new NewExpression(type, size);
            }
            case IDENTIFIER, STD_IDENTIFIER -> parseIdentifier(tokens);
            default -> {
                syntaxError(tokens, "expected expression, found " + describe(token));
                if (!tokens.matches(TokenType.SEMICOLON, TokenType.RBRACE, TokenType.RPAREN) && !tokens.atEnd()) {
                    tokens.next();
                }
                yield new LiteralExpression(LiteralKind.ERROR, token.image(), position);
            }
        };
    }

    private Expression parseIdentifier(Tokens tokens) {
        var nameToken = tokens.next();
        var position = Position.of(nameToken);
        var name = new StringBuilder(nameToken.image());
        while (tokens.matches(TokenType.COLON_COLON)) {
            tokens.next();
            var part = tokens.peek();
            if (part.type() == TokenType.IDENTIFIER || part.type() == TokenType.STD_IDENTIFIER || part.type().isTypeName()) {
                name.append("::").append(tokens.next().image());
            } else {
                syntaxError(tokens, "expected name after '::', found " + describe(part));
                break;
            }
        }

        var identifier = new IdentifierExpression(name.toString(), position);
        // qualified names belong to libraries and are not tracked
        if (identifier.name().contains("::")) {
            return identifier;
        }
        var entry = scopes.lookup(identifier.name());
        if (entry.isEmpty()) {
            scopes.require(identifier.name(), position);
        } else {
            pendingReads.add(new PendingRead(identifier, entry.get()));
        }
        return identifier;
    }

    private Optional<PendingRead> takeRead(IdentifierExpression identifier) {
        for (int i = pendingReads.size() - 1; i >= 0; i--) {
            if (pendingReads.get(i).identifier() == identifier) {
                return Optional.of(pendingReads.remove(i));
            }
        }
        return Optional.empty();
    }

    private void flushReads(int mark) {
        while (pendingReads.size() > mark) {
            var read = pendingReads.remove(mark);
            scopes.checkInitialized(read.entry(), read.identifier().name(), read.identifier().position());
        }
    }

    private boolean expect(Tokens tokens, TokenType type, String context) {
        if (tokens.matches(type)) {
            tokens.next();
            return true;
        }
        syntaxError(tokens, "expected '" + type.text() + "' " + context + ", found " + describe(tokens.peek()));
        return false;
    }

    private void expectSemicolon(Tokens tokens, String context) {
        if (!expect(tokens, TokenType.SEMICOLON, context)) {
            recover(tokens);
        }
    }

    private void syntaxError(Tokens tokens, String message) {
        if (inRecovery && recoveryIndex == tokens.index()) {
            return;
        }
        inRecovery = true;
        recoveryIndex = tokens.index();
        diagnostics.add(Diagnostic.at(tokens.peek(), message));
    }

    // skip to the next statement boundary
    private void recover(Tokens tokens) {
        while (!tokens.atEnd()) {
            var token = tokens.peek();
            if (token.type() == TokenType.SEMICOLON) {
                tokens.next();
                return;
            }
            if (token.type() == TokenType.RBRACE || token.type() == TokenType.LBRACE || token.type().isKeywordLike()) {
                return;
            }
            tokens.next();
        }
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : "'" + token.image() + "'";
    }

    private static Diagnostic error(Position position, String message) {
        return new Diagnostic(position.line(), position.column(), message);
    }

}
