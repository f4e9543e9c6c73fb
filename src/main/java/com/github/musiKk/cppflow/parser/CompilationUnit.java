package com.github.musiKk.cppflow.parser;

import java.util.List;
import java.util.Optional;

import com.github.musiKk.cppflow.Tokenizer.Token;
import com.github.musiKk.cppflow.Tokenizer.TokenType;

public record CompilationUnit(List<Statement> statements) {

    public record Position(int line, int column) {
        public static final Position NONE = new Position(-1, -1);

        public static Position of(Token token) {
            return new Position(token.line(), token.column());
        }
    }

    public sealed interface Statement {}
    public record ExpressionStatement(Expression expression) implements Statement {}
    public record Block(List<Statement> statements) implements Statement {
        public static Block empty() {
            return new Block(List.of());
        }
    }

    public record Declaration(String type, boolean constant, List<Declarator> declarators) implements Statement {
        public Declaration(String type, Declarator declarator) {
            this(type, false, List.of(declarator));
        }
    }
    public record Declarator(String name, String type, Optional<Expression> initializer, Position position) {
        public Declarator withInitializer(Expression initializer) {
            return new Declarator(name, type, Optional.of(initializer), position);
        }
    }

    public record IfStatement(Expression condition, Statement thenBranch, Optional<Statement> elseBranch) implements Statement {}
    public record WhileStatement(Expression condition, Statement body) implements Statement {}
    public record DoWhileStatement(Statement body, Expression condition) implements Statement {}
    public record ForStatement(
            Optional<Statement> init,
            Optional<Expression> condition,
            Optional<Expression> update,
            Statement body) implements Statement {}

    public record BreakStatement(Position position) implements Statement {}
    public record ContinueStatement(Position position) implements Statement {}
    public record ReturnStatement(Optional<Expression> value, Position position) implements Statement {}
    public record DeleteStatement(Expression target, boolean array) implements Statement {}

    public record FunctionDefinition(
            String returnType,
            String name,
            List<Parameter> parameters,
            Optional<Block> body,
            Position position) implements Statement {
        public boolean isMain() {
            return name.equals("main");
        }
    }
    public record Parameter(String type, String name) {}

    public sealed interface Expression {}

    public record IdentifierExpression(String name, Position position) implements Expression {
        public IdentifierExpression(String name) {
            this(name, Position.NONE);
        }
    }
    public record LiteralExpression(LiteralKind kind, String value, Position position) implements Expression {
        public LiteralExpression(LiteralKind kind, String value) {
            this(kind, value, Position.NONE);
        }
    }
    public enum LiteralKind { NUMBER, STRING, CHAR, BOOL, ERROR }

    public record AssignmentExpression(Expression target, TokenType operator, Expression value) implements Expression {
        public AssignmentExpression(Expression target, Expression value) {
            this(target, TokenType.EQUALS, value);
        }
        public boolean isPlain() {
            return operator == TokenType.EQUALS;
        }
    }
    public record BinaryExpression(Expression left, TokenType operator, Expression right) implements Expression {}
    public record UnaryExpression(TokenType operator, Expression operand) implements Expression {}
    public record PostfixExpression(Expression operand, TokenType operator) implements Expression {}
    public record IndexExpression(Expression target, Expression index) implements Expression {}
    public record MemberExpression(Expression target, String member, boolean arrow) implements Expression {}
    public record FunctionEvaluationExpression(Expression function, List<Expression> arguments) implements Expression {}
    public record NewExpression(String type, Optional<Expression> size) implements Expression {}
    public record InitializerListExpression(List<Expression> elements) implements Expression {}

}
