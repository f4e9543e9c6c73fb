package com.github.musiKk.cppflow.parser;

import java.util.stream.Collectors;

import com.github.musiKk.cppflow.Tokenizer.TokenType;
import com.github.musiKk.cppflow.parser.CompilationUnit.AssignmentExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.BinaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declaration;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declarator;
import com.github.musiKk.cppflow.parser.CompilationUnit.Expression;
import com.github.musiKk.cppflow.parser.CompilationUnit.FunctionDefinition;
import com.github.musiKk.cppflow.parser.CompilationUnit.FunctionEvaluationExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.IdentifierExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.IndexExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.InitializerListExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.LiteralExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.MemberExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.NewExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.PostfixExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.UnaryExpression;

/**
 * Prints expressions back as C++ source, with only the parentheses the
 * operator precedences require.
 */
public final class ExpressionPrinter {

    private static final int ASSIGNMENT = 1;
    private static final int OR = 2;
    private static final int AND = 3;
    private static final int EQUALITY = 4;
    private static final int RELATIONAL = 5;
    private static final int ADDITIVE = 6;
    private static final int MULTIPLICATIVE = 7;
    private static final int UNARY = 8;
    private static final int POSTFIX = 9;

    private ExpressionPrinter() {}

    public static String print(Expression expression) {
        return print(expression, 0);
    }

    public static String print(Declaration declaration) {
        var declarators = declaration.declarators().stream()
                .map(d -> print(declaration.type(), d))
                .collect(Collectors.joining(", "));
        return (declaration.constant() ? "const " : "") + declaration.type() + " " + declarators;
    }

    public static String signature(FunctionDefinition function) {
        var parameters = function.parameters().stream()
                .map(p -> p.name().isEmpty() ? p.type() : p.type() + " " + p.name())
                .collect(Collectors.joining(", "));
        return function.returnType() + " " + function.name() + "(" + parameters + ")";
    }

    private static String print(String baseType, Declarator declarator) {
        // the declarator type is the base type followed by pointer markers and array dimensions
        var rest = declarator.type().substring(Math.min(baseType.length(), declarator.type().length()));
        int bracket = rest.indexOf('[');
        var pointers = bracket < 0 ? rest : rest.substring(0, bracket);
        var dimensions = bracket < 0 ? "" : rest.substring(bracket);
        var text = pointers + declarator.name() + dimensions;
        return declarator.initializer()
                .map(init -> text + " = " + print(init, ASSIGNMENT))
                .orElse(text);
    }

    private static String print(Expression expression, int context) {
        var text = text(expression);
        return precedence(expression) < context ? "(" + text + ")" : text;
    }

    private static String text(Expression expression) {
        if (expression instanceof IdentifierExpression ie) {
            return ie.name();
        } else if (expression instanceof LiteralExpression le) {
            return le.value();
        } else if (expression instanceof AssignmentExpression ae) {
            return print(ae.target(), ASSIGNMENT + 1) + " " + ae.operator().text() + " " + print(ae.value(), ASSIGNMENT);
        } else if (expression instanceof BinaryExpression be) {
            int p = binaryPrecedence(be.operator());
            return print(be.left(), p) + " " + be.operator().text() + " " + print(be.right(), p + 1);
        } else if (expression instanceof UnaryExpression ue) {
            var operator = ue.operator().text();
            var operand = print(ue.operand(), UNARY);
            // "- -x" must not print as "--x"
            if (!operand.isEmpty() && operator.length() == 1 && "+-".contains(operator)
                    && operand.charAt(0) == operator.charAt(0)) {
                operand = "(" + operand + ")";
            }
            return operator + operand;
        } else if (expression instanceof PostfixExpression pe) {
            return print(pe.operand(), POSTFIX) + pe.operator().text();
        } else if (expression instanceof IndexExpression ie) {
            return print(ie.target(), POSTFIX) + "[" + print(ie.index()) + "]";
        } else if (expression instanceof MemberExpression me) {
            return print(me.target(), POSTFIX) + (me.arrow() ? "->" : ".") + me.member();
        } else if (expression instanceof FunctionEvaluationExpression fe) {
            return print(fe.function(), POSTFIX) + "("
                    + fe.arguments().stream().map(a -> print(a, ASSIGNMENT)).collect(Collectors.joining(", ")) + ")";
        } else if (expression instanceof NewExpression ne) {
            return "new " + ne.type() + ne.size().map(s -> "[" + print(s) + "]").orElse("");
        } else if (expression instanceof InitializerListExpression il) {
            return "{" + il.elements().stream().map(e -> print(e, ASSIGNMENT)).collect(Collectors.joining(", ")) + "}";
        }
        throw new IllegalArgumentException("unknown expression " + expression);
    }

    private static int precedence(Expression expression) {
        if (expression instanceof AssignmentExpression) {
            return ASSIGNMENT;
        } else if (expression instanceof BinaryExpression be) {
            return binaryPrecedence(be.operator());
        } else if (expression instanceof UnaryExpression || expression instanceof NewExpression) {
            return UNARY;
        }
        return POSTFIX;
    }

    private static int binaryPrecedence(TokenType operator) {
        return switch (operator) {
            case OR_OR -> OR;
            case AND_AND -> AND;
            case EQUALS_EQUALS, NOT_EQUALS -> EQUALITY;
            case LT, GT, LE, GE, SHIFT_LEFT, SHIFT_RIGHT -> RELATIONAL;
            case PLUS, MINUS -> ADDITIVE;
            case STAR, SLASH, PERCENT -> MULTIPLICATIVE;
            default -> throw new IllegalArgumentException("not a binary operator: " + operator);
        };
    }
}
