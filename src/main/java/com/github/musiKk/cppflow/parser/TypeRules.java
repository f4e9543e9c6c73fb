package com.github.musiKk.cppflow.parser;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import com.github.musiKk.cppflow.Tokenizer.TokenType;
import com.github.musiKk.cppflow.parser.CompilationUnit.AssignmentExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.BinaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.Expression;
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
 * Structural typing of expressions. Types are plain strings such as
 * {@code int}, {@code double*}, {@code int[10]} or {@code vector<int>}.
 */
public class TypeRules {

    public static final String UNKNOWN = "unknown";
    public static final String UNDECLARED = "undeclared";

    private static final Set<String> NUMERIC_WORDS = Set.of("int", "float", "double", "long", "short", "unsigned", "signed");
    private static final Set<String> PERMISSIVE = Set.of("void", UNKNOWN, UNDECLARED, "auto");

    private static final Set<TokenType> BOOLEAN_OPERATORS = EnumSet.of(
            TokenType.EQUALS_EQUALS, TokenType.NOT_EQUALS,
            TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE,
            TokenType.AND_AND, TokenType.OR_OR);

    private final Scopes scopes;

    public TypeRules(Scopes scopes) {
        this.scopes = scopes;
    }

    public String typeOf(Expression expression) {
        if (expression instanceof LiteralExpression le) {
            return switch (le.kind()) {
                case NUMBER -> numberType(le.value());
                case BOOL -> "bool";
                case STRING -> "string";
                case CHAR -> "char";
                case ERROR -> UNKNOWN;
            };
        } else if (expression instanceof IdentifierExpression ie) {
            if (ie.name().contains("::")) {
                return UNKNOWN;
            }
            return scopes.lookup(ie.name()).map(Entry::type).orElse(UNDECLARED);
        } else if (expression instanceof BinaryExpression be) {
            if (BOOLEAN_OPERATORS.contains(be.operator())) {
                return "bool";
            }
            var left = typeOf(be.left());
            if (be.operator() == TokenType.SHIFT_LEFT || be.operator() == TokenType.SHIFT_RIGHT) {
                return left;
            }
            return arithmetic(left, typeOf(be.right()));
        } else if (expression instanceof UnaryExpression ue) {
            return ue.operator() == TokenType.BANG ? "bool" : typeOf(ue.operand());
        } else if (expression instanceof PostfixExpression pe) {
            return typeOf(pe.operand());
        } else if (expression instanceof AssignmentExpression ae) {
            return typeOf(ae.target());
        } else if (expression instanceof IndexExpression ie) {
            return elementType(typeOf(ie.target()));
        } else if (expression instanceof FunctionEvaluationExpression fe) {
            if (fe.function() instanceof IdentifierExpression callee && !callee.name().contains("::")) {
                return scopes.lookup(callee.name())
                        .filter(entry -> entry.kind() == EntryKind.FUNC)
                        .map(Entry::type)
                        .orElse(UNKNOWN);
            }
            return UNKNOWN;
        } else if (expression instanceof NewExpression ne) {
            return ne.type() + "*";
        } else if (expression instanceof MemberExpression) {
            return UNKNOWN;
        } else if (expression instanceof InitializerListExpression) {
            return UNKNOWN;
        }
        throw new IllegalArgumentException("unknown expression " + expression);
    }

    static String numberType(String literal) {
        var lower = literal.toLowerCase();
        if (lower.startsWith("0x") || lower.startsWith("0b")) {
            return "int";
        }
        if (lower.contains(".") || lower.contains("e") || lower.endsWith("f")) {
            return "double";
        }
        return "int";
    }

    private static String arithmetic(String left, String right) {
        if (left.equals("string") || right.equals("string")) {
            return "string";
        }
        if (left.equals("double") || right.equals("double")) {
            return "double";
        }
        if (left.equals("float") || right.equals("float")) {
            return "float";
        }
        if (PERMISSIVE.contains(left)) {
            return left;
        }
        if (PERMISSIVE.contains(right)) {
            return right;
        }
        return "int";
    }

    static String elementType(String type) {
        if (type.endsWith("]")) {
            return type.substring(0, type.lastIndexOf('['));
        }
        if (type.endsWith("*")) {
            return type.substring(0, type.length() - 1);
        }
        int open = type.indexOf('<');
        if (open > 0 && type.endsWith(">")) {
            return type.substring(open + 1, type.length() - 1).strip();
        }
        if (type.equals("string")) {
            return "char";
        }
        return PERMISSIVE.contains(type) ? type : UNKNOWN;
    }

    public static boolean areCompatible(String target, String source) {
        var t = stripPointers(target);
        var s = stripPointers(source);
        if (t.equals(s)) {
            return true;
        }
        if (PERMISSIVE.contains(t) || PERMISSIVE.contains(s)) {
            return true;
        }
        return isNumeric(t) && isNumeric(s);
    }

    /** Compatibility of {@code target op= source}; {@code s += 'c'} appends to a string. */
    public static boolean areCompatible(String target, String source, TokenType operator) {
        if (operator == TokenType.PLUS_EQUALS && stripPointers(target).equals("string") && stripPointers(source).equals("char")) {
            return true;
        }
        return areCompatible(target, source);
    }

    static boolean isNumeric(String type) {
        return Arrays.stream(type.split(" ")).allMatch(NUMERIC_WORDS::contains);
    }

    private static String stripPointers(String type) {
        return type.replace("*", "").replace("&", "").strip();
    }
}
