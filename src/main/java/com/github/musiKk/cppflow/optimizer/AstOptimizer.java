package com.github.musiKk.cppflow.optimizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.github.musiKk.cppflow.Tokenizer.TokenType;
import com.github.musiKk.cppflow.parser.CompilationUnit;
import com.github.musiKk.cppflow.parser.CompilationUnit.AssignmentExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.BinaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.Block;
import com.github.musiKk.cppflow.parser.CompilationUnit.BreakStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ContinueStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declaration;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declarator;
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
import com.github.musiKk.cppflow.parser.CompilationUnit.MemberExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.NewExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.PostfixExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.ReturnStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Statement;
import com.github.musiKk.cppflow.parser.CompilationUnit.UnaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.WhileStatement;

/**
 * Local rewrites of flat statement lists: statements after an unconditional
 * {@code return}, {@code break} or {@code continue} are dropped, and an
 * assignment that is overwritten before anything reads it is removed or
 * folded into the variable's declaration.
 * <p>
 * Every statement list (program, block, function and loop bodies, branches)
 * is optimized on its own; nested statements are opaque to the list that
 * contains them.
 */
public class AstOptimizer {

    private static final Logger LOG = Logger.getLogger(AstOptimizer.class.getName());

    private static final Set<String> STREAMS = Set.of("cin", "cout", "cerr", "clog");

    private int removed;

    public CompilationUnit optimize(CompilationUnit compilationUnit) {
        removed = 0;
        var result = new CompilationUnit(optimizeList(compilationUnit.statements()));
        LOG.fine(() -> "optimizer removed " + removed + " statements");
        return result;
    }

    List<Statement> optimizeList(List<Statement> statements) {
        List<Statement> optimized = new ArrayList<>(statements.size());
        for (var statement : statements) {
            optimized.add(optimize(statement));
        }
        optimized = eliminateDeadCode(optimized);
        optimized = eliminateRedundantAssignments(optimized);
        return optimized;
    }

    private Statement optimize(Statement statement) {
        if (statement instanceof Block b) {
            return new Block(optimizeList(b.statements()));
        } else if (statement instanceof IfStatement is) {
            return new IfStatement(is.condition(), optimize(is.thenBranch()), is.elseBranch().map(this::optimize));
        } else if (statement instanceof WhileStatement ws) {
            return new WhileStatement(ws.condition(), optimize(ws.body()));
        } else if (statement instanceof DoWhileStatement dws) {
            return new DoWhileStatement(optimize(dws.body()), dws.condition());
        } else if (statement instanceof ForStatement fs) {
            return new ForStatement(fs.init(), fs.condition(), fs.update(), optimize(fs.body()));
        } else if (statement instanceof FunctionDefinition fd) {
            return new FunctionDefinition(fd.returnType(), fd.name(), fd.parameters(),
                    fd.body().map(body -> new Block(optimizeList(body.statements()))), fd.position());
        }
        return statement;
    }

    // pass 1
    List<Statement> eliminateDeadCode(List<Statement> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (var statement : statements) {
            result.add(statement);
            if (isTerminator(statement)) {
                removed += statements.size() - result.size();
                break;
            }
        }
        return result;
    }

    private static boolean isTerminator(Statement statement) {
        return statement instanceof ReturnStatement
                || statement instanceof BreakStatement
                || statement instanceof ContinueStatement;
    }

    private static final class LastWrite {
        final int index;
        // -1 for assignments
        final int declarator;
        final boolean inDeclaration;
        // the overwritten value may be dropped only if computing it had no effect
        final boolean removable;
        boolean usedSince;

        LastWrite(int index, int declarator, boolean inDeclaration, boolean removable) {
            this.index = index;
            this.declarator = declarator;
            this.inDeclaration = inDeclaration;
            this.removable = removable;
        }
    }

    // pass 2
    List<Statement> eliminateRedundantAssignments(List<Statement> input) {
        List<Statement> statements = new ArrayList<>(input);
        Map<String, LastWrite> lastWrites = new HashMap<>();
        Set<Integer> toRemove = new HashSet<>();

        for (int i = 0; i < statements.size(); i++) {
            var statement = statements.get(i);

            if (statement instanceof ExpressionStatement es
                    && es.expression() instanceof AssignmentExpression assignment
                    && assignment.isPlain()
                    && assignment.target() instanceof IdentifierExpression target) {
                var value = assignment.value();
                recordReads(value, lastWrites);

                var previous = lastWrites.get(target.name());
                if (previous != null && !previous.usedSince && previous.removable) {
                    if (!previous.inDeclaration) {
                        toRemove.add(previous.index);
                    } else if (isSideEffectFree(value)
                            && !mentionedBetween(statements, previous.index, i, toRemove, identifiers(value))) {
                        var declaration = (Declaration) statements.get(previous.index);
                        statements.set(previous.index, withInitializer(declaration, previous.declarator, value));
                        toRemove.add(i);
                    }
                }
                lastWrites.put(target.name(), new LastWrite(i, -1, false, isSideEffectFree(value)));
            } else if (statement instanceof ExpressionStatement es) {
                recordReads(es.expression(), lastWrites);
            } else if (statement instanceof Declaration declaration) {
                var declarators = declaration.declarators();
                for (int d = 0; d < declarators.size(); d++) {
                    var declarator = declarators.get(d);
                    boolean removable = true;
                    if (declarator.initializer().isPresent()) {
                        var initializer = declarator.initializer().get();
                        recordReads(initializer, lastWrites);
                        removable = isSideEffectFree(initializer);
                    }
                    lastWrites.put(declarator.name(), new LastWrite(i, d, true, removable));
                }
            } else if (statement instanceof Block b && b.statements().isEmpty()) {
                continue;
            } else {
                // control flow may read anything
                lastWrites.clear();
            }
        }

        removed += toRemove.size();
        List<Statement> result = new ArrayList<>(statements.size() - toRemove.size());
        for (int i = 0; i < statements.size(); i++) {
            if (!toRemove.contains(i)) {
                result.add(statements.get(i));
            }
        }
        return result;
    }

    private static void recordReads(Expression expression, Map<String, LastWrite> lastWrites) {
        if (containsCall(expression)) {
            // a call may read any variable
            lastWrites.clear();
            return;
        }
        for (var name : identifiers(expression)) {
            var lastWrite = lastWrites.get(name);
            if (lastWrite != null) {
                lastWrite.usedSince = true;
            }
        }
    }

    private static boolean mentionedBetween(List<Statement> statements, int from, int to,
            Set<Integer> removed, Set<String> names) {
        for (int k = from + 1; k < to; k++) {
            if (removed.contains(k)) {
                continue;
            }
            var mentioned = new HashSet<String>();
            var statement = statements.get(k);
            if (statement instanceof ExpressionStatement es) {
                collectIdentifiers(es.expression(), mentioned);
            } else if (statement instanceof Declaration declaration) {
                for (var declarator : declaration.declarators()) {
                    mentioned.add(declarator.name());
                    declarator.initializer().ifPresent(init -> collectIdentifiers(init, mentioned));
                }
            }
            for (var name : names) {
                if (mentioned.contains(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Declaration withInitializer(Declaration declaration, int index, Expression value) {
        List<Declarator> declarators = new ArrayList<>(declaration.declarators());
        declarators.set(index, declarators.get(index).withInitializer(value));
        return new Declaration(declaration.type(), declaration.constant(), declarators);
    }

    static Set<String> identifiers(Expression expression) {
        var names = new HashSet<String>();
        collectIdentifiers(expression, names);
        return names;
    }

    // assignment targets are collected too, a[i] = ... reads i
    private static void collectIdentifiers(Expression expression, Set<String> names) {
        if (expression instanceof IdentifierExpression ie) {
            names.add(ie.name());
        } else if (expression instanceof AssignmentExpression ae) {
            collectIdentifiers(ae.target(), names);
            collectIdentifiers(ae.value(), names);
        } else if (expression instanceof BinaryExpression be) {
            collectIdentifiers(be.left(), names);
            collectIdentifiers(be.right(), names);
        } else if (expression instanceof UnaryExpression ue) {
            collectIdentifiers(ue.operand(), names);
        } else if (expression instanceof PostfixExpression pe) {
            collectIdentifiers(pe.operand(), names);
        } else if (expression instanceof IndexExpression ie) {
            collectIdentifiers(ie.target(), names);
            collectIdentifiers(ie.index(), names);
        } else if (expression instanceof MemberExpression me) {
            collectIdentifiers(me.target(), names);
        } else if (expression instanceof FunctionEvaluationExpression fe) {
            collectIdentifiers(fe.function(), names);
            fe.arguments().forEach(a -> collectIdentifiers(a, names));
        } else if (expression instanceof NewExpression ne) {
            ne.size().ifPresent(s -> collectIdentifiers(s, names));
        } else if (expression instanceof InitializerListExpression il) {
            il.elements().forEach(e -> collectIdentifiers(e, names));
        } else if (!(expression instanceof LiteralExpression)) {
            throw new IllegalArgumentException("unknown expression " + expression);
        }
    }

    static boolean containsCall(Expression expression) {
        if (expression instanceof FunctionEvaluationExpression) {
            return true;
        } else if (expression instanceof AssignmentExpression ae) {
            return containsCall(ae.target()) || containsCall(ae.value());
        } else if (expression instanceof BinaryExpression be) {
            return containsCall(be.left()) || containsCall(be.right());
        } else if (expression instanceof UnaryExpression ue) {
            return containsCall(ue.operand());
        } else if (expression instanceof PostfixExpression pe) {
            return containsCall(pe.operand());
        } else if (expression instanceof IndexExpression ie) {
            return containsCall(ie.target()) || containsCall(ie.index());
        } else if (expression instanceof MemberExpression me) {
            return containsCall(me.target());
        } else if (expression instanceof NewExpression ne) {
            return ne.size().map(AstOptimizer::containsCall).orElse(false);
        } else if (expression instanceof InitializerListExpression il) {
            return il.elements().stream().anyMatch(AstOptimizer::containsCall);
        }
        return false;
    }

    static boolean isSideEffectFree(Expression expression) {
        if (expression instanceof IdentifierExpression ie) {
            var name = ie.name().startsWith("std::") ? ie.name().substring(5) : ie.name();
            return !STREAMS.contains(name);
        } else if (expression instanceof LiteralExpression) {
            return true;
        } else if (expression instanceof BinaryExpression be) {
            return isSideEffectFree(be.left()) && isSideEffectFree(be.right());
        } else if (expression instanceof UnaryExpression ue) {
            return ue.operator() != TokenType.PLUS_PLUS && ue.operator() != TokenType.MINUS_MINUS
                    && isSideEffectFree(ue.operand());
        } else if (expression instanceof IndexExpression ie) {
            return isSideEffectFree(ie.target()) && isSideEffectFree(ie.index());
        } else if (expression instanceof MemberExpression me) {
            return isSideEffectFree(me.target());
        } else if (expression instanceof InitializerListExpression il) {
            return il.elements().stream().allMatch(AstOptimizer::isSideEffectFree);
        }
        // assignments, increments, calls and allocations
        return false;
    }
}
