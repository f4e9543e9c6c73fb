package com.github.musiKk.cppflow.parser;

import java.util.ArrayList;
import java.util.List;

import com.github.musiKk.cppflow.parser.CompilationUnit.AssignmentExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.BinaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.Block;
import com.github.musiKk.cppflow.parser.CompilationUnit.BreakStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.ContinueStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Declaration;
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
import com.github.musiKk.cppflow.parser.CompilationUnit.MemberExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.NewExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.PostfixExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.ReturnStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Statement;
import com.github.musiKk.cppflow.parser.CompilationUnit.UnaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.WhileStatement;

/** Renders an AST as an indented tree with box-drawing connectors. */
public final class AstPrinter {

    private AstPrinter() {}

    private record Node(String label, List<Node> children) {
        Node(String label) {
            this(label, new ArrayList<>());
        }

        Node with(Node child) {
            children.add(child);
            return this;
        }

        Node with(String label, Node child) {
            return with(new Node(label).with(child));
        }
    }

    public static String render(CompilationUnit compilationUnit) {
        var root = new Node("Program");
        compilationUnit.statements().forEach(s -> root.with(node(s)));
        var sb = new StringBuilder(root.label()).append('\n');
        drawChildren(root, "", sb);
        return sb.toString();
    }

    private static void drawChildren(Node node, String prefix, StringBuilder sb) {
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            var child = children.get(i);
            sb.append(prefix).append(last ? "└── " : "├── ").append(child.label()).append('\n');
            drawChildren(child, prefix + (last ? "    " : "│   "), sb);
        }
    }

    private static Node node(Statement statement) {
        if (statement instanceof ExpressionStatement es) {
            return new Node("ExpressionStatement").with(node(es.expression()));
        } else if (statement instanceof Declaration d) {
            var declaration = new Node("Declaration " + (d.constant() ? "const " : "") + d.type());
            for (var declarator : d.declarators()) {
                var child = new Node("Declarator " + declarator.name() + " : " + declarator.type());
                declarator.initializer().ifPresent(init -> child.with(node(init)));
                declaration.with(child);
            }
            return declaration;
        } else if (statement instanceof Block b) {
            var block = new Node("Block");
            b.statements().forEach(s -> block.with(node(s)));
            return block;
        } else if (statement instanceof IfStatement is) {
            var n = new Node("If")
                    .with("condition", node(is.condition()))
                    .with("then", node(is.thenBranch()));
            is.elseBranch().ifPresent(e -> n.with("else", node(e)));
            return n;
        } else if (statement instanceof WhileStatement ws) {
            return new Node("While")
                    .with("condition", node(ws.condition()))
                    .with("body", node(ws.body()));
        } else if (statement instanceof DoWhileStatement dws) {
            return new Node("DoWhile")
                    .with("body", node(dws.body()))
                    .with("condition", node(dws.condition()));
        } else if (statement instanceof ForStatement fs) {
            var n = new Node("For");
            fs.init().ifPresent(i -> n.with("init", node(i)));
            fs.condition().ifPresent(c -> n.with("condition", node(c)));
            fs.update().ifPresent(u -> n.with("update", node(u)));
            return n.with("body", node(fs.body()));
        } else if (statement instanceof BreakStatement) {
            return new Node("Break");
        } else if (statement instanceof ContinueStatement) {
            return new Node("Continue");
        } else if (statement instanceof ReturnStatement rs) {
            var n = new Node("Return");
            rs.value().ifPresent(v -> n.with(node(v)));
            return n;
        } else if (statement instanceof DeleteStatement ds) {
            return new Node(ds.array() ? "Delete[]" : "Delete").with(node(ds.target()));
        } else if (statement instanceof FunctionDefinition fd) {
            var n = new Node("Function " + ExpressionPrinter.signature(fd));
            if (fd.body().isPresent()) {
                n.with(node(fd.body().get()));
            } else {
                n.with(new Node("(prototype)"));
            }
            return n;
        }
        throw new IllegalArgumentException("unknown statement " + statement);
    }

    private static Node node(Expression expression) {
        if (expression instanceof IdentifierExpression ie) {
            return new Node("Identifier " + ie.name());
        } else if (expression instanceof LiteralExpression le) {
            return new Node("Literal " + le.kind().name().toLowerCase() + " " + le.value());
        } else if (expression instanceof AssignmentExpression ae) {
            return new Node("Assign " + ae.operator().text()).with(node(ae.target())).with(node(ae.value()));
        } else if (expression instanceof BinaryExpression be) {
            return new Node("Binary " + be.operator().text()).with(node(be.left())).with(node(be.right()));
        } else if (expression instanceof UnaryExpression ue) {
            return new Node("Unary " + ue.operator().text()).with(node(ue.operand()));
        } else if (expression instanceof PostfixExpression pe) {
            return new Node("Postfix " + pe.operator().text()).with(node(pe.operand()));
        } else if (expression instanceof IndexExpression ie) {
            return new Node("Index").with(node(ie.target())).with(node(ie.index()));
        } else if (expression instanceof MemberExpression me) {
            return new Node("Member " + (me.arrow() ? "->" : ".") + me.member()).with(node(me.target()));
        } else if (expression instanceof FunctionEvaluationExpression fe) {
            var n = new Node("Call").with(node(fe.function()));
            fe.arguments().forEach(a -> n.with(node(a)));
            return n;
        } else if (expression instanceof NewExpression ne) {
            var n = new Node("New " + ne.type());
            ne.size().ifPresent(s -> n.with(node(s)));
            return n;
        } else if (expression instanceof InitializerListExpression il) {
            var n = new Node("InitializerList");
            il.elements().forEach(e -> n.with(node(e)));
            return n;
        }
        throw new IllegalArgumentException("unknown expression " + expression);
    }
}
