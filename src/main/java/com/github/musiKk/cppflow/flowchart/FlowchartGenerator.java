package com.github.musiKk.cppflow.flowchart;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import com.github.musiKk.cppflow.flowchart.Flow.Continues;
import com.github.musiKk.cppflow.parser.CompilationUnit;
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
import com.github.musiKk.cppflow.parser.CompilationUnit.MemberExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.NewExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.PostfixExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.ReturnStatement;
import com.github.musiKk.cppflow.parser.CompilationUnit.Statement;
import com.github.musiKk.cppflow.parser.CompilationUnit.UnaryExpression;
import com.github.musiKk.cppflow.parser.CompilationUnit.WhileStatement;
import com.github.musiKk.cppflow.parser.ExpressionPrinter;

/**
 * Turns an AST into a {@link Flowchart} with one start and one end node.
 * <p>
 * Traversal keeps a single frontier: a statement receives the {@link Flow} of
 * its predecessor and returns its own. A statement that ends in several
 * places (an if without else, a loop with breaks) parks all of them in the
 * pending tails and returns {@link Flow.Diverges}; the next node created is
 * connected from every pending tail. A returned {@link Flow.Continues} always
 * means the pending tails are empty.
 */
public class FlowchartGenerator {

    private static final Logger LOG = Logger.getLogger(FlowchartGenerator.class.getName());

    public static final Set<String> DEFAULT_IO_IDENTIFIERS = Set.of(
            "cin", "cout", "cerr", "clog", "printf", "scanf", "puts", "gets", "getline", "getchar", "putchar");

    private final Set<String> ioIdentifiers;
    private final String startLabel;
    private final String endLabel;
    private final String yesLabel;
    private final String noLabel;

    private Flowchart chart;
    private List<Continues> pending;
    private Deque<LoopContext> loops;
    // returns and the exits of functions other than main
    private List<Continues> endTails;

    public FlowchartGenerator() {
        this(DEFAULT_IO_IDENTIFIERS, "start", "end", "yes", "no");
    }

    public FlowchartGenerator(Set<String> ioIdentifiers, String startLabel, String endLabel, String yesLabel, String noLabel) {
        this.ioIdentifiers = Set.copyOf(ioIdentifiers);
        this.startLabel = startLabel;
        this.endLabel = endLabel;
        this.yesLabel = yesLabel;
        this.noLabel = noLabel;
    }

    public Flowchart generate(CompilationUnit compilationUnit) {
        chart = new Flowchart(yesLabel, noLabel);
        pending = new ArrayList<>();
        loops = new ArrayDeque<>();
        endTails = new ArrayList<>();

        var start = chart.addNode(NodeShape.TERMINATOR, startLabel);
        var flow = statements(compilationUnit.statements(), Continues.from(start));

        var end = chart.addNode(NodeShape.TERMINATOR, endLabel);
        for (var tail : drain(flow)) {
            connect(tail, end);
        }
        for (var tail : endTails) {
            connect(tail, end);
        }

        LOG.fine(() -> "flowchart has " + chart.nodes().size() + " nodes, " + chart.edges().size() + " edges");
        return chart;
    }

    private Flow statements(List<Statement> statements, Flow incoming) {
        var flow = incoming;
        for (var statement : statements) {
            flow = statement(statement, flow);
        }
        return flow;
    }

    private Flow statement(Statement statement, Flow incoming) {
        if (statement instanceof Block b) {
            return statements(b.statements(), incoming);
        } else if (statement instanceof IfStatement is) {
            return ifStatement(is, incoming);
        } else if (statement instanceof WhileStatement ws) {
            return whileStatement(ws, incoming);
        } else if (statement instanceof DoWhileStatement dws) {
            return doWhileStatement(dws, incoming);
        } else if (statement instanceof ForStatement fs) {
            return forStatement(fs, incoming);
        } else if (statement instanceof BreakStatement) {
            return breakStatement(incoming);
        } else if (statement instanceof ContinueStatement) {
            return continueStatement(incoming);
        } else if (statement instanceof ReturnStatement rs) {
            var label = rs.value().map(v -> "return " + ExpressionPrinter.print(v)).orElse("return");
            var node = chart.addNode(rs.value().filter(this::isIo).isPresent() ? NodeShape.IO : NodeShape.PROCESS, label);
            connectIncoming(node, incoming);
            endTails.add(Continues.from(node));
            return Flow.DIVERGES;
        } else if (statement instanceof FunctionDefinition fd) {
            return function(fd, incoming);
        } else if (statement instanceof ExpressionStatement es) {
            return leaf(ExpressionPrinter.print(es.expression()), isIo(es.expression()), incoming);
        } else if (statement instanceof Declaration d) {
            boolean io = d.declarators().stream()
                    .anyMatch(declarator -> declarator.initializer().filter(this::isIo).isPresent());
            return leaf(ExpressionPrinter.print(d), io, incoming);
        } else if (statement instanceof DeleteStatement ds) {
            return leaf((ds.array() ? "delete[] " : "delete ") + ExpressionPrinter.print(ds.target()), false, incoming);
        }
        throw new IllegalArgumentException("unknown statement " + statement);
    }

    private Flow leaf(String label, boolean io, Flow incoming) {
        var node = chart.addNode(io ? NodeShape.IO : NodeShape.PROCESS, label);
        connectIncoming(node, incoming);
        return Continues.from(node);
    }

    private Flow ifStatement(IfStatement ifStatement, Flow incoming) {
        var decision = chart.addNode(NodeShape.DECISION, ExpressionPrinter.print(ifStatement.condition()));
        connectIncoming(decision, incoming);

        var thenFlow = statement(ifStatement.thenBranch(), Continues.from(decision, yesLabel));
        List<Continues> tails = drain(thenFlow);

        if (ifStatement.elseBranch().isPresent()) {
            var elseFlow = statement(ifStatement.elseBranch().get(), Continues.from(decision, noLabel));
            tails.addAll(drain(elseFlow));
        } else {
            tails.add(Continues.from(decision, noLabel));
        }
        return settle(tails);
    }

    private Flow whileStatement(WhileStatement whileStatement, Flow incoming) {
        var decision = chart.addNode(NodeShape.DECISION, ExpressionPrinter.print(whileStatement.condition()));
        connectIncoming(decision, incoming);

        var loop = new LoopContext(Optional.of(decision));
        loops.push(loop);
        var bodyFlow = statement(whileStatement.body(), Continues.from(decision, yesLabel));
        loops.pop();

        for (var tail : drain(bodyFlow)) {
            connect(tail, decision);
        }
        return exits(decision, loop);
    }

    private Flow doWhileStatement(DoWhileStatement doWhile, Flow incoming) {
        int firstBodyNode = chart.nodes().size();

        var loop = new LoopContext(Optional.empty());
        loops.push(loop);
        var bodyFlow = statement(doWhile.body(), incoming);
        loops.pop();

        var decision = chart.addNode(NodeShape.DECISION, ExpressionPrinter.print(doWhile.condition()));
        for (var tail : drain(bodyFlow)) {
            connect(tail, decision);
        }
        for (var tail : loop.deferredContinues()) {
            connect(tail, decision);
        }

        // the body's first node is its entry; an empty body loops on the condition itself
        var entry = chart.nodes().get(firstBodyNode).id();
        chart.addEdge(decision, entry, Optional.of(yesLabel));
        return exits(decision, loop);
    }

    private Flow forStatement(ForStatement forStatement, Flow incoming) {
        var flow = forStatement.init().map(init -> statement(init, incoming)).orElse(incoming);

        var conditionLabel = forStatement.condition().map(ExpressionPrinter::print).orElse("true");
        var decision = chart.addNode(NodeShape.DECISION, conditionLabel);
        connectIncoming(decision, flow);

        var loop = new LoopContext(forStatement.update().isPresent() ? Optional.empty() : Optional.of(decision));
        loops.push(loop);
        var bodyFlow = statement(forStatement.body(), Continues.from(decision, yesLabel));
        loops.pop();

        var tails = drain(bodyFlow);
        if (forStatement.update().isPresent()) {
            var update = forStatement.update().get();
            var updateNode = chart.addNode(isIo(update) ? NodeShape.IO : NodeShape.PROCESS, ExpressionPrinter.print(update));
            tails.addAll(loop.deferredContinues());
            for (var tail : tails) {
                connect(tail, updateNode);
            }
            chart.addEdge(updateNode, decision, Optional.empty());
        } else {
            for (var tail : tails) {
                connect(tail, decision);
            }
        }
        return exits(decision, loop);
    }

    private Flow exits(String decision, LoopContext loop) {
        List<Continues> exits = new ArrayList<>();
        exits.add(Continues.from(decision, noLabel));
        exits.addAll(loop.exitTails());
        return settle(exits);
    }

    private Flow breakStatement(Flow incoming) {
        var node = chart.addNode(NodeShape.PROCESS, "break");
        connectIncoming(node, incoming);
        if (loops.isEmpty()) {
            return Continues.from(node);
        }
        loops.peek().exitTails().add(Continues.from(node));
        return Flow.DIVERGES;
    }

    private Flow continueStatement(Flow incoming) {
        var node = chart.addNode(NodeShape.PROCESS, "continue");
        connectIncoming(node, incoming);
        if (loops.isEmpty()) {
            return Continues.from(node);
        }
        var loop = loops.peek();
        if (loop.continueTarget().isPresent()) {
            chart.addEdge(node, loop.continueTarget().get(), Optional.empty());
        } else {
            loop.deferredContinues().add(Continues.from(node));
        }
        return Flow.DIVERGES;
    }

    private Flow function(FunctionDefinition function, Flow incoming) {
        if (function.body().isEmpty()) {
            return incoming;
        }
        var body = function.body().get();

        if (function.isMain()) {
            var header = chart.addNode(NodeShape.PROCESS, ExpressionPrinter.signature(function));
            connectIncoming(header, incoming);
            return statements(body.statements(), Continues.from(header));
        }

        // drawn as a separate chain that leaves the main frontier untouched
        List<Continues> outerPending = new ArrayList<>(pending);
        pending.clear();
        var outerLoops = loops;
        loops = new ArrayDeque<>();

        var header = chart.addNode(NodeShape.PROCESS, ExpressionPrinter.signature(function));
        var flow = statements(body.statements(), Continues.from(header));
        endTails.addAll(drain(flow));

        loops = outerLoops;
        pending.addAll(outerPending);
        return incoming;
    }

    private void connectIncoming(String node, Flow incoming) {
        if (incoming instanceof Continues c) {
            connect(c, node);
        }
        for (var tail : pending) {
            connect(tail, node);
        }
        pending.clear();
    }

    private void connect(Continues tail, String to) {
        chart.addEdge(tail.nodeId(), to, tail.edgeLabel());
    }

    /** All open tails of {@code flow}; the pending list is emptied. */
    private List<Continues> drain(Flow flow) {
        List<Continues> tails = new ArrayList<>(pending);
        pending.clear();
        if (flow instanceof Continues c) {
            tails.add(c);
        }
        return tails;
    }

    private Flow settle(List<Continues> tails) {
        if (tails.size() == 1) {
            return tails.get(0);
        }
        pending.addAll(tails);
        return Flow.DIVERGES;
    }

    private boolean isIo(Expression expression) {
        if (expression instanceof IdentifierExpression ie) {
            var name = ie.name();
            return ioIdentifiers.contains(name.substring(name.lastIndexOf(':') + 1));
        } else if (expression instanceof AssignmentExpression ae) {
            return isIo(ae.target()) || isIo(ae.value());
        } else if (expression instanceof BinaryExpression be) {
            return isIo(be.left()) || isIo(be.right());
        } else if (expression instanceof UnaryExpression ue) {
            return isIo(ue.operand());
        } else if (expression instanceof PostfixExpression pe) {
            return isIo(pe.operand());
        } else if (expression instanceof IndexExpression ie) {
            return isIo(ie.target()) || isIo(ie.index());
        } else if (expression instanceof MemberExpression me) {
            return isIo(me.target());
        } else if (expression instanceof FunctionEvaluationExpression fe) {
            return isIo(fe.function()) || fe.arguments().stream().anyMatch(this::isIo);
        } else if (expression instanceof NewExpression ne) {
            return ne.size().filter(this::isIo).isPresent();
        } else if (expression instanceof InitializerListExpression il) {
            return il.elements().stream().anyMatch(this::isIo);
        }
        return false;
    }
}
