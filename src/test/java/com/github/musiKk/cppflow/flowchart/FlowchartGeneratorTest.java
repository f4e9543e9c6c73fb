package com.github.musiKk.cppflow.flowchart;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.cppflow.Tokenizer;
import com.github.musiKk.cppflow.flowchart.Flowchart.Edge;
import com.github.musiKk.cppflow.flowchart.Flowchart.Node;
import com.github.musiKk.cppflow.parser.CompilationUnit;
import com.github.musiKk.cppflow.parser.Parser;
import com.github.musiKk.cppflow.parser.TopLevelMode;

public class FlowchartGeneratorTest {

    private static CompilationUnit parse(String code) {
        return new Parser(TopLevelMode.STATEMENTS).parseProgram(new Tokenizer().tokenize(code))
                .compilationUnit().orElseThrow();
    }

    private static Flowchart generate(String code) {
        return new FlowchartGenerator().generate(parse(code));
    }

    private static String id(Flowchart chart, String label) {
        var matches = chart.nodes().stream().filter(n -> n.label().equals(label)).toList();
        assertEquals(1, matches.size(), "nodes labeled " + label);
        return matches.get(0).id();
    }

    private static boolean hasEdge(Flowchart chart, String from, String to, Optional<String> label) {
        return chart.edges().contains(new Edge(from, to, label));
    }

    private static Object[] programs() {
        return new Object[] {
            "int x=0; int n=10; while(x<n){ if (x%2==0){ cout<<x; } x++; }",
            "int x = 0;",
            "",
            "int i = 0; do { i++; } while (i < 3);",
            "int i = 0; do { } while (i < 3);",
            "for (int i = 0; i < 5; i++) { if (i == 2) continue; if (i == 4) break; cout << i; }",
            "for (;;) { break; }",
            "for (int i = 0; ; ) { continue; }",
            "int x = 0; while (x < 3) { if (x == 1) { x++; continue; } else { x += 2; } }",
            "int x = 0; if (x > 0) { return 1; } else if (x < 0) { return 2; } else { x = 3; }",
            "int x = 0; if (x) {} x = 1;",
            "int x = 0; while (x < 5) { while (x < 3) { x++; break; } x += 2; }",
            "int x = 0; do { if (x > 2) break; x++; continue; } while (x < 10);",
            "int twice(int a) { return a * 2; } int y = twice(2);",
            "int main() { int x; cin >> x; if (x > 0) cout << x; else cout << -x; return 0; }",
            "break; continue; int x = 1;",
            "int main() { int x = 0; do { int f() { return 1; } x++; } while (x < 3); return 0; }",
        };
    }

    @ParameterizedTest
    @MethodSource("programs")
    public void testSingleEndNode(String code) {
        var chart = generate(code);
        var terminators = chart.nodes(NodeShape.TERMINATOR);
        assertEquals(2, terminators.size());
        assertEquals(1, terminators.stream().filter(n -> n.label().equals("end")).count());
        assertEquals(List.of(), chart.outgoing(id(chart, "end")));
        assertEquals(List.of(), chart.incoming(id(chart, "start")));
    }

    @ParameterizedTest
    @MethodSource("programs")
    public void testDecisionsHaveYesAndNoEdges(String code) {
        var chart = generate(code);
        for (var decision : chart.nodes(NodeShape.DECISION)) {
            var labels = chart.outgoing(decision.id()).stream()
                    .map(e -> e.label().orElse("<none>"))
                    .sorted()
                    .toList();
            assertEquals(List.of("no", "yes"), labels, "edges of " + decision);
        }
    }

    @ParameterizedTest
    @MethodSource("programs")
    public void testEveryReachableNodeReachesEnd(String code) {
        var chart = generate(code);
        var end = id(chart, "end");
        var reachable = reach(id(chart, "start"), from -> chart.outgoing(from).stream().map(Edge::to).toList());
        var reachesEnd = reach(end, to -> chart.incoming(to).stream().map(Edge::from).toList());
        assertTrue(reachable.contains(end));
        for (var node : reachable) {
            assertTrue(reachesEnd.contains(node), node + " does not reach the end");
        }
    }

    private static Set<String> reach(String origin, Function<String, List<String>> neighbours) {
        Set<String> seen = new HashSet<>();
        var queue = new ArrayDeque<String>();
        queue.add(origin);
        while (!queue.isEmpty()) {
            var node = queue.poll();
            if (seen.add(node)) {
                queue.addAll(neighbours.apply(node));
            }
        }
        return seen;
    }

    @Test
    public void testScenario() {
        var chart = generate("int x=0; int n=10; while(x<n){ if (x%2==0){ cout<<x; } x++; }");

        assertEquals(2, chart.nodes(NodeShape.DECISION).size());
        var loop = id(chart, "x < n");
        var even = id(chart, "x % 2 == 0");
        assertEquals(NodeShape.DECISION, chart.node(loop).shape());
        assertEquals(NodeShape.DECISION, chart.node(even).shape());

        var io = chart.nodes(NodeShape.IO);
        assertEquals(1, io.size());
        assertEquals("cout << x", io.get(0).label());

        var increment = id(chart, "x++");
        assertTrue(hasEdge(chart, increment, loop, Optional.empty()), "back edge from x++");
        assertTrue(hasEdge(chart, loop, even, Optional.of("yes")));
        assertTrue(hasEdge(chart, even, io.get(0).id(), Optional.of("yes")));
        assertTrue(hasEdge(chart, even, increment, Optional.of("no")));
        assertTrue(hasEdge(chart, io.get(0).id(), increment, Optional.empty()));
        assertTrue(hasEdge(chart, loop, id(chart, "end"), Optional.of("no")));
        assertEquals(8, chart.nodes().size());
    }

    @Test
    public void testForLoopBreakAndContinue() {
        var chart = generate("for (int i = 0; i < 5; i++) { if (i == 2) continue; if (i == 4) break; cout << i; }");
        var decision = id(chart, "i < 5");
        var update = id(chart, "i++");
        var end = id(chart, "end");

        assertTrue(hasEdge(chart, id(chart, "int i = 0"), decision, Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "continue"), update, Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "break"), end, Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "cout << i"), update, Optional.empty()));
        assertTrue(hasEdge(chart, update, decision, Optional.empty()));
        assertTrue(hasEdge(chart, decision, end, Optional.of("no")));
        assertTrue(hasEdge(chart, id(chart, "i == 2"), id(chart, "i == 4"), Optional.of("no")));
    }

    @Test
    public void testWhileContinueGoesToCondition() {
        var chart = generate("int x = 0; while (x < 3) { x++; continue; }");
        assertTrue(hasEdge(chart, id(chart, "continue"), id(chart, "x < 3"), Optional.empty()));
    }

    @Test
    public void testDoWhile() {
        var chart = generate("int i = 0; do { i++; } while (i < 3);");
        var body = id(chart, "i++");
        var decision = id(chart, "i < 3");
        assertTrue(hasEdge(chart, id(chart, "int i = 0"), body, Optional.empty()));
        assertTrue(hasEdge(chart, body, decision, Optional.empty()));
        assertTrue(hasEdge(chart, decision, body, Optional.of("yes")));
        assertTrue(hasEdge(chart, decision, id(chart, "end"), Optional.of("no")));
    }

    @Test
    public void testDoWhileLoopsBackIntoItsOwnBody() {
        var chart = generate("int main() { int x = 0; do { int f() { return 1; } x++; } while (x < 3); return 0; }");
        assertTrue(chart.nodes().stream().noneMatch(n -> n.label().equals("int f()")));
        var body = id(chart, "x++");
        assertTrue(hasEdge(chart, id(chart, "int x = 0"), body, Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "x < 3"), body, Optional.of("yes")));
    }

    @Test
    public void testReturnGoesToEnd() {
        var chart = generate("int main() { int x = 0; if (x > 0) { return 1; } x = 2; return x; }");
        var end = id(chart, "end");
        assertTrue(hasEdge(chart, id(chart, "int main()"), id(chart, "int x = 0"), Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "return 1"), end, Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "return x"), end, Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "x > 0"), id(chart, "x = 2"), Optional.of("no")));
    }

    @Test
    public void testOtherFunctionsAreDetached() {
        var chart = generate("int twice(int a) { return a * 2; } int y = twice(2);");
        var header = id(chart, "int twice(int a)");
        assertEquals(List.of(), chart.incoming(header));
        assertTrue(hasEdge(chart, id(chart, "start"), id(chart, "int y = twice(2)"), Optional.empty()));
        assertTrue(hasEdge(chart, id(chart, "return a * 2"), id(chart, "end"), Optional.empty()));
    }

    @Test
    public void testConfiguredLabels() {
        var generator = new FlowchartGenerator(Set.of("print"), "Begin", "Finish", "true", "false");
        var chart = generator.generate(parse("int x = 0; if (x) { print(x); }"));
        var labels = chart.nodes(NodeShape.TERMINATOR).stream().map(Node::label).toList();
        assertEquals(List.of("Begin", "Finish"), labels);
        var decision = id(chart, "x");
        assertTrue(hasEdge(chart, decision, id(chart, "print(x)"), Optional.of("true")));
        assertTrue(hasEdge(chart, decision, id(chart, "Finish"), Optional.of("false")));
        assertEquals(NodeShape.IO, chart.node(id(chart, "print(x)")).shape());
    }

    @Test
    public void testMermaidText() {
        var chart = generate("string s = \"hi\"; std::cout << s[0];");
        var expected = """
                %%{init: {'flowchart': {
                 'curve': 'linear',
                 'nodeSpacing': 80,
                 'rankSpacing': 100,
                 'diagramPadding': 40,
                 'defaultRenderer': 'elk'
                }}}%%
                flowchart TD
                 n0([start])
                 n1["string s = 'hi'"]
                 n2[/std::cout &lt;&lt; s(0)/]
                 n3([end])
                 n0 --> n1
                 n1 --> n2
                 n2 --> n3
                """;
        assertEquals(expected, chart.toMermaid());
    }

    @Test
    public void testMermaidDecisionEdgeLabels() {
        var text = generate("int x = 0; while (x < 2) x++;").toMermaid();
        assertTrue(text.contains(" n2{x &lt; 2}\n"), text);
        assertTrue(text.contains(" n2 -->|yes| n3\n"), text);
        assertTrue(text.contains(" n2 -->|no| n4\n"), text);
        assertTrue(text.contains(" n3 --> n2\n"), text);
    }

}
