package com.github.musiKk.cppflow.flowchart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only node and edge buffer of a generated flowchart. Edges leaving a
 * decision without an explicit label are labeled yes, then no.
 */
public class Flowchart {

    public record Node(String id, NodeShape shape, String label) {}

    public record Edge(String from, String to, Optional<String> label) {}

    private static final String HEADER = """
            %%{init: {'flowchart': {
             'curve': 'linear',
             'nodeSpacing': 80,
             'rankSpacing': 100,
             'diagramPadding': 40,
             'defaultRenderer': 'elk'
            }}}%%
            flowchart TD
            """;

    private final String yesLabel;
    private final String noLabel;
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, Node> nodesById = new HashMap<>();
    private final Map<String, Integer> decisionEdgeCount = new HashMap<>();

    public Flowchart(String yesLabel, String noLabel) {
        this.yesLabel = yesLabel;
        this.noLabel = noLabel;
    }

    String addNode(NodeShape shape, String label) {
        var node = new Node("n" + nodes.size(), shape, label);
        nodes.add(node);
        nodesById.put(node.id(), node);
        if (shape == NodeShape.DECISION) {
            decisionEdgeCount.put(node.id(), 0);
        }
        return node.id();
    }

    void addEdge(String from, String to, Optional<String> label) {
        var count = decisionEdgeCount.get(from);
        if (count != null) {
            if (label.isEmpty()) {
                label = Optional.of(count == 0 ? yesLabel : noLabel);
            }
            decisionEdgeCount.put(from, count + 1);
        }
        edges.add(new Edge(from, to, label));
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public Node node(String id) {
        var node = nodesById.get(id);
        if (node == null) {
            throw new IllegalArgumentException("no node " + id);
        }
        return node;
    }

    public List<Node> nodes(NodeShape shape) {
        return nodes.stream().filter(n -> n.shape() == shape).toList();
    }

    public List<Edge> outgoing(String id) {
        return edges.stream().filter(e -> e.from().equals(id)).toList();
    }

    public List<Edge> incoming(String id) {
        return edges.stream().filter(e -> e.to().equals(id)).toList();
    }

    public String toMermaid() {
        var sb = new StringBuilder(HEADER);
        for (var node : nodes) {
            sb.append(' ').append(node.id()).append(node.shape().wrap(escape(node.label()))).append('\n');
        }
        for (var edge : edges) {
            sb.append(' ').append(edge.from());
            if (edge.label().isPresent()) {
                sb.append(" -->|").append(escape(edge.label().get())).append("| ");
            } else {
                sb.append(" --> ");
            }
            sb.append(edge.to()).append('\n');
        }
        return sb.toString();
    }

    static String escape(String label) {
        return label
                .replace("\"", "'")
                .replace("\n", " ")
                .replace("[", "(")
                .replace("]", ")")
                .replace("{", "(")
                .replace("}", ")")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
