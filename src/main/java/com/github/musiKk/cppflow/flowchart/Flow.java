package com.github.musiKk.cppflow.flowchart;

import java.util.Optional;

/**
 * Where control goes after a statement: on from one node, optionally along a
 * labeled edge, or nowhere directly because every exit has been handed to a
 * loop, the end node or the pending tails.
 */
public sealed interface Flow {

    record Continues(String nodeId, Optional<String> edgeLabel) implements Flow {
        public static Continues from(String nodeId) {
            return new Continues(nodeId, Optional.empty());
        }

        public static Continues from(String nodeId, String edgeLabel) {
            return new Continues(nodeId, Optional.of(edgeLabel));
        }
    }

    record Diverges() implements Flow {}

    Diverges DIVERGES = new Diverges();
}
