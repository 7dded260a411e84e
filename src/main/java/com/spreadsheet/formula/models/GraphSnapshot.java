package com.spreadsheet.formula.models;

import java.util.List;

/**
 * Exported view of a dependency graph: every node address,
 * and every edge as from (source) -> to (dependent).
 */
public class GraphSnapshot {
    private final List<String> nodes;
    private final List<Edge> edges;

    public GraphSnapshot(List<String> nodes, List<Edge> edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    public List<String> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public static class Edge {
        private final String from;
        private final String to;

        public Edge(String from, String to) {
            this.from = from;
            this.to = to;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }
    }
}
