package com.vidnyan.flowchart.domain.graph;

import java.util.*;

/**
 * Control-flow graph of one function.
 * Immutable once built; nodes keep their creation order.
 */
public final class FlowGraph {

    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final String entryId;
    private final String exitId;

    FlowGraph(Map<String, Node> nodes, List<Edge> edges, String entryId, String exitId) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.entryId = entryId;
        this.exitId = exitId;
    }

    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<Edge> edges() {
        return edges;
    }

    public String entryId() {
        return entryId;
    }

    public String exitId() {
        return exitId;
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodes.values().stream()
                .filter(n -> n.kind() == kind)
                .toList();
    }

    public List<Edge> outgoing(String id) {
        return edges.stream()
                .filter(e -> e.fromId().equals(id))
                .toList();
    }

    public List<Edge> incoming(String id) {
        return edges.stream()
                .filter(e -> e.toId().equals(id))
                .toList();
    }

    /**
     * Every node is reachable from entry and can reach exit.
     */
    public boolean isConnected() {
        Set<String> forward = reach(entryId, true);
        Set<String> backward = reach(exitId, false);
        return forward.equals(nodes.keySet()) && backward.equals(nodes.keySet());
    }

    private Set<String> reach(String start, boolean forward) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!visited.add(id)) {
                continue;
            }
            for (Edge edge : forward ? outgoing(id) : incoming(id)) {
                queue.add(forward ? edge.toId() : edge.fromId());
            }
        }
        return visited;
    }

    /**
     * Get graph statistics.
     */
    public Stats stats() {
        return new Stats(
                nodes.size(),
                edges.size(),
                nodesOfKind(NodeKind.ACTION).size(),
                nodesOfKind(NodeKind.DECISION).size(),
                nodesOfKind(NodeKind.MERGE).size()
        );
    }

    public record Stats(int nodeCount, int edgeCount, int actionCount, int decisionCount, int mergeCount) {}
}
