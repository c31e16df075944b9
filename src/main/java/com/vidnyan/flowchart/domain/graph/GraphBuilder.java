package com.vidnyan.flowchart.domain.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator for one graph under construction.
 * Owns the node arena, the edge list and the id counter; never shared between requests.
 */
public final class GraphBuilder {

    public static final String ENTRY_ID = "start";
    public static final String EXIT_ID = "end_node";

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private int nextId;

    public GraphBuilder() {
        put(new Node(ENTRY_ID, NodeKind.ENTRY, "Start"));
    }

    public Attachment entry() {
        return new Attachment(ENTRY_ID, null);
    }

    public Node addAction(String label) {
        return put(new Node("action" + (++nextId), NodeKind.ACTION, label));
    }

    public Node addDecision(String condition) {
        return put(new Node("if" + (++nextId), NodeKind.DECISION, condition));
    }

    public Node addMerge() {
        return put(new Node("merge" + (++nextId), NodeKind.MERGE, ""));
    }

    /**
     * Connect the pending attachment point to {@code to}.
     */
    public void connect(Attachment from, Node to) {
        edges.add(new Edge(from.nodeId(), to.id(), from.branchLabel()));
    }

    /**
     * Close the graph: the last attachment point flows into the exit node.
     */
    public FlowGraph finish(Attachment last) {
        Node exit = put(new Node(EXIT_ID, NodeKind.EXIT, "End"));
        connect(last, exit);
        return new FlowGraph(nodes, edges, ENTRY_ID, EXIT_ID);
    }

    private Node put(Node node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            throw new IllegalStateException("Duplicate node id " + node.id());
        }
        return node;
    }

    /**
     * Where the next node hangs: the current last node, plus the branch label the
     * connecting edge must carry when that node is a decision.
     */
    public record Attachment(String nodeId, Edge.BranchLabel branchLabel) {

        public static Attachment after(Node node) {
            return new Attachment(node.id(), null);
        }

        public static Attachment branch(Node decision, Edge.BranchLabel label) {
            return new Attachment(decision.id(), label);
        }
    }
}
