package com.vidnyan.flowchart.domain.render;

import com.vidnyan.flowchart.domain.graph.Edge;
import com.vidnyan.flowchart.domain.graph.FlowGraph;
import com.vidnyan.flowchart.domain.graph.Node;
import com.vidnyan.flowchart.domain.graph.NodeKind;
import com.vidnyan.flowchart.domain.preprocessor.ConditionalBranchGroup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Markdown documents with an embedded Mermaid flowchart.
 * Node declarations come first, then edges; labelled edges use {@code A -- Yes --> B}.
 */
public class MermaidDiagramRenderer implements DiagramRenderer {

    private static final String INDENT = "    ";
    private static final String FENCE = "```";

    @Override
    public String renderFlowChart(String functionName, FlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Flow Chart for ").append(functionName).append("\n\n");
        sb.append(FENCE).append("mermaid\n");
        sb.append("graph TD\n");

        graph.node(graph.entryId()).ifPresent(entry -> sb.append(INDENT).append(declare(entry)).append("\n\n"));

        for (Node node : graph.nodes()) {
            if (node.kind() != NodeKind.ENTRY && node.kind() != NodeKind.EXIT) {
                sb.append(INDENT).append(declare(node)).append('\n');
            }
        }

        graph.node(graph.exitId()).ifPresent(exit -> sb.append('\n').append(INDENT).append(declare(exit)).append("\n\n"));

        for (Edge edge : graph.edges()) {
            sb.append(INDENT).append(edgeLine(edge)).append('\n');
        }

        sb.append(FENCE).append('\n');
        return sb.toString();
    }

    @Override
    public String renderSwitches(String functionName, List<ConditionalBranchGroup> lanes) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Preprocessor Directive Function Switches for ").append(functionName).append("\n\n");
        sb.append(FENCE).append("mermaid\n");
        sb.append("flowchart TD\n");

        Set<String> usedIds = new HashSet<>();
        for (ConditionalBranchGroup lane : lanes) {
            String laneId = uniqueId(MermaidText.sanitizeId(lane.guardName()), usedIds);

            sb.append("  subgraph ").append(laneId)
                    .append("[\"").append(MermaidText.escapeLabel(lane.guardName())).append("\"]\n");
            sb.append(INDENT).append("direction LR\n");

            List<String> labels = lane.statementLabels();
            List<String> nodeIds = new ArrayList<>();
            for (int i = 0; i < labels.size(); i++) {
                String nodeId = uniqueId(laneId + "_" + i, usedIds);
                nodeIds.add(nodeId);
                sb.append(INDENT).append(nodeId)
                        .append("[\"").append(MermaidText.escapeLabel(labels.get(i))).append("\"]\n");
            }
            for (int i = 1; i < nodeIds.size(); i++) {
                sb.append(INDENT).append(nodeIds.get(i - 1)).append(" --> ").append(nodeIds.get(i)).append('\n');
            }
            sb.append("  end\n");
        }

        sb.append(FENCE).append('\n');
        return sb.toString();
    }

    private static String declare(Node node) {
        String id = MermaidText.sanitizeId(node.id());
        String label = MermaidText.escapeLabel(node.label());
        return switch (node.kind()) {
            case ENTRY, EXIT -> id + "([" + label + "])";
            case ACTION -> id + "[\"" + label + "\"]";
            case DECISION -> id + "{\"" + label + "?\"}";
            case MERGE -> id + "[\" \"]";
        };
    }

    private static String edgeLine(Edge edge) {
        String from = MermaidText.sanitizeId(edge.fromId());
        String to = MermaidText.sanitizeId(edge.toId());
        if (edge.isLabeled()) {
            return from + " -- " + edge.branchLabel().text() + " --> " + to;
        }
        return from + " --> " + to;
    }

    // subgraph and node ids share one namespace; the same guard can open more than one run
    private static String uniqueId(String base, Set<String> used) {
        String id = base;
        int suffix = 2;
        while (!used.add(id)) {
            id = base + "_" + suffix++;
        }
        return id;
    }
}
