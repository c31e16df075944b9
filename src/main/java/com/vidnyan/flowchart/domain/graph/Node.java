package com.vidnyan.flowchart.domain.graph;

import java.util.Objects;

/**
 * Graph node. Decision nodes carry the condition text as label, merge nodes an empty label.
 */
public record Node(String id, NodeKind kind, String label) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        label = label == null ? "" : label;
    }
}
