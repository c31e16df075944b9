package com.vidnyan.flowchart.domain.graph;

import java.util.Objects;

/**
 * Directed edge. {@code branchLabel} is only set on edges leaving a decision node.
 */
public record Edge(String fromId, String toId, BranchLabel branchLabel) {

    public Edge {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
    }

    public boolean isLabeled() {
        return branchLabel != null;
    }

    /**
     * Outcome of a decision.
     */
    public enum BranchLabel {
        YES("Yes"),
        NO("No");

        private final String text;

        BranchLabel(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }
}
