package com.vidnyan.flowchart.domain.statement;

/**
 * One raw source statement together with its classification.
 * A {@code null} label means the statement is dropped and produces no node.
 */
public record Statement(
    String rawText,
    int lineNumber,
    String label
) {

    public boolean isDropped() {
        return label == null;
    }
}
