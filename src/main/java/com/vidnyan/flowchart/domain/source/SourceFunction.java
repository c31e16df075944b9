package com.vidnyan.flowchart.domain.source;

import java.util.List;
import java.util.Objects;

/**
 * Raw text of one function, from its name through the matching closing brace.
 * {@code startOffset} and {@code endOffset} index into the file the function was located in.
 */
public record SourceFunction(
    String name,
    String rawText,
    int startOffset,
    int endOffset,
    int startLine
) {

    public SourceFunction {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawText, "rawText");
        if (startOffset >= endOffset) {
            throw new IllegalArgumentException(
                    "startOffset " + startOffset + " must be before endOffset " + endOffset);
        }
    }

    /**
     * Lines of the function text, in source order.
     */
    public List<String> lines() {
        return rawText.lines().toList();
    }
}
