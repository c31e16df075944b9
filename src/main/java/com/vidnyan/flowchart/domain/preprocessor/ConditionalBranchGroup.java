package com.vidnyan.flowchart.domain.preprocessor;

import java.util.List;
import java.util.Objects;

/**
 * Statements guarded by one {@code #ifdef GUARD ... #endif} run, in source order.
 */
public record ConditionalBranchGroup(
    String guardName,
    List<String> statementLabels,
    int startLine
) {

    public ConditionalBranchGroup {
        Objects.requireNonNull(guardName, "guardName");
        statementLabels = List.copyOf(statementLabels);
    }
}
