package com.vidnyan.flowchart.domain.render;

import com.vidnyan.flowchart.domain.graph.FlowGraph;
import com.vidnyan.flowchart.domain.preprocessor.ConditionalBranchGroup;

import java.util.List;

/**
 * Serializes graphs into a text diagram document.
 */
public interface DiagramRenderer {

    /**
     * Document for the control-flow graph of {@code functionName}.
     */
    String renderFlowChart(String functionName, FlowGraph graph);

    /**
     * Document with one lane per preprocessor guard. Callers skip it when there are no lanes.
     */
    String renderSwitches(String functionName, List<ConditionalBranchGroup> lanes);
}
