package com.vidnyan.flowchart.application.port.in;

import com.vidnyan.flowchart.domain.error.ErrorKind;
import com.vidnyan.flowchart.domain.graph.FlowGraph;

/**
 * Primary use case: generate the flow chart documents for one function.
 */
public interface GenerateFlowChartUseCase {

    /**
     * Locate the function, build its graphs and write the diagram documents.
     * Never throws for caller errors; they come back as a non-OK result.
     */
    FlowChartResult generate(FlowChartRequest request);

    /**
     * Request parameters, as received from the calling client.
     */
    record FlowChartRequest(
        String functionName,
        String filePath,
        String outputRoot
    ) {}

    /**
     * Generation result.
     * {@code switchesPath} is only set when preprocessor lanes were found.
     */
    record FlowChartResult(
        Status status,
        String message,
        String diagramPath,
        String switchesPath,
        ErrorKind errorKind,
        GenerationStats stats
    ) {

        public enum Status {
            OK,
            INPUT_REQUIRED,
            ERROR
        }

        public static FlowChartResult ok(String diagramPath, String switchesPath, GenerationStats stats) {
            return new FlowChartResult(Status.OK, "Flow chart created at " + diagramPath,
                    diagramPath, switchesPath, null, stats);
        }

        public static FlowChartResult inputRequired(String message) {
            return new FlowChartResult(Status.INPUT_REQUIRED, message, null, null,
                    ErrorKind.INPUT_REQUIRED, null);
        }

        public static FlowChartResult error(ErrorKind kind, String message) {
            return new FlowChartResult(Status.ERROR, message, null, null, kind, null);
        }

        public boolean isOk() {
            return status == Status.OK;
        }
    }

    /**
     * Generation statistics.
     */
    record GenerationStats(
        int nodeCount,
        int edgeCount,
        int decisionCount,
        int mergeCount,
        int laneCount,
        long durationMs
    ) {
        public static GenerationStats of(FlowGraph graph, int laneCount, long durationMs) {
            FlowGraph.Stats stats = graph.stats();
            return new GenerationStats(stats.nodeCount(), stats.edgeCount(),
                    stats.decisionCount(), stats.mergeCount(), laneCount, durationMs);
        }
    }
}
