package com.vidnyan.flowchart.application.service;

import com.vidnyan.flowchart.FlowchartProperties;
import com.vidnyan.flowchart.application.port.in.GenerateFlowChartUseCase;
import com.vidnyan.flowchart.application.port.out.DiagramWriter;
import com.vidnyan.flowchart.application.port.out.SourceReader;
import com.vidnyan.flowchart.domain.error.ErrorKind;
import com.vidnyan.flowchart.domain.error.FlowChartException;
import com.vidnyan.flowchart.domain.graph.ControlFlowGraphBuilder;
import com.vidnyan.flowchart.domain.graph.FlowGraph;
import com.vidnyan.flowchart.domain.preprocessor.ConditionalBranchGroup;
import com.vidnyan.flowchart.domain.preprocessor.PreprocessorLaneExtractor;
import com.vidnyan.flowchart.domain.render.DiagramRenderer;
import com.vidnyan.flowchart.domain.source.FunctionLocator;
import com.vidnyan.flowchart.domain.source.SourceFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Runs the flow chart pipeline for one function:
 * read, locate, build graph, extract lanes, render, write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowChartApplicationService implements GenerateFlowChartUseCase {

    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final SourceReader sourceReader;
    private final DiagramWriter diagramWriter;
    private final FunctionLocator functionLocator;
    private final ControlFlowGraphBuilder graphBuilder;
    private final PreprocessorLaneExtractor laneExtractor;
    private final DiagramRenderer renderer;
    private final FlowchartProperties properties;

    @Override
    public FlowChartResult generate(FlowChartRequest request) {
        Instant startTime = Instant.now();
        try {
            String functionName = request.functionName();
            validate(request);
            Path filePath = toPath(request.filePath(), "file_path");
            Path outputRoot = toPath(request.outputRoot(), "output_root");

            log.info("Generating flow chart for {} from {}", functionName, filePath);

            log.debug("Step 1: Reading source...");
            String source = sourceReader.read(filePath);

            log.debug("Step 2: Locating function...");
            SourceFunction function = functionLocator.locate(source, functionName);

            log.debug("Step 3: Building control flow graph...");
            FlowGraph graph = graphBuilder.build(function);

            log.debug("Step 4: Extracting preprocessor lanes...");
            List<ConditionalBranchGroup> lanes = laneExtractor.extract(function);

            log.debug("Step 5: Rendering...");
            String flowChart = renderer.renderFlowChart(functionName, graph);
            String switchesDocument = lanes.isEmpty() ? null : renderer.renderSwitches(functionName, lanes);

            log.debug("Step 6: Writing...");
            Path diagram = diagramWriter.write(outputRoot, fileName(functionName, ""), flowChart);
            Path switches = publishSwitches(outputRoot, functionName, switchesDocument, diagram);

            GenerationStats stats = GenerationStats.of(graph, lanes.size(),
                    Duration.between(startTime, Instant.now()).toMillis());
            log.info("Flow chart for {} written to {}: {} nodes, {} decisions, {} lanes in {}ms",
                    functionName, diagram, stats.nodeCount(), stats.decisionCount(),
                    stats.laneCount(), stats.durationMs());

            return FlowChartResult.ok(diagram.toString(), switches != null ? switches.toString() : null, stats);
        } catch (FlowChartException e) {
            if (e.kind() == ErrorKind.INPUT_REQUIRED) {
                log.warn("Input required: {}", e.getMessage());
                return FlowChartResult.inputRequired(e.getMessage());
            }
            log.error("Flow chart generation failed [{}]: {}", e.kind(), e.getMessage());
            return FlowChartResult.error(e.kind(), e.getMessage());
        }
    }

    private Path publishSwitches(Path outputRoot, String functionName, String document, Path diagram) {
        String switchesName = fileName(functionName, "_switches");
        try {
            if (document != null) {
                return diagramWriter.write(outputRoot, switchesName, document);
            }
            if (diagramWriter.remove(outputRoot, switchesName)) {
                log.info("Removed stale {} (no preprocessor lanes in {})", switchesName, functionName);
            }
            return null;
        } catch (FlowChartException e) {
            throw new FlowChartException(e.kind(),
                    e.getMessage() + " (flow chart already written to " + diagram + ")", e);
        }
    }

    private static void validate(FlowChartRequest request) {
        if (isBlank(request.functionName()) || isBlank(request.filePath()) || isBlank(request.outputRoot())) {
            throw FlowChartException.inputRequired("function_name, file_path, and output_root are required");
        }
        if (!FUNCTION_NAME.matcher(request.functionName()).matches()) {
            throw FlowChartException.inputRequired(
                    "function_name must be a C identifier: '" + request.functionName() + "'");
        }
    }

    private static Path toPath(String value, String parameter) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw FlowChartException.inputRequired(parameter + " is not a valid path: " + e.getMessage());
        }
    }

    private String fileName(String functionName, String suffix) {
        return functionName + suffix + "." + properties.getFileExtension();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
