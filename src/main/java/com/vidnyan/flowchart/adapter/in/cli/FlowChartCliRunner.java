package com.vidnyan.flowchart.adapter.in.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.flowchart.FlowchartProperties;
import com.vidnyan.flowchart.application.port.in.GenerateFlowChartUseCase;
import com.vidnyan.flowchart.application.port.in.GenerateFlowChartUseCase.FlowChartRequest;
import com.vidnyan.flowchart.application.port.in.GenerateFlowChartUseCase.FlowChartResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * CLI Runner for one-shot generation.
 * Runs when flowchart.function and flowchart.file are set, e.g.
 * {@code --flowchart.function=PRC_Foo --flowchart.file=src/foo.c --flowchart.output-root=Gen}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowChartCliRunner implements CommandLineRunner {

    private final GenerateFlowChartUseCase generateFlowChartUseCase;
    private final FlowchartProperties properties;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Value("${flowchart.function:}")
    private String functionName;

    @Value("${flowchart.file:}")
    private String filePath;

    @Override
    public void run(String... args) throws Exception {
        if (functionName == null || functionName.isBlank()) {
            log.info("No function specified. Set flowchart.function and flowchart.file properties.");
            return;
        }

        FlowChartResult result;
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info(" FLOW CHART ENGINE");
            log.info("═══════════════════════════════════════════════════════════════");
            log.info(" Function: {}", functionName);
            log.info(" File:     {}", filePath);
            log.info(" Output:   {}", properties.getOutputRoot());
            log.info("───────────────────────────────────────────────────────────────");

            result = generateFlowChartUseCase.generate(
                    new FlowChartRequest(functionName, filePath, properties.getOutputRoot()));
            printResult(result);
        } catch (RuntimeException e) {
            log.error("Flow chart generation aborted", e);
            result = FlowChartResult.error(null, e.getMessage());
        }

        int exitCode = result.isOk() ? 0 : 1;
        SpringApplication.exit(context, () -> exitCode);
    }

    private void printResult(FlowChartResult result) throws JsonProcessingException {
        if (result.isOk()) {
            log.info(" ✅ {}", result.message());
            if (result.switchesPath() != null) {
                log.info(" Switches: {}", result.switchesPath());
            }
            log.info(" Nodes: {}  Decisions: {}  Lanes: {}  Duration: {}ms",
                    result.stats().nodeCount(), result.stats().decisionCount(),
                    result.stats().laneCount(), result.stats().durationMs());
        } else {
            log.warn(" 🔴 {} [{}]: {}", result.status(), result.errorKind(), result.message());
        }
        log.info("═══════════════════════════════════════════════════════════════");
        System.out.println(objectMapper.writeValueAsString(result));
    }
}
