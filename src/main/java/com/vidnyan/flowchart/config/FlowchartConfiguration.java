package com.vidnyan.flowchart.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.flowchart.FlowchartProperties;
import com.vidnyan.flowchart.domain.graph.ControlFlowGraphBuilder;
import com.vidnyan.flowchart.domain.preprocessor.PreprocessorLaneExtractor;
import com.vidnyan.flowchart.domain.render.DiagramRenderer;
import com.vidnyan.flowchart.domain.render.MermaidDiagramRenderer;
import com.vidnyan.flowchart.domain.source.FunctionLocator;
import com.vidnyan.flowchart.domain.statement.StatementClassifier;
import com.vidnyan.flowchart.domain.statement.StatementRule;
import com.vidnyan.flowchart.domain.statement.rules.FallbackStatementRule;
import com.vidnyan.flowchart.domain.statement.rules.LocalDeclarationRule;
import com.vidnyan.flowchart.domain.statement.rules.MessageReceiveRule;
import com.vidnyan.flowchart.domain.statement.rules.MessageSendRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the flow chart pipeline.
 * Domain classes stay framework-free; they are wired here.
 */
@Slf4j
@Configuration
public class FlowchartConfiguration {

    /**
     * ObjectMapper for JSON output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Rule chain in priority order. The fallback rule must stay last.
     */
    @Bean
    public StatementClassifier statementClassifier(FlowchartProperties properties) {
        List<StatementRule> rules = List.of(
                new MessageReceiveRule(),
                new MessageSendRule(),
                new LocalDeclarationRule(),
                new FallbackStatementRule(properties.getMaxLabelLength(), properties.getPortWriteMacros())
        );
        log.info("Registered {} statement rules:", rules.size());
        rules.forEach(r -> log.info("  - {}", r.getName()));
        return new StatementClassifier(rules);
    }

    @Bean
    public FunctionLocator functionLocator() {
        return new FunctionLocator();
    }

    @Bean
    public ControlFlowGraphBuilder controlFlowGraphBuilder(StatementClassifier classifier) {
        return new ControlFlowGraphBuilder(classifier);
    }

    @Bean
    public PreprocessorLaneExtractor preprocessorLaneExtractor(StatementClassifier classifier) {
        return new PreprocessorLaneExtractor(classifier);
    }

    @Bean
    public DiagramRenderer diagramRenderer() {
        return new MermaidDiagramRenderer();
    }
}
