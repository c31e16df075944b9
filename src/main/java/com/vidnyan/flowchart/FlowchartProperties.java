package com.vidnyan.flowchart;

import com.vidnyan.flowchart.domain.statement.rules.FallbackStatementRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for flow chart generation.
 * Can be configured via application.yml or command line ({@code --flowchart.output-root=...}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "flowchart")
public class FlowchartProperties {

    /**
     * Directory the documents are written to when the caller does not name one.
     */
    private String outputRoot = "Gen";

    /**
     * Extension of the written documents.
     */
    private String fileExtension = "md";

    /**
     * Longest label kept by the fallback rule before it is shortened with "...".
     */
    private int maxLabelLength = FallbackStatementRule.DEFAULT_MAX_LENGTH;

    /**
     * Macro names rendered as "Write to port".
     */
    private List<String> portWriteMacros = new ArrayList<>(FallbackStatementRule.DEFAULT_PORT_WRITE_MACROS);
}
