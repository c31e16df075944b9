package com.vidnyan.flowchart.domain.statement.rules;

import com.vidnyan.flowchart.domain.statement.StatementRule;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Last link of the chain. Answers for every statement that still has text:
 * unqualified messaging macros and port writes get a fixed short label,
 * {@code if (...)} text is kept whole, anything else is shortened to {@code maxLength}.
 */
public class FallbackStatementRule implements StatementRule {

    public static final int DEFAULT_MAX_LENGTH = 60;
    public static final List<String> DEFAULT_PORT_WRITE_MACROS = List.of("RBMICSYS_WritePort", "WritePort");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern IF_LEAD = Pattern.compile("^if\\s*\\(");
    private static final String ELLIPSIS = "...";

    private final int maxLength;
    private final List<String> portWriteMacros;

    public FallbackStatementRule() {
        this(DEFAULT_MAX_LENGTH, DEFAULT_PORT_WRITE_MACROS);
    }

    public FallbackStatementRule(int maxLength, List<String> portWriteMacros) {
        if (maxLength <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("maxLength must exceed " + ELLIPSIS.length() + ": " + maxLength);
        }
        this.maxLength = maxLength;
        this.portWriteMacros = List.copyOf(portWriteMacros);
    }

    @Override
    public Optional<String> apply(String statement) {
        String clean = WHITESPACE.matcher(statement.replace(";", "")).replaceAll(" ").strip();
        if (clean.isEmpty()) {
            return Optional.empty();
        }

        if (clean.contains("RcvMESG") && !clean.contains("RBMESG_RcvMESG")) {
            return Optional.of("Receive message");
        }
        if (clean.contains("SendMESG") && !clean.contains("RBMESG_SendMESG")) {
            return Optional.of("Send message");
        }
        if (portWriteMacros.stream().anyMatch(clean::contains)) {
            return Optional.of("Write to port");
        }

        // decision text is used upstream, keep it whole
        if (IF_LEAD.matcher(clean).find()) {
            return Optional.of(clean);
        }
        if (clean.length() > maxLength) {
            return Optional.of(clean.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS);
        }
        return Optional.of(clean);
    }
}
