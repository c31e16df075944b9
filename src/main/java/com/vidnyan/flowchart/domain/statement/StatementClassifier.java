package com.vidnyan.flowchart.domain.statement;

import com.vidnyan.flowchart.domain.statement.rules.FallbackStatementRule;
import com.vidnyan.flowchart.domain.statement.rules.LocalDeclarationRule;
import com.vidnyan.flowchart.domain.statement.rules.MessageReceiveRule;
import com.vidnyan.flowchart.domain.statement.rules.MessageSendRule;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered rule chain turning a raw statement into a node label.
 * The first rule that answers wins; an empty result means "drop".
 * Immutable and thread-safe, one instance can serve concurrent requests.
 */
public final class StatementClassifier {

    private static final Pattern LINE_COMMENT = Pattern.compile("//.*$");
    private static final Pattern INLINE_BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/");
    private static final Pattern ASTERISK_RUN = Pattern.compile("^/?\\*+/?$");

    private final List<StatementRule> rules;

    public StatementClassifier(List<StatementRule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("At least one statement rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Classifier with the built-in rules and default fallback settings.
     */
    public static StatementClassifier defaults() {
        return new StatementClassifier(List.of(
                new MessageReceiveRule(),
                new MessageSendRule(),
                new LocalDeclarationRule(),
                new FallbackStatementRule()
        ));
    }

    public List<StatementRule> rules() {
        return rules;
    }

    /**
     * Classify one raw line or statement.
     * @return the label, or empty when the statement should not produce a node
     */
    public Optional<String> classify(String rawStatement) {
        if (rawStatement == null) {
            return Optional.empty();
        }
        if (isCommentBanner(rawStatement.strip())) {
            return Optional.empty();
        }

        String clean = stripComments(rawStatement);
        if (clean.isEmpty()) {
            return Optional.empty();
        }

        for (StatementRule rule : rules) {
            Optional<String> label = rule.apply(clean);
            if (label.isPresent()) {
                return label;
            }
        }
        return Optional.empty();
    }

    public Statement toStatement(String rawStatement, int lineNumber) {
        return new Statement(rawStatement, lineNumber, classify(rawStatement).orElse(null));
    }

    /**
     * Remove same-line block comments and line comments, then trim.
     */
    public static String stripComments(String statement) {
        String withoutBlocks = INLINE_BLOCK_COMMENT.matcher(statement).replaceAll("");
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll("").strip();
    }

    /**
     * Lines that belong to a comment block rather than code.
     * A line led by '*' that ends in ';' is a pointer dereference, not a banner.
     */
    public static boolean isCommentBanner(String line) {
        if (line.startsWith("/*") || line.endsWith("*/")) {
            return true;
        }
        if (line.startsWith("*")) {
            return !line.endsWith(";");
        }
        return !line.isEmpty() && ASTERISK_RUN.matcher(line).matches();
    }
}
