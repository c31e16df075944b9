package com.vidnyan.flowchart.domain.statement;

import java.util.Optional;

/**
 * One link of the classifier chain.
 * Receives a comment-stripped statement and answers with a label when it recognises the form.
 * Implementations must be stateless.
 */
public interface StatementRule {

    /**
     * @return the label for a recognised statement, empty otherwise
     */
    Optional<String> apply(String statement);

    /**
     * Get the rule name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
