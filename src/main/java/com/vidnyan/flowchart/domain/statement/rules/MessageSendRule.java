package com.vidnyan.flowchart.domain.statement.rules;

import com.vidnyan.flowchart.domain.statement.StatementRule;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code RBMESG_SendMESG(A, B)}: interface A is updated from B.
 */
public class MessageSendRule implements StatementRule {

    private static final Pattern SEND = Pattern.compile(
            "RBMESG_SendMESG\\s*\\(\\s*([^,()]+?)\\s*,\\s*([^)]+?)\\s*\\)");

    @Override
    public Optional<String> apply(String statement) {
        Matcher matcher = SEND.matcher(statement);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of("Update the interface " + matcher.group(1).strip()
                + " with the value from " + matcher.group(2).strip());
    }
}
