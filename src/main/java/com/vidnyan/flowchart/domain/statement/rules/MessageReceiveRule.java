package com.vidnyan.flowchart.domain.statement.rules;

import com.vidnyan.flowchart.domain.statement.StatementRule;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code RcvMESG(A, B)} and {@code RBMESG_RcvMESG(A, B)}, with or without {@code &} on A.
 */
public class MessageReceiveRule implements StatementRule {

    private static final Pattern RECEIVE = Pattern.compile(
            "(?:RBMESG_)?RcvMESG\\s*\\(\\s*&?\\s*([^,()]+?)\\s*,\\s*([^)]+?)\\s*\\)");

    @Override
    public Optional<String> apply(String statement) {
        Matcher matcher = RECEIVE.matcher(statement);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String target = matcher.group(1).replace("&", "").strip();
        String source = matcher.group(2).strip();
        return Optional.of("Receive the value from " + source + " and store it in " + target);
    }
}
