package com.vidnyan.flowchart.domain.statement.rules;

import com.vidnyan.flowchart.domain.statement.StatementRule;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local definitions {@code Type Name;} and {@code Type Name[size];} become "Type Name".
 */
public class LocalDeclarationRule implements StatementRule {

    private static final Pattern DECLARATION = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*(\\[[^\\]]*\\])?\\s*;");

    // "return x;" has the same shape
    private static final Set<String> NOT_A_TYPE = Set.of("return", "goto", "else", "case", "do");

    @Override
    public Optional<String> apply(String statement) {
        Matcher matcher = DECLARATION.matcher(statement.strip());
        if (!matcher.find() || NOT_A_TYPE.contains(matcher.group(1))) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1) + " " + matcher.group(2));
    }
}
