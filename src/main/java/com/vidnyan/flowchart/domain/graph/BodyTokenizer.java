package com.vidnyan.flowchart.domain.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits function text into braces, {@code if}/{@code else} keywords and plain statements.
 * <p>
 * Comments are removed (block comments may span lines), string and character literals are
 * copied without interpreting their braces, and preprocessor lines, including their
 * backslash continuations, are skipped entirely. A statement ends at {@code ;}, at a brace,
 * or at end of line when no parenthesis is open, so conditions may span several lines.
 * An unclosed parenthesis is dropped at the next brace, or at a line ending in {@code ;},
 * so one malformed condition only degrades its own statement.
 * <p>
 * Not thread-safe; create one per function.
 */
@Slf4j
public class BodyTokenizer {

    public static final String PLACEHOLDER_CONDITION = "condition";

    private static final Pattern ELSE_LEAD = Pattern.compile("^else\\b");
    private static final Pattern IF_LEAD = Pattern.compile("^if\\b");

    private final List<BodyToken> tokens = new ArrayList<>();
    private final StringBuilder pending = new StringBuilder();
    private int pendingLine;
    private int parenDepth;
    private boolean inBlockComment;

    public List<BodyToken> tokenize(String functionText) {
        tokens.clear();
        pending.setLength(0);
        parenDepth = 0;
        inBlockComment = false;

        String[] lines = functionText.split("\\R", -1);
        boolean directiveContinues = false;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;

            if (directiveContinues) {
                directiveContinues = line.stripTrailing().endsWith("\\");
                continue;
            }
            if (!inBlockComment && line.strip().startsWith("#")) {
                directiveContinues = line.stripTrailing().endsWith("\\");
                continue;
            }

            boolean endsWithSemicolon = scanLine(line, lineNumber);
            if (parenDepth > 0 && endsWithSemicolon) {
                abandonOpenParens(lineNumber);
            }
            if (parenDepth == 0) {
                flush();
            } else {
                pending.append(' ');
            }
        }
        flush();
        return List.copyOf(tokens);
    }

    /**
     * @return whether the last code character on the line is {@code ;}
     */
    private boolean scanLine(String line, int lineNumber) {
        int i = 0;
        int length = line.length();
        char lastCode = '\0';

        while (i < length) {
            char c = line.charAt(i);
            char next = i + 1 < length ? line.charAt(i + 1) : '\0';

            if (inBlockComment) {
                if (c == '*' && next == '/') {
                    inBlockComment = false;
                    i += 2;
                } else {
                    i++;
                }
                continue;
            }
            if (c == '/' && next == '/') {
                return lastCode == ';';
            }
            if (c == '/' && next == '*') {
                inBlockComment = true;
                append(' ', lineNumber);
                i += 2;
                continue;
            }
            if (c == '"' || c == '\'') {
                i = copyLiteral(line, i, lineNumber);
                lastCode = c;
                continue;
            }
            if (!Character.isWhitespace(c)) {
                lastCode = c;
            }

            if (c == '(') {
                parenDepth++;
            } else if (c == ')') {
                parenDepth = Math.max(0, parenDepth - 1);
            } else if (parenDepth > 0 && (c == '{' || c == '}')) {
                abandonOpenParens(lineNumber);
            }

            if (parenDepth == 0 && c == '{') {
                flush();
                tokens.add(BodyToken.open(lineNumber));
            } else if (parenDepth == 0 && c == '}') {
                flush();
                tokens.add(BodyToken.close(lineNumber));
            } else if (parenDepth == 0 && c == ';') {
                append(c, lineNumber);
                flush();
            } else {
                append(c, lineNumber);
            }
            i++;
        }
        return lastCode == ';';
    }

    private void abandonOpenParens(int lineNumber) {
        log.warn("Line {}: {} unclosed '(' in '{}', closing them here",
                lineNumber, parenDepth, pending.toString().strip());
        parenDepth = 0;
    }

    private int copyLiteral(String line, int start, int lineNumber) {
        char quote = line.charAt(start);
        append(quote, lineNumber);
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            append(c, lineNumber);
            if (c == '\\' && i + 1 < line.length()) {
                append(line.charAt(i + 1), lineNumber);
                i += 2;
                continue;
            }
            i++;
            if (c == quote) {
                break;
            }
        }
        return i;
    }

    private void append(char c, int lineNumber) {
        if (pending.length() == 0) {
            if (Character.isWhitespace(c)) {
                return;
            }
            pendingLine = lineNumber;
        }
        pending.append(c);
    }

    private void flush() {
        String text = pending.toString().strip();
        pending.setLength(0);
        if (!text.isEmpty()) {
            emit(text, pendingLine);
        }
    }

    private void emit(String text, int line) {
        if (ELSE_LEAD.matcher(text).find()) {
            tokens.add(new BodyToken(BodyToken.Type.ELSE, "else", line));
            String rest = text.substring("else".length()).strip();
            if (!rest.isEmpty()) {
                emit(rest, line);
            }
            return;
        }

        if (IF_LEAD.matcher(text).find()) {
            emitIf(text, line);
            return;
        }

        tokens.add(new BodyToken(BodyToken.Type.STATEMENT, text, line));
    }

    private void emitIf(String text, int line) {
        int open = text.indexOf('(');
        int close = open < 0 ? -1 : matchingParen(text, open);
        if (close < 0) {
            log.warn("Line {}: no condition found in '{}', using placeholder", line, text);
            tokens.add(new BodyToken(BodyToken.Type.IF, PLACEHOLDER_CONDITION, line));
            return;
        }

        String condition = text.substring(open + 1, close).strip();
        if (condition.isEmpty()) {
            condition = PLACEHOLDER_CONDITION;
        }
        tokens.add(new BodyToken(BodyToken.Type.IF, condition, line));

        String rest = text.substring(close + 1).strip();
        if (!rest.isEmpty()) {
            emit(rest, line);
        }
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
