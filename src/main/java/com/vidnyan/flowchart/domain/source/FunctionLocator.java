package com.vidnyan.flowchart.domain.source;

import com.vidnyan.flowchart.domain.error.FlowChartException;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a function definition by name and cuts its text out of the file.
 * The definition is the first occurrence of the name followed by a parameter list
 * and an opening brace; the body ends where brace depth returns to zero.
 * Braces inside comments, string and character literals are not counted.
 */
@Slf4j
public class FunctionLocator {

    public SourceFunction locate(String source, String functionName) {
        String patternText = "\\b" + Pattern.quote(functionName) + "\\s*\\([^)]*\\)\\s*\\{";
        Matcher matcher = Pattern.compile(patternText).matcher(source);
        if (!matcher.find()) {
            throw FlowChartException.notFound(String.format(
                    "Function '%s' not found in file. Pattern used: %s", functionName, patternText));
        }

        int start = matcher.start();
        int end = findBodyEnd(source, start, functionName);
        int startLine = lineOf(source, start);

        log.debug("Located {} at offsets [{}, {}), line {}", functionName, start, end, startLine);
        return new SourceFunction(functionName, source.substring(start, end), start, end, startLine);
    }

    private int findBodyEnd(String source, int from, String functionName) {
        int depth = 0;
        boolean opened = false;
        int i = from;
        int length = source.length();

        while (i < length) {
            char c = source.charAt(i);
            char next = i + 1 < length ? source.charAt(i + 1) : '\0';

            if (c == '/' && next == '/') {
                i = skipLineComment(source, i);
                continue;
            }
            if (c == '/' && next == '*') {
                i = skipBlockComment(source, i);
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipLiteral(source, i, c);
                continue;
            }

            if (c == '{') {
                depth++;
                opened = true;
            } else if (c == '}') {
                depth--;
                if (opened && depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }

        throw FlowChartException.unbalancedBraces(functionName, depth, length);
    }

    private static int skipLineComment(String source, int i) {
        int newline = source.indexOf('\n', i);
        return newline < 0 ? source.length() : newline;
    }

    private static int skipBlockComment(String source, int i) {
        int close = source.indexOf("*/", i + 2);
        return close < 0 ? source.length() : close + 2;
    }

    private static int skipLiteral(String source, int i, char quote) {
        int j = i + 1;
        while (j < source.length()) {
            char c = source.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == quote || c == '\n') {
                return j + 1;
            }
            j++;
        }
        return source.length();
    }

    private static int lineOf(String source, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
