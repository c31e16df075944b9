package com.vidnyan.flowchart.domain.preprocessor;

import com.vidnyan.flowchart.domain.source.SourceFunction;
import com.vidnyan.flowchart.domain.statement.StatementClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the statements of each {@code #ifdef NAME ... #endif} run of a function.
 * <p>
 * Guards do not nest: an {@code #ifdef} while another guard is open closes that guard first,
 * and the next {@code #endif} closes whichever guard is current. Other directives inside a
 * guard ({@code #else}, {@code #if}, ...) are skipped without changing the current guard.
 * Guards that collected nothing produce no group; a guard still open at the end of the
 * function is closed there.
 * <p>
 * Block comments are removed across lines before directives are matched, and lines left with
 * only braces or a bare {@code else}/{@code do} contribute no statement.
 */
@Slf4j
public class PreprocessorLaneExtractor {

    private static final Pattern IFDEF = Pattern.compile("^#\\s*ifdef\\s+(\\w+)");
    private static final Pattern ENDIF = Pattern.compile("^#\\s*endif\\b");
    private static final Pattern EDGE_BRACES = Pattern.compile("^[{}\\s]+|[{}\\s]+$");
    private static final Pattern BARE_KEYWORD = Pattern.compile("^(?:else|do)$");

    private final StatementClassifier classifier;

    public PreprocessorLaneExtractor(StatementClassifier classifier) {
        this.classifier = classifier;
    }

    public List<ConditionalBranchGroup> extract(SourceFunction function) {
        List<ConditionalBranchGroup> groups = new ArrayList<>();
        List<String> lines = function.lines();

        String guard = null;
        int guardLine = 0;
        List<String> statements = new ArrayList<>();
        BlockCommentFilter comments = new BlockCommentFilter();

        for (int i = 0; i < lines.size(); i++) {
            String stripped = comments.code(lines.get(i)).strip();
            int lineNumber = function.startLine() + i;

            Matcher ifdef = IFDEF.matcher(stripped);
            if (ifdef.find()) {
                if (guard != null) {
                    log.debug("Line {}: #ifdef {} while {} is open, closing {}",
                            lineNumber, ifdef.group(1), guard, guard);
                }
                flush(groups, guard, statements, guardLine);
                guard = ifdef.group(1);
                guardLine = lineNumber;
                statements = new ArrayList<>();
                continue;
            }
            if (ENDIF.matcher(stripped).find()) {
                flush(groups, guard, statements, guardLine);
                guard = null;
                statements = new ArrayList<>();
                continue;
            }

            if (guard == null || stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            String body = EDGE_BRACES.matcher(stripped).replaceAll("");
            if (!body.isEmpty() && !BARE_KEYWORD.matcher(body).matches()) {
                classifier.classify(body).ifPresent(statements::add);
            }
        }
        flush(groups, guard, statements, guardLine);

        log.debug("Found {} preprocessor lanes in {}", groups.size(), function.name());
        return groups;
    }

    private static void flush(List<ConditionalBranchGroup> groups, String guard,
                              List<String> statements, int guardLine) {
        if (guard != null && !statements.isEmpty()) {
            groups.add(new ConditionalBranchGroup(guard, statements, guardLine));
        }
    }

    /**
     * Removes block comment text line by line, remembering an unterminated {@code /*}.
     * Literals are copied untouched.
     */
    private static final class BlockCommentFilter {

        private boolean inComment;

        String code(String line) {
            StringBuilder out = new StringBuilder(line.length());
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                char next = i + 1 < line.length() ? line.charAt(i + 1) : '\0';
                if (inComment) {
                    if (c == '*' && next == '/') {
                        inComment = false;
                        out.append(' ');
                        i += 2;
                    } else {
                        i++;
                    }
                } else if (c == '/' && next == '/') {
                    break;
                } else if (c == '/' && next == '*') {
                    inComment = true;
                    i += 2;
                } else if (c == '"' || c == '\'') {
                    int end = i + 1;
                    while (end < line.length() && line.charAt(end) != c) {
                        end += line.charAt(end) == '\\' ? 2 : 1;
                    }
                    end = Math.min(end + 1, line.length());
                    out.append(line, i, end);
                    i = end;
                } else {
                    out.append(c);
                    i++;
                }
            }
            return out.toString();
        }
    }
}
