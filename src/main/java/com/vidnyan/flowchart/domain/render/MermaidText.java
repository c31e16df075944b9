package com.vidnyan.flowchart.domain.render;

import java.util.regex.Pattern;

/**
 * Identifier and label escaping for Mermaid flowcharts.
 */
public final class MermaidText {

    private static final Pattern NON_ID_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final String EMPTY_ID = "node";
    static final String DIGIT_PREFIX = "n_";

    private MermaidText() {
    }

    /**
     * Reduce any text to an identifier matching {@code [A-Za-z_][A-Za-z0-9_]*}.
     */
    public static String sanitizeId(String text) {
        if (text == null) {
            return EMPTY_ID;
        }
        String id = text.replaceAll("[\\t\\r\\n();]", "");
        id = NON_ID_CHARS.matcher(id).replaceAll("_");
        id = UNDERSCORE_RUN.matcher(id).replaceAll("_");
        id = EDGE_UNDERSCORES.matcher(id).replaceAll("");

        if (id.isEmpty()) {
            return EMPTY_ID;
        }
        if (Character.isDigit(id.charAt(0))) {
            return DIGIT_PREFIX + id;
        }
        return id;
    }

    /**
     * Make text safe inside a quoted node label. Never shortens the text.
     */
    public static String escapeLabel(String text) {
        if (text == null) {
            return "";
        }
        String label = text.replace('\t', ' ')
                .replace('\n', ' ')
                .replace('\r', ' ')
                .strip()
                .replace('"', '\'')
                .replace("#", "num")
                .replace("|", " or ")
                .replace("&", " and ");
        return WHITESPACE.matcher(label).replaceAll(" ").strip();
    }
}
