package com.vidnyan.flowchart.domain.graph;

/**
 * Structural unit of a function body as seen by the graph builder.
 * {@code text} is the condition for {@link Type#IF} and the statement for {@link Type#STATEMENT}.
 */
public record BodyToken(Type type, String text, int line) {

    public enum Type {
        OPEN,       // {
        CLOSE,      // }
        IF,         // if (condition)
        ELSE,       // else
        STATEMENT   // anything else, handed to the classifier
    }

    public static BodyToken open(int line) {
        return new BodyToken(Type.OPEN, "{", line);
    }

    public static BodyToken close(int line) {
        return new BodyToken(Type.CLOSE, "}", line);
    }

    public boolean is(Type type) {
        return this.type == type;
    }
}
