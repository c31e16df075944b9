package com.vidnyan.flowchart.domain.error;

/**
 * Raised by the pipeline stages for conditions the caller can act on.
 * Converted to a {@code FlowChartResult} by the application service.
 */
public class FlowChartException extends RuntimeException {

    private final ErrorKind kind;

    public FlowChartException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FlowChartException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static FlowChartException inputRequired(String message) {
        return new FlowChartException(ErrorKind.INPUT_REQUIRED, message);
    }

    public static FlowChartException notFound(String message) {
        return new FlowChartException(ErrorKind.NOT_FOUND, message);
    }

    public static FlowChartException unbalancedBraces(String functionName, int depth, int position) {
        return new FlowChartException(ErrorKind.UNBALANCED_BRACES, String.format(
                "Could not extract complete body of '%s': reached end of file at position %d with brace depth %d",
                functionName, position, depth));
    }

    public static FlowChartException readFailure(String path, Throwable cause) {
        return new FlowChartException(ErrorKind.READ_FAILURE,
                "Failed to read file " + path + ": " + cause.getMessage(), cause);
    }

    public static FlowChartException writeFailure(String path, Throwable cause) {
        return new FlowChartException(ErrorKind.WRITE_FAILURE,
                "Failed to write " + path + ": " + cause.getMessage(), cause);
    }
}
