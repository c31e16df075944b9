package com.vidnyan.flowchart.domain.error;

/**
 * Failure categories reported back to the caller.
 * None of them is fatal to the process; the caller decides whether to retry.
 */
public enum ErrorKind {
    INPUT_REQUIRED,     // function name, file path or output root missing/invalid
    NOT_FOUND,          // function signature not present in the file
    READ_FAILURE,       // source file could not be read
    WRITE_FAILURE,      // diagram could not be published
    UNBALANCED_BRACES   // body extraction hit end of file before depth returned to zero
}
