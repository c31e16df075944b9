package com.vidnyan.flowchart.application.port.out;

import java.nio.file.Path;

/**
 * Port for loading source files.
 */
public interface SourceReader {

    /**
     * Read the whole file as text.
     * @throws com.vidnyan.flowchart.domain.error.FlowChartException with {@code READ_FAILURE}
     */
    String read(Path file);
}
