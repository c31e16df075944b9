package com.vidnyan.flowchart.application.port.out;

import java.nio.file.Path;

/**
 * Port for publishing rendered documents.
 * A failed write must not leave a partial file behind under the target name.
 */
public interface DiagramWriter {

    /**
     * Write {@code content} to {@code directory/fileName}, creating the directory if needed.
     * @return the written file
     * @throws com.vidnyan.flowchart.domain.error.FlowChartException with {@code WRITE_FAILURE}
     */
    Path write(Path directory, String fileName, String content);

    /**
     * Delete {@code directory/fileName} if present.
     * @return true if a file was removed
     */
    boolean remove(Path directory, String fileName);
}
