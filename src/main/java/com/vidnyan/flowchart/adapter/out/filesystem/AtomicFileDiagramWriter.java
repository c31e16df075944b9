package com.vidnyan.flowchart.adapter.out.filesystem;

import com.vidnyan.flowchart.application.port.out.DiagramWriter;
import com.vidnyan.flowchart.domain.error.FlowChartException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes each document to a temporary file next to the target and moves it into place,
 * so readers see either the previous file or the complete new one.
 */
@Slf4j
@Component
public class AtomicFileDiagramWriter implements DiagramWriter {

    @Override
    public Path write(Path directory, String fileName, String content) {
        Path target = directory.resolve(fileName);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + fileName + ".", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            publish(temp, target);
            log.debug("Wrote {} ({} chars)", target, content.length());
            return target;
        } catch (IOException e) {
            deleteQuietly(temp);
            throw FlowChartException.writeFailure(target.toString(), e);
        }
    }

    @Override
    public boolean remove(Path directory, String fileName) {
        Path target = directory.resolve(fileName);
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw FlowChartException.writeFailure(target.toString(), e);
        }
    }

    private static void publish(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
