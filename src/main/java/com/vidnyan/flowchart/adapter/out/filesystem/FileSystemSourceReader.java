package com.vidnyan.flowchart.adapter.out.filesystem;

import com.vidnyan.flowchart.application.port.out.SourceReader;
import com.vidnyan.flowchart.domain.error.FlowChartException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source files as UTF-8. Malformed bytes are replaced, not rejected:
 * legacy firmware sources are often not clean UTF-8.
 */
@Slf4j
@Component
public class FileSystemSourceReader implements SourceReader {

    @Override
    public String read(Path file) {
        try {
            byte[] bytes = Files.readAllBytes(file);
            log.debug("Read {} bytes from {}", bytes.length, file);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw FlowChartException.readFailure(file.toString(), e);
        }
    }
}
