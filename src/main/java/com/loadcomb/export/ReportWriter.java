package com.loadcomb.export;

import com.loadcomb.exception.ReportException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes generated load combinations to an external report.
 */
public interface ReportWriter {

    /**
     * @throws ReportException if writing fails
     */
    void write(List<LoadCombination> combinations, Writer out);

    /**
     * Write to a file, creating parent directories as needed.
     *
     * @throws ReportException if the file cannot be written
     */
    default void write(List<LoadCombination> combinations, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(combinations, out);
            }
        } catch (IOException e) {
            throw new ReportException("Failed to write report to: " + path, e);
        }
    }
}
