package com.mediaindex.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes records as JSON Lines: one {@link MediaRecord#serialize()} result per line.
 */
public class JsonExportService implements JsonExportServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(JsonExportService.class);

    private final Path outputDir;

    public JsonExportService(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Path writeRecords(List<? extends MediaRecord> records, String filename) throws IOException {
        if (records == null) {
            logger.warn("Attempted to write null record list to JSON: {}", filename);
            throw new IllegalArgumentException("Record list cannot be null");
        }
        if (filename == null || filename.isBlank()) {
            logger.warn("Attempted to write JSON with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(filename);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (MediaRecord record : records) {
                writer.write(record.serialize());
                writer.newLine();
            }
        }
        logger.info("Wrote {} records to {}", records.size(), file);
        return file;
    }
}
