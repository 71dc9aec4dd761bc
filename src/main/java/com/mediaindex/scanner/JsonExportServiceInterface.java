package com.mediaindex.scanner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for JSON export operations for scanned records.
 */
public interface JsonExportServiceInterface {
    /**
     * Writes records as JSON Lines, one serialized record per line.
     * @param records records to write
     * @param filename Name of the output file, resolved against the output directory
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writeRecords(List<? extends MediaRecord> records, String filename) throws IOException;
}
