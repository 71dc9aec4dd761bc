package com.mediaindex.scanner;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting scanned songs to CSV files using OpenCSV.
 * <p>
 * One header row, then one row per song with every Song field. A null {@code path} is written
 * as an empty cell.
 *
 * @author Media Scanner Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {
        "Id", "Title", "Artist", "Album", "Year", "Track", "Composer",
        "Duration", "Size", "Path", "CreatedAt", "UpdatedAt"
    };

    private final Path outputDir;

    /**
     * @param outputDir directory the CSV files are written to; created on demand
     */
    public CsvService(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Path writeSongsToCSV(List<Song> songs, String filename) throws IOException {
        if (songs == null) {
            logger.warn("Attempted to write null song list to CSV: {}", filename);
            throw new IllegalArgumentException("Song list cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(filename);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (Song song : songs) {
                writer.writeNext(new String[]{
                    Long.toString(song.identity().id()),
                    song.title(),
                    song.artist(),
                    song.album(),
                    song.year(),
                    Long.toString(song.track()),
                    song.composer(),
                    Long.toString(song.duration()),
                    Long.toString(song.size()),
                    Utils.emptyIfNull(song.path()),
                    Long.toString(song.identity().createdAt()),
                    Long.toString(song.identity().updatedAt())
                });
            }
        }
        logger.info("Wrote {} songs to CSV file: {}", songs.size(), file);
        return file;
    }
}
