package com.mediaindex.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Main entry point for the media scanner.
 * This application scans songs and playlists from the media database and exports them to CSV
 * and JSON Lines files in the configured output directory.
 *
 * @author Media Scanner Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ScannerConfig config = ScannerConfig.fromEnvironment();
        logger.info("Starting scan with {}", config);
        ScannerServiceInterface scanner = new ScannerService(new JdbcMediaSource(config));
        run(scanner, new CsvService(config.outputDir()), new JsonExportService(config.outputDir()));
    }

    /**
     * Scans the library and every playlist, then writes the export files.
     * @param scanner scanner reading the media source
     * @param csvService CSV exporter
     * @param jsonExportService JSON Lines exporter
     */
    static void run(ScannerServiceInterface scanner, CsvServiceInterface csvService, JsonExportServiceInterface jsonExportService) {
        List<Song> songs = scanner.scanSongs();
        List<Playlist> playlists = scanner.scanPlaylists();
        if (songs.isEmpty() && playlists.isEmpty()) {
            logger.info("No songs or playlists found in the media source.");
            return;
        }
        try {
            csvService.writeSongsToCSV(songs, "library.csv");
            jsonExportService.writeRecords(songs, "library.jsonl");
            jsonExportService.writeRecords(playlists, "playlists.jsonl");
        } catch (IOException e) {
            logger.error("Failed to write library export: {}", e.getMessage());
        }
        exportPlaylists(playlists, csvService);
        logger.info("Scan finished: {} songs, {} playlists.", songs.size(), playlists.size());
    }

    private static void exportPlaylists(List<Playlist> playlists, CsvServiceInterface csvService) {
        for (Playlist playlist : playlists) {
            if (playlist.songs().isEmpty()) {
                logger.warn("Playlist '{}' has no songs.", playlist.name());
                continue;
            }
            String safeName = Utils.sanitizeFilename(playlist.name());
            if (safeName.isEmpty()) safeName = "playlist-" + playlist.identity().id();
            try {
                csvService.writeSongsToCSV(playlist.songs(), safeName + ".csv");
            } catch (IOException e) {
                logger.error("Failed to write playlist CSV '{}': {}", safeName, e.getMessage());
            }
        }
    }
}
