package com.mediaindex.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps query results of a {@link MediaSource} to {@link Song} and {@link Playlist} records.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Each operation issues one query (playlist scans issue one more per playlist) and owns
 *       its result from acquisition to close.</li>
 *   <li>Column offsets are resolved once per query through {@link ColumnOffsets}, using the
 *       naming scheme of the queried collection ({@link ColumnContext}).</li>
 *   <li>Every row becomes one fully built record; absent or null values fall back to the
 *       field's default.</li>
 * </ul>
 * <p>
 * Error handling: "no result" is an empty scan, not an error. A read failure while walking the
 * rows is logged and the scan returns an empty list, so a partial result is never returned.
 * <p>
 * Not safe for concurrent use of one instance; thread safety of the source is the source's concern.
 *
 * @author Media Scanner Team
 * @since 1.0
 */
public class ScannerService implements ScannerServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ScannerService.class);

    static final String MUSIC_SELECTION = MediaColumnRegistry.IS_MUSIC + " != 0";
    static final String SONG_SORT_ORDER = MediaColumnRegistry.TITLE.columnName(ColumnContext.LIBRARY) + " ASC, "
        + MediaColumnRegistry.ARTIST.columnName(ColumnContext.LIBRARY) + " ASC";

    private final MediaSource source;

    /**
     * Constructs a ScannerService reading from the given source.
     * @param source tabular media source
     */
    public ScannerService(MediaSource source) {
        if (source == null) {
            throw new IllegalArgumentException("Media source cannot be null");
        }
        this.source = source;
    }

    @Override
    public List<Song> scanSongs() {
        List<Song> songs = readSongs(MediaCollections.AUDIO_MEDIA, SONG_SORT_ORDER, ColumnContext.LIBRARY);
        logger.info("Scanned {} songs from the library.", songs.size());
        return songs;
    }

    @Override
    public List<Playlist> scanPlaylists() {
        QueryResult result = source.query(MediaCollections.PLAYLISTS, null, null);
        if (result == null) {
            logger.warn("No result for collection {}", MediaCollections.PLAYLISTS);
            return List.of();
        }
        List<Playlist> playlists = new ArrayList<>();
        try (result) {
            if (!result.hasRows()) {
                return playlists;
            }
            ColumnOffsets columns = ColumnOffsets.resolve(result, ColumnContext.PLAYLISTS);
            while (result.next()) {
                RecordIdentity identity = readIdentity(columns);
                String name = columns.getString(MediaColumnRegistry.NAME, "");
                playlists.add(new Playlist(identity, name, getSongsFromPlaylist(identity.id())));
            }
        } catch (MediaSourceException e) {
            logger.error("Failed to read playlists: {}", e.getMessage());
            return List.of();
        }
        logger.info("Scanned {} playlists.", playlists.size());
        return playlists;
    }

    @Override
    public List<Song> getSongsFromPlaylist(long playlistId) {
        List<Song> songs = readSongs(MediaCollections.playlistMembers(playlistId), null, ColumnContext.PLAYLIST_MEMBERS);
        logger.debug("Playlist {} has {} songs.", playlistId, songs.size());
        return songs;
    }

    /**
     * Runs a playable-song query and maps every row.
     * @param collection collection to query
     * @param sortOrder sort expression, or null for native order
     * @param context naming scheme of {@code collection}
     * @return mapped songs, empty on no result or read failure
     */
    private List<Song> readSongs(String collection, String sortOrder, ColumnContext context) {
        QueryResult result = source.query(collection, MUSIC_SELECTION, sortOrder);
        if (result == null) {
            logger.warn("No result for collection {}", collection);
            return List.of();
        }
        List<Song> songs = new ArrayList<>();
        try (result) {
            if (!result.hasRows()) {
                return songs;
            }
            ColumnOffsets columns = ColumnOffsets.resolve(result, context);
            while (result.next()) {
                songs.add(readSong(columns));
            }
        } catch (MediaSourceException e) {
            logger.error("Failed to read songs from {}: {}", collection, e.getMessage());
            return List.of();
        }
        return songs;
    }

    private static Song readSong(ColumnOffsets columns) {
        return new Song(
            readIdentity(columns),
            columns.getString(MediaColumnRegistry.TITLE, ""),
            columns.getString(MediaColumnRegistry.ARTIST, ""),
            columns.getString(MediaColumnRegistry.ALBUM, ""),
            columns.getString(MediaColumnRegistry.COMPOSER, ""),
            columns.getString(MediaColumnRegistry.YEAR, ""),
            columns.getLong(MediaColumnRegistry.TRACK, 0),
            columns.getLong(MediaColumnRegistry.DURATION, 0),
            columns.getLong(MediaColumnRegistry.SIZE, 0),
            columns.getString(MediaColumnRegistry.PATH, null)
        );
    }

    // Missing identity values fall back to the construction time.
    private static RecordIdentity readIdentity(ColumnOffsets columns) {
        RecordIdentity defaults = RecordIdentity.now();
        return new RecordIdentity(
            columns.getLong(MediaColumnRegistry.ID, defaults.id()),
            columns.getLong(MediaColumnRegistry.CREATED_AT, defaults.createdAt()),
            columns.getLong(MediaColumnRegistry.UPDATED_AT, defaults.updatedAt())
        );
    }
}
