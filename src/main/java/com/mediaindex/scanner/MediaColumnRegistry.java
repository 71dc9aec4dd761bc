package com.mediaindex.scanner;

import java.util.List;
import java.util.Map;

import static com.mediaindex.scanner.ColumnContext.LIBRARY;
import static com.mediaindex.scanner.ColumnContext.PLAYLISTS;
import static com.mediaindex.scanner.ColumnContext.PLAYLIST_MEMBERS;

/**
 * Central table of every column the scanner reads, keyed by semantic field and
 * {@link ColumnContext}.
 * <p>
 * The membership view exposes a song's id as {@code audio_id}; its own {@code _id} is the
 * id of the membership entry, not of the song. Every other song column has the same name
 * in both song contexts.
 */
public final class MediaColumnRegistry {
    private MediaColumnRegistry() {}

    public static final MediaColumn ID = column("id", Map.of(
        LIBRARY, "_id", PLAYLIST_MEMBERS, "audio_id", PLAYLISTS, "_id"));
    public static final MediaColumn TITLE = songColumn("title", "title");
    public static final MediaColumn ARTIST = songColumn("artist", "artist");
    public static final MediaColumn ALBUM = songColumn("album", "album");
    public static final MediaColumn YEAR = songColumn("year", "year");
    public static final MediaColumn TRACK = songColumn("track", "track");
    public static final MediaColumn COMPOSER = songColumn("composer", "composer");
    public static final MediaColumn DURATION = songColumn("duration", "duration");
    public static final MediaColumn SIZE = songColumn("size", "_size");
    public static final MediaColumn PATH = songColumn("path", "_data");
    public static final MediaColumn CREATED_AT = column("createdAt", Map.of(
        LIBRARY, "date_added", PLAYLIST_MEMBERS, "date_added", PLAYLISTS, "date_added"));
    public static final MediaColumn UPDATED_AT = column("updatedAt", Map.of(
        LIBRARY, "date_modified", PLAYLIST_MEMBERS, "date_modified", PLAYLISTS, "date_modified"));
    public static final MediaColumn NAME = column("name", Map.of(PLAYLISTS, "name"));

    /** Flag column marking rows that are playable audio tracks; non-zero means true. */
    public static final String IS_MUSIC = "is_music";

    private static final List<MediaColumn> SONG_COLUMNS = List.of(
        ID, TITLE, ARTIST, ALBUM, YEAR, TRACK, COMPOSER, DURATION, SIZE, PATH, CREATED_AT, UPDATED_AT);

    private static final List<MediaColumn> PLAYLIST_COLUMNS = List.of(ID, NAME, CREATED_AT, UPDATED_AT);

    /**
     * Returns the columns read when mapping a row of the given context.
     */
    public static List<MediaColumn> getColumns(ColumnContext context) {
        return context == PLAYLISTS ? PLAYLIST_COLUMNS : SONG_COLUMNS;
    }

    private static MediaColumn songColumn(String fieldName, String columnName) {
        return column(fieldName, Map.of(LIBRARY, columnName, PLAYLIST_MEMBERS, columnName));
    }

    private static MediaColumn column(String fieldName, Map<ColumnContext, String> columnNames) {
        return new MediaColumn(fieldName, columnNames);
    }
}
