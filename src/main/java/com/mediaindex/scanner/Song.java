package com.mediaindex.scanner;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Immutable record representing a song materialized from one source row.
 * <p>
 * Null handling is done at construction so consumers (CSV, JSON, callers of the scanner)
 * never see a null {@code title}, {@code artist}, {@code album}, {@code composer} or
 * {@code year}. {@code path} stays null when the source has no file location.
 *
 * @param identity id and timestamps
 * @param title song title
 * @param artist performing artist
 * @param album album name
 * @param composer composer, empty when unknown
 * @param year release year as provided by the source, empty when unknown
 * @param track track number, 0 when unknown
 * @param duration duration in milliseconds
 * @param size file size in bytes
 * @param path file location, or null
 * @author Media Scanner Team
 * @since 1.0
 */
public record Song(
    @JsonUnwrapped RecordIdentity identity,
    String title,
    String artist,
    String album,
    String composer,
    String year,
    long track,
    long duration,
    long size,
    String path
) implements MediaRecord {

    public Song {
        identity = identity == null ? RecordIdentity.now() : identity;
        title = Utils.emptyIfNull(title);
        artist = Utils.emptyIfNull(artist);
        album = Utils.emptyIfNull(album);
        composer = Utils.emptyIfNull(composer);
        year = Utils.emptyIfNull(year);
    }
}
