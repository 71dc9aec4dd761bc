package com.mediaindex.scanner;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * Immutable record representing a playlist and the songs it contains.
 * <p>
 * The song list is copied at construction, so a playlist owns its songs and nothing
 * outside it can change them.
 *
 * @param identity id and timestamps
 * @param name playlist name
 * @param songs member songs in source order
 */
public record Playlist(@JsonUnwrapped RecordIdentity identity, String name, List<Song> songs) implements MediaRecord {

    public Playlist {
        identity = identity == null ? RecordIdentity.now() : identity;
        name = Utils.emptyIfNull(name);
        songs = songs == null ? List.of() : List.copyOf(songs);
    }
}
