package com.mediaindex.scanner;

import java.util.List;

/**
 * Interface for reading songs and playlists out of a {@link MediaSource}.
 * <p>
 * Every operation is a synchronous, single-shot scan that returns freshly built records.
 * A source that yields no result, or fails while being read, produces an empty list.
 */
public interface ScannerServiceInterface {
    /**
     * Scans every playable song in the library.
     * @return songs ordered by title, then artist
     */
    List<Song> scanSongs();

    /**
     * Scans every playlist, each with its member songs resolved.
     * @return playlists in source order
     */
    List<Playlist> scanPlaylists();

    /**
     * Scans the playable songs of one playlist.
     * @param playlistId the playlist's id
     * @return member songs in source order, empty if the playlist does not exist
     */
    List<Song> getSongsFromPlaylist(long playlistId);
}
