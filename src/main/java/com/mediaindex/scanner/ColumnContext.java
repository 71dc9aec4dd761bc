package com.mediaindex.scanner;

/**
 * Column naming scheme of a query. The same semantic field can live under different
 * column names depending on which collection is queried.
 */
public enum ColumnContext {
    /** Global song collection, {@link MediaCollections#AUDIO_MEDIA}. */
    LIBRARY,
    /** Membership view of one playlist, {@link MediaCollections#playlistMembers(long)}. */
    PLAYLIST_MEMBERS,
    /** Global playlist collection, {@link MediaCollections#PLAYLISTS}. */
    PLAYLISTS
}
