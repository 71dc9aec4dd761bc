package com.mediaindex.scanner;

/**
 * Identifiers of the collections a {@link MediaSource} serves.
 */
public final class MediaCollections {
    private MediaCollections() {}

    /** Every audio file in the library. */
    public static final String AUDIO_MEDIA = "audio/media";

    /** Every playlist. */
    public static final String PLAYLISTS = "audio/playlists";

    private static final String MEMBERS_SUFFIX = "/members";

    /**
     * Returns the membership view of one playlist: the songs it contains, with the
     * membership column layout.
     * @param playlistId playlist id
     * @return collection identifier
     */
    public static String playlistMembers(long playlistId) {
        return PLAYLISTS + "/" + playlistId + MEMBERS_SUFFIX;
    }

    /**
     * Extracts the playlist id from a membership collection identifier.
     * @param collection collection identifier
     * @return playlist id, or null if {@code collection} is not a membership view
     */
    public static Long parsePlaylistId(String collection) {
        if (collection == null || !collection.startsWith(PLAYLISTS + "/") || !collection.endsWith(MEMBERS_SUFFIX)) {
            return null;
        }
        String id = collection.substring(PLAYLISTS.length() + 1, collection.length() - MEMBERS_SUFFIX.length());
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
