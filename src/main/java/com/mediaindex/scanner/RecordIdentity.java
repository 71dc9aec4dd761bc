package com.mediaindex.scanner;

/**
 * Identity and timestamp fields shared by every media record.
 * <p>
 * Embedded by value in {@link Song} and {@link Playlist}; serialized flat alongside the
 * record's own fields.
 *
 * @param id identifier, unique within its record kind
 * @param createdAt creation timestamp in epoch milliseconds
 * @param updatedAt last modification timestamp in epoch milliseconds
 * @author Media Scanner Team
 * @since 1.0
 */
public record RecordIdentity(long id, long createdAt, long updatedAt) {

    /**
     * Returns an identity whose id and timestamps are all the current time.
     * Used when the source does not supply a value.
     */
    public static RecordIdentity now() {
        long now = System.currentTimeMillis();
        return new RecordIdentity(now, now, now);
    }
}
