package com.mediaindex.scanner;

/**
 * Common contract of the records produced by a scan.
 * <p>
 * Every record carries a {@link RecordIdentity} and can render itself as JSON through
 * {@link #serialize()}, which never throws.
 *
 * @author Media Scanner Team
 * @since 1.0
 */
public interface MediaRecord {

    /**
     * @return identity and timestamps of this record
     */
    RecordIdentity identity();

    /**
     * Renders the whole record as JSON using the shared {@link RecordSerializer}.
     * @return JSON text, or {@code "{}"} if encoding failed
     */
    default String serialize() {
        return RecordSerializer.getDefault().serialize(this);
    }
}
