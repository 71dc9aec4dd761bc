package com.mediaindex.scanner;

/**
 * Raised when a {@link QueryResult} cannot read from its underlying source.
 */
public class MediaSourceException extends RuntimeException {

    public MediaSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
