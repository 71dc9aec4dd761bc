package com.mediaindex.scanner;

/**
 * Sink for failures that are handled locally and must not propagate.
 * Implementations must not throw.
 */
@FunctionalInterface
public interface ErrorLogger {

    /**
     * Records a failure.
     * @param error the failure that was handled
     */
    void logError(Throwable error);
}
