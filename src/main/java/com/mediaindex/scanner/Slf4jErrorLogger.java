package com.mediaindex.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ErrorLogger} that forwards failures to SLF4J at error level.
 */
public class Slf4jErrorLogger implements ErrorLogger {
    private final Logger logger;

    public Slf4jErrorLogger() {
        this(LoggerFactory.getLogger(Slf4jErrorLogger.class));
    }

    public Slf4jErrorLogger(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void logError(Throwable error) {
        logger.error("Handled failure: {}", error == null ? null : error.getMessage(), error);
    }
}
