package com.mediaindex.scanner;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings of a scan run.
 * <p>
 * Each value is read from a Java system property first, then from the environment variable of
 * the same name, then falls back to its default.
 *
 * @param dbUrl JDBC URL of the media database ({@code MEDIA_DB_URL})
 * @param dbUser database user ({@code MEDIA_DB_USER})
 * @param dbPassword database password ({@code MEDIA_DB_PASSWORD})
 * @param outputDir directory export files are written to ({@code SCANNER_OUTPUT_DIR})
 */
public record ScannerConfig(String dbUrl, String dbUser, String dbPassword, Path outputDir) {
    public static final String DB_URL = "MEDIA_DB_URL";
    public static final String DB_USER = "MEDIA_DB_USER";
    public static final String DB_PASSWORD = "MEDIA_DB_PASSWORD";
    public static final String OUTPUT_DIR = "SCANNER_OUTPUT_DIR";

    static final String DEFAULT_DB_URL = "jdbc:postgresql://localhost:5432/media";
    static final String DEFAULT_DB_USER = "postgres";
    static final String DEFAULT_DB_PASSWORD = "postgres";
    static final String DEFAULT_OUTPUT_DIR = "scanned-data";

    /**
     * Builds the configuration from system properties and environment variables.
     */
    public static ScannerConfig fromEnvironment() {
        return new ScannerConfig(
            setting(DB_URL, DEFAULT_DB_URL),
            setting(DB_USER, DEFAULT_DB_USER),
            setting(DB_PASSWORD, DEFAULT_DB_PASSWORD),
            Paths.get(setting(OUTPUT_DIR, DEFAULT_OUTPUT_DIR))
        );
    }

    private static String setting(String name, String defaultValue) {
        return System.getProperty(name, System.getenv().getOrDefault(name, defaultValue));
    }

    @Override
    public String toString() {
        // keep the password out of logs
        return "ScannerConfig[dbUrl=" + dbUrl + ", dbUser=" + dbUser + ", outputDir=" + outputDir + "]";
    }
}
