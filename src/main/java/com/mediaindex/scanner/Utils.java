package com.mediaindex.scanner;

/**
 * Utility class for small helpers shared by records and exporters.
 *
 * @author Media Scanner Team
 * @since 1.0
 */
public class Utils {

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        // Replace each invalid character or whitespace with a single underscore
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * @param value Input text
     * @return {@code value}, or the empty string if it is null
     */
    public static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
