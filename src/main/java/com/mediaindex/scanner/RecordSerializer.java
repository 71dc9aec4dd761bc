package com.mediaindex.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders media records as JSON text with Jackson.
 * <p>
 * {@link #serialize(MediaRecord)} is total: any encoding failure is reported to the
 * configured {@link ErrorLogger} once and the empty object {@code "{}"} is returned.
 *
 * @author Media Scanner Team
 * @since 1.0
 */
public class RecordSerializer {
    /** Text returned when a record cannot be encoded. */
    public static final String EMPTY_OBJECT = "{}";

    private static final RecordSerializer DEFAULT = new RecordSerializer(new ObjectMapper(), new Slf4jErrorLogger());

    private final ObjectMapper mapper;
    private final ErrorLogger errorLogger;

    /**
     * Constructs a serializer.
     * @param mapper Jackson mapper used for encoding
     * @param errorLogger receives encoding failures
     */
    public RecordSerializer(ObjectMapper mapper, ErrorLogger errorLogger) {
        this.mapper = mapper;
        this.errorLogger = errorLogger;
    }

    /**
     * @return the shared serializer used by {@link MediaRecord#serialize()}
     */
    public static RecordSerializer getDefault() {
        return DEFAULT;
    }

    /**
     * Encodes a record as JSON.
     * @param record record to encode
     * @return JSON text, or {@link #EMPTY_OBJECT} if encoding failed
     */
    public String serialize(MediaRecord record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (Exception e) {
            errorLogger.logError(e);
            return EMPTY_OBJECT;
        }
    }
}
