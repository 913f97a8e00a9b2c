package org.smileyface.linkmeta.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.net.URI;
import java.time.Instant;

public class LinkMetaUtils {

    private static final String UPLOADS_PATH = "/api/v1/uploads";

    private LinkMetaUtils() {
        // No instanciation
    }

    /**
     * ObjectMapper used for every JSON payload of the pipeline (queue, database column, events).
     * Dates are written as ISO-8601 strings and unknown properties are ignored on read.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * True for links pointing at files uploaded to the application itself, either as a
     * relative path or an absolute URL.
     */
    public static boolean isInternalUploadUrl(String url) {
        if (url == null || url.isBlank()) return false;
        String trimmed = url.trim();
        if (trimmed.equals(UPLOADS_PATH) || trimmed.startsWith(UPLOADS_PATH + "/")) {
            return true;
        }
        try {
            String path = URI.create(trimmed).getPath();
            return path != null && (path.equals(UPLOADS_PATH) || path.startsWith(UPLOADS_PATH + "/"));
        } catch (Exception e) {
            return false;
        }
    }

    public static long durationMs(Instant start, Instant end) {
        return Math.max(0, end.toEpochMilli() - start.toEpochMilli());
    }
}
