package org.smileyface.linkmeta.fetch;

import java.io.IOException;

/**
 * A metadata fetch failed. {@link #getReason()} classifies the failure for logging.
 */
public class MetadataFetchException extends IOException {

    public enum Reason {
        INVALID_URL,
        BLOCKED,
        DNS,
        HTTP_STATUS,
        REDIRECT,
        TIMEOUT,
        FETCH_ERROR
    }

    private final Reason reason;

    public MetadataFetchException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MetadataFetchException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
