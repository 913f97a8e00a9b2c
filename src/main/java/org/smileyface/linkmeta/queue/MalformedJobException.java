package org.smileyface.linkmeta.queue;

/**
 * A dequeued payload could not be decoded into a {@link MetadataJob}. By the time this is thrown
 * the payload has been removed from the processing list, unless that removal failed, in which
 * case the failure is attached as a suppressed exception.
 */
public class MalformedJobException extends MetadataQueueException {

    private final String payload;

    public MalformedJobException(String payload, Throwable cause) {
        super("Malformed metadata job payload: " + abbreviate(payload), cause);
        this.payload = payload;
    }

    public String getPayload() {
        return payload;
    }

    private static String abbreviate(String payload) {
        if (payload == null) return "null";
        return payload.length() <= 200 ? payload : payload.substring(0, 200) + "...";
    }
}
