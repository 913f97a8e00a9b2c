package org.smileyface.linkmeta.queue;

/**
 * Raised when the queue cannot serialize a job or talk to its backing store.
 */
public class MetadataQueueException extends RuntimeException {

    public MetadataQueueException(String message) {
        super(message);
    }

    public MetadataQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
