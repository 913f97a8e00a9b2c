package org.smileyface.linkmeta.processor;

/**
 * Terminal result of processing one job. Every outcome is followed by an acknowledgment.
 */
public enum JobOutcome {
    /** Metadata merged, stored and announced. */
    UPDATED,

    /** The fetcher raised an error. */
    FETCH_FAILED,

    /** The fetcher returned nothing. */
    EMPTY_RESULT,

    /** The link was deleted before or during processing. */
    LINK_NOT_FOUND,

    /** Reading or writing the link store failed. */
    PERSIST_FAILED;

    public boolean isSuccess() {
        return this == UPDATED;
    }
}
