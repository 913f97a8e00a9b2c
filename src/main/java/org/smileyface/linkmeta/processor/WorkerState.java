package org.smileyface.linkmeta.processor;

/**
 * Lifecycle state of a MetadataWorker. A worker cycles IDLE, FETCHING, PERSISTING, NOTIFYING
 * and back to IDLE once per job until it ends in STOPPED or ERROR.
 */
public enum WorkerState {
    NEW,
    IDLE,
    FETCHING,
    PERSISTING,
    NOTIFYING,
    STOPPED,
    ERROR;

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR;
    }
}
