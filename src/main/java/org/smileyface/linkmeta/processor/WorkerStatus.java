package org.smileyface.linkmeta.processor;

import java.time.Instant;

/**
 * Immutable snapshot of a worker's status.
 */
public final class WorkerStatus {
    private final String id;
    private final WorkerState state;
    private final long processedCount;
    private final long droppedCount;
    private final String lastUrl;
    private final String lastError;
    private final Instant startedAt;
    private final Instant finishedAt;

    public WorkerStatus(String id, WorkerState state, long processedCount, long droppedCount, String lastUrl,
                        String lastError, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.state = state;
        this.processedCount = processedCount;
        this.droppedCount = droppedCount;
        this.lastUrl = lastUrl;
        this.lastError = lastError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getId() { return id; }
    public WorkerState getState() { return state; }
    /** Jobs taken off the queue and acknowledged, whatever their outcome. */
    public long getProcessedCount() { return processedCount; }
    /** Subset of processed jobs that ended without a metadata update. */
    public long getDroppedCount() { return droppedCount; }
    public String getLastUrl() { return lastUrl; }
    public String getLastError() { return lastError; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}
