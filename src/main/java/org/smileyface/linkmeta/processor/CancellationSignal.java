package org.smileyface.linkmeta.processor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag shared by all workers of a pool. Workers check it between polls;
 * a job already in progress is finished first.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
