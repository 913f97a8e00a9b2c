package org.smileyface.linkmeta.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkmeta.queue.MalformedJobException;
import org.smileyface.linkmeta.queue.MetadataJob;
import org.smileyface.linkmeta.queue.MetadataJobQueue;
import org.smileyface.linkmeta.queue.MetadataQueueException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.smileyface.linkmeta.util.LinkMetaUtils.durationMs;

/**
 * A consumer loop that takes jobs from a MetadataJobQueue, hands them to the
 * {@link LinkMetadataJobProcessor} and acknowledges them. The loop polls with a bounded
 * timeout and exits at the next poll once stop is requested or the pool's
 * {@link CancellationSignal} fires.
 */
public class MetadataWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MetadataWorker.class);

    private final String id;
    private final MetadataJobQueue queue;
    private final LinkMetadataJobProcessor processor;
    private final Duration dequeueTimeout;
    private final Duration errorBackoff;
    private final CancellationSignal cancellation;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong droppedCount = new AtomicLong(0);

    private volatile WorkerState state = WorkerState.NEW;
    private volatile String lastUrl;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public MetadataWorker(String id,
                          MetadataJobQueue queue,
                          LinkMetadataJobProcessor processor,
                          Duration dequeueTimeout,
                          Duration errorBackoff,
                          CancellationSignal cancellation) {
        this.id = Objects.requireNonNull(id, "id");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.dequeueTimeout = Objects.requireNonNull(dequeueTimeout, "dequeueTimeout");
        this.errorBackoff = errorBackoff != null ? errorBackoff : Duration.ZERO;
        this.cancellation = cancellation != null ? cancellation : new CancellationSignal();
    }

    public String getId() {
        return id;
    }

    public void stop() {
        stopRequested.set(true);
        if (state == WorkerState.NEW) {
            transitionTo(WorkerState.STOPPED, null);
        }
    }

    public WorkerStatus getStatus() {
        return new WorkerStatus(id, state, processedCount.get(), droppedCount.get(), lastUrl, lastError,
                startedAt, finishedAt);
    }

    @Override
    public void run() {
        if (state.isTerminal()) {
            return;
        }
        transitionTo(WorkerState.IDLE, null);
        try {
            while (!shouldStop()) {
                MetadataJob job;
                try {
                    job = queue.dequeue(dequeueTimeout);
                } catch (MalformedJobException e) {
                    lastError = e.getMessage();
                    log.error("Worker {} dropped malformed job payload: {}", id, e.getMessage());
                    continue;
                } catch (MetadataQueueException e) {
                    if (shouldStop()) break;
                    lastError = e.getMessage();
                    log.error("Worker {} failed to dequeue metadata job", id, e);
                    pause(errorBackoff);
                    continue;
                }
                if (job == null) {
                    continue;
                }
                handle(job);
            }
            transitionTo(WorkerState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(WorkerState.ERROR, t);
        }
    }

    private void handle(MetadataJob job) {
        lastUrl = job.getUrl();
        try {
            JobOutcome outcome = processor.process(job, this::enterStage);
            if (!outcome.isSuccess()) {
                droppedCount.incrementAndGet();
            }
        } catch (RuntimeException e) {
            droppedCount.incrementAndGet();
            lastError = e.getMessage();
            log.error("Worker {} failed processing job {} (url={})", id, job.getJobId(), job.getUrl(), e);
        } finally {
            try {
                queue.ack(job);
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.error("Worker {} failed to acknowledge job {}", id, job.getJobId(), e);
            }
            processedCount.incrementAndGet();
            enterStage(WorkerState.IDLE);
        }
    }

    private boolean shouldStop() {
        return stopRequested.get() || cancellation.isCancelled() || Thread.currentThread().isInterrupted();
    }

    private void pause(Duration duration) {
        if (duration.isZero()) return;
        long deadline = System.nanoTime() + duration.toNanos();
        // Sleep in short slices so a stop request is honoured promptly
        while (!shouldStop()) {
            long left = deadline - System.nanoTime();
            if (left <= 0) return;
            try {
                Thread.sleep(Math.max(1L, Math.min(100L, Duration.ofNanos(left).toMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void enterStage(WorkerState stage) {
        WorkerState old = this.state;
        this.state = stage;
        log.debug("Worker {} state {} -> {}", id, old, stage);
    }

    /**
     * Lifecycle transitions (start and terminal states) with structured logging. Terminal
     * transitions record the finish time and include the run duration.
     */
    private void transitionTo(WorkerState newState, Throwable error) {
        WorkerState old = this.state;
        if (newState == WorkerState.IDLE) {
            if (this.startedAt == null) {
                this.startedAt = Instant.now();
            }
            this.state = WorkerState.IDLE;
            log.info("Worker {} state {} -> {} (startedAt={})", id, old, this.state, startedAt);
            return;
        }

        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? durationMs(startedAt, finishedAt) : 0L;
        long count = processedCount.get();
        if (newState == WorkerState.ERROR) {
            log.error("Worker {} state {} -> ERROR after {} ms (processed={}, lastUrl={}, error={})",
                    id, old, dur, count, lastUrl, lastError, error);
        } else {
            log.info("Worker {} state {} -> {} after {} ms (processed={}, dropped={})",
                    id, old, newState, dur, count, droppedCount.get());
        }
    }
}
