package org.smileyface.linkmeta.queue;

import java.time.Duration;

/**
 * Durable producer/consumer queue for {@link MetadataJob}s, split into a pending list and a
 * processing list.
 *
 * <p>A job moves from pending to processing atomically on {@link #dequeue(Duration)} and leaves
 * processing only through {@link #ack(MetadataJob)}. Delivery is at-least-once: a consumer that
 * dies between dequeue and ack leaves its job in the processing list.</p>
 */
public interface MetadataJobQueue {

    /**
     * Append a job to the pending list.
     *
     * @throws MetadataQueueException on serialization or transport failure
     */
    void enqueue(MetadataJob job);

    /**
     * Atomically move the oldest pending job onto the processing list and return it, waiting up to
     * {@code timeout} for one to arrive.
     *
     * @return the job, or null when the timeout elapsed with nothing pending
     * @throws MalformedJobException when the payload cannot be decoded; it has already been
     *                               removed from the processing list
     * @throws MetadataQueueException on transport failure
     */
    MetadataJob dequeue(Duration timeout);

    /**
     * Remove one occurrence of the job from the processing list. Acknowledging a job that is no
     * longer there is a no-op.
     */
    void ack(MetadataJob job);

    /** Number of jobs waiting to be picked up. */
    long pendingLength();

    /** Number of jobs dequeued but not yet acknowledged. */
    long processingLength();

    /**
     * Reset the queue by clearing both the pending and the processing list.
     */
    void init();
}
