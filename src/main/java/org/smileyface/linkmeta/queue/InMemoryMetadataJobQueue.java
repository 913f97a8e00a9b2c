package org.smileyface.linkmeta.queue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process MetadataJobQueue for tests and single-node runs without Redis.
 *
 * <p>Both lists are guarded by one lock, so the pending-to-processing move is atomic in the same
 * way BRPOPLPUSH is for the Redis queue. Nothing survives a restart.</p>
 */
public class InMemoryMetadataJobQueue implements MetadataJobQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<MetadataJob> pending = new ArrayDeque<>();
    private final List<MetadataJob> processing = new ArrayList<>();

    @Override
    public void enqueue(MetadataJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job must not be null");
        }
        lock.lock();
        try {
            pending.addLast(job);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MetadataJob dequeue(Duration timeout) {
        long nanos = timeout == null ? 0L : Math.max(0L, timeout.toNanos());
        lock.lock();
        try {
            while (pending.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                try {
                    nanos = notEmpty.awaitNanos(nanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return null;
                }
            }
            MetadataJob job = pending.pollFirst();
            processing.add(job);
            return job;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ack(MetadataJob job) {
        if (job == null) return;
        lock.lock();
        try {
            processing.remove(job);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long pendingLength() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long processingLength() {
        lock.lock();
        try {
            return processing.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void init() {
        lock.lock();
        try {
            pending.clear();
            processing.clear();
        } finally {
            lock.unlock();
        }
    }
}
