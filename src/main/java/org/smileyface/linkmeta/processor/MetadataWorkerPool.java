package org.smileyface.linkmeta.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkmeta.config.LinkMetadataProperties;
import org.smileyface.linkmeta.fetch.MetadataFetcher;
import org.smileyface.linkmeta.notify.LinkEventPublisher;
import org.smileyface.linkmeta.queue.MetadataJobQueue;
import org.smileyface.linkmeta.store.LinkMetadataStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manages a fixed set of {@link MetadataWorker}s, each on its own platform thread.
 * Provides APIs to start, stop and query statuses of workers.
 */
public class MetadataWorkerPool {

    private static final Logger log = LogManager.getLogger();

    public static final Duration DEFAULT_DEQUEUE_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofSeconds(1);

    private final MetadataJobQueue queue;
    private final LinkMetadataJobProcessor processor;
    private final int workerCount;
    private final Duration dequeueTimeout;
    private final Duration errorBackoff;

    private final List<MetadataWorker> workers = new CopyOnWriteArrayList<>();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService executor;
    private CancellationSignal cancellation;

    /**
     * Pool with the default processing pipeline. A worker count of zero or less selects
     * {@link LinkMetadataProperties#DEFAULT_WORKER_COUNT}.
     */
    public MetadataWorkerPool(MetadataJobQueue queue,
                              LinkMetadataStore store,
                              MetadataFetcher fetcher,
                              LinkEventPublisher publisher,
                              int workerCount) {
        this(queue, new LinkMetadataJobProcessor(fetcher, store, publisher), workerCount,
                DEFAULT_DEQUEUE_TIMEOUT, DEFAULT_ERROR_BACKOFF);
    }

    public MetadataWorkerPool(MetadataJobQueue queue,
                              LinkMetadataJobProcessor processor,
                              int workerCount,
                              Duration dequeueTimeout,
                              Duration errorBackoff) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.workerCount = LinkMetadataProperties.effectiveWorkerCount(workerCount);
        this.dequeueTimeout = dequeueTimeout != null ? dequeueTimeout : DEFAULT_DEQUEUE_TIMEOUT;
        this.errorBackoff = errorBackoff != null ? errorBackoff : DEFAULT_ERROR_BACKOFF;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void start() {
        start(new CancellationSignal());
    }

    /**
     * Launches the workers and returns immediately. Cancelling {@code signal} makes every worker
     * exit after its current job without a call to {@link #stop()}; once the last one has exited
     * the pool releases its threads and may be started again.
     */
    public synchronized void start(CancellationSignal signal) {
        if (running.get()) {
            throw new IllegalStateException("MetadataWorkerPool already running");
        }
        Objects.requireNonNull(signal, "signal");
        this.cancellation = signal;
        workers.clear();
        futures.clear();
        ExecutorService pool = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        AtomicInteger live = new AtomicInteger(workerCount);
        executor = pool;
        running.set(true);
        for (int i = 0; i < workerCount; i++) {
            MetadataWorker w = new MetadataWorker("metadata-worker-" + (i + 1), queue, processor,
                    dequeueTimeout, errorBackoff, signal);
            workers.add(w);
            futures.add(pool.submit(() -> {
                try {
                    w.run();
                } finally {
                    if (live.decrementAndGet() == 0) {
                        onAllWorkersExited(pool);
                    }
                }
            }));
        }
        log.info("MetadataWorkerPool STARTED with {} workers (dequeueTimeout={})", workerCount, dequeueTimeout);
    }

    /**
     * Signals cancellation and blocks until every worker has returned. Jobs already being
     * processed are finished and acknowledged first.
     */
    public synchronized void stop() {
        if (!running.get()) {
            return;
        }
        cancellation.cancel();
        for (MetadataWorker w : workers) {
            w.stop();
        }
        boolean interrupted = false;
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                interrupted = true;
            } catch (ExecutionException e) {
                log.error("Metadata worker terminated abnormally", e.getCause());
            }
        }
        executor.shutdown();
        running.set(false);
        logAggregate("STOPPED");
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Wait until all workers exit or the timeout elapses.
     * @return true if all workers finished before timeout, false otherwise.
     */
    public boolean awaitTermination(Duration timeout) {
        long remainingMs = timeout == null ? Long.MAX_VALUE : Math.max(0, timeout.toMillis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            long nanosLeft = deadline - System.nanoTime();
            if (nanosLeft <= 0 && !f.isDone()) return false;
            try {
                f.get(Math.max(0, nanosLeft), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logAggregate("AWAIT INTERRUPTED");
                return false;
            } catch (ExecutionException e) {
                log.error("Metadata worker terminated abnormally", e.getCause());
            }
        }
        synchronized (this) {
            if (executor != null) {
                executor.shutdown();
            }
            running.set(false);
        }
        logAggregate("ALL EXITED");
        return true;
    }

    // Runs on the last exiting worker thread; must not take the pool monitor, stop() holds it while joining
    private void onAllWorkersExited(ExecutorService pool) {
        pool.shutdown();
        if (executor == pool && running.compareAndSet(true, false)) {
            logAggregate("ALL EXITED");
        }
    }

    public boolean isRunning() {
        if (!running.get()) return false;
        for (Future<?> f : futures) {
            if (!f.isDone()) return true;
        }
        return false;
    }

    public List<WorkerStatus> getStatuses() {
        List<WorkerStatus> list = new ArrayList<>(workers.size());
        for (MetadataWorker w : workers) {
            list.add(w.getStatus());
        }
        return list;
    }

    private void logAggregate(String event) {
        int stopped = 0;
        int error = 0;
        long processed = 0L;
        long dropped = 0L;
        List<WorkerStatus> statuses = getStatuses();
        for (WorkerStatus s : statuses) {
            processed += s.getProcessedCount();
            dropped += s.getDroppedCount();
            if (s.getState() == WorkerState.STOPPED) stopped++;
            else if (s.getState() == WorkerState.ERROR) error++;
        }
        log.info("MetadataWorkerPool {}: workers -> stopped={}, error={}, totalProcessed={}, totalDropped={} (workers={})",
                event, stopped, error, processed, dropped, statuses.size());
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "metadata-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
