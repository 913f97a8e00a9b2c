package org.smileyface.linkmeta.config;

import org.smileyface.linkmeta.processor.MetadataWorkerPool;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the metadata worker pool start/stop lifecycle with the Spring container lifecycle.
 * Running state is read from the pool, so a pool whose workers exited on their own reports
 * stopped.
 */
public class WorkerPoolLifecycle implements SmartLifecycle {
    private final MetadataWorkerPool pool;
    private final boolean autoStartup;

    public WorkerPoolLifecycle(MetadataWorkerPool pool, boolean autoStartup) {
        this.pool = pool;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        pool.start();
    }

    @Override
    public void stop() {
        pool.stop();
    }

    @Override
    public boolean isRunning() {
        return pool.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
