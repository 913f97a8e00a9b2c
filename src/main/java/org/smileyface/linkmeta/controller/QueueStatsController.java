package org.smileyface.linkmeta.controller;

import org.smileyface.linkmeta.processor.MetadataWorkerPool;
import org.smileyface.linkmeta.processor.WorkerStatus;
import org.smileyface.linkmeta.queue.MetadataJobQueue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of queue depth and worker state.
 */
@RestController
@RequestMapping("/api/v1/link-metadata")
class QueueStatsController {

    private final MetadataJobQueue queue;
    private final MetadataWorkerPool pool;

    QueueStatsController(MetadataJobQueue queue, MetadataWorkerPool pool) {
        this.queue = queue;
        this.pool = pool;
    }

    @GetMapping("/queue")
    public Map<String, Object> queue() {
        List<WorkerStatus> workers = pool.getStatuses();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pending", queue.pendingLength());
        body.put("processing", queue.processingLength());
        body.put("running", pool.isRunning());
        body.put("workers", workers);
        return body;
    }
}
