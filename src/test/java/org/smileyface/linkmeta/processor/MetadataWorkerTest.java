package org.smileyface.linkmeta.processor;

import org.junit.jupiter.api.Test;
import org.smileyface.linkmeta.queue.MalformedJobException;
import org.smileyface.linkmeta.queue.MetadataJob;
import org.smileyface.linkmeta.queue.MetadataJobQueue;
import org.smileyface.linkmeta.queue.MetadataQueueException;
import org.smileyface.linkmeta.store.InMemoryLinkMetadataStore;
import org.smileyface.linkmeta.testutil.RecordingEventPublisher;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.smileyface.linkmeta.testutil.Waits.waitUntil;

class MetadataWorkerTest {

    private final InMemoryLinkMetadataStore store = new InMemoryLinkMetadataStore();
    private final RecordingEventPublisher publisher = new RecordingEventPublisher();
    private final LinkMetadataJobProcessor processor =
            new LinkMetadataJobProcessor((url, timeout) -> Map.of("title", "T"), store, publisher);

    private MetadataJob job() {
        UUID postId = UUID.randomUUID();
        UUID linkId = UUID.randomUUID();
        store.putLink(linkId, postId, UUID.randomUUID(), null);
        return MetadataJob.create(postId, linkId, "https://example.com/");
    }

    @Test
    void malformedPayloadIsSkippedAndLoopContinues() throws Exception {
        MetadataJobQueue queue = mock(MetadataJobQueue.class);
        MetadataJob good = job();
        when(queue.dequeue(any()))
                .thenThrow(new MalformedJobException("garbage", null))
                .thenReturn(good)
                .thenReturn(null);
        MetadataWorker worker = new MetadataWorker("w-1", queue, processor, Duration.ofMillis(10),
                Duration.ofMillis(10), new CancellationSignal());

        Thread t = new Thread(worker);
        t.start();
        assertThat(waitUntil(() -> worker.getStatus().getProcessedCount() == 1, Duration.ofSeconds(5))).isTrue();
        worker.stop();
        t.join(5000);

        verify(queue).ack(good);
        assertThat(publisher.getPublished()).hasSize(1);
        assertThat(worker.getStatus().getState()).isEqualTo(WorkerState.STOPPED);
        assertThat(worker.getStatus().getLastError()).contains("garbage");
    }

    @Test
    void transportErrorBacksOffAndRecovers() throws Exception {
        MetadataJobQueue queue = mock(MetadataJobQueue.class);
        MetadataJob good = job();
        when(queue.dequeue(any()))
                .thenThrow(new MetadataQueueException("connection refused", null))
                .thenReturn(good)
                .thenReturn(null);
        MetadataWorker worker = new MetadataWorker("w-1", queue, processor, Duration.ofMillis(10),
                Duration.ofMillis(100), new CancellationSignal());

        Thread t = new Thread(worker);
        t.start();
        assertThat(waitUntil(() -> worker.getStatus().getProcessedCount() == 1, Duration.ofSeconds(5))).isTrue();
        worker.stop();
        t.join(5000);

        verify(queue).ack(good);
        assertThat(t.isAlive()).isFalse();
    }

    @Test
    void failedAckDoesNotKillTheWorker() throws Exception {
        MetadataJobQueue queue = mock(MetadataJobQueue.class);
        MetadataJob first = job();
        MetadataJob second = job();
        when(queue.dequeue(any())).thenReturn(first).thenReturn(second).thenReturn(null);
        doThrow(new MetadataQueueException("ack failed", null)).when(queue).ack(first);
        MetadataWorker worker = new MetadataWorker("w-1", queue, processor, Duration.ofMillis(10),
                Duration.ofMillis(10), new CancellationSignal());

        Thread t = new Thread(worker);
        t.start();
        assertThat(waitUntil(() -> worker.getStatus().getProcessedCount() == 2, Duration.ofSeconds(5))).isTrue();
        worker.stop();
        t.join(5000);

        verify(queue).ack(second);
        assertThat(worker.getStatus().getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void stopBeforeRunEndsImmediately() {
        MetadataJobQueue queue = mock(MetadataJobQueue.class);
        MetadataWorker worker = new MetadataWorker("w-1", queue, processor, Duration.ofMillis(10),
                Duration.ofMillis(10), null);

        worker.stop();
        worker.run();

        verifyNoInteractions(queue);
        assertThat(worker.getStatus().getState()).isEqualTo(WorkerState.STOPPED);
    }
}
