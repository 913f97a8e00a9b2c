package org.smileyface.linkmeta.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkmeta.fetch.MetadataFetcher;
import org.smileyface.linkmeta.merge.LinkMetadataMerger;
import org.smileyface.linkmeta.model.LinkMetadata;
import org.smileyface.linkmeta.model.LinkRecord;
import org.smileyface.linkmeta.notify.LinkEventPublisher;
import org.smileyface.linkmeta.notify.LinkMetadataEvent;
import org.smileyface.linkmeta.queue.MetadataJob;
import org.smileyface.linkmeta.store.LinkMetadataStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one job: fetch, load the link's current metadata, merge, persist, publish.
 *
 * <p>The stored metadata is read after the fetch, at processing time, so highlights added
 * between enqueue and processing are part of the merge input. There is no per-link locking:
 * two workers processing jobs for the same link at the same time can still overwrite each
 * other's merge.</p>
 */
public class LinkMetadataJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(LinkMetadataJobProcessor.class);

    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);

    private final MetadataFetcher fetcher;
    private final LinkMetadataStore store;
    private final LinkEventPublisher publisher;
    private final LinkMetadataMerger merger;
    private final FailedJobPolicy failedJobPolicy;
    private final Duration fetchTimeout;
    private final Clock clock;

    public LinkMetadataJobProcessor(MetadataFetcher fetcher, LinkMetadataStore store, LinkEventPublisher publisher) {
        this(fetcher, store, publisher, new LinkMetadataMerger(), new DropFailedJobPolicy(),
                DEFAULT_FETCH_TIMEOUT, Clock.systemUTC());
    }

    public LinkMetadataJobProcessor(MetadataFetcher fetcher,
                                    LinkMetadataStore store,
                                    LinkEventPublisher publisher,
                                    LinkMetadataMerger merger,
                                    FailedJobPolicy failedJobPolicy,
                                    Duration fetchTimeout,
                                    Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.failedJobPolicy = Objects.requireNonNull(failedJobPolicy, "failedJobPolicy");
        this.fetchTimeout = fetchTimeout != null ? fetchTimeout : DEFAULT_FETCH_TIMEOUT;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public JobOutcome process(MetadataJob job) {
        return process(job, stage -> { });
    }

    /**
     * @param onStage notified with FETCHING, PERSISTING and NOTIFYING as the job reaches each step
     */
    public JobOutcome process(MetadataJob job, Consumer<WorkerState> onStage) {
        Objects.requireNonNull(job, "job");
        log.debug("Processing metadata job {}: post={}, link={}, url={}",
                job.getJobId(), job.getPostId(), job.getLinkId(), job.getUrl());

        onStage.accept(WorkerState.FETCHING);
        Map<String, Object> fetched;
        try {
            fetched = fetcher.fetch(job.getUrl(), fetchTimeout);
        } catch (Exception e) {
            return fail(job, JobOutcome.FETCH_FAILED, e);
        }
        if (fetched == null || fetched.isEmpty()) {
            return fail(job, JobOutcome.EMPTY_RESULT, null);
        }

        onStage.accept(WorkerState.PERSISTING);
        LinkMetadata merged;
        LinkRecord link;
        try {
            Optional<LinkRecord> found = store.findLink(job.getLinkId());
            if (found.isEmpty()) {
                return fail(job, JobOutcome.LINK_NOT_FOUND, null);
            }
            link = found.get();
            merged = merger.merge(link.metadata(), fetched);
            if (!store.updateMetadata(job.getLinkId(), merged, clock.instant())) {
                return fail(job, JobOutcome.LINK_NOT_FOUND, null);
            }
        } catch (RuntimeException e) {
            return fail(job, JobOutcome.PERSIST_FAILED, e);
        }
        log.info("Metadata stored for link {} (post={}, keys={})",
                job.getLinkId(), job.getPostId(), merged.getExternalMetadata().size());

        onStage.accept(WorkerState.NOTIFYING);
        notifySection(job, link, merged);
        return JobOutcome.UPDATED;
    }

    private void notifySection(MetadataJob job, LinkRecord link, LinkMetadata merged) {
        if (link.sectionId() == null) {
            log.warn("Link {} has no section; skipping live update", job.getLinkId());
            return;
        }
        Instant now = clock.instant();
        LinkMetadataEvent event = new LinkMetadataEvent(job.getPostId(), job.getLinkId(), job.getUrl(),
                merged.toFlatMap(), now);
        try {
            publisher.publish(link.sectionId(), event);
        } catch (RuntimeException e) {
            // The row is already updated; viewers pick it up on their next read
            log.warn("Failed to publish metadata update for link {} to section {}: {}",
                    job.getLinkId(), link.sectionId(), e.getMessage());
        }
    }

    private JobOutcome fail(MetadataJob job, JobOutcome outcome, Exception cause) {
        try {
            failedJobPolicy.onFailure(job, outcome, cause);
        } catch (RuntimeException e) {
            log.error("Failed job policy threw for job {} ({})", job.getJobId(), outcome, e);
        }
        return outcome;
    }
}
