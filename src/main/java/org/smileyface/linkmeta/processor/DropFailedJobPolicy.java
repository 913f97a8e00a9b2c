package org.smileyface.linkmeta.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkmeta.queue.MetadataJob;

/**
 * Logs and drops failed jobs. Nothing is retried: a link whose fetch failed keeps rendering with
 * its raw URL.
 */
public class DropFailedJobPolicy implements FailedJobPolicy {

    private static final Logger log = LoggerFactory.getLogger(DropFailedJobPolicy.class);

    @Override
    public void onFailure(MetadataJob job, JobOutcome outcome, Exception cause) {
        String message = cause != null ? cause.getMessage() : null;
        switch (outcome) {
            case FETCH_FAILED, EMPTY_RESULT -> log.warn("Dropping metadata job {} ({}): link={}, url={}, error={}",
                    job.getJobId(), outcome, job.getLinkId(), job.getUrl(), message);
            case LINK_NOT_FOUND -> log.info("Dropping metadata job {}: link {} no longer exists",
                    job.getJobId(), job.getLinkId());
            default -> log.error("Dropping metadata job {} ({}): link={}, url={}",
                    job.getJobId(), outcome, job.getLinkId(), job.getUrl(), cause);
        }
    }
}
