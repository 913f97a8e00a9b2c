package org.smileyface.linkmeta.processor;

import org.smileyface.linkmeta.queue.MetadataJob;

/**
 * Decides what happens to a job that did not end in {@link JobOutcome#UPDATED}. The worker
 * acknowledges the job after the policy returns, so a policy that wants another attempt must
 * enqueue a new job itself.
 */
@FunctionalInterface
public interface FailedJobPolicy {

    /**
     * @param cause the underlying error, or null for outcomes without one (e.g. an empty result)
     */
    void onFailure(MetadataJob job, JobOutcome outcome, Exception cause);
}
