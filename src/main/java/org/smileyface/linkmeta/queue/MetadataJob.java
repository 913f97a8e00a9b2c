package org.smileyface.linkmeta.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One link metadata fetch task. Immutable. A job read back from a queue remembers the exact
 * payload text it was decoded from, which is what acknowledgment removes; that text is not part
 * of equality.
 */
@JsonPropertyOrder({"job_id", "post_id", "link_id", "url", "created_at"})
public final class MetadataJob {

    private final UUID jobId;
    private final UUID postId;
    private final UUID linkId;
    private final String url;
    private final Instant createdAt;
    private final String payload;

    @JsonCreator
    public MetadataJob(@JsonProperty("job_id") UUID jobId,
                       @JsonProperty("post_id") UUID postId,
                       @JsonProperty("link_id") UUID linkId,
                       @JsonProperty("url") String url,
                       @JsonProperty("created_at") Instant createdAt) {
        this(jobId, postId, linkId, url, createdAt, null);
    }

    private MetadataJob(UUID jobId, UUID postId, UUID linkId, String url, Instant createdAt, String payload) {
        this.jobId = jobId;
        this.postId = Objects.requireNonNull(postId, "postId");
        this.linkId = Objects.requireNonNull(linkId, "linkId");
        this.url = Objects.requireNonNull(url, "url");
        this.createdAt = createdAt;
        this.payload = payload;
    }

    /**
     * New job with a fresh job id, created now.
     */
    public static MetadataJob create(UUID postId, UUID linkId, String url) {
        return new MetadataJob(UUID.randomUUID(), postId, linkId, url, Instant.now());
    }

    /**
     * Same job, bound to the raw payload it was read from.
     */
    public MetadataJob withPayload(String payload) {
        return new MetadataJob(jobId, postId, linkId, url, createdAt, payload);
    }

    @JsonProperty("job_id")
    public UUID getJobId() { return jobId; }

    @JsonProperty("post_id")
    public UUID getPostId() { return postId; }

    @JsonProperty("link_id")
    public UUID getLinkId() { return linkId; }

    @JsonProperty("url")
    public String getUrl() { return url; }

    @JsonProperty("created_at")
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Raw queue payload this job was decoded from, or null for a job built in process.
     */
    @JsonIgnore
    public String getPayload() { return payload; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetadataJob that = (MetadataJob) o;
        return Objects.equals(jobId, that.jobId)
                && postId.equals(that.postId)
                && linkId.equals(that.linkId)
                && url.equals(that.url)
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, postId, linkId, url, createdAt);
    }

    @Override
    public String toString() {
        return "MetadataJob{" +
                "jobId=" + jobId +
                ", postId=" + postId +
                ", linkId=" + linkId +
                ", url='" + url + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
