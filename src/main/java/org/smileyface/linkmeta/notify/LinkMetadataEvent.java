package org.smileyface.linkmeta.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Live-update event telling viewers of a section that a link's metadata changed.
 * Built once per successfully processed job and never stored.
 */
@JsonPropertyOrder({"type", "data", "timestamp"})
public final class LinkMetadataEvent {

    public static final String TYPE = "link_metadata_updated";

    private final Data data;
    private final Instant timestamp;

    public LinkMetadataEvent(UUID postId, UUID linkId, String url, Map<String, Object> metadata, Instant timestamp) {
        this.data = new Data(postId, linkId, url, metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)));
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @JsonProperty("data")
    public Data getData() {
        return data;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonPropertyOrder({"post_id", "link_id", "url", "metadata"})
    public record Data(@JsonProperty("post_id") UUID postId,
                       @JsonProperty("link_id") UUID linkId,
                       @JsonProperty("url") String url,
                       @JsonProperty("metadata") Map<String, Object> metadata) {}
}
