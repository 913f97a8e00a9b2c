package org.smileyface.linkmeta.store;

import org.smileyface.linkmeta.model.LinkMetadata;
import org.smileyface.linkmeta.model.LinkRecord;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed LinkMetadataStore for tests and local runs without a database.
 * Each link is replaced atomically per update, mirroring a per-row update.
 */
public class InMemoryLinkMetadataStore implements LinkMetadataStore {

    private final Map<UUID, Row> links = new ConcurrentHashMap<>();

    /**
     * Register a link owned by {@code postId} in {@code sectionId} with optional initial metadata.
     */
    public void putLink(UUID linkId, UUID postId, UUID sectionId, LinkMetadata metadata) {
        Objects.requireNonNull(linkId, "linkId");
        links.put(linkId, new Row(postId, sectionId, metadata == null ? null : LinkMetadata.copyOf(metadata), null));
    }

    public void removeLink(UUID linkId) {
        links.remove(linkId);
    }

    /** Last updated timestamp written for the link, or null. */
    public Instant getUpdatedAt(UUID linkId) {
        Row row = links.get(linkId);
        return row == null ? null : row.updatedAt;
    }

    @Override
    public Optional<LinkRecord> findLink(UUID linkId) {
        Row row = links.get(linkId);
        if (row == null) return Optional.empty();
        LinkMetadata metadata = row.metadata == null ? null : LinkMetadata.copyOf(row.metadata);
        return Optional.of(new LinkRecord(linkId, row.postId, row.sectionId, metadata));
    }

    @Override
    public boolean updateMetadata(UUID linkId, LinkMetadata metadata, Instant updatedAt) {
        Row updated = links.computeIfPresent(linkId, (id, row) ->
                new Row(row.postId, row.sectionId, LinkMetadata.copyOf(metadata), updatedAt));
        return updated != null;
    }

    private record Row(UUID postId, UUID sectionId, LinkMetadata metadata, Instant updatedAt) {}
}
