package org.smileyface.linkmeta.store;

import org.smileyface.linkmeta.model.LinkMetadata;
import org.smileyface.linkmeta.model.LinkRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * The slice of the relational store the pipeline needs: read a link's metadata and section,
 * and write merged metadata back.
 */
public interface LinkMetadataStore {

    /**
     * @return the link with its owning post, the post's section and current metadata (null when
     * nothing is stored), or empty when the link does not exist
     */
    Optional<LinkRecord> findLink(UUID linkId);

    /**
     * Replace the link's metadata and set its updated timestamp.
     *
     * @return false when the link no longer exists
     */
    boolean updateMetadata(UUID linkId, LinkMetadata metadata, Instant updatedAt);
}
