package org.smileyface.linkmeta.model;

import java.util.Objects;
import java.util.UUID;

/**
 * The columns of a link row this pipeline reads: owning post, owning section (through the post)
 * and the current metadata, which is null when nothing has been stored yet.
 */
public record LinkRecord(UUID linkId, UUID postId, UUID sectionId, LinkMetadata metadata) {

    public LinkRecord {
        Objects.requireNonNull(linkId, "linkId");
    }
}
