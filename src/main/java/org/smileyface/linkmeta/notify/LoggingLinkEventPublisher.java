package org.smileyface.linkmeta.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Publisher for deployments without a live-update channel: events are only logged.
 */
public class LoggingLinkEventPublisher implements LinkEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingLinkEventPublisher.class);

    @Override
    public void publish(UUID sectionId, LinkMetadataEvent event) {
        log.info("Event {} for link {} on {} (no live-update channel configured)",
                event.getType(), event.getData().linkId(), SectionTopics.forSection(sectionId));
    }
}
