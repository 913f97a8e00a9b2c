package org.smileyface.linkmeta.notify;

import java.util.UUID;

/**
 * Best-effort publisher of live-update events. No acknowledgment and no persistence; subscribers
 * that miss an event catch up through the ordinary read path.
 */
public interface LinkEventPublisher {

    /**
     * Publish the event on the topic of the given section.
     *
     * @throws EventPublishException when the event could not be handed to the transport
     */
    void publish(UUID sectionId, LinkMetadataEvent event);
}
