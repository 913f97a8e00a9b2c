package org.smileyface.linkmeta.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkmeta.config.LinkMetadataProperties;
import org.smileyface.linkmeta.util.LinkMetaUtils;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Publishes events through Redis PUBLISH on {@code section:<id>} channels. A failed PUBLISH is
 * retried a few times with a linear back-off before giving up.
 */
public class RedisLinkEventPublisher implements LinkEventPublisher {

    private static final Logger log = LogManager.getLogger();

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final int attempts;
    private final Duration backoff;

    public RedisLinkEventPublisher(StringRedisTemplate redisTemplate, LinkMetadataProperties.Notifier properties) {
        this(redisTemplate, LinkMetaUtils.newObjectMapper(), properties.getPublishAttempts(), properties.getPublishBackoff());
    }

    public RedisLinkEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper mapper, int attempts, Duration backoff) {
        this.redis = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.attempts = Math.max(1, attempts);
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    @Override
    public void publish(UUID sectionId, LinkMetadataEvent event) {
        String channel = SectionTopics.forSection(sectionId);
        String payload;
        try {
            payload = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventPublishException("Failed to serialize event for " + channel, e);
        }

        RuntimeException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                redis.convertAndSend(channel, payload);
                log.debug("Published {} to {} (attempt {})", event.getType(), channel, attempt + 1);
                return;
            } catch (RuntimeException e) {
                last = e;
                log.warn("Publish to {} failed on attempt {}/{}: {}", channel, attempt + 1, attempts, e.getMessage());
                if (attempt + 1 < attempts && !sleep(backoff.multipliedBy(attempt + 1L))) {
                    break;
                }
            }
        }
        throw new EventPublishException("Failed to publish " + event.getType() + " to " + channel, last);
    }

    private static boolean sleep(Duration duration) {
        if (duration.isZero()) return true;
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
