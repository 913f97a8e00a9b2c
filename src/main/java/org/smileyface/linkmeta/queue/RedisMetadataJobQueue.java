package org.smileyface.linkmeta.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkmeta.config.LinkMetadataProperties;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Objects;

/**
 * Redis-backed implementation of MetadataJobQueue.
 *
 * Uses two Redis Lists: pending ("{ns}") and processing ("{ns}:processing"). Producers LPUSH onto
 * pending; consumers BRPOPLPUSH from pending to processing, which gives FIFO order and moves the
 * payload in a single atomic command. Acknowledgment is LREM of one copy of the exact payload
 * that was dequeued.
 */
public class RedisMetadataJobQueue implements MetadataJobQueue {

    private static final Logger log = LogManager.getLogger();
    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

    private final StringRedisTemplate redis;
    private final MetadataJobCodec codec;
    private final String pendingKey;
    private final String processingKey;

    public RedisMetadataJobQueue(StringRedisTemplate redisTemplate, LinkMetadataProperties properties) {
        this(redisTemplate, properties, new MetadataJobCodec());
    }

    public RedisMetadataJobQueue(StringRedisTemplate redisTemplate, LinkMetadataProperties properties,
                                 MetadataJobCodec codec) {
        this.redis = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.codec = Objects.requireNonNull(codec, "codec");
        String ns = properties.getQueue().getNamespace();
        this.pendingKey = ns;
        this.processingKey = ns + ":processing";
    }

    public String getPendingKey() {
        return pendingKey;
    }

    public String getProcessingKey() {
        return processingKey;
    }

    @Override
    public void enqueue(MetadataJob job) {
        String payload = codec.encode(job);
        try {
            redis.opsForList().leftPush(pendingKey, payload);
        } catch (RuntimeException e) {
            throw new MetadataQueueException("Failed to enqueue metadata job " + job.getJobId(), e);
        }
    }

    @Override
    public MetadataJob dequeue(Duration timeout) {
        // A zero timeout means "block forever" to Redis
        Duration wait = (timeout == null || timeout.compareTo(MIN_TIMEOUT) < 0) ? MIN_TIMEOUT : timeout;
        String payload;
        try {
            payload = redis.opsForList().rightPopAndLeftPush(pendingKey, processingKey, wait);
        } catch (RuntimeException e) {
            throw new MetadataQueueException("Failed to dequeue metadata job from " + pendingKey, e);
        }
        if (payload == null) {
            return null;
        }
        try {
            return codec.decode(payload);
        } catch (MalformedJobException e) {
            try {
                removeFromProcessing(payload);
            } catch (MetadataQueueException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    @Override
    public void ack(MetadataJob job) {
        String payload = job.getPayload() != null ? job.getPayload() : codec.encode(job);
        Long removed = removeFromProcessing(payload);
        if (removed == null || removed == 0) {
            log.debug("Ack for job {} found nothing in {}", job.getJobId(), processingKey);
        }
    }

    @Override
    public long pendingLength() {
        return sizeOf(pendingKey);
    }

    @Override
    public long processingLength() {
        return sizeOf(processingKey);
    }

    @Override
    public void init() {
        try {
            redis.delete(pendingKey);
            redis.delete(processingKey);
        } catch (RuntimeException e) {
            throw new MetadataQueueException("Failed to reset metadata queue " + pendingKey, e);
        }
    }

    private Long removeFromProcessing(String payload) {
        try {
            return redis.opsForList().remove(processingKey, 1, payload);
        } catch (RuntimeException e) {
            throw new MetadataQueueException("Failed to remove payload from " + processingKey, e);
        }
    }

    private long sizeOf(String key) {
        try {
            Long size = redis.opsForList().size(key);
            return size != null ? size : 0L;
        } catch (RuntimeException e) {
            throw new MetadataQueueException("Failed to read length of " + key, e);
        }
    }
}
