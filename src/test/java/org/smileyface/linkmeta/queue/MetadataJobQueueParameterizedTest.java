package org.smileyface.linkmeta.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.smileyface.linkmeta.config.LinkMetadataProperties;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Contract tests for MetadataJobQueue implementations using JUnit 5 parameterized tests.
 * The Redis-backed implementation is included only when a Docker daemon is reachable.
 */
class MetadataJobQueueParameterizedTest {

    private static final Logger logger = LogManager.getLogger(MetadataJobQueueParameterizedTest.class);
    private static final Duration SHORT = Duration.ofMillis(100);

    private static GenericContainer<?> redisContainer; // lazily started
    private static List<Arguments> IMPLEMENTATIONS; // cached implementations list

    static Stream<Arguments> queueImplementations() {
        if (IMPLEMENTATIONS == null) {
            synchronized (MetadataJobQueueParameterizedTest.class) {
                if (IMPLEMENTATIONS == null) {
                    IMPLEMENTATIONS = new ArrayList<>();
                    IMPLEMENTATIONS.add(Arguments.of(
                            "InMemoryMetadataJobQueue",
                            (Supplier<MetadataJobQueue>) InMemoryMetadataJobQueue::new
                    ));

                    try {
                        redisContainer = new GenericContainer<>("redis:7.2.4").withExposedPorts(6379);
                        redisContainer.start();

                        Supplier<MetadataJobQueue> redisSupplier = () -> {
                            LettuceConnectionFactory cf = new LettuceConnectionFactory(
                                    redisContainer.getHost(), redisContainer.getMappedPort(6379));
                            cf.afterPropertiesSet();
                            StringRedisTemplate template = new StringRedisTemplate(cf);
                            LinkMetadataProperties props = new LinkMetadataProperties();
                            props.getQueue().setNamespace("test:" + UUID.randomUUID());
                            return new RedisMetadataJobQueue(template, props);
                        };

                        IMPLEMENTATIONS.add(Arguments.of("RedisMetadataJobQueue", redisSupplier));
                    } catch (Throwable t) {
                        // Docker not available; run the in-memory implementation only
                        logger.warn("Failed to start Redis Testcontainer: {}", t.getMessage());
                    }
                }
            }
        }
        return IMPLEMENTATIONS.stream();
    }

    @AfterAll
    static void tearDown() {
        if (redisContainer != null) {
            try {
                redisContainer.stop();
            } finally {
                redisContainer = null;
            }
        }
    }

    private static MetadataJob job(String url) {
        return MetadataJob.create(UUID.randomUUID(), UUID.randomUUID(), url);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("dequeueOnEmptyQueueTimesOutWithNull")
    void dequeueOnEmptyQueueTimesOutWithNull(String implName, Supplier<MetadataJobQueue> supplier) {
        MetadataJobQueue q = supplier.get();
        assertThat(q.dequeue(SHORT)).isNull();
        assertThat(q.pendingLength()).isZero();
        assertThat(q.processingLength()).isZero();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("dequeueMovesJobFromPendingToProcessing")
    void dequeueMovesJobFromPendingToProcessing(String implName, Supplier<MetadataJobQueue> supplier) {
        MetadataJobQueue q = supplier.get();
        MetadataJob original = job("https://example.com/a");
        q.enqueue(original);
        assertThat(q.pendingLength()).isEqualTo(1);

        MetadataJob taken = q.dequeue(SHORT);

        assertThat(taken).isEqualTo(original);
        assertThat(q.pendingLength()).isZero();
        assertThat(q.processingLength()).isEqualTo(1);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("ackRemovesJobFromProcessingAndIsIdempotent")
    void ackRemovesJobFromProcessingAndIsIdempotent(String implName, Supplier<MetadataJobQueue> supplier) {
        MetadataJobQueue q = supplier.get();
        q.enqueue(job("https://example.com/a"));
        MetadataJob taken = q.dequeue(SHORT);

        q.ack(taken);
        assertThat(q.processingLength()).isZero();

        assertThatCode(() -> q.ack(taken)).doesNotThrowAnyException();
        assertThat(q.processingLength()).isZero();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("jobsAreDeliveredInEnqueueOrder")
    void jobsAreDeliveredInEnqueueOrder(String implName, Supplier<MetadataJobQueue> supplier) {
        MetadataJobQueue q = supplier.get();
        MetadataJob a = job("https://a.example/");
        MetadataJob b = job("https://b.example/");
        MetadataJob c = job("https://c.example/");
        q.enqueue(a);
        q.enqueue(b);
        q.enqueue(c);

        assertThat(q.dequeue(SHORT)).isEqualTo(a);
        assertThat(q.dequeue(SHORT)).isEqualTo(b);
        assertThat(q.dequeue(SHORT)).isEqualTo(c);
        assertThat(q.dequeue(SHORT)).isNull();
        assertThat(q.processingLength()).isEqualTo(3);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("ackOfOneJobLeavesTwinForSameLinkInProcessing")
    void ackOfOneJobLeavesTwinForSameLinkInProcessing(String implName, Supplier<MetadataJobQueue> supplier) {
        MetadataJobQueue q = supplier.get();
        UUID postId = UUID.randomUUID();
        UUID linkId = UUID.randomUUID();
        MetadataJob first = MetadataJob.create(postId, linkId, "https://example.com/same");
        MetadataJob second = MetadataJob.create(postId, linkId, "https://example.com/same");
        q.enqueue(first);
        q.enqueue(second);
        MetadataJob takenFirst = q.dequeue(SHORT);
        q.dequeue(SHORT);

        q.ack(takenFirst);

        assertThat(q.processingLength()).isEqualTo(1);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("nullJobIsRejected")
    void nullJobIsRejected(String implName, Supplier<MetadataJobQueue> supplier) {
        MetadataJobQueue q = supplier.get();
        assertThatThrownBy(() -> q.enqueue(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(q.pendingLength()).isZero();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("init_clearsPendingAndProcessing")
    void init_clearsPendingAndProcessing(String implName, Supplier<MetadataJobQueue> supplier) {
        MetadataJobQueue q = supplier.get();
        q.enqueue(job("https://a.example/"));
        q.enqueue(job("https://b.example/"));
        q.dequeue(SHORT);

        q.init();

        assertThat(q.pendingLength()).isZero();
        assertThat(q.processingLength()).isZero();
        assertThat(q.dequeue(SHORT)).isNull();
    }
}
