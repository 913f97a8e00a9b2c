package org.smileyface.linkmeta.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkmeta.fetch.JsoupMetadataFetcher;
import org.smileyface.linkmeta.fetch.MetadataFetcher;
import org.smileyface.linkmeta.merge.LinkMetadataMerger;
import org.smileyface.linkmeta.notify.LinkEventPublisher;
import org.smileyface.linkmeta.notify.LoggingLinkEventPublisher;
import org.smileyface.linkmeta.notify.RedisLinkEventPublisher;
import org.smileyface.linkmeta.processor.DropFailedJobPolicy;
import org.smileyface.linkmeta.processor.FailedJobPolicy;
import org.smileyface.linkmeta.processor.LinkMetadataJobProcessor;
import org.smileyface.linkmeta.processor.MetadataWorkerPool;
import org.smileyface.linkmeta.queue.InMemoryMetadataJobQueue;
import org.smileyface.linkmeta.queue.MetadataJobQueue;
import org.smileyface.linkmeta.queue.RedisMetadataJobQueue;
import org.smileyface.linkmeta.store.InMemoryLinkMetadataStore;
import org.smileyface.linkmeta.store.JdbcLinkMetadataStore;
import org.smileyface.linkmeta.store.LinkMetadataStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the metadata pipeline. Queue, store and notifier implementations are selected from
 * {@code link-metadata.*.type}:
 * - queue: "redis" (default) or "in-memory"
 * - store: "jdbc" (default) or "in-memory"
 * - notifier: "redis" (default) or "logging"
 *
 * A Redis or JDBC choice falls back to the in-process implementation when the corresponding
 * template bean is not available.
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger();

    @Bean
    public MetadataJobQueue metadataJobQueue(ObjectProvider<StringRedisTemplate> redisProvider,
                                             LinkMetadataProperties properties) {
        String kind = normalize(properties.getQueue().getType());
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                return new RedisMetadataJobQueue(template, properties);
            }
            log.warn("link-metadata.queue.type=redis but no StringRedisTemplate available; using in-memory queue");
        }
        return new InMemoryMetadataJobQueue();
    }

    @Bean
    public LinkMetadataStore linkMetadataStore(ObjectProvider<JdbcTemplate> jdbcProvider,
                                               LinkMetadataProperties properties) {
        String kind = normalize(properties.getStore().getType());
        if ("jdbc".equals(kind)) {
            JdbcTemplate template = jdbcProvider.getIfAvailable();
            if (template != null) {
                return new JdbcLinkMetadataStore(template);
            }
            log.warn("link-metadata.store.type=jdbc but no JdbcTemplate available; using in-memory store");
        }
        return new InMemoryLinkMetadataStore();
    }

    @Bean
    public LinkEventPublisher linkEventPublisher(ObjectProvider<StringRedisTemplate> redisProvider,
                                                 LinkMetadataProperties properties) {
        String kind = normalize(properties.getNotifier().getType());
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                return new RedisLinkEventPublisher(template, properties.getNotifier());
            }
            log.warn("link-metadata.notifier.type=redis but no StringRedisTemplate available; logging events only");
        }
        return new LoggingLinkEventPublisher();
    }

    @Bean
    public MetadataFetcher metadataFetcher(LinkMetadataProperties properties) {
        return new JsoupMetadataFetcher(properties.getFetch());
    }

    @Bean
    public FailedJobPolicy failedJobPolicy() {
        return new DropFailedJobPolicy();
    }

    @Bean
    public LinkMetadataJobProcessor linkMetadataJobProcessor(MetadataFetcher fetcher,
                                                             LinkMetadataStore store,
                                                             LinkEventPublisher publisher,
                                                             FailedJobPolicy failedJobPolicy,
                                                             LinkMetadataProperties properties) {
        return new LinkMetadataJobProcessor(fetcher, store, publisher, new LinkMetadataMerger(),
                failedJobPolicy, properties.getFetch().getTimeout(), Clock.systemUTC());
    }

    @Bean
    public MetadataWorkerPool metadataWorkerPool(MetadataJobQueue queue,
                                                 LinkMetadataJobProcessor processor,
                                                 LinkMetadataProperties properties) {
        LinkMetadataProperties.Worker worker = properties.getWorker();
        return new MetadataWorkerPool(queue, processor, worker.getCount(),
                worker.getDequeueTimeout(), worker.getErrorBackoff());
    }

    @Bean
    public WorkerPoolLifecycle workerPoolLifecycle(MetadataWorkerPool pool, LinkMetadataProperties properties) {
        return new WorkerPoolLifecycle(pool, properties.isEnabled() && properties.getWorker().isAutoStart());
    }

    private static String normalize(String type) {
        return type == null ? "" : type.trim().toLowerCase();
    }
}
