package org.smileyface.linkmeta.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the link metadata pipeline.
 */
@ConfigurationProperties(prefix = "link-metadata")
public class LinkMetadataProperties {

    public static final int DEFAULT_WORKER_COUNT = 3;
    public static final String DEFAULT_QUEUE_NAMESPACE = "clubhouse:metadata_queue";

    /** Master switch; when false no new jobs are enqueued. */
    private boolean enabled = true;

    private Queue queue = new Queue();
    private Store store = new Store();
    private Notifier notifier = new Notifier();
    private Worker worker = new Worker();
    private Fetch fetch = new Fetch();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue != null ? queue : new Queue();
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store != null ? store : new Store();
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public void setNotifier(Notifier notifier) {
        this.notifier = notifier != null ? notifier : new Notifier();
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker != null ? worker : new Worker();
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch != null ? fetch : new Fetch();
    }

    /**
     * Worker count falls back to {@value #DEFAULT_WORKER_COUNT} for any value &lt;= 0.
     */
    public static int effectiveWorkerCount(int requested) {
        return requested <= 0 ? DEFAULT_WORKER_COUNT : requested;
    }

    // --------- Nested groups ---------

    public static class Queue {

        /** "redis" or "in-memory". */
        private String type = "redis";

        /**
         * Key of the pending list in Redis; the processing list is "{namespace}:processing".
         */
        private String namespace = DEFAULT_QUEUE_NAMESPACE;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type == null ? "redis" : type.trim().toLowerCase();
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = (namespace == null || namespace.isBlank()) ? DEFAULT_QUEUE_NAMESPACE : namespace;
        }
    }

    public static class Store {

        /** "jdbc" or "in-memory". */
        private String type = "jdbc";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type == null ? "jdbc" : type.trim().toLowerCase();
        }
    }

    public static class Notifier {

        /** "redis" or "logging". */
        private String type = "redis";

        /** Attempts per publish call before giving up. */
        private int publishAttempts = 3;

        /** Base delay between publish attempts; attempt n waits n * backoff. */
        private Duration publishBackoff = Duration.ofMillis(50);

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type == null ? "redis" : type.trim().toLowerCase();
        }

        public int getPublishAttempts() {
            return publishAttempts;
        }

        public void setPublishAttempts(int publishAttempts) {
            this.publishAttempts = Math.max(1, publishAttempts);
        }

        public Duration getPublishBackoff() {
            return publishBackoff;
        }

        public void setPublishBackoff(Duration publishBackoff) {
            this.publishBackoff = (publishBackoff == null || publishBackoff.isNegative()) ? Duration.ZERO : publishBackoff;
        }
    }

    public static class Worker {

        /** Number of consumer threads; values &lt;= 0 mean {@value LinkMetadataProperties#DEFAULT_WORKER_COUNT}. */
        private int count = DEFAULT_WORKER_COUNT;

        /** How long a single dequeue call blocks waiting for a job. */
        private Duration dequeueTimeout = Duration.ofSeconds(1);

        /** Pause after a dequeue transport error before polling again. */
        private Duration errorBackoff = Duration.ofSeconds(1);

        /** Start the pool together with the application context. */
        private boolean autoStart = true;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = effectiveWorkerCount(count);
        }

        public Duration getDequeueTimeout() {
            return dequeueTimeout;
        }

        public void setDequeueTimeout(Duration dequeueTimeout) {
            this.dequeueTimeout = (dequeueTimeout == null || dequeueTimeout.isNegative() || dequeueTimeout.isZero())
                    ? Duration.ofSeconds(1) : dequeueTimeout;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = (errorBackoff == null || errorBackoff.isNegative()) ? Duration.ZERO : errorBackoff;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class Fetch {

        /** Upper bound for one fetch including redirects. */
        private Duration timeout = Duration.ofSeconds(30);

        /** User agent sent with every metadata request. */
        private String userAgent = "ClubhouseMetadataFetcher/1.0";

        /** Response bodies are truncated to this many bytes. */
        private int maxBodyBytes = 2 * 1024 * 1024;

        /**
         * Allow loopback/private/link-local targets. Off in production; tests serve pages from localhost.
         */
        private boolean allowPrivateHosts = false;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = (timeout == null || timeout.isNegative() || timeout.isZero()) ? Duration.ofSeconds(30) : timeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = (userAgent == null || userAgent.isBlank()) ? "ClubhouseMetadataFetcher/1.0" : userAgent;
        }

        public int getMaxBodyBytes() {
            return maxBodyBytes;
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes > 0 ? maxBodyBytes : 2 * 1024 * 1024;
        }

        public boolean isAllowPrivateHosts() {
            return allowPrivateHosts;
        }

        public void setAllowPrivateHosts(boolean allowPrivateHosts) {
            this.allowPrivateHosts = allowPrivateHosts;
        }
    }
}
