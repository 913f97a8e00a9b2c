package org.smileyface.linkmeta.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkmeta.config.LinkMetadataProperties;
import org.smileyface.linkmeta.queue.MetadataJob;
import org.smileyface.linkmeta.queue.MetadataJobQueue;
import org.smileyface.linkmeta.queue.MetadataQueueException;
import org.smileyface.linkmeta.util.LinkMetaUtils;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Producer side of the pipeline. Called when a link is created or its URL edited; puts a fetch
 * job on the {@link MetadataJobQueue} and returns without waiting for the fetch.
 */
@Service
public class LinkMetadataService {

    private static final Logger log = LoggerFactory.getLogger(LinkMetadataService.class);

    private final MetadataJobQueue queue;
    private final LinkMetadataProperties properties;

    public LinkMetadataService(MetadataJobQueue queue, LinkMetadataProperties properties) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Enqueue a metadata fetch for a link.
     *
     * @return the enqueued job, or empty when the feature is disabled or the URL is not fetchable
     * @throws MetadataQueueException when the queue rejects the job
     */
    public Optional<MetadataJob> enqueueLinkMetadata(UUID postId, UUID linkId, String url) {
        Objects.requireNonNull(postId, "postId");
        Objects.requireNonNull(linkId, "linkId");
        if (!properties.isEnabled()) {
            log.debug("Link metadata disabled; not enqueuing link {}", linkId);
            return Optional.empty();
        }
        if (url == null || url.isBlank() || LinkMetaUtils.isInternalUploadUrl(url.trim())) {
            log.debug("Skipping metadata fetch for link {} (url={})", linkId, url);
            return Optional.empty();
        }
        String normalized = normalizeUrl(url);
        if (normalized == null) {
            log.debug("Skipping metadata fetch for link {}: unsupported url {}", linkId, url);
            return Optional.empty();
        }

        MetadataJob job = MetadataJob.create(postId, linkId, normalized);
        try {
            queue.enqueue(job);
        } catch (MetadataQueueException e) {
            log.error("Failed to enqueue metadata job for link {} (url={})", linkId, normalized, e);
            throw e;
        }
        log.debug("Enqueued metadata job {} for link {} (url={})", job.getJobId(), linkId, normalized);
        return Optional.of(job);
    }

    /**
     * Lower-case scheme and host, drop the default port and the fragment, and resolve an empty
     * path to "/". Returns null for anything that is not an absolute http(s) URL.
     */
    static String normalizeUrl(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (scheme == null) return null;
            String lowerScheme = scheme.toLowerCase();
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null;
            }
            String host = uri.getHost();
            if (host == null) return null;
            String path = uri.getRawPath();
            if (path == null || path.isBlank()) path = "/";
            String query = uri.getRawQuery();

            StringBuilder sb = new StringBuilder();
            sb.append(lowerScheme).append("://").append(host.toLowerCase());
            if (uri.getPort() != -1 && uri.getPort() != defaultPort(lowerScheme)) {
                sb.append(':').append(uri.getPort());
            }
            sb.append(path);
            if (query != null && !query.isBlank()) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
