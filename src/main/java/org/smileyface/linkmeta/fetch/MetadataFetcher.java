package org.smileyface.linkmeta.fetch;

import java.time.Duration;
import java.util.Map;

/**
 * Resolves a URL to a flat key/value metadata map (title, description, image, embed, ...).
 * Values are opaque to the pipeline; nested structures such as an embed descriptor are allowed.
 */
@FunctionalInterface
public interface MetadataFetcher {

    /**
     * @param url     absolute http(s) URL
     * @param timeout upper bound for the whole fetch
     * @return metadata, possibly empty; never null
     * @throws MetadataFetchException when the URL is rejected or cannot be fetched
     */
    Map<String, Object> fetch(String url, Duration timeout) throws MetadataFetchException;
}
