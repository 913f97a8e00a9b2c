package org.smileyface.linkmeta.fetch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interactive embed details for a link ("iframe", "oembed" or "native").
 */
public record EmbedData(String type, String provider, String embedUrl, Integer width, Integer height) {

    public EmbedData(String type, String provider, String embedUrl) {
        this(type, provider, embedUrl, null, null);
    }

    /**
     * Map form stored under the "embed" metadata key.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("provider", provider);
        map.put("embed_url", embedUrl);
        if (width != null && width > 0) map.put("width", width);
        if (height != null && height > 0) map.put("height", height);
        return map;
    }
}
