package org.smileyface.linkmeta.fetch;

import java.net.URI;
import java.util.Optional;

/**
 * Builds privacy-enhanced YouTube iframe embeds from watch, short-link, embed, shorts and
 * legacy /v/ URLs.
 */
public class YouTubeEmbedExtractor implements EmbedExtractor {

    static final String EMBED_BASE_URL = "https://www.youtube-nocookie.com/embed/";

    @Override
    public boolean canExtract(URI uri) {
        return uri != null && isYouTubeHost(uri.getHost());
    }

    @Override
    public Optional<EmbedData> extract(URI uri) {
        String videoId = parseVideoId(uri);
        if (videoId == null || !videoId.matches("[A-Za-z0-9_-]+")) {
            return Optional.empty();
        }
        return Optional.of(new EmbedData("iframe", "youtube", EMBED_BASE_URL + videoId));
    }

    static String parseVideoId(URI uri) {
        if (uri == null || !isYouTubeHost(uri.getHost())) return null;
        String host = uri.getHost().toLowerCase();
        String path = trimSlashes(uri.getPath());
        if (host.endsWith("youtu.be")) {
            return firstSegment(path);
        }
        if (path.startsWith("watch")) {
            return queryParam(uri.getRawQuery(), "v");
        }
        for (String prefix : new String[]{"embed/", "shorts/", "v/"}) {
            if (path.startsWith(prefix)) {
                return firstSegment(path.substring(prefix.length()));
            }
        }
        return null;
    }

    static boolean isYouTubeHost(String host) {
        if (host == null) return false;
        String h = host.trim().toLowerCase();
        return h.equals("youtube.com") || h.endsWith(".youtube.com")
                || h.equals("youtu.be") || h.endsWith(".youtu.be");
    }

    private static String queryParam(String rawQuery, String name) {
        if (rawQuery == null) return null;
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                String value = pair.substring(eq + 1).trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private static String firstSegment(String value) {
        String v = trimSlashes(value);
        if (v.isEmpty()) return null;
        int slash = v.indexOf('/');
        return slash < 0 ? v : v.substring(0, slash);
    }

    private static String trimSlashes(String value) {
        if (value == null) return "";
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') start++;
        while (end > start && value.charAt(end - 1) == '/') end--;
        return value.substring(start, end);
    }
}
