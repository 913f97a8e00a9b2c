package org.smileyface.linkmeta.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkmeta.config.LinkMetadataProperties;
import org.smileyface.linkmeta.fetch.MetadataFetchException.Reason;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Default {@link MetadataFetcher}: downloads the page with Jsoup and reads OpenGraph, Twitter
 * card and standard meta tags. Redirects are followed by hand so every hop passes the
 * {@link UrlGuard}.
 */
public class JsoupMetadataFetcher implements MetadataFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupMetadataFetcher.class);

    static final int MAX_REDIRECTS = 5;
    private static final Set<String> IMAGE_EXTENSIONS =
            Set.of("jpg", "jpeg", "png", "gif", "webp", "bmp", "svg", "avif", "tif", "tiff");

    private final LinkMetadataProperties.Fetch properties;
    private final UrlGuard urlGuard;
    private final List<EmbedExtractor> embedExtractors;

    public JsoupMetadataFetcher(LinkMetadataProperties.Fetch properties) {
        this(properties, new UrlGuard(properties.isAllowPrivateHosts()), List.of(new YouTubeEmbedExtractor()));
    }

    public JsoupMetadataFetcher(LinkMetadataProperties.Fetch properties, UrlGuard urlGuard,
                                List<EmbedExtractor> embedExtractors) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.urlGuard = Objects.requireNonNull(urlGuard, "urlGuard");
        this.embedExtractors = embedExtractors != null ? List.copyOf(embedExtractors) : List.of();
    }

    @Override
    public Map<String, Object> fetch(String url, Duration timeout) throws MetadataFetchException {
        URI uri = urlGuard.validate(url);
        Duration budget = (timeout == null || timeout.isZero() || timeout.isNegative()) ? properties.getTimeout() : timeout;
        long deadline = System.nanoTime() + budget.toNanos();

        Connection.Response res = execute(uri, deadline);
        URI finalUri = uri;
        for (int redirects = 0; isRedirect(res.statusCode()); redirects++) {
            if (redirects >= MAX_REDIRECTS) {
                throw new MetadataFetchException(Reason.REDIRECT, "too many redirects: " + url);
            }
            String location = res.header("Location");
            if (location == null || location.isBlank()) {
                throw new MetadataFetchException(Reason.REDIRECT, "redirect without location: " + finalUri);
            }
            try {
                finalUri = finalUri.resolve(location.trim());
            } catch (IllegalArgumentException e) {
                throw new MetadataFetchException(Reason.REDIRECT, "invalid redirect location: " + location, e);
            }
            urlGuard.validate(finalUri);
            res = execute(finalUri, deadline);
        }

        int status = res.statusCode();
        if (status < 200 || status >= 400) {
            throw new MetadataFetchException(Reason.HTTP_STATUS, "unexpected status: " + status + " for " + url);
        }

        String contentType = res.contentType() == null ? "" : res.contentType().toLowerCase(Locale.ROOT);
        boolean isHtml = contentType.contains("text/html");
        Map<String, Object> metadata = new LinkedHashMap<>();

        // SVGs are treated as images; clients render them through <img>
        if (contentType.startsWith("image/")) {
            metadata.put("image", finalUri.toString());
            metadata.put("type", "image");
        }

        String provider = detectProvider(finalUri.getHost());
        if (isHtml) {
            Document doc;
            try {
                doc = res.parse();
            } catch (IOException e) {
                throw new MetadataFetchException(Reason.FETCH_ERROR, "read response: " + url, e);
            }
            Map<String, String> meta = metaTags(doc);
            String title = firstNonEmpty(meta.get("og:title"), meta.get("twitter:title"), doc.title());
            String description = firstNonEmpty(meta.get("og:description"), meta.get("twitter:description"), meta.get("description"));
            String image = firstNonEmpty(meta.get("og:image:secure_url"), meta.get("og:image"),
                    meta.get("twitter:image"), meta.get("twitter:image:src"));
            String siteName = firstNonEmpty(meta.get("og:site_name"), meta.get("application-name"));
            String author = firstNonEmpty(meta.get("author"), meta.get("twitter:creator"));
            String ogType = meta.get("og:type");

            putIfPresent(metadata, "title", title);
            putIfPresent(metadata, "description", description);
            if (image != null) {
                metadata.put("image", resolve(finalUri, image));
            }
            putIfPresent(metadata, "site_name", siteName);
            putIfPresent(metadata, "author", author);
            putIfPresent(metadata, "type", ogType);
            if (provider == null) {
                provider = siteName;
            }
        }

        // Embeds are keyed off the URL the user posted, not the redirect target
        extractEmbed(uri).ifPresent(embed -> metadata.put("embed", embed.toMap()));

        if (!metadata.containsKey("image") && !isHtml && looksLikeImageUrl(finalUri)) {
            metadata.put("image", finalUri.toString());
            metadata.put("type", "image");
        }

        if (provider == null) {
            provider = finalUri.getHost();
        }
        putIfPresent(metadata, "provider", provider);

        log.debug("Fetched {} metadata keys for {} (status={}, contentType={})", metadata.size(), url, status, contentType);
        return metadata;
    }

    private Connection.Response execute(URI uri, long deadline) throws MetadataFetchException {
        long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
        if (remainingMs <= 0) {
            throw new MetadataFetchException(Reason.TIMEOUT, "fetch deadline exceeded: " + uri);
        }
        try {
            return Jsoup.connect(uri.toString())
                    .userAgent(properties.getUserAgent())
                    .timeout((int) Math.min(Integer.MAX_VALUE, remainingMs))
                    .maxBodySize(properties.getMaxBodyBytes())
                    .followRedirects(false)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .execute();
        } catch (SocketTimeoutException e) {
            throw new MetadataFetchException(Reason.TIMEOUT, "fetch timed out: " + uri, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new MetadataFetchException(Reason.FETCH_ERROR, "fetch url: " + uri + " - " + e.getMessage(), e);
        }
    }

    private Optional<EmbedData> extractEmbed(URI uri) {
        for (EmbedExtractor extractor : embedExtractors) {
            if (extractor.canExtract(uri)) {
                Optional<EmbedData> embed = extractor.extract(uri);
                if (embed.isPresent()) return embed;
            }
        }
        return Optional.empty();
    }

    private static Map<String, String> metaTags(Document doc) {
        Map<String, String> tags = new HashMap<>();
        for (Element meta : doc.select("meta[content]")) {
            String key = meta.hasAttr("property") ? meta.attr("property") : meta.attr("name");
            String content = meta.attr("content").trim();
            if (key.isBlank() || content.isEmpty()) continue;
            tags.putIfAbsent(key.trim().toLowerCase(Locale.ROOT), content);
        }
        return tags;
    }

    static String detectProvider(String host) {
        if (host == null) return null;
        String h = host.toLowerCase(Locale.ROOT);
        if (h.contains("spotify.com")) return "spotify";
        if (h.contains("youtube.com") || h.contains("youtu.be")) return "youtube";
        if (h.contains("imdb.com")) return "imdb";
        if (h.contains("soundcloud.com")) return "soundcloud";
        if (h.contains("bandcamp.com")) return "bandcamp";
        if (h.contains("vimeo.com")) return "vimeo";
        return null;
    }

    static boolean looksLikeImageUrl(URI uri) {
        if (uri == null) return false;
        if (hasImageExtension(uri.getPath())) return true;
        String query = uri.getQuery();
        if (query == null || query.isBlank()) return false;
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq > 0 ? pair.substring(0, eq) : pair;
            String value = eq > 0 ? pair.substring(eq + 1).toLowerCase(Locale.ROOT) : "";
            if (Set.of("format", "fm", "ext", "type").contains(key)
                    && (IMAGE_EXTENSIONS.contains(value) || value.equals("image"))) {
                return true;
            }
            if (hasImageExtension(value)) return true;
        }
        return false;
    }

    private static boolean hasImageExtension(String value) {
        if (value == null || value.isEmpty()) return false;
        String lower = value.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(lower.substring(dot + 1));
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static String resolve(URI base, String ref) {
        try {
            return base.resolve(ref.trim()).toString();
        } catch (IllegalArgumentException e) {
            return ref;
        }
    }

    private static String firstNonEmpty(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value);
        }
    }
}
