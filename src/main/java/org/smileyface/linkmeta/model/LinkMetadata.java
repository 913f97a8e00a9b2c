package org.smileyface.linkmeta.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata stored against a link record.
 *
 * <p>User-curated {@link Highlight}s and externally fetched key/value metadata live in separate
 * fields. On the wire and in the database the two are flattened into one JSON object:
 * fetched keys sit at the top level and the highlights sit under {@value #HIGHLIGHTS_KEY}.
 * The fetched map can never hold a {@value #HIGHLIGHTS_KEY} entry.</p>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class LinkMetadata {

    public static final String HIGHLIGHTS_KEY = "highlights";

    private List<Highlight> highlights = new ArrayList<>();
    private final Map<String, Object> externalMetadata = new LinkedHashMap<>();

    public LinkMetadata() {
        // for JSON mapping
    }

    public LinkMetadata(List<Highlight> highlights, Map<String, Object> externalMetadata) {
        setHighlights(highlights);
        if (externalMetadata != null) {
            externalMetadata.forEach(this::putExternal);
        }
    }

    /**
     * Copy of the given metadata, or an empty instance when {@code source} is null.
     */
    public static LinkMetadata copyOf(LinkMetadata source) {
        if (source == null) return new LinkMetadata();
        return new LinkMetadata(source.highlights, source.externalMetadata);
    }

    @JsonProperty(HIGHLIGHTS_KEY)
    public List<Highlight> getHighlights() {
        return Collections.unmodifiableList(highlights);
    }

    @JsonProperty(HIGHLIGHTS_KEY)
    public void setHighlights(List<Highlight> highlights) {
        this.highlights = highlights != null ? new ArrayList<>(highlights) : new ArrayList<>();
    }

    @JsonAnyGetter
    public Map<String, Object> getExternalMetadata() {
        return Collections.unmodifiableMap(externalMetadata);
    }

    /**
     * Stores a fetched value. Writes to the reserved highlights key are ignored.
     *
     * @return true if the value was stored
     */
    public boolean putExternal(String key, Object value) {
        if (key == null || HIGHLIGHTS_KEY.equals(key)) {
            return false;
        }
        externalMetadata.put(key, value);
        return true;
    }

    @JsonAnySetter
    void readExternal(String key, Object value) {
        putExternal(key, value);
    }

    public Object getExternal(String key) {
        return externalMetadata.get(key);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return highlights.isEmpty() && externalMetadata.isEmpty();
    }

    /**
     * Flat view matching the stored JSON shape: fetched keys plus {@value #HIGHLIGHTS_KEY} when present.
     */
    public Map<String, Object> toFlatMap() {
        Map<String, Object> flat = new LinkedHashMap<>(externalMetadata);
        if (!highlights.isEmpty()) {
            flat.put(HIGHLIGHTS_KEY, List.copyOf(highlights));
        }
        return flat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LinkMetadata that = (LinkMetadata) o;
        return highlights.equals(that.highlights) && externalMetadata.equals(that.externalMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(highlights, externalMetadata);
    }

    @Override
    public String toString() {
        return "LinkMetadata{" +
                "highlights=" + highlights +
                ", externalMetadata=" + externalMetadata +
                '}';
    }
}
