package org.smileyface.linkmeta.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A user-authored annotation on a link: a position (seconds into the media) and a short label.
 */
public final class Highlight {

    private final int timestamp;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final String label;

    @JsonCreator
    public Highlight(@JsonProperty("timestamp") int timestamp,
                     @JsonProperty("label") String label) {
        this.timestamp = timestamp;
        this.label = label;
    }

    public int getTimestamp() { return timestamp; }
    public String getLabel() { return label; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Highlight that = (Highlight) o;
        return timestamp == that.timestamp && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, label);
    }

    @Override
    public String toString() {
        return "Highlight{" +
                "timestamp=" + timestamp +
                ", label='" + label + '\'' +
                '}';
    }
}
