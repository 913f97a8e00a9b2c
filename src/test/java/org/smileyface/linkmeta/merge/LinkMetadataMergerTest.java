package org.smileyface.linkmeta.merge;

import org.junit.jupiter.api.Test;
import org.smileyface.linkmeta.model.Highlight;
import org.smileyface.linkmeta.model.LinkMetadata;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LinkMetadataMergerTest {

    private final LinkMetadataMerger merger = new LinkMetadataMerger();

    @Test
    void fetchedKeysOverwriteAndExtendExisting() {
        LinkMetadata existing = new LinkMetadata(null, Map.of("title", "Old", "author", "Someone"));

        LinkMetadata merged = merger.merge(existing, Map.of("title", "New", "description", "D"));

        assertThat(merged.getExternalMetadata())
                .containsEntry("title", "New")
                .containsEntry("description", "D")
                .containsEntry("author", "Someone");
    }

    @Test
    void existingHighlightsSurviveAndFetchedHighlightsAreDropped() {
        List<Highlight> highlights = List.of(new Highlight(12, "Intro"), new Highlight(42, "Drop"));
        LinkMetadata existing = new LinkMetadata(highlights, Map.of("title", "Old"));
        Map<String, Object> fetched = new HashMap<>();
        fetched.put("title", "New");
        fetched.put("highlights", List.of(Map.of("timestamp", 1, "label", "Injected")));

        LinkMetadata merged = merger.merge(existing, fetched);

        assertThat(merged.getHighlights()).containsExactlyElementsOf(highlights);
        assertThat(merged.getExternalMetadata()).doesNotContainKey("highlights");
        assertThat(merged.getExternal("title")).isEqualTo("New");
    }

    @Test
    void fetchedHighlightsAreDroppedWhenNothingIsStored() {
        LinkMetadata merged = merger.merge(null, Map.of("highlights", "x", "title", "T"));

        assertThat(merged.getHighlights()).isEmpty();
        assertThat(merged.getExternalMetadata()).containsOnlyKeys("title");
    }

    @Test
    void inputsAreNotModified() {
        LinkMetadata existing = new LinkMetadata(List.of(new Highlight(3, "x")), Map.of("title", "Old"));
        LinkMetadata snapshot = LinkMetadata.copyOf(existing);

        merger.merge(existing, Map.of("title", "New"));

        assertThat(existing).isEqualTo(snapshot);
    }

    @Test
    void nullFetchLeavesExistingUnchanged() {
        LinkMetadata existing = new LinkMetadata(List.of(new Highlight(3, "x")), Map.of("title", "Old"));

        assertThat(merger.merge(existing, null)).isEqualTo(existing);
    }
}
