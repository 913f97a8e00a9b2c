package org.smileyface.linkmeta.notify;

import java.util.Objects;
import java.util.UUID;

public final class SectionTopics {

    public static final String SECTION_PREFIX = "section:";

    private SectionTopics() {
        // utility
    }

    /** Topic for live updates of one section, e.g. {@code section:3f0c...}. */
    public static String forSection(UUID sectionId) {
        return SECTION_PREFIX + Objects.requireNonNull(sectionId, "sectionId");
    }
}
