package org.smileyface.linkmeta.fetch;

import java.net.URI;
import java.util.Optional;

/**
 * Provider-specific embed detection.
 */
public interface EmbedExtractor {

    boolean canExtract(URI uri);

    Optional<EmbedData> extract(URI uri);
}
