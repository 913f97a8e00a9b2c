package org.smileyface.linkmeta.merge;

import org.smileyface.linkmeta.model.LinkMetadata;

import java.util.Map;

/**
 * Combines freshly fetched metadata with what is currently stored on a link.
 *
 * <p>Fetched keys overwrite or extend the stored external metadata. Highlights always come from
 * the stored value; a fetched "highlights" entry is dropped. Stored keys that the fetch did not
 * return are kept.</p>
 */
public class LinkMetadataMerger {

    /**
     * @param existing currently stored metadata, may be null
     * @param fetched  fetch result, may be null or empty
     * @return a new instance; neither argument is modified
     */
    public LinkMetadata merge(LinkMetadata existing, Map<String, Object> fetched) {
        LinkMetadata merged = LinkMetadata.copyOf(existing);
        if (fetched != null) {
            fetched.forEach(merged::putExternal);
        }
        return merged;
    }
}
