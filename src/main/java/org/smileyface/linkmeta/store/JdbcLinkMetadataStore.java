package org.smileyface.linkmeta.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkmeta.model.LinkMetadata;
import org.smileyface.linkmeta.model.LinkRecord;
import org.smileyface.linkmeta.util.LinkMetaUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed LinkMetadataStore. Metadata lives in the {@code links.metadata} jsonb column;
 * the section is resolved through the owning post.
 */
public class JdbcLinkMetadataStore implements LinkMetadataStore {

    private static final Logger log = LogManager.getLogger();

    static final String SELECT_LINK_SQL = """
            SELECT l.post_id, p.section_id, l.metadata::text AS metadata
            FROM links l
            JOIN posts p ON p.id = l.post_id
            WHERE l.id = ?
            """;

    static final String UPDATE_METADATA_SQL =
            "UPDATE links SET metadata = CAST(? AS jsonb), updated_at = ? WHERE id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper mapper;

    public JdbcLinkMetadataStore(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, LinkMetaUtils.newObjectMapper());
    }

    public JdbcLinkMetadataStore(JdbcTemplate jdbcTemplate, ObjectMapper mapper) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Optional<LinkRecord> findLink(UUID linkId) {
        try {
            List<LinkRecord> rows = jdbcTemplate.query(SELECT_LINK_SQL, (rs, i) -> mapRow(linkId, rs), linkId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new LinkStoreException("Failed to load link " + linkId, e);
        }
    }

    @Override
    public boolean updateMetadata(UUID linkId, LinkMetadata metadata, Instant updatedAt) {
        String json;
        try {
            json = mapper.writeValueAsString(metadata == null ? new LinkMetadata() : metadata);
        } catch (JsonProcessingException e) {
            throw new LinkStoreException("Failed to serialize metadata for link " + linkId, e);
        }
        try {
            int rows = jdbcTemplate.update(UPDATE_METADATA_SQL, json, Timestamp.from(updatedAt), linkId);
            return rows > 0;
        } catch (DataAccessException e) {
            throw new LinkStoreException("Failed to update metadata for link " + linkId, e);
        }
    }

    private LinkRecord mapRow(UUID linkId, ResultSet rs) throws SQLException {
        UUID postId = rs.getObject("post_id", UUID.class);
        UUID sectionId = rs.getObject("section_id", UUID.class);
        String json = rs.getString("metadata");
        return new LinkRecord(linkId, postId, sectionId, parseMetadata(linkId, json));
    }

    private LinkMetadata parseMetadata(UUID linkId, String json) {
        if (json == null || json.isBlank() || json.equals("null")) {
            return null;
        }
        try {
            return mapper.readValue(json, LinkMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata stored on link {}: {}", linkId, e.getOriginalMessage());
            throw new LinkStoreException("Unreadable metadata on link " + linkId, e);
        }
    }
}
