package org.smileyface.linkmeta.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.smileyface.linkmeta.util.LinkMetaUtils;

import java.util.Objects;

/**
 * JSON encoding of {@link MetadataJob} queue payloads. Encoding uses a fixed property order and
 * ISO-8601 timestamps. Decoding is lenient, so a decoded job keeps its source text for
 * acknowledgment.
 */
public class MetadataJobCodec {

    private final ObjectMapper mapper;

    public MetadataJobCodec() {
        this(LinkMetaUtils.newObjectMapper());
    }

    public MetadataJobCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(MetadataJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job must not be null");
        }
        try {
            return mapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new MetadataQueueException("Failed to serialize metadata job " + job.getJobId(), e);
        }
    }

    /**
     * @throws MalformedJobException when the payload is not a valid job
     */
    public MetadataJob decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedJobException(payload, null);
        }
        try {
            return mapper.readValue(payload, MetadataJob.class).withPayload(payload);
        } catch (Exception e) {
            throw new MalformedJobException(payload, e);
        }
    }
}
