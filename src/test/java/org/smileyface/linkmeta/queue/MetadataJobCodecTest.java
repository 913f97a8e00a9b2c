package org.smileyface.linkmeta.queue;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class MetadataJobCodecTest {

    private final MetadataJobCodec codec = new MetadataJobCodec();

    @Test
    void encodesSnakeCaseFieldsInFixedOrder() {
        UUID jobId = UUID.fromString("00000000-0000-0000-0000-000000000001");
        UUID postId = UUID.fromString("00000000-0000-0000-0000-000000000002");
        UUID linkId = UUID.fromString("00000000-0000-0000-0000-000000000003");
        MetadataJob job = new MetadataJob(jobId, postId, linkId, "https://example.com/",
                Instant.parse("2024-05-01T10:15:30Z"));

        assertThat(codec.encode(job)).isEqualTo(
                "{\"job_id\":\"00000000-0000-0000-0000-000000000001\","
                        + "\"post_id\":\"00000000-0000-0000-0000-000000000002\","
                        + "\"link_id\":\"00000000-0000-0000-0000-000000000003\","
                        + "\"url\":\"https://example.com/\","
                        + "\"created_at\":\"2024-05-01T10:15:30Z\"}");
    }

    @Test
    void decodeIgnoresUnknownProperties() {
        String payload = "{\"post_id\":\"00000000-0000-0000-0000-000000000002\","
                + "\"link_id\":\"00000000-0000-0000-0000-000000000003\","
                + "\"url\":\"https://example.com/x\",\"attempt\":2}";

        MetadataJob job = codec.decode(payload);

        assertThat(job.getUrl()).isEqualTo("https://example.com/x");
        assertThat(job.getJobId()).isNull();
        assertThat(job.getCreatedAt()).isNull();
    }

    @Test
    void encodingIsStableForTheSameJob() {
        MetadataJob job = MetadataJob.create(UUID.randomUUID(), UUID.randomUUID(), "https://example.com/");
        assertThat(codec.encode(codec.decode(codec.encode(job)))).isEqualTo(codec.encode(job));
    }

    @Test
    void malformedPayloadsAreRejected() {
        assertThatThrownBy(() -> codec.decode("not json")).isInstanceOf(MalformedJobException.class);
        assertThatThrownBy(() -> codec.decode("   ")).isInstanceOf(MalformedJobException.class);
        assertThatThrownBy(() -> codec.decode("{\"post_id\":\"00000000-0000-0000-0000-000000000002\"}"))
                .isInstanceOf(MalformedJobException.class);
    }

    @Test
    void nullJobCannotBeEncoded() {
        assertThatThrownBy(() -> codec.encode(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
