package org.smileyface.linkmeta.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.linkmeta.queue.MetadataJob;
import org.smileyface.linkmeta.queue.MetadataJobQueue;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class QueueStatsControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private MetadataJobQueue queue;

    @BeforeEach
    void resetQueue() {
        queue.init();
    }

    @Test
    void reportsQueueLengthsAndIdlePool() throws Exception {
        queue.enqueue(MetadataJob.create(UUID.randomUUID(), UUID.randomUUID(), "https://example.com/a"));
        queue.enqueue(MetadataJob.create(UUID.randomUUID(), UUID.randomUUID(), "https://example.com/b"));
        queue.dequeue(Duration.ofMillis(10));

        mvc.perform(get("/api/v1/link-metadata/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(1))
                .andExpect(jsonPath("$.processing").value(1))
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.workers").isArray());
    }
}
