package me.golemcore.calhelper.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.calhelper.domain.model.ConversationThread;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreConfigurationTest {

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = CoreConfiguration.objectMapper();
        ConversationThread thread = ConversationThread.builder()
                .threadId("t")
                .createdAt(Instant.parse("2025-07-10T16:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(thread);

        assertTrue(json.contains("\"createdAt\":\"2025-07-10T16:00:00Z\""));
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        ConversationThread thread = CoreConfiguration.objectMapper()
                .readValue("{\"threadId\":\"t\",\"legacyField\":1}", ConversationThread.class);

        assertEquals("t", thread.getThreadId());
    }
}
