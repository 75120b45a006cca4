package com.clapgrow.push.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PushMessageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testOf_KeepsRecipientOrderAndPayload() {
        PushMessage message = PushMessage.of(Map.of("key", "value"), "C", "A", "B");

        assertEquals(List.of("C", "A", "B"), message.getRegistrationIds());
        assertEquals("value", message.getData().get("key"));
        assertNull(message.getTimeToLive());
    }

    @Test
    void testOf_CopiesPayloadMap() {
        Map<String, String> data = new java.util.HashMap<>();
        data.put("key", "value");

        PushMessage message = PushMessage.of(data, "A");
        data.put("other", "x");

        assertFalse(message.getData().containsKey("other"));
    }

    @Test
    void testJson_UsesBackendPropertyNamesAndSkipsNulls() throws Exception {
        PushMessage message = PushMessage.of(Map.of("score", "5x1"), "A", "B");
        message.setCollapseKey("score_update");
        message.setTimeToLive(108);
        message.setDryRun(true);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(message));

        assertEquals("A", json.get("registration_ids").get(0).asText());
        assertEquals("score_update", json.get("collapse_key").asText());
        assertEquals(108, json.get("time_to_live").asInt());
        assertTrue(json.get("dry_run").asBoolean());
        assertEquals("5x1", json.get("data").get("score").asText());
        assertFalse(json.has("restricted_package_name"));
        assertFalse(json.has("delay_while_idle"));
    }

    @Test
    void testJson_ReadsKafkaPayload() throws Exception {
        String json = """
            {"registration_ids":["t1","t2"],"data":{"k":"v"},"time_to_live":60,"ignored":"x"}
            """;

        PushMessage message = objectMapper.readValue(json, PushMessage.class);

        assertEquals(List.of("t1", "t2"), message.getRegistrationIds());
        assertEquals(60, message.getTimeToLive());
        assertEquals("v", message.getData().get("k"));
    }
}
