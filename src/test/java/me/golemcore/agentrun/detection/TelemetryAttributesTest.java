package me.golemcore.agentrun.detection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryAttributesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void shouldPreferTopLevelAttributes() throws Exception {
        JsonNode event = json("{\"attributes\":{\"k\":\"top\"},\"resource\":{\"attributes\":{\"k\":\"res\"}}}");

        assertEquals("top", TelemetryAttributes.extractAttributes(event).get("k").asText());
    }

    @Test
    void shouldFallBackToResourceThenBodyAttributes() throws Exception {
        JsonNode resource = json("{\"resource\":{\"attributes\":{\"k\":\"res\"}},\"body\":{\"attributes\":{\"k\":\"body\"}}}");
        JsonNode body = json("{\"body\":{\"attributes\":{\"k\":\"body\"}}}");

        assertEquals("res", TelemetryAttributes.extractAttributes(resource).get("k").asText());
        assertEquals("body", TelemetryAttributes.extractAttributes(body).get("k").asText());
    }

    @Test
    void shouldSkipNonObjectAttributes() throws Exception {
        JsonNode event = json("{\"attributes\":\"flat\",\"body\":{\"attributes\":{\"k\":\"body\"}}}");

        assertEquals("body", TelemetryAttributes.extractAttributes(event).get("k").asText());
    }

    @Test
    void shouldReturnNullWhenNoAttributesPresent() throws Exception {
        assertNull(TelemetryAttributes.extractAttributes(json("{\"name\":\"x\"}")));
        assertNull(TelemetryAttributes.extractAttributes(json("[1,2]")));
        assertNull(TelemetryAttributes.extractAttributes(null));
    }

    @Test
    void shouldChooseFirstTextualCandidate() throws Exception {
        JsonNode attrs = json("{\"event.name\":7,\"event_name\":\"qwen.next_speaker_check\"}");

        assertEquals("qwen.next_speaker_check", TelemetryAttributes.chooseAttr(attrs, "event.name", "event_name"));
        assertNull(TelemetryAttributes.chooseAttr(attrs, "missing"));
        assertNull(TelemetryAttributes.chooseAttr(null, "event.name"));
    }
}
