package me.golemcore.agentrun.detection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonObjectStreamParserTest {

    private static final String STREAM = "{\"a\":1}{\"b\":{\"c\":\"}{\"}}\n  {\"d\":\"x\\\"}y\"}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private List<JsonNode> received;
    private JsonObjectStreamParser parser;

    @BeforeEach
    void setUp() {
        received = new ArrayList<>();
        parser = new JsonObjectStreamParser(objectMapper, 1024, received::add);
    }

    // ===== Chunking =====

    @Test
    void shouldEmitSameObjectsForEverySplitPoint() {
        for (int split = 0; split <= STREAM.length(); split++) {
            List<JsonNode> objects = new ArrayList<>();
            JsonObjectStreamParser splitParser = new JsonObjectStreamParser(objectMapper, 1024, objects::add);

            splitParser.feed(STREAM.substring(0, split));
            splitParser.feed(STREAM.substring(split));

            assertEquals(3, objects.size(), "split at " + split);
            assertEquals(1, objects.get(0).get("a").asInt());
            assertEquals("}{", objects.get(1).path("b").path("c").asText());
            assertEquals("x\"}y", objects.get(2).get("d").asText());
        }
    }

    @Test
    void shouldEmitObjectsWhenFedOneCharacterAtATime() {
        for (char ch : STREAM.toCharArray()) {
            parser.feed(String.valueOf(ch));
        }

        assertEquals(3, received.size());
        assertEquals(0, parser.bufferedChars());
    }

    @Test
    void shouldHoldIncompleteObjectUntilClosed() {
        parser.feed("{\"event\":{\"name\":");

        assertTrue(received.isEmpty());
        assertTrue(parser.bufferedChars() > 0);

        parser.feed("\"done\"}}");

        assertEquals(1, received.size());
        assertEquals("done", received.get(0).path("event").path("name").asText());
    }

    // ===== Recovery =====

    @Test
    void shouldDropMalformedObjectAndContinue() {
        parser.feed("{\"broken\":}{\"ok\":true}");

        assertEquals(1, received.size());
        assertTrue(received.get(0).get("ok").asBoolean());
    }

    @Test
    void shouldIgnoreTextBetweenObjects() {
        parser.feed("log line } ] garbage {\"ok\":1} trailing text\n");

        assertEquals(1, received.size());
        assertEquals(0, parser.bufferedChars());
    }

    @Test
    void shouldDropOversizedObjectAndResyncOnNextObject() {
        JsonObjectStreamParser small = new JsonObjectStreamParser(objectMapper, 20, received::add);

        small.feed("{\"big\":\"xxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxx\"}");
        assertTrue(received.isEmpty());
        assertEquals(0, small.bufferedChars());

        small.feed("{\"ok\":1}");
        assertEquals(1, received.size());
        assertEquals(1, received.get(0).get("ok").asInt());
    }

    @Test
    void shouldNotEmitNestedObjectsOfOversizedObject() {
        JsonObjectStreamParser small = new JsonObjectStreamParser(objectMapper, 120, received::add);
        String oversized = "{\"pad\":\"" + "x".repeat(200) + "\",\"body\":{\"attributes\":"
                + "{\"event.name\":\"qwen.next_speaker_check\",\"result\":\"user\"}}}";

        small.feed(oversized.substring(0, 150));
        small.feed(oversized.substring(150));
        assertTrue(received.isEmpty());

        small.feed("{\"after\":true}");
        assertEquals(1, received.size());
        assertTrue(received.get(0).get("after").asBoolean());
    }

    @Test
    void shouldTrackStringsWhileSkippingOversizedObject() {
        JsonObjectStreamParser small = new JsonObjectStreamParser(objectMapper, 20, received::add);

        small.feed("{\"pad\":\"" + "x".repeat(30) + "\",\"text\":\"}{\\\"}\",\"inner\":{\"a\":1}}");
        small.feed("{\"ok\":1}");

        assertEquals(1, received.size());
        assertEquals(1, received.get(0).get("ok").asInt());
    }

    @Test
    void shouldKeepDeliveringWhenCallbackThrows() {
        List<JsonNode> delivered = new ArrayList<>();
        JsonObjectStreamParser failing = new JsonObjectStreamParser(objectMapper, 1024, node -> {
            delivered.add(node);
            if (node.has("fail")) {
                throw new IllegalStateException("boom");
            }
        });

        failing.feed("{\"fail\":1}{\"next\":2}");

        assertEquals(2, delivered.size());
    }

    @Test
    void shouldDiscardPartialObjectOnReset() {
        parser.feed("{\"partial\":");
        parser.reset();
        parser.feed("{\"fresh\":1}");

        assertEquals(1, received.size());
        assertTrue(received.get(0).has("fresh"));
    }

    @Test
    void shouldIgnoreNullChunk() {
        parser.feed(null);

        assertTrue(received.isEmpty());
    }

    @Test
    void shouldRejectNonPositiveBufferLimit() {
        assertThrows(IllegalArgumentException.class,
                () -> new JsonObjectStreamParser(objectMapper, 0, received::add));
    }
}
