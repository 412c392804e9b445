package me.golemcore.agentrun.detection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class CompletionEventPredicatesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    // ===== Next speaker =====

    @Test
    void shouldMatchNextSpeakerUserWithDottedEventName() throws Exception {
        JsonNode event = json("{\"attributes\":{\"event.name\":\"qwen-code.next_speaker_check\",\"result\":\"user\"}}");

        assertTrue(CompletionEventPredicates.nextSpeakerIsUser().test(event));
    }

    @Test
    void shouldMatchNextSpeakerUserWithUnderscoreKeyInResource() throws Exception {
        JsonNode event = json(
                "{\"resource\":{\"attributes\":{\"event_name\":\"gemini_cli.next_speaker_check\",\"result\":\"user\"}}}");

        assertTrue(CompletionEventPredicates.nextSpeakerIsUser().test(event));
    }

    @Test
    void shouldNotMatchWhenModelSpeaksNext() throws Exception {
        JsonNode event = json("{\"attributes\":{\"event.name\":\"qwen-code.next_speaker_check\",\"result\":\"model\"}}");

        assertFalse(CompletionEventPredicates.nextSpeakerIsUser().test(event));
    }

    @Test
    void shouldNotMatchEventsWithoutAttributes() throws Exception {
        assertFalse(CompletionEventPredicates.nextSpeakerIsUser().test(json("{\"result\":\"user\"}")));
    }

    // ===== Tool call =====

    @Test
    void shouldMatchCompleteTaskToolCall() throws Exception {
        Predicate<JsonNode> predicate = CompletionEventPredicates.taskToolCall();

        assertTrue(predicate.test(json("{\"body\":{\"attributes\":{\"function_name\":\"complete_task\"}}}")));
        assertFalse(predicate.test(json("{\"attributes\":{\"function_name\":\"read_file\"}}")));
    }

    // ===== Goal termination =====

    @Test
    void shouldMatchGoalTerminationOnAgentFinish() throws Exception {
        Predicate<JsonNode> predicate = CompletionEventPredicates.goalTermination();

        assertTrue(predicate.test(json("{\"attributes\":{\"event.name\":\"agent_finish\",\"terminate_reason\":\"GOAL\"}}")));
        assertTrue(predicate.test(
                json("{\"attributes\":{\"event.name\":\"gemini_cli.agent.finish\",\"terminateReason\":\"GOAL\"}}")));
    }

    @Test
    void shouldNotMatchOtherTerminationReasons() throws Exception {
        Predicate<JsonNode> predicate = CompletionEventPredicates.goalTermination();

        assertFalse(predicate.test(
                json("{\"attributes\":{\"event.name\":\"agent_finish\",\"terminate_reason\":\"MAX_TURNS\"}}")));
        assertFalse(predicate.test(json("{\"attributes\":{\"event.name\":\"tool_call\",\"terminate_reason\":\"GOAL\"}}")));
    }

    @Test
    void shouldCombinePredicatesWithAnyOf() throws Exception {
        Predicate<JsonNode> combined = CompletionEventPredicates.anyOf(
                CompletionEventPredicates.nextSpeakerIsUser(),
                CompletionEventPredicates.goalTermination());

        assertTrue(combined.test(json("{\"attributes\":{\"event.name\":\"agent_finish\",\"terminate_reason\":\"GOAL\"}}")));
        assertTrue(combined.test(json("{\"attributes\":{\"event.name\":\"x.next_speaker_check\",\"result\":\"user\"}}")));
        assertFalse(combined.test(json("{\"attributes\":{\"event.name\":\"api_request\"}}")));
    }
}
