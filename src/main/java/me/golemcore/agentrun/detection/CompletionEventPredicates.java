package me.golemcore.agentrun.detection;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Provider completion predicates over telemetry events. All of them are pure
 * functions of the event's attribute map.
 */
public final class CompletionEventPredicates {

    private static final String[] EVENT_NAME_KEYS = { "event.name", "event_name" };
    private static final String NEXT_SPEAKER_SUFFIX = ".next_speaker_check";
    private static final String SPEAKER_USER = "user";
    private static final String COMPLETE_TASK = "complete_task";
    private static final String AGENT_FINISH = "agent_finish";
    private static final String AGENT_FINISH_SUFFIX = ".agent.finish";
    private static final String TERMINATE_REASON_GOAL = "GOAL";

    private CompletionEventPredicates() {
    }

    /**
     * The CLI decided the next speaker is the user, e.g.
     * {@code qwen_cli.next_speaker_check} with {@code result=user}.
     */
    public static Predicate<JsonNode> nextSpeakerIsUser() {
        return event -> isNextSpeakerUser(TelemetryAttributes.extractAttributes(event));
    }

    /**
     * The agent called its {@code complete_task} tool.
     */
    public static Predicate<JsonNode> taskToolCall() {
        return event -> isTaskToolCall(TelemetryAttributes.extractAttributes(event));
    }

    /**
     * The agent finished with an explicit {@code GOAL} termination reason.
     */
    public static Predicate<JsonNode> goalTermination() {
        return event -> isGoalTermination(TelemetryAttributes.extractAttributes(event));
    }

    @SafeVarargs
    public static Predicate<JsonNode> anyOf(Predicate<JsonNode>... predicates) {
        List<Predicate<JsonNode>> all = Arrays.asList(predicates);
        return event -> all.stream().anyMatch(predicate -> predicate.test(event));
    }

    static boolean isNextSpeakerUser(JsonNode attrs) {
        String eventName = TelemetryAttributes.chooseAttr(attrs, EVENT_NAME_KEYS);
        if (eventName == null || !eventName.endsWith(NEXT_SPEAKER_SUFFIX)) {
            return false;
        }
        return SPEAKER_USER.equals(TelemetryAttributes.chooseAttr(attrs, "result"));
    }

    static boolean isTaskToolCall(JsonNode attrs) {
        return COMPLETE_TASK.equals(TelemetryAttributes.chooseAttr(attrs, "function_name"));
    }

    static boolean isGoalTermination(JsonNode attrs) {
        String eventName = TelemetryAttributes.chooseAttr(attrs, EVENT_NAME_KEYS);
        if (eventName == null) {
            return false;
        }
        boolean finishEvent = AGENT_FINISH.equals(eventName) || eventName.endsWith(AGENT_FINISH_SUFFIX);
        return finishEvent && TERMINATE_REASON_GOAL.equals(
                TelemetryAttributes.chooseAttr(attrs, "terminate_reason", "terminateReason"));
    }
}
