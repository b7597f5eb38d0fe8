package me.golemcore.orchestrator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Outcomes reported back to the scheduler by agents, tools and humans. Each
 * kind is valid from one source state and maps to one target state;
 * {@link #AGENT_MESSAGE} records output without a transition.
 */
public enum CompletionKind {

    TOOL_CALL("tool_call", SessionState.RUNNING, SessionState.TOOL_EXEC),
    TOOL_RESULT("tool_result", SessionState.TOOL_EXEC, SessionState.RUNNING),
    HUMAN_REQUEST("human_request", SessionState.RUNNING, SessionState.HUMAN_INPUT),
    HUMAN_RESPONSE("human_response", SessionState.HUMAN_INPUT, SessionState.RUNNING),
    AGENT_FINISHED("agent_finished", SessionState.RUNNING, SessionState.SUCCESS),
    AGENT_FAILED("agent_failed", SessionState.RUNNING, SessionState.FAILED),
    AGENT_MESSAGE("agent_message", null, null);

    private final String wireName;
    private final SessionState source;
    private final SessionState target;

    CompletionKind(String wireName, SessionState source, SessionState target) {
        this.wireName = wireName;
        this.source = source;
        this.target = target;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public SessionState getSource() {
        return source;
    }

    public SessionState getTarget() {
        return target;
    }

    public boolean isTransition() {
        return target != null;
    }

    @JsonCreator
    public static CompletionKind fromWireName(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown completion kind: " + value));
    }
}
