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
 * Lifecycle states of an agent session. Wire names are the lowercase tags used
 * in events and persisted records.
 */
public enum SessionState {

    CREATED("created"),
    PENDING("pending"),
    RUNNING("running"),
    TOOL_EXEC("tool_exec"),
    HUMAN_INPUT("human_input"),
    PAUSED("paused"),
    SUCCESS("success"),
    FAILED("failed"),
    STOPPED("stopped");

    private final String wireName;

    SessionState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == STOPPED;
    }

    /**
     * States that run against the per-session timeout thresholds.
     */
    public boolean isWaiting() {
        return this == TOOL_EXEC || this == HUMAN_INPUT;
    }

    /**
     * States occupying one of the concurrent execution slots.
     */
    public boolean isActive() {
        return this == RUNNING || this == TOOL_EXEC;
    }

    @JsonCreator
    public static SessionState fromWireName(String value) {
        return Arrays.stream(values())
                .filter(state -> state.wireName.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session state: " + value));
    }
}
