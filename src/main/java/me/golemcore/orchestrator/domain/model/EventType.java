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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of events fanned out to observers.
 */
public enum EventType {

    STATE_CHANGED("state:changed"),
    CHANNEL_CREATED("channel:created"),
    CHANNEL_DELETED("channel:deleted"),
    SESSION_ADDED("session:added"),
    SESSION_REMOVED("session:removed"),
    SESSION_DELETED("session:deleted"),
    AGENT_INVITED("agent:invited"),
    MESSAGE_USER("message:user"),
    MESSAGE_AGENT("message:agent");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
