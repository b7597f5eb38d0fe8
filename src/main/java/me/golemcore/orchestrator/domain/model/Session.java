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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One agent session tracked by the orchestrator.
 *
 * <p>
 * Instances are mutated only on the scheduler thread. The same shape is
 * persisted as {@code sessions/<id>.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private SessionId id;

    /** Agent name used in {@code @name#id} mentions. */
    private String name;

    /** Agent template the session was invited with. */
    private String template;

    /**
     * Owning channel, or null when detached. Membership is persisted on the
     * channel record and mirrored here on load.
     */
    @JsonIgnore
    private String channel;

    private SessionState state;

    /** State to return to when un-paused; set only while paused. */
    private SessionState resumeState;

    @Builder.Default
    private Map<String, Object> stateData = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    /** Per-session override in seconds, null means the configured default. */
    private Long toolTimeoutSeconds;

    /** Per-session override in seconds, null means the configured default. */
    private Long humanInputTimeoutSeconds;

    @Builder.Default
    private List<SessionMessage> messages = new ArrayList<>();

    public void addMessage(SessionMessage message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
    }

    @JsonIgnore
    public String getMention() {
        return "@" + name + "#" + id;
    }
}
