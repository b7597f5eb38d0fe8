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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Named group of sessions, persisted as {@code channels/<name>.json}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Channel {

    private String name;
    private String description;

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    @Builder.Default
    private Set<SessionId> sessionIds = new LinkedHashSet<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Deep-enough copy for rollback and for handing out to readers.
     */
    public Channel copy() {
        return toBuilder()
                .labels(new LinkedHashMap<>(labels != null ? labels : Map.of()))
                .sessionIds(new LinkedHashSet<>(sessionIds != null ? sessionIds : Set.of()))
                .build();
    }
}
