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

import lombok.Builder;

/**
 * Request to invite a new agent session into a channel. {@code name} defaults
 * to the template, {@code prompt} to the configured invitation text and the
 * timeouts to the scheduler defaults.
 */
@Builder
public record AgentInvitation(String channel, String template, String name, String prompt,
        Long toolTimeoutSeconds, Long humanInputTimeoutSeconds) {
}
