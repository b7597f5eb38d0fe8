package me.golemcore.orchestrator.adapter.outbound.agent;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.port.outbound.AgentWorkPort;
import org.springframework.stereotype.Component;

/**
 * Fallback agent work adapter used when no agent runtime is wired in. Logs the
 * request and does nothing else; the session stays {@code running} until a
 * completion arrives through the REST callback.
 */
@Component
@Slf4j
public class NoOpAgentWorkAdapter implements AgentWorkPort {

    @Override
    public void requestWork(Session session) {
        log.debug("[AgentWork] No agent runtime configured, session {} ({}) awaits an external completion",
                session.getId(), session.getTemplate());
    }
}
