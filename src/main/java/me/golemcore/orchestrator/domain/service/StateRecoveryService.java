package me.golemcore.orchestrator.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.PersistenceFailureException;
import me.golemcore.orchestrator.domain.model.Channel;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.model.SessionState;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds id generations, sessions and channel membership from persisted
 * records at startup. Runs on the scheduler thread before the first tick.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StateRecoveryService {

    private final OrchestratorRecordService recordService;
    private final SessionStore sessionStore;
    private final ChannelRegistry channelRegistry;

    /**
     * @return sessions recovered in {@code running}, whose agent work has to be
     *         requested again
     */
    public List<Session> recover() {
        recordService.loadIdGenerations().ifPresent(table -> {
            if (sessionStore.restoreIdGenerations(table)) {
                log.info("[Recovery] Restored generations for {} id slots", table.generations().length);
            } else {
                log.warn("[Recovery] Ignoring id generation table written with index-bits {}", table.indexBits());
            }
        });

        Set<SessionId> restored = new HashSet<>();
        for (Session session : recordService.loadSessions()) {
            if (session.getId() == null || session.getState() == null) {
                log.warn("[Recovery] Skipping session record without id or state");
                continue;
            }
            try {
                sessionStore.restore(session);
                restored.add(session.getId());
            } catch (IllegalStateException e) {
                log.warn("[Recovery] Skipping session {}: {}", session.getId(), e.getMessage());
            }
        }

        List<Channel> channels = recordService.loadChannels();
        Set<SessionId> assigned = new HashSet<>();
        for (Channel channel : channels) {
            Set<SessionId> members = channel.getSessionIds() != null ? channel.getSessionIds() : Set.of();
            Set<SessionId> kept = new LinkedHashSet<>();
            for (SessionId id : members) {
                if (restored.contains(id) && assigned.add(id)) {
                    kept.add(id);
                }
            }
            if (kept.size() != members.size()) {
                log.warn("[Recovery] Channel {} referenced {} missing or duplicate sessions",
                        channel.getName(), members.size() - kept.size());
                channel.setSessionIds(kept);
                try {
                    recordService.saveChannel(channel);
                } catch (PersistenceFailureException e) {
                    log.warn("[Recovery] Could not rewrite channel {}: {}", channel.getName(), e.getMessage());
                }
            } else {
                channel.setSessionIds(kept);
            }
        }
        channelRegistry.load(channels);

        List<Session> running = new ArrayList<>();
        for (Session session : sessionStore.list()) {
            if (session.getState() == SessionState.RUNNING) {
                running.add(session);
            }
        }
        log.info("[Recovery] Restored {} sessions in {} channels ({} detached)",
                restored.size(), channels.size(), restored.size() - assigned.size());
        return running;
    }
}
