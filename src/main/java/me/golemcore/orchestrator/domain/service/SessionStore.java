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
import me.golemcore.orchestrator.domain.exception.NotFoundException;
import me.golemcore.orchestrator.domain.exception.StaleReferenceException;
import me.golemcore.orchestrator.domain.model.IdGenerationTable;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owner of all live sessions, keyed by generational id. Ids are issued and
 * released only through this store so a session and its slot live and die
 * together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionStore {

    private final GenerationalIdAllocator allocator;
    private final Map<SessionId, Session> sessions = new ConcurrentHashMap<>();

    public SessionId allocateId() {
        return allocator.allocate();
    }

    public void put(Session session) {
        if (!allocator.isValid(session.getId())) {
            throw new StaleReferenceException(session.getId());
        }
        sessions.put(session.getId(), session);
    }

    /**
     * Generation table covering every slot handed out so far.
     */
    public IdGenerationTable idGenerations() {
        return new IdGenerationTable(allocator.getIndexBits(), allocator.generationTable());
    }

    /**
     * Seeds the allocator from a stored table. Must run before any session is
     * restored.
     *
     * @return false when the table was written with a different index width
     *         and was ignored
     */
    public boolean restoreIdGenerations(IdGenerationTable table) {
        if (table.indexBits() != allocator.getIndexBits() || table.generations() == null) {
            return false;
        }
        allocator.restoreGenerations(table.generations());
        return true;
    }

    /**
     * Registers a session read back from disk, claiming its id.
     */
    public void restore(Session session) {
        allocator.claim(session.getId());
        sessions.put(session.getId(), session);
    }

    public Optional<Session> find(SessionId id) {
        if (!allocator.isValid(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * @throws StaleReferenceException
     *             when the id was issued but its slot has since been released
     * @throws NotFoundException
     *             when the id was never issued
     */
    public Session require(SessionId id) {
        Optional<Session> session = find(id);
        if (session.isPresent()) {
            return session.get();
        }
        if (allocator.wasIssued(id)) {
            throw new StaleReferenceException(id);
        }
        throw new NotFoundException("Session not found: " + id);
    }

    /**
     * Drops the session and frees its slot. Returns false when the id is no
     * longer valid.
     */
    public boolean remove(SessionId id) {
        sessions.remove(id);
        boolean released = allocator.release(id);
        if (!released) {
            log.debug("[Sessions] Release of {} ignored, id no longer valid", id);
        }
        return released;
    }

    /**
     * Frees an id that never made it into the store.
     */
    public void releaseId(SessionId id) {
        allocator.release(id);
    }

    public List<Session> list() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(Session::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(session -> session.getId().asLong()))
                .toList();
    }

    public int size() {
        return sessions.size();
    }
}
