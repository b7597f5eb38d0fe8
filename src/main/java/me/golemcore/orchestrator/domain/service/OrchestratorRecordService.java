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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.PersistenceFailureException;
import me.golemcore.orchestrator.domain.model.Channel;
import me.golemcore.orchestrator.domain.model.IdGenerationTable;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable channel and session records.
 *
 * <p>
 * Writes block until the atomic write has completed; any failure surfaces as
 * {@link PersistenceFailureException} so the caller can roll back its
 * in-memory change before anything is broadcast.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestratorRecordService {

    private static final String JSON_SUFFIX = ".json";
    private static final String GENERATIONS_FILE = "generations.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final OrchestratorProperties properties;

    public void saveSession(Session session) {
        write(sessionsDirectory(), session.getId() + JSON_SUFFIX, session);
    }

    public void deleteSession(SessionId id) {
        delete(sessionsDirectory(), id + JSON_SUFFIX);
    }

    public void saveChannel(Channel channel) {
        write(channelsDirectory(), channel.getName() + JSON_SUFFIX, channel);
    }

    public void deleteChannel(String name) {
        delete(channelsDirectory(), name + JSON_SUFFIX);
    }

    public List<Channel> loadChannels() {
        return load(channelsDirectory(), Channel.class);
    }

    public List<Session> loadSessions() {
        return load(sessionsDirectory(), Session.class);
    }

    public void saveIdGenerations(IdGenerationTable table) {
        write(idsDirectory(), GENERATIONS_FILE, table);
    }

    /**
     * @return the stored table, or empty when none was written yet or it cannot
     *         be read
     */
    public Optional<IdGenerationTable> loadIdGenerations() {
        try {
            String json = storagePort.getText(idsDirectory(), GENERATIONS_FILE).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, IdGenerationTable.class));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Records] Unreadable id generation table {}/{}: {}", idsDirectory(), GENERATIONS_FILE,
                    e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String directory, String file, Object record) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new PersistenceFailureException("Failed to serialize " + directory + "/" + file, e);
        }
        try {
            storagePort.putTextAtomic(directory, file, json, properties.getStorage().isBackupOnWrite()).join();
        } catch (RuntimeException e) {
            log.error("[Records] Write failed: {}/{}", directory, file, e);
            throw new PersistenceFailureException("Failed to write " + directory + "/" + file, e);
        }
    }

    private void delete(String directory, String file) {
        try {
            storagePort.deleteObject(directory, file).join();
        } catch (RuntimeException e) {
            log.error("[Records] Delete failed: {}/{}", directory, file, e);
            throw new PersistenceFailureException("Failed to delete " + directory + "/" + file, e);
        }
    }

    private <T> List<T> load(String directory, Class<T> type) {
        List<String> files;
        try {
            files = storagePort.listObjects(directory).join();
        } catch (RuntimeException e) {
            log.error("[Records] Failed to list {}", directory, e);
            return List.of();
        }
        List<T> records = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(JSON_SUFFIX)) {
                continue;
            }
            try {
                String json = storagePort.getText(directory, file).join();
                if (json != null && !json.isBlank()) {
                    records.add(objectMapper.readValue(json, type));
                }
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("[Records] Skipping unreadable record {}/{}: {}", directory, file, e.getMessage());
            }
        }
        return records;
    }

    private String channelsDirectory() {
        return properties.getStorage().getDirectories().getChannels();
    }

    private String sessionsDirectory() {
        return properties.getStorage().getDirectories().getSessions();
    }

    private String idsDirectory() {
        return properties.getStorage().getDirectories().getIds();
    }
}
