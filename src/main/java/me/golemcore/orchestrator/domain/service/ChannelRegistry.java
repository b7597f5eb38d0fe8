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
import me.golemcore.orchestrator.domain.exception.DuplicateChannelException;
import me.golemcore.orchestrator.domain.exception.ErrorCode;
import me.golemcore.orchestrator.domain.exception.NotFoundException;
import me.golemcore.orchestrator.domain.exception.OrchestrationException;
import me.golemcore.orchestrator.domain.exception.PersistenceFailureException;
import me.golemcore.orchestrator.domain.model.Channel;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.domain.model.SessionId;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Channel definitions and the two-way channel/session membership index.
 *
 * <p>
 * Every mutation updates memory, writes the affected channel records, and only
 * then publishes its event. A failed write restores the previous membership on
 * both sides before the {@link PersistenceFailureException} propagates.
 * Called on the scheduler thread only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelRegistry {

    private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");

    private final OrchestratorRecordService recordService;
    private final EventBroadcaster eventBroadcaster;
    private final SessionStore sessionStore;
    private final Clock clock;

    private final Map<String, Channel> channels = new LinkedHashMap<>();
    private final Map<SessionId, String> sessionToChannel = new HashMap<>();

    public Channel createChannel(String name, String description) {
        validateName(name);
        if (channels.containsKey(name)) {
            throw new DuplicateChannelException(name);
        }
        Instant now = clock.instant();
        Channel channel = Channel.builder()
                .name(name)
                .description(description != null ? description : "")
                .createdAt(now)
                .updatedAt(now)
                .build();
        channels.put(name, channel);
        try {
            recordService.saveChannel(channel);
        } catch (PersistenceFailureException e) {
            channels.remove(name);
            throw e;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("description", channel.getDescription());
        eventBroadcaster.publish(EventType.CHANNEL_CREATED, null, name, payload);
        log.info("[Channels] Created channel: {}", name);
        return channel.copy();
    }

    /**
     * Deletes the channel and clears the membership of its sessions. The
     * sessions themselves keep running, detached.
     *
     * @return ids of the sessions that were members
     */
    public List<SessionId> deleteChannel(String name) {
        Channel channel = require(name);
        List<SessionId> members = new ArrayList<>(channel.getSessionIds());

        channels.remove(name);
        members.forEach(id -> unlink(id, name));
        try {
            recordService.deleteChannel(name);
        } catch (PersistenceFailureException e) {
            channels.put(name, channel);
            members.forEach(id -> link(id, name));
            throw e;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("session_ids", members);
        eventBroadcaster.publish(EventType.CHANNEL_DELETED, null, name, payload);
        log.info("[Channels] Deleted channel: {} ({} sessions detached)", name, members.size());
        return members;
    }

    /**
     * Puts the session into the channel, moving it out of its current channel
     * first. Adding a session to the channel it already belongs to is a no-op.
     */
    public void addSession(String name, SessionId id) {
        Channel target = require(name);
        if (target.getSessionIds().contains(id)) {
            return;
        }
        String previousName = sessionToChannel.get(id);
        Channel previous = previousName != null ? channels.get(previousName) : null;
        Channel targetBackup = target.copy();
        Channel previousBackup = previous != null ? previous.copy() : null;

        Instant now = clock.instant();
        if (previous != null) {
            previous.getSessionIds().remove(id);
            previous.setUpdatedAt(now);
        }
        target.getSessionIds().add(id);
        target.setUpdatedAt(now);
        link(id, name);

        try {
            if (previous != null) {
                recordService.saveChannel(previous);
            }
            recordService.saveChannel(target);
        } catch (PersistenceFailureException e) {
            channels.put(name, targetBackup);
            if (previousBackup != null) {
                channels.put(previousName, previousBackup);
                link(id, previousName);
            } else {
                unlink(id, name);
            }
            rewriteQuietly(previousBackup);
            throw e;
        }

        if (previous != null) {
            eventBroadcaster.publish(EventType.SESSION_REMOVED, id, previousName, membershipPayload(previousName, id));
        }
        eventBroadcaster.publish(EventType.SESSION_ADDED, id, name, membershipPayload(name, id));
        log.debug("[Channels] Session {} added to {}", id, name);
    }

    public void removeSession(String name, SessionId id) {
        Channel channel = require(name);
        if (!channel.getSessionIds().contains(id)) {
            throw new NotFoundException("Session " + id + " is not a member of channel " + name);
        }
        Channel backup = channel.copy();

        channel.getSessionIds().remove(id);
        channel.setUpdatedAt(clock.instant());
        unlink(id, name);
        try {
            recordService.saveChannel(channel);
        } catch (PersistenceFailureException e) {
            channels.put(name, backup);
            link(id, name);
            throw e;
        }

        eventBroadcaster.publish(EventType.SESSION_REMOVED, id, name, membershipPayload(name, id));
        log.debug("[Channels] Session {} removed from {}", id, name);
    }

    public Optional<String> getChannelForSession(SessionId id) {
        return Optional.ofNullable(sessionToChannel.get(id));
    }

    public Optional<Channel> getChannel(String name) {
        return Optional.ofNullable(channels.get(name)).map(Channel::copy);
    }

    public boolean exists(String name) {
        return channels.containsKey(name);
    }

    public List<Channel> listChannels() {
        return channels.values().stream()
                .sorted(Comparator.comparing(Channel::getName))
                .map(Channel::copy)
                .toList();
    }

    public List<SessionId> getSessionIds(String name) {
        return List.copyOf(require(name).getSessionIds());
    }

    /**
     * Replaces the registry contents with recovered records. No events are
     * published.
     */
    public void load(Collection<Channel> recovered) {
        channels.clear();
        sessionToChannel.clear();
        for (Channel channel : recovered) {
            if (channel.getSessionIds() == null) {
                channel.setSessionIds(new LinkedHashSet<>());
            }
            channels.put(channel.getName(), channel);
            channel.getSessionIds().forEach(id -> link(id, channel.getName()));
        }
        log.info("[Channels] Loaded {} channels", channels.size());
    }

    private Channel require(String name) {
        Channel channel = channels.get(name);
        if (channel == null) {
            throw new NotFoundException("Channel not found: " + name);
        }
        return channel;
    }

    private void link(SessionId id, String name) {
        sessionToChannel.put(id, name);
        sessionStore.find(id).ifPresent(session -> session.setChannel(name));
    }

    private void unlink(SessionId id, String name) {
        sessionToChannel.remove(id, name);
        sessionStore.find(id).ifPresent(session -> {
            if (name.equals(session.getChannel())) {
                session.setChannel(null);
            }
        });
    }

    private void rewriteQuietly(Channel channel) {
        if (channel == null) {
            return;
        }
        try {
            recordService.saveChannel(channel);
        } catch (PersistenceFailureException e) {
            log.error("[Channels] Could not restore record of channel {} after failed move", channel.getName(), e);
        }
    }

    private Map<String, Object> membershipPayload(String name, SessionId id) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", name);
        payload.put("session_id", id);
        return payload;
    }

    private void validateName(String name) {
        if (name == null || !CHANNEL_NAME.matcher(name).matches()) {
            throw new OrchestrationException(ErrorCode.BAD_REQUEST,
                    "Invalid channel name: must be 1-64 characters of letters, digits, '.', '_' or '-'");
        }
    }
}
