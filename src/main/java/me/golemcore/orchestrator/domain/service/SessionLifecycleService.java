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
import me.golemcore.orchestrator.domain.exception.ErrorCode;
import me.golemcore.orchestrator.domain.exception.InvalidTransitionException;
import me.golemcore.orchestrator.domain.exception.NotFoundException;
import me.golemcore.orchestrator.domain.exception.OrchestrationException;
import me.golemcore.orchestrator.domain.exception.PersistenceFailureException;
import me.golemcore.orchestrator.domain.model.AgentInvitation;
import me.golemcore.orchestrator.domain.model.Channel;
import me.golemcore.orchestrator.domain.model.Completion;
import me.golemcore.orchestrator.domain.model.CompletionKind;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.domain.model.OrchestratorSnapshot;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.model.SessionMessage;
import me.golemcore.orchestrator.domain.model.SessionState;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.inbound.CompletionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Control operations on sessions: invite, message, pause, resume, stop and
 * delete, plus channel management on behalf of clients.
 *
 * <p>
 * Must be called on the scheduler thread; adapters go through
 * {@link me.golemcore.orchestrator.domain.loop.SchedulerLoop#submit}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleService {

    private final SessionStore sessionStore;
    private final SessionStateMachine stateMachine;
    private final ChannelRegistry channelRegistry;
    private final OrchestratorRecordService recordService;
    private final EventBroadcaster eventBroadcaster;
    private final CompletionPort completionPort;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public Channel createChannel(String name, String description) {
        return channelRegistry.createChannel(name, description);
    }

    public List<SessionId> deleteChannel(String name) {
        return channelRegistry.deleteChannel(name);
    }

    public Session addToChannel(String channel, SessionId id) {
        Session session = sessionStore.require(id);
        channelRegistry.addSession(channel, id);
        return session;
    }

    public Session removeFromChannel(String channel, SessionId id) {
        Session session = sessionStore.require(id);
        channelRegistry.removeSession(channel, id);
        return session;
    }

    /**
     * Creates a session, records the invitation prompt, moves it from
     * {@code created} to {@code pending} and joins it to the channel. The
     * session record is written once, already pending; joining the channel is
     * the last write. Events go out only after both writes succeeded, and
     * nothing is left behind if either fails.
     */
    public Session invite(AgentInvitation invitation) {
        String channel = invitation.channel();
        if (channel == null || !channelRegistry.exists(channel)) {
            throw new NotFoundException("Channel not found: " + channel);
        }
        String template = requireText(invitation.template(), "template");
        String name = invitation.name() != null && !invitation.name().isBlank()
                ? invitation.name().trim()
                : template;
        String prompt = invitation.prompt() != null && !invitation.prompt().isBlank()
                ? invitation.prompt()
                : properties.getWebsocket().getDefaultInvitePrompt();

        SessionId id = sessionStore.allocateId();
        Instant now = clock.instant();
        Session session = Session.builder()
                .id(id)
                .name(name)
                .template(template)
                .state(SessionState.CREATED)
                .createdAt(now)
                .updatedAt(now)
                .toolTimeoutSeconds(invitation.toolTimeoutSeconds())
                .humanInputTimeoutSeconds(invitation.humanInputTimeoutSeconds())
                .build();

        session.addMessage(message(SessionMessage.ROLE_USER, prompt));
        SessionStateMachine.StateChange pending = stateMachine.apply(session, SessionState.PENDING,
                Map.of("reason", "invited"));

        boolean stored = false;
        try {
            recordService.saveSession(session);
            sessionStore.put(session);
            stored = true;
            channelRegistry.addSession(channel, id);
        } catch (RuntimeException e) {
            rollbackInvite(session, stored, e);
            throw e;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("session_id", id);
        payload.put("name", name);
        payload.put("template", template);
        eventBroadcaster.publish(EventType.AGENT_INVITED, id, channel, payload);
        stateMachine.publish(pending);
        log.info("[Lifecycle] Invited {} into {}", session.getMention(), channel);
        return session;
    }

    /**
     * Delivers a user message to the agent addressed by {@code agent} in the
     * channel. Accepted forms: {@code @name#id}, {@code name#id}, {@code #id},
     * {@code id} and a bare {@code name} that matches exactly one session.
     */
    public Session submitMessage(String channel, String agent, String content) {
        if (channel == null || !channelRegistry.exists(channel)) {
            throw new NotFoundException("Channel not found: " + channel);
        }
        String text = requireText(content, "content");
        Session session = resolveMention(channel, agent);
        SessionState state = session.getState();
        if (state.isTerminal()) {
            throw new InvalidTransitionException(state,
                    "Session " + session.getId() + " is " + state.getWireName() + " and no longer accepts messages");
        }

        recordMessage(session, SessionMessage.ROLE_USER, text);
        if (state == SessionState.CREATED) {
            stateMachine.transition(session, SessionState.PENDING, Map.of("reason", "message"));
        } else if (state == SessionState.HUMAN_INPUT) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("content", text);
            completionPort.submit(Completion.builder()
                    .sessionId(session.getId())
                    .kind(CompletionKind.HUMAN_RESPONSE)
                    .payload(payload)
                    .receivedAt(clock.instant())
                    .build());
        }
        return session;
    }

    /**
     * Appends a message to the session history, persists it and broadcasts it
     * as {@code message:user} or {@code message:agent}.
     */
    public void recordMessage(Session session, String role, String content) {
        SessionMessage message = message(role, content);
        session.addMessage(message);
        try {
            recordService.saveSession(session);
        } catch (PersistenceFailureException e) {
            session.getMessages().remove(message);
            throw e;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", session.getId());
        payload.put("agent", session.getMention());
        payload.put("role", role);
        payload.put("content", content);
        EventType type = SessionMessage.ROLE_AGENT.equals(role) ? EventType.MESSAGE_AGENT : EventType.MESSAGE_USER;
        eventBroadcaster.publish(type, session.getId(), session.getChannel(), payload);
    }

    public Session pause(SessionId id) {
        Session session = sessionStore.require(id);
        stateMachine.transition(session, SessionState.PAUSED, Map.of("reason", "paused"));
        return session;
    }

    /**
     * Resumes a paused session into the state it was paused from. Resuming a
     * stopped session succeeds without an event.
     */
    public Session resume(SessionId id) {
        Session session = sessionStore.require(id);
        if (session.getState() == SessionState.STOPPED) {
            log.debug("[Lifecycle] Session {} is stopped, ignoring resume", id);
            return session;
        }
        if (session.getState() != SessionState.PAUSED) {
            throw new InvalidTransitionException(session.getState(),
                    "Session " + id + " is " + session.getState().getWireName() + ", not paused");
        }
        stateMachine.transition(session, session.getResumeState(), Map.of("reason", "resumed"));
        return session;
    }

    /**
     * Stops the session. Stopping a stopped session succeeds without an event.
     */
    public Session stop(SessionId id) {
        Session session = sessionStore.require(id);
        stateMachine.transition(session, SessionState.STOPPED, Map.of("reason", "stopped"));
        return session;
    }

    /**
     * Stops the session if still live, deletes its record, detaches it and frees
     * its id. Any later use of the id fails as a stale reference.
     *
     * <p>
     * The id generation table is written first so the id stays retired across
     * restarts. If a later write fails the session is left as it was and
     * nothing is broadcast.
     */
    public void delete(SessionId id) {
        Session session = sessionStore.require(id);
        Optional<String> channel = channelRegistry.getChannelForSession(id);

        recordService.saveIdGenerations(sessionStore.idGenerations());
        SessionStateMachine.StateChange stop = session.getState().isTerminal()
                ? null
                : stateMachine.apply(session, SessionState.STOPPED, Map.of("reason", "deleted"));
        try {
            recordService.deleteSession(id);
        } catch (PersistenceFailureException e) {
            revertStop(stop);
            throw e;
        }
        if (channel.isPresent()) {
            try {
                channelRegistry.removeSession(channel.get(), id);
            } catch (PersistenceFailureException e) {
                revertStop(stop);
                restoreRecord(session, e);
                throw e;
            }
        }
        if (stop != null) {
            stateMachine.publish(stop);
        }
        sessionStore.remove(id);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", id);
        payload.put("channel", channel.orElse(null));
        eventBroadcaster.publish(EventType.SESSION_DELETED, id, channel.orElse(null), payload);
        log.info("[Lifecycle] Deleted session {}", id);
    }

    public Session getSession(SessionId id) {
        return sessionStore.require(id);
    }

    public List<Session> listSessions(String channel) {
        return sessionStore.list().stream()
                .filter(session -> channel == null || channel.equals(session.getChannel()))
                .toList();
    }

    public List<Channel> listChannels() {
        return channelRegistry.listChannels();
    }

    public Channel getChannel(String name) {
        return channelRegistry.getChannel(name)
                .orElseThrow(() -> new NotFoundException("Channel not found: " + name));
    }

    public OrchestratorSnapshot snapshot() {
        return new OrchestratorSnapshot(channelRegistry.listChannels(), sessionStore.list());
    }

    private Session resolveMention(String channel, String agent) {
        String mention = requireText(agent, "agent");
        if (mention.startsWith("@")) {
            mention = mention.substring(1);
        }
        int hash = mention.indexOf('#');
        String name = hash >= 0 ? mention.substring(0, hash) : mention;
        String idPart = hash >= 0 ? mention.substring(hash + 1) : null;
        if (idPart == null && !name.isEmpty() && name.chars().allMatch(Character::isDigit)) {
            idPart = name;
            name = "";
        }

        if (idPart != null) {
            Session session = sessionStore.require(SessionId.parse(idPart));
            if (!channel.equals(session.getChannel())) {
                throw new NotFoundException("Session " + session.getId() + " is not a member of channel " + channel);
            }
            if (!name.isEmpty() && !name.equalsIgnoreCase(session.getName())) {
                throw new NotFoundException("Session " + session.getId() + " is not named " + name);
            }
            return session;
        }

        String wanted = name;
        List<Session> matches = channelRegistry.getSessionIds(channel).stream()
                .map(sessionStore::find)
                .flatMap(Optional::stream)
                .filter(session -> wanted.equalsIgnoreCase(session.getName()))
                .toList();
        if (matches.isEmpty()) {
            throw new NotFoundException("No agent named " + wanted + " in channel " + channel);
        }
        if (matches.size() > 1) {
            throw new OrchestrationException(ErrorCode.BAD_REQUEST,
                    "Agent name " + wanted + " is ambiguous in channel " + channel + ", use @name#id");
        }
        return matches.get(0);
    }

    private void revertStop(SessionStateMachine.StateChange stop) {
        if (stop != null) {
            stateMachine.revert(stop);
        }
    }

    private void restoreRecord(Session session, RuntimeException cause) {
        try {
            recordService.saveSession(session);
        } catch (PersistenceFailureException e) {
            cause.addSuppressed(e);
            log.error("[Lifecycle] Could not restore record of session {}", session.getId(), e);
        }
    }

    private void rollbackInvite(Session session, boolean stored, RuntimeException cause) {
        SessionId id = session.getId();
        log.warn("[Lifecycle] Invite of {} failed, rolling back: {}", id, cause.getMessage());
        try {
            recordService.deleteSession(id);
        } catch (OrchestrationException e) {
            cause.addSuppressed(e);
            log.error("[Lifecycle] Incomplete rollback for session {}", id, e);
        }
        if (stored) {
            sessionStore.remove(id);
        } else {
            sessionStore.releaseId(id);
        }
    }

    private SessionMessage message(String role, String content) {
        return SessionMessage.builder()
                .role(role)
                .content(content)
                .timestamp(clock.instant())
                .build();
    }

    private String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new OrchestrationException(ErrorCode.BAD_REQUEST, field + " is required");
        }
        return value.trim();
    }
}
