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
import me.golemcore.orchestrator.domain.exception.InvalidTransitionException;
import me.golemcore.orchestrator.domain.exception.PersistenceFailureException;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionState;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validates and applies session state transitions.
 *
 * <p>
 * Edges:
 *
 * <pre>
 * created     → pending
 * pending     → running | paused
 * running     → tool_exec | human_input | success | failed | paused
 * tool_exec   → running | failed (timeout) | paused
 * human_input → running | failed (timeout) | paused
 * paused      → the state it was paused from
 * any non-terminal → stopped
 * </pre>
 *
 * <p>
 * A transition changes memory, then persists the session record, then
 * publishes {@code state:changed}. If the write fails the in-memory change is
 * undone and nothing is published. Callers that fold the change into a larger
 * write use {@link #apply} and {@link #publish} directly. {@code stopped} absorbs every request as a
 * silent no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStateMachine {

    private static final Map<SessionState, Set<SessionState>> EDGES = new EnumMap<>(SessionState.class);

    static {
        EDGES.put(SessionState.CREATED, EnumSet.of(SessionState.PENDING));
        EDGES.put(SessionState.PENDING, EnumSet.of(SessionState.RUNNING, SessionState.PAUSED));
        EDGES.put(SessionState.RUNNING, EnumSet.of(SessionState.TOOL_EXEC, SessionState.HUMAN_INPUT,
                SessionState.SUCCESS, SessionState.FAILED, SessionState.PAUSED));
        EDGES.put(SessionState.TOOL_EXEC, EnumSet.of(SessionState.RUNNING, SessionState.FAILED,
                SessionState.PAUSED));
        EDGES.put(SessionState.HUMAN_INPUT, EnumSet.of(SessionState.RUNNING, SessionState.FAILED,
                SessionState.PAUSED));
    }

    private final OrchestratorRecordService recordService;
    private final EventBroadcaster eventBroadcaster;
    private final Clock clock;

    public static boolean isAllowed(Session session, SessionState target) {
        SessionState source = session.getState();
        if (source == null || target == null || source.isTerminal()) {
            return false;
        }
        if (target == SessionState.STOPPED) {
            return true;
        }
        if (source == SessionState.PAUSED) {
            return target == session.getResumeState();
        }
        return EDGES.getOrDefault(source, Set.of()).contains(target);
    }

    /**
     * Moves {@code session} to {@code target}.
     *
     * @return true if the session changed state, false for the no-op on a
     *         stopped session
     * @throws InvalidTransitionException
     *             if the edge does not exist; the session is left untouched
     * @throws PersistenceFailureException
     *             if the record could not be written; the session is rolled back
     */
    public boolean transition(Session session, SessionState target, Map<String, Object> stateData) {
        SessionState source = session.getState();
        if (source == SessionState.STOPPED) {
            log.debug("[StateMachine] Session {} is stopped, ignoring {}", session.getId(), target);
            return false;
        }

        StateChange change = apply(session, target, stateData);
        try {
            recordService.saveSession(session);
        } catch (PersistenceFailureException e) {
            revert(change);
            log.warn("[StateMachine] Rolled back {} -> {} for session {}: {}",
                    source.getWireName(), target.getWireName(), session.getId(), e.getMessage());
            throw e;
        }
        publish(change);
        return true;
    }

    /**
     * Changes the session in memory only. The caller owns the record write and
     * calls {@link #publish(StateChange)} once it has succeeded, or
     * {@link #revert(StateChange)} if it failed.
     *
     * @throws InvalidTransitionException
     *             if the edge does not exist; the session is left untouched
     */
    public StateChange apply(Session session, SessionState target, Map<String, Object> stateData) {
        SessionState source = session.getState();
        if (!isAllowed(session, target)) {
            throw new InvalidTransitionException(source, target);
        }
        StateChange change = new StateChange(session, source, target,
                Collections.unmodifiableMap(stateData != null ? new LinkedHashMap<>(stateData) : new LinkedHashMap<>()),
                session.getChannel(), session.getStateData(), session.getResumeState(), session.getUpdatedAt());
        session.setState(target);
        session.setStateData(new LinkedHashMap<>(change.stateData()));
        session.setUpdatedAt(clock.instant());
        session.setResumeState(target == SessionState.PAUSED ? source : null);
        return change;
    }

    /**
     * Puts the session back where it was before {@code change} was applied.
     */
    public void revert(StateChange change) {
        Session session = change.session();
        session.setState(change.oldState());
        session.setStateData(change.previousStateData());
        session.setResumeState(change.previousResumeState());
        session.setUpdatedAt(change.previousUpdatedAt());
    }

    /**
     * Broadcasts {@code state:changed} for a change made by
     * {@link #apply(Session, SessionState, Map)}. The event is addressed to
     * the session's channel, or to the channel it was in when the change was
     * applied if it has left since.
     */
    public void publish(StateChange change) {
        Session session = change.session();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", session.getId());
        payload.put("old_state", change.oldState());
        payload.put("new_state", change.newState());
        payload.put("state_data", change.stateData());
        String channel = session.getChannel() != null ? session.getChannel() : change.channel();
        eventBroadcaster.publish(EventType.STATE_CHANGED, session.getId(), channel, payload);

        log.debug("[StateMachine] Session {}: {} -> {}", session.getId(), change.oldState().getWireName(),
                change.newState().getWireName());
    }

    /**
     * A state change applied in memory, with what it replaced.
     */
    public record StateChange(Session session, SessionState oldState, SessionState newState,
            Map<String, Object> stateData, String channel, Map<String, Object> previousStateData,
            SessionState previousResumeState, Instant previousUpdatedAt) {
    }
}
