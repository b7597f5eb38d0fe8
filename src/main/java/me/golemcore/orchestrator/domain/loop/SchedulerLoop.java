package me.golemcore.orchestrator.domain.loop;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.OrchestrationException;
import me.golemcore.orchestrator.domain.exception.PersistenceFailureException;
import me.golemcore.orchestrator.domain.model.Completion;
import me.golemcore.orchestrator.domain.model.CompletionKind;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.model.SessionMessage;
import me.golemcore.orchestrator.domain.model.SessionState;
import me.golemcore.orchestrator.domain.service.SessionLifecycleService;
import me.golemcore.orchestrator.domain.service.SessionStateMachine;
import me.golemcore.orchestrator.domain.service.SessionStore;
import me.golemcore.orchestrator.domain.service.StateRecoveryService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.AgentWorkPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded driver of every session state machine.
 *
 * <p>
 * Every tick (default 100 ms) runs three phases in order:
 * <ol>
 * <li>apply queued completions, at most one per session; the rest wait for
 * the next tick</li>
 * <li>fail {@code tool_exec}/{@code human_input} sessions that exceeded their
 * threshold, skipping sessions that just received a completion</li>
 * <li>admit {@code pending} sessions into {@code running}, oldest first, while
 * fewer than {@code max-concurrent-running} sessions are active</li>
 * </ol>
 *
 * <p>
 * All external mutations are funnelled onto the same thread through
 * {@link #submit(Callable)}, so no session is ever touched by two threads. A
 * failure while handling one session is logged and does not stop the tick.
 *
 * @see CompletionQueue
 */
@Component
@Slf4j
public class SchedulerLoop {

    private static final String THREAD_NAME = "orchestrator-scheduler";

    private final OrchestratorProperties.SchedulerProperties settings;
    private final SessionStore sessionStore;
    private final SessionStateMachine stateMachine;
    private final SessionLifecycleService lifecycleService;
    private final StateRecoveryService recoveryService;
    private final CompletionQueue completionQueue;
    private final AgentWorkPort agentWorkPort;
    private final Clock clock;
    private final List<Completion> deferred = new ArrayList<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public SchedulerLoop(OrchestratorProperties properties, SessionStore sessionStore,
            SessionStateMachine stateMachine, SessionLifecycleService lifecycleService,
            StateRecoveryService recoveryService, CompletionQueue completionQueue,
            AgentWorkPort agentWorkPort, Clock clock) {
        this.settings = properties.getScheduler();
        this.sessionStore = sessionStore;
        this.stateMachine = stateMachine;
        this.lifecycleService = lifecycleService;
        this.recoveryService = recoveryService;
        this.completionQueue = completionQueue;
        this.agentWorkPort = agentWorkPort;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });

        scheduler.execute(this::recover);

        if (!settings.isEnabled()) {
            log.info("[Scheduler] Ticking disabled, control operations only");
            return;
        }

        long interval = Math.max(1, settings.getTickIntervalMillis());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[Scheduler] Started with tick interval: {}ms, max concurrent running: {}",
                interval, settings.getMaxConcurrentRunning());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Scheduler] Shut down");
    }

    /**
     * Runs {@code task} on the scheduler thread between ticks.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        ScheduledExecutorService executor = scheduler;
        if (executor == null || executor.isShutdown()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Scheduler is not running"));
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Scheduler is not running", e));
        }
        return result;
    }

    void recover() {
        try {
            List<Session> running = recoveryService.recover();
            running.forEach(this::requestWork);
        } catch (RuntimeException e) {
            log.error("[Scheduler] State recovery failed", e);
        }
    }

    void tick() {
        try {
            Set<SessionId> completed = applyCompletions();
            failTimedOut(completed);
            admitPending();
        } catch (RuntimeException e) {
            log.error("[Scheduler] Tick failed", e);
        }
    }

    private Set<SessionId> applyCompletions() {
        List<Completion> batch = new ArrayList<>(deferred);
        deferred.clear();
        batch.addAll(completionQueue.drain());

        Set<SessionId> touched = new HashSet<>();
        for (Completion completion : batch) {
            if (touched.contains(completion.sessionId())) {
                deferred.add(completion);
                continue;
            }
            Optional<Session> found = sessionStore.find(completion.sessionId());
            if (found.isEmpty()) {
                log.warn("[Scheduler] Dropping {} for unknown or stale session {}",
                        completion.kind().getWireName(), completion.sessionId());
                continue;
            }
            Session session = found.get();
            if (session.getState() == SessionState.PAUSED) {
                deferred.add(completion);
                continue;
            }
            try {
                if (apply(session, completion)) {
                    touched.add(session.getId());
                }
            } catch (PersistenceFailureException e) {
                log.warn("[Scheduler] Retrying {} for session {} next tick: {}",
                        completion.kind().getWireName(), session.getId(), e.getMessage());
                touched.add(session.getId());
                deferred.add(completion);
            } catch (RuntimeException e) {
                log.error("[Scheduler] Failed to apply {} to session {}",
                        completion.kind().getWireName(), session.getId(), e);
            }
        }
        return touched;
    }

    private boolean apply(Session session, Completion completion) {
        CompletionKind kind = completion.kind();
        SessionState state = session.getState();
        if (state.isTerminal()) {
            log.warn("[Scheduler] Dropping {} for session {} in terminal state {}",
                    kind.getWireName(), session.getId(), state.getWireName());
            return false;
        }

        if (!kind.isTransition()) {
            Object content = completion.payload() != null ? completion.payload().get("content") : null;
            lifecycleService.recordMessage(session, SessionMessage.ROLE_AGENT,
                    content != null ? content.toString() : "");
            return true;
        }

        if (state != kind.getSource()) {
            log.warn("[Scheduler] Dropping {} for session {}: expected {}, was {}",
                    kind.getWireName(), session.getId(), kind.getSource().getWireName(), state.getWireName());
            return false;
        }

        stateMachine.transition(session, kind.getTarget(), completion.payload());
        if (kind.getTarget() == SessionState.RUNNING) {
            requestWork(session);
        }
        return true;
    }

    private void failTimedOut(Set<SessionId> completed) {
        Instant now = clock.instant();
        for (Session session : sessionStore.list()) {
            if (!session.getState().isWaiting() || completed.contains(session.getId())) {
                continue;
            }
            Duration threshold = thresholdFor(session);
            Duration elapsed = Duration.between(session.getUpdatedAt(), now);
            if (elapsed.compareTo(threshold) < 0) {
                continue;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("reason", "timeout");
            data.put("timed_out_state", session.getState().getWireName());
            data.put("elapsed_ms", elapsed.toMillis());
            try {
                stateMachine.transition(session, SessionState.FAILED, data);
                log.info("[Scheduler] Session {} timed out in {} after {}ms",
                        session.getId(), data.get("timed_out_state"), elapsed.toMillis());
            } catch (OrchestrationException e) {
                log.warn("[Scheduler] Could not fail timed out session {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    private void admitPending() {
        int limit = settings.getMaxConcurrentRunning();
        List<Session> sessions = sessionStore.list();
        long active = sessions.stream().filter(s -> s.getState().isActive()).count();
        if (active >= limit) {
            return;
        }
        List<Session> pending = sessions.stream()
                .filter(s -> s.getState() == SessionState.PENDING)
                .sorted(Comparator.comparing(Session::getUpdatedAt)
                        .thenComparing(s -> s.getId().asLong()))
                .toList();
        for (Session session : pending) {
            if (active >= limit) {
                break;
            }
            try {
                stateMachine.transition(session, SessionState.RUNNING, Map.of("reason", "admitted"));
                active++;
                requestWork(session);
            } catch (OrchestrationException e) {
                log.warn("[Scheduler] Could not admit session {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    private Duration thresholdFor(Session session) {
        Long seconds = session.getState() == SessionState.TOOL_EXEC
                ? session.getToolTimeoutSeconds()
                : session.getHumanInputTimeoutSeconds();
        if (seconds == null) {
            seconds = session.getState() == SessionState.TOOL_EXEC
                    ? settings.getToolTimeoutSeconds()
                    : settings.getHumanInputTimeoutSeconds();
        }
        return Duration.ofSeconds(seconds);
    }

    private void requestWork(Session session) {
        try {
            agentWorkPort.requestWork(session);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Agent work request failed for session {}", session.getId(), e);
        }
    }

    int deferredCount() {
        return deferred.size();
    }
}
