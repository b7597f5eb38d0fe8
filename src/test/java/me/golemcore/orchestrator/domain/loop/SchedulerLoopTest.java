package me.golemcore.orchestrator.domain.loop;

import me.golemcore.orchestrator.domain.model.AgentInvitation;
import me.golemcore.orchestrator.domain.model.Completion;
import me.golemcore.orchestrator.domain.model.CompletionKind;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.domain.model.OrchestratorEvent;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionMessage;
import me.golemcore.orchestrator.domain.model.SessionState;
import me.golemcore.orchestrator.port.outbound.AgentWorkPort;
import me.golemcore.orchestrator.testsupport.OrchestratorFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SchedulerLoopTest {

    private OrchestratorFixture fixture;
    private AgentWorkPort agentWorkPort;
    private SchedulerLoop loop;

    @BeforeEach
    void setUp() {
        fixture = new OrchestratorFixture();
        fixture.properties.getScheduler().setMaxConcurrentRunning(2);
        fixture.properties.getScheduler().setToolTimeoutSeconds(30);
        fixture.properties.getScheduler().setHumanInputTimeoutSeconds(60);
        agentWorkPort = mock(AgentWorkPort.class);
        loop = new SchedulerLoop(fixture.properties, fixture.store, fixture.stateMachine, fixture.lifecycle,
                fixture.recovery, fixture.completions, agentWorkPort, fixture.clock);
        fixture.registry.createChannel("general", null);
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    private Session invite(String template) {
        Session session = fixture.lifecycle.invite(AgentInvitation.builder()
                .channel("general")
                .template(template)
                .build());
        fixture.clock.advance(Duration.ofMillis(10));
        return session;
    }

    private Session inState(SessionState state) {
        Session session = invite("worker");
        fixture.stateMachine.transition(session, SessionState.RUNNING, Map.of());
        if (state != SessionState.RUNNING) {
            fixture.stateMachine.transition(session, state, Map.of());
        }
        return session;
    }

    private void complete(Session session, CompletionKind kind, Map<String, Object> payload) {
        fixture.completions.submit(Completion.builder()
                .sessionId(session.getId())
                .kind(kind)
                .payload(payload)
                .receivedAt(fixture.clock.instant())
                .build());
    }

    // ==================== admission ====================

    @Test
    void admitsPendingSessionsOldestFirstUpToLimit() {
        Session first = invite("a");
        Session second = invite("b");
        Session third = invite("c");

        loop.tick();

        assertEquals(SessionState.RUNNING, first.getState());
        assertEquals(SessionState.RUNNING, second.getState());
        assertEquals(SessionState.PENDING, third.getState());
        verify(agentWorkPort).requestWork(first);
        verify(agentWorkPort).requestWork(second);
        verify(agentWorkPort, never()).requestWork(third);
    }

    @Test
    void admitsNextPendingWhenSlotFrees() {
        Session first = invite("a");
        invite("b");
        Session third = invite("c");
        loop.tick();

        complete(first, CompletionKind.AGENT_FINISHED, Map.of());
        loop.tick();

        assertEquals(SessionState.SUCCESS, first.getState());
        assertEquals(SessionState.RUNNING, third.getState());
    }

    @Test
    void humanInputDoesNotOccupyASlot() {
        inState(SessionState.HUMAN_INPUT);
        inState(SessionState.HUMAN_INPUT);
        Session pending = invite("c");

        loop.tick();

        assertEquals(SessionState.RUNNING, pending.getState());
    }

    @Test
    void toolExecOccupiesASlot() {
        inState(SessionState.TOOL_EXEC);
        inState(SessionState.RUNNING);
        Session pending = invite("c");

        loop.tick();

        assertEquals(SessionState.PENDING, pending.getState());
    }

    // ==================== timeouts ====================

    @Test
    void toolExecTimeoutFailsSessionWithReason() {
        Session session = inState(SessionState.TOOL_EXEC);
        fixture.clock.advance(Duration.ofSeconds(31));

        loop.tick();

        assertEquals(SessionState.FAILED, session.getState());
        assertEquals("timeout", session.getStateData().get("reason"));
        assertEquals("tool_exec", session.getStateData().get("timed_out_state"));
        assertTrue((Long) session.getStateData().get("elapsed_ms") >= 31_000L);
        OrchestratorEvent event = fixture.broadcaster.recent(1).get(0);
        assertEquals(EventType.STATE_CHANGED, event.type());
        assertEquals(SessionState.FAILED, event.payload().get("new_state"));
    }

    @Test
    void sessionWithinThresholdIsNotFailed() {
        Session session = inState(SessionState.TOOL_EXEC);
        fixture.clock.advance(Duration.ofSeconds(29));

        loop.tick();

        assertEquals(SessionState.TOOL_EXEC, session.getState());
    }

    @Test
    void perSessionThresholdOverridesDefault() {
        Session session = inState(SessionState.HUMAN_INPUT);
        session.setHumanInputTimeoutSeconds(5L);
        fixture.clock.advance(Duration.ofSeconds(6));

        loop.tick();

        assertEquals(SessionState.FAILED, session.getState());
        assertEquals("human_input", session.getStateData().get("timed_out_state"));
    }

    @Test
    void completionWinsOverTimeoutOnTheSameTick() {
        Session session = inState(SessionState.TOOL_EXEC);
        fixture.clock.advance(Duration.ofSeconds(31));
        complete(session, CompletionKind.TOOL_RESULT, Map.of("output", "ok"));

        loop.tick();

        assertEquals(SessionState.RUNNING, session.getState());
        assertEquals("ok", session.getStateData().get("output"));
    }

    // ==================== completions ====================

    @Test
    void appliesAtMostOneCompletionPerSessionPerTick() {
        Session session = inState(SessionState.RUNNING);
        complete(session, CompletionKind.TOOL_CALL, Map.of("tool", "shell"));
        complete(session, CompletionKind.TOOL_RESULT, Map.of("output", "done"));

        loop.tick();
        assertEquals(SessionState.TOOL_EXEC, session.getState());
        assertEquals(1, loop.deferredCount());

        loop.tick();
        assertEquals(SessionState.RUNNING, session.getState());
        assertEquals(0, loop.deferredCount());
    }

    @Test
    void returningToRunningRequestsMoreWork() {
        Session session = inState(SessionState.TOOL_EXEC);
        complete(session, CompletionKind.TOOL_RESULT, Map.of());

        loop.tick();

        verify(agentWorkPort).requestWork(session);
    }

    @Test
    void completionsForPausedSessionWaitForResume() {
        Session session = inState(SessionState.TOOL_EXEC);
        fixture.lifecycle.pause(session.getId());
        complete(session, CompletionKind.TOOL_RESULT, Map.of());

        loop.tick();
        assertEquals(SessionState.PAUSED, session.getState());
        assertEquals(1, loop.deferredCount());

        fixture.lifecycle.resume(session.getId());
        loop.tick();
        assertEquals(SessionState.RUNNING, session.getState());
    }

    @Test
    void pausedWaitingSessionDoesNotTimeOut() {
        Session session = inState(SessionState.TOOL_EXEC);
        fixture.lifecycle.pause(session.getId());
        fixture.clock.advance(Duration.ofMinutes(10));

        loop.tick();

        assertEquals(SessionState.PAUSED, session.getState());
    }

    @Test
    void completionForStoppedSessionIsDropped() {
        Session session = inState(SessionState.TOOL_EXEC);
        fixture.lifecycle.stop(session.getId());
        complete(session, CompletionKind.TOOL_RESULT, Map.of());

        loop.tick();

        assertEquals(SessionState.STOPPED, session.getState());
        assertEquals(0, loop.deferredCount());
    }

    @Test
    void completionForDeletedSessionIsDropped() {
        Session session = inState(SessionState.RUNNING);
        complete(session, CompletionKind.AGENT_FINISHED, Map.of());
        fixture.lifecycle.delete(session.getId());

        loop.tick();

        assertEquals(0, loop.deferredCount());
        assertFalse(fixture.store.find(session.getId()).isPresent());
    }

    @Test
    void completionFromWrongStateIsDropped() {
        Session session = inState(SessionState.RUNNING);
        complete(session, CompletionKind.TOOL_RESULT, Map.of());

        loop.tick();

        assertEquals(SessionState.RUNNING, session.getState());
        assertEquals(0, loop.deferredCount());
    }

    @Test
    void agentMessageIsRecordedAndBroadcast() {
        Session session = inState(SessionState.RUNNING);
        complete(session, CompletionKind.AGENT_MESSAGE, Map.of("content", "Working on it"));

        loop.tick();

        SessionMessage last = session.getMessages().get(session.getMessages().size() - 1);
        assertEquals(SessionMessage.ROLE_AGENT, last.getRole());
        assertEquals("Working on it", last.getContent());
        List<EventType> types = fixture.broadcaster.recent(100).stream().map(OrchestratorEvent::type).toList();
        assertTrue(types.contains(EventType.MESSAGE_AGENT));
    }

    @Test
    void failedWriteKeepsCompletionForNextTick() {
        Session session = inState(SessionState.RUNNING);
        complete(session, CompletionKind.AGENT_FINISHED, Map.of());
        fixture.storage.setFailWrites(true);

        loop.tick();
        assertEquals(SessionState.RUNNING, session.getState());
        assertEquals(1, loop.deferredCount());

        fixture.storage.setFailWrites(false);
        loop.tick();
        assertEquals(SessionState.SUCCESS, session.getState());
    }

    @Test
    void failingWorkRequestDoesNotStopTheTick() {
        Session first = invite("a");
        Session second = invite("b");
        doThrow(new IllegalStateException("runtime down")).when(agentWorkPort).requestWork(first);

        loop.tick();

        assertEquals(SessionState.RUNNING, first.getState());
        assertEquals(SessionState.RUNNING, second.getState());
        verify(agentWorkPort).requestWork(second);
    }

    // ==================== thread model ====================

    @Test
    void submitBeforeInitFails() {
        CompletableFuture<String> result = loop.submit(() -> "x");

        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void submitRunsOnTheSchedulerThread() throws Exception {
        fixture.properties.getScheduler().setEnabled(false);
        loop.init();

        String thread = loop.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

        assertEquals("orchestrator-scheduler", thread);
    }

    @Test
    void submitPropagatesTaskFailure() {
        fixture.properties.getScheduler().setEnabled(false);
        loop.init();

        CompletableFuture<Object> result = loop.submit(() -> {
            throw new IllegalArgumentException("bad");
        });

        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void runningTicksAdmitPendingSessions() throws Exception {
        fixture.properties.getScheduler().setTickIntervalMillis(10);
        loop.init();
        Session session = loop.submit(() -> invite("a")).get(5, TimeUnit.SECONDS);

        SessionState state = SessionState.PENDING;
        for (int i = 0; i < 200 && state != SessionState.RUNNING; i++) {
            Thread.sleep(10);
            state = loop.submit(session::getState).get(5, TimeUnit.SECONDS);
        }

        assertEquals(SessionState.RUNNING, state);
        verify(agentWorkPort, atLeastOnce()).requestWork(any());
    }
}
