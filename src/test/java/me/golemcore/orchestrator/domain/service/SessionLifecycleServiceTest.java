package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.exception.ErrorCode;
import me.golemcore.orchestrator.domain.exception.InvalidTransitionException;
import me.golemcore.orchestrator.domain.exception.NotFoundException;
import me.golemcore.orchestrator.domain.exception.OrchestrationException;
import me.golemcore.orchestrator.domain.exception.PersistenceFailureException;
import me.golemcore.orchestrator.domain.exception.StaleReferenceException;
import me.golemcore.orchestrator.domain.model.AgentInvitation;
import me.golemcore.orchestrator.domain.model.Completion;
import me.golemcore.orchestrator.domain.model.CompletionKind;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.domain.model.OrchestratorEvent;
import me.golemcore.orchestrator.domain.model.OrchestratorSnapshot;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.model.SessionMessage;
import me.golemcore.orchestrator.domain.model.SessionState;
import me.golemcore.orchestrator.testsupport.OrchestratorFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionLifecycleServiceTest {

    private OrchestratorFixture fixture;
    private SessionLifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        fixture = new OrchestratorFixture();
        lifecycle = fixture.lifecycle;
        lifecycle.createChannel("general", "Main room");
    }

    private Session invite(String name) {
        return lifecycle.invite(AgentInvitation.builder()
                .channel("general")
                .template("coder")
                .name(name)
                .build());
    }

    private List<EventType> eventTypes() {
        return fixture.broadcaster.recent(1000).stream().map(OrchestratorEvent::type).toList();
    }

    // ==================== invite ====================

    @Test
    void inviteCreatesPendingSessionInChannel() {
        Session session = invite("alice");

        assertEquals(SessionState.PENDING, session.getState());
        assertEquals("general", session.getChannel());
        assertEquals("alice", session.getName());
        assertEquals("coder", session.getTemplate());
        assertEquals(List.of(session.getId()), fixture.registry.getSessionIds("general"));
        assertTrue(fixture.storage.contains("sessions", session.getId() + ".json"));

        SessionMessage prompt = session.getMessages().get(0);
        assertEquals(SessionMessage.ROLE_USER, prompt.getRole());
        assertEquals("You have been invited to the channel", prompt.getContent());
        assertTrue(eventTypes().containsAll(List.of(EventType.AGENT_INVITED, EventType.STATE_CHANGED)));
    }

    @Test
    void inviteDefaultsNameToTemplate() {
        Session session = lifecycle.invite(AgentInvitation.builder()
                .channel("general")
                .template("reviewer")
                .prompt("Review the open pull requests")
                .build());

        assertEquals("reviewer", session.getName());
        assertEquals("Review the open pull requests", session.getMessages().get(0).getContent());
        assertEquals("@reviewer#" + session.getId(), session.getMention());
    }

    @Test
    void inviteIntoUnknownChannelFails() {
        AgentInvitation invitation = AgentInvitation.builder().channel("nowhere").template("coder").build();

        assertThrows(NotFoundException.class, () -> lifecycle.invite(invitation));
        assertEquals(0, fixture.allocator.getLiveCount());
    }

    @Test
    void inviteWithoutTemplateIsBadRequest() {
        AgentInvitation invitation = AgentInvitation.builder().channel("general").build();

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> lifecycle.invite(invitation));
        assertEquals(ErrorCode.BAD_REQUEST, error.getCode());
    }

    @Test
    void failedInviteLeavesNothingBehind() {
        fixture.storage.setFailWrites(true);

        assertThrows(PersistenceFailureException.class, () -> invite("alice"));

        assertEquals(0, fixture.allocator.getLiveCount());
        assertEquals(0, fixture.store.size());
        assertTrue(fixture.registry.getSessionIds("general").isEmpty());
    }

    @Test
    void inviteWhoseChannelWriteFailsBroadcastsNothing() {
        int events = fixture.broadcaster.recent(1000).size();
        fixture.storage.setFailWritesIn("channels");

        assertThrows(PersistenceFailureException.class, () -> invite("alice"));

        assertEquals(events, fixture.broadcaster.recent(1000).size());
        assertEquals(0, fixture.allocator.getLiveCount());
        assertEquals(0, fixture.store.size());
        assertTrue(fixture.registry.getSessionIds("general").isEmpty());
        assertTrue(fixture.storage.listObjects("sessions").join().isEmpty());
    }

    @Test
    void inviteWritesPendingRecordAndPublishesAfterCommit() throws Exception {
        int before = fixture.broadcaster.recent(1000).size();

        Session session = invite("alice");

        Session stored = fixture.objectMapper.readValue(
                fixture.storage.read("sessions", session.getId() + ".json"), Session.class);
        assertEquals(SessionState.PENDING, stored.getState());
        assertEquals(1, stored.getMessages().size());

        List<OrchestratorEvent> published = fixture.broadcaster.recent(1000);
        List<EventType> types = published.subList(before, published.size()).stream()
                .map(OrchestratorEvent::type)
                .toList();
        assertEquals(List.of(EventType.SESSION_ADDED, EventType.AGENT_INVITED, EventType.STATE_CHANGED), types);
        assertEquals("general", published.get(published.size() - 1).channel());
    }

    // ==================== messages ====================

    @Test
    void submitResolvesEveryMentionForm() {
        Session session = invite("alice");
        String id = session.getId().toString();

        for (String mention : List.of("@alice#" + id, "alice#" + id, "#" + id, id, "alice", "ALICE")) {
            assertSame(session, lifecycle.submitMessage("general", mention, "hi"));
        }
        assertEquals(7, session.getMessages().size());
    }

    @Test
    void ambiguousNameIsRejected() {
        invite("alice");
        invite("alice");

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> lifecycle.submitMessage("general", "alice", "hi"));
        assertEquals(ErrorCode.BAD_REQUEST, error.getCode());
    }

    @Test
    void mentionOfSessionInAnotherChannelIsNotFound() {
        Session session = invite("alice");
        lifecycle.createChannel("other", null);

        assertThrows(NotFoundException.class,
                () -> lifecycle.submitMessage("other", "#" + session.getId(), "hi"));
    }

    @Test
    void mentionWithWrongNameIsNotFound() {
        Session session = invite("alice");

        assertThrows(NotFoundException.class,
                () -> lifecycle.submitMessage("general", "@bob#" + session.getId(), "hi"));
    }

    @Test
    void submitRecordsAndBroadcastsUserMessage() {
        Session session = invite("alice");

        lifecycle.submitMessage("general", "alice", "Please fix the build");

        SessionMessage last = session.getMessages().get(session.getMessages().size() - 1);
        assertEquals("Please fix the build", last.getContent());
        OrchestratorEvent event = fixture.broadcaster.recent(1).get(0);
        assertEquals(EventType.MESSAGE_USER, event.type());
        assertEquals("general", event.channel());
        assertEquals("@alice#" + session.getId(), event.payload().get("agent"));
    }

    @Test
    void submitToHumanInputQueuesResponse() {
        Session session = invite("alice");
        fixture.stateMachine.transition(session, SessionState.RUNNING, Map.of());
        fixture.stateMachine.transition(session, SessionState.HUMAN_INPUT, Map.of());

        lifecycle.submitMessage("general", "alice", "yes, go ahead");

        List<Completion> queued = fixture.completions.drain();
        assertEquals(1, queued.size());
        assertEquals(CompletionKind.HUMAN_RESPONSE, queued.get(0).kind());
        assertEquals("yes, go ahead", queued.get(0).payload().get("content"));
        assertEquals(SessionState.HUMAN_INPUT, session.getState());
    }

    @Test
    void submitToRunningSessionDoesNotQueueCompletion() {
        Session session = invite("alice");
        fixture.stateMachine.transition(session, SessionState.RUNNING, Map.of());

        lifecycle.submitMessage("general", "alice", "status?");

        assertEquals(0, fixture.completions.size());
        assertEquals(SessionState.RUNNING, session.getState());
    }

    @Test
    void submitToFinishedSessionIsRejected() {
        Session session = invite("alice");
        fixture.stateMachine.transition(session, SessionState.RUNNING, Map.of());
        fixture.stateMachine.transition(session, SessionState.SUCCESS, Map.of());
        int messages = session.getMessages().size();

        assertThrows(InvalidTransitionException.class,
                () -> lifecycle.submitMessage("general", "alice", "one more thing"));
        assertEquals(messages, session.getMessages().size());
    }

    @Test
    void blankMessageIsBadRequest() {
        invite("alice");

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> lifecycle.submitMessage("general", "alice", "  "));
        assertEquals(ErrorCode.BAD_REQUEST, error.getCode());
    }

    @Test
    void failedMessageWriteIsRolledBack() {
        Session session = invite("alice");
        int messages = session.getMessages().size();
        fixture.storage.setFailWrites(true);

        assertThrows(PersistenceFailureException.class,
                () -> lifecycle.submitMessage("general", "alice", "hello"));
        assertEquals(messages, session.getMessages().size());
    }

    // ==================== control ====================

    @Test
    void pauseAndResumeReturnToPriorState() {
        Session session = invite("alice");
        fixture.stateMachine.transition(session, SessionState.RUNNING, Map.of());
        fixture.stateMachine.transition(session, SessionState.TOOL_EXEC, Map.of());

        lifecycle.pause(session.getId());
        assertEquals(SessionState.PAUSED, session.getState());
        assertEquals(SessionState.TOOL_EXEC, session.getResumeState());

        lifecycle.resume(session.getId());
        assertEquals(SessionState.TOOL_EXEC, session.getState());
    }

    @Test
    void resumeOfSessionThatIsNotPausedFails() {
        Session session = invite("alice");

        assertThrows(InvalidTransitionException.class, () -> lifecycle.resume(session.getId()));
    }

    @Test
    void stopIsIdempotent() {
        Session session = invite("alice");

        lifecycle.stop(session.getId());
        int events = fixture.broadcaster.recent(1000).size();
        lifecycle.stop(session.getId());

        assertEquals(SessionState.STOPPED, session.getState());
        assertEquals(events, fixture.broadcaster.recent(1000).size());
        assertSame(session, lifecycle.getSession(session.getId()));
    }

    @Test
    void resumeAndPauseOfStoppedSessionAreNoOps() {
        Session session = invite("alice");
        lifecycle.stop(session.getId());
        int events = fixture.broadcaster.recent(1000).size();

        assertSame(session, lifecycle.resume(session.getId()));
        assertSame(session, lifecycle.pause(session.getId()));

        assertEquals(SessionState.STOPPED, session.getState());
        assertEquals(events, fixture.broadcaster.recent(1000).size());
    }

    @Test
    void resumeOfFinishedSessionFails() {
        Session session = invite("alice");
        fixture.stateMachine.transition(session, SessionState.RUNNING, Map.of());
        fixture.stateMachine.transition(session, SessionState.SUCCESS, Map.of());

        assertThrows(InvalidTransitionException.class, () -> lifecycle.resume(session.getId()));
    }

    @Test
    void failedRecordDeleteLeavesSessionUntouched() {
        Session session = invite("alice");
        SessionId id = session.getId();
        int events = fixture.broadcaster.recent(1000).size();
        fixture.storage.setFailDeletes(true);

        assertThrows(PersistenceFailureException.class, () -> lifecycle.delete(id));

        assertEquals(SessionState.PENDING, session.getState());
        assertEquals("general", session.getChannel());
        assertEquals(List.of(id), fixture.registry.getSessionIds("general"));
        assertTrue(fixture.storage.contains("sessions", id + ".json"));
        assertEquals(events, fixture.broadcaster.recent(1000).size());
        assertSame(session, lifecycle.getSession(id));
    }

    @Test
    void failedChannelWriteDuringDeleteRestoresRecord() throws Exception {
        Session session = invite("alice");
        SessionId id = session.getId();
        int events = fixture.broadcaster.recent(1000).size();
        fixture.storage.setFailWritesIn("channels");

        assertThrows(PersistenceFailureException.class, () -> lifecycle.delete(id));

        assertEquals(SessionState.PENDING, session.getState());
        assertEquals(List.of(id), fixture.registry.getSessionIds("general"));
        Session stored = fixture.objectMapper.readValue(fixture.storage.read("sessions", id + ".json"),
                Session.class);
        assertEquals(SessionState.PENDING, stored.getState());
        assertEquals(events, fixture.broadcaster.recent(1000).size());

        fixture.storage.setFailWritesIn(null);
        lifecycle.delete(id);
        assertThrows(StaleReferenceException.class, () -> lifecycle.getSession(id));
    }

    @Test
    void deleteFreesIdAndLeavesStaleReference() {
        Session session = invite("alice");
        SessionId id = session.getId();

        lifecycle.delete(id);

        assertEquals(SessionState.STOPPED, session.getState());
        assertFalse(fixture.storage.contains("sessions", id + ".json"));
        assertTrue(fixture.registry.getSessionIds("general").isEmpty());
        assertEquals(EventType.SESSION_DELETED, fixture.broadcaster.recent(1).get(0).type());
        assertThrows(StaleReferenceException.class, () -> lifecycle.getSession(id));
        assertThrows(StaleReferenceException.class, () -> lifecycle.stop(id));

        Session next = invite("bob");
        assertNotEquals(id, next.getId());
        assertThrows(StaleReferenceException.class, () -> lifecycle.getSession(id));
    }

    @Test
    void unknownIdIsNotFound() {
        assertThrows(NotFoundException.class, () -> lifecycle.getSession(new SessionId(42)));
    }

    // ==================== channels and reads ====================

    @Test
    void moveSessionBetweenChannels() {
        Session session = invite("alice");
        lifecycle.createChannel("ops", null);

        lifecycle.addToChannel("ops", session.getId());

        assertEquals("ops", session.getChannel());
        assertEquals(List.of(session), lifecycle.listSessions("ops"));
        assertTrue(lifecycle.listSessions("general").isEmpty());

        lifecycle.removeFromChannel("ops", session.getId());
        assertNull(session.getChannel());
        assertEquals(1, lifecycle.listSessions(null).size());
    }

    @Test
    void deleteChannelDetachesMembersWithoutStoppingThem() {
        Session session = invite("alice");

        List<SessionId> members = lifecycle.deleteChannel("general");

        assertEquals(List.of(session.getId()), members);
        assertNull(session.getChannel());
        assertEquals(SessionState.PENDING, session.getState());
        assertThrows(NotFoundException.class, () -> lifecycle.getChannel("general"));
    }

    @Test
    void snapshotListsChannelsAndSessions() {
        Session alice = invite("alice");
        Session bob = invite("bob");

        OrchestratorSnapshot snapshot = lifecycle.snapshot();

        assertEquals(1, snapshot.channels().size());
        assertEquals(List.of(alice, bob), snapshot.sessions());
    }
}
