package me.golemcore.orchestrator.adapter.inbound.web.controller;

import me.golemcore.orchestrator.adapter.inbound.web.OutboundMessageMapper;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.testsupport.OrchestratorFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

import reactor.test.StepVerifier;

class EventsControllerTest {

    private OrchestratorFixture fixture;
    private EventsController controller;

    @BeforeEach
    void setUp() {
        fixture = new OrchestratorFixture();
        controller = new EventsController(fixture.broadcaster, new OutboundMessageMapper(fixture.objectMapper));
        for (int i = 0; i < 5; i++) {
            fixture.broadcaster.publish(EventType.CHANNEL_CREATED, null, "c" + i, Map.of("name", "c" + i));
        }
    }

    @Test
    void shouldReturnMostRecentEventsOldestFirst() {
        StepVerifier.create(controller.listEvents(2))
                .assertNext(response -> {
                    List<Map<String, Object>> body = response.getBody();
                    assertEquals(2, body.size());
                    assertEquals(4L, body.get(0).get("seq"));
                    assertEquals(5L, body.get(1).get("seq"));
                    assertEquals("c4", body.get(1).get("channel"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnEverythingWhenLimitExceedsHistory() {
        StepVerifier.create(controller.listEvents(100))
                .assertNext(response -> assertEquals(5, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldTreatNegativeLimitAsEmpty() {
        StepVerifier.create(controller.listEvents(-1))
                .assertNext(response -> assertEquals(0, response.getBody().size()))
                .verifyComplete();
    }
}
