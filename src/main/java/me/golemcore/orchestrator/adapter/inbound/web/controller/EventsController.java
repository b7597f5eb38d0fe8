package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.adapter.inbound.web.OutboundMessageMapper;
import me.golemcore.orchestrator.domain.service.EventBroadcaster;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Tail of the event history.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventsController {

    private final EventBroadcaster eventBroadcaster;
    private final OutboundMessageMapper messageMapper;

    @GetMapping
    public Mono<ResponseEntity<List<Map<String, Object>>>> listEvents(
            @RequestParam(defaultValue = "100") int limit) {
        List<Map<String, Object>> events = eventBroadcaster.recent(limit).stream()
                .map(messageMapper::eventData)
                .toList();
        return Mono.just(ResponseEntity.ok(events));
    }
}
