package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.dto.CompletionAcceptedResponse;
import me.golemcore.orchestrator.adapter.inbound.web.dto.CompletionRequest;
import me.golemcore.orchestrator.adapter.inbound.web.dto.SessionDetailDto;
import me.golemcore.orchestrator.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.orchestrator.domain.loop.CompletionQueue;
import me.golemcore.orchestrator.domain.loop.SchedulerLoop;
import me.golemcore.orchestrator.domain.model.Completion;
import me.golemcore.orchestrator.domain.model.CompletionKind;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.service.SessionLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Session browser endpoints and the completion callback used by tool runners
 * and agent runtimes.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private final SchedulerLoop schedulerLoop;
    private final SessionLifecycleService lifecycleService;
    private final CompletionQueue completionQueue;
    private final Clock clock;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions(
            @RequestParam(required = false) String channel) {
        return Mono.fromFuture(() -> schedulerLoop.submit(() -> lifecycleService.listSessions(channel).stream()
                .map(SessionSummaryDto::from)
                .toList()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionDetailDto>> getSession(@PathVariable String id) {
        SessionId sessionId = SessionId.parse(id);
        return Mono.fromFuture(() -> schedulerLoop.submit(
                () -> SessionDetailDto.from(lifecycleService.getSession(sessionId))))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/completions")
    public Mono<ResponseEntity<CompletionAcceptedResponse>> submitCompletion(@PathVariable String id,
            @RequestBody CompletionRequest request) {
        SessionId sessionId = SessionId.parse(id);
        if (request == null || request.getKind() == null || request.getKind().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "kind is required");
        }
        CompletionKind kind = CompletionKind.fromWireName(request.getKind());
        Map<String, Object> payload = request.getPayload() != null ? request.getPayload() : Map.of();

        return Mono.fromFuture(() -> schedulerLoop.submit(() -> {
            lifecycleService.getSession(sessionId);
            completionQueue.submit(Completion.builder()
                    .sessionId(sessionId)
                    .kind(kind)
                    .payload(payload)
                    .receivedAt(clock.instant())
                    .build());
            return new CompletionAcceptedResponse(sessionId, kind.getWireName(), completionQueue.size());
        }))
                .doOnNext(accepted -> log.debug("[API] Accepted {} for session {}", accepted.kind(), sessionId))
                .map(accepted -> ResponseEntity.status(HttpStatus.ACCEPTED).body(accepted));
    }
}
