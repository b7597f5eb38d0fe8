package me.golemcore.orchestrator.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.loop.SchedulerLoop;
import me.golemcore.orchestrator.domain.model.OrchestratorSnapshot;
import me.golemcore.orchestrator.domain.model.SubscriptionSnapshot;
import me.golemcore.orchestrator.domain.service.EventBroadcaster;
import me.golemcore.orchestrator.domain.service.SessionLifecycleService;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Real-time protocol endpoint.
 *
 * <p>
 * On connect the client receives one {@code init} frame (channels, sessions
 * and recent events) followed by every new event. Inbound frames are control
 * operations; their replies are interleaved with the event stream. A client
 * that cannot keep up with the event stream is disconnected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketOrchestratorHandler implements WebSocketHandler {

    private final EventBroadcaster eventBroadcaster;
    private final SessionLifecycleService lifecycleService;
    private final SchedulerLoop schedulerLoop;
    private final ControlOperationDispatcher dispatcher;
    private final OutboundMessageMapper messageMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = session.getId();
        log.info("[WS] Connection established: {}", connectionId);

        Sinks.Many<String> replies = Sinks.many().unicast().onBackpressureBuffer();

        Flux<String> events = Mono.fromFuture(() -> schedulerLoop.submit(this::open))
                .flatMapMany(opened -> Flux.concat(
                        Mono.fromCallable(() -> messageMapper.init(opened.state(), opened.subscription().history())),
                        opened.subscription().live().map(messageMapper::event))
                        .doFinally(signal -> eventBroadcaster.unsubscribe(opened.subscription().subscriberId())))
                .onErrorResume(e -> {
                    log.warn("[WS] Event stream for {} terminated: {}", connectionId, e.getMessage());
                    return session.close(CloseStatus.GOING_AWAY).thenMany(Flux.<String>empty());
                });

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(dispatcher::dispatch)
                .doOnNext(replies::tryEmitNext)
                .then();

        Flux<WebSocketMessage> outbound = Flux.merge(events, replies.asFlux())
                .map(session::textMessage);

        return session.send(outbound)
                .and(inbound)
                .doFinally(signal -> log.info("[WS] Connection closed: {}, signal={}", connectionId, signal));
    }

    private OpenedStream open() {
        return new OpenedStream(lifecycleService.snapshot(), eventBroadcaster.subscribe());
    }

    /**
     * State and subscription taken together on the scheduler thread, so no
     * mutation falls between them.
     */
    private record OpenedStream(OrchestratorSnapshot state, SubscriptionSnapshot subscription) {
    }
}
