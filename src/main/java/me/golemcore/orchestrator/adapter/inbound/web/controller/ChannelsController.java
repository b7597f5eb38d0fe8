package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ChannelDto;
import me.golemcore.orchestrator.domain.loop.SchedulerLoop;
import me.golemcore.orchestrator.domain.service.SessionLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only channel endpoints.
 */
@RestController
@RequestMapping("/api/channels")
@RequiredArgsConstructor
public class ChannelsController {

    private final SchedulerLoop schedulerLoop;
    private final SessionLifecycleService lifecycleService;

    @GetMapping
    public Mono<ResponseEntity<List<ChannelDto>>> listChannels() {
        return Mono.fromFuture(() -> schedulerLoop.submit(() -> lifecycleService.listChannels().stream()
                .map(ChannelDto::from)
                .toList()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<ChannelDto>> getChannel(@PathVariable String name) {
        return Mono.fromFuture(() -> schedulerLoop.submit(() -> ChannelDto.from(lifecycleService.getChannel(name))))
                .map(ResponseEntity::ok);
    }
}
