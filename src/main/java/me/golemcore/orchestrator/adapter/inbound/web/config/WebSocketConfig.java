package me.golemcore.orchestrator.adapter.inbound.web.config;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.adapter.inbound.web.WebSocketOrchestratorHandler;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * WebFlux WebSocket configuration for the orchestrator protocol endpoint.
 */
@Configuration
@RequiredArgsConstructor
public class WebSocketConfig {

    private final WebSocketOrchestratorHandler webSocketOrchestratorHandler;
    private final OrchestratorProperties properties;

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping();
        mapping.setUrlMap(Map.of(properties.getWebsocket().getPath(), webSocketOrchestratorHandler));
        mapping.setOrder(-1);
        return mapping;
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
