package me.golemcore.orchestrator.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ChannelDto;
import me.golemcore.orchestrator.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.orchestrator.domain.exception.ErrorCode;
import me.golemcore.orchestrator.domain.exception.OrchestrationException;
import me.golemcore.orchestrator.domain.loop.SchedulerLoop;
import me.golemcore.orchestrator.domain.model.AgentInvitation;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.service.EventBroadcaster;
import me.golemcore.orchestrator.domain.service.SessionLifecycleService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Decodes inbound protocol frames and runs them on the scheduler thread.
 *
 * <p>
 * Every frame produces exactly one reply: an {@code ack} carrying the result,
 * an {@code error} carrying an {@link ErrorCode}, or a {@code pong}. The
 * optional {@code request_id} of the frame is echoed back. Errors never close
 * the connection.
 */
@Component
@Slf4j
public class ControlOperationDispatcher {

    private final ObjectMapper objectMapper;
    private final SessionLifecycleService lifecycleService;
    private final EventBroadcaster eventBroadcaster;
    private final SchedulerLoop schedulerLoop;
    private final OutboundMessageMapper messageMapper;
    private final Duration operationTimeout;

    public ControlOperationDispatcher(ObjectMapper objectMapper, SessionLifecycleService lifecycleService,
            EventBroadcaster eventBroadcaster, SchedulerLoop schedulerLoop, OutboundMessageMapper messageMapper,
            OrchestratorProperties properties) {
        this.objectMapper = objectMapper;
        this.lifecycleService = lifecycleService;
        this.eventBroadcaster = eventBroadcaster;
        this.schedulerLoop = schedulerLoop;
        this.messageMapper = messageMapper;
        this.operationTimeout = Duration.ofSeconds(Math.max(1, properties.getScheduler().getControlTimeoutSeconds()));
    }

    public Mono<String> dispatch(String frame) {
        JsonNode request;
        try {
            request = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.debug("[WS] Malformed frame: {}", e.getOriginalMessage());
            return Mono.just(messageMapper.error(null, null, ErrorCode.BAD_REQUEST, "Malformed JSON"));
        }
        if (request == null || !request.isObject()) {
            return Mono.just(messageMapper.error(null, null, ErrorCode.BAD_REQUEST, "Frame must be a JSON object"));
        }

        JsonNode requestId = request.get("request_id");
        String op = optionalText(request, "type");
        if (op == null) {
            return Mono.just(messageMapper.error(requestId, null, ErrorCode.BAD_REQUEST, "Missing operation type"));
        }
        if ("ping".equals(op)) {
            return Mono.just(messageMapper.pong(requestId));
        }

        Callable<Object> action;
        try {
            action = resolve(op, request);
        } catch (RuntimeException e) {
            return Mono.just(toError(requestId, op, e));
        }

        AtomicBoolean claimed = new AtomicBoolean();
        Callable<Object> task = () -> {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException(op + " was withdrawn after timing out");
            }
            return action.call();
        };
        return Mono.fromFuture(() -> schedulerLoop.submit(task))
                .timeout(operationTimeout)
                .map(result -> messageMapper.ack(requestId, op, result))
                .onErrorResume(TimeoutException.class,
                        e -> Mono.just(timedOut(requestId, op, claimed.compareAndSet(false, true))))
                .onErrorResume(e -> Mono.just(toError(requestId, op, e)));
    }

    /**
     * A timed-out operation that had not started is withdrawn and never runs.
     * One already running on the scheduler thread cannot be interrupted and may
     * still commit and broadcast its events.
     */
    private String timedOut(JsonNode requestId, String op, boolean withdrawn) {
        if (withdrawn) {
            log.warn("[WS] {} timed out after {} before it started, withdrawn", op, operationTimeout);
            return messageMapper.error(requestId, op, ErrorCode.INTERNAL, "Operation timed out and was not applied");
        }
        log.warn("[WS] {} timed out after {} while running", op, operationTimeout);
        return messageMapper.error(requestId, op, ErrorCode.INTERNAL,
                "Operation timed out while running and may still be applied");
    }

    private Callable<Object> resolve(String op, JsonNode request) {
        return switch (op) {
        case "channel:create" -> createChannel(request);
        case "channel:delete" -> deleteChannel(request);
        case "channel:add_agent" -> addAgent(request);
        case "channel:remove_agent" -> removeAgent(request);
        case "agent:invite" -> invite(request);
        case "agent:pause" -> sessionAction(request, lifecycleService::pause);
        case "agent:resume" -> sessionAction(request, lifecycleService::resume);
        case "agent:stop" -> sessionAction(request, lifecycleService::stop);
        case "agent:delete" -> deleteAgent(request);
        case "message:submit" -> submitMessage(request);
        case "events:clear" -> () -> Map.of("cleared", eventBroadcaster.clearHistory());
        default -> throw new OrchestrationException(ErrorCode.BAD_REQUEST, "Unknown operation: " + op);
        };
    }

    private Callable<Object> createChannel(JsonNode request) {
        String name = requiredText(request, "name");
        String description = optionalText(request, "description");
        return () -> ChannelDto.from(lifecycleService.createChannel(name, description));
    }

    private Callable<Object> deleteChannel(JsonNode request) {
        String name = requiredText(request, "name");
        return () -> {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("name", name);
            result.put("detached_session_ids", lifecycleService.deleteChannel(name));
            return result;
        };
    }

    private Callable<Object> addAgent(JsonNode request) {
        String channel = requiredText(request, "channel");
        SessionId id = sessionId(request);
        return () -> SessionSummaryDto.from(lifecycleService.addToChannel(channel, id));
    }

    private Callable<Object> removeAgent(JsonNode request) {
        String channel = requiredText(request, "channel");
        SessionId id = sessionId(request);
        return () -> SessionSummaryDto.from(lifecycleService.removeFromChannel(channel, id));
    }

    private Callable<Object> invite(JsonNode request) {
        AgentInvitation invitation = AgentInvitation.builder()
                .channel(requiredText(request, "channel"))
                .template(requiredText(request, "template"))
                .name(optionalText(request, "name"))
                .prompt(optionalText(request, "prompt"))
                .toolTimeoutSeconds(optionalLong(request, "tool_timeout_seconds"))
                .humanInputTimeoutSeconds(optionalLong(request, "human_input_timeout_seconds"))
                .build();
        return () -> SessionSummaryDto.from(lifecycleService.invite(invitation));
    }

    private Callable<Object> sessionAction(JsonNode request, Function<SessionId, Session> action) {
        SessionId id = sessionId(request);
        return () -> SessionSummaryDto.from(action.apply(id));
    }

    private Callable<Object> deleteAgent(JsonNode request) {
        SessionId id = sessionId(request);
        return () -> {
            lifecycleService.delete(id);
            return Map.of("session_id", id);
        };
    }

    private Callable<Object> submitMessage(JsonNode request) {
        String channel = requiredText(request, "channel");
        String agent = requiredText(request, "agent");
        String content = requiredText(request, "content");
        return () -> SessionSummaryDto.from(lifecycleService.submitMessage(channel, agent, content));
    }

    private String toError(JsonNode requestId, String op, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof OrchestrationException orchestrationException) {
            log.debug("[WS] {} rejected: {}", op, cause.getMessage());
            return messageMapper.error(requestId, op, orchestrationException.getCode(), cause.getMessage());
        }
        if (cause instanceof IllegalArgumentException) {
            return messageMapper.error(requestId, op, ErrorCode.BAD_REQUEST, cause.getMessage());
        }
        log.error("[WS] {} failed", op, cause);
        return messageMapper.error(requestId, op, ErrorCode.INTERNAL, "Internal error");
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private SessionId sessionId(JsonNode request) {
        return SessionId.parse(requiredText(request, "session_id"));
    }

    private String requiredText(JsonNode request, String field) {
        String value = optionalText(request, field);
        if (value == null || value.isBlank()) {
            throw new OrchestrationException(ErrorCode.BAD_REQUEST, "Missing field: " + field);
        }
        return value;
    }

    private String optionalText(JsonNode request, String field) {
        JsonNode node = request.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private Long optionalLong(JsonNode request, String field) {
        JsonNode node = request.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToLong() || node.asLong() <= 0) {
            throw new OrchestrationException(ErrorCode.BAD_REQUEST, field + " must be a positive number");
        }
        return node.asLong();
    }
}
