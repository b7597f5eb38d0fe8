package me.golemcore.orchestrator.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ChannelDto;
import me.golemcore.orchestrator.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.orchestrator.domain.exception.ErrorCode;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.domain.model.OrchestratorEvent;
import me.golemcore.orchestrator.domain.model.OrchestratorSnapshot;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the JSON frames sent to protocol clients.
 *
 * <p>
 * {@code state:changed} events are sent flat so observers can track session
 * state without unwrapping; every other event is wrapped as
 * {@code {"type":"event","channel":...,"data":{...}}}.
 */
@Component
@RequiredArgsConstructor
public class OutboundMessageMapper {

    private static final String TYPE = "type";
    private static final String REQUEST_ID = "request_id";

    private final ObjectMapper objectMapper;

    public String init(OrchestratorSnapshot snapshot, List<OrchestratorEvent> history) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(TYPE, "init");
        message.put("channels", snapshot.channels().stream().map(ChannelDto::from).toList());
        message.put("sessions", snapshot.sessions().stream().map(SessionSummaryDto::from).toList());
        message.put("events", history.stream().map(this::eventData).toList());
        return write(message);
    }

    public String event(OrchestratorEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        if (event.type() == EventType.STATE_CHANGED) {
            message.put(TYPE, EventType.STATE_CHANGED.getWireName());
            message.put("seq", event.seq());
            message.put("session_id", event.sessionId());
            message.put("old_state", event.payload().get("old_state"));
            message.put("new_state", event.payload().get("new_state"));
            message.put("channel", event.channel());
            message.put("state_data", event.payload().get("state_data"));
            message.put("timestamp", event.timestamp());
        } else {
            message.put(TYPE, "event");
            message.put("channel", event.channel());
            message.put("data", eventData(event));
        }
        return write(message);
    }

    public Map<String, Object> eventData(OrchestratorEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seq", event.seq());
        data.put(TYPE, event.type());
        data.put("timestamp", event.timestamp());
        data.put("session_id", event.sessionId());
        data.put("channel", event.channel());
        data.put("payload", event.payload());
        return data;
    }

    public String ack(JsonNode requestId, String op, Object result) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(TYPE, "ack");
        message.put(REQUEST_ID, requestId);
        message.put("op", op);
        message.put("ok", true);
        message.put("result", result);
        return write(message);
    }

    public String error(JsonNode requestId, String op, ErrorCode code, String text) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(TYPE, "error");
        message.put(REQUEST_ID, requestId);
        message.put("op", op);
        message.put("ok", false);
        message.put("code", code);
        message.put("message", text);
        return write(message);
    }

    public String pong(JsonNode requestId) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(TYPE, "pong");
        message.put(REQUEST_ID, requestId);
        return write(message);
    }

    private String write(Map<String, Object> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
