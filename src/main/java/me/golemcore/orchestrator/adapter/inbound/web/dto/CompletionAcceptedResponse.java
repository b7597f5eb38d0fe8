package me.golemcore.orchestrator.adapter.inbound.web.dto;

import me.golemcore.orchestrator.domain.model.SessionId;

public record CompletionAcceptedResponse(SessionId sessionId, String kind, int queued) {
}
