package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.model.SessionState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {
    private SessionId id;
    private String name;
    private String mention;
    private String template;
    private String channel;
    private SessionState state;
    private SessionState resumeState;
    private Map<String, Object> stateData;
    private int messageCount;
    private Instant createdAt;
    private Instant updatedAt;

    public static SessionSummaryDto from(Session session) {
        return SessionSummaryDto.builder()
                .id(session.getId())
                .name(session.getName())
                .mention(session.getMention())
                .template(session.getTemplate())
                .channel(session.getChannel())
                .state(session.getState())
                .resumeState(session.getResumeState())
                .stateData(session.getStateData() != null ? new LinkedHashMap<>(session.getStateData()) : Map.of())
                .messageCount(session.getMessages() != null ? session.getMessages().size() : 0)
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}
