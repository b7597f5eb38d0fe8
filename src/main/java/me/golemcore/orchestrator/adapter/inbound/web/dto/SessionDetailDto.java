package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionMessage;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionDetailDto {
    private SessionSummaryDto session;
    private Long toolTimeoutSeconds;
    private Long humanInputTimeoutSeconds;
    private List<MessageDto> messages;

    public static SessionDetailDto from(Session session) {
        List<SessionMessage> history = session.getMessages() != null ? session.getMessages() : List.of();
        return SessionDetailDto.builder()
                .session(SessionSummaryDto.from(session))
                .toolTimeoutSeconds(session.getToolTimeoutSeconds())
                .humanInputTimeoutSeconds(session.getHumanInputTimeoutSeconds())
                .messages(history.stream()
                        .map(message -> MessageDto.builder()
                                .role(message.getRole())
                                .content(message.getContent())
                                .timestamp(message.getTimestamp() != null ? message.getTimestamp().toString() : null)
                                .build())
                        .toList())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageDto {
        private String role;
        private String content;
        private String timestamp;
    }
}
