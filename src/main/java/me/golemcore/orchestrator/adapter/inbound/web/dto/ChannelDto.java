package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.orchestrator.domain.model.Channel;
import me.golemcore.orchestrator.domain.model.SessionId;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelDto {
    private String name;
    private String description;
    private Map<String, String> labels;
    private List<SessionId> sessionIds;
    private Instant createdAt;
    private Instant updatedAt;

    public static ChannelDto from(Channel channel) {
        return ChannelDto.builder()
                .name(channel.getName())
                .description(channel.getDescription())
                .labels(Map.copyOf(channel.getLabels()))
                .sessionIds(List.copyOf(channel.getSessionIds()))
                .createdAt(channel.getCreatedAt())
                .updatedAt(channel.getUpdatedAt())
                .build();
    }
}
