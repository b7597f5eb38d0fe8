package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome reported by an external tool runner, human or agent runtime.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {
    private String kind;
    private Map<String, Object> payload;
}
