package com.agentdesk.agent.normalize;

import com.agentdesk.agent.usage.ModelUsage;
import com.agentdesk.agent.usage.TokenCounts;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final accounting of one query, built from its result message.
 *
 * @param subtype           backend result subtype
 * @param durationMs        backend duration, or elapsed time since the query started
 * @param costUsd           backend-reported cost, may be null
 * @param usage             token usage of the turn, never null
 * @param modelUsage        per-model context usage, empty when not reported
 * @param stopReason        backend stop reason, may be null
 * @param stopSequence      stop sequence that ended generation, may be null
 * @param requestId         backend request id, may be null
 * @param turnCount         turns the backend ran, may be null
 * @param permissionRequest pending tool-permission prompt, may be null
 * @param resultText        backend summary text, may be null
 * @param error             surfaced error, null on success or when suppressed
 * @param errorSuppressed   whether an execution error was dropped as a cancel race
 */
public record TurnResult(String subtype, long durationMs, Double costUsd, TokenCounts usage,
                         Map<String, ModelUsage> modelUsage, String stopReason, String stopSequence,
                         String requestId, Integer turnCount, JsonNode permissionRequest,
                         String resultText, String error, boolean errorSuppressed) {

    public TurnResult {
        modelUsage = modelUsage != null ? Collections.unmodifiableMap(new LinkedHashMap<>(modelUsage)) : Map.of();
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasPermissionRequest() {
        return permissionRequest != null;
    }
}
