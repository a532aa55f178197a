package com.agentdesk.agent.usage;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running usage per agent: a live current-response counter plus cumulative
 * session totals.
 * <p>
 * The current-response counter restarts at zero on every new assistant message
 * and otherwise accumulates output tokens, so observers can show a live token
 * count without re-reading the transcript.
 */
@Slf4j
public class UsageAccumulator {

    private final Map<String, TokenCounts> currentResponse = new HashMap<>();
    private final Map<String, SessionUsage> sessions = new HashMap<>();
    private final Map<String, Map<String, ModelUsage>> contextUsage = new HashMap<>();

    // ── Current response ──────────────────────────────────────────────

    /**
     * Called for every content delta; resets the current-response counter when
     * the delta starts a new assistant message.
     */
    public synchronized void onContentDelta(String agentId, boolean isNewMessage) {
        if (isNewMessage) {
            currentResponse.computeIfAbsent(agentId, k -> TokenCounts.zero()).reset();
        }
    }

    public synchronized TokenCounts addOutputTokens(String agentId, long outputTokens) {
        TokenCounts counts = currentResponse.computeIfAbsent(agentId, k -> TokenCounts.zero());
        if (outputTokens > 0) {
            counts.accumulate(TokenCounts.ofOutput(outputTokens));
        }
        return counts.copy();
    }

    public synchronized TokenCounts currentResponse(String agentId) {
        TokenCounts counts = currentResponse.get(agentId);
        return counts != null ? counts.copy() : TokenCounts.zero();
    }

    public synchronized void resetCurrentResponse(String agentId) {
        TokenCounts counts = currentResponse.get(agentId);
        if (counts != null) {
            counts.reset();
        }
    }

    // ── Session totals ────────────────────────────────────────────────

    public synchronized SessionUsage recordQuery(String agentId, TokenCounts usage, Double costUsd,
                                                 long durationMs) {
        SessionUsage updated = sessions.getOrDefault(agentId, SessionUsage.empty())
                .plus(usage, costUsd, durationMs);
        sessions.put(agentId, updated);
        log.debug("usage recorded: agentId={} queries={} totalCostUsd={} lastDurationMs={}",
                agentId, updated.queryCount(), updated.totalCostUsd(), updated.lastDurationMs());
        return updated;
    }

    public synchronized SessionUsage sessionUsage(String agentId) {
        return sessions.getOrDefault(agentId, SessionUsage.empty());
    }

    // ── Context usage ─────────────────────────────────────────────────

    /**
     * Replace the per-model context usage of {@code agentId} with the latest
     * report. A report without any tokens (a local command that made no model
     * call) keeps the previous values once some exist.
     *
     * @return true if the stored usage changed
     */
    public synchronized boolean updateContextUsage(String agentId, Map<String, ModelUsage> modelUsage) {
        if (modelUsage == null || modelUsage.isEmpty()) {
            return false;
        }
        Map<String, ModelUsage> existing = contextUsage.get(agentId);
        boolean hasTokens = modelUsage.values().stream().anyMatch(ModelUsage::hasTokens);
        if (!hasTokens && existing != null) {
            log.debug("context usage kept: agentId={} reason=zero_token_report", agentId);
            return false;
        }
        if (existing == null) {
            existing = new LinkedHashMap<>();
            contextUsage.put(agentId, existing);
        }
        existing.putAll(modelUsage);
        log.debug("context usage updated: agentId={} models={}", agentId, modelUsage.keySet());
        return true;
    }

    /**
     * @return the latest per-model context usage, empty before the first report
     */
    public synchronized Map<String, ModelUsage> contextUsage(String agentId) {
        Map<String, ModelUsage> usage = contextUsage.get(agentId);
        return usage != null ? Collections.unmodifiableMap(new LinkedHashMap<>(usage)) : Map.of();
    }

    public synchronized void clear(String agentId) {
        currentResponse.remove(agentId);
        sessions.remove(agentId);
        contextUsage.remove(agentId);
    }
}
