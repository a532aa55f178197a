package com.agentdesk.agent.usage;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the usage objects found on backend messages to {@link TokenCounts}.
 * <p>
 * The backend reports usage under snake_case keys; camelCase and short
 * variants are accepted too so that replayed transcripts still parse.
 */
public final class UsageParser {

    private UsageParser() {
    }

    /**
     * @return the parsed counts, or null when the node carries no usage field at all
     */
    public static TokenCounts parse(JsonNode usage) {
        if (usage == null || !usage.isObject() || usage.isEmpty()) {
            return null;
        }
        Long input = firstNonNegative(usage,
                "input_tokens", "inputTokens", "input", "prompt_tokens");
        Long output = firstNonNegative(usage,
                "output_tokens", "outputTokens", "output", "completion_tokens");
        Long cacheCreation = firstNonNegative(usage,
                "cache_creation_input_tokens", "cacheCreationInputTokens", "cacheWrite");
        Long cacheRead = firstNonNegative(usage,
                "cache_read_input_tokens", "cacheReadInputTokens", "cacheRead");

        if (input == null && output == null && cacheCreation == null && cacheRead == null) {
            return null;
        }
        return new TokenCounts(orZero(input), orZero(output), orZero(cacheCreation), orZero(cacheRead));
    }

    /**
     * Parse a per-model usage object keyed by model name. Entries that are not
     * objects are skipped; a missing context window falls back to
     * {@link ModelUsage#DEFAULT_CONTEXT_WINDOW}.
     *
     * @return the entries in report order, or null when the node is absent or not an object
     */
    public static Map<String, ModelUsage> parseModelUsage(JsonNode modelUsage) {
        if (modelUsage == null || !modelUsage.isObject()) {
            return null;
        }
        Map<String, ModelUsage> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = modelUsage.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode u = field.getValue();
            if (!u.isObject()) {
                continue;
            }
            Long window = firstNonNegative(u, "contextWindow", "context_window");
            result.put(field.getKey(), new ModelUsage(
                    orZero(firstNonNegative(u, "inputTokens", "input_tokens")),
                    orZero(firstNonNegative(u, "outputTokens", "output_tokens")),
                    orZero(firstNonNegative(u, "cacheReadInputTokens", "cache_read_input_tokens")),
                    orZero(firstNonNegative(u, "cacheCreationInputTokens", "cache_creation_input_tokens")),
                    window != null && window > 0 ? window : ModelUsage.DEFAULT_CONTEXT_WINDOW));
        }
        return Collections.unmodifiableMap(result);
    }

    private static long orZero(Long v) {
        return v != null ? v : 0L;
    }

    private static Long firstNonNegative(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode v = node.get(key);
            if (v != null && v.isNumber()) {
                double d = v.asDouble();
                if (Double.isFinite(d) && d >= 0) {
                    return v.asLong();
                }
            }
        }
        return null;
    }
}
