package com.agentdesk.agent.usage;

/**
 * Context-window usage of one model, as reported on a result message. Each
 * report describes the full context of the latest turn, not a delta.
 *
 * @param inputTokens              prompt tokens
 * @param outputTokens             generated tokens
 * @param cacheReadInputTokens     prompt tokens served from cache
 * @param cacheCreationInputTokens prompt tokens written to cache
 * @param contextWindow            size of the model's context window
 */
public record ModelUsage(long inputTokens, long outputTokens, long cacheReadInputTokens,
                         long cacheCreationInputTokens, long contextWindow) {

    public static final long DEFAULT_CONTEXT_WINDOW = 200_000L;

    public long totalTokens() {
        return inputTokens + outputTokens + cacheReadInputTokens + cacheCreationInputTokens;
    }

    public boolean hasTokens() {
        return totalTokens() > 0;
    }

    /** Share of the context window in use, between 0 and 1. */
    public double contextFraction() {
        if (contextWindow <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) (inputTokens + cacheReadInputTokens + cacheCreationInputTokens) / contextWindow);
    }
}
