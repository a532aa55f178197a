package com.agentdesk.agent.usage;

/**
 * Snapshot of one agent's cumulative usage.
 *
 * @param tokens           summed token counts of all finished queries
 * @param totalCostUsd     summed backend-reported cost
 * @param queryCount       number of finished queries
 * @param totalDurationMs  summed request durations
 * @param lastDurationMs   duration of the most recent query, 0 before the first
 */
public record SessionUsage(TokenCounts tokens, double totalCostUsd, int queryCount,
                           long totalDurationMs, long lastDurationMs) {

    public SessionUsage {
        tokens = tokens != null ? tokens.copy() : TokenCounts.zero();
    }

    /**
     * @return a copy; the snapshot's own counts cannot be changed through it
     */
    @Override
    public TokenCounts tokens() {
        return tokens.copy();
    }

    public static SessionUsage empty() {
        return new SessionUsage(TokenCounts.zero(), 0.0, 0, 0L, 0L);
    }

    public SessionUsage plus(TokenCounts usage, Double costUsd, long durationMs) {
        return new SessionUsage(
                TokenCounts.add(tokens, usage),
                totalCostUsd + (costUsd != null ? costUsd : 0.0),
                queryCount + 1,
                totalDurationMs + Math.max(0, durationMs),
                Math.max(0, durationMs));
    }

    public long averageDurationMs() {
        return queryCount == 0 ? 0 : totalDurationMs / queryCount;
    }
}
