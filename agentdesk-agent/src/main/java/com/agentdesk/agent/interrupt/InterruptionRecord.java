package com.agentdesk.agent.interrupt;

import java.time.Duration;
import java.time.Instant;

/**
 * A user-initiated cancel of one query.
 *
 * @param agentId     agent the cancel was issued for
 * @param queryId     query that was live when the cancel was issued, may be null
 * @param cancelledAt when the cancel was issued
 */
public record InterruptionRecord(String agentId, String queryId, Instant cancelledAt) {

    public boolean isYoungerThan(Duration window, Instant now) {
        return Duration.between(cancelledAt, now).compareTo(window) < 0;
    }
}
