package com.agentdesk.agent.normalize;

import java.time.Instant;

/**
 * Per-message inputs to {@link MessageNormalizer#normalize}.
 *
 * @param agentId            agent the message belongs to
 * @param queryId            query the message was delivered for
 * @param startedAt          when the query started
 * @param now                arrival time of the message
 * @param interruptionActive whether an interruption window currently covers this query
 * @param maxTurns           turn limit the query was started with, 0 when unknown
 */
public record NormalizationContext(String agentId, String queryId, Instant startedAt, Instant now,
                                   boolean interruptionActive, int maxTurns) {

    public NormalizationContext(String agentId, String queryId, Instant startedAt, Instant now,
                                boolean interruptionActive) {
        this(agentId, queryId, startedAt, now, interruptionActive, 0);
    }
}
