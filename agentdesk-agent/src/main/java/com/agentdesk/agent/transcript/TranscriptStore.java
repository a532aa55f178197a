package com.agentdesk.agent.transcript;

import java.util.List;

/**
 * Sink for normalized transcript changes.
 */
public interface TranscriptStore {

    /**
     * Insert {@code message}, or replace the stored entry with the same id.
     */
    void appendOrUpdateMessage(String agentId, TranscriptMessage message);

    /**
     * @return the agent's transcript in insertion order; empty for unknown agents
     */
    List<TranscriptMessage> getMessages(String agentId);

    default void clear(String agentId) {
    }
}
