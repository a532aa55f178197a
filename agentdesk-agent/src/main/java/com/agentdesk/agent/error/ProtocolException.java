package com.agentdesk.agent.error;

/**
 * A raw backend message had a shape the parser cannot interpret.
 * Scoped to the session it arrived on; other sessions keep streaming.
 */
public class ProtocolException extends QueryException {

    public ProtocolException(String message) {
        super(message, null, null);
    }

    public ProtocolException(String message, String agentId, String queryId, Throwable cause) {
        super(message, agentId, queryId, cause);
    }

    /**
     * Re-scope a parser failure to the session and query it was received on.
     */
    public ProtocolException scopedTo(String agentId, String queryId) {
        return new ProtocolException(getMessage(), agentId, queryId, this);
    }
}
