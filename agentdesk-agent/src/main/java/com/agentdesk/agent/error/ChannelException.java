package com.agentdesk.agent.error;

/**
 * The backend failed to start a query, or reported an error event for one.
 */
public class ChannelException extends QueryException {

    public ChannelException(String message, String agentId, String queryId) {
        super(message, agentId, queryId);
    }

    public ChannelException(String message, String agentId, String queryId, Throwable cause) {
        super(message, agentId, queryId, cause);
    }
}
