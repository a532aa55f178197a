package com.agentdesk.agent.error;

import lombok.Getter;

/**
 * Base type for failures raised by the query layer.
 * Carries the agent (and, when known, query) the failure belongs to so that
 * callers can keep errors scoped to one session.
 */
@Getter
public class QueryException extends RuntimeException {

    private final String agentId;
    private final String queryId;

    public QueryException(String message, String agentId, String queryId) {
        this(message, agentId, queryId, null);
    }

    public QueryException(String message, String agentId, String queryId, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
        this.queryId = queryId;
    }
}
