package com.agentdesk.agent.normalize;

import com.agentdesk.agent.error.QueryException;
import com.agentdesk.agent.usage.TokenCounts;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Events delivered to query observers. Every event names the agent and query
 * it belongs to.
 */
public sealed interface QueryEvent {

    String agentId();

    String queryId();

    // ── Normalizer output ─────────────────────────────────────────────

    record SessionBound(String agentId, String queryId, String backendSessionId, String model,
                        List<String> mcpServers) implements QueryEvent {
    }

    record ContextCompacted(String agentId, String queryId, String trigger, long preTokens)
            implements QueryEvent {
    }

    /**
     * @param isNewMessage true for the first text item of an assistant message
     */
    record ContentDelta(String agentId, String queryId, String text, boolean isNewMessage)
            implements QueryEvent {
    }

    record ToolInvocation(String agentId, String queryId, String toolId, String name, JsonNode input,
                          String parentToolId, String description) implements QueryEvent {
    }

    record ToolCompletion(String agentId, String queryId, String toolId, String content, boolean isError)
            implements QueryEvent {
    }

    /**
     * @param usage           usage reported on one assistant message
     * @param currentResponse running output count of the current response, null until accumulated
     */
    record UsageReported(String agentId, String queryId, TokenCounts usage, TokenCounts currentResponse)
            implements QueryEvent {

        public UsageReported withCurrentResponse(TokenCounts counts) {
            return new UsageReported(agentId, queryId, usage, counts);
        }
    }

    record TurnCompleted(String agentId, String queryId, TurnResult result) implements QueryEvent {
    }

    /** The turn ended waiting on a tool-permission decision; {@code request} is the backend's payload. */
    record PermissionRequested(String agentId, String queryId, JsonNode request) implements QueryEvent {
    }

    // ── Lifecycle, emitted by the orchestrator ────────────────────────

    record QueryStarted(String agentId, String queryId) implements QueryEvent {
    }

    record QueryCancelled(String agentId, String queryId, boolean silent) implements QueryEvent {
    }

    record StreamCompleted(String agentId, String queryId, String finalText) implements QueryEvent {
    }

    /** The single error surfaced for a query. */
    record QueryFailed(String agentId, String queryId, String error) implements QueryEvent {
    }

    /** Non-fatal protocol or validation problem on one message. */
    record Notice(String agentId, String queryId, QueryException cause) implements QueryEvent {
    }
}
