package com.agentdesk.agent.backend;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One event delivered by the backend for a query.
 *
 * @param raw   message body for {@link Kind#MESSAGE}, otherwise null
 * @param error error text for {@link Kind#ERROR}, otherwise null
 */
public record ChannelEvent(Kind kind, String queryId, JsonNode raw, String error) {

    public enum Kind {
        MESSAGE,
        COMPLETE,
        ERROR
    }

    public static ChannelEvent message(String queryId, JsonNode raw) {
        return new ChannelEvent(Kind.MESSAGE, queryId, raw, null);
    }

    public static ChannelEvent complete(String queryId) {
        return new ChannelEvent(Kind.COMPLETE, queryId, null, null);
    }

    public static ChannelEvent error(String queryId, String error) {
        return new ChannelEvent(Kind.ERROR, queryId, null, error);
    }
}
