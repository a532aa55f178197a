package com.agentdesk.agent.backend;

import com.agentdesk.agent.error.ChannelException;

import java.util.function.Consumer;

/**
 * Asynchronous connection to the coding-assistant backend.
 * <p>
 * Events for one query id are delivered in order; no ordering holds across
 * query ids. Implementations must not deliver events for a query before
 * {@link #start} has returned its id.
 */
public interface BackendQueryChannel {

    /**
     * Start a query.
     *
     * @return the backend's id for the new query
     * @throws ChannelException if the backend could not start it
     */
    String start(PromptPayload payload);

    /**
     * Ask the backend to stop a query. Delivery continues until the backend
     * sends its own terminal event.
     */
    void abort(String queryId);

    /**
     * @return a handle that removes the listener
     */
    Runnable subscribe(String queryId, ChannelEvent.Kind kind, Consumer<ChannelEvent> listener);
}
