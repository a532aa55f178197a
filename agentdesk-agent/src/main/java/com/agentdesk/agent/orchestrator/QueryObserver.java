package com.agentdesk.agent.orchestrator;

import com.agentdesk.agent.normalize.QueryEvent;

/**
 * Receives every event of every agent, on the thread that delivered the
 * triggering backend event. Filter by {@link QueryEvent#agentId()} as needed.
 */
@FunctionalInterface
public interface QueryObserver {

    void onEvent(QueryEvent event);
}
