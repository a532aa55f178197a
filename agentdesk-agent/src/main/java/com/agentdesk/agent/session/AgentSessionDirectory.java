package com.agentdesk.agent.session;

import com.agentdesk.agent.error.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known agent sessions, keyed by agent id.
 */
@Slf4j
public class AgentSessionDirectory {

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();

    public AgentSession register(AgentSession session) {
        if (session == null || session.getAgentId() == null || session.getAgentId().isBlank()) {
            throw new IllegalArgumentException("session must have an agent id");
        }
        AgentSession previous = sessions.put(session.getAgentId(), session);
        log.debug("session registered: agentId={} replaced={}", session.getAgentId(), previous != null);
        return session;
    }

    public Optional<AgentSession> find(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(sessions.get(agentId));
    }

    /**
     * @throws ConfigurationException if no session is registered for {@code agentId}
     */
    public AgentSession resolve(String agentId) {
        return find(agentId).orElseThrow(
                () -> new ConfigurationException("no session for agent: " + agentId, agentId));
    }

    public boolean remove(String agentId) {
        return sessions.remove(agentId) != null;
    }

    public List<AgentSession> list() {
        return new ArrayList<>(sessions.values());
    }
}
