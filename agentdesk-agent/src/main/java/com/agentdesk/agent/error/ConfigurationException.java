package com.agentdesk.agent.error;

/**
 * The agent id does not resolve to a known session.
 */
public class ConfigurationException extends QueryException {

    public ConfigurationException(String message, String agentId) {
        super(message, agentId, null);
    }
}
