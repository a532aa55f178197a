package com.agentdesk.agent.session;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One conversation with its own backend identity.
 * <p>
 * {@code backendSessionId} is bound from the backend's init message and passed
 * back as the resume id on the next send. {@code permissionMode} and
 * {@code model} override the settings defaults when set.
 */
@Data
@NoArgsConstructor
public class AgentSession {

    private String agentId;
    private String backendSessionId;
    private String cwd;
    private String permissionMode;
    private String model;
    private List<String> mcpServers = new ArrayList<>();

    public AgentSession(String agentId, String cwd) {
        this.agentId = agentId;
        this.cwd = cwd;
    }
}
