package com.agentdesk.agent.backend;

import java.util.List;

/**
 * Everything the backend needs to start one query.
 *
 * @param resume backend session id to resume, null for a fresh session
 */
public record PromptPayload(String prompt, String agentId, String resume, String cwd, String model,
                            String permissionMode, int maxTurns, List<Attachment> attachments) {

    public PromptPayload {
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }
}
