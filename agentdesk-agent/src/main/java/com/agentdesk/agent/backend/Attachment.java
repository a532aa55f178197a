package com.agentdesk.agent.backend;

/**
 * A resolved resource passed to the backend as an inline file reference.
 */
public record Attachment(String resourceId, String path, String name, String mimeType, AttachmentType type) {
}
