package com.agentdesk.agent.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of an assistant or user message's ordered content array.
 */
public sealed interface ContentItem {

    record Text(String text) implements ContentItem {
        public boolean isBlank() {
            return text == null || text.isBlank();
        }
    }

    /**
     * @param parentToolId id of the enclosing tool call for sub-agent output, otherwise null
     */
    record ToolUse(String id, String name, JsonNode input, String parentToolId) implements ContentItem {
    }

    record ToolResult(String toolUseId, String content, boolean isError) implements ContentItem {
    }

    /** Item types this layer does not interpret, e.g. thinking blocks or images. */
    record Other(String type) implements ContentItem {
    }
}
