package com.agentdesk.agent.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tool invocation recorded on an assistant entry, completed in place when
 * its result arrives.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolUsage {

    private String toolId;
    private String name;
    private JsonNode input;
    private String parentToolId;
    private String description;
    private String result;
    private boolean error;
    private boolean completed;

    public static ToolUsage invoked(String toolId, String name, JsonNode input, String parentToolId,
                                    String description) {
        return new ToolUsage(toolId, name, input, parentToolId, description, null, false, false);
    }

    public void complete(String result, boolean isError) {
        this.result = result;
        this.error = isError;
        this.completed = true;
    }

    public ToolUsage copy() {
        return new ToolUsage(toolId, name, input, parentToolId, description, result, error, completed);
    }
}
