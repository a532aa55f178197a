package com.agentdesk.agent.normalize;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Short human-readable descriptions of tool invocations, derived from the
 * tool's input.
 */
public final class ToolDescriptions {

    private ToolDescriptions() {
    }

    public static String describe(String toolName, JsonNode input) {
        if (input == null || !input.isObject()) {
            return "";
        }
        String name = toolName != null ? toolName : "";
        return switch (name) {
            case "Read", "Write", "Edit", "MultiEdit" -> firstText(input, "file_path", "path");
            case "Grep" -> "\"" + text(input, "pattern") + "\" in " + orDot(text(input, "path"));
            case "Glob" -> text(input, "pattern") + " in " + orDot(text(input, "path"));
            case "LS" -> orDot(text(input, "path"));
            case "Bash" -> text(input, "command");
            case "Task" -> text(input, "description");
            case "WebSearch" -> text(input, "query");
            case "WebFetch" -> text(input, "url");
            case "NotebookEdit" -> text(input, "notebook_path");
            default -> firstText(input, "file_path", "path", "query", "url", "command");
        };
    }

    private static String firstText(JsonNode input, String... fields) {
        for (String field : fields) {
            String v = text(input, field);
            if (!v.isEmpty()) {
                return v;
            }
        }
        return "";
    }

    private static String text(JsonNode input, String field) {
        JsonNode v = input.get(field);
        return v != null && v.isTextual() ? v.asText() : "";
    }

    private static String orDot(String path) {
        return path.isEmpty() ? "." : path;
    }
}
