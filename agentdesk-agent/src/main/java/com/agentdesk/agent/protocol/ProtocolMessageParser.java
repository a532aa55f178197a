package com.agentdesk.agent.protocol;

import com.agentdesk.agent.error.ProtocolException;
import com.agentdesk.agent.usage.TokenCounts;
import com.agentdesk.agent.usage.UsageParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts raw backend JSON into {@link ProtocolMessage} variants.
 * <p>
 * The parser is lenient about optional fields and strict about shape: a field
 * that is present with the wrong JSON type raises {@link ProtocolException}.
 * Unrecognized {@code type} values are returned as {@link ProtocolMessage.Unknown}.
 * <p>
 * Thread-safe; one instance can serve every session.
 */
@Slf4j
public class ProtocolMessageParser {

    public static final String SUBTYPE_SUCCESS = "success";
    public static final String SUBTYPE_ERROR_MAX_TURNS = "error_max_turns";
    public static final String SUBTYPE_ERROR_DURING_EXECUTION = "error_during_execution";

    private final ObjectMapper mapper;

    public ProtocolMessageParser() {
        this(new ObjectMapper());
    }

    public ProtocolMessageParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ProtocolMessage parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ProtocolException("empty message");
        }
        try {
            return parse(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ProtocolException("message is not valid JSON: " + e.getOriginalMessage(), null, null, e);
        }
    }

    public ProtocolMessage parse(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new ProtocolException("message must be a JSON object");
        }
        String type = optText(raw, "type");
        if (type == null) {
            throw new ProtocolException("message has no type");
        }
        String subtype = optText(raw, "subtype");
        String sessionId = optText(raw, "session_id");

        return switch (MessageTag.of(type, subtype)) {
            case SYSTEM_INIT -> parseSystemInit(raw, sessionId);
            case SYSTEM_COMPACT -> parseSystemCompact(raw, sessionId);
            case ASSISTANT -> parseAssistant(raw, sessionId);
            case USER -> parseUser(raw, sessionId);
            case TOOL_USE -> parseToolUse(raw, sessionId);
            case TOOL_RESULT -> parseToolResult(raw, sessionId);
            case RESULT -> parseResult(raw, sessionId);
            default -> new ProtocolMessage.Unknown(sessionId, subtype != null ? type + ":" + subtype : type, raw);
        };
    }

    // ── System ────────────────────────────────────────────────────────

    private ProtocolMessage parseSystemInit(JsonNode raw, String sessionId) {
        List<String> servers = new ArrayList<>();
        JsonNode mcp = raw.get("mcp_servers");
        if (mcp != null && !mcp.isNull()) {
            if (!mcp.isArray()) {
                throw new ProtocolException("system init mcp_servers must be an array");
            }
            for (JsonNode server : mcp) {
                String name = server.isTextual() ? server.asText() : optText(server, "name");
                if (name != null && !name.isBlank()) {
                    servers.add(name);
                }
            }
        }
        return new ProtocolMessage.SystemInit(sessionId, optText(raw, "model"), optText(raw, "cwd"),
                Collections.unmodifiableList(servers));
    }

    private ProtocolMessage parseSystemCompact(JsonNode raw, String sessionId) {
        JsonNode meta = raw.path("compact_metadata");
        String trigger = optText(meta, "trigger");
        long preTokens = meta.path("pre_tokens").asLong(0);
        return new ProtocolMessage.SystemCompact(sessionId, trigger != null ? trigger : "auto",
                Math.max(0, preTokens));
    }

    // ── Conversation ──────────────────────────────────────────────────

    private ProtocolMessage parseAssistant(JsonNode raw, String sessionId) {
        JsonNode message = raw.get("message");
        String parentToolId = optText(raw, "parent_tool_use_id");
        if (message == null || message.isNull()) {
            return new ProtocolMessage.AssistantMessage(sessionId, null, List.of(), null, parentToolId);
        }
        if (!message.isObject()) {
            throw new ProtocolException("assistant message body must be an object");
        }
        List<ContentItem> content = parseContent(message.get("content"), parentToolId, "assistant");
        TokenCounts usage = UsageParser.parse(message.get("usage"));
        return new ProtocolMessage.AssistantMessage(sessionId, optText(message, "id"), content, usage,
                parentToolId);
    }

    private ProtocolMessage parseUser(JsonNode raw, String sessionId) {
        JsonNode message = raw.get("message");
        String parentToolId = optText(raw, "parent_tool_use_id");
        if (message == null || message.isNull()) {
            // Some backends flatten the echo to a top-level content field
            return new ProtocolMessage.UserMessage(sessionId,
                    parseContent(raw.get("content"), parentToolId, "user"), parentToolId);
        }
        if (!message.isObject()) {
            throw new ProtocolException("user message body must be an object");
        }
        return new ProtocolMessage.UserMessage(sessionId,
                parseContent(message.get("content"), parentToolId, "user"), parentToolId);
    }

    private List<ContentItem> parseContent(JsonNode content, String parentToolId, String role) {
        if (content == null || content.isNull()) {
            return List.of();
        }
        if (content.isTextual()) {
            return List.of(new ContentItem.Text(content.asText()));
        }
        if (!content.isArray()) {
            throw new ProtocolException(role + " content must be a string or an array");
        }
        List<ContentItem> items = new ArrayList<>(content.size());
        for (JsonNode item : content) {
            items.add(parseContentItem(item, parentToolId));
        }
        return Collections.unmodifiableList(items);
    }

    private ContentItem parseContentItem(JsonNode item, String parentToolId) {
        if (item.isTextual()) {
            return new ContentItem.Text(item.asText());
        }
        if (!item.isObject()) {
            throw new ProtocolException("content item must be an object");
        }
        String type = optText(item, "type");
        if (type == null) {
            return new ContentItem.Other("unknown");
        }
        return switch (type) {
            case "text" -> new ContentItem.Text(item.path("text").asText(""));
            case "tool_use" -> new ContentItem.ToolUse(optText(item, "id"), optText(item, "name"),
                    item.get("input"), parentToolId);
            case "tool_result" -> new ContentItem.ToolResult(optText(item, "tool_use_id"),
                    flattenToolContent(item.get("content")), item.path("is_error").asBoolean(false));
            default -> new ContentItem.Other(type);
        };
    }

    // ── Tools ─────────────────────────────────────────────────────────

    private ProtocolMessage parseToolUse(JsonNode raw, String sessionId) {
        String toolId = optText(raw, "tool_use_id");
        if (toolId == null) {
            toolId = optText(raw, "id");
        }
        if (toolId == null) {
            throw new ProtocolException("tool_use message has no tool id");
        }
        return new ProtocolMessage.ToolUseMessage(sessionId, toolId, optText(raw, "name"),
                raw.get("input"), optText(raw, "parent_tool_use_id"));
    }

    private ProtocolMessage parseToolResult(JsonNode raw, String sessionId) {
        JsonNode message = raw.path("message");
        String toolId = optText(raw, "tool_use_id");
        if (toolId == null) {
            toolId = optText(message, "tool_use_id");
        }
        if (toolId == null) {
            toolId = optText(raw, "parent_tool_use_id");
        }
        if (toolId == null) {
            throw new ProtocolException("tool_result message has no tool id");
        }
        JsonNode content = raw.has("content") ? raw.get("content")
                : message.has("content") ? message.get("content") : raw.get("result");
        boolean isError = raw.path("is_error").asBoolean(message.path("is_error").asBoolean(false));
        return new ProtocolMessage.ToolResultMessage(sessionId, toolId, flattenToolContent(content), isError);
    }

    /**
     * Tool output arrives either as a plain string or as an array of text blocks.
     */
    static String flattenToolContent(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode block : content) {
                String text = block.isTextual() ? block.asText() : optText(block, "text");
                if (text != null) {
                    if (sb.length() > 0) {
                        sb.append('\n');
                    }
                    sb.append(text);
                }
            }
            return sb.toString();
        }
        return content.toString();
    }

    // ── Result ────────────────────────────────────────────────────────

    private ProtocolMessage parseResult(JsonNode raw, String sessionId) {
        String subtype = optText(raw, "subtype");
        boolean isError = raw.path("is_error").asBoolean(false);
        Long durationMs = raw.path("duration_ms").isNumber() ? raw.get("duration_ms").asLong() : null;
        Double cost = raw.path("total_cost_usd").isNumber() ? raw.get("total_cost_usd").asDouble() : null;
        String resultText = optText(raw, "result");
        Integer turnCount = optCount(raw, "turn_count");
        if (turnCount == null) {
            turnCount = optCount(raw, "num_turns");
        }
        JsonNode modelUsage = raw.get("modelUsage");
        if (modelUsage != null && !modelUsage.isNull() && !modelUsage.isObject()) {
            throw new ProtocolException("result modelUsage must be an object");
        }
        JsonNode permissionRequest = raw.get("__permissionRequest");
        if (permissionRequest != null && (permissionRequest.isNull() || permissionRequest.isMissingNode())) {
            permissionRequest = null;
        }
        return new ProtocolMessage.ResultMessage(sessionId, subtype != null ? subtype : SUBTYPE_SUCCESS,
                isError, durationMs, cost, UsageParser.parse(raw.get("usage")),
                UsageParser.parseModelUsage(modelUsage), optText(raw, "stop_reason"),
                optText(raw, "stop_sequence"), optText(raw, "request_id"), turnCount, permissionRequest,
                resultText, resolveError(raw, subtype, isError, resultText, turnCount));
    }

    /**
     * Error text for a turn stopped by the turn limit.
     *
     * @param turnCount turns run, or null when unknown
     */
    public static String maxTurnsError(Integer turnCount) {
        if (turnCount == null || turnCount <= 0) {
            return "Maximum turns limit reached";
        }
        return "Maximum turns limit reached (" + turnCount + (turnCount == 1 ? " turn)" : " turns)");
    }

    private static String resolveError(JsonNode raw, String subtype, boolean isError, String resultText,
                                       Integer turnCount) {
        JsonNode error = raw.get("error");
        if (error != null && !error.isNull()) {
            if (error.isTextual()) {
                return error.asText();
            }
            String message = optText(error, "message");
            return message != null ? message : error.toString();
        }
        if (SUBTYPE_ERROR_MAX_TURNS.equals(subtype)) {
            return turnCount != null ? maxTurnsError(turnCount) : null;
        }
        if (SUBTYPE_ERROR_DURING_EXECUTION.equals(subtype)) {
            return resultText != null && !resultText.isBlank() ? resultText : "Error during execution";
        }
        if (isError) {
            return resultText != null && !resultText.isBlank() ? resultText : "Query failed";
        }
        return null;
    }

    private static Integer optCount(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.canConvertToInt() && v.isIntegralNumber() && v.asInt() >= 0 ? v.asInt() : null;
    }

    static String optText(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
