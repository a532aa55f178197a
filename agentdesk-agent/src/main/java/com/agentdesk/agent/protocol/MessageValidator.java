package com.agentdesk.agent.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-tier shape check for raw backend messages.
 * <p>
 * Strict mode checks the fields each known tag is expected to carry. A message
 * that fails strict mode but is still an object with a textual {@code type} is
 * accepted in relaxed mode, with the strict findings returned as warnings.
 * Anything else fails.
 */
public final class MessageValidator {

    private MessageValidator() {
    }

    public static ValidationResult validate(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return new ValidationResult(ValidationResult.Method.FAILED, List.of("message is not an object"));
        }
        JsonNode type = raw.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            return new ValidationResult(ValidationResult.Method.FAILED, List.of("missing type"));
        }

        List<String> warnings = new ArrayList<>();
        MessageTag tag = MessageTag.of(type.asText(), text(raw, "subtype"));
        switch (tag) {
            case SYSTEM_INIT -> {
                requireText(raw, "session_id", warnings);
                requireArrayIfPresent(raw, "mcp_servers", warnings);
            }
            case SYSTEM_COMPACT -> {
                if (!raw.path("compact_metadata").isObject()) {
                    warnings.add("compact_metadata must be an object");
                } else if (!raw.path("compact_metadata").path("pre_tokens").isNumber()) {
                    warnings.add("compact_metadata.pre_tokens must be a number");
                }
            }
            case ASSISTANT -> {
                requireText(raw, "session_id", warnings);
                if (!raw.path("message").isObject()) {
                    warnings.add("message must be an object");
                } else if (!raw.path("message").path("content").isArray()) {
                    warnings.add("message.content must be an array");
                }
            }
            case USER -> {
                JsonNode content = raw.path("message").path("content");
                if (!content.isArray() && !content.isTextual()) {
                    warnings.add("message.content must be a string or an array");
                }
            }
            case TOOL_USE -> {
                requireText(raw, "name", warnings);
                if (text(raw, "tool_use_id") == null && text(raw, "id") == null) {
                    warnings.add("tool_use_id is required");
                }
            }
            case TOOL_RESULT -> {
                if (text(raw, "tool_use_id") == null && text(raw.path("message"), "tool_use_id") == null
                        && text(raw, "parent_tool_use_id") == null) {
                    warnings.add("tool_use_id is required");
                }
            }
            case RESULT -> {
                requireText(raw, "subtype", warnings);
                requireText(raw, "session_id", warnings);
                if (!raw.path("is_error").isBoolean()) {
                    warnings.add("is_error must be a boolean");
                }
                JsonNode modelUsage = raw.get("modelUsage");
                if (modelUsage != null && !modelUsage.isNull() && !modelUsage.isObject()) {
                    warnings.add("modelUsage must be an object");
                }
            }
            default -> {
                // unknown tags are passed through; the normalizer ignores them
            }
        }
        if (warnings.isEmpty()) {
            return ValidationResult.strict();
        }
        return new ValidationResult(ValidationResult.Method.RELAXED, warnings);
    }

    private static void requireText(JsonNode node, String field, List<String> warnings) {
        if (text(node, field) == null) {
            warnings.add(field + " is required");
        }
    }

    private static void requireArrayIfPresent(JsonNode node, String field, List<String> warnings) {
        JsonNode v = node.get(field);
        if (v != null && !v.isNull() && !v.isArray()) {
            warnings.add(field + " must be an array");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
