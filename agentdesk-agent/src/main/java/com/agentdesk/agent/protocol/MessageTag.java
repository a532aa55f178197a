package com.agentdesk.agent.protocol;

/**
 * Discriminator of a raw backend message, derived from its {@code type} field
 * and, for system messages, its {@code subtype}.
 */
public enum MessageTag {
    SYSTEM_INIT("system-init"),
    SYSTEM_COMPACT("system-compact"),
    ASSISTANT("assistant"),
    USER("user"),
    TOOL_USE("tool_use"),
    TOOL_RESULT("tool_result"),
    RESULT("result"),
    UNKNOWN("unknown");

    private final String wireName;

    MessageTag(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve the tag for a {@code type}/{@code subtype} pair.
     * Unrecognized combinations map to {@link #UNKNOWN}.
     */
    public static MessageTag of(String type, String subtype) {
        if (type == null) {
            return UNKNOWN;
        }
        return switch (type) {
            case "system" -> {
                if ("init".equals(subtype)) {
                    yield SYSTEM_INIT;
                }
                yield "compact_boundary".equals(subtype) ? SYSTEM_COMPACT : UNKNOWN;
            }
            case "assistant" -> ASSISTANT;
            case "user" -> USER;
            case "tool_use" -> TOOL_USE;
            case "tool_result" -> TOOL_RESULT;
            case "result" -> RESULT;
            default -> UNKNOWN;
        };
    }
}
