package com.agentdesk.agent.protocol;

import com.agentdesk.agent.usage.ModelUsage;
import com.agentdesk.agent.usage.TokenCounts;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Closed set of backend stream messages. Produced by {@link ProtocolMessageParser};
 * anything outside the known tags becomes {@link Unknown}.
 */
public sealed interface ProtocolMessage {

    MessageTag tag();

    /** Backend session id carried by the message, may be null. */
    String sessionId();

    record SystemInit(String sessionId, String model, String cwd, List<String> mcpServers)
            implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.SYSTEM_INIT;
        }
    }

    /**
     * Context compaction boundary.
     *
     * @param trigger   "auto" or "manual"
     * @param preTokens token count before compaction, 0 when unknown
     */
    record SystemCompact(String sessionId, String trigger, long preTokens) implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.SYSTEM_COMPACT;
        }
    }

    record AssistantMessage(String sessionId, String messageId, List<ContentItem> content,
                            TokenCounts usage, String parentToolId) implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.ASSISTANT;
        }
    }

    record UserMessage(String sessionId, List<ContentItem> content, String parentToolId)
            implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.USER;
        }
    }

    record ToolUseMessage(String sessionId, String toolId, String name, JsonNode input,
                          String parentToolId) implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.TOOL_USE;
        }
    }

    record ToolResultMessage(String sessionId, String toolId, String content, boolean isError)
            implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.TOOL_RESULT;
        }
    }

    /**
     * Final message of a turn.
     *
     * @param durationMs        backend-reported duration, null when absent
     * @param totalCostUsd      backend-reported cost, null when absent
     * @param modelUsage        per-model context usage keyed by model name, null when absent
     * @param turnCount         number of turns the backend ran, null when absent
     * @param permissionRequest pending tool-permission prompt, passed through untouched
     * @param error             error text when the turn failed, otherwise null; a max-turns
     *                          result without a turn count leaves the text to the normalizer
     */
    record ResultMessage(String sessionId, String subtype, boolean isError, Long durationMs,
                         Double totalCostUsd, TokenCounts usage, Map<String, ModelUsage> modelUsage,
                         String stopReason, String stopSequence, String requestId, Integer turnCount,
                         JsonNode permissionRequest, String resultText, String error)
            implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.RESULT;
        }

        public boolean isExecutionError() {
            return ProtocolMessageParser.SUBTYPE_ERROR_DURING_EXECUTION.equals(subtype);
        }

        public boolean isMaxTurns() {
            return ProtocolMessageParser.SUBTYPE_ERROR_MAX_TURNS.equals(subtype);
        }

        public boolean hasError() {
            return error != null;
        }
    }

    record Unknown(String sessionId, String type, JsonNode raw) implements ProtocolMessage {
        @Override
        public MessageTag tag() {
            return MessageTag.UNKNOWN;
        }
    }
}
