package com.agentdesk.agent.transcript;

import com.agentdesk.agent.usage.ModelUsage;
import com.agentdesk.agent.usage.TokenCounts;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One transcript line. Assistant entries grow across chunks: content is only
 * ever appended to.
 */
@Data
@NoArgsConstructor
public class TranscriptMessage {

    private String id;
    private TranscriptRole role;
    private String queryId;
    private String content = "";
    private Instant createdAt;
    private TokenCounts tokenUsage;
    private List<ToolUsage> toolUsages = new ArrayList<>();
    private String stopReason;
    private String stopSequence;
    private String requestId;
    private Integer turnCount;
    private Map<String, ModelUsage> modelUsage;
    /** Pending tool-permission prompt the turn ended on. */
    private JsonNode permissionRequest;
    private String error;
    private Double costUsd;
    private Long durationMs;
    private boolean interruptionMarker;

    public static TranscriptMessage user(String queryId, String content, Instant createdAt) {
        TranscriptMessage msg = create(TranscriptRole.USER, queryId, createdAt);
        msg.content = content != null ? content : "";
        return msg;
    }

    public static TranscriptMessage assistant(String queryId, Instant createdAt) {
        return create(TranscriptRole.ASSISTANT, queryId, createdAt);
    }

    private static TranscriptMessage create(TranscriptRole role, String queryId, Instant createdAt) {
        TranscriptMessage msg = new TranscriptMessage();
        msg.id = UUID.randomUUID().toString();
        msg.role = role;
        msg.queryId = queryId;
        msg.createdAt = createdAt;
        return msg;
    }

    public void appendContent(String text) {
        if (text != null && !text.isEmpty()) {
            content = content + text;
        }
    }

    public ToolUsage findToolUsage(String toolId) {
        if (toolId == null) {
            return null;
        }
        for (ToolUsage usage : toolUsages) {
            if (toolId.equals(usage.getToolId())) {
                return usage;
            }
        }
        return null;
    }

    /** Deep enough copy that later appends to this entry do not show through. */
    public TranscriptMessage copy() {
        TranscriptMessage c = new TranscriptMessage();
        c.id = id;
        c.role = role;
        c.queryId = queryId;
        c.content = content;
        c.createdAt = createdAt;
        c.tokenUsage = tokenUsage != null ? tokenUsage.copy() : null;
        List<ToolUsage> tools = new ArrayList<>(toolUsages.size());
        for (ToolUsage t : toolUsages) {
            tools.add(t.copy());
        }
        c.toolUsages = tools;
        c.stopReason = stopReason;
        c.stopSequence = stopSequence;
        c.requestId = requestId;
        c.turnCount = turnCount;
        c.modelUsage = modelUsage != null ? new LinkedHashMap<>(modelUsage) : null;
        c.permissionRequest = permissionRequest != null ? permissionRequest.deepCopy() : null;
        c.error = error;
        c.costUsd = costUsd;
        c.durationMs = durationMs;
        c.interruptionMarker = interruptionMarker;
        return c;
    }
}
