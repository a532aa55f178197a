package com.agentdesk.agent.normalize;

import com.agentdesk.agent.protocol.ContentItem;
import com.agentdesk.agent.protocol.ProtocolMessage;
import com.agentdesk.agent.protocol.ProtocolMessageParser;
import com.agentdesk.agent.usage.TokenCounts;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns one protocol message into at most one transcript delta plus ordered
 * side-channel events.
 * <p>
 * Pure apart from logging: session binding, transcript writes and usage
 * accounting are left to the caller, which applies the returned
 * {@link Normalization}.
 */
@Slf4j
public final class MessageNormalizer {

    /**
     * Literal text of the backend's cancellation echo. Also used for the line
     * synthesized locally on a user cancel.
     * <p>
     * Matched as exact text because the backend carries no structured
     * interruption flag; a wording change upstream disables suppression.
     */
    public static final String INTERRUPTION_MARKER = "[Request interrupted by user]";

    private MessageNormalizer() {
    }

    public static boolean isInterruptionEcho(String text) {
        return text != null && INTERRUPTION_MARKER.equals(text.trim());
    }

    public static Normalization normalize(ProtocolMessage message, NormalizationContext ctx) {
        if (message instanceof ProtocolMessage.SystemInit init) {
            return Normalization.events(List.of(new QueryEvent.SessionBound(ctx.agentId(), ctx.queryId(),
                    init.sessionId(), init.model(), init.mcpServers())));
        } else if (message instanceof ProtocolMessage.SystemCompact compact) {
            return Normalization.events(List.of(new QueryEvent.ContextCompacted(ctx.agentId(), ctx.queryId(),
                    compact.trigger(), compact.preTokens())));
        } else if (message instanceof ProtocolMessage.AssistantMessage assistant) {
            return normalizeAssistant(assistant, ctx);
        } else if (message instanceof ProtocolMessage.UserMessage user) {
            return normalizeUser(user, ctx);
        } else if (message instanceof ProtocolMessage.ToolUseMessage toolUse) {
            return Normalization.events(List.of(new QueryEvent.ToolInvocation(ctx.agentId(), ctx.queryId(),
                    toolUse.toolId(), toolUse.name(), toolUse.input(), toolUse.parentToolId(),
                    ToolDescriptions.describe(toolUse.name(), toolUse.input()))));
        } else if (message instanceof ProtocolMessage.ToolResultMessage toolResult) {
            return Normalization.events(List.of(new QueryEvent.ToolCompletion(ctx.agentId(), ctx.queryId(),
                    toolResult.toolId(), toolResult.content(), toolResult.isError())));
        } else if (message instanceof ProtocolMessage.ResultMessage result) {
            return normalizeResult(result, ctx);
        } else if (message instanceof ProtocolMessage.Unknown unknown) {
            log.debug("ignoring message: agentId={} queryId={} type={}",
                    ctx.agentId(), ctx.queryId(), unknown.type());
            return Normalization.empty();
        }
        log.warn("unhandled message variant: agentId={} variant={}", ctx.agentId(),
                message != null ? message.getClass().getSimpleName() : "null");
        return Normalization.empty();
    }

    // ── Assistant ─────────────────────────────────────────────────────

    private static Normalization normalizeAssistant(ProtocolMessage.AssistantMessage message,
                                                    NormalizationContext ctx) {
        StringBuilder text = new StringBuilder();
        for (ContentItem item : message.content()) {
            if (item instanceof ContentItem.Text t && t.text() != null) {
                text.append(t.text());
            }
        }
        boolean hasText = !text.toString().isBlank();

        List<QueryEvent> events = new ArrayList<>();
        boolean first = true;
        for (ContentItem item : message.content()) {
            if (item instanceof ContentItem.Text t) {
                if (hasText && t.text() != null && !t.text().isEmpty()) {
                    events.add(new QueryEvent.ContentDelta(ctx.agentId(), ctx.queryId(), t.text(), first));
                    first = false;
                }
            } else if (item instanceof ContentItem.ToolUse use) {
                events.add(new QueryEvent.ToolInvocation(ctx.agentId(), ctx.queryId(), use.id(), use.name(),
                        use.input(), use.parentToolId(), ToolDescriptions.describe(use.name(), use.input())));
            }
        }
        if (message.usage() != null) {
            events.add(new QueryEvent.UsageReported(ctx.agentId(), ctx.queryId(), message.usage(), null));
        }
        return Normalization.of(hasText ? new TranscriptDelta.AssistantText(text.toString()) : null, events);
    }

    // ── User ──────────────────────────────────────────────────────────

    private static Normalization normalizeUser(ProtocolMessage.UserMessage message, NormalizationContext ctx) {
        List<QueryEvent> events = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (ContentItem item : message.content()) {
            if (item instanceof ContentItem.ToolResult result) {
                events.add(new QueryEvent.ToolCompletion(ctx.agentId(), ctx.queryId(), result.toolUseId(),
                        result.content(), result.isError()));
            } else if (item instanceof ContentItem.Text t && t.text() != null) {
                text.append(t.text());
            }
        }
        String literal = text.toString();
        if (literal.isBlank()) {
            return Normalization.events(events);
        }
        if (ctx.interruptionActive() && isInterruptionEcho(literal)) {
            log.debug("interruption echo suppressed: agentId={} queryId={}", ctx.agentId(), ctx.queryId());
            return Normalization.events(events);
        }
        return Normalization.of(new TranscriptDelta.UserLine(literal), events);
    }

    // ── Result ────────────────────────────────────────────────────────

    private static Normalization normalizeResult(ProtocolMessage.ResultMessage message, NormalizationContext ctx) {
        // a zero duration means the backend did not measure it
        long durationMs = message.durationMs() != null && message.durationMs() > 0
                ? message.durationMs()
                : Math.max(0, Duration.between(ctx.startedAt(), ctx.now()).toMillis());

        String error = message.error();
        if (error == null && message.isMaxTurns()) {
            error = ProtocolMessageParser.maxTurnsError(ctx.maxTurns() > 0 ? ctx.maxTurns() : null);
        }
        boolean suppressed = false;
        if (error != null && ctx.interruptionActive() && message.isExecutionError()) {
            log.info("execution error suppressed after cancel: agentId={} queryId={}",
                    ctx.agentId(), ctx.queryId());
            error = null;
            suppressed = true;
        }

        TokenCounts usage = message.usage() != null ? message.usage().copy() : TokenCounts.zero();
        TurnResult result = new TurnResult(message.subtype(), durationMs, message.totalCostUsd(), usage,
                message.modelUsage(), message.stopReason(), message.stopSequence(), message.requestId(),
                message.turnCount(), message.permissionRequest(), message.resultText(), error, suppressed);

        List<QueryEvent> events = new ArrayList<>(2);
        events.add(new QueryEvent.TurnCompleted(ctx.agentId(), ctx.queryId(), result));
        if (result.hasPermissionRequest()) {
            events.add(new QueryEvent.PermissionRequested(ctx.agentId(), ctx.queryId(), result.permissionRequest()));
        }
        return Normalization.of(new TranscriptDelta.TurnFinalized(result), events);
    }
}
