package com.agentdesk.agent.orchestrator;

import com.agentdesk.agent.backend.AttachmentResolver;
import com.agentdesk.agent.backend.BackendQueryChannel;
import com.agentdesk.agent.backend.ChannelEvent;
import com.agentdesk.agent.backend.PromptPayload;
import com.agentdesk.agent.error.ChannelException;
import com.agentdesk.agent.error.ConfigurationException;
import com.agentdesk.agent.error.ProtocolException;
import com.agentdesk.agent.error.QueryException;
import com.agentdesk.agent.error.ValidationException;
import com.agentdesk.agent.interrupt.InterruptionTracker;
import com.agentdesk.agent.normalize.MessageNormalizer;
import com.agentdesk.agent.normalize.Normalization;
import com.agentdesk.agent.normalize.NormalizationContext;
import com.agentdesk.agent.normalize.QueryEvent;
import com.agentdesk.agent.normalize.TranscriptDelta;
import com.agentdesk.agent.normalize.TurnResult;
import com.agentdesk.agent.protocol.MessageValidator;
import com.agentdesk.agent.protocol.ProtocolMessage;
import com.agentdesk.agent.protocol.ProtocolMessageParser;
import com.agentdesk.agent.protocol.ValidationResult;
import com.agentdesk.agent.query.AgentQueryRegistry;
import com.agentdesk.agent.query.QueryHandle;
import com.agentdesk.agent.query.QueryOptions;
import com.agentdesk.agent.session.AgentSession;
import com.agentdesk.agent.session.AgentSessionDirectory;
import com.agentdesk.agent.transcript.ToolUsage;
import com.agentdesk.agent.transcript.TranscriptMessage;
import com.agentdesk.agent.transcript.TranscriptStore;
import com.agentdesk.agent.usage.ModelUsage;
import com.agentdesk.agent.usage.SessionUsage;
import com.agentdesk.agent.usage.TokenCounts;
import com.agentdesk.agent.usage.UsageAccumulator;
import com.agentdesk.common.config.QuerySettings;
import com.agentdesk.common.config.SettingsProvider;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for sending prompts to the backend and following their streams.
 * <p>
 * Each agent has at most one live query. Sending while a query is live
 * replaces it silently; {@link #stop} cancels it cooperatively and leaves the
 * stream running until the backend's own terminal events. Backend events are
 * normalized into transcript updates, usage totals and {@link QueryEvent}s.
 * <p>
 * Every state change, whether from a caller or from a channel listener, runs
 * under one lock, so no other send or event can observe a half-updated agent.
 * Observers are called while that lock is held.
 */
@Slf4j
public class StreamingQueryOrchestrator implements AutoCloseable {

    private final AgentSessionDirectory sessions;
    private final BackendQueryChannel channel;
    private final TranscriptStore transcript;
    private final SettingsProvider settings;
    private final AttachmentResolver attachments;
    private final ProtocolMessageParser parser;
    private final Clock clock;

    private final AgentQueryRegistry registry;
    private final InterruptionTracker interruptions;
    private final UsageAccumulator usage = new UsageAccumulator();
    private final List<QueryObserver> observers = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService sweeper;

    private final Object lock = new Object();
    private boolean closed;

    public StreamingQueryOrchestrator(AgentSessionDirectory sessions, BackendQueryChannel channel,
                                      TranscriptStore transcript, SettingsProvider settings) {
        this(sessions, channel, transcript, settings, AttachmentResolver.none(), OrchestratorOptions.defaults());
    }

    public StreamingQueryOrchestrator(AgentSessionDirectory sessions, BackendQueryChannel channel,
                                      TranscriptStore transcript, SettingsProvider settings,
                                      AttachmentResolver attachments, OrchestratorOptions options) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.transcript = Objects.requireNonNull(transcript, "transcript");
        this.settings = settings != null ? settings : SettingsProvider.of(QuerySettings.defaults());
        this.attachments = attachments != null ? attachments : AttachmentResolver.none();
        this.parser = new ProtocolMessageParser();
        this.clock = options.clock();
        this.registry = new AgentQueryRegistry(channel, clock, this::onSuperseded);
        this.interruptions = new InterruptionTracker(clock, options.interruptionWindow());

        if (options.startSweeper()) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "agentdesk-interruption-sweep");
                t.setDaemon(true);
                return t;
            });
            long periodMs = options.sweepInterval().toMillis();
            sweeper.scheduleAtFixedRate(this::sweepInterruptions, periodMs, periodMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    // ── Observers ─────────────────────────────────────────────────────

    /**
     * @return a handle that removes the observer
     */
    public Runnable addObserver(QueryObserver observer) {
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    private void emit(QueryEvent event) {
        for (QueryObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("observer failed: agentId={} event={} error={}",
                        event.agentId(), event.getClass().getSimpleName(), e.toString(), e);
            }
        }
    }

    // ── Send ──────────────────────────────────────────────────────────

    public CompletableFuture<String> send(String agentId, String text) {
        return send(agentId, text, QueryOptions.defaults());
    }

    /**
     * Start a query for {@code agentId}, replacing any query it still has.
     * <p>
     * The future resolves with the accumulated assistant text when the stream
     * completes, including after a cancel or a replacement. It fails with
     * {@link ConfigurationException} for an unknown agent and with
     * {@link ChannelException} when the backend cannot start the query or
     * reports a stream error.
     */
    public CompletableFuture<String> send(String agentId, String text, QueryOptions options) {
        Objects.requireNonNull(text, "text");
        QueryOptions opts = options != null ? options : QueryOptions.defaults();
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(
                        new ChannelException("orchestrator is closed", agentId, null));
            }
            AgentSession session;
            try {
                session = sessions.resolve(agentId);
            } catch (ConfigurationException e) {
                log.warn("send rejected: agentId={} reason=unknown_agent", agentId);
                return CompletableFuture.failedFuture(e);
            }

            PromptPayload payload = buildPayload(session, text, opts);
            QueryHandle handle;
            try {
                handle = registry.startQuery(agentId, payload, this::wire);
            } catch (ChannelException e) {
                log.error("query start failed: agentId={} error={}", agentId, e.getMessage(), e);
                return CompletableFuture.failedFuture(e);
            }

            transcript.appendOrUpdateMessage(agentId,
                    TranscriptMessage.user(handle.getQueryId(), text, handle.getStartedAt()));
            usage.resetCurrentResponse(agentId);
            emit(new QueryEvent.QueryStarted(agentId, handle.getQueryId()));
            return handle.getCompletion().copy();
        }
    }

    /**
     * Silently cancel whatever {@code agentId} is running and send {@code text}
     * in the same step.
     */
    public CompletableFuture<String> cancelAndSend(String agentId, String text, QueryOptions options) {
        synchronized (lock) {
            cancelQuery(agentId, true);
            return send(agentId, text, options);
        }
    }

    public CompletableFuture<String> cancelAndSend(String agentId, String text) {
        return cancelAndSend(agentId, text, QueryOptions.defaults());
    }

    private PromptPayload buildPayload(AgentSession session, String text, QueryOptions opts) {
        QuerySettings defaults = settings.current();
        String permissionMode = firstNonNull(opts.getPermissionMode(), session.getPermissionMode(),
                defaults.permissionMode());
        String model = firstNonNull(opts.getModel(), session.getModel(), defaults.model());
        String cwd = firstNonNull(opts.getCwd(), session.getCwd(), null);
        int maxTurns = opts.getMaxTurns() != null && opts.getMaxTurns() > 0 ? opts.getMaxTurns() : defaults.maxTurns();
        return new PromptPayload(text, session.getAgentId(), session.getBackendSessionId(), cwd, model,
                permissionMode, maxTurns, attachments.resolve(session.getAgentId(), opts.getAttachmentRefs()));
    }

    private void wire(QueryHandle handle) {
        String queryId = handle.getQueryId();
        handle.addSubscription(channel.subscribe(queryId, ChannelEvent.Kind.MESSAGE,
                event -> onMessage(handle, event.raw())));
        handle.addSubscription(channel.subscribe(queryId, ChannelEvent.Kind.COMPLETE,
                event -> onComplete(handle)));
        handle.addSubscription(channel.subscribe(queryId, ChannelEvent.Kind.ERROR,
                event -> onError(handle, event.error())));
    }

    // ── Cancel ────────────────────────────────────────────────────────

    public boolean stop(String agentId) {
        return stop(agentId, false);
    }

    /**
     * Cancel the live query of {@code agentId}.
     *
     * @param silentCancel skip the local "[Request interrupted by user]" line
     * @return true if a query was cancelled; false for unknown agents, idle
     * agents and queries that were already cancelled
     */
    public boolean stop(String agentId, boolean silentCancel) {
        return cancelQuery(agentId, silentCancel);
    }

    private boolean cancelQuery(String agentId, boolean silent) {
        synchronized (lock) {
            QueryHandle handle = registry.current(agentId);
            if (handle == null || handle.isCancelled()) {
                log.debug("cancel skipped: agentId={} reason={}", agentId,
                        handle == null ? "no_live_query" : "already_cancelled");
                return false;
            }
            interruptions.record(agentId, handle.getQueryId());
            if (registry.cancel(agentId) == null) {
                return false;
            }
            log.info("query cancelled: agentId={} queryId={} silent={}", agentId, handle.getQueryId(), silent);
            if (!silent) {
                TranscriptMessage marker = TranscriptMessage.user(handle.getQueryId(),
                        MessageNormalizer.INTERRUPTION_MARKER, clock.instant());
                marker.setInterruptionMarker(true);
                transcript.appendOrUpdateMessage(agentId, marker);
            }
            emit(new QueryEvent.QueryCancelled(agentId, handle.getQueryId(), silent));
            return true;
        }
    }

    private void onSuperseded(QueryHandle old) {
        log.debug("resolving replaced query: agentId={} queryId={} textLength={}",
                old.getAgentId(), old.getQueryId(), old.text().length());
        old.resolve();
    }

    // ── Channel events ────────────────────────────────────────────────

    private void onMessage(QueryHandle handle, JsonNode raw) {
        synchronized (lock) {
            if (handle.isDetached()) {
                log.debug("message dropped: agentId={} queryId={} reason=detached",
                        handle.getAgentId(), handle.getQueryId());
                return;
            }
            String agentId = handle.getAgentId();
            String queryId = handle.getQueryId();

            ValidationResult validation = MessageValidator.validate(raw);
            if (!validation.isUsable()) {
                notice(new ProtocolException("invalid message: " + String.join(", ", validation.warnings()),
                        agentId, queryId, null));
                return;
            }
            if (validation.method() == ValidationResult.Method.RELAXED) {
                notice(new ValidationException("message accepted in relaxed mode", agentId, queryId,
                        validation.warnings()));
            }

            ProtocolMessage message;
            try {
                message = parser.parse(raw);
            } catch (ProtocolException e) {
                notice(e.scopedTo(agentId, queryId));
                return;
            }
            log.debug("message routed: agentId={} queryId={} tag={}", agentId, queryId, message.tag().wireName());

            NormalizationContext ctx = new NormalizationContext(agentId, queryId, handle.getStartedAt(),
                    clock.instant(), interruptions.isSuppressing(agentId, queryId), handle.getMaxTurns());
            apply(handle, MessageNormalizer.normalize(message, ctx));
        }
    }

    private void onComplete(QueryHandle handle) {
        synchronized (lock) {
            if (handle.isDetached()) {
                return;
            }
            endStream(handle);
            log.info("query completed: agentId={} queryId={} cancelled={}",
                    handle.getAgentId(), handle.getQueryId(), handle.isCancelled());
            String finalText = handle.text();
            handle.resolve();
            emit(new QueryEvent.StreamCompleted(handle.getAgentId(), handle.getQueryId(), finalText));
        }
    }

    private void onError(QueryHandle handle, String error) {
        synchronized (lock) {
            if (handle.isDetached()) {
                return;
            }
            String agentId = handle.getAgentId();
            String queryId = handle.getQueryId();
            endStream(handle);

            if (handle.isCancelled()) {
                log.info("stream error after cancel: agentId={} queryId={} error={}", agentId, queryId, error);
                handle.resolve();
                emit(new QueryEvent.StreamCompleted(agentId, queryId, handle.text()));
                return;
            }
            String message = error != null && !error.isBlank() ? error : "backend stream failed";
            if (handle.claimError()) {
                recordError(handle, message);
                emit(new QueryEvent.QueryFailed(agentId, queryId, message));
            } else {
                log.debug("duplicate error suppressed: agentId={} queryId={}", agentId, queryId);
            }
            handle.fail(new ChannelException(message, agentId, queryId));
        }
    }

    private void endStream(QueryHandle handle) {
        registry.onResult(handle.getAgentId(), handle.getQueryId());
        registry.onTerminal(handle.getAgentId(), handle.getQueryId());
        handle.detach();
    }

    private void notice(QueryException cause) {
        log.warn("query notice: agentId={} queryId={} type={} message={}",
                cause.getAgentId(), cause.getQueryId(), cause.getClass().getSimpleName(), cause.getMessage());
        emit(new QueryEvent.Notice(cause.getAgentId(), cause.getQueryId(), cause));
    }

    // ── Normalization output ──────────────────────────────────────────

    private void apply(QueryHandle handle, Normalization normalization) {
        String agentId = handle.getAgentId();
        normalization.delta().ifPresent(delta -> applyDelta(handle, delta));

        for (QueryEvent event : normalization.events()) {
            if (event instanceof QueryEvent.SessionBound bound) {
                bindSession(agentId, bound);
            } else if (event instanceof QueryEvent.ContentDelta delta) {
                usage.onContentDelta(agentId, delta.isNewMessage());
            } else if (event instanceof QueryEvent.ToolInvocation invocation) {
                TranscriptMessage entry = assistantEntry(handle);
                entry.getToolUsages().add(ToolUsage.invoked(invocation.toolId(), invocation.name(),
                        invocation.input(), invocation.parentToolId(), invocation.description()));
                transcript.appendOrUpdateMessage(agentId, entry);
            } else if (event instanceof QueryEvent.ToolCompletion completion) {
                completeTool(handle, completion);
            } else if (event instanceof QueryEvent.UsageReported reported) {
                TokenCounts current = usage.addOutputTokens(agentId, reported.usage().getOutput());
                event = reported.withCurrentResponse(current);
            }
            emit(event);
        }
    }

    private void applyDelta(QueryHandle handle, TranscriptDelta delta) {
        String agentId = handle.getAgentId();
        if (delta instanceof TranscriptDelta.AssistantText text) {
            TranscriptMessage entry = assistantEntry(handle);
            entry.appendContent(text.text());
            handle.appendText(text.text());
            transcript.appendOrUpdateMessage(agentId, entry);
        } else if (delta instanceof TranscriptDelta.UserLine line) {
            TranscriptMessage msg = TranscriptMessage.user(handle.getQueryId(), line.text(), clock.instant());
            msg.setInterruptionMarker(MessageNormalizer.isInterruptionEcho(line.text()));
            transcript.appendOrUpdateMessage(agentId, msg);
        } else if (delta instanceof TranscriptDelta.TurnFinalized finalized) {
            finalizeTurn(handle, finalized.result());
        }
    }

    private TranscriptMessage assistantEntry(QueryHandle handle) {
        TranscriptMessage entry = handle.getAssistantEntry();
        if (entry == null) {
            entry = TranscriptMessage.assistant(handle.getQueryId(), clock.instant());
            handle.setAssistantEntry(entry);
        }
        return entry;
    }

    private void completeTool(QueryHandle handle, QueryEvent.ToolCompletion completion) {
        TranscriptMessage entry = handle.getAssistantEntry();
        ToolUsage tool = entry != null ? entry.findToolUsage(completion.toolId()) : null;
        if (tool == null) {
            log.debug("tool result without invocation: agentId={} toolId={}",
                    handle.getAgentId(), completion.toolId());
            return;
        }
        tool.complete(completion.content(), completion.isError());
        transcript.appendOrUpdateMessage(handle.getAgentId(), entry);
    }

    private void bindSession(String agentId, QueryEvent.SessionBound bound) {
        sessions.find(agentId).ifPresent(session -> {
            if (bound.backendSessionId() != null) {
                session.setBackendSessionId(bound.backendSessionId());
            }
            if (bound.mcpServers() != null) {
                session.setMcpServers(new ArrayList<>(bound.mcpServers()));
            }
            log.info("session bound: agentId={} backendSessionId={} mcpServers={}",
                    agentId, bound.backendSessionId(), bound.mcpServers());
        });
    }

    private void finalizeTurn(QueryHandle handle, TurnResult result) {
        String agentId = handle.getAgentId();
        handle.setResultReceived(true);
        registry.onResult(agentId, handle.getQueryId());
        usage.recordQuery(agentId, result.usage(), result.costUsd(), result.durationMs());
        usage.updateContextUsage(agentId, result.modelUsage());

        boolean surfaceError = result.hasError() && handle.claimError();
        TranscriptMessage entry = handle.getAssistantEntry();
        if (entry == null && (surfaceError || result.hasPermissionRequest())) {
            entry = assistantEntry(handle);
            if (surfaceError) {
                entry.appendContent(result.error());
            }
        }
        if (entry != null) {
            entry.setTokenUsage(result.usage().copy());
            entry.setStopReason(result.stopReason());
            entry.setStopSequence(result.stopSequence());
            entry.setRequestId(result.requestId());
            entry.setTurnCount(result.turnCount());
            entry.setModelUsage(result.modelUsage().isEmpty() ? null : result.modelUsage());
            entry.setPermissionRequest(result.permissionRequest());
            entry.setCostUsd(result.costUsd());
            entry.setDurationMs(result.durationMs());
            if (surfaceError) {
                entry.setError(result.error());
            }
            transcript.appendOrUpdateMessage(agentId, entry);
        }
        if (surfaceError) {
            emit(new QueryEvent.QueryFailed(agentId, handle.getQueryId(), result.error()));
        } else if (result.hasError()) {
            log.debug("duplicate error suppressed: agentId={} queryId={}", agentId, handle.getQueryId());
        }
    }

    private void recordError(QueryHandle handle, String error) {
        TranscriptMessage entry = handle.getAssistantEntry();
        if (entry == null) {
            entry = assistantEntry(handle);
            entry.appendContent(error);
        }
        entry.setError(error);
        transcript.appendOrUpdateMessage(handle.getAgentId(), entry);
    }

    // ── Query ─────────────────────────────────────────────────────────

    /** True from send until the query's result (or stream end). */
    public boolean isQuerying(String agentId) {
        return registry.isQuerying(agentId);
    }

    /** True from send until the stream's complete or error; never clears before {@link #isQuerying}. */
    public boolean isStreaming(String agentId) {
        return registry.isStreaming(agentId);
    }

    public SessionUsage sessionUsage(String agentId) {
        return usage.sessionUsage(agentId);
    }

    public TokenCounts currentResponseTokens(String agentId) {
        return usage.currentResponse(agentId);
    }

    /**
     * Latest per-model context-window usage of {@code agentId}, keyed by model name.
     */
    public Map<String, ModelUsage> contextUsage(String agentId) {
        return usage.contextUsage(agentId);
    }

    public int liveQueryCount() {
        return registry.liveCount();
    }

    /**
     * Drop interruption records older than the window.
     *
     * @return number of records removed
     */
    public int sweepInterruptions() {
        try {
            return interruptions.sweep();
        } catch (RuntimeException e) {
            log.warn("interruption sweep failed: error={}", e.toString(), e);
            return 0;
        }
    }

    InterruptionTracker interruptions() {
        return interruptions;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────

    /**
     * Stop the sweep, abort live queries and resolve every outstanding send
     * with its partial text.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (sweeper != null) {
                sweeper.shutdownNow();
            }
            for (QueryHandle handle : registry.clearAll()) {
                if (!handle.isResultReceived()) {
                    handle.getToken().cancel();
                }
                handle.resolve();
            }
            log.info("orchestrator closed");
        }
    }

    private static String firstNonNull(String a, String b, String c) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        if (b != null && !b.isBlank()) {
            return b;
        }
        return c;
    }
}
