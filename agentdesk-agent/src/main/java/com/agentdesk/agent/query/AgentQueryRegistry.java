package com.agentdesk.agent.query;

import com.agentdesk.agent.backend.BackendQueryChannel;
import com.agentdesk.agent.backend.PromptPayload;
import com.agentdesk.agent.error.ChannelException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Holds at most one live query per agent.
 * <p>
 * Two slots are kept per agent: the live slot, held from start until the
 * query's first terminal event, and the streaming slot, held until the
 * stream's own {@code complete} or {@code error}. Slots are cleared by query
 * id, so a late terminal event of a replaced query never clears its successor.
 * <p>
 * All methods are synchronized; callers that combine several calls into one
 * step hold their own lock around them.
 */
@Slf4j
public class AgentQueryRegistry {

    private final BackendQueryChannel channel;
    private final Clock clock;
    private final Consumer<QueryHandle> supersessionHandler;

    private final Map<String, QueryHandle> live = new HashMap<>();
    private final Map<String, QueryHandle> streaming = new HashMap<>();

    /**
     * @param supersessionHandler told about every query replaced by a newer one,
     *                            after its listeners are gone
     */
    public AgentQueryRegistry(BackendQueryChannel channel, Clock clock, Consumer<QueryHandle> supersessionHandler) {
        this.channel = channel;
        this.clock = clock;
        this.supersessionHandler = supersessionHandler != null ? supersessionHandler : h -> {
        };
    }

    // ── Start ─────────────────────────────────────────────────────────

    /**
     * Replace any query of {@code agentId} and start a new one.
     *
     * @param wiring subscribes the new query's channel listeners; runs before the
     *               handle becomes visible
     * @throws ChannelException if the backend refuses the query
     */
    public synchronized QueryHandle startQuery(String agentId, PromptPayload payload, Consumer<QueryHandle> wiring) {
        supersede(agentId);

        String queryId;
        try {
            queryId = channel.start(payload);
        } catch (ChannelException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ChannelException("backend failed to start query: " + e.getMessage(), agentId, null, e);
        }
        if (queryId == null || queryId.isBlank()) {
            throw new ChannelException("backend returned no query id", agentId, null);
        }

        CancellationToken token = new CancellationToken();
        QueryHandle handle = new QueryHandle(agentId, queryId, payload.prompt(), token, clock.instant());
        token.onCancel(() -> abortQuietly(handle));
        handle.setMaxTurns(payload.maxTurns());
        if (wiring != null) {
            wiring.accept(handle);
        }
        handle.setLive(true);
        live.put(agentId, handle);
        streaming.put(agentId, handle);
        log.info("query started: agentId={} queryId={} totalLive={}", agentId, queryId, live.size());
        return handle;
    }

    /**
     * Detach whatever query {@code agentId} still has, without any user-visible
     * interruption. A still-live query is also cancelled, which aborts it.
     *
     * @return the replaced query, or null
     */
    public synchronized QueryHandle supersede(String agentId) {
        QueryHandle current = live.remove(agentId);
        QueryHandle stream = streaming.remove(agentId);
        QueryHandle target = current != null ? current : stream;
        if (target == null) {
            return null;
        }
        if (stream != null && stream != target) {
            stream.detach();
        }
        target.detach();
        if (target.isLive()) {
            target.setLive(false);
            target.getToken().cancel();
        }
        log.info("query superseded: agentId={} queryId={}", agentId, target.getQueryId());
        try {
            supersessionHandler.accept(target);
        } catch (RuntimeException e) {
            log.warn("supersession handler failed: agentId={} queryId={} error={}",
                    agentId, target.getQueryId(), e.toString(), e);
        }
        return target;
    }

    // ── Cancel ────────────────────────────────────────────────────────

    /**
     * Signal the live query's token, which asks the backend to abort. The slots
     * stay in place until the query's terminal events arrive.
     *
     * @return the cancelled query, or null if there was none or it was already cancelled
     */
    public synchronized QueryHandle cancel(String agentId) {
        QueryHandle handle = live.get(agentId);
        if (handle == null) {
            log.debug("cancel skipped: agentId={} reason=no_live_query", agentId);
            return null;
        }
        if (!handle.getToken().cancel()) {
            log.debug("cancel skipped: agentId={} queryId={} reason=already_cancelled",
                    agentId, handle.getQueryId());
            return null;
        }
        return handle;
    }

    private void abortQuietly(QueryHandle handle) {
        try {
            channel.abort(handle.getQueryId());
        } catch (RuntimeException e) {
            log.warn("backend abort failed: agentId={} queryId={} error={}",
                    handle.getAgentId(), handle.getQueryId(), e.toString());
        }
    }

    // ── Terminal events ───────────────────────────────────────────────

    /**
     * A result arrived: the query is no longer live. Its listeners stay so the
     * stream's {@code complete} can still be delivered.
     *
     * @return true if {@code queryId} held the live slot
     */
    public synchronized boolean onResult(String agentId, String queryId) {
        QueryHandle handle = live.get(agentId);
        if (handle == null || !handle.getQueryId().equals(queryId)) {
            log.debug("live clear skipped: agentId={} queryId={} reason=handle_mismatch", agentId, queryId);
            return false;
        }
        live.remove(agentId);
        handle.setLive(false);
        log.debug("live cleared: agentId={} queryId={} totalLive={}", agentId, queryId, live.size());
        return true;
    }

    /**
     * The stream ended ({@code complete} or {@code error}): clear both slots if
     * {@code queryId} still holds them and unsubscribe its listeners. No-op for a
     * query that was already replaced.
     *
     * @return true if {@code queryId} was the agent's current query
     */
    public synchronized boolean onTerminal(String agentId, String queryId) {
        QueryHandle stream = streaming.get(agentId);
        if (stream == null || !stream.getQueryId().equals(queryId)) {
            log.debug("terminal skipped: agentId={} queryId={} reason=handle_mismatch", agentId, queryId);
            return false;
        }
        streaming.remove(agentId);
        QueryHandle current = live.get(agentId);
        if (current == stream) {
            live.remove(agentId);
        }
        stream.setLive(false);
        stream.detach();
        log.debug("query cleared: agentId={} queryId={} totalLive={}", agentId, queryId, live.size());
        return true;
    }

    // ── Query ─────────────────────────────────────────────────────────

    public synchronized QueryHandle current(String agentId) {
        return live.get(agentId);
    }

    /**
     * The newest query of {@code agentId} whose stream has not ended, live or not.
     */
    public synchronized QueryHandle currentStream(String agentId) {
        return streaming.get(agentId);
    }

    public synchronized boolean isQuerying(String agentId) {
        return live.containsKey(agentId);
    }

    public synchronized boolean isStreaming(String agentId) {
        return streaming.containsKey(agentId);
    }

    public synchronized int liveCount() {
        return live.size();
    }

    /**
     * Detach and forget every query.
     *
     * @return the handles that were still tracked
     */
    public synchronized List<QueryHandle> clearAll() {
        List<QueryHandle> handles = new ArrayList<>(streaming.values());
        for (QueryHandle h : live.values()) {
            if (!handles.contains(h)) {
                handles.add(h);
            }
        }
        live.clear();
        streaming.clear();
        for (QueryHandle h : handles) {
            h.setLive(false);
            h.detach();
        }
        return handles;
    }
}
