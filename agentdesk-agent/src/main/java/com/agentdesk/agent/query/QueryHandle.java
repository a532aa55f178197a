package com.agentdesk.agent.query;

import com.agentdesk.agent.transcript.TranscriptMessage;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one in-flight query: identity, cancellation token, start time, the
 * channel subscriptions to tear down, and the text accumulated so far.
 * <p>
 * Mutated only while the owning orchestrator holds its lock.
 */
@Slf4j
@Getter
public class QueryHandle {

    private final String agentId;
    private final String queryId;
    private final String prompt;
    private final CancellationToken token;
    private final Instant startedAt;
    private final CompletableFuture<String> completion = new CompletableFuture<>();

    @Getter(AccessLevel.NONE)
    private final List<Runnable> subscriptions = new CopyOnWriteArrayList<>();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean detached = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean errorLatch = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final StringBuilder text = new StringBuilder();

    @Setter
    private volatile boolean live;
    @Setter
    private boolean resultReceived;
    @Setter
    private TranscriptMessage assistantEntry;
    /** Turn limit sent with the query, 0 when unknown. */
    @Setter
    private int maxTurns;

    public QueryHandle(String agentId, String queryId, String prompt, CancellationToken token, Instant startedAt) {
        this.agentId = agentId;
        this.queryId = queryId;
        this.prompt = prompt;
        this.token = token;
        this.startedAt = startedAt;
    }

    public void addSubscription(Runnable unsubscribe) {
        if (detached.get()) {
            unsubscribe.run();
            return;
        }
        subscriptions.add(unsubscribe);
    }

    /**
     * Unsubscribe every channel listener of this query. Runs at most once.
     *
     * @return true if this call performed the teardown
     */
    public boolean detach() {
        if (!detached.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable unsubscribe : subscriptions) {
            try {
                unsubscribe.run();
            } catch (RuntimeException e) {
                log.warn("unsubscribe failed: agentId={} queryId={} error={}", agentId, queryId, e.toString());
            }
        }
        log.debug("listeners detached: agentId={} queryId={} count={}", agentId, queryId, subscriptions.size());
        subscriptions.clear();
        return true;
    }

    public boolean isDetached() {
        return detached.get();
    }

    /**
     * Claim the right to surface this query's error.
     *
     * @return true for the first caller only
     */
    public boolean claimError() {
        return errorLatch.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public void appendText(String chunk) {
        text.append(chunk);
    }

    public String text() {
        return text.toString();
    }

    /**
     * Resolve the caller's future with the text accumulated so far.
     */
    public boolean resolve() {
        return completion.complete(text.toString());
    }

    public boolean fail(Throwable error) {
        return completion.completeExceptionally(error);
    }
}
