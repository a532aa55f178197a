package com.agentdesk.agent.interrupt;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived per-agent markers left by a user cancel.
 * <p>
 * While a marker is younger than the window it suppresses the late cancellation
 * echo and the execution-error result of the query that was cancelled. A marker
 * only applies to that query: content of a query started after the cancel is
 * never suppressed.
 * <p>
 * Thread-safe. {@link #sweep()} may run concurrently with {@link #record} and
 * {@link #isSuppressing}.
 */
@Slf4j
public class InterruptionTracker {

    private final Clock clock;
    private final Duration window;
    private final Map<String, InterruptionRecord> records = new ConcurrentHashMap<>();

    public InterruptionTracker(Clock clock, Duration window) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.window = window;
    }

    public InterruptionRecord record(String agentId, String queryId) {
        InterruptionRecord rec = new InterruptionRecord(agentId, queryId, clock.instant());
        records.put(agentId, rec);
        log.debug("interruption recorded: agentId={} queryId={} at={}", agentId, queryId, rec.cancelledAt());
        return rec;
    }

    /**
     * Whether late messages of {@code queryId} on {@code agentId} fall inside an
     * interruption window.
     */
    public boolean isSuppressing(String agentId, String queryId) {
        InterruptionRecord rec = records.get(agentId);
        if (rec == null || !rec.isYoungerThan(window, clock.instant())) {
            return false;
        }
        return rec.queryId() == null || rec.queryId().equals(queryId);
    }

    public InterruptionRecord get(String agentId) {
        return records.get(agentId);
    }

    public void clear(String agentId) {
        records.remove(agentId);
    }

    /**
     * Drop every record older than the window.
     *
     * @return number of records removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int before = records.size();
        records.values().removeIf(rec -> !rec.isYoungerThan(window, now));
        int removed = Math.max(0, before - records.size());
        if (removed > 0) {
            log.debug("interruption sweep: removed={} remaining={}", removed, records.size());
        }
        return removed;
    }

    public int size() {
        return records.size();
    }

    public Duration window() {
        return window;
    }
}
