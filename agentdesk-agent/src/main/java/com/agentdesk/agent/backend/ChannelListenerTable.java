package com.agentdesk.agent.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Query-id to listener dispatch table shared by channel implementations.
 * <p>
 * A listener that throws is logged and skipped; the remaining listeners for the
 * same event still run and nobody is unsubscribed. Events for a query with no
 * listeners are dropped.
 */
@Slf4j
public class ChannelListenerTable {

    private final Map<String, List<Consumer<ChannelEvent>>> listeners = new ConcurrentHashMap<>();

    /**
     * @return a handle that removes the listener; calling it more than once has no effect
     */
    public Runnable subscribe(String queryId, ChannelEvent.Kind kind, Consumer<ChannelEvent> listener) {
        String key = key(kind, queryId);
        listeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> {
            List<Consumer<ChannelEvent>> list = listeners.get(key);
            if (list != null && list.remove(listener)) {
                listeners.computeIfPresent(key, (k, v) -> v.isEmpty() ? null : v);
            }
        };
    }

    /**
     * @return number of listeners that ran without throwing
     */
    public int dispatch(ChannelEvent event) {
        List<Consumer<ChannelEvent>> list = listeners.get(key(event.kind(), event.queryId()));
        if (list == null || list.isEmpty()) {
            log.debug("event dropped: queryId={} kind={} reason=no_listener", event.queryId(), event.kind());
            return 0;
        }
        int delivered = 0;
        for (Consumer<ChannelEvent> listener : list) {
            try {
                listener.accept(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("listener failed: queryId={} kind={} error={}",
                        event.queryId(), event.kind(), e.toString(), e);
            }
        }
        return delivered;
    }

    public int listenerCount(String queryId) {
        int count = 0;
        for (ChannelEvent.Kind kind : ChannelEvent.Kind.values()) {
            List<Consumer<ChannelEvent>> list = listeners.get(key(kind, queryId));
            if (list != null) {
                count += list.size();
            }
        }
        return count;
    }

    public int totalListeners() {
        return listeners.values().stream().mapToInt(List::size).sum();
    }

    private static String key(ChannelEvent.Kind kind, String queryId) {
        return kind.name() + ":" + queryId;
    }
}
