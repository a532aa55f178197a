package com.agentdesk.agent.backend;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelListenerTableTest {

    private final ChannelListenerTable table = new ChannelListenerTable();

    @Test
    void dispatchesByQueryAndKind() {
        List<String> seen = new ArrayList<>();
        table.subscribe("q-1", ChannelEvent.Kind.COMPLETE, e -> seen.add("q-1:complete"));
        table.subscribe("q-2", ChannelEvent.Kind.COMPLETE, e -> seen.add("q-2:complete"));
        table.subscribe("q-1", ChannelEvent.Kind.ERROR, e -> seen.add("q-1:error"));

        table.dispatch(ChannelEvent.complete("q-1"));
        assertEquals(List.of("q-1:complete"), seen);
    }

    @Test
    void throwingListenerDoesNotAffectOthers() {
        List<String> seen = new ArrayList<>();
        table.subscribe("q-1", ChannelEvent.Kind.COMPLETE, e -> {
            throw new IllegalStateException("boom");
        });
        table.subscribe("q-1", ChannelEvent.Kind.COMPLETE, e -> seen.add("second"));

        assertEquals(1, table.dispatch(ChannelEvent.complete("q-1")));
        assertEquals(1, table.dispatch(ChannelEvent.complete("q-1")));
        assertEquals(List.of("second", "second"), seen);
        assertEquals(2, table.listenerCount("q-1"));
    }

    @Test
    void unsubscribeIsIdempotent() {
        Runnable off = table.subscribe("q-1", ChannelEvent.Kind.MESSAGE, e -> {
        });
        table.subscribe("q-1", ChannelEvent.Kind.MESSAGE, e -> {
        });
        off.run();
        off.run();
        assertEquals(1, table.listenerCount("q-1"));
    }

    @Test
    void eventsWithoutListenersAreDropped() {
        assertEquals(0, table.dispatch(ChannelEvent.error("q-9", "gone")));
        assertEquals(0, table.totalListeners());
    }
}
