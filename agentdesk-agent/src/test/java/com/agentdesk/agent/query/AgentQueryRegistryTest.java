package com.agentdesk.agent.query;

import com.agentdesk.agent.backend.ChannelEvent;
import com.agentdesk.agent.backend.PromptPayload;
import com.agentdesk.agent.error.ChannelException;
import com.agentdesk.agent.testing.FakeBackendChannel;
import com.agentdesk.agent.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentQueryRegistryTest {

    private FakeBackendChannel channel;
    private List<QueryHandle> superseded;
    private AgentQueryRegistry registry;

    @BeforeEach
    void setUp() {
        channel = new FakeBackendChannel();
        superseded = new ArrayList<>();
        registry = new AgentQueryRegistry(channel, new MutableClock(), superseded::add);
    }

    private static PromptPayload payload(String agentId) {
        return new PromptPayload("hi", agentId, null, null, null, "default", 10, List.of());
    }

    private QueryHandle start(String agentId) {
        return registry.startQuery(agentId, payload(agentId), h -> {
            for (ChannelEvent.Kind kind : ChannelEvent.Kind.values()) {
                h.addSubscription(channel.subscribe(h.getQueryId(), kind, e -> {
                }));
            }
        });
    }

    @Nested
    class SingleFlight {

        @Test
        void startRegistersLiveQuery() {
            QueryHandle h = start("a");
            assertTrue(h.isLive());
            assertSame(h, registry.current("a"));
            assertTrue(registry.isQuerying("a"));
            assertTrue(registry.isStreaming("a"));
        }

        @Test
        void secondStartSupersedesFirst() {
            QueryHandle first = start("a");
            QueryHandle second = start("a");

            assertEquals(1, registry.liveCount());
            assertSame(second, registry.current("a"));
            assertFalse(first.isLive());
            assertTrue(first.isCancelled());
            assertTrue(first.isDetached());
            assertEquals(List.of(first), superseded);
            assertEquals(List.of(first.getQueryId()), channel.aborted());
        }

        @Test
        void supersededListenersRemovedExactlyOnce() {
            QueryHandle first = start("a");
            start("a");
            registry.onTerminal("a", first.getQueryId());
            first.detach();

            assertEquals(0, channel.listenerCount(first.getQueryId()));
            assertEquals(3, channel.unsubscribeCalls(first.getQueryId()));
        }

        @Test
        void agentsDoNotShareSlots() {
            start("a");
            start("b");
            assertEquals(2, registry.liveCount());
            assertTrue(superseded.isEmpty());
        }

        @Test
        void failedStartLeavesNoSlot() {
            channel.failNextStart("spawn failed");
            assertThrows(ChannelException.class, () -> start("a"));
            assertFalse(registry.isQuerying("a"));
        }

        @Test
        void unexpectedStartFailureIsWrapped() {
            channel.failNextStartWith(new IllegalStateException("boom"));
            ChannelException e = assertThrows(ChannelException.class, () -> start("a"));
            assertEquals("a", e.getAgentId());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }

    @Nested
    class Terminal {

        @Test
        void resultClearsLiveSlotOnly() {
            QueryHandle h = start("a");
            assertTrue(registry.onResult("a", h.getQueryId()));
            assertFalse(registry.isQuerying("a"));
            assertTrue(registry.isStreaming("a"));
            assertFalse(h.isDetached());
        }

        @Test
        void terminalClearsBothAndDetaches() {
            QueryHandle h = start("a");
            assertTrue(registry.onTerminal("a", h.getQueryId()));
            assertFalse(registry.isQuerying("a"));
            assertFalse(registry.isStreaming("a"));
            assertTrue(h.isDetached());
            assertEquals(0, channel.listenerCount(h.getQueryId()));
        }

        @Test
        void lateTerminalOfReplacedQueryIsIgnored() {
            QueryHandle old = start("a");
            QueryHandle current = start("a");

            assertFalse(registry.onResult("a", old.getQueryId()));
            assertFalse(registry.onTerminal("a", old.getQueryId()));
            assertSame(current, registry.current("a"));
            assertTrue(registry.isStreaming("a"));
        }

        @Test
        void startAfterResultDetachesLingeringStream() {
            QueryHandle old = start("a");
            registry.onResult("a", old.getQueryId());
            QueryHandle next = start("a");

            assertTrue(old.isDetached());
            assertFalse(old.isCancelled());
            assertTrue(channel.aborted().isEmpty());
            assertSame(next, registry.currentStream("a"));
        }
    }

    @Nested
    class Cancel {

        @Test
        void cancelKeepsSlot() {
            QueryHandle h = start("a");
            assertSame(h, registry.cancel("a"));
            assertTrue(h.isCancelled());
            assertTrue(registry.isQuerying("a"));
            assertEquals(List.of(h.getQueryId()), channel.aborted());
        }

        @Test
        void secondCancelIsNoOp() {
            start("a");
            assertNotNull(registry.cancel("a"));
            assertNull(registry.cancel("a"));
            assertEquals(1, channel.aborted().size());
        }

        @Test
        void cancellingTokenAbortsBackend() {
            QueryHandle h = start("a");

            assertTrue(h.getToken().cancel());
            assertFalse(h.getToken().cancel());

            assertEquals(List.of(h.getQueryId()), channel.aborted());
            assertNull(registry.cancel("a"));
            assertEquals(1, channel.aborted().size());
        }

        @Test
        void failedAbortDoesNotEscapeCancel() {
            QueryHandle h = start("a");
            channel.failAborts();

            assertSame(h, registry.cancel("a"));
            assertTrue(h.isCancelled());
            assertEquals(List.of(h.getQueryId()), channel.aborted());
        }

        @Test
        void unknownAgentIsNoOp() {
            assertNull(registry.cancel("ghost"));
        }
    }

    @Test
    void clearAllDetachesEverything() {
        QueryHandle a = start("a");
        QueryHandle b = start("b");
        List<QueryHandle> cleared = registry.clearAll();
        assertEquals(2, cleared.size());
        assertTrue(a.isDetached());
        assertTrue(b.isDetached());
        assertEquals(0, channel.totalListeners());
    }
}
