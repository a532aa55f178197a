package com.agentdesk.agent.normalize;

import com.agentdesk.agent.protocol.ProtocolMessage;
import com.agentdesk.agent.protocol.ProtocolMessageParser;
import com.agentdesk.agent.testing.Messages;
import com.agentdesk.agent.usage.TokenCounts;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageNormalizerTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T10:00:00Z");

    private final ProtocolMessageParser parser = new ProtocolMessageParser();

    private static NormalizationContext ctx(boolean interrupted) {
        return new NormalizationContext("agent-1", "q-1", STARTED, STARTED.plusMillis(2500), interrupted);
    }

    private Normalization normalize(String json) {
        return MessageNormalizer.normalize(parser.parse(json), ctx(false));
    }

    @Nested
    class Assistant {

        @Test
        void textThenToolUseEmitsDeltaThenInvocation() {
            Normalization n = normalize(Messages.assistantTextAndTool("Let me look", "toolu_1", "/src/App.java"));

            assertEquals(2, n.events().size());
            QueryEvent.ContentDelta delta = assertInstanceOf(QueryEvent.ContentDelta.class, n.events().get(0));
            assertEquals("Let me look", delta.text());
            assertTrue(delta.isNewMessage());
            QueryEvent.ToolInvocation tool = assertInstanceOf(QueryEvent.ToolInvocation.class, n.events().get(1));
            assertEquals("toolu_1", tool.toolId());
            assertEquals("Read", tool.name());
            assertNull(tool.parentToolId());
            assertEquals("/src/App.java", tool.description());

            assertEquals(new TranscriptDelta.AssistantText("Let me look"), n.delta().orElseThrow());
        }

        @Test
        void consecutiveTextItemsConcatenateWithoutSeparator() {
            Normalization n = normalize("{\"type\":\"assistant\",\"message\":{\"content\":["
                    + "{\"type\":\"text\",\"text\":\"Hello\"},{\"type\":\"text\",\"text\":\" world\"}]}}");

            assertEquals(new TranscriptDelta.AssistantText("Hello world"), n.delta().orElseThrow());
            List<QueryEvent> events = n.events();
            assertEquals(2, events.size());
            assertTrue(((QueryEvent.ContentDelta) events.get(0)).isNewMessage());
            assertFalse(((QueryEvent.ContentDelta) events.get(1)).isNewMessage());
        }

        @Test
        void blankTextProducesNoTranscriptLine() {
            Normalization n = normalize("{\"type\":\"assistant\",\"message\":{\"content\":["
                    + "{\"type\":\"text\",\"text\":\"  \"},{\"type\":\"thinking\"}]}}");
            assertTrue(n.delta().isEmpty());
            assertTrue(n.events().isEmpty());
        }

        @Test
        void toolOnlyMessageHasNoDelta() {
            Normalization n = normalize("{\"type\":\"assistant\",\"parent_tool_use_id\":\"p-1\",\"message\":{"
                    + "\"content\":[{\"type\":\"tool_use\",\"id\":\"t1\",\"name\":\"Bash\","
                    + "\"input\":{\"command\":\"mvn test\"}},{\"type\":\"tool_use\",\"id\":\"t2\","
                    + "\"name\":\"Grep\",\"input\":{\"pattern\":\"TODO\"}}]}}");
            assertTrue(n.delta().isEmpty());
            assertEquals(2, n.events().size());
            QueryEvent.ToolInvocation first = (QueryEvent.ToolInvocation) n.events().get(0);
            QueryEvent.ToolInvocation second = (QueryEvent.ToolInvocation) n.events().get(1);
            assertEquals("t1", first.toolId());
            assertEquals("p-1", first.parentToolId());
            assertEquals("mvn test", first.description());
            assertEquals("\"TODO\" in .", second.description());
        }

        @Test
        void usageIsReportedLast() {
            Normalization n = normalize(Messages.assistantText("hi"));
            QueryEvent last = n.events().get(n.events().size() - 1);
            QueryEvent.UsageReported usage = assertInstanceOf(QueryEvent.UsageReported.class, last);
            assertEquals(new TokenCounts(10, 5, 0, 0), usage.usage());
            assertNull(usage.currentResponse());
        }
    }

    @Nested
    class User {

        @Test
        void echoSuppressedInsideInterruptionWindow() {
            ProtocolMessage echo = parser.parse(Messages.interruptionEcho());
            Normalization n = MessageNormalizer.normalize(echo, ctx(true));
            assertTrue(n.isEmpty());
        }

        @Test
        void echoKeptOutsideInterruptionWindow() {
            Normalization n = normalize(Messages.interruptionEcho());
            assertEquals(new TranscriptDelta.UserLine("[Request interrupted by user]"), n.delta().orElseThrow());
        }

        @Test
        void otherTextKeptEvenWhenInterrupted() {
            ProtocolMessage msg = parser.parse(Messages.userText("please continue"));
            Normalization n = MessageNormalizer.normalize(msg, ctx(true));
            assertEquals(new TranscriptDelta.UserLine("please continue"), n.delta().orElseThrow());
        }

        @Test
        void toolResultsBecomeCompletions() {
            Normalization n = normalize(Messages.userToolResult("toolu_1", "file contents"));
            assertTrue(n.delta().isEmpty());
            QueryEvent.ToolCompletion done = assertInstanceOf(QueryEvent.ToolCompletion.class, n.events().get(0));
            assertEquals("toolu_1", done.toolId());
            assertEquals("file contents", done.content());
            assertFalse(done.isError());
        }
    }

    @Nested
    class Tools {

        @Test
        void topLevelToolResultNeverCreatesLine() {
            Normalization n = normalize("{\"type\":\"tool_result\",\"tool_use_id\":\"t9\",\"content\":\"ok\","
                    + "\"is_error\":true}");
            assertTrue(n.delta().isEmpty());
            assertEquals(new QueryEvent.ToolCompletion("agent-1", "q-1", "t9", "ok", true), n.events().get(0));
        }

        @Test
        void topLevelToolUseEmitsInvocation() {
            Normalization n = normalize("{\"type\":\"tool_use\",\"id\":\"t3\",\"name\":\"WebSearch\","
                    + "\"input\":{\"query\":\"jdk 17\"}}");
            QueryEvent.ToolInvocation tool = assertInstanceOf(QueryEvent.ToolInvocation.class, n.events().get(0));
            assertEquals("jdk 17", tool.description());
        }
    }

    @Nested
    class SystemMessages {

        @Test
        void initBindsSessionWithoutDelta() {
            Normalization n = normalize(Messages.systemInit("backend-7"));
            assertTrue(n.delta().isEmpty());
            QueryEvent.SessionBound bound = assertInstanceOf(QueryEvent.SessionBound.class, n.events().get(0));
            assertEquals("backend-7", bound.backendSessionId());
            assertEquals(List.of("github"), bound.mcpServers());
        }

        @Test
        void compactBoundaryEmitsEvent() {
            Normalization n = normalize(Messages.compactBoundary(120000));
            QueryEvent.ContextCompacted compacted = assertInstanceOf(QueryEvent.ContextCompacted.class,
                    n.events().get(0));
            assertEquals(120000, compacted.preTokens());
            assertEquals("auto", compacted.trigger());
        }

        @Test
        void unknownTagIsIgnored() {
            assertTrue(normalize("{\"type\":\"stream_event\",\"event\":{}}").isEmpty());
        }
    }

    @Nested
    class Result {

        @Test
        void usesBackendDuration() {
            Normalization n = normalize(Messages.resultSuccess());
            TurnResult result = ((TranscriptDelta.TurnFinalized) n.delta().orElseThrow()).result();
            assertEquals(1200, result.durationMs());
            assertEquals(0.01, result.costUsd(), 1e-9);
            assertEquals(new TokenCounts(100, 40, 3, 7), result.usage());
            assertFalse(result.hasError());
            assertInstanceOf(QueryEvent.TurnCompleted.class, n.events().get(0));
        }

        @Test
        void computesDurationWhenMissing() {
            Normalization n = normalize(Messages.resultWithError("overloaded"));
            TurnResult result = ((TranscriptDelta.TurnFinalized) n.delta().orElseThrow()).result();
            assertEquals(2500, result.durationMs());
            assertEquals("overloaded", result.error());
            assertTrue(result.usage().isEmpty());
        }

        @Test
        void zeroBackendDurationFallsBackToElapsed() {
            Normalization n = normalize(Messages.resultWithZeroModelUsage());
            TurnResult result = ((TranscriptDelta.TurnFinalized) n.delta().orElseThrow()).result();
            assertEquals(2500, result.durationMs());
        }

        @Test
        void maxTurnsWithoutCountUsesConfiguredLimit() {
            ProtocolMessage msg = parser.parse(Messages.resultMaxTurns(null));
            NormalizationContext limited = new NormalizationContext("agent-1", "q-1", STARTED,
                    STARTED.plusMillis(2500), false, 10);
            TurnResult result = ((TranscriptDelta.TurnFinalized) MessageNormalizer.normalize(msg, limited)
                    .delta().orElseThrow()).result();
            assertEquals("Maximum turns limit reached (10 turns)", result.error());
        }

        @Test
        void maxTurnsWithoutAnyCount() {
            TurnResult result = ((TranscriptDelta.TurnFinalized) normalize(Messages.resultMaxTurns(null))
                    .delta().orElseThrow()).result();
            assertEquals("Maximum turns limit reached", result.error());
        }

        @Test
        void resultExtrasAndPermissionRequest() {
            Normalization n = normalize(Messages.resultWithContextUsage());
            TurnResult result = ((TranscriptDelta.TurnFinalized) n.delta().orElseThrow()).result();

            assertEquals(900, result.durationMs());
            assertEquals(List.of("claude-sonnet"), List.copyOf(result.modelUsage().keySet()));
            assertEquals("</done>", result.stopSequence());
            assertEquals("req-42", result.requestId());
            assertEquals(3, result.turnCount());
            assertTrue(result.hasPermissionRequest());

            assertEquals(2, n.events().size());
            assertInstanceOf(QueryEvent.TurnCompleted.class, n.events().get(0));
            QueryEvent.PermissionRequested request =
                    assertInstanceOf(QueryEvent.PermissionRequested.class, n.events().get(1));
            assertEquals("Bash", request.request().path("toolName").asText());
        }

        @Test
        void executionErrorSuppressedWhenInterrupted() {
            ProtocolMessage msg = parser.parse(Messages.resultExecutionError());
            TurnResult result = ((TranscriptDelta.TurnFinalized) MessageNormalizer.normalize(msg, ctx(true))
                    .delta().orElseThrow()).result();
            assertNull(result.error());
            assertTrue(result.errorSuppressed());
        }

        @Test
        void otherErrorsNotSuppressedWhenInterrupted() {
            ProtocolMessage msg = parser.parse(Messages.resultWithError("overloaded"));
            TurnResult result = ((TranscriptDelta.TurnFinalized) MessageNormalizer.normalize(msg, ctx(true))
                    .delta().orElseThrow()).result();
            assertEquals("overloaded", result.error());
            assertFalse(result.errorSuppressed());
        }
    }
}
