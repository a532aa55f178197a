package com.agentdesk.agent.protocol;

import com.agentdesk.agent.error.ProtocolException;
import com.agentdesk.agent.testing.Messages;
import com.agentdesk.agent.usage.ModelUsage;
import com.agentdesk.agent.usage.TokenCounts;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolMessageParserTest {

    private final ProtocolMessageParser parser = new ProtocolMessageParser();

    @Nested
    class SystemMessages {

        @Test
        void parsesInit() {
            ProtocolMessage msg = parser.parse(Messages.systemInit("sess-9"));
            ProtocolMessage.SystemInit init = assertInstanceOf(ProtocolMessage.SystemInit.class, msg);
            assertEquals("sess-9", init.sessionId());
            assertEquals("claude-sonnet", init.model());
            assertEquals(java.util.List.of("github"), init.mcpServers());
            assertEquals(MessageTag.SYSTEM_INIT, init.tag());
        }

        @Test
        void parsesCompactBoundary() {
            ProtocolMessage.SystemCompact compact = assertInstanceOf(ProtocolMessage.SystemCompact.class,
                    parser.parse(Messages.compactBoundary(45000)));
            assertEquals("auto", compact.trigger());
            assertEquals(45000, compact.preTokens());
        }

        @Test
        void otherSubtypeIsUnknown() {
            ProtocolMessage msg = parser.parse("{\"type\":\"system\",\"subtype\":\"status\"}");
            ProtocolMessage.Unknown unknown = assertInstanceOf(ProtocolMessage.Unknown.class, msg);
            assertEquals("system:status", unknown.type());
        }
    }

    @Nested
    class Conversation {

        @Test
        void parsesAssistantContentInOrder() {
            ProtocolMessage.AssistantMessage msg = assertInstanceOf(ProtocolMessage.AssistantMessage.class,
                    parser.parse(Messages.assistantTextAndTool("Reading", "toolu_1", "/a.txt")));
            assertEquals(2, msg.content().size());
            assertEquals("Reading", ((ContentItem.Text) msg.content().get(0)).text());
            ContentItem.ToolUse use = (ContentItem.ToolUse) msg.content().get(1);
            assertEquals("toolu_1", use.id());
            assertEquals("Read", use.name());
            assertEquals("/a.txt", use.input().get("file_path").asText());
            assertNull(use.parentToolId());
        }

        @Test
        void parsesAssistantUsage() {
            ProtocolMessage.AssistantMessage msg = assertInstanceOf(ProtocolMessage.AssistantMessage.class,
                    parser.parse(Messages.assistantText("hi")));
            assertEquals(new TokenCounts(10, 5, 0, 0), msg.usage());
        }

        @Test
        void unknownContentItemsBecomeOther() {
            ProtocolMessage.AssistantMessage msg = assertInstanceOf(ProtocolMessage.AssistantMessage.class,
                    parser.parse("{\"type\":\"assistant\",\"message\":{\"content\":["
                            + "{\"type\":\"thinking\",\"thinking\":\"...\"}]}}"));
            assertEquals(new ContentItem.Other("thinking"), msg.content().get(0));
        }

        @Test
        void userStringContentBecomesText() {
            ProtocolMessage.UserMessage msg = assertInstanceOf(ProtocolMessage.UserMessage.class,
                    parser.parse("{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":\"hello\"}}"));
            assertEquals(new ContentItem.Text("hello"), msg.content().get(0));
        }

        @Test
        void flattensToolResultBlocks() {
            ProtocolMessage.UserMessage msg = assertInstanceOf(ProtocolMessage.UserMessage.class,
                    parser.parse("{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\","
                            + "\"tool_use_id\":\"t1\",\"is_error\":true,"
                            + "\"content\":[{\"type\":\"text\",\"text\":\"a\"},{\"type\":\"text\",\"text\":\"b\"}]}]}}"));
            assertEquals(new ContentItem.ToolResult("t1", "a\nb", true), msg.content().get(0));
        }
    }

    @Nested
    class Tools {

        @Test
        void parsesTopLevelToolUse() {
            ProtocolMessage.ToolUseMessage msg = assertInstanceOf(ProtocolMessage.ToolUseMessage.class,
                    parser.parse("{\"type\":\"tool_use\",\"tool_use_id\":\"t1\",\"name\":\"Bash\","
                            + "\"input\":{\"command\":\"ls\"},\"parent_tool_use_id\":\"p1\"}"));
            assertEquals("t1", msg.toolId());
            assertEquals("p1", msg.parentToolId());
        }

        @Test
        void parsesTopLevelToolResult() {
            ProtocolMessage.ToolResultMessage msg = assertInstanceOf(ProtocolMessage.ToolResultMessage.class,
                    parser.parse("{\"type\":\"tool_result\",\"message\":{\"tool_use_id\":\"t1\","
                            + "\"content\":\"ok\"}}"));
            assertEquals("t1", msg.toolId());
            assertEquals("ok", msg.content());
            assertFalse(msg.isError());
        }

        @Test
        void toolUseWithoutIdFails() {
            assertThrows(ProtocolException.class, () -> parser.parse("{\"type\":\"tool_use\",\"name\":\"Bash\"}"));
        }
    }

    @Nested
    class Result {

        @Test
        void parsesSuccess() {
            ProtocolMessage.ResultMessage result = assertInstanceOf(ProtocolMessage.ResultMessage.class,
                    parser.parse(Messages.resultSuccess()));
            assertEquals("success", result.subtype());
            assertEquals(1200L, result.durationMs());
            assertEquals(0.01, result.totalCostUsd(), 1e-9);
            assertEquals(new TokenCounts(100, 40, 3, 7), result.usage());
            assertNull(result.error());
            assertFalse(result.isExecutionError());
        }

        @Test
        void executionErrorGetsErrorText() {
            ProtocolMessage.ResultMessage result = assertInstanceOf(ProtocolMessage.ResultMessage.class,
                    parser.parse(Messages.resultExecutionError()));
            assertTrue(result.isExecutionError());
            assertEquals("Error during execution", result.error());
        }

        @Test
        void errorObjectMessageIsUsed() {
            ProtocolMessage.ResultMessage result = assertInstanceOf(ProtocolMessage.ResultMessage.class,
                    parser.parse(Messages.resultWithError("overloaded")));
            assertEquals("overloaded", result.error());
            assertNull(result.durationMs());
        }

        @Test
        void carriesModelUsageAndRequestMetadata() {
            ProtocolMessage.ResultMessage result = assertInstanceOf(ProtocolMessage.ResultMessage.class,
                    parser.parse(Messages.resultWithContextUsage()));

            ModelUsage sonnet = result.modelUsage().get("claude-sonnet");
            assertEquals(new ModelUsage(1200, 300, 5000, 800, 200_000), sonnet);
            assertEquals("end_turn", result.stopReason());
            assertEquals("</done>", result.stopSequence());
            assertEquals("req-42", result.requestId());
            assertEquals(3, result.turnCount());
            assertEquals("Bash", result.permissionRequest().path("toolName").asText());
        }

        @Test
        void maxTurnsErrorNamesTurnCount() {
            ProtocolMessage.ResultMessage result = assertInstanceOf(ProtocolMessage.ResultMessage.class,
                    parser.parse(Messages.resultMaxTurns(12)));
            assertTrue(result.isMaxTurns());
            assertEquals("Maximum turns limit reached (12 turns)", result.error());
        }

        @Test
        void maxTurnsWithoutCountLeavesErrorOpen() {
            ProtocolMessage.ResultMessage result = assertInstanceOf(ProtocolMessage.ResultMessage.class,
                    parser.parse(Messages.resultMaxTurns(null)));
            assertNull(result.turnCount());
            assertNull(result.error());
        }

        @Test
        void absentExtrasAreNull() {
            ProtocolMessage.ResultMessage result = assertInstanceOf(ProtocolMessage.ResultMessage.class,
                    parser.parse(Messages.resultSuccess()));
            assertNull(result.modelUsage());
            assertNull(result.permissionRequest());
            assertNull(result.requestId());
        }
    }

    @Nested
    class Malformed {

        @Test
        void invalidJson() {
            assertThrows(ProtocolException.class, () -> parser.parse("{not json"));
        }

        @Test
        void nonObject() {
            assertThrows(ProtocolException.class, () -> parser.parse("[1,2]"));
        }

        @Test
        void missingType() {
            assertThrows(ProtocolException.class, () -> parser.parse("{\"session_id\":\"x\"}"));
        }

        @Test
        void modelUsageMustBeObject() {
            assertThrows(ProtocolException.class, () -> parser.parse(
                    "{\"type\":\"result\",\"subtype\":\"success\",\"modelUsage\":[1]}"));
        }

        @Test
        void wrongContentShape() {
            assertThrows(ProtocolException.class,
                    () -> parser.parse("{\"type\":\"assistant\",\"message\":{\"content\":42}}"));
        }

        @Test
        void unknownTypeIsNotAnError() {
            assertInstanceOf(ProtocolMessage.Unknown.class, parser.parse("{\"type\":\"stream_event\"}"));
        }
    }
}
