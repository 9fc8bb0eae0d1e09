package com.warp.bridge.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.conversation.ChatTurn;
import com.warp.bridge.conversation.ContentPart.ImagePart;
import com.warp.bridge.conversation.ContentPart.TextPart;
import com.warp.bridge.conversation.ContentPart.ToolCallPart;
import com.warp.bridge.conversation.ContentPart.ToolResultPart;
import com.warp.bridge.conversation.ConversationNormalizer;
import com.warp.bridge.conversation.NormalizedConversation;
import com.warp.bridge.conversation.Role;
import com.warp.bridge.exception.NormalizationException;
import com.warp.bridge.exception.TranslationException;
import com.warp.bridge.model.ModelSelection;
import com.warp.bridge.session.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WarpRequestTranslatorTest {

    private static final Instant NOW = Instant.parse("2025-08-10T12:00:00Z");
    private static final ModelSelection MODELS = new ModelSelection("claude-4.1-opus", "o3", "auto");

    private final WarpRequestTranslator translator = new WarpRequestTranslator(Clock.fixed(NOW, ZoneOffset.UTC));
    private final ConversationNormalizer normalizer = new ConversationNormalizer();

    private OutboundRequest translate(List<ChatTurn> turns, SessionState session) {
        NormalizedConversation conversation = normalizer.normalize(turns);
        return translator.translate(conversation, MODELS, ToolSchemaSanitizer.SanitizedTools.empty(), session);
    }

    private static JSONArray inputs(OutboundRequest request) {
        return request.packet().toJson().getJSONObject("input").getJSONObject("user_inputs").getJSONArray("inputs");
    }

    private static JSONArray history(OutboundRequest request) {
        return request.packet().toJson().getJSONObject("task_context").getJSONArray("tasks")
                .getJSONObject(0).getJSONArray("messages");
    }

    @Test
    void translate_singleUserTurn_becomesUserQueryWithSystemPrompt() {
        OutboundRequest request = translate(List.of(
                ChatTurn.of(Role.SYSTEM, "S"),
                ChatTurn.of(Role.USER, "Hi"),
                ChatTurn.of(Role.USER, "there")), SessionState.NEW);

        JSONObject userQuery = inputs(request).getJSONObject(0).getJSONObject("user_query");
        assertEquals("Hi\nthere", userQuery.getString("query"));
        assertEquals("S", userQuery.getJSONObject("referenced_attachments")
                .getJSONObject("SYSTEM_PROMPT").getString("plain_text"));
        assertTrue(history(request).isEmpty());
    }

    @Test
    void translate_setsModelConfigAndFeatureFlags() {
        OutboundRequest request = translate(List.of(ChatTurn.of(Role.USER, "q")), SessionState.NEW);

        JSONObject settings = request.packet().toJson().getJSONObject("settings");
        JSONObject modelConfig = settings.getJSONObject("model_config");
        assertEquals("claude-4.1-opus", modelConfig.getString("base"));
        assertEquals("o3", modelConfig.getString("planning"));
        assertEquals("auto", modelConfig.getString("coding"));
        assertFalse(settings.getBooleanValue("supports_create_files"));
    }

    @Test
    void translate_newSession_generatesTaskIdAndOmitsConversationId() {
        OutboundRequest request = translate(List.of(ChatTurn.of(Role.USER, "q")), SessionState.NEW);

        assertNotNull(request.taskId());
        assertNull(request.conversationId());
        assertFalse(request.packet().toJson().getJSONObject("metadata").containsKey("conversation_id"));
    }

    @Test
    void translate_existingSession_reusesIdentifiers() {
        OutboundRequest request = translate(List.of(ChatTurn.of(Role.USER, "q")), new SessionState("conv-1", "task-1"));

        assertEquals("task-1", request.taskId());
        assertEquals("conv-1", request.packet().toJson().getJSONObject("metadata").getString("conversation_id"));
        assertEquals("task-1", request.packet().toJson().getJSONObject("task_context").getString("active_task_id"));
    }

    @Test
    void translate_history_carriesAgentOutputWithServerMessageData() {
        OutboundRequest request = translate(List.of(
                ChatTurn.of(Role.USER, "first"),
                ChatTurn.of(Role.ASSISTANT, "answer"),
                ChatTurn.of(Role.USER, "second")), SessionState.NEW);

        JSONArray history = history(request);
        assertEquals(2, history.size());
        assertEquals("first", history.getJSONObject(0).getJSONObject("user_query").getString("query"));

        JSONObject agentOutput = history.getJSONObject(1);
        assertEquals("answer", agentOutput.getJSONObject("agent_output").getString("text"));
        ServerMessageData data = ServerMessageDataCodec.decode(agentOutput.getString("server_message_data"));
        assertEquals(agentOutput.getString("id"), data.uuid().toString());
        assertEquals(NOW, data.timestamp());

        assertEquals("second", inputs(request).getJSONObject(0).getJSONObject("user_query").getString("query"));
    }

    @Test
    void translate_trailingToolResults_becomeToolCallResultInput() {
        ChatTurn assistant = new ChatTurn(Role.ASSISTANT, List.of(
                new TextPart("checking"),
                new ToolCallPart("call_1", "get_weather", "{\"city\":\"Paris\"}")));
        ChatTurn tool = new ChatTurn(Role.TOOL, List.of(new ToolResultPart("call_1", "sunny")));

        OutboundRequest request = translate(List.of(ChatTurn.of(Role.USER, "weather?"), assistant, tool), SessionState.NEW);

        JSONArray history = history(request);
        assertEquals(3, history.size());
        JSONObject toolCall = history.getJSONObject(2).getJSONObject("tool_call");
        assertEquals("call_1", toolCall.getString("tool_call_id"));
        assertEquals("Paris", toolCall.getJSONObject("call_mcp_tool").getJSONObject("args").getString("city"));

        JSONObject result = inputs(request).getJSONObject(0).getJSONObject("tool_call_result");
        assertEquals("call_1", result.getString("tool_call_id"));
        assertEquals("sunny", result.getJSONObject("call_mcp_tool").getJSONObject("success")
                .getJSONArray("results").getJSONObject(0).getJSONObject("text").getString("text"));
    }

    @Test
    void translate_lastAssistantWithoutResults_continues() {
        OutboundRequest request = translate(List.of(
                ChatTurn.of(Role.USER, "q"),
                ChatTurn.of(Role.ASSISTANT, "partial")), SessionState.NEW);

        assertEquals("continue", inputs(request).getJSONObject(0).getJSONObject("user_query").getString("query"));
    }

    @Test
    void translate_imagesAndOrphanResults_renderAsText() {
        ChatTurn user = new ChatTurn(Role.USER, List.of(
                new TextPart("look"),
                new ImagePart("https://example.com/a.png"),
                new ToolResultPart("call_x", "42")));

        OutboundRequest request = translate(List.of(user), SessionState.NEW);

        assertEquals("look\n[image: https://example.com/a.png]\n[Tool Result: call_x] 42",
                inputs(request).getJSONObject(0).getJSONObject("user_query").getString("query"));
    }

    @Test
    void translate_toolsAreSentInMcpContext() {
        JSONArray tools = JSONArray.of(JSONObject.of("type", "function",
                "function", JSONObject.of("name", "mcp.read", "parameters", JSONObject.of("type", "object"))));
        ToolSchemaSanitizer.SanitizedTools sanitized = new ToolSchemaSanitizer().sanitize(tools, null);

        OutboundRequest request = translator.translate(normalizer.normalize(List.of(ChatTurn.of(Role.USER, "q"))),
                MODELS, sanitized, SessionState.NEW);

        JSONArray sent = request.packet().toJson().getJSONObject("mcp_context").getJSONArray("tools");
        assertEquals("mcp_read", sent.getJSONObject(0).getString("name"));
        assertEquals("mcp.read", request.originalToolName("mcp_read"));
    }

    @Test
    void translate_systemOnly_isRejected() {
        NormalizedConversation conversation = normalizer.normalize(List.of(ChatTurn.of(Role.SYSTEM, "S")));

        assertThrows(NormalizationException.class, () -> translator.translate(conversation, MODELS,
                ToolSchemaSanitizer.SanitizedTools.empty(), SessionState.NEW));
    }

    @Test
    void validate_multipleChoices_isRejected() {
        ChatRequest request = new ChatRequest("gpt-4o", null, null, false, List.of(ChatTurn.of(Role.USER, "q")),
                null, null, 2, null);

        assertThrows(TranslationException.class, () -> translator.validate(request));
    }
}
