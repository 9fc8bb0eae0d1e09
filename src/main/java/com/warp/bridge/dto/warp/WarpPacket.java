package com.warp.bridge.dto.warp;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.model.ModelSelection;

import java.util.Map;

/**
 * Warp multi_agent 请求包构建器
 * <p>
 * 生成交给 protobuf 编码桥的 JSON 结构：task_context / input / settings / mcp_context / metadata
 */
public class WarpPacket {

    /**
     * 默认特性开关，关闭上游的本地文件、命令执行等客户端能力
     */
    public static final Map<String, Object> DEFAULT_FEATURE_FLAGS = Map.ofEntries(
            Map.entry("rules_enabled", false),
            Map.entry("web_context_retrieval_enabled", false),
            Map.entry("supports_parallel_tool_calls", false),
            Map.entry("planning_enabled", false),
            Map.entry("warp_drive_context_enabled", false),
            Map.entry("supports_create_files", false),
            Map.entry("use_anthropic_text_editor_tools", false),
            Map.entry("supports_long_running_commands", false),
            Map.entry("should_preserve_file_content_in_history", false),
            Map.entry("supports_todos_ui", false),
            Map.entry("supports_linked_code_blocks", false),
            Map.entry("supported_tools", JSONArray.of(9))
    );

    private final JSONObject root = new JSONObject();
    private final JSONArray messages = new JSONArray();
    private final JSONArray inputs = new JSONArray();
    private final String taskId;

    public WarpPacket(String taskId) {
        this.taskId = taskId;
        JSONObject task = JSONObject.of(
                "id", taskId, //
                "description", "", //
                "status", JSONObject.of("in_progress", new JSONObject()), //
                "messages", messages //
        );
        root.put("task_context", JSONObject.of(
                "tasks", JSONArray.of(task), //
                "active_task_id", taskId //
        ));
        root.put("input", JSONObject.of(
                "context", new JSONObject(), //
                "user_inputs", JSONObject.of("inputs", inputs) //
        ));
        root.put("metadata", JSONObject.of(
                "logging", JSONObject.of( //
                        "is_autodetected_user_query", true, //
                        "entrypoint", "USER_INITIATED" //
                ) //
        ));
    }

    /**
     * 设置 model_config 与特性开关
     */
    public WarpPacket settings(ModelSelection models, Map<String, Object> featureFlags) {
        JSONObject settings = new JSONObject();
        settings.put("model_config", JSONObject.of(
                "base", models.base(), //
                "planning", models.planning(), //
                "coding", models.coding() //
        ));
        settings.putAll(featureFlags);
        root.put("settings", settings);
        return this;
    }

    public WarpPacket conversationId(String conversationId) {
        if (conversationId != null && !conversationId.isEmpty()) {
            root.getJSONObject("metadata").put("conversation_id", conversationId);
        }
        return this;
    }

    public WarpPacket tools(JSONArray tools) {
        if (tools != null && !tools.isEmpty()) {
            root.put("mcp_context", JSONObject.of("tools", tools));
        }
        return this;
    }

    // ==================== 历史消息 ====================

    public WarpPacket addUserQuery(String id, String query) {
        messages.add(message(id, "user_query", JSONObject.of("query", query)));
        return this;
    }

    public WarpPacket addAgentOutput(String id, String text, String serverMessageData) {
        JSONObject msg = message(id, "agent_output", JSONObject.of("text", text));
        if (serverMessageData != null) {
            msg.put("server_message_data", serverMessageData);
        }
        messages.add(msg);
        return this;
    }

    public WarpPacket addToolCall(String id, String toolCallId, String name, JSONObject args) {
        messages.add(message(id, "tool_call", toolCall(toolCallId, name, args)));
        return this;
    }

    public WarpPacket addToolCallResult(String id, String toolCallId, String content) {
        messages.add(message(id, "tool_call_result", toolCallResult(toolCallId, content)));
        return this;
    }

    // ==================== 当前输入 ====================

    /**
     * 当前用户输入，system 提示作为 SYSTEM_PROMPT 附件
     */
    public WarpPacket inputUserQuery(String query, String systemPrompt) {
        JSONObject userQuery = JSONObject.of("query", query);
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            userQuery.put("referenced_attachments", JSONObject.of(
                    "SYSTEM_PROMPT", JSONObject.of("plain_text", systemPrompt) //
            ));
        }
        inputs.add(JSONObject.of("user_query", userQuery));
        return this;
    }

    public WarpPacket inputToolCallResult(String toolCallId, String content) {
        inputs.add(JSONObject.of("tool_call_result", toolCallResult(toolCallId, content)));
        return this;
    }

    public JSONObject toJson() {
        return root;
    }

    public String toJsonString() {
        return root.toJSONString();
    }

    public String taskId() {
        return taskId;
    }

    public int historySize() {
        return messages.size();
    }

    // ==================== 辅助方法 ====================

    private JSONObject message(String id, String kind, JSONObject body) {
        return JSONObject.of(
                "id", id, //
                "task_id", taskId, //
                kind, body //
        );
    }

    private static JSONObject toolCall(String toolCallId, String name, JSONObject args) {
        return JSONObject.of(
                "tool_call_id", toolCallId, //
                "call_mcp_tool", JSONObject.of( //
                        "name", name, //
                        "args", args != null ? args : new JSONObject() //
                ) //
        );
    }

    private static JSONObject toolCallResult(String toolCallId, String content) {
        return JSONObject.of(
                "tool_call_id", toolCallId, //
                "call_mcp_tool", JSONObject.of( //
                        "success", JSONObject.of( //
                                "results", JSONArray.of(JSONObject.of("text", JSONObject.of("text", content))) //
                        ) //
                ) //
        );
    }
}
