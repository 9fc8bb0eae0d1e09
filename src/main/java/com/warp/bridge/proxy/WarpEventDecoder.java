package com.warp.bridge.proxy;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.stream.FinishReason;
import com.warp.bridge.stream.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 上游事件 JSON → {@link StreamEvent}
 * <p>
 * 每个请求一个实例：工具调用序号在实例内递增。字段名同时兼容 snake_case 与 camelCase
 */
public class WarpEventDecoder {

    private static final Logger log = LoggerFactory.getLogger(WarpEventDecoder.class);

    private final Map<String, String> toolNameReverse;
    private int nextToolIndex;

    /**
     * @param toolNameReverse 上游工具名 → 客户端原始名
     */
    public WarpEventDecoder(Map<String, String> toolNameReverse) {
        this.toolNameReverse = toolNameReverse;
    }

    public List<StreamEvent> decode(String payload) {
        JSONObject event;
        try {
            event = JSONObject.parseObject(payload);
        } catch (JSONException e) {
            log.warn("无法解析上游事件: {}", abbreviate(payload));
            return List.of();
        }
        if (event == null) {
            return List.of();
        }

        List<StreamEvent> out = new ArrayList<>();
        Object bridgeError = event.get("error");
        if (bridgeError != null) {
            out.add(new StreamEvent.Error(errorText(bridgeError)));
            return out;
        }

        JSONObject data = get(event, "parsed_data", "parsedData");
        if (data == null) {
            data = event;
        }

        JSONObject init = get(data, "init", "init");
        if (init != null) {
            out.add(new StreamEvent.SessionInit(
                    getString(init, "conversation_id", "conversationId"),
                    getString(init, "task_id", "taskId")));
        }

        JSONObject clientActions = get(data, "client_actions", "clientActions");
        if (clientActions != null) {
            JSONArray actions = getArray(clientActions, "actions", "Actions");
            if (actions != null) {
                for (int i = 0; i < actions.size(); i++) {
                    JSONObject action = actions.getJSONObject(i);
                    if (action != null) {
                        decodeAction(action, out);
                    }
                }
            }
        }

        if (data.containsKey("finished")) {
            out.add(decodeFinished(get(data, "finished", "finished")));
        }
        return out;
    }

    private void decodeAction(JSONObject action, List<StreamEvent> out) {
        JSONObject createTask = get(action, "create_task", "createTask");
        if (createTask != null) {
            JSONObject task = createTask.getJSONObject("task");
            String taskId = task != null ? task.getString("id") : null;
            if (taskId != null) {
                out.add(new StreamEvent.SessionInit(null, taskId));
            }
        }

        JSONObject append = get(action, "append_to_message_content", "appendToMessageContent");
        if (append != null) {
            JSONObject message = append.getJSONObject("message");
            if (message != null) {
                decodeMessage(message, out);
            }
        }

        JSONObject addMessages = get(action, "add_messages_to_task", "addMessagesToTask");
        if (addMessages != null) {
            String taskId = getString(addMessages, "task_id", "taskId");
            if (taskId != null) {
                out.add(new StreamEvent.SessionInit(null, taskId));
            }
            JSONArray messages = addMessages.getJSONArray("messages");
            if (messages != null) {
                for (int i = 0; i < messages.size(); i++) {
                    JSONObject message = messages.getJSONObject(i);
                    if (message != null) {
                        decodeMessage(message, out);
                    }
                }
            }
        }
    }

    private void decodeMessage(JSONObject message, List<StreamEvent> out) {
        JSONObject toolCall = get(message, "tool_call", "toolCall");
        if (toolCall != null) {
            JSONObject callMcp = get(toolCall, "call_mcp_tool", "callMcpTool");
            String name = callMcp != null ? callMcp.getString("name") : null;
            if (name != null && !name.isEmpty()) {
                Object args = callMcp.get("args");
                String argsJson = args != null ? JSONObject.toJSONString(args) : "{}";
                String id = getString(toolCall, "tool_call_id", "toolCallId");
                out.add(new StreamEvent.ToolCallDelta(
                        nextToolIndex++,
                        id != null ? id : "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24),
                        toolNameReverse.getOrDefault(name, name),
                        argsJson));
                return;
            }
        }

        JSONObject citation = get(message, "citation", "citation");
        if (citation != null) {
            out.add(new StreamEvent.Citation(citation.toJSONString()));
            return;
        }

        JSONObject agentOutput = get(message, "agent_output", "agentOutput");
        if (agentOutput != null) {
            String text = agentOutput.getString("text");
            if (text != null && !text.isEmpty()) {
                out.add(new StreamEvent.TextDelta(text));
            }
        }
    }

    /**
     * finished 的子字段决定结束原因
     */
    private StreamEvent decodeFinished(JSONObject finished) {
        if (finished == null || finished.isEmpty() || has(finished, "done", "done")) {
            return new StreamEvent.Finish(FinishReason.CONTENT_COMPLETE);
        }
        if (has(finished, "max_token_limit", "maxTokenLimit")
                || has(finished, "context_window_exceeded", "contextWindowExceeded")) {
            return new StreamEvent.Finish(FinishReason.LENGTH_LIMIT);
        }
        if (has(finished, "tool_call_requested", "toolCallRequested")) {
            return new StreamEvent.Finish(FinishReason.TOOL_INVOCATION);
        }
        if (has(finished, "quota_limit", "quotaLimit")) {
            return new StreamEvent.Error("上游额度已用尽");
        }
        if (has(finished, "llm_unavailable", "llmUnavailable")) {
            return new StreamEvent.Error("上游模型暂不可用");
        }
        JSONObject internalError = get(finished, "internal_error", "internalError");
        if (internalError != null) {
            String message = internalError.getString("message");
            return new StreamEvent.Error("上游内部错误" + (message != null ? ": " + message : ""));
        }
        log.debug("未知的结束原因，按正常结束处理: {}", finished);
        return new StreamEvent.Finish(FinishReason.CONTENT_COMPLETE);
    }

    // ==================== 辅助方法 ====================

    private static boolean has(JSONObject obj, String snake, String camel) {
        return obj.containsKey(snake) || obj.containsKey(camel);
    }

    private static JSONObject get(JSONObject obj, String snake, String camel) {
        Object value = obj.containsKey(snake) ? obj.get(snake) : obj.get(camel);
        return value instanceof JSONObject json ? json : null;
    }

    private static JSONArray getArray(JSONObject obj, String snake, String camel) {
        Object value = obj.containsKey(snake) ? obj.get(snake) : obj.get(camel);
        return value instanceof JSONArray array ? array : null;
    }

    private static String getString(JSONObject obj, String snake, String camel) {
        String value = obj.getString(snake);
        if (value == null || value.isEmpty()) {
            value = obj.getString(camel);
        }
        return value == null || value.isEmpty() ? null : value;
    }

    private static String errorText(Object error) {
        if (error instanceof JSONObject obj && obj.getString("message") != null) {
            return obj.getString("message");
        }
        return String.valueOf(error);
    }

    private static String abbreviate(String text) {
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
