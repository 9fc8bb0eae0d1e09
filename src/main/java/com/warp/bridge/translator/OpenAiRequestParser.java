package com.warp.bridge.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.conversation.ChatTurn;
import com.warp.bridge.conversation.ContentPart;
import com.warp.bridge.conversation.ContentPart.ImagePart;
import com.warp.bridge.conversation.ContentPart.TextPart;
import com.warp.bridge.conversation.ContentPart.ToolCallPart;
import com.warp.bridge.conversation.ContentPart.ToolResultPart;
import com.warp.bridge.conversation.Role;
import com.warp.bridge.exception.NormalizationException;
import com.warp.bridge.exception.TranslationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI 请求体 → {@link ChatRequest}
 */
@Component
public class OpenAiRequestParser {

    public ChatRequest parse(JSONObject body) {
        Object rawMessages = body.get("messages");
        if (!(rawMessages instanceof JSONArray messages)) {
            throw new NormalizationException("messages 必须是数组");
        }

        List<ChatTurn> turns = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            Object raw = messages.get(i);
            if (!(raw instanceof JSONObject msg)) {
                throw new NormalizationException("messages[" + i + "] 不是对象");
            }
            turns.add(parseMessage(msg, i));
        }

        String planning = null;
        String coding = null;
        JSONObject modelConfig = body.getJSONObject("model_config");
        if (modelConfig != null) {
            planning = modelConfig.getString("planning");
            coding = modelConfig.getString("coding");
        }

        Integer n = body.getInteger("n");
        Boolean stream = body.getBoolean("stream");
        return new ChatRequest(
                body.getString("model"),
                planning,
                coding,
                Boolean.TRUE.equals(stream),
                turns,
                body.getJSONArray("tools"),
                body.get("tool_choice"),
                n != null ? n : 1,
                body.getString("user")
        );
    }

    private ChatTurn parseMessage(JSONObject msg, int index) {
        Role role = Role.fromWire(msg.getString("role"));
        if (role == null) {
            throw new NormalizationException("messages[" + index + "] 角色无效: " + msg.getString("role"));
        }

        List<ContentPart> parts = new ArrayList<>();
        if (role == Role.TOOL) {
            parts.add(new ToolResultPart(msg.getString("tool_call_id"), extractText(msg.get("content"))));
            return new ChatTurn(role, parts);
        }

        parseContent(msg.get("content"), parts, index);

        if (role == Role.ASSISTANT) {
            JSONArray toolCalls = msg.getJSONArray("tool_calls");
            if (toolCalls != null) {
                for (int i = 0; i < toolCalls.size(); i++) {
                    JSONObject tc = toolCalls.getJSONObject(i);
                    JSONObject function = tc != null ? tc.getJSONObject("function") : null;
                    if (function == null) {
                        throw new TranslationException("messages[" + index + "].tool_calls[" + i + "] 缺少 function");
                    }
                    Object arguments = function.get("arguments");
                    String argumentsJson = arguments instanceof String s ? s
                            : arguments != null ? JSONObject.toJSONString(arguments) : "{}";
                    parts.add(new ToolCallPart(tc.getString("id"), function.getString("name"), argumentsJson));
                }
            }
        }
        return new ChatTurn(role, parts);
    }

    private void parseContent(Object content, List<ContentPart> parts, int index) {
        if (content == null) {
            return;
        }
        if (content instanceof String s) {
            parts.add(new TextPart(s));
            return;
        }
        if (!(content instanceof JSONArray arr)) {
            throw new TranslationException("messages[" + index + "].content 类型不支持");
        }
        for (int i = 0; i < arr.size(); i++) {
            JSONObject block = arr.getJSONObject(i);
            if (block == null) continue;
            String type = block.getString("type");
            if ("text".equals(type) || "input_text".equals(type)) {
                parts.add(new TextPart(block.getString("text")));
            } else if ("image_url".equals(type)) {
                Object imageUrl = block.get("image_url");
                String url = imageUrl instanceof JSONObject obj ? obj.getString("url") : String.valueOf(imageUrl);
                parts.add(new ImagePart(url));
            } else {
                throw new TranslationException("不支持的内容类型: " + type);
            }
        }
    }

    private String extractText(Object content) {
        if (content == null) return "";
        if (content instanceof String s) return s;
        if (content instanceof JSONArray arr) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < arr.size(); i++) {
                JSONObject block = arr.getJSONObject(i);
                if (block != null && block.containsKey("text")) {
                    if (!sb.isEmpty()) sb.append("\n");
                    sb.append(block.getString("text"));
                }
            }
            return sb.toString();
        }
        return content.toString();
    }
}
