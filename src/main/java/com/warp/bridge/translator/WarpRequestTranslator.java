package com.warp.bridge.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.conversation.ChatTurn;
import com.warp.bridge.conversation.ContentPart;
import com.warp.bridge.conversation.ContentPart.ImagePart;
import com.warp.bridge.conversation.ContentPart.TextPart;
import com.warp.bridge.conversation.ContentPart.ToolCallPart;
import com.warp.bridge.conversation.ContentPart.ToolResultPart;
import com.warp.bridge.conversation.NormalizedConversation;
import com.warp.bridge.conversation.Role;
import com.warp.bridge.dto.warp.WarpPacket;
import com.warp.bridge.exception.TranslationException;
import com.warp.bridge.model.ModelSelection;
import com.warp.bridge.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 会话 → Warp 请求包
 * <p>
 * 最后一轮决定 input：user 结尾时作为 user_query，assistant 结尾且带工具结果时作为 tool_call_result，
 * 其余轮次进入 task_context 历史
 */
@Component
public class WarpRequestTranslator implements RequestTranslator {

    private static final Logger log = LoggerFactory.getLogger(WarpRequestTranslator.class);

    private final Clock clock;
    private final Map<String, Object> featureFlags;

    @Autowired
    public WarpRequestTranslator(Clock clock) {
        this(clock, WarpPacket.DEFAULT_FEATURE_FLAGS);
    }

    public WarpRequestTranslator(Clock clock, Map<String, Object> featureFlags) {
        this.clock = clock;
        this.featureFlags = featureFlags;
    }

    @Override
    public OutboundRequest translate(NormalizedConversation conversation,
                                     ModelSelection models,
                                     ToolSchemaSanitizer.SanitizedTools tools,
                                     SessionState session) {
        conversation.requireUserContent();

        String taskId = session.taskId() != null ? session.taskId() : UUID.randomUUID().toString();
        WarpPacket packet = new WarpPacket(taskId)
                .settings(models, featureFlags)
                .conversationId(session.conversationId());

        Map<String, String> nameMap = tools.nameMap();
        JSONArray toolJson = new JSONArray();
        for (ToolDefinition tool : tools.tools()) {
            toolJson.add(tool.toJson());
        }
        packet.tools(toolJson);

        List<ChatTurn> turns = conversation.turns();
        ChatTurn last = turns.get(turns.size() - 1);
        List<ChatTurn> history = turns.subList(0, turns.size() - 1);
        for (ChatTurn turn : history) {
            addHistory(packet, turn.parts(), turn.role(), nameMap);
        }

        if (last.role() == Role.USER) {
            packet.inputUserQuery(renderUserText(last.parts()), conversation.leadingSystemText());
        } else {
            // assistant 结尾：末尾连续的工具结果作为本轮输入，其余进入历史
            List<ContentPart> parts = last.parts();
            int split = parts.size();
            while (split > 0 && parts.get(split - 1) instanceof ToolResultPart) {
                split--;
            }
            addHistory(packet, parts.subList(0, split), Role.ASSISTANT, nameMap);
            if (split == parts.size()) {
                packet.inputUserQuery("continue", conversation.leadingSystemText());
            } else {
                for (ContentPart part : parts.subList(split, parts.size())) {
                    ToolResultPart result = (ToolResultPart) part;
                    packet.inputToolCallResult(result.toolCallId(), result.content());
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("请求转换完成: taskId={}, conversationId={}, 历史 {} 条, 工具 {} 个",
                    taskId, session.conversationId(), packet.historySize(), toolJson.size());
        }
        return new OutboundRequest(packet, models, session.conversationId(), taskId, tools.reverseNameMap());
    }

    /**
     * 校验 Warp 不支持的请求组合
     */
    public void validate(ChatRequest request) {
        if (request.n() > 1) {
            throw new TranslationException("不支持 n > 1");
        }
    }

    private void addHistory(WarpPacket packet, List<ContentPart> parts, Role role, Map<String, String> nameMap) {
        if (role == Role.USER) {
            packet.addUserQuery(newId(), renderUserText(parts));
            return;
        }

        List<String> textBuffer = new ArrayList<>();
        for (ContentPart part : parts) {
            if (part instanceof TextPart text) {
                textBuffer.add(text.text());
                continue;
            }
            flushAgentOutput(packet, textBuffer);
            if (part instanceof ToolCallPart call) {
                String name = nameMap.getOrDefault(call.name(), ToolSchemaSanitizer.sanitizeToolName(call.name()));
                packet.addToolCall(newId(), call.id(), name, parseArguments(call.arguments()));
            } else if (part instanceof ToolResultPart result) {
                packet.addToolCallResult(newId(), result.toolCallId(), result.content());
            } else if (part instanceof ImagePart image) {
                textBuffer.add("[image: " + image.url() + "]");
            }
        }
        flushAgentOutput(packet, textBuffer);
    }

    private void flushAgentOutput(WarpPacket packet, List<String> textBuffer) {
        if (textBuffer.isEmpty()) {
            return;
        }
        String text = String.join("\n", textBuffer);
        textBuffer.clear();
        if (text.isEmpty()) {
            return;
        }
        UUID id = UUID.randomUUID();
        String serverMessageData = ServerMessageDataCodec.encode(new ServerMessageData(id, clock.instant()));
        packet.addAgentOutput(id.toString(), text, serverMessageData);
    }

    /**
     * user 轮次渲染为纯文本：图片用占位符，孤立的工具结果带上 id
     */
    private String renderUserText(List<ContentPart> parts) {
        List<String> lines = new ArrayList<>();
        for (ContentPart part : parts) {
            if (part instanceof TextPart text) {
                lines.add(text.text());
            } else if (part instanceof ImagePart image) {
                lines.add("[image: " + image.url() + "]");
            } else if (part instanceof ToolResultPart result) {
                lines.add("[Tool Result: " + result.toolCallId() + "] " + result.content());
            } else if (part instanceof ToolCallPart call) {
                lines.add("[Tool Call: " + call.name() + "] " + call.arguments());
            }
        }
        return String.join("\n", lines);
    }

    private JSONObject parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return new JSONObject();
        }
        try {
            JSONObject parsed = JSONObject.parseObject(arguments);
            return parsed != null ? parsed : new JSONObject();
        } catch (JSONException e) {
            return JSONObject.of("raw", arguments);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
