package com.warp.bridge.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.stream.AggregateResponse;
import com.warp.bridge.stream.OutputChunk;
import com.warp.bridge.stream.OutputChunk.ContentDelta;
import com.warp.bridge.stream.OutputChunk.ErrorChunk;
import com.warp.bridge.stream.OutputChunk.FinishChunk;
import com.warp.bridge.stream.OutputChunk.RoleMarker;
import com.warp.bridge.stream.OutputChunk.ToolCallChunk;

import java.util.UUID;

/**
 * OpenAI 响应渲染
 * <p>
 * 同一响应的所有块共享 id / created / model
 */
public class OpenAiChunkRenderer {

    private final String completionId;
    private final long created;
    private final String model;

    public OpenAiChunkRenderer(String model, long createdEpochSeconds) {
        this("chatcmpl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24), model, createdEpochSeconds);
    }

    public OpenAiChunkRenderer(String completionId, String model, long createdEpochSeconds) {
        this.completionId = completionId;
        this.model = model;
        this.created = createdEpochSeconds;
    }

    /**
     * 构建 SSE chunk（流式）
     */
    public JSONObject renderChunk(OutputChunk chunk) {
        JSONObject delta = new JSONObject();
        String finishReason = null;
        JSONObject error = null;

        if (chunk instanceof RoleMarker role) {
            delta.put("role", role.role());
        } else if (chunk instanceof ContentDelta content) {
            delta.put("content", content.text());
        } else if (chunk instanceof ToolCallChunk call) {
            delta.put("tool_calls", JSONArray.of(toolCallDelta(call)));
        } else if (chunk instanceof FinishChunk finish) {
            finishReason = finish.finishReason();
        } else if (chunk instanceof ErrorChunk errorChunk) {
            finishReason = errorChunk.finishReason();
            error = JSONObject.of(
                    "message", errorChunk.message(), //
                    "type", "upstream_error" //
            );
        }

        JSONObject choice = JSONObject.of(
                "index", 0, //
                "delta", delta //
        );
        choice.put("finish_reason", finishReason);

        JSONObject result = JSONObject.of(
                "id", completionId, //
                "object", "chat.completion.chunk", //
                "created", created, //
                "model", model, //
                "choices", JSONArray.of(choice) //
        );
        if (error != null) {
            result.put("error", error);
        }
        return result;
    }

    /**
     * SSE 帧
     */
    public String renderSse(OutputChunk chunk) {
        return "data: " + renderChunk(chunk).toJSONString() + "\n\n";
    }

    public static String doneFrame() {
        return "data: [DONE]\n\n";
    }

    /**
     * 将聚合结果转换为 OpenAI Chat Completion（非流式）
     */
    public JSONObject renderCompletion(AggregateResponse response) {
        JSONObject message = JSONObject.of(
                "role", "assistant", //
                "content", response.content() //
        );
        if (response.hasToolCalls()) {
            JSONArray toolCalls = new JSONArray();
            for (AggregateResponse.ToolCall call : response.toolCalls()) {
                toolCalls.add(JSONObject.of(
                        "id", call.id(), //
                        "type", "function", //
                        "function", JSONObject.of("name", call.name(), "arguments", call.arguments()) //
                ));
            }
            message.put("tool_calls", toolCalls);
        }

        JSONObject choice = JSONObject.of(
                "index", 0, //
                "message", message, //
                "finish_reason", response.finishReason() != null ? response.finishReason() : "stop" //
        );

        JSONObject result = new JSONObject();
        result.put("id", completionId);
        result.put("object", "chat.completion");
        result.put("created", created);
        result.put("model", model);
        result.put("choices", JSONArray.of(choice));
        result.put("usage", JSONObject.of( //
                "prompt_tokens", 0, //
                "completion_tokens", 0, //
                "total_tokens", 0 //
        ));
        return result;
    }

    public String completionId() {
        return completionId;
    }

    private JSONObject toolCallDelta(ToolCallChunk call) {
        JSONObject function = new JSONObject();
        if (call.name() != null) {
            function.put("name", call.name());
        }
        function.put("arguments", call.arguments() != null ? call.arguments() : "");

        JSONObject delta = JSONObject.of("index", call.index());
        if (call.id() != null) {
            delta.put("id", call.id());
            delta.put("type", "function");
        }
        delta.put("function", function);
        return delta;
    }
}
