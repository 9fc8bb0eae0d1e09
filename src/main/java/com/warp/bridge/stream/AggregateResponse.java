package com.warp.bridge.stream;

import java.util.List;

/**
 * 非流式模式的聚合结果
 */
public record AggregateResponse(String content, List<ToolCall> toolCalls, String finishReason) {

    public AggregateResponse {
        toolCalls = List.copyOf(toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public record ToolCall(int index, String id, String name, String arguments) {}
}
