package com.warp.bridge.stream;

/**
 * 上游事件
 */
public sealed interface StreamEvent
        permits StreamEvent.SessionInit, StreamEvent.TextDelta, StreamEvent.ToolCallDelta,
        StreamEvent.Citation, StreamEvent.Finish, StreamEvent.Error {

    /**
     * 上游下发的会话标识，不产生输出
     */
    record SessionInit(String conversationId, String taskId) implements StreamEvent {}

    record TextDelta(String text) implements StreamEvent {}

    /**
     * 工具调用片段，同一调用的第一个片段携带 id 和 name
     *
     * @param index 调用序号，从 0 开始
     */
    record ToolCallDelta(int index, String id, String name, String argumentsFragment) implements StreamEvent {}

    record Citation(String source) implements StreamEvent {}

    record Finish(FinishReason reason) implements StreamEvent {}

    record Error(String message) implements StreamEvent {}
}
