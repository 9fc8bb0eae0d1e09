package com.warp.bridge.stream;

/**
 * 上游结束原因
 */
public enum FinishReason {

    // 正常完成
    CONTENT_COMPLETE,
    // 请求调用工具
    TOOL_INVOCATION,
    // 达到长度或上下文上限
    LENGTH_LIMIT;

    /**
     * 映射为 OpenAI finish_reason
     *
     * @param toolCallsEmitted 本次响应是否输出过工具调用
     */
    public String toOpenAi(boolean toolCallsEmitted) {
        return switch (this) {
            case CONTENT_COMPLETE -> toolCallsEmitted ? "tool_calls" : "stop";
            case TOOL_INVOCATION -> "tool_calls";
            case LENGTH_LIMIT -> "length";
        };
    }
}
