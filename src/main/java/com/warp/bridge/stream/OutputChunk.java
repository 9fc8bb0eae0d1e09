package com.warp.bridge.stream;

/**
 * 面向客户端的增量块，每块至多携带一种内容
 */
public sealed interface OutputChunk
        permits OutputChunk.RoleMarker, OutputChunk.ContentDelta, OutputChunk.ToolCallChunk,
        OutputChunk.FinishChunk, OutputChunk.ErrorChunk {

    /**
     * 是否为终止块
     */
    default boolean terminal() {
        return false;
    }

    record RoleMarker(String role) implements OutputChunk {}

    record ContentDelta(String text) implements OutputChunk {}

    /**
     * id / name 只在该调用的第一个片段上出现
     */
    record ToolCallChunk(int index, String id, String name, String arguments) implements OutputChunk {}

    record FinishChunk(String finishReason) implements OutputChunk {
        @Override
        public boolean terminal() {
            return true;
        }
    }

    /**
     * @param cause 传输层失败时的原始异常，上游错误事件时为 null
     */
    record ErrorChunk(String message, Throwable cause) implements OutputChunk {
        @Override
        public boolean terminal() {
            return true;
        }

        public String finishReason() {
            return "error";
        }
    }
}
