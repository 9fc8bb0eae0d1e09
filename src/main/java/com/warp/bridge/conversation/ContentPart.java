package com.warp.bridge.conversation;

/**
 * 消息内容片段
 * <p>
 * 文本、图片引用、工具调用、工具结果四种，保持输入顺序
 */
public sealed interface ContentPart
        permits ContentPart.TextPart, ContentPart.ImagePart, ContentPart.ToolCallPart, ContentPart.ToolResultPart {

    record TextPart(String text) implements ContentPart {
        public TextPart {
            text = text != null ? text : "";
        }
    }

    record ImagePart(String url) implements ContentPart {}

    /**
     * @param arguments 原始 JSON 字符串
     */
    record ToolCallPart(String id, String name, String arguments) implements ContentPart {}

    record ToolResultPart(String toolCallId, String content) implements ContentPart {}
}
