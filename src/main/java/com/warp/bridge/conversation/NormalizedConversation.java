package com.warp.bridge.conversation;

import com.warp.bridge.exception.NormalizationException;

import java.util.List;

/**
 * 规范化后的会话：user/assistant 严格交替且以 user 开头，工具结果挂在 assistant 上
 *
 * @param leadingSystemText 所有 system 消息以空行拼接，没有时为 null
 */
public record NormalizedConversation(String leadingSystemText, List<ChatTurn> turns) {

    public NormalizedConversation {
        turns = List.copyOf(turns);
    }

    public boolean hasSystemText() {
        return leadingSystemText != null && !leadingSystemText.isEmpty();
    }

    public ChatTurn lastTurn() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }

    /**
     * 只有 system 消息的会话无法生成回复
     */
    public NormalizedConversation requireUserContent() {
        if (turns.isEmpty()) {
            throw new NormalizationException("会话中没有用户消息");
        }
        return this;
    }
}
