package com.warp.bridge.conversation;

import com.warp.bridge.conversation.ContentPart.TextPart;
import com.warp.bridge.conversation.ContentPart.ToolCallPart;
import com.warp.bridge.conversation.ContentPart.ToolResultPart;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 一轮会话消息
 */
public record ChatTurn(Role role, List<ContentPart> parts) {

    public ChatTurn {
        parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public static ChatTurn of(Role role, String text) {
        return new ChatTurn(role, List.of(new TextPart(text)));
    }

    public static ChatTurn emptyUser() {
        return of(Role.USER, "");
    }

    /**
     * 文本片段按 "\n" 拼接
     */
    public String text() {
        return parts.stream()
                .filter(TextPart.class::isInstance)
                .map(p -> ((TextPart) p).text())
                .collect(Collectors.joining("\n"));
    }

    public List<ToolCallPart> toolCalls() {
        return parts.stream()
                .filter(ToolCallPart.class::isInstance)
                .map(ToolCallPart.class::cast)
                .toList();
    }

    public List<ToolResultPart> toolResults() {
        return parts.stream()
                .filter(ToolResultPart.class::isInstance)
                .map(ToolResultPart.class::cast)
                .toList();
    }

    /**
     * 追加片段，返回新的 turn
     */
    public ChatTurn append(List<ContentPart> more) {
        List<ContentPart> merged = new ArrayList<>(parts.size() + more.size());
        merged.addAll(parts);
        merged.addAll(more);
        return new ChatTurn(role, merged);
    }

    public ChatTurn withRole(Role newRole) {
        return new ChatTurn(newRole, parts);
    }
}
