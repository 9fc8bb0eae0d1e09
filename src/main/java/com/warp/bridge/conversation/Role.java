package com.warp.bridge.conversation;

import java.util.Locale;

/**
 * 会话角色
 */
public enum Role {

    SYSTEM,
    USER,
    ASSISTANT,
    TOOL;

    /**
     * 解析 OpenAI 消息中的 role 字段，developer 视为 system
     *
     * @return 无法识别时返回 null
     */
    public static Role fromWire(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "system", "developer" -> SYSTEM;
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            case "tool", "function" -> TOOL;
            default -> null;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
