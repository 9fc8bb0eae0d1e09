package com.warp.bridge.proxy;

import java.util.List;

/**
 * SSE 行解码
 * <p>
 * 连续的 data: 行拼接为一个事件，空行结束事件，data: [DONE] 结束整个流
 */
public class SseLineDecoder {

    private final StringBuilder current = new StringBuilder();
    private boolean done;

    /**
     * 输入一行，返回本行结束的事件（0 或 1 个）
     */
    public List<String> feed(String line) {
        if (done) {
            return List.of();
        }
        if (line.startsWith("data:")) {
            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                return List.of();
            }
            if ("[DONE]".equals(payload)) {
                done = true;
                return flush();
            }
            current.append(payload);
            return List.of();
        }
        if (line.isBlank()) {
            return flush();
        }
        // event: / id: / 注释行忽略
        return List.of();
    }

    /**
     * 流结束时输出尚未结束的事件
     */
    public List<String> flush() {
        if (current.isEmpty()) {
            return List.of();
        }
        String event = current.toString();
        current.setLength(0);
        return List.of(event);
    }

    public boolean isDone() {
        return done;
    }
}
