package com.warp.bridge.session;

import com.warp.bridge.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按会话键保存 conversation_id / task_id
 * <p>
 * 每个键的更新通过 {@link ConcurrentHashMap#compute} 原子完成
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final String defaultKey;

    public SessionRegistry(AppProperties properties) {
        this.defaultKey = properties.getSession().getDefaultKey();
    }

    /**
     * 会话键：显式请求头优先，其次 user 字段，否则共享默认会话
     */
    public String keyFor(String headerValue, String user) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        if (user != null && !user.isBlank()) {
            return user.trim();
        }
        return defaultKey;
    }

    public SessionState get(String key) {
        return sessions.getOrDefault(key, SessionState.NEW);
    }

    /**
     * 记录上游下发的新标识
     */
    public SessionState update(String key, String conversationId, String taskId) {
        SessionState updated = sessions.compute(key, (k, current) ->
                (current != null ? current : SessionState.NEW).merge(conversationId, taskId));
        log.debug("会话 {} 已更新: conversationId={}, taskId={}", key, updated.conversationId(), updated.taskId());
        return updated;
    }

    public void reset(String key) {
        sessions.remove(key);
    }

    public int size() {
        return sessions.size();
    }
}
