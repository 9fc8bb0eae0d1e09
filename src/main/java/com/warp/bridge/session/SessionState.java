package com.warp.bridge.session;

/**
 * 单个逻辑会话的上游标识，均为 null 表示新会话
 *
 * @param conversationId 上游 conversation_id
 * @param taskId         上一轮的 task id
 */
public record SessionState(String conversationId, String taskId) {

    public static final SessionState NEW = new SessionState(null, null);

    public boolean isNew() {
        return conversationId == null && taskId == null;
    }

    /**
     * 合并上游新下发的标识，空值沿用原值
     */
    public SessionState merge(String newConversationId, String newTaskId) {
        return new SessionState(
                newConversationId != null && !newConversationId.isEmpty() ? newConversationId : conversationId,
                newTaskId != null && !newTaskId.isEmpty() ? newTaskId : taskId
        );
    }
}
