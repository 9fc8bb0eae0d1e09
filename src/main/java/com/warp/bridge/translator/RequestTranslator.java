package com.warp.bridge.translator;

import com.warp.bridge.conversation.NormalizedConversation;
import com.warp.bridge.model.ModelSelection;
import com.warp.bridge.session.SessionState;

/**
 * 请求转换接口
 * <p>
 * 将规范化后的会话转换为上游请求
 */
public interface RequestTranslator {

    /**
     * 转换请求
     *
     * @param conversation 规范化后的会话，至少包含一条用户消息
     * @param models       解析后的模型组合
     * @param tools        规范化后的工具定义
     * @param session      会话标识，新会话传 {@link SessionState#NEW}
     * @return 上游请求
     */
    OutboundRequest translate(NormalizedConversation conversation,
                              ModelSelection models,
                              ToolSchemaSanitizer.SanitizedTools tools,
                              SessionState session);
}
