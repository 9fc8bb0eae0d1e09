package com.warp.bridge.translator;

import com.warp.bridge.dto.warp.WarpPacket;
import com.warp.bridge.model.ModelSelection;

import java.util.Map;

/**
 * 发往上游的请求
 *
 * @param packet          上游请求包
 * @param models          实际使用的模型组合
 * @param conversationId  沿用的 conversation_id，新会话为 null
 * @param taskId          本次请求的 task id
 * @param toolNameReverse 上游工具名 → 客户端原始名
 */
public record OutboundRequest(WarpPacket packet,
                              ModelSelection models,
                              String conversationId,
                              String taskId,
                              Map<String, String> toolNameReverse) {

    /**
     * 将上游工具名还原为客户端名称
     */
    public String originalToolName(String upstreamName) {
        return toolNameReverse.getOrDefault(upstreamName, upstreamName);
    }
}
