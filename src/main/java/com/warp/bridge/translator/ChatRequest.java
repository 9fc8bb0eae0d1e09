package com.warp.bridge.translator;

import com.alibaba.fastjson2.JSONArray;
import com.warp.bridge.conversation.ChatTurn;

import java.util.List;

/**
 * 解析后的 Chat Completions 请求
 *
 * @param model           请求的模型名，可为 null
 * @param planningModel   扩展字段 model_config.planning，可为 null
 * @param codingModel     扩展字段 model_config.coding，可为 null
 * @param tools           原始 tools 数组，可为 null
 * @param toolChoice      原始 tool_choice（字符串或对象），可为 null
 * @param user            OpenAI user 字段，用作会话键的后备
 */
public record ChatRequest(String model,
                          String planningModel,
                          String codingModel,
                          boolean stream,
                          List<ChatTurn> turns,
                          JSONArray tools,
                          Object toolChoice,
                          int n,
                          String user) {

    public ChatRequest {
        turns = List.copyOf(turns);
    }
}
