package com.warp.bridge.translator;

import com.alibaba.fastjson2.JSONObject;

/**
 * 规范化后的工具定义，对应上游 mcp_context.tools 的一项
 *
 * @param name         上游使用的安全名称
 * @param originalName 客户端原始名称
 */
public record ToolDefinition(String name, String originalName, String description, JSONObject inputSchema) {

    public JSONObject toJson() {
        return JSONObject.of(
                "name", name, //
                "description", description != null ? description : "", //
                "input_schema", inputSchema //
        );
    }
}
