package com.warp.bridge.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.exception.InvalidToolSchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工具 schema 规范化
 * <p>
 * 输出 {name, description, input_schema}；缺 type 但有 properties 视为 object；
 * 缺 required 时推断为所有没有 default 且不可为 null 的属性；类型无法识别的工具丢弃并告警。
 * 同名工具只保留第一个有效定义
 */
@Component
public class ToolSchemaSanitizer {

    private static final Logger log = LoggerFactory.getLogger(ToolSchemaSanitizer.class);

    private static final Set<String> KNOWN_TYPES = Set.of(
            "object", "string", "number", "integer", "boolean", "array", "null");

    private static final int MAX_DESCRIPTION_LENGTH = 10000;

    /**
     * @param tools      OpenAI tools 数组，可为 null
     * @param toolChoice OpenAI tool_choice，可为 null
     */
    public SanitizedTools sanitize(JSONArray tools, Object toolChoice) {
        Map<String, String> nameMap = new LinkedHashMap<>();
        Set<String> usedNames = new HashSet<>();
        List<ToolDefinition> result = new ArrayList<>();

        if (tools != null) {
            for (int i = 0; i < tools.size(); i++) {
                ToolDefinition definition = sanitizeTool(tools.get(i), nameMap, usedNames);
                if (definition != null) {
                    result.add(definition);
                }
            }
        }

        String requiredName = requiredToolName(toolChoice);
        boolean toolsDemanded = requiredName != null || "required".equals(toolChoice);
        if (toolsDemanded && result.isEmpty()) {
            throw new InvalidToolSchemaException("tool_choice 要求调用工具，但没有有效的工具定义");
        }
        if (requiredName != null && !nameMap.containsKey(requiredName)) {
            throw new InvalidToolSchemaException("tool_choice 指定的工具无效: " + requiredName);
        }

        // tool_choice=none 时不向上游暴露工具，名称映射仍保留用于历史中的工具调用
        if ("none".equals(toolChoice)) {
            return new SanitizedTools(List.of(), nameMap);
        }
        return new SanitizedTools(result, nameMap);
    }

    private ToolDefinition sanitizeTool(Object raw, Map<String, String> nameMap, Set<String> usedNames) {
        if (!(raw instanceof JSONObject tool)) {
            log.warn("丢弃无效工具定义: {}", raw);
            return null;
        }
        String type = tool.getString("type");
        if (type != null && !"function".equals(type)) {
            log.warn("丢弃不支持的工具类型: {}", type);
            return null;
        }
        JSONObject function = tool.getJSONObject("function");
        String originalName = function != null ? function.getString("name") : null;
        if (originalName == null || originalName.isBlank()) {
            log.warn("丢弃缺少名称的工具定义");
            return null;
        }
        if (nameMap.containsKey(originalName)) {
            log.warn("工具 '{}' 重复定义，只保留第一个", originalName);
            return null;
        }

        Object parameters = function.get("parameters");
        JSONObject schema;
        if (parameters == null) {
            schema = JSONObject.of("type", "object", "properties", new JSONObject());
        } else if (parameters instanceof JSONObject obj) {
            schema = normalizeSchema(JSONObject.parseObject(obj.toJSONString()));
            if (schema == null) {
                log.warn("工具 '{}' 的 schema 无法解析，已丢弃", originalName);
                return null;
            }
            if (!"object".equals(schema.get("type"))) {
                log.warn("工具 '{}' 的参数 schema 不是 object，已丢弃", originalName);
                return null;
            }
        } else {
            log.warn("工具 '{}' 的 parameters 不是对象，已丢弃", originalName);
            return null;
        }

        String description = function.getString("description");
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            description = description.substring(0, MAX_DESCRIPTION_LENGTH);
        }

        String name = getOrCreateToolName(originalName, nameMap, usedNames);
        return new ToolDefinition(name, originalName, description, schema);
    }

    /**
     * 递归规范化 schema
     *
     * @return 类型无法识别时返回 null
     */
    private JSONObject normalizeSchema(JSONObject schema) {
        Object type = schema.get("type");
        Object properties = schema.get("properties");

        if (type == null && properties != null) {
            schema.put("type", "object");
            type = "object";
        }
        if (type != null && !isKnownType(type)) {
            return null;
        }

        if (properties != null) {
            if (!(properties instanceof JSONObject props)) {
                return null;
            }
            for (String key : new ArrayList<>(props.keySet())) {
                Object child = props.get(key);
                if (!(child instanceof JSONObject childSchema)) {
                    return null;
                }
                JSONObject normalized = normalizeSchema(childSchema);
                if (normalized == null) {
                    return null;
                }
                props.put(key, normalized);
            }
            if (!schema.containsKey("required")) {
                schema.put("required", inferRequired(props));
            }
        } else if ("object".equals(type)) {
            schema.put("properties", new JSONObject());
            if (!schema.containsKey("required")) {
                schema.put("required", new JSONArray());
            }
        }

        Object items = schema.get("items");
        if (items instanceof JSONObject itemSchema) {
            JSONObject normalized = normalizeSchema(itemSchema);
            if (normalized == null) {
                return null;
            }
            schema.put("items", normalized);
        }
        return schema;
    }

    private JSONArray inferRequired(JSONObject properties) {
        JSONArray required = new JSONArray();
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            JSONObject prop = (JSONObject) entry.getValue();
            if (!prop.containsKey("default") && !isNullable(prop)) {
                required.add(entry.getKey());
            }
        }
        return required;
    }

    private boolean isNullable(JSONObject prop) {
        if (Boolean.TRUE.equals(prop.getBoolean("nullable"))) {
            return true;
        }
        Object type = prop.get("type");
        if (type instanceof JSONArray types && types.contains("null")) {
            return true;
        }
        for (String combinator : List.of("anyOf", "oneOf")) {
            JSONArray options = prop.getJSONArray(combinator);
            if (options == null) continue;
            for (int i = 0; i < options.size(); i++) {
                Object option = options.get(i);
                if (option instanceof JSONObject o && "null".equals(o.get("type"))) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isKnownType(Object type) {
        if (type instanceof String s) {
            return KNOWN_TYPES.contains(s);
        }
        if (type instanceof JSONArray types) {
            if (types.isEmpty()) return false;
            for (Object t : types) {
                if (!(t instanceof String s) || !KNOWN_TYPES.contains(s)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private String requiredToolName(Object toolChoice) {
        if (toolChoice instanceof JSONObject choice && "function".equals(choice.getString("type"))) {
            JSONObject function = choice.getJSONObject("function");
            return function != null ? function.getString("name") : null;
        }
        return null;
    }

    static String getOrCreateToolName(String originalName, Map<String, String> toolNameMap, Set<String> usedNames) {
        if (toolNameMap.containsKey(originalName)) return toolNameMap.get(originalName);
        String safe = sanitizeToolName(originalName);
        String candidate = safe;
        int i = 2;
        while (usedNames.contains(candidate)) {
            candidate = safe + "_" + i++;
        }
        usedNames.add(candidate);
        toolNameMap.put(originalName, candidate);
        return candidate;
    }

    static String sanitizeToolName(String name) {
        if (name == null || name.isEmpty()) return "tool";
        String replaced = name.replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        String trimmed = replaced.replaceAll("^_+|_+$", "");
        if (trimmed.isEmpty()) return "tool";
        return trimmed.matches("^[0-9].*") ? "t_" + trimmed : trimmed;
    }

    /**
     * 规范化结果
     *
     * @param nameMap 原始名 → 上游名
     */
    public record SanitizedTools(List<ToolDefinition> tools, Map<String, String> nameMap) {

        public static SanitizedTools empty() {
            return new SanitizedTools(List.of(), Collections.emptyMap());
        }

        /**
         * 上游名 → 原始名
         */
        public Map<String, String> reverseNameMap() {
            Map<String, String> reverse = new LinkedHashMap<>();
            nameMap.forEach((original, safe) -> reverse.put(safe, original));
            return reverse;
        }
    }
}
