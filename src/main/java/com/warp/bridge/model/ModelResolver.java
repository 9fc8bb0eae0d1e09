package com.warp.bridge.model;

import com.warp.bridge.config.AppProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 模型解析器
 * <p>
 * 将外部模型名（如 gpt-4o, claude-3-5-sonnet）映射为 Warp 模型 ID。
 * base / planning / coding 任一无法识别时回退到配置的默认值，不会导致请求失败
 */
@Component
public class ModelResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelResolver.class);

    private final AppProperties.ModelsConfig config;

    // 映射规则（按优先级降序），regex 规则启动时预编译
    private final List<CompiledRule> mappingRules = new ArrayList<>();
    private final Set<String> knownModels = new LinkedHashSet<>();
    // 已解析缓存，value 为空串表示未匹配
    private final Map<String, String> resolveCache = new ConcurrentHashMap<>();

    public ModelResolver(AppProperties properties) {
        this.config = properties.getModels();
    }

    @PostConstruct
    public void init() {
        knownModels.clear();
        for (String model : config.getAvailable()) {
            knownModels.add(model.toLowerCase(Locale.ROOT));
        }
        knownModels.add(config.getDefaultBase().toLowerCase(Locale.ROOT));
        knownModels.add(config.getDefaultPlanning().toLowerCase(Locale.ROOT));
        knownModels.add(config.getDefaultCoding().toLowerCase(Locale.ROOT));

        mappingRules.clear();
        for (AppProperties.MappingRule rule : config.getMappings()) {
            if (rule.getPattern() == null || rule.getTarget() == null) {
                log.warn("忽略不完整的模型映射规则: {}", rule);
                continue;
            }
            mappingRules.add(compile(rule));
        }
        mappingRules.sort(Comparator.comparingInt((CompiledRule r) -> r.rule().getPriority()).reversed());
        resolveCache.clear();
        log.info("模型解析器初始化完成: {} 个模型, {} 条映射规则", knownModels.size(), mappingRules.size());
    }

    /**
     * 解析完整的模型组合
     *
     * @param requestedBase     请求中的 model 字段
     * @param requestedPlanning 可选，请求中 model_config.planning
     * @param requestedCoding   可选，请求中 model_config.coding
     */
    public ModelSelection resolve(String requestedBase, String requestedPlanning, String requestedCoding) {
        return new ModelSelection(
                resolveOne(requestedBase, config.getDefaultBase()),
                resolveOne(requestedPlanning, config.getDefaultPlanning()),
                resolveOne(requestedCoding, config.getDefaultCoding())
        );
    }

    public ModelSelection resolve(String requestedBase) {
        return resolve(requestedBase, null, null);
    }

    /**
     * /v1/models 展示的模型列表
     */
    public List<String> listModels() {
        return List.copyOf(config.getAvailable());
    }

    private String resolveOne(String externalModel, String fallback) {
        if (externalModel == null || externalModel.isBlank()) {
            return fallback;
        }
        String key = externalModel.trim().toLowerCase(Locale.ROOT);
        String resolved = resolveCache.computeIfAbsent(key, this::match);
        if (resolved.isEmpty()) {
            log.debug("模型 '{}' 未找到映射，使用默认模型 {}", externalModel, fallback);
            return fallback;
        }
        return resolved;
    }

    private String match(String model) {
        // 精确匹配已知模型
        if (knownModels.contains(model)) {
            return model;
        }

        // 映射规则匹配
        for (CompiledRule compiled : mappingRules) {
            AppProperties.MappingRule rule = compiled.rule();
            String pattern = rule.getPattern().toLowerCase(Locale.ROOT);
            boolean matched = switch (rule.getMatchType()) {
                case "exact" -> model.equals(pattern);
                case "prefix" -> model.startsWith(pattern);
                case "contains" -> model.contains(pattern);
                case "regex" -> compiled.regex().matcher(model).matches();
                default -> false;
            };
            if (matched) {
                return rule.getTarget();
            }
        }
        return "";
    }

    /**
     * 非法正则在启动时拒绝，避免请求时才失败
     */
    private static CompiledRule compile(AppProperties.MappingRule rule) {
        if (!"regex".equals(rule.getMatchType())) {
            return new CompiledRule(rule, null);
        }
        try {
            return new CompiledRule(rule, Pattern.compile(rule.getPattern()));
        } catch (PatternSyntaxException e) {
            throw new IllegalStateException("模型映射规则正则无效: " + rule.getPattern() + " (" + e.getDescription() + ")", e);
        }
    }

    private record CompiledRule(AppProperties.MappingRule rule, Pattern regex) {
    }
}
