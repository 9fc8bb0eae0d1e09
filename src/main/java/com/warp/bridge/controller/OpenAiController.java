package com.warp.bridge.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.NormalizationException;
import com.warp.bridge.model.ModelResolver;
import com.warp.bridge.service.ChatCompletionService;
import com.warp.bridge.usage.UsageSnapshot;
import com.warp.bridge.usage.UsageTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * OpenAI 兼容 API 端点
 * <p>
 * POST /v1/chat/completions : 流式 + 非流式
 * GET  /v1/models            : 模型列表
 * GET  /v1/usage             : 额度快照
 */
@RestController
@RequestMapping("/v1")
public class OpenAiController {

    private static final Logger log = LoggerFactory.getLogger(OpenAiController.class);

    private final ChatCompletionService completionService;
    private final ModelResolver modelResolver;
    private final UsageTracker usageTracker;
    private final String sessionHeader;

    public OpenAiController(ChatCompletionService completionService, ModelResolver modelResolver,
                            UsageTracker usageTracker, AppProperties properties) {
        this.completionService = completionService;
        this.modelResolver = modelResolver;
        this.usageTracker = usageTracker;
        this.sessionHeader = properties.getSession().getHeader();
    }

    /**
     * POST /v1/chat/completions
     */
    @PostMapping(value = "/chat/completions")
    public Mono<Void> chatCompletions(@RequestBody(required = false) String body, ServerWebExchange exchange) {
        JSONObject request = parseBody(body);
        String session = exchange.getRequest().getHeaders().getFirst(sessionHeader);
        ChatCompletionService.PreparedCompletion prepared = completionService.prepare(request, session);

        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();

        if (prepared.stream()) {
            return completionService.streamCompletion(prepared).flatMap(sseFlux -> {
                exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
                exchange.getResponse().getHeaders().setCacheControl("no-cache");
                return exchange.getResponse().writeAndFlushWith(
                        sseFlux.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
                );
            });
        }

        // 非流式：直接写 JSON 字节，避免 Jackson 二次序列化
        return completionService.completion(prepared).flatMap(json -> {
            exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
            byte[] bytes = json.toJSONString().getBytes(StandardCharsets.UTF_8);
            exchange.getResponse().getHeaders().setContentLength(bytes.length);
            DataBuffer buffer = bufferFactory.wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        });
    }

    /**
     * GET /v1/models
     */
    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> listModels() {
        long created = System.currentTimeMillis() / 1000;
        JSONArray data = new JSONArray();
        for (String model : modelResolver.listModels()) {
            data.add(JSONObject.of(
                    "id", model, //
                    "object", "model", //
                    "created", created, //
                    "owned_by", "warp" //
            ));
        }
        JSONObject response = JSONObject.of("object", "list", "data", data);
        return Mono.just(response.toJSONString());
    }

    /**
     * GET /v1/usage
     */
    @GetMapping(value = "/usage", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> usage() {
        return Mono.fromCallable(usageTracker::snapshot)
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::usageJson);
    }

    private String usageJson(Optional<UsageSnapshot> snapshot) {
        if (snapshot.isEmpty()) {
            return JSONObject.of("available", false).toJSONString();
        }
        UsageSnapshot s = snapshot.get();
        JSONObject result = new JSONObject();
        result.put("available", true);
        result.put("unlimited", s.unlimited());
        result.put("request_limit", s.windowLimit());
        result.put("requests_used", s.windowUsed());
        result.put("requests_remaining", s.unlimited() ? null : s.remaining());
        result.put("next_refresh_time", s.resetsAt() != null ? s.resetsAt().toString() : null);
        result.put("fetched_at", s.fetchedAt().toString());
        result.put("stale", s.stale());
        return result.toJSONString();
    }

    private JSONObject parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new NormalizationException("请求体为空");
        }
        try {
            JSONObject json = JSONObject.parseObject(body);
            if (json == null) {
                throw new NormalizationException("请求体必须是 JSON 对象");
            }
            return json;
        } catch (JSONException e) {
            log.warn("请求体 JSON 解析失败: {}", e.getMessage());
            throw new NormalizationException("请求体不是合法的 JSON: " + e.getMessage());
        }
    }
}
