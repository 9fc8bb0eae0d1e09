package com.warp.bridge.service;

import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.auth.Credential;
import com.warp.bridge.auth.CredentialManager;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.conversation.ConversationNormalizer;
import com.warp.bridge.conversation.NormalizedConversation;
import com.warp.bridge.exception.QuotaExceededException;
import com.warp.bridge.exception.StreamStalledException;
import com.warp.bridge.exception.UpstreamErrorException;
import com.warp.bridge.model.ModelResolver;
import com.warp.bridge.model.ModelSelection;
import com.warp.bridge.proxy.UpstreamTransport;
import com.warp.bridge.proxy.WarpEventDecoder;
import com.warp.bridge.session.SessionRegistry;
import com.warp.bridge.session.SessionState;
import com.warp.bridge.stream.StreamEvent;
import com.warp.bridge.stream.StreamTransformer;
import com.warp.bridge.translator.ChatRequest;
import com.warp.bridge.translator.OpenAiChunkRenderer;
import com.warp.bridge.translator.OpenAiRequestParser;
import com.warp.bridge.translator.OutboundRequest;
import com.warp.bridge.translator.ToolSchemaSanitizer;
import com.warp.bridge.translator.WarpRequestTranslator;
import com.warp.bridge.usage.RequestKind;
import com.warp.bridge.usage.UsageTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单次 Chat Completions 请求的编排
 * <p>
 * 解析 → 规范化 → 模型解析 → 工具规范化 → 转换 → 取凭证 → 发送 → 解码 → 流转换。
 * 上游在任何数据之前返回 401/403 或额度耗尽时，换凭证重试一次；已有数据后不再重试
 */
@Service
public class ChatCompletionService {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionService.class);

    private final OpenAiRequestParser parser;
    private final ConversationNormalizer normalizer;
    private final ModelResolver modelResolver;
    private final ToolSchemaSanitizer sanitizer;
    private final WarpRequestTranslator translator;
    private final SessionRegistry sessions;
    private final CredentialManager credentialManager;
    private final UpstreamTransport transport;
    private final StreamTransformer transformer;
    private final UsageTracker usageTracker;
    private final Clock clock;
    private final Duration idleTimeout;
    private final Duration requestDeadline;
    private final boolean enforceQuota;

    public ChatCompletionService(OpenAiRequestParser parser,
                                 ConversationNormalizer normalizer,
                                 ModelResolver modelResolver,
                                 ToolSchemaSanitizer sanitizer,
                                 WarpRequestTranslator translator,
                                 SessionRegistry sessions,
                                 CredentialManager credentialManager,
                                 UpstreamTransport transport,
                                 StreamTransformer transformer,
                                 UsageTracker usageTracker,
                                 AppProperties properties,
                                 Clock clock) {
        this.parser = parser;
        this.normalizer = normalizer;
        this.modelResolver = modelResolver;
        this.sanitizer = sanitizer;
        this.translator = translator;
        this.sessions = sessions;
        this.credentialManager = credentialManager;
        this.transport = transport;
        this.transformer = transformer;
        this.usageTracker = usageTracker;
        this.clock = clock;
        this.idleTimeout = Duration.ofSeconds(properties.getStream().getIdleTimeoutSeconds());
        this.requestDeadline = Duration.ofSeconds(properties.getStream().getRequestDeadlineSeconds());
        this.enforceQuota = properties.getUsage().isEnforce();
    }

    /**
     * 同步校验并转换请求，输入问题在这里直接抛出 4xx 异常
     */
    public PreparedCompletion prepare(JSONObject body, String sessionHeader) {
        ChatRequest request = parser.parse(body);
        translator.validate(request);

        NormalizedConversation conversation = normalizer.normalize(request.turns()).requireUserContent();
        ModelSelection models = modelResolver.resolve(request.model(), request.planningModel(), request.codingModel());
        ToolSchemaSanitizer.SanitizedTools tools = sanitizer.sanitize(request.tools(), request.toolChoice());

        String sessionKey = sessions.keyFor(sessionHeader, request.user());
        SessionState session = sessions.get(sessionKey);
        OutboundRequest outbound = translator.translate(conversation, models, tools, session);

        String displayModel = request.model() != null ? request.model() : models.base();
        OpenAiChunkRenderer renderer = new OpenAiChunkRenderer(displayModel, clock.instant().getEpochSecond());
        log.info("收到请求: session={}, model={}, base={}, stream={}, turns={}, tools={}",
                sessionKey, request.model(), models.base(), request.stream(),
                conversation.turns().size(), tools.tools().size());
        return new PreparedCompletion(request, outbound, sessionKey, renderer);
    }

    /**
     * 流式：凭证获取失败等发生在任何数据之前的错误以 Mono.error 返回，之后的错误都在流内以错误块结束
     */
    public Mono<Flux<String>> streamCompletion(PreparedCompletion prepared) {
        return acquireForRequest().map(credential -> {
            OpenAiChunkRenderer renderer = prepared.renderer();
            return transformer.transform(events(prepared, credential))
                    .map(renderer::renderSse)
                    .concatWithValues(OpenAiChunkRenderer.doneFrame());
        });
    }

    /**
     * 非流式
     */
    public Mono<JSONObject> completion(PreparedCompletion prepared) {
        return acquireForRequest()
                .flatMap(credential -> transformer.aggregate(events(prepared, credential)))
                .map(response -> prepared.renderer().renderCompletion(response));
    }

    private Mono<Credential> acquireForRequest() {
        return Mono.fromCallable(() -> {
            if (enforceQuota && usageTracker.shouldThrottle(RequestKind.INTERACTIVE)) {
                throw new QuotaExceededException("请求额度即将耗尽，已拒绝请求");
            }
            return credentialManager.acquire();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 上游事件流，带空闲超时与整体截止时间
     */
    Flux<StreamEvent> events(PreparedCompletion prepared, Credential credential) {
        return Flux.defer(() -> {
            OutboundRequest outbound = prepared.outbound();
            long deadline = nowMillis() + requestDeadline.toMillis();
            WarpEventDecoder decoder = new WarpEventDecoder(outbound.toolNameReverse());

            return send(outbound, credential, true)
                    .concatMapIterable(decoder::decode)
                    .doOnNext(event -> onEvent(prepared.sessionKey(), event))
                    .timeout(Mono.delay(nextWait(deadline)), item -> Mono.delay(nextWait(deadline)))
                    .onErrorMap(TimeoutException.class, e -> stalled(deadline));
        });
    }

    private Flux<String> send(OutboundRequest outbound, Credential credential, boolean firstAttempt) {
        AtomicBoolean received = new AtomicBoolean();
        return transport.stream(outbound, credential.accessToken())
                .doOnNext(event -> received.set(true))
                .onErrorResume(UpstreamErrorException.class, e -> {
                    if (!firstAttempt || received.get() || !(e.isAuthError() || e.isQuotaExhausted())) {
                        return Flux.error(e);
                    }
                    boolean quota = e.isQuotaExhausted();
                    log.warn("上游拒绝请求 (status={}), 更换凭证后重试一次", e.getUpstreamStatus());
                    return Mono.fromCallable(() -> {
                                if (quota) {
                                    usageTracker.markExhausted();
                                    return credentialManager.forceReacquire(credential);
                                }
                                return credentialManager.forceRefresh(credential);
                            })
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMapMany(fresh -> send(outbound, fresh, false));
                });
    }

    private void onEvent(String sessionKey, StreamEvent event) {
        if (event instanceof StreamEvent.SessionInit init) {
            sessions.update(sessionKey, init.conversationId(), init.taskId());
        } else if (event instanceof StreamEvent.Finish) {
            usageTracker.recordRequest();
        }
    }

    // 超时计时与 Mono.delay 使用同一个调度器时钟
    private static long nowMillis() {
        return Schedulers.parallel().now(TimeUnit.MILLISECONDS);
    }

    private Duration nextWait(long deadline) {
        Duration remaining = Duration.ofMillis(deadline - nowMillis());
        if (remaining.isNegative()) {
            return Duration.ZERO;
        }
        return remaining.compareTo(idleTimeout) < 0 ? remaining : idleTimeout;
    }

    private StreamStalledException stalled(long deadline) {
        if (nowMillis() >= deadline) {
            log.warn("请求超过截止时间 {}s", requestDeadline.toSeconds());
            return new StreamStalledException("请求超过截止时间 " + requestDeadline.toSeconds() + "s");
        }
        log.warn("上游 {}s 内没有新事件", idleTimeout.toSeconds());
        return new StreamStalledException("上游事件流停滞超过 " + idleTimeout.toSeconds() + "s");
    }

    /**
     * 已校验、已转换的请求
     */
    public record PreparedCompletion(ChatRequest request,
                                     OutboundRequest outbound,
                                     String sessionKey,
                                     OpenAiChunkRenderer renderer) {

        public boolean stream() {
            return request.stream();
        }
    }
}
