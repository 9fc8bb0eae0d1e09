package com.warp.bridge.proxy;

import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.UpstreamErrorException;
import com.warp.bridge.translator.OutboundRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 经 protobuf 编码桥访问上游
 * <p>
 * 请求体为 {json_data, message_type}，桥负责编码并以 SSE 返回解析后的事件
 */
@Component
public class BridgeTransport implements UpstreamTransport {

    private static final Logger log = LoggerFactory.getLogger(BridgeTransport.class);

    private final HttpClient httpClient;
    private final AppProperties.BridgeConfig config;

    public BridgeTransport(HttpClient warpHttpClient, AppProperties properties) {
        this.httpClient = warpHttpClient;
        this.config = properties.getBridge();
    }

    @Override
    public Flux<String> stream(OutboundRequest outbound, String accessToken) {
        return Flux.defer(() -> {
            HttpRequest request = buildRequest(outbound, accessToken);
            log.debug("发送请求到编码桥: taskId={}, url={}", outbound.taskId(), request.uri());
            return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofLines()))
                    .onErrorMap(e -> !(e instanceof UpstreamErrorException),
                            e -> new UpstreamErrorException("编码桥请求失败: " + e.getMessage(), e))
                    .flatMapMany(this::readEvents);
        });
    }

    private Flux<String> readEvents(HttpResponse<Stream<String>> response) {
        int status = response.statusCode();
        if (status != 200) {
            String body;
            try (Stream<String> lines = response.body()) {
                body = lines.collect(Collectors.joining("\n"));
            }
            log.error("编码桥返回错误: status={}, body={}", status, abbreviate(body));
            return Flux.error(new UpstreamErrorException(status, body));
        }

        SseLineDecoder decoder = new SseLineDecoder();
        // [DONE] 之后的下一行触发取消，关闭响应流
        return Flux.fromStream(response.body())
                .takeWhile(line -> !decoder.isDone())
                .concatMapIterable(decoder::feed)
                .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.flush())))
                .onErrorMap(e -> !(e instanceof UpstreamErrorException),
                        e -> new UpstreamErrorException("读取上游事件流失败: " + e.getMessage(), e));
    }

    private HttpRequest buildRequest(OutboundRequest outbound, String accessToken) {
        JSONObject body = JSONObject.of(
                "json_data", outbound.packet().toJson(), //
                "message_type", config.getMessageType() //
        );
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl() + config.getStreamPath()))
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .header("Authorization", "Bearer " + accessToken)
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString()));
        if (config.getApiKey() != null && !config.getApiKey().isEmpty()) {
            builder.header("X-API-Key", config.getApiKey());
        }
        return builder.build();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
