package com.warp.bridge.proxy;

import com.warp.bridge.translator.OutboundRequest;
import reactor.core.publisher.Flux;

/**
 * 上游传输
 * <p>
 * 发送请求包并返回原始事件 JSON。非 200 响应在任何事件之前以
 * {@link com.warp.bridge.exception.UpstreamErrorException} 失败；取消订阅时关闭响应流
 */
public interface UpstreamTransport {

    Flux<String> stream(OutboundRequest request, String accessToken);
}
