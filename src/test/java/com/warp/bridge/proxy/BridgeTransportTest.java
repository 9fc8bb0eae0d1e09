package com.warp.bridge.proxy;

import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.dto.warp.WarpPacket;
import com.warp.bridge.exception.UpstreamErrorException;
import com.warp.bridge.model.ModelSelection;
import com.warp.bridge.translator.OutboundRequest;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BridgeTransportTest {

    private MockWebServer server;
    private BridgeTransport transport;
    private OutboundRequest outbound;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        AppProperties properties = new AppProperties();
        properties.getBridge().setBaseUrl(server.url("").toString().replaceAll("/$", ""));
        properties.getBridge().setApiKey("bridge-key");
        transport = new BridgeTransport(HttpClient.newHttpClient(), properties);

        ModelSelection models = new ModelSelection("claude-4.1-opus", "o3", "auto");
        WarpPacket packet = new WarpPacket("task-1").settings(models, WarpPacket.DEFAULT_FEATURE_FLAGS)
                .inputUserQuery("hi", null);
        outbound = new OutboundRequest(packet, models, null, "task-1", Map.of());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void stream_postsPacketAndSplitsSseEvents() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("""
                        data: {"parsed_data":{"init":{"conversation_id":"c1"}}}

                        data: {"parsed_data":{"finished":{"done":{}}}}

                        data: [DONE]

                        """));

        StepVerifier.create(transport.stream(outbound, "access-token"))
                .expectNext("{\"parsed_data\":{\"init\":{\"conversation_id\":\"c1\"}}}")
                .expectNext("{\"parsed_data\":{\"finished\":{\"done\":{}}}}")
                .verifyComplete();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/warp/send_stream_sse");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer access-token");
        assertThat(request.getHeader("Accept")).isEqualTo("text/event-stream");
        assertThat(request.getHeader("X-API-Key")).isEqualTo("bridge-key");
        JSONObject body = JSONObject.parseObject(request.getBody().readUtf8());
        assertThat(body.getString("message_type")).isEqualTo("warp.multi_agent.v1.Request");
        assertThat(body.getJSONObject("json_data").getJSONObject("task_context").getString("active_task_id"))
                .isEqualTo("task-1");
    }

    @Test
    void stream_nonOkStatus_failsWithUpstreamStatusAndBody() {
        server.enqueue(new MockResponse().setResponseCode(429)
                .setBody("{\"error\":\"No remaining quota\"}"));

        StepVerifier.create(transport.stream(outbound, "access-token"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamErrorException.class);
                    UpstreamErrorException upstream = (UpstreamErrorException) e;
                    assertThat(upstream.getUpstreamStatus()).isEqualTo(429);
                    assertThat(upstream.isQuotaExhausted()).isTrue();
                })
                .verify();
    }

    @Test
    void stream_unauthorized_isAuthError() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("unauthorized"));

        StepVerifier.create(transport.stream(outbound, "expired"))
                .expectErrorSatisfies(e -> assertThat(((UpstreamErrorException) e).isAuthError()).isTrue())
                .verify();
    }
}
