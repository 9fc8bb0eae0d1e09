package com.warp.bridge.auth;

import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.AcquireFailedException;
import com.warp.bridge.exception.ExchangeFailedException;
import com.warp.bridge.exception.GrantFailedException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class WarpIdentityClientTest {

    private MockWebServer server;
    private WarpIdentityClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        AppProperties properties = new AppProperties();
        AppProperties.IdentityConfig identity = properties.getIdentity();
        identity.setGraphqlUrl(server.url("/graphql/v2").toString());
        identity.setIdentityToolkitUrl(server.url("/v1/accounts:signInWithCustomToken").toString());
        identity.setTokenUrl(server.url("/proxy/token").toString());
        identity.setFirebaseApiKey("test-key");
        identity.setDefaultRetryAfterSeconds(30);
        client = new WarpIdentityClient(HttpClient.newHttpClient(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void createAnonymousUser_returnsIdToken() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"data":{"createAnonymousUser":{
                          "__typename":"CreateAnonymousUserOutput",
                          "idToken":"custom-id-token","firebaseUid":"uid-1"}}}
                        """));

        assertThat(client.createAnonymousUser()).isEqualTo("custom-id-token");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/graphql/v2?op=CreateAnonymousUser");
        assertThat(request.getHeader("x-warp-client-version")).isNotBlank();
        JSONObject body = JSONObject.parseObject(request.getBody().readUtf8());
        assertThat(body.getString("operationName")).isEqualTo("CreateAnonymousUser");
        assertThat(body.getJSONObject("variables").getJSONObject("input").getString("anonymousUserType"))
                .isEqualTo("NATIVE_CLIENT_ANONYMOUS_USER_FEATURE_GATED");
    }

    @Test
    void createAnonymousUser_userFacingError_isNotRetryable() {
        server.enqueue(new MockResponse().setBody("""
                {"data":{"createAnonymousUser":{"__typename":"UserFacingError",
                  "error":{"__typename":"SomeError","message":"blocked"}}}}
                """));

        AcquireFailedException e = catchThrowableOfType(client::createAnonymousUser, AcquireFailedException.class);

        assertThat(e).isNotNull();
        assertThat(e.isRetryable()).isFalse();
        assertThat(e.getMessage()).contains("blocked");
    }

    @Test
    void createAnonymousUser_serverError_isRetryable() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

        AcquireFailedException e = catchThrowableOfType(client::createAnonymousUser, AcquireFailedException.class);

        assertThat(e.isRetryable()).isTrue();
    }

    @Test
    void exchangeIdentityAssertion_returnsRefreshToken() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"idToken\":\"x\",\"refreshToken\":\"rt-1\",\"expiresIn\":\"3600\"}"));

        assertThat(client.exchangeIdentityAssertion("custom-id-token")).isEqualTo("rt-1");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/accounts:signInWithCustomToken?key=test-key");
        JSONObject body = JSONObject.parseObject(request.getBody().readUtf8());
        assertThat(body.getString("token")).isEqualTo("custom-id-token");
        assertThat(body.getBooleanValue("returnSecureToken")).isTrue();
    }

    @Test
    void exchangeIdentityAssertion_invalidToken_isNotRetryable() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":{\"code\":400,\"message\":\"INVALID_CUSTOM_TOKEN\"}}"));

        ExchangeFailedException e = catchThrowableOfType(
                () -> client.exchangeIdentityAssertion("expired"), ExchangeFailedException.class);

        assertThat(e.isRetryable()).isFalse();
        assertThat(e.getMessage()).contains("INVALID_CUSTOM_TOKEN");
    }

    @Test
    void grantAccessToken_returnsIdTokenAndRotatedRefreshToken() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"id_token":"jwt-access","refresh_token":"rt-2","expires_in":"3600","token_type":"Bearer"}
                """));

        IdentityClient.TokenGrant grant = client.grantAccessToken("rt-1");

        assertThat(grant.accessToken()).isEqualTo("jwt-access");
        assertThat(grant.refreshToken()).isEqualTo("rt-2");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/proxy/token?key=test-key");
        assertThat(request.getBody().readUtf8()).isEqualTo("grant_type=refresh_token&refresh_token=rt-1");
    }

    @Test
    void grantAccessToken_tooManyRequests_carriesRetryAfterHeader() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "12")
                .setBody("{\"error\":\"rate_limit_exceeded\"}"));

        GrantFailedException e = catchThrowableOfType(() -> client.grantAccessToken("rt-1"), GrantFailedException.class);

        assertThat(e.isRateLimited()).isTrue();
        assertThat(e.retryAfterHint()).contains(Duration.ofSeconds(12));
    }

    @Test
    void grantAccessToken_rateLimitMessageWithoutHeader_usesDefaultRetryAfter() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":{\"message\":\"TOO_MANY_ATTEMPTS_TRY_LATER\"}}"));

        GrantFailedException e = catchThrowableOfType(() -> client.grantAccessToken("rt-1"), GrantFailedException.class);

        assertThat(e.isRateLimited()).isTrue();
        assertThat(e.retryAfterHint()).contains(Duration.ofSeconds(30));
    }

    @Test
    void grantAccessToken_rateLimitMessage_isRecognisedUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            server.enqueue(new MockResponse().setResponseCode(400)
                    .setBody("{\"error\":{\"message\":\"TOO_MANY_ATTEMPTS_TRY_LATER\"}}"));

            GrantFailedException e = catchThrowableOfType(() -> client.grantAccessToken("rt-1"), GrantFailedException.class);

            assertThat(e.isRateLimited()).isTrue();
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void grantAccessToken_invalidGrant_isNotRetryable() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":{\"message\":\"TOKEN_EXPIRED\"}}"));

        GrantFailedException e = catchThrowableOfType(() -> client.grantAccessToken("rt-1"), GrantFailedException.class);

        assertThat(e.isRateLimited()).isFalse();
        assertThat(e.isRetryable()).isFalse();
    }
}
