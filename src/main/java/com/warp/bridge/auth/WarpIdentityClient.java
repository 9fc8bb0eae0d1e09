package com.warp.bridge.auth;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.AcquireFailedException;
import com.warp.bridge.exception.ExchangeFailedException;
import com.warp.bridge.exception.GrantFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Warp 匿名身份客户端
 * <p>
 * 阶段 1 调用 Warp GraphQL 的 CreateAnonymousUser，阶段 2 通过身份服务的
 * signInWithCustomToken 换取 refresh token，阶段 3 调用 token 端点换取 access token
 */
@Component
public class WarpIdentityClient implements IdentityClient {

    private static final Logger log = LoggerFactory.getLogger(WarpIdentityClient.class);

    private static final String CREATE_ANONYMOUS_USER_MUTATION =
            "mutation CreateAnonymousUser($input: CreateAnonymousUserInput!, $requestContext: RequestContext!) {\n"
                    + "  createAnonymousUser(input: $input, requestContext: $requestContext) {\n"
                    + "    __typename\n"
                    + "    ... on CreateAnonymousUserOutput { expiresAt anonymousUserType firebaseUid idToken isInviteValid }\n"
                    + "    ... on UserFacingError { error { __typename message } }\n"
                    + "  }\n"
                    + "}\n";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final AppProperties.IdentityConfig config;

    public WarpIdentityClient(HttpClient warpHttpClient, AppProperties properties) {
        this.httpClient = warpHttpClient;
        this.config = properties.getIdentity();
    }

    @Override
    public String createAnonymousUser() {
        JSONObject variables = JSONObject.of(
                "input", JSONObject.of( //
                        "anonymousUserType", "NATIVE_CLIENT_ANONYMOUS_USER_FEATURE_GATED", //
                        "expirationType", "NO_EXPIRATION", //
                        "referralCode", emptyToNull(config.getReferralCode()) //
                ), //
                "requestContext", requestContext() //
        );
        JSONObject body = JSONObject.of(
                "query", CREATE_ANONYMOUS_USER_MUTATION, //
                "variables", variables, //
                "operationName", "CreateAnonymousUser" //
        );

        HttpRequest request = warpRequestBuilder(config.getGraphqlUrl() + "?op=CreateAnonymousUser")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AcquireFailedException("创建匿名用户请求失败: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquireFailedException("创建匿名用户请求被中断", false, e);
        }

        int status = response.statusCode();
        if (status != 200) {
            log.error("创建匿名用户失败: status={}, body={}", status, abbreviate(response.body()));
            throw new AcquireFailedException("创建匿名用户失败: " + status, isTransient(status));
        }

        JSONObject json = parseJson(response.body());
        if (json == null) {
            throw new AcquireFailedException("创建匿名用户响应无法解析", false);
        }
        JSONArray errors = json.getJSONArray("errors");
        if (errors != null && !errors.isEmpty()) {
            String message = errors.getJSONObject(0).getString("message");
            throw new AcquireFailedException("创建匿名用户返回错误: " + message, false);
        }

        JSONObject data = json.getJSONObject("data");
        JSONObject result = data != null ? data.getJSONObject("createAnonymousUser") : null;
        if (result == null) {
            throw new AcquireFailedException("创建匿名用户响应缺少 createAnonymousUser", false);
        }
        if ("UserFacingError".equals(result.getString("__typename"))) {
            JSONObject error = result.getJSONObject("error");
            String message = error != null ? error.getString("message") : "unknown";
            throw new AcquireFailedException("创建匿名用户被拒绝: " + message, false);
        }

        String idToken = result.getString("idToken");
        if (idToken == null || idToken.isEmpty()) {
            throw new AcquireFailedException("创建匿名用户未返回 idToken", false);
        }
        log.debug("匿名用户创建成功: firebaseUid={}", result.getString("firebaseUid"));
        return idToken;
    }

    @Override
    public String exchangeIdentityAssertion(String identityAssertion) {
        JSONObject body = JSONObject.of(
                "token", identityAssertion, //
                "returnSecureToken", true //
        );
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(withApiKey(config.getIdentityToolkitUrl())))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExchangeFailedException("身份断言交换请求失败: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeFailedException("身份断言交换请求被中断", false, e);
        }

        int status = response.statusCode();
        if (status != 200) {
            String message = errorMessage(response.body());
            log.error("身份断言交换失败: status={}, error={}", status, message);
            throw new ExchangeFailedException("身份断言交换失败: " + status + " " + message, isTransient(status));
        }

        JSONObject json = parseJson(response.body());
        String refreshToken = json != null ? json.getString("refreshToken") : null;
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw new ExchangeFailedException("身份断言交换未返回 refreshToken", false);
        }
        return refreshToken;
    }

    @Override
    public TokenGrant grantAccessToken(String refreshToken) {
        String form = "grant_type=refresh_token&refresh_token="
                + URLEncoder.encode(refreshToken, StandardCharsets.UTF_8);
        HttpRequest request = warpRequestBuilder(withApiKey(config.getTokenUrl()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw GrantFailedException.transport("access token 请求失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GrantFailedException.invalidGrant("access token 请求被中断");
        }

        int status = response.statusCode();
        String body = response.body();
        if (status != 200) {
            String message = errorMessage(body);
            log.error("access token 换取失败: status={}, error={}", status, message);
            if (status == 429 || isRateLimitMessage(message)) {
                Duration retryAfter = retryAfter(response);
                throw GrantFailedException.rateLimited("access token 换取被限流: " + message, retryAfter);
            }
            if (status >= 500) {
                throw GrantFailedException.transport("access token 换取失败: " + status + " " + message, null);
            }
            throw GrantFailedException.invalidGrant("access token 换取失败: " + status + " " + message);
        }

        JSONObject json = parseJson(body);
        if (json == null) {
            throw GrantFailedException.invalidGrant("access token 响应无法解析");
        }
        String accessToken = json.getString("id_token");
        if (accessToken == null || accessToken.isEmpty()) {
            accessToken = json.getString("access_token");
        }
        if (accessToken == null || accessToken.isEmpty()) {
            throw GrantFailedException.invalidGrant("token 端点未返回 access token");
        }
        return new TokenGrant(accessToken, json.getString("refresh_token"));
    }

    // ==================== 辅助方法 ====================

    private HttpRequest.Builder warpRequestBuilder(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("x-warp-client-version", config.getClientVersion())
                .header("x-warp-os-category", config.getOsCategory())
                .header("x-warp-os-name", config.getOsName())
                .header("x-warp-os-version", config.getOsVersion());
    }

    private JSONObject requestContext() {
        return JSONObject.of(
                "clientContext", JSONObject.of("version", config.getClientVersion()), //
                "osContext", JSONObject.of( //
                        "category", config.getOsCategory(), //
                        "name", config.getOsName(), //
                        "version", config.getOsVersion() //
                ) //
        );
    }

    private String withApiKey(String url) {
        String key = config.getFirebaseApiKey();
        if (key == null || key.isEmpty()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + "key=" + URLEncoder.encode(key, StandardCharsets.UTF_8);
    }

    private Duration retryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
                .flatMap(WarpIdentityClient::parseSeconds)
                .orElse(Duration.ofSeconds(config.getDefaultRetryAfterSeconds()));
    }

    private static java.util.Optional<Duration> parseSeconds(String value) {
        try {
            return java.util.Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            return java.util.Optional.empty();
        }
    }

    private static boolean isTransient(int status) {
        return status == 429 || status >= 500;
    }

    private static boolean isRateLimitMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("rate_limit_exceeded") || lower.contains("too_many_attempts");
    }

    /**
     * 提取错误信息，兼容 {"error":"..."} 与 {"error":{"message":"..."}}
     */
    private static String errorMessage(String body) {
        JSONObject json = parseJson(body);
        if (json == null) {
            return abbreviate(body);
        }
        Object error = json.get("error");
        if (error instanceof JSONObject obj) {
            String message = obj.getString("message");
            return message != null ? message : obj.toJSONString();
        }
        if (error != null) {
            String description = json.getString("error_description");
            return description != null ? error + ": " + description : error.toString();
        }
        return abbreviate(body);
    }

    private static JSONObject parseJson(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            return JSONObject.parseObject(body);
        } catch (JSONException e) {
            return null;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
