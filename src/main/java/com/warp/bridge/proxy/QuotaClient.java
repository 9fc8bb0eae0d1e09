package com.warp.bridge.proxy;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.UpstreamErrorException;
import com.warp.bridge.usage.UsageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Warp 请求额度查询（GraphQL GetRequestLimitInfo）
 */
@Component
public class QuotaClient {

    private static final Logger log = LoggerFactory.getLogger(QuotaClient.class);

    private static final String REQUEST_LIMIT_QUERY =
            "query GetRequestLimitInfo($requestContext: RequestContext!) {\n"
                    + "  user(requestContext: $requestContext) {\n"
                    + "    __typename\n"
                    + "    ... on UserOutput { user { requestLimitInfo {\n"
                    + "      isUnlimited nextRefreshTime requestLimit requestsUsedSinceLastRefresh\n"
                    + "    } } }\n"
                    + "    ... on UserFacingError { error { __typename message } }\n"
                    + "  }\n"
                    + "}\n";

    private final HttpClient httpClient;
    private final AppProperties.IdentityConfig config;
    private final Clock clock;

    public QuotaClient(HttpClient warpHttpClient, AppProperties properties, Clock clock) {
        this.httpClient = warpHttpClient;
        this.config = properties.getIdentity();
        this.clock = clock;
    }

    /**
     * 查询当前账号的请求额度
     *
     * @throws UpstreamErrorException 请求失败或响应无法解析
     */
    public UsageSnapshot fetch(String accessToken) {
        JSONObject body = JSONObject.of(
                "query", REQUEST_LIMIT_QUERY, //
                "variables", JSONObject.of("requestContext", JSONObject.of( //
                        "clientContext", JSONObject.of("version", config.getClientVersion()), //
                        "osContext", JSONObject.of( //
                                "category", config.getOsCategory(), //
                                "name", config.getOsName(), //
                                "version", config.getOsVersion()) //
                )), //
                "operationName", "GetRequestLimitInfo" //
        );

        URI uri;
        try {
            uri = URI.create(config.getGraphqlUrl() + "?op=GetRequestLimitInfo");
        } catch (IllegalArgumentException e) {
            throw new UpstreamErrorException("额度查询地址无效: " + config.getGraphqlUrl(), e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(15))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + accessToken)
                .header("x-warp-client-version", config.getClientVersion())
                .header("x-warp-os-category", config.getOsCategory())
                .header("x-warp-os-name", config.getOsName())
                .header("x-warp-os-version", config.getOsVersion())
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamErrorException("额度查询请求失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamErrorException("额度查询被中断", e);
        }

        if (response.statusCode() != 200) {
            log.warn("获取额度失败: status={}", response.statusCode());
            throw new UpstreamErrorException(response.statusCode(), response.body());
        }
        return parse(response.body());
    }

    UsageSnapshot parse(String body) {
        JSONObject json;
        try {
            json = JSONObject.parseObject(body);
        } catch (JSONException e) {
            log.warn("额度响应不是合法 JSON: {}", abbreviate(body));
            throw new UpstreamErrorException("额度响应无法解析: " + e.getMessage(), e);
        }
        JSONObject data = json != null ? json.getJSONObject("data") : null;
        JSONObject userResult = data != null ? data.getJSONObject("user") : null;
        if (userResult == null) {
            throw new UpstreamErrorException("额度响应缺少 user 字段");
        }
        if ("UserFacingError".equals(userResult.getString("__typename"))) {
            JSONObject error = userResult.getJSONObject("error");
            throw new UpstreamErrorException("额度查询被拒绝: " + (error != null ? error.getString("message") : "unknown"));
        }
        JSONObject user = userResult.getJSONObject("user");
        JSONObject info = user != null ? user.getJSONObject("requestLimitInfo") : null;
        if (info == null) {
            throw new UpstreamErrorException("额度响应缺少 requestLimitInfo");
        }

        return new UsageSnapshot(
                info.getLongValue("requestLimit"),
                info.getLongValue("requestsUsedSinceLastRefresh"),
                parseInstant(info.getString("nextRefreshTime")),
                info.getBooleanValue("isUnlimited"),
                clock.instant(),
                false
        );
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("无法解析额度重置时间: {}", value);
            return null;
        }
    }
}
