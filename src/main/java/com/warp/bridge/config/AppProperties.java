package com.warp.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 应用配置属性绑定
 * <p>
 * 所有来自上游观测的阈值（额度、限流等）都放在配置里，不写死在代码中
 */
@Data
@Component
@ConfigurationProperties(prefix = "warp")
public class AppProperties {

    // 调用本网关时使用的 API Key（为空则不校验）
    private String apiKey = "";
    private boolean requireApiKey = false;
    private ProxyConfig proxy = new ProxyConfig();
    private BridgeConfig bridge = new BridgeConfig();
    private IdentityConfig identity = new IdentityConfig();
    private CredentialsConfig credentials = new CredentialsConfig();
    private RetryConfig retry = new RetryConfig();
    private ModelsConfig models = new ModelsConfig();
    private StreamConfig stream = new StreamConfig();
    private UsageConfig usage = new UsageConfig();
    private SessionConfig session = new SessionConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
        // 逗号分隔，本机与回环地址始终直连
        private String noProxy = "";
    }

    /**
     * protobuf 编解码桥（负责把 JSON 包编码为上游二进制格式）
     */
    @Data
    public static class BridgeConfig {
        private String baseUrl = "http://127.0.0.1:28888";
        private String streamPath = "/api/warp/send_stream_sse";
        private String messageType = "warp.multi_agent.v1.Request";
        private String apiKey = "";
    }

    @Data
    public static class IdentityConfig {
        private String graphqlUrl = "https://app.warp.dev/graphql/v2";
        private String identityToolkitUrl = "https://identitytoolkit.googleapis.com/v1/accounts:signInWithCustomToken";
        private String tokenUrl = "https://app.warp.dev/proxy/token";
        private String firebaseApiKey = "";
        private String clientVersion = "v0.2025.08.06.08.12.stable_02";
        private String osCategory = "Windows";
        private String osName = "Windows";
        private String osVersion = "11 (26100)";
        private String referralCode = "";
        // 429 响应未携带 Retry-After 时使用
        private long defaultRetryAfterSeconds = 30;
    }

    @Data
    public static class CredentialsConfig {
        // 调用时检查：剩余有效期小于该值即刷新
        private long refreshBufferSeconds = 120;
        // 后台主动刷新使用更大的缓冲
        private long proactiveRefreshBufferSeconds = 600;
        // 预置的 refresh token（可选）
        private String refreshToken = "";
        // 凭证持久化文件（可选）
        private String cacheFile = "";
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double multiplier = 2.0;
        private long maxBackoffMs = 30000;
    }

    @Data
    public static class ModelsConfig {
        private String defaultBase = "claude-4.1-opus";
        private String defaultPlanning = "o3";
        private String defaultCoding = "auto";
        private List<String> available = new ArrayList<>(List.of(
                "auto",
                "claude-4-sonnet",
                "claude-4-opus",
                "claude-4.1-opus",
                "gpt-5",
                "gpt-4o",
                "gpt-4.1",
                "o3",
                "o4-mini",
                "gemini-2.5-pro"
        ));
        private List<MappingRule> mappings = new ArrayList<>();
    }

    @Data
    public static class MappingRule {
        private String pattern;
        private String target;
        // exact / prefix / contains / regex
        private String matchType = "contains";
        private int priority = 0;
    }

    @Data
    public static class StreamConfig {
        private long idleTimeoutSeconds = 60;
        private long requestDeadlineSeconds = 300;
    }

    @Data
    public static class UsageConfig {
        private long staleAfterSeconds = 300;
        private double criticalThreshold = 0.95;
        private double backgroundThreshold = 0.80;
        // 是否在额度耗尽前拒绝请求（默认仅提示）
        private boolean enforce = false;
    }

    @Data
    public static class SessionConfig {
        private String header = "X-Session-Id";
        private String defaultKey = "default";
    }
}
