package com.warp.bridge.auth;

import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.GrantFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 凭证获取器
 * <p>
 * 从零获取一对新凭证：创建匿名用户 → 换取 refresh token → 换取 access token。
 * 只返回结果，不写入 {@link CredentialStore}
 */
@Component
public class CredentialAcquirer {

    private static final Logger log = LoggerFactory.getLogger(CredentialAcquirer.class);

    private final IdentityClient identityClient;
    private final RetryPolicy retryPolicy;

    @Autowired
    public CredentialAcquirer(IdentityClient identityClient, AppProperties properties) {
        this(identityClient, RetryPolicy.from(properties.getRetry()));
    }

    public CredentialAcquirer(IdentityClient identityClient, RetryPolicy retryPolicy) {
        this.identityClient = identityClient;
        this.retryPolicy = retryPolicy;
    }

    /**
     * 完整获取流程
     */
    public Credential acquire() {
        log.info("开始获取匿名凭证");
        String assertion = retryPolicy.execute("创建匿名用户", identityClient::createAnonymousUser);
        String refreshToken = retryPolicy.execute("换取 refresh token",
                () -> identityClient.exchangeIdentityAssertion(assertion));
        Credential credential = redeem(refreshToken);
        log.info("匿名凭证获取成功, 过期时间: {}", credential.expiresAt());
        return credential;
    }

    /**
     * 用 refresh token 换取 access token（获取流程的阶段 3，也是刷新交换）
     */
    public Credential redeem(String refreshToken) {
        IdentityClient.TokenGrant grant = retryPolicy.execute("换取 access token",
                () -> identityClient.grantAccessToken(refreshToken));
        String newRefreshToken = grant.refreshToken() != null && !grant.refreshToken().isEmpty()
                ? grant.refreshToken()
                : refreshToken;
        try {
            return Credential.of(grant.accessToken(), newRefreshToken);
        } catch (IllegalArgumentException e) {
            throw GrantFailedException.invalidGrant("access token 无法解析: " + e.getMessage());
        }
    }
}
