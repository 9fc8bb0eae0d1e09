package com.warp.bridge.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * 上游凭证
 * <p>
 * expiresAt / issuedAt 只从 access token 的 JWT 声明中解析，不接受外部传入
 */
public final class Credential {

    private final String accessToken;
    private final String refreshToken;
    private final Instant expiresAt;
    private final Instant issuedAt;

    private Credential(String accessToken, String refreshToken, JwtClaims claims) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = claims.expiresAt();
        this.issuedAt = claims.issuedAt();
    }

    /**
     * 由 token 对构建凭证
     *
     * @throws IllegalArgumentException access token 无法解析出 exp
     */
    public static Credential of(String accessToken, String refreshToken) {
        return new Credential(accessToken, refreshToken, JwtClaims.decode(accessToken));
    }

    public String accessToken() {
        return accessToken;
    }

    public String refreshToken() {
        return refreshToken;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Instant issuedAt() {
        return issuedAt;
    }

    /**
     * 剩余有效期是否大于 buffer
     */
    public boolean isFreshFor(Duration buffer, Instant now) {
        return Duration.between(now, expiresAt).compareTo(buffer) > 0;
    }

    public boolean sameAccessToken(Credential other) {
        return other != null && accessToken.equals(other.accessToken);
    }

    /**
     * 脱敏 token，只保留前8位
     */
    public String maskedAccessToken() {
        return accessToken.length() > 8 ? accessToken.substring(0, 8) + "***" : "***";
    }

    @Override
    public String toString() {
        return "Credential{accessToken=" + maskedAccessToken() + ", expiresAt=" + expiresAt + "}";
    }
}
