package com.warp.bridge.exception;

import java.time.Duration;

/**
 * 阶段 3 失败：refresh token 换取 access token
 * <p>
 * 限流时携带 retry-after，调用方重试前必须等待
 */
public class GrantFailedException extends CredentialPhaseException {

    private GrantFailedException(String message, boolean retryable, Duration retryAfter, Throwable cause) {
        super(message, retryable, retryAfter, cause);
    }

    public static GrantFailedException invalidGrant(String message) {
        return new GrantFailedException(message, false, null, null);
    }

    public static GrantFailedException rateLimited(String message, Duration retryAfter) {
        return new GrantFailedException(message, true, retryAfter, null);
    }

    public static GrantFailedException transport(String message, Throwable cause) {
        return new GrantFailedException(message, true, null, cause);
    }

    public boolean isRateLimited() {
        return getRetryAfter() != null;
    }

    @Override
    public String phase() {
        return "grant-access-token";
    }
}
