package com.warp.bridge.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.Optional;

/**
 * 凭证获取阶段异常
 * <p>
 * 仅在凭证管理器内部传播，最终统一转换为 {@link CredentialUnavailableException}
 */
@Getter
public abstract class CredentialPhaseException extends BridgeException {

    private final boolean retryable;
    private final Duration retryAfter;

    protected CredentialPhaseException(String message, boolean retryable, Duration retryAfter, Throwable cause) {
        super(message, 502, cause);
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    /**
     * 阶段名称，用于日志
     */
    public abstract String phase();

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String errorType() {
        return "upstream_auth_error";
    }
}
