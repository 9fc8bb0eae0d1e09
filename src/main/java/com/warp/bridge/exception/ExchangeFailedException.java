package com.warp.bridge.exception;

/**
 * 阶段 2 失败：身份断言换取 refresh token
 */
public class ExchangeFailedException extends CredentialPhaseException {

    public ExchangeFailedException(String message, boolean retryable) {
        super(message, retryable, null, null);
    }

    public ExchangeFailedException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, null, cause);
    }

    @Override
    public String phase() {
        return "exchange-identity-assertion";
    }
}
