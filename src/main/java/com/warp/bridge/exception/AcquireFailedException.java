package com.warp.bridge.exception;

/**
 * 阶段 1 失败：创建匿名用户
 */
public class AcquireFailedException extends CredentialPhaseException {

    public AcquireFailedException(String message, boolean retryable) {
        super(message, retryable, null, null);
    }

    public AcquireFailedException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, null, cause);
    }

    @Override
    public String phase() {
        return "create-anonymous-user";
    }
}
