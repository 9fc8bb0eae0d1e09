package com.warp.bridge.exception;

/**
 * 刷新与重新获取均失败，无可用凭证
 */
public class CredentialUnavailableException extends BridgeException {

    public CredentialUnavailableException(String message, Throwable cause) {
        super(message, 503, cause);
    }

    @Override
    public String errorType() {
        return "upstream_auth_error";
    }
}
