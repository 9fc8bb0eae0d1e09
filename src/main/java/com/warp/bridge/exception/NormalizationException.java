package com.warp.bridge.exception;

/**
 * 输入会话无效（例如没有任何用户内容）
 */
public class NormalizationException extends BridgeException {

    public NormalizationException(String message) {
        super(message, 400);
    }

    @Override
    public String errorType() {
        return "invalid_request_error";
    }
}
