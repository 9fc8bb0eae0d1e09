package com.warp.bridge.exception;

/**
 * 请求无法转换为上游格式（不支持的模型/字段组合）
 */
public class TranslationException extends BridgeException {

    public TranslationException(String message) {
        super(message, 400);
    }

    @Override
    public String errorType() {
        return "invalid_request_error";
    }
}
