package com.warp.bridge.exception;

/**
 * 工具定义无效且请求离开工具无法继续
 */
public class InvalidToolSchemaException extends BridgeException {

    public InvalidToolSchemaException(String message) {
        super(message, 400);
    }

    @Override
    public String errorType() {
        return "invalid_request_error";
    }
}
