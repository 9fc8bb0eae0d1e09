package com.warp.bridge.exception;

import lombok.Getter;

/**
 * Warp Bridge 异常基类
 * <p>
 * statusCode 为返回给客户端的 HTTP 状态码，errorType 对应 OpenAI 错误体中的 type
 */
@Getter
public class BridgeException extends RuntimeException {

    private final int statusCode;

    public BridgeException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public BridgeException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    public BridgeException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public String errorType() {
        return "bridge_error";
    }
}
