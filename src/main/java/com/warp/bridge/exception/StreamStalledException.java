package com.warp.bridge.exception;

/**
 * 上游事件流停滞（单事件空闲超时或整体截止时间到达）
 */
public class StreamStalledException extends BridgeException {

    public StreamStalledException(String message) {
        super(message, 504);
    }

    @Override
    public String errorType() {
        return "timeout_error";
    }
}
