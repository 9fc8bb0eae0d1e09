package com.warp.bridge.exception;

/**
 * 额度接近上限且启用了强制限流
 */
public class QuotaExceededException extends BridgeException {

    public QuotaExceededException(String message) {
        super(message, 429);
    }

    @Override
    public String errorType() {
        return "rate_limit_error";
    }
}
