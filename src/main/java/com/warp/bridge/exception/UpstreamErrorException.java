package com.warp.bridge.exception;

import lombok.Getter;

/**
 * 上游错误：HTTP 非 200 或流中的错误事件
 */
@Getter
public class UpstreamErrorException extends BridgeException {

    // 上游 HTTP 状态码，流内错误事件时为 0
    private final int upstreamStatus;
    private final String responseBody;

    public UpstreamErrorException(String message) {
        super(message, 502);
        this.upstreamStatus = 0;
        this.responseBody = null;
    }

    public UpstreamErrorException(String message, Throwable cause) {
        super(message, 502, cause);
        this.upstreamStatus = 0;
        this.responseBody = null;
    }

    public UpstreamErrorException(int upstreamStatus, String responseBody) {
        super("上游错误: " + upstreamStatus + " - " + responseBody, 502);
        this.upstreamStatus = upstreamStatus;
        this.responseBody = responseBody;
    }

    public boolean isAuthError() {
        return upstreamStatus == 401 || upstreamStatus == 403;
    }

    /**
     * 匿名账号额度耗尽（429 且响应体包含额度提示）
     */
    public boolean isQuotaExhausted() {
        return upstreamStatus == 429 && responseBody != null
                && (responseBody.contains("No remaining quota") || responseBody.contains("No AI requests remaining"));
    }

    @Override
    public String errorType() {
        return "api_error";
    }
}
