package com.warp.bridge.exception;

import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 * <p>
 * 统一输出 OpenAI 风格的错误体 {"error":{"type","message"}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CredentialUnavailableException.class)
    public ResponseEntity<String> handleCredential(CredentialUnavailableException e) {
        log.error("无可用上游凭证: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), e.errorType(), e.getMessage());
    }

    @ExceptionHandler(UpstreamErrorException.class)
    public ResponseEntity<String> handleUpstream(UpstreamErrorException e) {
        log.error("上游异常: status={}, message={}", e.getUpstreamStatus(), e.getMessage());
        return buildErrorResponse(e.getStatusCode(), e.errorType(), e.getMessage());
    }

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<String> handleBridge(BridgeException e) {
        if (e.getStatusCode() >= 500) {
            log.error("请求处理失败: {}", e.getMessage(), e);
        } else {
            log.warn("请求无效: {}", e.getMessage());
        }
        return buildErrorResponse(e.getStatusCode(), e.errorType(), e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        if (statusCode == 404) {
            log.warn("路由未找到: {}", e.getReason());
            return buildErrorResponse(statusCode, "not_found_error", e.getReason());
        }
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        return buildErrorResponse(statusCode, "invalid_request_error", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "internal_error", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message) {
        JSONObject body = JSONObject.of(
                "error", JSONObject.of( //
                        "type", errorType, //
                        "message", message //
                ) //
        );
        return ResponseEntity
                .status(statusCode)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
