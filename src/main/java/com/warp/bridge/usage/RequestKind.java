package com.warp.bridge.usage;

/**
 * 请求类型，对应不同的限流阈值
 */
public enum RequestKind {
    // 客户端交互请求
    INTERACTIVE,
    // 后台任务
    BACKGROUND
}
