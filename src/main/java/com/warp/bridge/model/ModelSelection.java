package com.warp.bridge.model;

/**
 * 上游 model_config：base 用于主对话，planning 与 coding 用于子任务
 */
public record ModelSelection(String base, String planning, String coding) {}
