package com.warp.bridge.translator;

import java.time.Instant;
import java.util.UUID;

/**
 * server_message_data 解码后的内容，两个字段都可能缺省
 */
public record ServerMessageData(UUID uuid, Instant timestamp) {

    public static ServerMessageData now(UUID uuid) {
        return new ServerMessageData(uuid, Instant.now());
    }
}
