package com.warp.bridge.auth;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * JWT 声明解析（不校验签名，仅读取 exp / iat）
 *
 * @param expiresAt exp 声明
 * @param issuedAt  iat 声明，缺失时为 null
 */
public record JwtClaims(Instant expiresAt, Instant issuedAt) {

    /**
     * 解析 access token 中的声明
     *
     * @throws IllegalArgumentException token 不是 JWT 或缺少 exp
     */
    public static JwtClaims decode(String jwt) {
        if (jwt == null || jwt.isEmpty()) {
            throw new IllegalArgumentException("token 为空");
        }
        String[] parts = jwt.split("\\.");
        if (parts.length < 2) {
            throw new IllegalArgumentException("token 不是 JWT 格式");
        }

        JSONObject payload;
        try {
            byte[] decoded = Base64.getUrlDecoder().decode(pad(parts[1]));
            payload = JSONObject.parseObject(new String(decoded, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | JSONException e) {
            throw new IllegalArgumentException("JWT payload 解析失败: " + e.getMessage(), e);
        }
        if (payload == null || !payload.containsKey("exp")) {
            throw new IllegalArgumentException("JWT 缺少 exp 声明");
        }

        Instant exp = Instant.ofEpochSecond(payload.getLongValue("exp"));
        Instant iat = payload.containsKey("iat") ? Instant.ofEpochSecond(payload.getLongValue("iat")) : null;
        return new JwtClaims(exp, iat);
    }

    private static String pad(String segment) {
        int remainder = segment.length() % 4;
        return remainder == 0 ? segment : segment + "=".repeat(4 - remainder);
    }
}
