package com.warp.bridge.auth;

/**
 * 上游身份服务接口
 * <p>
 * 三个阶段依次调用，每个阶段依赖上一阶段的结果；grantAccessToken 同时用于刷新
 */
public interface IdentityClient {

    /**
     * 阶段 1：创建匿名用户，返回短期身份断言
     *
     * @throws com.warp.bridge.exception.AcquireFailedException 上游返回面向用户的错误或传输失败
     */
    String createAnonymousUser();

    /**
     * 阶段 2：用身份断言换取 refresh token
     *
     * @throws com.warp.bridge.exception.ExchangeFailedException 断言无效或过期
     */
    String exchangeIdentityAssertion(String identityAssertion);

    /**
     * 阶段 3：用 refresh token 换取 access token
     *
     * @throws com.warp.bridge.exception.GrantFailedException invalid_grant 或限流
     */
    TokenGrant grantAccessToken(String refreshToken);

    /**
     * 授权结果
     *
     * @param accessToken  新的访问令牌（JWT）
     * @param refreshToken 新的刷新令牌（轮换时与旧值不同）
     */
    record TokenGrant(String accessToken, String refreshToken) {}
}
