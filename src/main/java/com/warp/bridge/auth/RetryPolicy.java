package com.warp.bridge.auth;

import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.CredentialPhaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 重试策略：最大次数 + 指数退避 + 可重试判定
 * <p>
 * 统一应用在凭证获取的每个阶段边界上。上游给出 retry-after 时等待
 * max(退避, retry-after)；retry-after 超过 maxBackoff 则直接放弃
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Predicate<RuntimeException> retryable;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff,
                       Predicate<RuntimeException> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须 >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.retryable = retryable;
    }

    /**
     * 默认策略：仅重试标记为可重试的阶段异常
     */
    public static RetryPolicy from(AppProperties.RetryConfig config) {
        return new RetryPolicy(
                config.getMaxAttempts(),
                Duration.ofMillis(config.getInitialBackoffMs()),
                config.getMultiplier(),
                Duration.ofMillis(config.getMaxBackoffMs()),
                RetryPolicy::isRetryablePhaseFailure
        );
    }

    public static boolean isRetryablePhaseFailure(RuntimeException e) {
        return e instanceof CredentialPhaseException phase && phase.isRetryable();
    }

    /**
     * 执行操作，失败时按策略重试
     *
     * @param operation 操作名，用于日志
     * @param action    实际操作
     * @return 操作结果
     */
    public <T> T execute(String operation, Supplier<T> action) {
        for (int attempt = 0; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (attempt + 1 >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = delayFor(attempt, e);
                if (delay.compareTo(maxBackoff) > 0) {
                    log.warn("{} 要求等待 {}ms，超过最大退避 {}ms，放弃重试", operation, delay.toMillis(), maxBackoff.toMillis());
                    throw e;
                }
                log.warn("{} 失败({}), 第{}次重试, 等待{}ms", operation, e.getMessage(), attempt + 1, delay.toMillis());
                if (!sleep(delay)) {
                    throw e;
                }
            }
        }
    }

    /**
     * 计算第 attempt 次失败后的退避时间
     */
    public Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private Duration delayFor(int attempt, RuntimeException e) {
        Duration delay = backoff(attempt);
        if (e instanceof CredentialPhaseException phase) {
            Duration hint = phase.getRetryAfter();
            if (hint != null && hint.compareTo(delay) > 0) {
                return hint;
            }
        }
        return delay;
    }

    /**
     * @return false 表示等待被中断
     */
    protected boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
