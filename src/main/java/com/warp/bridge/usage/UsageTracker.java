package com.warp.bridge.usage;

import com.warp.bridge.auth.CredentialManager;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.BridgeException;
import com.warp.bridge.proxy.QuotaClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 额度跟踪
 * <p>
 * 快照在 staleAfter 内直接使用缓存；刷新失败时保留上一次快照并标记 stale。
 * 从未拿到快照时不限流
 */
@Service
public class UsageTracker {

    private static final Logger log = LoggerFactory.getLogger(UsageTracker.class);

    private final QuotaClient quotaClient;
    private final CredentialManager credentialManager;
    private final Clock clock;
    private final Duration staleAfter;
    private final double criticalThreshold;
    private final double backgroundThreshold;

    private final AtomicReference<UsageSnapshot> cached = new AtomicReference<>();

    public UsageTracker(QuotaClient quotaClient, CredentialManager credentialManager,
                        AppProperties properties, Clock clock) {
        this.quotaClient = quotaClient;
        this.credentialManager = credentialManager;
        this.clock = clock;
        AppProperties.UsageConfig config = properties.getUsage();
        this.staleAfter = Duration.ofSeconds(config.getStaleAfterSeconds());
        this.criticalThreshold = config.getCriticalThreshold();
        this.backgroundThreshold = config.getBackgroundThreshold();
    }

    /**
     * 当前快照，必要时刷新
     *
     * @return 从未成功获取过时为空
     */
    public Optional<UsageSnapshot> snapshot() {
        UsageSnapshot current = cached.get();
        Instant now = clock.instant();
        if (current != null && !current.stale() && !current.windowExpired(now)
                && Duration.between(current.fetchedAt(), now).compareTo(staleAfter) < 0) {
            return Optional.of(current);
        }
        return Optional.ofNullable(refresh());
    }

    /**
     * 立即刷新
     *
     * @return 刷新失败时返回标记为 stale 的旧快照，没有旧快照时为 null
     */
    public UsageSnapshot refresh() {
        try {
            String accessToken = credentialManager.acquire().accessToken();
            UsageSnapshot fresh = quotaClient.fetch(accessToken);
            UsageSnapshot installed = cached.updateAndGet(old -> merge(old, fresh));
            log.debug("额度已刷新: used={}/{}, unlimited={}, resetsAt={}",
                    installed.windowUsed(), installed.windowLimit(), installed.unlimited(), installed.resetsAt());
            return installed;
        } catch (BridgeException e) {
            log.warn("额度刷新失败，沿用旧快照: {}", e.getMessage());
            return cached.updateAndGet(old -> old != null ? old.markStale() : null);
        } catch (RuntimeException e) {
            // 额度只用于限流判断，任何刷新异常都不能影响对话请求
            log.error("额度刷新异常，沿用旧快照", e);
            return cached.updateAndGet(old -> old != null ? old.markStale() : null);
        }
    }

    /**
     * 是否应限流：不限量或没有快照时为 false
     */
    public boolean shouldThrottle(RequestKind kind) {
        Optional<UsageSnapshot> snapshot = snapshot();
        if (snapshot.isEmpty() || snapshot.get().unlimited() || snapshot.get().windowLimit() <= 0) {
            return false;
        }
        double threshold = kind == RequestKind.BACKGROUND ? backgroundThreshold : criticalThreshold;
        return snapshot.get().usageRatio() > threshold;
    }

    /**
     * 一次成功请求后本地累加
     */
    public void recordRequest() {
        cached.updateAndGet(old -> old != null ? old.withUsed(old.windowUsed() + 1) : null);
    }

    /**
     * 上游报告额度耗尽
     */
    public void markExhausted() {
        cached.updateAndGet(old -> old != null && !old.unlimited() ? old.withUsed(old.windowLimit()) : old);
    }

    /**
     * 不触发刷新，只读缓存
     */
    public Optional<UsageSnapshot> cachedSnapshot() {
        return Optional.ofNullable(cached.get());
    }

    /**
     * 同一窗口内已用数不回退；窗口已重置时以新值为准
     */
    private UsageSnapshot merge(UsageSnapshot old, UsageSnapshot fresh) {
        if (old == null || old.resetsAt() == null || fresh.resetsAt() == null
                || !old.resetsAt().equals(fresh.resetsAt())) {
            return fresh;
        }
        return fresh.withUsed(old.windowUsed());
    }
}
