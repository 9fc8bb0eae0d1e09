package com.warp.bridge.usage;

import java.time.Instant;

/**
 * 额度快照
 *
 * @param windowLimit 当前窗口的请求上限
 * @param windowUsed  当前窗口已用请求数，窗口内单调不减
 * @param resetsAt    窗口重置时间，未知时为 null
 * @param unlimited   是否不限量
 * @param fetchedAt   拉取时间
 * @param stale       最近一次刷新失败，内容可能过期
 */
public record UsageSnapshot(long windowLimit,
                            long windowUsed,
                            Instant resetsAt,
                            boolean unlimited,
                            Instant fetchedAt,
                            boolean stale) {

    public double usageRatio() {
        if (unlimited || windowLimit <= 0) {
            return 0.0;
        }
        return (double) windowUsed / windowLimit;
    }

    public long remaining() {
        return unlimited ? Long.MAX_VALUE : Math.max(0, windowLimit - windowUsed);
    }

    public boolean windowExpired(Instant now) {
        return resetsAt != null && !now.isBefore(resetsAt);
    }

    /**
     * 已用数只增不减
     */
    public UsageSnapshot withUsed(long used) {
        return new UsageSnapshot(windowLimit, Math.max(windowUsed, used), resetsAt, unlimited, fetchedAt, stale);
    }

    public UsageSnapshot markStale() {
        return stale ? this : new UsageSnapshot(windowLimit, windowUsed, resetsAt, unlimited, fetchedAt, true);
    }
}
