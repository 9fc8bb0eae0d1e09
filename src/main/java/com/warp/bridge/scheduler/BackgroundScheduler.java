package com.warp.bridge.scheduler;

import com.warp.bridge.auth.CredentialManager;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.BridgeException;
import com.warp.bridge.usage.RequestKind;
import com.warp.bridge.usage.UsageTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 后台定时任务调度器
 * <p>
 * - 凭证主动刷新（较大的缓冲时间）
 * - 额度快照刷新
 */
@Component
public class BackgroundScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final CredentialManager credentialManager;
    private final UsageTracker usageTracker;
    private final Duration proactiveBuffer;

    public BackgroundScheduler(CredentialManager credentialManager, UsageTracker usageTracker,
                               AppProperties properties) {
        this.credentialManager = credentialManager;
        this.usageTracker = usageTracker;
        this.proactiveBuffer = Duration.ofSeconds(properties.getCredentials().getProactiveRefreshBufferSeconds());
    }

    /**
     * 凭证主动刷新（每分钟检查）
     */
    @Scheduled(fixedDelay = 60000, initialDelay = 30000)
    public void refreshCredential() {
        try {
            credentialManager.refreshIfExpiringWithin(proactiveBuffer);
        } catch (BridgeException e) {
            log.error("凭证主动刷新失败: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("凭证主动刷新任务异常", e);
        }
    }

    /**
     * 额度快照刷新（每 5 分钟）
     */
    @Scheduled(fixedDelay = 300000, initialDelay = 60000)
    public void refreshUsage() {
        if (credentialManager.current().isEmpty()) {
            return;
        }
        try {
            usageTracker.refresh();
            if (usageTracker.shouldThrottle(RequestKind.BACKGROUND)) {
                log.warn("请求额度已超过后台阈值，请注意用量");
            }
        } catch (RuntimeException e) {
            log.error("额度快照刷新任务异常", e);
        }
    }
}
