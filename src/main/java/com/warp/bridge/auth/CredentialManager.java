package com.warp.bridge.auth;

import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.CredentialPhaseException;
import com.warp.bridge.exception.CredentialUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 凭证生命周期管理
 * <p>
 * 管理 access token 的复用、刷新与重新获取：
 * - 剩余有效期大于 refresh buffer 时直接复用
 * - 否则用 refresh token 刷新，检测 refresh token 轮换并持久化
 * - 刷新失败回退到完整获取流程
 * - 同一时刻最多一个刷新/获取在执行，并发调用方等待并共享结果（失败也共享）
 */
@Service
public class CredentialManager {

    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    private final CredentialStore store;
    private final CredentialAcquirer acquirer;
    private final Clock clock;
    private final Duration refreshBuffer;
    private final ReentrantLock lock = new ReentrantLock();

    // 已完成的刷新/获取次数；排队期间若有一次尝试失败，等待者直接复用其异常
    private volatile long attempts;
    private CredentialUnavailableException lastFailure;

    // 预置的 refresh token，只在首次获取时尝试一次
    private String seedRefreshToken;

    public CredentialManager(CredentialStore store, CredentialAcquirer acquirer, AppProperties properties, Clock clock) {
        this.store = store;
        this.acquirer = acquirer;
        this.clock = clock;
        this.refreshBuffer = Duration.ofSeconds(properties.getCredentials().getRefreshBufferSeconds());
        String seed = properties.getCredentials().getRefreshToken();
        this.seedRefreshToken = seed == null || seed.isBlank() ? null : seed;
    }

    /**
     * 获取有效凭证
     *
     * @throws CredentialUnavailableException 刷新与重新获取均失败
     */
    public Credential acquire() {
        Optional<Credential> cached = store.get();
        if (cached.isPresent() && cached.get().isFreshFor(refreshBuffer, clock.instant())) {
            return cached.get();
        }

        long observed = attempts;
        lock.lock();
        try {
            // 双重检查：其他线程可能已刷新
            Credential current = store.get().orElse(null);
            if (current != null && current.isFreshFor(refreshBuffer, clock.instant())) {
                return current;
            }
            rethrowFailureSince(observed);
            return attempt(() -> refreshOrAcquire(current));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 后台主动刷新：即将在 buffer 内过期时刷新，尚无凭证时不做任何事
     */
    public void refreshIfExpiringWithin(Duration buffer) {
        Optional<Credential> cached = store.get();
        if (cached.isEmpty() || cached.get().isFreshFor(buffer, clock.instant())) {
            return;
        }
        lock.lock();
        try {
            Credential current = store.get().orElse(null);
            if (current != null && !current.isFreshFor(buffer, clock.instant())) {
                attempt(() -> refreshOrAcquire(current));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 上游拒绝了 stale（401/403）：刷新，失败则重新获取。
     * 若其他线程已经替换了凭证，直接返回新凭证
     */
    public Credential forceRefresh(Credential stale) {
        long observed = attempts;
        lock.lock();
        try {
            Credential current = store.get().orElse(null);
            if (current != null && !current.sameAccessToken(stale)) {
                return current;
            }
            rethrowFailureSince(observed);
            return attempt(() -> refreshOrAcquire(current));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 匿名额度耗尽：丢弃当前身份，重新获取新的匿名凭证
     */
    public Credential forceReacquire(Credential stale) {
        long observed = attempts;
        lock.lock();
        try {
            Credential current = store.get().orElse(null);
            if (current != null && !current.sameAccessToken(stale)) {
                return current;
            }
            rethrowFailureSince(observed);
            log.warn("当前匿名凭证额度耗尽，重新获取");
            store.clear();
            return attempt(this::acquireAndInstall);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Credential> current() {
        return store.get();
    }

    // 以下方法调用方必须持有 lock

    private Credential attempt(Supplier<Credential> action) {
        try {
            Credential credential = action.get();
            lastFailure = null;
            return credential;
        } catch (CredentialUnavailableException e) {
            lastFailure = e;
            throw e;
        } finally {
            attempts++;
        }
    }

    /**
     * 排队等锁期间已有一次尝试失败：共享该结果，不再重复走完整获取流程
     */
    private void rethrowFailureSince(long observed) {
        CredentialUnavailableException failure = lastFailure;
        if (attempts != observed && failure != null) {
            log.debug("复用并发获取的失败结果: {}", failure.getMessage());
            throw new CredentialUnavailableException(failure.getMessage(), failure);
        }
    }

    private Credential refreshOrAcquire(Credential current) {
        String refreshToken = current != null ? current.refreshToken() : takeSeedRefreshToken();
        if (refreshToken != null) {
            try {
                Credential refreshed = acquirer.redeem(refreshToken);
                if (!refreshToken.equals(refreshed.refreshToken())) {
                    log.info("refresh token 已轮换");
                }
                store.replace(refreshed);
                log.info("Token 刷新成功, 过期时间: {}", refreshed.expiresAt());
                return refreshed;
            } catch (CredentialPhaseException e) {
                log.warn("Token 刷新失败({}), 回退到完整获取流程: {}", e.phase(), e.getMessage());
            }
        }
        return acquireAndInstall();
    }

    private Credential acquireAndInstall() {
        try {
            Credential fresh = acquirer.acquire();
            store.replace(fresh);
            return fresh;
        } catch (CredentialPhaseException e) {
            log.error("凭证获取失败: phase={}, error={}", e.phase(), e.getMessage());
            throw new CredentialUnavailableException("无法获取上游凭证: " + e.getMessage(), e);
        }
    }

    private String takeSeedRefreshToken() {
        String seed = seedRefreshToken;
        seedRefreshToken = null;
        return seed;
    }
}
