package com.warp.bridge.usage;

import com.warp.bridge.auth.Credential;
import com.warp.bridge.auth.CredentialManager;
import com.warp.bridge.auth.TestTokens;
import com.warp.bridge.config.AppProperties;
import com.warp.bridge.exception.UpstreamErrorException;
import com.warp.bridge.proxy.QuotaClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class UsageTrackerTest {

    private static final Instant NOW = Instant.parse("2025-08-10T12:00:00Z");
    private static final Instant RESET = Instant.parse("2025-08-17T00:00:00Z");

    private final AtomicReference<Instant> now = new AtomicReference<>(NOW);
    private final Clock clock = new Clock() {
        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    };

    private QuotaClient quotaClient;
    private UsageTracker tracker;

    @BeforeEach
    void setUp() {
        quotaClient = mock(QuotaClient.class);
        CredentialManager credentialManager = mock(CredentialManager.class);
        when(credentialManager.acquire())
                .thenReturn(Credential.of(TestTokens.jwt(NOW, NOW.plusSeconds(3600)), "rt"));

        AppProperties properties = new AppProperties();
        properties.getUsage().setStaleAfterSeconds(300);
        properties.getUsage().setCriticalThreshold(0.95);
        properties.getUsage().setBackgroundThreshold(0.80);
        tracker = new UsageTracker(quotaClient, credentialManager, properties, clock);
    }

    private UsageSnapshot snapshot(long limit, long used) {
        return new UsageSnapshot(limit, used, RESET, false, now.get(), false);
    }

    @Test
    void snapshot_withinStaleWindow_usesCache() {
        when(quotaClient.fetch(anyString())).thenReturn(snapshot(100, 10));

        tracker.snapshot();
        now.set(NOW.plusSeconds(60));
        tracker.snapshot();

        verify(quotaClient, times(1)).fetch(anyString());
    }

    @Test
    void snapshot_afterStaleWindow_refetches() {
        when(quotaClient.fetch(anyString())).thenReturn(snapshot(100, 10));

        tracker.snapshot();
        now.set(NOW.plusSeconds(301));
        tracker.snapshot();

        verify(quotaClient, times(2)).fetch(anyString());
    }

    @Test
    void refresh_failure_keepsPreviousSnapshotMarkedStale() {
        when(quotaClient.fetch(anyString()))
                .thenReturn(snapshot(100, 10))
                .thenThrow(new UpstreamErrorException("down"));

        tracker.refresh();
        UsageSnapshot afterFailure = tracker.refresh();

        assertNotNull(afterFailure);
        assertTrue(afterFailure.stale());
        assertEquals(10, afterFailure.windowUsed());
    }

    @Test
    void refresh_unexpectedException_keepsPreviousSnapshotAndDoesNotThrottle() {
        when(quotaClient.fetch(anyString()))
                .thenReturn(snapshot(100, 10))
                .thenThrow(new IllegalStateException("unexpected response"));

        tracker.refresh();
        now.set(NOW.plusSeconds(600));

        assertFalse(tracker.shouldThrottle(RequestKind.INTERACTIVE));
        UsageSnapshot kept = tracker.cachedSnapshot().orElseThrow();
        assertTrue(kept.stale());
        assertEquals(10, kept.windowUsed());
    }

    @Test
    void refresh_failureWithoutPreviousSnapshot_returnsNull() {
        when(quotaClient.fetch(anyString())).thenThrow(new UpstreamErrorException("down"));

        assertNull(tracker.refresh());
        assertFalse(tracker.shouldThrottle(RequestKind.INTERACTIVE));
    }

    @Test
    void windowUsed_neverDecreasesWithinSameWindow() {
        when(quotaClient.fetch(anyString()))
                .thenReturn(snapshot(100, 10))
                .thenReturn(snapshot(100, 4));

        tracker.refresh();
        tracker.recordRequest();
        UsageSnapshot second = tracker.refresh();

        assertEquals(11, second.windowUsed());
    }

    @Test
    void windowReset_acceptsLowerUsage() {
        when(quotaClient.fetch(anyString()))
                .thenReturn(snapshot(100, 90))
                .thenReturn(new UsageSnapshot(100, 0, RESET.plusSeconds(604800), false, NOW, false));

        tracker.refresh();
        assertEquals(0, tracker.refresh().windowUsed());
    }

    @Test
    void shouldThrottle_usesThresholdPerKind() {
        when(quotaClient.fetch(anyString())).thenReturn(snapshot(100, 85));

        assertTrue(tracker.shouldThrottle(RequestKind.BACKGROUND));
        assertFalse(tracker.shouldThrottle(RequestKind.INTERACTIVE));
    }

    @Test
    void shouldThrottle_unlimited_neverThrottles() {
        when(quotaClient.fetch(anyString())).thenReturn(new UsageSnapshot(0, 1000, null, true, NOW, false));

        assertFalse(tracker.shouldThrottle(RequestKind.BACKGROUND));
    }

    @Test
    void markExhausted_usesWholeWindow() {
        when(quotaClient.fetch(anyString())).thenReturn(snapshot(100, 10));
        tracker.refresh();

        tracker.markExhausted();

        assertEquals(100, tracker.cachedSnapshot().orElseThrow().windowUsed());
        assertTrue(tracker.shouldThrottle(RequestKind.INTERACTIVE));
    }
}
