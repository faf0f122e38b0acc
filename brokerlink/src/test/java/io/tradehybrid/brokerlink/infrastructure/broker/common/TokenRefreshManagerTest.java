package io.tradehybrid.brokerlink.infrastructure.broker.common;

import io.tradehybrid.brokerlink.infrastructure.broker.common.TokenRefreshManager.TokenInfo;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerAuthenticationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenRefreshManager.
 *
 * Tests:
 * - Token reads after start
 * - Missing and expired token detection
 * - Scheduled renewal before expiry
 * - Retry after a failed renewal
 * - Forced renewal
 * - Shutdown
 */
class TokenRefreshManagerTest {

    private ScheduledExecutorService scheduler;
    private TokenRefreshManager manager;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown();
        }
        scheduler.shutdownNow();
    }

    @Test
    void testTokenAvailableAfterStart() {
        TokenInfo token = new TokenInfo("access_token_123", Instant.now().plus(Duration.ofHours(1)));
        manager = new TokenRefreshManager("TRADOVATE", () -> token,
            Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler);

        manager.start(token);

        assertTrue(manager.isRunning());
        assertTrue(manager.hasValidToken(), "Should have valid token after start");
        assertEquals("access_token_123", manager.getToken());
        assertEquals(token, manager.getTokenInfo());
    }

    @Test
    void testStartRejectsNullToken() {
        manager = new TokenRefreshManager("TRADOVATE", () -> null,
            Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler);

        assertThrows(IllegalArgumentException.class, () -> manager.start(null));
        assertFalse(manager.isRunning());
    }

    @Test
    void testGetTokenWhenNoToken() {
        manager = new TokenRefreshManager("TRADOVATE", () -> null,
            Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler);

        BrokerAuthenticationException exception = assertThrows(BrokerAuthenticationException.class,
            () -> manager.getToken());

        assertTrue(exception.getMessage().contains("No token available"));
        assertEquals("TRADOVATE", exception.getBrokerCode());
    }

    @Test
    void testGetTokenWhenExpired() {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        TokenInfo expired = new TokenInfo("expired_token", now.minus(Duration.ofMinutes(10)));

        manager = new TokenRefreshManager("TRADOVATE", () -> expired,
            Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler, clock);
        manager.start(expired);

        BrokerAuthenticationException exception = assertThrows(BrokerAuthenticationException.class,
            () -> manager.getToken());

        assertTrue(exception.getMessage().contains("Token expired at"), exception.getMessage());
        assertFalse(manager.hasValidToken());
    }

    @Test
    void testScheduledRefreshBeforeExpiry() throws InterruptedException {
        CountDownLatch refreshed = new CountDownLatch(1);
        manager = new TokenRefreshManager("TRADOVATE", () -> {
            refreshed.countDown();
            return new TokenInfo("token_2", Instant.now().plus(Duration.ofHours(1)));
        }, Duration.ofSeconds(1), Duration.ofSeconds(30), scheduler);

        // Refresh due 1s before expiry, clamped to the minimum delay
        manager.start(new TokenInfo("token_1", Instant.now().plus(Duration.ofMillis(1500))));

        assertTrue(refreshed.await(5, TimeUnit.SECONDS), "Scheduled refresh should have occurred");
        waitForToken("token_2");
        assertEquals("token_2", manager.getToken());
    }

    @Test
    void testRefreshRetryAfterFailure() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch retried = new CountDownLatch(2);

        manager = new TokenRefreshManager("TRADOVATE", () -> {
            int attempt = attempts.incrementAndGet();
            retried.countDown();
            if (attempt == 1) {
                throw new IllegalStateException("Renewal endpoint down");
            }
            return new TokenInfo("token_retry", Instant.now().plus(Duration.ofHours(1)));
        }, Duration.ofMinutes(5), Duration.ofMillis(200), scheduler);

        manager.start(new TokenInfo("token_1", Instant.now().plus(Duration.ofSeconds(30))));

        assertTrue(retried.await(5, TimeUnit.SECONDS), "Failed renewal should be retried");
        waitForToken("token_retry");
        assertEquals("token_retry", manager.getToken());
        assertEquals(2, attempts.get());
    }

    @Test
    void testForceRefresh() {
        AtomicInteger calls = new AtomicInteger();
        manager = new TokenRefreshManager("TRADOVATE",
            () -> new TokenInfo("forced_" + calls.incrementAndGet(), Instant.now().plus(Duration.ofHours(1))),
            Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler);
        manager.start(new TokenInfo("token_1", Instant.now().plus(Duration.ofHours(1))));

        manager.forceRefresh();

        assertEquals("forced_1", manager.getToken());
        assertEquals(1, calls.get());
    }

    @Test
    void testForceRefreshFailure() {
        manager = new TokenRefreshManager("TRADOVATE",
            () -> { throw new IllegalStateException("Renewal rejected"); },
            Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler);
        TokenInfo initial = new TokenInfo("token_1", Instant.now().plus(Duration.ofHours(1)));
        manager.start(initial);

        BrokerAuthenticationException exception = assertThrows(BrokerAuthenticationException.class,
            () -> manager.forceRefresh());

        assertTrue(exception.getMessage().contains("Forced token refresh failed"));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertEquals("token_1", manager.getToken(), "Old token should be kept after a failed renewal");
    }

    @Test
    void testShutdownClearsToken() {
        TokenInfo token = new TokenInfo("valid_token", Instant.now().plus(Duration.ofHours(1)));
        manager = new TokenRefreshManager("TRADOVATE", () -> token,
            Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler);

        assertFalse(manager.hasValidToken(), "Should not have token before start");
        manager.start(token);
        assertTrue(manager.hasValidToken());

        manager.shutdown();

        assertFalse(manager.isRunning());
        assertFalse(manager.hasValidToken(), "Should not have token after shutdown");
        assertNull(manager.getTokenInfo());
        assertFalse(scheduler.isShutdown(), "Scheduler belongs to the caller");
    }

    private void waitForToken(String expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            TokenInfo info = manager.getTokenInfo();
            if (info != null && expected.equals(info.accessToken())) {
                return;
            }
            Thread.sleep(20);
        }
    }
}
