package io.tradehybrid.brokerlink.infrastructure.broker.common;

import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerAuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Keeps a bearer token valid by renewing it before expiry.
 *
 * Features:
 * - Renewal scheduled {@code refreshWindow} before expiry
 * - Retry after a failed renewal
 * - Thread-safe token reads
 *
 * Runs on the owning adapter's scheduler; {@link #shutdown()} cancels pending work but leaves
 * the scheduler to its owner.
 *
 * Usage:
 * <pre>
 * TokenRefreshManager manager = new TokenRefreshManager(
 *     "TRADOVATE", this::renewToken, Duration.ofMinutes(5), Duration.ofSeconds(30), scheduler);
 * manager.start(initialToken);
 * String token = manager.getToken();
 * manager.shutdown();
 * </pre>
 */
public class TokenRefreshManager {

    private static final Logger log = LoggerFactory.getLogger(TokenRefreshManager.class);

    private static final long MIN_DELAY_MILLIS = 1000;

    private final String brokerCode;
    private final Supplier<TokenInfo> tokenRefreshFunction;
    private final Duration refreshWindow;
    private final Duration retryDelay;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private volatile TokenInfo currentToken;
    private volatile ScheduledFuture<?> refreshTask;
    private volatile boolean running = false;

    public TokenRefreshManager(String brokerCode, Supplier<TokenInfo> tokenRefreshFunction,
                               Duration refreshWindow, Duration retryDelay,
                               ScheduledExecutorService scheduler) {
        this(brokerCode, tokenRefreshFunction, refreshWindow, retryDelay, scheduler, Clock.systemUTC());
    }

    TokenRefreshManager(String brokerCode, Supplier<TokenInfo> tokenRefreshFunction,
                        Duration refreshWindow, Duration retryDelay,
                        ScheduledExecutorService scheduler, Clock clock) {
        this.brokerCode = brokerCode;
        this.tokenRefreshFunction = tokenRefreshFunction;
        this.refreshWindow = refreshWindow;
        this.retryDelay = retryDelay;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Start with a token obtained from the login handshake and schedule its renewal.
     */
    public synchronized void start(TokenInfo initialToken) {
        if (initialToken == null) {
            throw new IllegalArgumentException("Initial token cannot be null");
        }
        if (running) {
            log.warn("[{}] Token refresh manager already running", brokerCode);
            return;
        }

        log.info("[{}] Starting token refresh manager, token expires at {}", brokerCode, initialToken.expiresAt());
        running = true;
        currentToken = initialToken;
        scheduleNextRefresh(initialToken);
    }

    /**
     * Cancel scheduled renewal and forget the token.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }

        log.info("[{}] Shutting down token refresh manager", brokerCode);
        running = false;

        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
        currentToken = null;
    }

    /**
     * Current valid access token.
     *
     * @throws BrokerAuthenticationException if there is no token or it has expired
     */
    public String getToken() {
        TokenInfo token = currentToken;
        if (token == null) {
            throw new BrokerAuthenticationException(brokerCode, "No token available");
        }
        if (isExpired(token)) {
            throw new BrokerAuthenticationException(brokerCode, "Token expired at " + token.expiresAt());
        }
        return token.accessToken();
    }

    public TokenInfo getTokenInfo() {
        return currentToken;
    }

    public boolean hasValidToken() {
        TokenInfo token = currentToken;
        return token != null && !isExpired(token);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Renew now, on the caller's thread.
     *
     * @throws BrokerAuthenticationException if renewal fails
     */
    public synchronized void forceRefresh() {
        log.info("[{}] Forcing token refresh", brokerCode);
        try {
            refreshToken();
        } catch (RuntimeException e) {
            throw new BrokerAuthenticationException(brokerCode, "Forced token refresh failed", e);
        }
    }

    private synchronized void refreshToken() {
        if (!running) {
            return;
        }
        log.debug("[{}] Refreshing token", brokerCode);

        try {
            TokenInfo newToken = tokenRefreshFunction.get();
            if (newToken == null) {
                throw new BrokerAuthenticationException(brokerCode, "Token refresh function returned null");
            }

            currentToken = newToken;
            log.info("[{}] Token refreshed successfully, expires at {}", brokerCode, newToken.expiresAt());
            scheduleNextRefresh(newToken);

        } catch (RuntimeException e) {
            log.error("[{}] Token refresh failed", brokerCode, e);
            scheduleRefreshRetry();
            throw e;
        }
    }

    private void scheduleNextRefresh(TokenInfo token) {
        if (!running) {
            return;
        }

        if (refreshTask != null) {
            refreshTask.cancel(false);
        }

        Instant refreshAt = token.expiresAt().minus(refreshWindow);
        long delayMillis = Math.max(Duration.between(clock.instant(), refreshAt).toMillis(), MIN_DELAY_MILLIS);

        log.debug("[{}] Scheduling next token refresh in {} seconds", brokerCode, delayMillis / 1000);
        refreshTask = scheduler.schedule(this::runScheduledRefresh, delayMillis, TimeUnit.MILLISECONDS);
    }

    private void scheduleRefreshRetry() {
        if (!running) {
            return;
        }

        log.info("[{}] Scheduling token refresh retry in {} seconds", brokerCode, retryDelay.toSeconds());
        refreshTask = scheduler.schedule(this::runScheduledRefresh, retryDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runScheduledRefresh() {
        try {
            refreshToken();
        } catch (RuntimeException e) {
            // Already logged, retry is scheduled
            log.debug("[{}] Scheduled token refresh did not complete: {}", brokerCode, e.getMessage());
        }
    }

    private boolean isExpired(TokenInfo token) {
        return clock.instant().isAfter(token.expiresAt());
    }

    /**
     * Token information record.
     */
    public record TokenInfo(
        String accessToken,
        Instant expiresAt
    ) {}
}
