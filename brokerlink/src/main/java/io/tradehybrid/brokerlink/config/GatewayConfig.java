package io.tradehybrid.brokerlink.config;

import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.infrastructure.broker.common.ReconnectionPolicy;
import io.tradehybrid.brokerlink.util.Env;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration. Immutable; built from the environment at startup or through the builder in tests.
 */
public record GatewayConfig(
    Duration requestTimeout,          // Per HTTP request
    Duration connectTimeout,          // HTTP client and WebSocket connect
    Duration pollInterval,            // Quote polling for venues without a stream
    int schedulerThreads,             // Per adapter
    Duration reconnectInitialDelay,
    Duration reconnectMaxDelay,
    double reconnectMultiplier,
    int reconnectMaxAttempts,
    int orderHistoryLimit,
    Duration tokenRefreshWindow,      // Renew this long before expiry
    Duration tokenRetryDelay,
    Duration brokerConnectTimeout,    // Aggregator wait on connect()
    Duration maxQuoteAge,             // Execution router freshness bound
    List<String> binanceHistorySymbols,
    double paperStartingCash,
    Path connectionStorePath,
    int metricsPort,                  // 0 disables the /metrics endpoint
    Map<Venue, String> restBaseUrlOverrides,
    Map<Venue, String> streamBaseUrlOverrides
) {
    public GatewayConfig {
        binanceHistorySymbols = List.copyOf(binanceHistorySymbols);
        restBaseUrlOverrides = Map.copyOf(restBaseUrlOverrides);
        streamBaseUrlOverrides = Map.copyOf(streamBaseUrlOverrides);
    }

    /**
     * Build configuration from environment variables (system properties as fallback).
     */
    public static GatewayConfig fromEnv() {
        Builder b = builder()
            .requestTimeout(Duration.ofMillis(Env.getLong("BROKERLINK_REQUEST_TIMEOUT_MS", 10_000)))
            .connectTimeout(Duration.ofMillis(Env.getLong("BROKERLINK_CONNECT_TIMEOUT_MS", 5_000)))
            .pollInterval(Duration.ofMillis(Env.getLong("BROKERLINK_POLL_INTERVAL_MS", 1_000)))
            .schedulerThreads(Env.getInt("BROKERLINK_SCHEDULER_THREADS", 2))
            .reconnectInitialDelay(Duration.ofMillis(Env.getLong("BROKERLINK_RECONNECT_INITIAL_MS", 1_000)))
            .reconnectMaxDelay(Duration.ofMillis(Env.getLong("BROKERLINK_RECONNECT_MAX_MS", 30_000)))
            .reconnectMultiplier(Env.getDouble("BROKERLINK_RECONNECT_MULTIPLIER", 2.0))
            .reconnectMaxAttempts(Env.getInt("BROKERLINK_RECONNECT_MAX_ATTEMPTS", 5))
            .orderHistoryLimit(Env.getInt("BROKERLINK_ORDER_HISTORY_LIMIT", 50))
            .tokenRefreshWindow(Duration.ofSeconds(Env.getLong("BROKERLINK_TOKEN_REFRESH_WINDOW_S", 300)))
            .tokenRetryDelay(Duration.ofSeconds(Env.getLong("BROKERLINK_TOKEN_RETRY_DELAY_S", 30)))
            .brokerConnectTimeout(Duration.ofMillis(Env.getLong("BROKERLINK_BROKER_CONNECT_TIMEOUT_MS", 30_000)))
            .maxQuoteAge(Duration.ofMillis(Env.getLong("BROKERLINK_MAX_QUOTE_AGE_MS", 5_000)))
            .binanceHistorySymbols(Env.getList("BROKERLINK_BINANCE_HISTORY_SYMBOLS", DEFAULT_BINANCE_HISTORY_SYMBOLS))
            .paperStartingCash(Env.getDouble("BROKERLINK_PAPER_STARTING_CASH", 25_000))
            .connectionStorePath(Path.of(Env.get("BROKERLINK_CONNECTION_STORE", "./data/broker-connections.json")))
            .metricsPort(Env.getInt("BROKERLINK_METRICS_PORT", 9464));

        for (Venue venue : Venue.values()) {
            String rest = Env.get("BROKERLINK_" + venue.name() + "_BASE_URL", null);
            if (rest != null) {
                b.restBaseUrl(venue, rest);
            }
            String stream = Env.get("BROKERLINK_" + venue.name() + "_STREAM_URL", null);
            if (stream != null) {
                b.streamBaseUrl(venue, stream);
            }
        }
        return b.build();
    }

    public static GatewayConfig defaults() {
        return builder().build();
    }

    /**
     * Reject values that would make the gateway misbehave.
     *
     * @throws IllegalStateException on the first invalid value
     */
    public GatewayConfig validate() {
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(pollInterval, "pollInterval");
        requirePositive(reconnectInitialDelay, "reconnectInitialDelay");
        requirePositive(reconnectMaxDelay, "reconnectMaxDelay");
        requirePositive(tokenRefreshWindow, "tokenRefreshWindow");
        requirePositive(tokenRetryDelay, "tokenRetryDelay");
        requirePositive(brokerConnectTimeout, "brokerConnectTimeout");
        requirePositive(maxQuoteAge, "maxQuoteAge");
        if (schedulerThreads < 1) {
            throw new IllegalStateException("schedulerThreads must be at least 1, got " + schedulerThreads);
        }
        if (reconnectInitialDelay.compareTo(reconnectMaxDelay) > 0) {
            throw new IllegalStateException("reconnectInitialDelay cannot exceed reconnectMaxDelay");
        }
        if (reconnectMultiplier <= 1.0) {
            throw new IllegalStateException("reconnectMultiplier must be greater than 1.0");
        }
        if (reconnectMaxAttempts < 1) {
            throw new IllegalStateException("reconnectMaxAttempts must be at least 1");
        }
        if (orderHistoryLimit < 1 || orderHistoryLimit > 1000) {
            throw new IllegalStateException("orderHistoryLimit must be between 1 and 1000");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalStateException("metricsPort must be between 0 and 65535");
        }
        if (!(paperStartingCash >= 0)) {
            throw new IllegalStateException("paperStartingCash cannot be negative");
        }
        return this;
    }

    /**
     * New policy instance for one stream. Policies are stateful and never shared.
     */
    public ReconnectionPolicy newReconnectionPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectInitialDelay)
            .maxDelay(reconnectMaxDelay)
            .multiplier(reconnectMultiplier)
            .maxAttempts(reconnectMaxAttempts)
            .build();
    }

    /**
     * REST base URL for a venue, override first, then the live or sandbox default.
     */
    public String restBaseUrl(Venue venue, boolean sandbox) {
        String override = restBaseUrlOverrides.get(venue);
        if (override != null) {
            return trimSlash(override);
        }
        return switch (venue) {
            case ETRADE -> sandbox ? "https://apisb.etrade.com/v1" : "https://api.etrade.com/v1";
            case TRADOVATE -> sandbox ? "https://demo.tradovateapi.com/v1" : "https://live.tradovateapi.com/v1";
            case BINANCE -> sandbox ? "https://testnet.binance.vision" : "https://api.binance.com";
            case PAPER -> "paper://local";
        };
    }

    /**
     * WebSocket base URL for venues that push market data; null otherwise.
     */
    public String streamBaseUrl(Venue venue, boolean sandbox) {
        String override = streamBaseUrlOverrides.get(venue);
        if (override != null) {
            return trimSlash(override);
        }
        return switch (venue) {
            case BINANCE -> sandbox ? "wss://testnet.binance.vision/ws" : "wss://stream.binance.com:9443/ws";
            case ETRADE, TRADOVATE, PAPER -> null;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final List<String> DEFAULT_BINANCE_HISTORY_SYMBOLS =
        List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "DOGEUSDT");

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalStateException(name + " must be positive, got " + value);
        }
    }

    private static String trimSlash(String url) {
        return url.replaceAll("/+$", "");
    }

    /**
     * Builder with production defaults.
     */
    public static class Builder {
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofSeconds(1);
        private int schedulerThreads = 2;
        private Duration reconnectInitialDelay = Duration.ofSeconds(1);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private double reconnectMultiplier = 2.0;
        private int reconnectMaxAttempts = 5;
        private int orderHistoryLimit = 50;
        private Duration tokenRefreshWindow = Duration.ofMinutes(5);
        private Duration tokenRetryDelay = Duration.ofSeconds(30);
        private Duration brokerConnectTimeout = Duration.ofSeconds(30);
        private Duration maxQuoteAge = Duration.ofSeconds(5);
        private List<String> binanceHistorySymbols = DEFAULT_BINANCE_HISTORY_SYMBOLS;
        private double paperStartingCash = 25_000;
        private Path connectionStorePath = Path.of("./data/broker-connections.json");
        private int metricsPort = 0;
        private final Map<Venue, String> restBaseUrlOverrides = new EnumMap<>(Venue.class);
        private final Map<Venue, String> streamBaseUrlOverrides = new EnumMap<>(Venue.class);

        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder connectTimeout(Duration v) { this.connectTimeout = v; return this; }
        public Builder pollInterval(Duration v) { this.pollInterval = v; return this; }
        public Builder schedulerThreads(int v) { this.schedulerThreads = v; return this; }
        public Builder reconnectInitialDelay(Duration v) { this.reconnectInitialDelay = v; return this; }
        public Builder reconnectMaxDelay(Duration v) { this.reconnectMaxDelay = v; return this; }
        public Builder reconnectMultiplier(double v) { this.reconnectMultiplier = v; return this; }
        public Builder reconnectMaxAttempts(int v) { this.reconnectMaxAttempts = v; return this; }
        public Builder orderHistoryLimit(int v) { this.orderHistoryLimit = v; return this; }
        public Builder tokenRefreshWindow(Duration v) { this.tokenRefreshWindow = v; return this; }
        public Builder tokenRetryDelay(Duration v) { this.tokenRetryDelay = v; return this; }
        public Builder brokerConnectTimeout(Duration v) { this.brokerConnectTimeout = v; return this; }
        public Builder maxQuoteAge(Duration v) { this.maxQuoteAge = v; return this; }
        public Builder binanceHistorySymbols(List<String> v) { this.binanceHistorySymbols = v; return this; }
        public Builder paperStartingCash(double v) { this.paperStartingCash = v; return this; }
        public Builder connectionStorePath(Path v) { this.connectionStorePath = v; return this; }
        public Builder metricsPort(int v) { this.metricsPort = v; return this; }
        public Builder restBaseUrl(Venue venue, String url) { restBaseUrlOverrides.put(venue, url); return this; }
        public Builder streamBaseUrl(Venue venue, String url) { streamBaseUrlOverrides.put(venue, url); return this; }

        public GatewayConfig build() {
            return new GatewayConfig(requestTimeout, connectTimeout, pollInterval, schedulerThreads,
                reconnectInitialDelay, reconnectMaxDelay, reconnectMultiplier, reconnectMaxAttempts,
                orderHistoryLimit, tokenRefreshWindow, tokenRetryDelay, brokerConnectTimeout, maxQuoteAge,
                binanceHistorySymbols, paperStartingCash, connectionStorePath, metricsPort,
                restBaseUrlOverrides, streamBaseUrlOverrides);
        }
    }
}
