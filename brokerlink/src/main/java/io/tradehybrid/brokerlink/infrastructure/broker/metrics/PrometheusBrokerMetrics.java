package io.tradehybrid.brokerlink.infrastructure.broker.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus implementation of BrokerMetrics.
 *
 * Key Metrics:
 * - broker_orders_total{broker, status}
 * - broker_order_latency_seconds{broker}
 * - broker_authentications_total{broker, status}
 * - broker_requests_total{broker, operation, outcome}
 * - broker_request_latency_seconds{broker, operation}
 * - broker_connection_events_total{broker, event}
 * - broker_market_data_ticks_total{broker}
 * - broker_poll_failures_total{broker}
 * - broker_stream_reconnects_total{broker, status}
 * - broker_active_subscriptions{broker}
 *
 * Usage:
 * <pre>
 * PrometheusBrokerMetrics metrics = new PrometheusBrokerMetrics();
 * BrokerAdapterFactory factory = new BrokerAdapterFactory(config, metrics);
 * </pre>
 */
public class PrometheusBrokerMetrics implements BrokerMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusBrokerMetrics.class);

    private final CollectorRegistry registry;

    // Order metrics
    private final Counter orderCounter;
    private final Histogram orderLatency;

    // Authentication metrics
    private final Counter authCounter;
    private final Histogram authLatency;

    // Request metrics
    private final Counter requestCounter;
    private final Histogram requestLatency;

    // Connection metrics
    private final Counter connectionEventCounter;
    private final Gauge connectionStatus;

    // Market data metrics
    private final Counter tickCounter;
    private final Counter pollFailureCounter;
    private final Counter streamReconnectCounter;
    private final Gauge activeSubscriptions;

    // In-memory state for aggregations
    private final Map<String, MetricsState> stateMap = new ConcurrentHashMap<>();

    public PrometheusBrokerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusBrokerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.orderCounter = Counter.build()
            .name("broker_orders_total")
            .help("Total number of orders placed")
            .labelNames("broker", "status")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("broker_order_latency_seconds")
            .help("Order placement latency in seconds")
            .labelNames("broker")
            .buckets(0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.authCounter = Counter.build()
            .name("broker_authentications_total")
            .help("Total number of authentication attempts")
            .labelNames("broker", "status")
            .register(registry);

        this.authLatency = Histogram.build()
            .name("broker_authentication_latency_seconds")
            .help("Authentication latency in seconds")
            .labelNames("broker")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.requestCounter = Counter.build()
            .name("broker_requests_total")
            .help("Total number of venue requests")
            .labelNames("broker", "operation", "outcome")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("broker_request_latency_seconds")
            .help("Venue request latency in seconds")
            .labelNames("broker", "operation")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("broker_connection_events_total")
            .help("Total number of connection events")
            .labelNames("broker", "event")
            .register(registry);

        this.connectionStatus = Gauge.build()
            .name("broker_connection_status")
            .help("Current connection status (1=connected, 0=disconnected)")
            .labelNames("broker")
            .register(registry);

        this.tickCounter = Counter.build()
            .name("broker_market_data_ticks_total")
            .help("Total number of market data ticks received")
            .labelNames("broker")
            .register(registry);

        this.pollFailureCounter = Counter.build()
            .name("broker_poll_failures_total")
            .help("Total number of failed quote polls")
            .labelNames("broker")
            .register(registry);

        this.streamReconnectCounter = Counter.build()
            .name("broker_stream_reconnects_total")
            .help("Total number of market data stream reconnect attempts")
            .labelNames("broker", "status")
            .register(registry);

        this.activeSubscriptions = Gauge.build()
            .name("broker_active_subscriptions")
            .help("Number of symbols with an open market data channel")
            .labelNames("broker")
            .register(registry);

        log.info("[PrometheusBrokerMetrics] Initialized");
    }

    @Override
    public void recordOrderSuccess(String brokerCode, Duration latency) {
        orderCounter.labels(brokerCode, "success").inc();
        orderLatency.labels(brokerCode).observe(latency.toMillis() / 1000.0);
        getState(brokerCode).successfulOrders.incrementAndGet();
    }

    @Override
    public void recordOrderFailure(String brokerCode, String errorType, Duration latency) {
        orderCounter.labels(brokerCode, "failure").inc();
        orderLatency.labels(brokerCode).observe(latency.toMillis() / 1000.0);
        getState(brokerCode).failedOrders.incrementAndGet();
        log.debug("[PrometheusBrokerMetrics] Order failure for {}: {}", brokerCode, errorType);
    }

    @Override
    public void recordAuthentication(String brokerCode, boolean success, Duration latency) {
        authCounter.labels(brokerCode, success ? "success" : "failure").inc();
        authLatency.labels(brokerCode).observe(latency.toMillis() / 1000.0);
        if (!success) {
            getState(brokerCode).authenticationFailures.incrementAndGet();
        }
    }

    @Override
    public void recordRequest(String brokerCode, String operation, String outcome, Duration latency) {
        requestCounter.labels(brokerCode, operation, outcome).inc();
        requestLatency.labels(brokerCode, operation).observe(latency.toMillis() / 1000.0);
        getState(brokerCode).requests.incrementAndGet();
    }

    @Override
    public void recordConnectionEvent(String brokerCode, ConnectionEvent event) {
        connectionEventCounter.labels(brokerCode, event.name()).inc();

        if (event == ConnectionEvent.CONNECTED) {
            connectionStatus.labels(brokerCode).set(1);
        } else if (event == ConnectionEvent.DISCONNECTED || event == ConnectionEvent.ERROR) {
            connectionStatus.labels(brokerCode).set(0);
        }

        if (event == ConnectionEvent.STREAM_CLOSED || event == ConnectionEvent.ERROR) {
            getState(brokerCode).connectionDrops.incrementAndGet();
        }
    }

    @Override
    public void recordMarketDataTick(String brokerCode) {
        tickCounter.labels(brokerCode).inc();
        getState(brokerCode).ticks.incrementAndGet();
    }

    @Override
    public void recordPollFailure(String brokerCode) {
        pollFailureCounter.labels(brokerCode).inc();
        getState(brokerCode).pollFailures.incrementAndGet();
    }

    @Override
    public void recordStreamReconnect(String brokerCode, boolean success) {
        streamReconnectCounter.labels(brokerCode, success ? "success" : "failure").inc();
        getState(brokerCode).streamReconnects.incrementAndGet();
    }

    @Override
    public void setActiveSubscriptions(String brokerCode, int count) {
        activeSubscriptions.labels(brokerCode).set(count);
    }

    @Override
    public Map<String, Object> getMetrics(String brokerCode) {
        MetricsState state = stateMap.get(brokerCode);
        if (state == null) {
            return new HashMap<>();
        }
        return state.toMap();
    }

    @Override
    public void reset(String brokerCode) {
        stateMap.remove(brokerCode);
        log.info("[PrometheusBrokerMetrics] Reset metrics for {}", brokerCode);
    }

    /**
     * Get Prometheus CollectorRegistry for scraping.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    private MetricsState getState(String brokerCode) {
        return stateMap.computeIfAbsent(brokerCode, k -> new MetricsState());
    }

    /**
     * In-memory state for aggregated metrics.
     */
    private static class MetricsState {
        private final AtomicLong successfulOrders = new AtomicLong();
        private final AtomicLong failedOrders = new AtomicLong();
        private final AtomicLong authenticationFailures = new AtomicLong();
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong connectionDrops = new AtomicLong();
        private final AtomicLong ticks = new AtomicLong();
        private final AtomicLong pollFailures = new AtomicLong();
        private final AtomicLong streamReconnects = new AtomicLong();

        Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            long success = successfulOrders.get();
            long failed = failedOrders.get();
            map.put("totalOrders", success + failed);
            map.put("successfulOrders", success);
            map.put("failedOrders", failed);
            map.put("successRate", success + failed == 0 ? 0.0 : (double) success / (success + failed));
            map.put("authenticationFailures", authenticationFailures.get());
            map.put("requests", requests.get());
            map.put("connectionDrops", connectionDrops.get());
            map.put("ticks", ticks.get());
            map.put("pollFailures", pollFailures.get());
            map.put("streamReconnects", streamReconnects.get());
            return map;
        }
    }
}
