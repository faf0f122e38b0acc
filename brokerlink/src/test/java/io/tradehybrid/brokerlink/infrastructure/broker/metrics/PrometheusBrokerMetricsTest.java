package io.tradehybrid.brokerlink.infrastructure.broker.metrics;

import io.prometheus.client.CollectorRegistry;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics.ConnectionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PrometheusBrokerMetrics.
 *
 * Tests:
 * - Counter and gauge values per label set
 * - Aggregated per-broker snapshot and reset
 */
class PrometheusBrokerMetricsTest {

    private CollectorRegistry registry;
    private PrometheusBrokerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusBrokerMetrics(registry);
    }

    @Test
    void testOrderAndAuthenticationCounters() {
        metrics.recordOrderSuccess("PAPER", Duration.ofMillis(5));
        metrics.recordOrderFailure("PAPER", "InvalidOrderException", Duration.ofMillis(1));
        metrics.recordOrderFailure("PAPER", "InvalidOrderException", Duration.ofMillis(1));
        metrics.recordAuthentication("TRADOVATE", false, Duration.ofMillis(300));

        assertEquals(1.0, sample("broker_orders_total", "PAPER", "success"));
        assertEquals(2.0, sample("broker_orders_total", "PAPER", "failure"));
        assertEquals(1.0, sample("broker_authentications_total", "TRADOVATE", "failure"));
        assertNull(sample("broker_authentications_total", "TRADOVATE", "success"), "Unused label set is absent");
    }

    @Test
    void testConnectionStatusFollowsEvents() {
        metrics.recordConnectionEvent("BINANCE", ConnectionEvent.CONNECTED);
        assertEquals(1.0, registry.getSampleValue("broker_connection_status",
            new String[] {"broker"}, new String[] {"BINANCE"}));

        metrics.recordConnectionEvent("BINANCE", ConnectionEvent.STREAM_CLOSED);
        assertEquals(1.0, registry.getSampleValue("broker_connection_status",
            new String[] {"broker"}, new String[] {"BINANCE"}), "Stream events leave the broker status alone");

        metrics.recordConnectionEvent("BINANCE", ConnectionEvent.ERROR);
        assertEquals(0.0, registry.getSampleValue("broker_connection_status",
            new String[] {"broker"}, new String[] {"BINANCE"}));
        assertEquals(1.0, registry.getSampleValue("broker_connection_events_total",
            new String[] {"broker", "event"}, new String[] {"BINANCE", "STREAM_CLOSED"}));
    }

    @Test
    void testSnapshotAndReset() {
        metrics.recordOrderSuccess("ETRADE", Duration.ofMillis(10));
        metrics.recordOrderFailure("ETRADE", "VenueRejectedException", Duration.ofMillis(10));
        metrics.recordMarketDataTick("ETRADE");
        metrics.recordPollFailure("ETRADE");
        metrics.recordStreamReconnect("ETRADE", true);
        metrics.recordConnectionEvent("ETRADE", ConnectionEvent.STREAM_CLOSED);

        Map<String, Object> snapshot = metrics.getMetrics("ETRADE");

        assertEquals(2L, snapshot.get("totalOrders"));
        assertEquals(0.5, (Double) snapshot.get("successRate"), 1e-9);
        assertEquals(1L, snapshot.get("ticks"));
        assertEquals(1L, snapshot.get("pollFailures"));
        assertEquals(1L, snapshot.get("streamReconnects"));
        assertEquals(1L, snapshot.get("connectionDrops"));

        metrics.reset("ETRADE");
        assertTrue(metrics.getMetrics("ETRADE").isEmpty());
        assertTrue(metrics.getMetrics("UNKNOWN").isEmpty());
    }

    private Double sample(String name, String broker, String status) {
        return registry.getSampleValue(name, new String[] {"broker", "status"}, new String[] {broker, status});
    }
}
