package io.tradehybrid.brokerlink.infrastructure.broker.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Broker metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Order success/failure counts and latency
 * - Authentication attempts
 * - Venue request outcomes and latency
 * - Connection and stream reconnect events
 * - Market data ticks, poll failures and active subscriptions
 */
public interface BrokerMetrics {

    /**
     * Record successful order placement.
     *
     * @param brokerCode Broker code
     * @param latency Order placement latency
     */
    void recordOrderSuccess(String brokerCode, Duration latency);

    /**
     * Record failed order placement.
     *
     * @param brokerCode Broker code
     * @param errorType Exception simple name (InvalidOrderException, VenueRejectedException, ...)
     * @param latency Time to failure
     */
    void recordOrderFailure(String brokerCode, String errorType, Duration latency);

    /**
     * Record authentication attempt (connect handshake or token renewal).
     */
    void recordAuthentication(String brokerCode, boolean success, Duration latency);

    /**
     * Record one venue HTTP round trip.
     *
     * @param operation Logical operation (balance, positions, quote, ...)
     * @param outcome success, auth_error, unavailable, rejected, mapping_error
     */
    void recordRequest(String brokerCode, String operation, String outcome, Duration latency);

    void recordConnectionEvent(String brokerCode, ConnectionEvent event);

    void recordMarketDataTick(String brokerCode);

    void recordPollFailure(String brokerCode);

    void recordStreamReconnect(String brokerCode, boolean success);

    void setActiveSubscriptions(String brokerCode, int count);

    /**
     * Aggregated counters for one broker.
     */
    Map<String, Object> getMetrics(String brokerCode);

    void reset(String brokerCode);

    enum ConnectionEvent {
        CONNECTED,
        DISCONNECTED,
        STREAM_OPENED,
        STREAM_CLOSED,
        STREAM_ABANDONED,
        ERROR
    }
}
