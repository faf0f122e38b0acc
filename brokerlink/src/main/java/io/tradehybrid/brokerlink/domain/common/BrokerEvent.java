package io.tradehybrid.brokerlink.domain.common;

import io.tradehybrid.brokerlink.domain.order.OrderRequest;

import java.time.Instant;

/**
 * Aggregator event. Payload type depends on the event type:
 * BrokerConnection for CONNECT/DISCONNECT, {@link OrderSubmitted} for ORDER_SUBMIT,
 * OrderHistoryRecord for ORDER_UPDATE.
 */
public record BrokerEvent(
    BrokerEventType type,
    String brokerId,
    Instant timestamp,
    Object payload
) {
    public static BrokerEvent of(BrokerEventType type, String brokerId, Object payload) {
        return new BrokerEvent(type, brokerId, Instant.now(), payload);
    }

    /**
     * Payload cast to the expected type.
     */
    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }

    /**
     * ORDER_SUBMIT payload.
     */
    public record OrderSubmitted(String orderId, OrderRequest request) {}
}
