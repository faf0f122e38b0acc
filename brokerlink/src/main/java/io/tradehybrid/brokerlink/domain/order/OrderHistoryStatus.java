package io.tradehybrid.brokerlink.domain.order;

/**
 * Normalized order status. Every venue status is mapped onto one of these.
 */
public enum OrderHistoryStatus {
    FILLED,
    PENDING,
    CANCELLED
}
