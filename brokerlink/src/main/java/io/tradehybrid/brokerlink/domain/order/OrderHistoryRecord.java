package io.tradehybrid.brokerlink.domain.order;

/**
 * One order as reported by a venue, normalized.
 *
 * @param timestamp epoch millis of order placement as reported by the venue
 * @param broker    code of the venue that reported the order
 */
public record OrderHistoryRecord(
    String orderId,
    String symbol,
    OrderSide side,
    double quantity,
    double price,
    OrderHistoryStatus status,
    long timestamp,
    String broker
) {}
