package io.tradehybrid.brokerlink.broker.codec;

import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;

/**
 * Position as read from a venue payload, before the current price is known for certain.
 *
 * @param lastPrice price reported alongside the position, or null when the adapter must look it up
 */
public record PositionLine(
    String symbol,
    double quantity,
    double averagePrice,
    Double lastPrice
) {
    public boolean hasPrice() {
        return lastPrice != null && lastPrice > 0;
    }

    public BrokerPosition toPosition(double currentPrice) {
        return BrokerPosition.of(symbol, quantity, averagePrice, currentPrice);
    }

    public BrokerPosition toPosition() {
        return toPosition(hasPrice() ? lastPrice : averagePrice);
    }
}
