package io.tradehybrid.brokerlink.domain.order;

import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.infrastructure.broker.data.InvalidOrderException;

/**
 * Normalized order request accepted by every broker adapter.
 *
 * The record accepts a LIMIT order without a price so that raw caller input can be
 * represented; {@link #validate(String)} rejects it before anything is sent to a venue.
 */
public record OrderRequest(
    String symbol,
    OrderSide side,
    double quantity,
    OrderType type,
    Double limitPrice      // Required and positive for LIMIT orders
) {
    public OrderRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("Order type cannot be null");
        }
    }

    public static OrderRequest market(String symbol, OrderSide side, double quantity) {
        return new OrderRequest(symbol, side, quantity, OrderType.MARKET, null);
    }

    public static OrderRequest limit(String symbol, OrderSide side, double quantity, double limitPrice) {
        return new OrderRequest(symbol, side, quantity, OrderType.LIMIT, limitPrice);
    }

    /**
     * Market order that flattens all or part of a position: sells a long, buys back a short.
     *
     * @param quantity amount to close, or null for the whole position
     * @throws InvalidOrderException if the quantity is not positive or exceeds the position
     */
    public static OrderRequest closing(BrokerPosition position, Double quantity, String brokerCode) {
        double held = Math.abs(position.quantity());
        double amount = quantity == null ? held : quantity;
        OrderSide side = position.quantity() > 0 ? OrderSide.SELL : OrderSide.BUY;
        OrderRequest request = market(position.symbol(), side, amount);
        if (!(amount > 0) || amount > held) {
            throw new InvalidOrderException(brokerCode, request,
                "Close quantity must be positive and at most " + held + " for " + position.symbol());
        }
        return request;
    }

    public boolean isLimit() {
        return type == OrderType.LIMIT;
    }

    /**
     * Check the order is submittable.
     *
     * @param brokerCode broker the order is headed to, used in the error
     * @throws InvalidOrderException if quantity or limit price are invalid
     */
    public void validate(String brokerCode) {
        if (!(quantity > 0) || Double.isInfinite(quantity)) {
            throw new InvalidOrderException(brokerCode, this, "Quantity must be positive");
        }
        if (isLimit() && (limitPrice == null || !(limitPrice > 0) || limitPrice.isInfinite())) {
            throw new InvalidOrderException(brokerCode, this, "Limit order requires a positive limit price");
        }
    }
}
