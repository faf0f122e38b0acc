package io.tradehybrid.brokerlink.domain.broker;

/**
 * Open position, normalized.
 *
 * Short exposure is a negative quantity, so {@code pnl = quantity * (currentPrice - averagePrice)}
 * holds for every venue.
 */
public record BrokerPosition(
    String symbol,
    double quantity,
    double averagePrice,
    double currentPrice,
    double pnl
) {
    public static BrokerPosition of(String symbol, double quantity, double averagePrice, double currentPrice) {
        return new BrokerPosition(symbol, quantity, averagePrice, currentPrice,
            quantity * (currentPrice - averagePrice));
    }

    public double marketValue() {
        return quantity * currentPrice;
    }
}
