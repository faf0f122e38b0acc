package io.tradehybrid.brokerlink.domain.data;

/**
 * Normalized market data tick for one symbol.
 * Optional fields are null when the venue did not report them.
 */
public record MarketData(
    String symbol,
    double price,
    long timestamp,
    Double volume,
    Double high,
    Double low,
    Double open,
    Double close,
    Double bid,
    Double ask
) {
    public static MarketData of(String symbol, double price, long timestamp) {
        return new MarketData(symbol, price, timestamp, null, null, null, null, null, null, null);
    }

    public MarketData withSymbol(String newSymbol) {
        return new MarketData(newSymbol, price, timestamp, volume, high, low, open, close, bid, ask);
    }

    public boolean hasQuote() {
        return bid != null && ask != null && ask >= bid;
    }
}
