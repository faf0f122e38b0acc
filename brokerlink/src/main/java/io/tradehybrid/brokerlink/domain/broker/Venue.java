package io.tradehybrid.brokerlink.domain.broker;

/**
 * Supported trading venues. Closed set: adding a venue means adding a constant here,
 * a codec, an adapter and a branch in BrokerAdapterFactory.
 */
public enum Venue {
    ETRADE("E*TRADE", BrokerType.STOCKS),
    TRADOVATE("Tradovate", BrokerType.FUTURES),
    BINANCE("Binance", BrokerType.CRYPTO),
    PAPER("Paper", BrokerType.STOCKS);

    private final String displayName;
    private final BrokerType defaultType;

    Venue(String displayName, BrokerType defaultType) {
        this.displayName = displayName;
        this.defaultType = defaultType;
    }

    public String displayName() {
        return displayName;
    }

    public BrokerType defaultType() {
        return defaultType;
    }

    /**
     * Broker code used in logs and metrics labels.
     */
    public String code() {
        return name();
    }
}
