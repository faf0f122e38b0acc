package io.tradehybrid.brokerlink.domain.broker;

/**
 * Market class a broker connection trades.
 */
public enum BrokerType {
    CRYPTO,
    FOREX,
    STOCKS,
    FUTURES
}
