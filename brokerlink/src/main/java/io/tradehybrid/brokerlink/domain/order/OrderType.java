package io.tradehybrid.brokerlink.domain.order;

/**
 * Order type accepted by the uniform contract.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
