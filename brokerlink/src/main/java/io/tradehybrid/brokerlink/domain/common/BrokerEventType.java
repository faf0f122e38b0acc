package io.tradehybrid.brokerlink.domain.common;

/**
 * Events emitted by the broker aggregator.
 */
public enum BrokerEventType {
    CONNECT,
    DISCONNECT,
    ORDER_SUBMIT,
    ORDER_UPDATE
}
