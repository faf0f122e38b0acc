package io.tradehybrid.brokerlink.infrastructure.broker.subscription;

/**
 * Creates the venue's channel for a symbol. The returned channel is not started yet.
 */
@FunctionalInterface
public interface ChannelFactory {
    MarketDataChannel create(String symbol, ChannelSink sink);
}
