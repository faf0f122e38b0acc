package io.tradehybrid.brokerlink.broker;

import io.tradehybrid.brokerlink.domain.data.MarketData;

/**
 * Receives ticks for one subscribed symbol. Invoked synchronously on the channel's thread.
 */
@FunctionalInterface
public interface MarketDataListener {
    void onMarketData(MarketData data);
}
