package io.tradehybrid.brokerlink.infrastructure.broker.subscription;

import io.tradehybrid.brokerlink.domain.data.MarketData;

/**
 * Callbacks from a channel back into the registry.
 */
public interface ChannelSink {

    void onTick(MarketData tick);

    /**
     * One poll failed. The channel keeps polling.
     */
    void onPollFailure(Throwable error);

    /**
     * Stream opened (initially or after a reconnect).
     */
    void onStreamOpened();

    /**
     * Stream ended without stop() being called.
     *
     * @param error failure cause, or null for a close frame from the venue
     */
    void onStreamClosed(Throwable error);
}
