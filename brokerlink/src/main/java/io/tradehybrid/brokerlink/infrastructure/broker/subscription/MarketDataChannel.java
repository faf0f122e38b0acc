package io.tradehybrid.brokerlink.infrastructure.broker.subscription;

/**
 * The single poll task or stream connection feeding one symbol.
 */
public interface MarketDataChannel {

    String symbol();

    /**
     * Begin producing ticks into the channel's sink. Called once.
     */
    void start();

    /**
     * Stop producing ticks. No tick reaches the sink after this returns. Idempotent.
     */
    void stop();

    boolean isActive();
}
