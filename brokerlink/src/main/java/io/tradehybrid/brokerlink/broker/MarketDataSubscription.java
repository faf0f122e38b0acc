package io.tradehybrid.brokerlink.broker;

/**
 * Handle returned by {@link BrokerAdapter#subscribeToMarketData}.
 * Cancelling removes only the listener this handle was created for.
 */
public interface MarketDataSubscription extends AutoCloseable {

    String symbol();

    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
