package io.tradehybrid.brokerlink.broker;

import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform broker contract implemented by every venue adapter.
 *
 * Network operations return futures that complete exceptionally with a
 * {@link io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerException} subtype.
 * Every operation other than {@link #connect()} fails with
 * {@link io.tradehybrid.brokerlink.infrastructure.broker.data.NotConnectedException}
 * until connect has completed successfully.
 */
public interface BrokerAdapter {

    /**
     * Broker code (ETRADE, TRADOVATE, BINANCE, PAPER).
     */
    String getBrokerCode();

    Venue getVenue();

    /**
     * Authenticate with the venue. Completes once the account identifier is known.
     */
    CompletableFuture<Void> connect();

    /**
     * Close every market data channel and stop background work. Idempotent.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Venue account identifier resolved during connect, or null before that.
     */
    String getAccountId();

    CompletableFuture<AccountBalance> getBalance();

    /**
     * Open positions, zero quantities and cash equivalents excluded.
     */
    CompletableFuture<List<BrokerPosition>> getPositions();

    /**
     * Validate and submit an order.
     *
     * @return venue order id
     */
    CompletableFuture<String> placeOrder(OrderRequest request);

    /**
     * Recent orders, newest first.
     */
    CompletableFuture<List<OrderHistoryRecord>> getOrderHistory();

    /**
     * Current state of one order.
     */
    CompletableFuture<OrderHistoryRecord> getOrderStatus(String orderId);

    /**
     * Ask the venue to cancel an open order. Completes once the venue has accepted the request;
     * the order may still show PENDING until the venue processes it.
     */
    CompletableFuture<Void> cancelOrder(String orderId);

    /**
     * One quote snapshot, independent of any market data subscription.
     */
    CompletableFuture<MarketData> getQuote(String symbol);

    /**
     * Flatten all or part of a position with a market order.
     *
     * @param quantity amount to close, or null for the whole position
     * @return venue order id of the closing order
     */
    CompletableFuture<String> closePosition(String symbol, Double quantity);

    /**
     * Register a listener for ticks on a symbol. The first listener for a symbol opens its channel.
     *
     * @throws io.tradehybrid.brokerlink.infrastructure.broker.data.NotConnectedException if not connected
     */
    MarketDataSubscription subscribeToMarketData(String symbol, MarketDataListener listener);

    /**
     * Drop every listener for a symbol and close its channel.
     */
    void unsubscribeFromMarketData(String symbol);

    /**
     * Drop one listener. The channel is closed when it was the last one.
     */
    void unsubscribeFromMarketData(String symbol, MarketDataListener listener);

    Set<String> getSubscribedSymbols();
}
