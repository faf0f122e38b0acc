package io.tradehybrid.brokerlink.broker.adapters;

import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryStatus;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.domain.order.OrderSide;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueRejectedException;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.ChannelSink;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.MarketDataChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * In-process simulated venue for demos and development.
 *
 * Orders fill immediately: LIMIT at the limit price, MARKET at the current simulated price.
 * Prices follow a random walk of at most 0.5% per tick around a base derived from the symbol.
 */
public class PaperAdapter extends AbstractVenueAdapter {
    private static final Logger log = LoggerFactory.getLogger(PaperAdapter.class);

    private static final double MAX_STEP = 0.005;
    private static final double HALF_SPREAD = 0.0001;

    private final Random random;
    private final Object state = new Object();

    // guarded by state
    private double cash;
    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private final Map<String, Double> lastPrices = new HashMap<>();
    private final List<OrderHistoryRecord> orders = new ArrayList<>();
    private long lastOrderId = 1000;

    public PaperAdapter(BrokerCredentials credentials, GatewayConfig config, ScheduledExecutorService scheduler,
                        BrokerMetrics metrics) {
        this(credentials, config, scheduler, metrics, new Random());
    }

    PaperAdapter(BrokerCredentials credentials, GatewayConfig config, ScheduledExecutorService scheduler,
                 BrokerMetrics metrics, Random random) {
        super(Venue.PAPER, credentials, config, scheduler, metrics);
        this.random = random;
        this.cash = config.paperStartingCash();
    }

    @Override
    protected CompletableFuture<String> doConnect() {
        return CompletableFuture.completedFuture("PAPER-" + UUID.randomUUID().toString().substring(0, 8));
    }

    @Override
    protected CompletableFuture<AccountBalance> fetchBalance() {
        synchronized (state) {
            double positions = 0;
            for (Holding h : holdings.values()) {
                positions += h.quantity * priceOf(h.symbol);
            }
            return CompletableFuture.completedFuture(AccountBalance.of(cash, positions));
        }
    }

    @Override
    protected CompletableFuture<List<BrokerPosition>> fetchPositions() {
        synchronized (state) {
            List<BrokerPosition> out = new ArrayList<>();
            for (Holding h : holdings.values()) {
                out.add(BrokerPosition.of(h.symbol, h.quantity, h.averagePrice, priceOf(h.symbol)));
            }
            return CompletableFuture.completedFuture(out);
        }
    }

    @Override
    protected CompletableFuture<String> doPlaceOrder(OrderRequest request) {
        synchronized (state) {
            String symbol = request.symbol();
            double price = request.isLimit() ? request.limitPrice() : priceOf(symbol);
            double quantity = request.quantity();

            if (request.side() == OrderSide.BUY) {
                Holding h = holdings.computeIfAbsent(symbol, Holding::new);
                double cost = h.quantity * h.averagePrice + quantity * price;
                h.quantity += quantity;
                h.averagePrice = cost / h.quantity;
                cash -= quantity * price;
            } else {
                Holding h = holdings.get(symbol);
                if (h == null) {
                    return CompletableFuture.failedFuture(
                        new VenueRejectedException(getBrokerCode(), 400, "No position in " + symbol));
                }
                // Selling more than held closes the position
                double sold = Math.min(quantity, h.quantity);
                h.quantity -= sold;
                cash += sold * price;
                if (h.quantity <= 0) {
                    holdings.remove(symbol);
                }
                quantity = sold;
            }
            lastPrices.put(symbol, price);

            String orderId = Long.toString(++lastOrderId);
            orders.add(new OrderHistoryRecord(orderId, symbol, request.side(), quantity, price,
                OrderHistoryStatus.FILLED, System.currentTimeMillis(), getBrokerCode()));
            log.info("[{}] Filled {} {} {} @ {} (cash={})", getBrokerCode(), request.side(), quantity, symbol,
                price, cash);
            return CompletableFuture.completedFuture(orderId);
        }
    }

    @Override
    protected CompletableFuture<List<OrderHistoryRecord>> fetchOrderHistory() {
        synchronized (state) {
            return CompletableFuture.completedFuture(List.copyOf(orders));
        }
    }

    @Override
    protected CompletableFuture<OrderHistoryRecord> fetchOrderStatus(String orderId) {
        synchronized (state) {
            return CompletableFuture.completedFuture(findOrder(orderId));
        }
    }

    /**
     * Paper orders fill on placement, so there is never anything left to cancel.
     */
    @Override
    protected CompletableFuture<Void> doCancelOrder(String orderId) {
        synchronized (state) {
            OrderHistoryRecord order = findOrder(orderId);
            return CompletableFuture.failedFuture(new VenueRejectedException(getBrokerCode(), 400,
                "Order " + orderId + " is already " + order.status()));
        }
    }

    /**
     * Snapshot at the last simulated price. Does not advance the random walk.
     */
    @Override
    protected CompletableFuture<MarketData> fetchQuote(String symbol) {
        synchronized (state) {
            double price = priceOf(symbol);
            return CompletableFuture.completedFuture(new MarketData(symbol, price, System.currentTimeMillis(),
                null, null, null, null, null, price * (1 - HALF_SPREAD), price * (1 + HALF_SPREAD)));
        }
    }

    @Override
    protected MarketDataChannel createChannel(String symbol, ChannelSink sink) {
        return pollingChannel(symbol, sink, () -> CompletableFuture.completedFuture(nextTick(symbol)));
    }

    /**
     * Advance the symbol's random walk and return the new tick.
     */
    MarketData nextTick(String symbol) {
        double price;
        synchronized (state) {
            double current = priceOf(symbol);
            price = Math.max(0.01, current * (1 + (random.nextDouble() * 2 - 1) * MAX_STEP));
            price = Math.round(price * 100) / 100.0;
            lastPrices.put(symbol, price);
        }
        double volume = 100 + random.nextInt(1000);
        return new MarketData(symbol, price, System.currentTimeMillis(), volume, null, null, null, null,
            price * (1 - HALF_SPREAD), price * (1 + HALF_SPREAD));
    }

    /**
     * Order by id. Caller holds the state lock.
     */
    private OrderHistoryRecord findOrder(String orderId) {
        for (OrderHistoryRecord order : orders) {
            if (order.orderId().equals(orderId)) {
                return order;
            }
        }
        throw new VenueRejectedException(getBrokerCode(), 404, "Unknown order " + orderId);
    }

    /**
     * Last simulated price, seeded from the symbol's base price. Caller holds the state lock.
     */
    private double priceOf(String symbol) {
        return lastPrices.computeIfAbsent(symbol, PaperAdapter::basePrice);
    }

    /**
     * Deterministic starting price in [50, 1050) from the symbol's characters.
     */
    static double basePrice(String symbol) {
        int sum = 0;
        for (char c : symbol.toCharArray()) {
            sum += c;
        }
        return (sum % 1000) + 50;
    }

    private static final class Holding {
        final String symbol;
        double quantity;
        double averagePrice;

        Holding(String symbol) {
            this.symbol = symbol;
        }
    }
}
