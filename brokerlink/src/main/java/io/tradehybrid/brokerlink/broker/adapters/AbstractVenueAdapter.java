package io.tradehybrid.brokerlink.broker.adapters;

import io.tradehybrid.brokerlink.broker.BrokerAdapter;
import io.tradehybrid.brokerlink.broker.MarketDataListener;
import io.tradehybrid.brokerlink.broker.MarketDataSubscription;
import io.tradehybrid.brokerlink.broker.codec.PositionLine;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerAuthenticationException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerExceptions;
import io.tradehybrid.brokerlink.infrastructure.broker.data.InvalidOrderException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.NotConnectedException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueRejectedException;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics.ConnectionEvent;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.ChannelSink;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.MarketDataChannel;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.PollingChannel;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Shared base for venue adapters.
 *
 * Holds the connect guard, failure normalization, order metrics and the subscription registry.
 * Subclasses implement the venue round trips ({@code do*}/{@code fetch*}) and the channel for a symbol.
 *
 * {@link #disconnect()} is terminal: it closes every channel and shuts the adapter's scheduler down.
 */
public abstract class AbstractVenueAdapter implements BrokerAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractVenueAdapter.class);

    protected final Venue venue;
    protected final BrokerCredentials credentials;
    protected final GatewayConfig config;
    protected final ScheduledExecutorService scheduler;
    protected final BrokerMetrics metrics;
    protected final SubscriptionRegistry registry;

    private volatile boolean connected = false;
    private volatile boolean disposed = false;
    private volatile String accountId;
    private CompletableFuture<Void> pendingConnect;   // guarded by this

    protected AbstractVenueAdapter(Venue venue, BrokerCredentials credentials, GatewayConfig config,
                                   ScheduledExecutorService scheduler, BrokerMetrics metrics) {
        if (credentials == null || credentials.venue() != venue) {
            throw new IllegalArgumentException("Credentials for " + venue + " required");
        }
        this.venue = venue;
        this.credentials = credentials;
        this.config = config;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.registry = new SubscriptionRegistry(venue.code(), this::createChannel, scheduler,
            config::newReconnectionPolicy, metrics);
    }

    // ═══════════════════════════════════════════════════════════════
    // Venue hooks
    // ═══════════════════════════════════════════════════════════════

    /**
     * Authenticate and resolve the account identifier.
     */
    protected abstract CompletableFuture<String> doConnect();

    protected abstract CompletableFuture<AccountBalance> fetchBalance();

    protected abstract CompletableFuture<List<BrokerPosition>> fetchPositions();

    /**
     * Submit an already validated order.
     */
    protected abstract CompletableFuture<String> doPlaceOrder(OrderRequest request);

    protected abstract CompletableFuture<List<OrderHistoryRecord>> fetchOrderHistory();

    /**
     * Current state of one order, looked up by venue order id.
     */
    protected abstract CompletableFuture<OrderHistoryRecord> fetchOrderStatus(String orderId);

    protected abstract CompletableFuture<Void> doCancelOrder(String orderId);

    /**
     * Quote snapshot for a symbol. Also backs the price lookup for positions that arrive without one.
     */
    protected abstract CompletableFuture<MarketData> fetchQuote(String symbol);

    /**
     * Venue-specific order checks on top of {@link OrderRequest#validate(String)}. Runs before any network call.
     *
     * @throws InvalidOrderException if the venue cannot take the order as given
     */
    protected void validateForVenue(OrderRequest request) {
    }

    /**
     * Channel feeding one symbol. Called by the registry on first subscribe and on stream reconnect.
     */
    protected abstract MarketDataChannel createChannel(String symbol, ChannelSink sink);

    /**
     * Release venue resources (tokens, sessions). Called once from {@link #disconnect()} before the scheduler stops.
     */
    protected void onDisconnect() {
    }

    // ═══════════════════════════════════════════════════════════════
    // BrokerAdapter
    // ═══════════════════════════════════════════════════════════════

    @Override
    public String getBrokerCode() {
        return venue.code();
    }

    @Override
    public Venue getVenue() {
        return venue;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    @Override
    public synchronized CompletableFuture<Void> connect() {
        if (disposed) {
            return CompletableFuture.failedFuture(
                new BrokerException(getBrokerCode(), "Adapter was disconnected; create a new one"));
        }
        if (connected) {
            return CompletableFuture.completedFuture(null);
        }
        if (pendingConnect != null) {
            return pendingConnect;
        }

        Instant start = Instant.now();
        log.info("[{}] Connecting to {} (sandbox={}, key={})", getBrokerCode(), venue.displayName(),
            credentials.sandbox(), BrokerCredentials.maskKey(credentials.apiKey()));

        CompletableFuture<String> handshake;
        try {
            handshake = doConnect();
        } catch (RuntimeException e) {
            handshake = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> result = handshake.handle((id, error) -> {
            Duration latency = Duration.between(start, Instant.now());
            synchronized (this) {
                pendingConnect = null;
                if (error == null && !disposed) {
                    accountId = id;
                    connected = true;
                }
            }
            if (error != null) {
                BrokerException failure = connectFailure(error);
                metrics.recordAuthentication(getBrokerCode(), false, latency);
                metrics.recordConnectionEvent(getBrokerCode(), ConnectionEvent.ERROR);
                log.error("[{}] Connect failed after {}ms: {}", getBrokerCode(), latency.toMillis(),
                    BrokerExceptions.unwrap(error).getMessage());
                throw failure;
            }
            metrics.recordAuthentication(getBrokerCode(), true, latency);
            metrics.recordConnectionEvent(getBrokerCode(), ConnectionEvent.CONNECTED);
            log.info("[{}] ✓ Connected in {}ms (account={})", getBrokerCode(), latency.toMillis(), id);
            return null;
        });
        if (!result.isDone()) {
            pendingConnect = result;
        }
        return result;
    }

    /**
     * A rejected handshake means the venue did not accept the credentials.
     */
    private BrokerException connectFailure(Throwable error) {
        Throwable cause = BrokerExceptions.unwrap(error);
        String message = "Failed to connect to " + venue.displayName();
        if (cause instanceof VenueRejectedException) {
            return new BrokerAuthenticationException(getBrokerCode(), message, cause);
        }
        return BrokerExceptions.normalize(getBrokerCode(), message, cause);
    }

    @Override
    public void disconnect() {
        boolean wasConnected;
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
            wasConnected = connected;
            connected = false;
        }
        log.info("[{}] Disconnecting", getBrokerCode());
        registry.closeAll();
        try {
            onDisconnect();
        } catch (RuntimeException e) {
            log.warn("[{}] Error releasing venue resources: {}", getBrokerCode(), e.getMessage(), e);
        }
        scheduler.shutdownNow();
        if (wasConnected) {
            metrics.recordConnectionEvent(getBrokerCode(), ConnectionEvent.DISCONNECTED);
        }
        log.info("[{}] Disconnected", getBrokerCode());
    }

    @Override
    public CompletableFuture<AccountBalance> getBalance() {
        return guarded("get balance", this::fetchBalance);
    }

    @Override
    public CompletableFuture<List<BrokerPosition>> getPositions() {
        return guarded("get positions", this::fetchPositions);
    }

    @Override
    public CompletableFuture<String> placeOrder(OrderRequest request) {
        if (!connected) {
            return CompletableFuture.failedFuture(new NotConnectedException(getBrokerCode(), "place order"));
        }
        Instant start = Instant.now();
        try {
            if (request == null) {
                throw new InvalidOrderException(getBrokerCode(), null, "Order is required");
            }
            request.validate(getBrokerCode());
            validateForVenue(request);
        } catch (InvalidOrderException e) {
            metrics.recordOrderFailure(getBrokerCode(), e.getClass().getSimpleName(),
                Duration.between(start, Instant.now()));
            log.warn("[{}] Order rejected locally: {}", getBrokerCode(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        log.info("[{}] Placing order: {} {} {} {}{}", getBrokerCode(), request.side(), request.quantity(),
            request.symbol(), request.type(), request.isLimit() ? " @ " + request.limitPrice() : "");

        return invoke(() -> doPlaceOrder(request)).handle((orderId, error) -> {
            Duration latency = Duration.between(start, Instant.now());
            if (error != null) {
                BrokerException failure = BrokerExceptions.normalize(getBrokerCode(),
                    "Failed to place order on " + venue.displayName(), error);
                metrics.recordOrderFailure(getBrokerCode(),
                    BrokerExceptions.unwrap(error).getClass().getSimpleName(), latency);
                log.warn("[{}] Order failed after {}ms: {}", getBrokerCode(), latency.toMillis(),
                    BrokerExceptions.unwrap(error).getMessage());
                throw failure;
            }
            metrics.recordOrderSuccess(getBrokerCode(), latency);
            log.info("[{}] ✓ Order placed: {} ({}ms)", getBrokerCode(), orderId, latency.toMillis());
            return orderId;
        });
    }

    @Override
    public CompletableFuture<List<OrderHistoryRecord>> getOrderHistory() {
        return guarded("get order history", this::fetchOrderHistory).thenApply(orders -> {
            List<OrderHistoryRecord> sorted = new ArrayList<>(orders);
            sorted.sort(Comparator.comparingLong(OrderHistoryRecord::timestamp).reversed());
            if (sorted.size() > config.orderHistoryLimit()) {
                return List.copyOf(sorted.subList(0, config.orderHistoryLimit()));
            }
            return List.copyOf(sorted);
        });
    }

    @Override
    public CompletableFuture<OrderHistoryRecord> getOrderStatus(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Order id is required"));
        }
        return guarded("get order status", () -> fetchOrderStatus(orderId));
    }

    @Override
    public CompletableFuture<Void> cancelOrder(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Order id is required"));
        }
        log.info("[{}] Cancelling order {}", getBrokerCode(), orderId);
        return guardedAs("Failed to cancel order " + orderId + " on " + venue.displayName(), "cancel order",
            () -> doCancelOrder(orderId))
            .thenRun(() -> log.info("[{}] ✓ Order {} cancelled", getBrokerCode(), orderId));
    }

    @Override
    public CompletableFuture<MarketData> getQuote(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Symbol is required"));
        }
        return guarded("get quote", () -> fetchQuote(symbol));
    }

    /**
     * Market order on the opposite side of the held position: sell a long, buy back a short.
     * A null quantity closes the whole position.
     */
    @Override
    public CompletableFuture<String> closePosition(String symbol, Double quantity) {
        if (symbol == null || symbol.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Symbol is required"));
        }
        return getPositions().thenCompose(positions -> {
            BrokerPosition position = positions.stream()
                .filter(p -> p.symbol().equalsIgnoreCase(symbol))
                .findFirst()
                .orElse(null);
            if (position == null) {
                return CompletableFuture.failedFuture(new VenueRejectedException(getBrokerCode(), 404,
                    "No open position found for " + symbol));
            }
            OrderRequest closing;
            try {
                closing = OrderRequest.closing(position, quantity, getBrokerCode());
            } catch (InvalidOrderException e) {
                return CompletableFuture.failedFuture(e);
            }
            log.info("[{}] Closing {} of {} {}", getBrokerCode(), closing.quantity(), position.quantity(),
                position.symbol());
            return placeOrder(closing);
        });
    }

    @Override
    public MarketDataSubscription subscribeToMarketData(String symbol, MarketDataListener listener) {
        if (!connected) {
            throw new NotConnectedException(getBrokerCode(), "subscribe to market data");
        }
        return registry.subscribe(symbol, listener);
    }

    @Override
    public void unsubscribeFromMarketData(String symbol) {
        registry.unsubscribeAll(symbol);
    }

    @Override
    public void unsubscribeFromMarketData(String symbol, MarketDataListener listener) {
        registry.unsubscribe(symbol, listener);
    }

    @Override
    public Set<String> getSubscribedSymbols() {
        return registry.symbols();
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers for subclasses
    // ═══════════════════════════════════════════════════════════════

    /**
     * Channel that polls a quote on the adapter scheduler at the configured interval.
     */
    protected MarketDataChannel pollingChannel(String symbol, ChannelSink sink,
                                               Supplier<CompletableFuture<MarketData>> quoteFetcher) {
        return new PollingChannel(getBrokerCode(), symbol, quoteFetcher, scheduler,
            config.pollInterval(), config.requestTimeout(), sink);
    }

    /**
     * Positions whose payload carried no price get one from {@link #fetchQuote(String)}.
     */
    protected CompletableFuture<List<BrokerPosition>> pricePositions(List<PositionLine> lines) {
        List<CompletableFuture<BrokerPosition>> priced = new ArrayList<>();
        for (PositionLine line : lines) {
            if (line.hasPrice()) {
                priced.add(CompletableFuture.completedFuture(line.toPosition()));
            } else {
                priced.add(fetchQuote(line.symbol()).thenApply(q -> line.toPosition(q.price())));
            }
        }
        return CompletableFuture.allOf(priced.toArray(new CompletableFuture[0]))
            .thenApply(v -> priced.stream().map(CompletableFuture::join).toList());
    }

    protected String baseUrl() {
        return config.restBaseUrl(venue, credentials.sandbox());
    }

    /**
     * Run a connected operation and normalize its failure to "Failed to {operation} from {venue}".
     */
    private <T> CompletableFuture<T> guarded(String operation, Supplier<CompletableFuture<T>> action) {
        return guardedAs("Failed to " + operation + " from " + venue.displayName(), operation, action);
    }

    private <T> CompletableFuture<T> guardedAs(String message, String operation, Supplier<CompletableFuture<T>> action) {
        if (!connected) {
            return CompletableFuture.failedFuture(new NotConnectedException(getBrokerCode(), operation));
        }
        return invoke(action).handle((value, error) -> {
            if (error != null) {
                log.warn("[{}] {}: {}", getBrokerCode(), message, BrokerExceptions.unwrap(error).getMessage());
                throw BrokerExceptions.normalize(getBrokerCode(), message, error);
            }
            return value;
        });
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
