package io.tradehybrid.brokerlink.application.service;

import io.tradehybrid.brokerlink.application.port.output.BrokerConnectionRepository;
import io.tradehybrid.brokerlink.broker.BrokerAdapter;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerConnection;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.BrokerType;
import io.tradehybrid.brokerlink.domain.common.BrokerEvent;
import io.tradehybrid.brokerlink.domain.common.BrokerEventType;
import io.tradehybrid.brokerlink.domain.common.OperationResult;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryStatus;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.infrastructure.broker.BrokerAdapterFactory;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerExceptions;
import io.tradehybrid.brokerlink.infrastructure.broker.data.InvalidOrderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Registry of connected brokers by caller-chosen id.
 *
 * The aggregator is the only component that creates (through {@link BrokerAdapterFactory}) or disposes
 * adapters. Query and order methods return {@link OperationResult} and never throw for venue failures.
 * Connection metadata is persisted through {@link BrokerConnectionRepository}; secrets never are.
 */
public class BrokerAggregator {
    private static final Logger log = LoggerFactory.getLogger(BrokerAggregator.class);

    private final BrokerAdapterFactory factory;
    private final BrokerConnectionRepository repository;
    private final BrokerEventBus eventBus;
    private final Duration callTimeout;
    private final Clock clock;

    private final Map<String, BrokerAdapter> adapters = new ConcurrentHashMap<>();
    private final Map<String, BrokerConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Duration> connectLatency = new ConcurrentHashMap<>();
    // brokerId -> orderId -> last observed status, for orders submitted here
    private final Map<String, Map<String, OrderHistoryStatus>> submittedOrders = new ConcurrentHashMap<>();

    public BrokerAggregator(BrokerAdapterFactory factory, BrokerConnectionRepository repository,
                            BrokerEventBus eventBus, GatewayConfig config) {
        this(factory, repository, eventBus, config, Clock.systemUTC());
    }

    BrokerAggregator(BrokerAdapterFactory factory, BrokerConnectionRepository repository,
                     BrokerEventBus eventBus, GatewayConfig config, Clock clock) {
        this.factory = factory;
        this.repository = repository;
        this.eventBus = eventBus;
        this.callTimeout = config.brokerConnectTimeout();
        this.clock = clock;

        // Adapters do not survive a restart
        for (BrokerConnection stored : repository.findAll()) {
            connections.put(stored.id(), stored.connected() ? stored.markDisconnected() : stored);
        }
        if (!connections.isEmpty()) {
            log.info("[Aggregator] Restored {} broker connection records", connections.size());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Connection lifecycle
    // ═══════════════════════════════════════════════════════════════

    /**
     * Create and connect an adapter under {@code id}. A previous adapter under the same id is disposed first.
     *
     * @param type broker type for display, or null for the venue default
     * @return true when connected; false (with the cause logged) otherwise, and no event is emitted
     */
    public boolean connectBroker(String id, String name, BrokerType type, BrokerCredentials credentials) {
        if (id == null || id.isBlank() || credentials == null) {
            log.warn("[Aggregator] connectBroker requires an id and credentials");
            return false;
        }

        BrokerAdapter previous = adapters.remove(id);
        if (previous != null) {
            log.info("[Aggregator] Replacing existing adapter for {}", id);
            previous.disconnect();
        }

        BrokerAdapter adapter;
        try {
            adapter = factory.create(credentials);
        } catch (IllegalArgumentException e) {
            log.error("[Aggregator] Cannot create adapter for {}: {}", id, e.getMessage());
            return false;
        }

        Instant start = clock.instant();
        try {
            adapter.connect().get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            adapter.disconnect();
            log.warn("[Aggregator] Interrupted while connecting {}", id);
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            adapter.disconnect();
            log.error("[Aggregator] Failed to connect {} ({}): {}", id, credentials.venue().displayName(),
                describe(e));
            return false;
        }
        Instant connectedAt = clock.instant();
        Duration latency = Duration.between(start, connectedAt);

        BrokerConnection connection = new BrokerConnection(id, name == null ? id : name,
            type == null ? credentials.venue().defaultType() : type, credentials.venue(), true, connectedAt);

        BrokerAdapter raced = adapters.put(id, adapter);
        if (raced != null) {
            raced.disconnect();
        }
        connections.put(id, connection);
        connectLatency.put(id, latency);
        persist(connection);

        log.info("[Aggregator] ✓ Connected {} to {} in {}ms", id, credentials.venue().displayName(),
            latency.toMillis());
        eventBus.publish(BrokerEvent.of(BrokerEventType.CONNECT, id, connection));
        return true;
    }

    /**
     * Dispose the adapter under {@code id} and mark its record disconnected.
     *
     * @return false when no adapter is registered under the id
     */
    public boolean disconnectBroker(String id) {
        if (id == null) {
            return false;
        }
        BrokerAdapter adapter = adapters.remove(id);
        if (adapter == null) {
            log.debug("[Aggregator] disconnectBroker: no adapter for {}", id);
            return false;
        }
        adapter.disconnect();
        submittedOrders.remove(id);

        BrokerConnection updated = connections.computeIfPresent(id, (k, c) -> c.markDisconnected());
        if (updated != null) {
            persist(updated);
        }
        log.info("[Aggregator] Disconnected {}", id);
        eventBus.publish(BrokerEvent.of(BrokerEventType.DISCONNECT, id, updated));
        return true;
    }

    /**
     * Disconnect and forget the record entirely.
     *
     * @return true if there was an adapter or a record under the id
     */
    public boolean removeBroker(String id) {
        if (id == null) {
            return false;
        }
        boolean disconnected = disconnectBroker(id);
        boolean forgotten = connections.remove(id) != null;
        connectLatency.remove(id);
        if (forgotten) {
            try {
                repository.delete(id);
            } catch (UncheckedIOException e) {
                log.warn("[Aggregator] Failed to delete stored connection {}: {}", id, e.getMessage());
            }
        }
        return disconnected || forgotten;
    }

    /**
     * Disconnect every broker. Records stay in the store marked disconnected.
     */
    public void shutdown() {
        log.info("[Aggregator] Shutting down {} brokers", adapters.size());
        for (String id : new ArrayList<>(adapters.keySet())) {
            disconnectBroker(id);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Broker operations
    // ═══════════════════════════════════════════════════════════════

    public OperationResult<String> submitOrder(String brokerId, OrderRequest order) {
        if (order == null) {
            return OperationResult.failure("Order is required");
        }
        OperationResult<String> result = call(brokerId, "submit order", a -> a.placeOrder(order));
        if (result.success()) {
            track(brokerId, result.data());
            eventBus.publish(BrokerEvent.of(BrokerEventType.ORDER_SUBMIT, brokerId,
                new BrokerEvent.OrderSubmitted(result.data(), order)));
        }
        return result;
    }

    public OperationResult<AccountBalance> getAccountBalance(String brokerId) {
        return call(brokerId, "get balance", BrokerAdapter::getBalance);
    }

    public OperationResult<List<BrokerPosition>> getPositions(String brokerId) {
        return call(brokerId, "get positions", BrokerAdapter::getPositions);
    }

    /**
     * Order history; emits ORDER_UPDATE for orders submitted here whose status moved since last seen.
     */
    public OperationResult<List<OrderHistoryRecord>> getOrderHistory(String brokerId) {
        OperationResult<List<OrderHistoryRecord>> result = call(brokerId, "get order history",
            BrokerAdapter::getOrderHistory);
        if (result.success()) {
            result.data().forEach(record -> observe(brokerId, record));
        }
        return result;
    }

    /**
     * Current state of one order; emits ORDER_UPDATE like {@link #getOrderHistory(String)}.
     */
    public OperationResult<OrderHistoryRecord> getOrderStatus(String brokerId, String orderId) {
        OperationResult<OrderHistoryRecord> result = call(brokerId, "get order status",
            a -> a.getOrderStatus(orderId));
        if (result.success()) {
            observe(brokerId, result.data());
        }
        return result;
    }

    /**
     * Request cancellation. The order's final state shows up through status or history queries.
     *
     * @return the order id on success
     */
    public OperationResult<String> cancelOrder(String brokerId, String orderId) {
        OperationResult<Void> result = call(brokerId, "cancel order", a -> a.cancelOrder(orderId));
        return result.success() ? OperationResult.success(orderId) : OperationResult.failure(result.error());
    }

    public OperationResult<MarketData> getQuote(String brokerId, String symbol) {
        return call(brokerId, "get quote", a -> a.getQuote(symbol));
    }

    /**
     * Close all ({@code quantity == null}) or part of a position with a market order, submitted and
     * announced like any other order.
     */
    public OperationResult<String> closePosition(String brokerId, String symbol, Double quantity) {
        if (symbol == null || symbol.isBlank()) {
            return OperationResult.failure("Symbol is required");
        }
        OperationResult<List<BrokerPosition>> positions = getPositions(brokerId);
        if (positions.isFailure()) {
            return OperationResult.failure(positions.error());
        }
        Optional<BrokerPosition> position = positions.data().stream()
            .filter(p -> p.symbol().equalsIgnoreCase(symbol))
            .findFirst();
        if (position.isEmpty()) {
            return OperationResult.failure("No open position found for " + symbol + " on " + brokerId);
        }
        OrderRequest closing;
        try {
            closing = OrderRequest.closing(position.get(), quantity, brokerId);
        } catch (InvalidOrderException e) {
            return OperationResult.failure(e.getMessage());
        }
        return submitOrder(brokerId, closing);
    }

    /**
     * Check credentials against the venue with a throwaway adapter. Nothing is registered or persisted.
     *
     * @return success with a confirmation message, or failure with the cause
     */
    public OperationResult<String> testConnection(BrokerCredentials credentials) {
        if (credentials == null) {
            return OperationResult.failure("Credentials are required");
        }
        String venueName = credentials.venue().displayName();
        BrokerAdapter adapter;
        try {
            adapter = factory.create(credentials);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure("Connection test failed: " + e.getMessage());
        }
        try {
            adapter.connect().get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Aggregator] Connection test to {} succeeded", venueName);
            return OperationResult.success("Successfully connected to " + venueName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure("Connection test interrupted");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Aggregator] Connection test to {} failed: {}", venueName, describe(e));
            return OperationResult.failure("Connection test failed: " + describe(e));
        } finally {
            adapter.disconnect();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════

    public List<BrokerConnection> getConnections() {
        List<BrokerConnection> list = new ArrayList<>(connections.values());
        list.sort(Comparator.comparing(BrokerConnection::id));
        return list;
    }

    public Optional<BrokerConnection> getConnection(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(connections.get(id));
    }

    public Optional<BrokerAdapter> getAdapter(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(adapters.get(id));
    }

    /**
     * Time the last successful connect took for a broker.
     */
    public Optional<Duration> getConnectLatency(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(connectLatency.get(id));
    }

    public Set<String> connectedBrokerIds() {
        Set<String> ids = new TreeSet<>();
        adapters.forEach((id, adapter) -> {
            if (adapter.isConnected()) {
                ids.add(id);
            }
        });
        return ids;
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    private <T> OperationResult<T> call(String brokerId, String operation,
                                        Function<BrokerAdapter, CompletableFuture<T>> action) {
        BrokerAdapter adapter = brokerId == null ? null : adapters.get(brokerId);
        if (adapter == null || !adapter.isConnected()) {
            return OperationResult.failure("Broker " + brokerId + " is not connected");
        }
        try {
            return OperationResult.success(action.apply(adapter).get(callTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure("Interrupted during " + operation);
        } catch (TimeoutException e) {
            log.warn("[Aggregator] {} on {} timed out after {}ms", operation, brokerId, callTimeout.toMillis());
            return OperationResult.failure("Timed out during " + operation + " on " + brokerId);
        } catch (ExecutionException | RuntimeException e) {
            String message = describe(e);
            log.warn("[Aggregator] {} on {} failed: {}", operation, brokerId, message);
            return OperationResult.failure(message);
        }
    }

    private void track(String brokerId, String orderId) {
        submittedOrders.computeIfAbsent(brokerId, k -> new ConcurrentHashMap<>())
            .put(orderId, OrderHistoryStatus.PENDING);
    }

    /**
     * Publish ORDER_UPDATE when a tracked order changed status. Orders leave tracking once FILLED or CANCELLED.
     */
    private void observe(String brokerId, OrderHistoryRecord record) {
        Map<String, OrderHistoryStatus> tracked = submittedOrders.get(brokerId);
        if (tracked == null) {
            return;
        }
        OrderHistoryStatus last = tracked.get(record.orderId());
        if (last == null || last == record.status()) {
            return;
        }
        if (record.status() == OrderHistoryStatus.PENDING) {
            tracked.put(record.orderId(), record.status());
        } else {
            tracked.remove(record.orderId());
        }
        eventBus.publish(BrokerEvent.of(BrokerEventType.ORDER_UPDATE, brokerId, record));
    }

    /**
     * Number of orders submitted through this aggregator that have not reached a final status yet.
     */
    int trackedOrderCount(String brokerId) {
        Map<String, OrderHistoryStatus> tracked = submittedOrders.get(brokerId);
        return tracked == null ? 0 : tracked.size();
    }

    private void persist(BrokerConnection connection) {
        try {
            repository.save(connection);
        } catch (UncheckedIOException e) {
            log.warn("[Aggregator] Failed to persist connection {}: {}", connection.id(), e.getMessage());
        }
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out";
        }
        Throwable cause = BrokerExceptions.unwrap(e);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
