package io.tradehybrid.brokerlink.application.service;

import io.tradehybrid.brokerlink.broker.BrokerAdapter;
import io.tradehybrid.brokerlink.broker.MarketDataSubscription;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.common.OperationResult;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.domain.order.OrderSide;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Best-execution routing across connected brokers.
 *
 * Each tracked symbol is subscribed on every connected broker and the latest quote per broker is kept.
 * Brokers are scored on fresh quotes only (lower is better):
 * <pre>
 * score = price * 0.40 (negated for SELL) + spread * 0.25 + (latencyMs / 100) * 0.20 + (fee * 1000) * 0.15
 * </pre>
 * Spread is ask - bid when both are quoted, else 0.02% of price.
 */
public class ExecutionRouter {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);

    static final double PRICE_WEIGHT = 0.40;
    static final double SPREAD_WEIGHT = 0.25;
    static final double LATENCY_WEIGHT = 0.20;
    static final double FEE_WEIGHT = 0.15;

    static final double DEFAULT_SPREAD_RATIO = 0.0002;
    static final double DEFAULT_FEE = 0.0015;
    static final long DEFAULT_LATENCY_MILLIS = 100;

    private static final Map<Venue, Double> FEES = new EnumMap<>(Venue.class);

    static {
        FEES.put(Venue.ETRADE, 0.0005);
        FEES.put(Venue.TRADOVATE, 0.0008);
        FEES.put(Venue.BINANCE, 0.001);
    }

    private final BrokerAggregator aggregator;
    private final Duration maxQuoteAge;
    private final Clock clock;

    private final Map<String, Tracked> tracked = new ConcurrentHashMap<>();

    public ExecutionRouter(BrokerAggregator aggregator, Duration maxQuoteAge) {
        this(aggregator, maxQuoteAge, Clock.systemUTC());
    }

    ExecutionRouter(BrokerAggregator aggregator, Duration maxQuoteAge, Clock clock) {
        this.aggregator = aggregator;
        this.maxQuoteAge = maxQuoteAge;
        this.clock = clock;
    }

    /**
     * Fee rate for a venue as a fraction of notional.
     */
    public static double feeFor(Venue venue) {
        return FEES.getOrDefault(venue, DEFAULT_FEE);
    }

    /**
     * Subscribe a symbol on every connected broker not already feeding it. A broker whose subscription
     * went inactive (adapter replaced or disconnected, stream given up) is subscribed again.
     *
     * @return number of brokers now feeding the symbol
     */
    public synchronized int track(String symbol) {
        Tracked t = tracked.computeIfAbsent(symbol, s -> new Tracked());
        for (String brokerId : aggregator.connectedBrokerIds()) {
            MarketDataSubscription existing = t.subscriptions.get(brokerId);
            if (existing != null) {
                if (existing.isActive()) {
                    continue;
                }
                log.info("[Router] Subscription for {} on {} is no longer active, resubscribing", symbol, brokerId);
                t.subscriptions.remove(brokerId);
                t.quotes.remove(brokerId);
            }
            Optional<BrokerAdapter> adapter = aggregator.getAdapter(brokerId);
            if (adapter.isEmpty()) {
                continue;
            }
            try {
                MarketDataSubscription sub = adapter.get().subscribeToMarketData(symbol,
                    tick -> t.quotes.put(brokerId, new Quote(tick, clock.millis())));
                t.subscriptions.put(brokerId, sub);
            } catch (BrokerException | IllegalStateException e) {
                log.warn("[Router] Cannot track {} on {}: {}", symbol, brokerId, e.getMessage());
            }
        }
        log.info("[Router] Tracking {} on {} brokers", symbol, t.subscriptions.size());
        return t.subscriptions.size();
    }

    public synchronized void untrack(String symbol) {
        Tracked t = tracked.remove(symbol);
        if (t == null) {
            return;
        }
        t.subscriptions.values().forEach(MarketDataSubscription::cancel);
        log.info("[Router] Stopped tracking {}", symbol);
    }

    /**
     * Comparisons for every connected broker with a fresh quote, best first.
     */
    public List<BrokerComparison> compare(String symbol, OrderSide side) {
        Tracked t = tracked.get(symbol);
        if (t == null) {
            return List.of();
        }
        long now = clock.millis();
        List<BrokerComparison> out = new ArrayList<>();
        t.quotes.forEach((brokerId, quote) -> {
            if (now - quote.receivedAt > maxQuoteAge.toMillis()) {
                return;
            }
            Optional<BrokerAdapter> adapter = aggregator.getAdapter(brokerId);
            if (adapter.isEmpty() || !adapter.get().isConnected()) {
                return;
            }
            Venue venue = adapter.get().getVenue();
            long latency = aggregator.getConnectLatency(brokerId).map(Duration::toMillis).orElse(DEFAULT_LATENCY_MILLIS);
            out.add(score(brokerId, venue, quote.tick, side, latency));
        });
        out.sort(Comparator.comparingDouble(BrokerComparison::score));
        return out;
    }

    public Optional<BrokerComparison> findBest(String symbol, OrderSide side) {
        List<BrokerComparison> comparisons = compare(symbol, side);
        return comparisons.isEmpty() ? Optional.empty() : Optional.of(comparisons.get(0));
    }

    /**
     * Place the order on the best-scoring broker for its symbol and side.
     */
    public OperationResult<RoutedOrder> executeBest(OrderRequest order) {
        Optional<BrokerComparison> best = findBest(order.symbol(), order.side());
        if (best.isEmpty()) {
            return OperationResult.failure("No broker with a fresh quote for " + order.symbol());
        }
        BrokerComparison chosen = best.get();
        log.info("[Router] Routing {} {} to {} (price={}, score={})", order.side(), order.symbol(),
            chosen.brokerId(), chosen.price(), String.format("%.4f", chosen.score()));

        OperationResult<String> placed = aggregator.submitOrder(chosen.brokerId(), order);
        if (placed.isFailure()) {
            return OperationResult.failure(placed.error());
        }
        return OperationResult.success(new RoutedOrder(chosen.brokerId(), chosen.venue(), placed.data(), chosen));
    }

    static BrokerComparison score(String brokerId, Venue venue, MarketData tick, OrderSide side, long latencyMillis) {
        double price = tick.price();
        double spread = tick.bid() != null && tick.ask() != null
            ? tick.ask() - tick.bid()
            : DEFAULT_SPREAD_RATIO * price;
        double fee = feeFor(venue);
        double priceTerm = side == OrderSide.SELL ? -price : price;
        double score = priceTerm * PRICE_WEIGHT
            + spread * SPREAD_WEIGHT
            + (latencyMillis / 100.0) * LATENCY_WEIGHT
            + (fee * 1000) * FEE_WEIGHT;
        return new BrokerComparison(brokerId, venue, price, spread, latencyMillis, fee, score);
    }

    /**
     * One broker's standing for a symbol.
     *
     * @param fees fee rate as a fraction of notional
     */
    public record BrokerComparison(
        String brokerId,
        Venue venue,
        double price,
        double spread,
        long latencyMillis,
        double fees,
        double score
    ) {}

    public record RoutedOrder(
        String brokerId,
        Venue venue,
        String orderId,
        BrokerComparison comparison
    ) {}

    private record Quote(MarketData tick, long receivedAt) {}

    private static final class Tracked {
        final Map<String, MarketDataSubscription> subscriptions = new ConcurrentHashMap<>();
        final Map<String, Quote> quotes = new ConcurrentHashMap<>();
    }
}
