package io.tradehybrid.brokerlink.application.service;

import io.tradehybrid.brokerlink.application.service.ExecutionRouter.BrokerComparison;
import io.tradehybrid.brokerlink.application.service.ExecutionRouter.RoutedOrder;
import io.tradehybrid.brokerlink.broker.BrokerAdapter;
import io.tradehybrid.brokerlink.broker.MarketDataListener;
import io.tradehybrid.brokerlink.broker.MarketDataSubscription;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.common.OperationResult;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.domain.order.OrderSide;
import io.tradehybrid.brokerlink.infrastructure.broker.data.NotConnectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for ExecutionRouter.
 *
 * Tests:
 * - Score formula (price, spread, latency, fee weights)
 * - Ranking for BUY and SELL
 * - Stale quotes excluded
 * - executeBest routes through the aggregator
 * - Tracking skips brokers that cannot subscribe
 * - Tracking resubscribes after an adapter was replaced
 */
@ExtendWith(MockitoExtension.class)
class ExecutionRouterTest {

    @Mock
    private BrokerAggregator aggregator;
    @Mock
    private BrokerAdapter etrade;
    @Mock
    private BrokerAdapter binance;
    @Mock
    private MarketDataSubscription subscription;

    private MutableClock clock;
    private ExecutionRouter router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        router = new ExecutionRouter(aggregator, Duration.ofSeconds(5), clock);
    }

    @Test
    void testScoreFormula() {
        MarketData quoted = new MarketData("AAPL", 100.0, 0, null, null, null, null, null, 99.9, 100.1);

        BrokerComparison buy = ExecutionRouter.score("e", Venue.ETRADE, quoted, OrderSide.BUY, 50);
        BrokerComparison sell = ExecutionRouter.score("e", Venue.ETRADE, quoted, OrderSide.SELL, 50);

        // 100*0.40 + 0.2*0.25 + 0.5*0.20 + 0.5*0.15
        assertEquals(40.225, buy.score(), 1e-9);
        assertEquals(-39.775, sell.score(), 1e-9);
        assertEquals(0.2, buy.spread(), 1e-9);
        assertEquals(0.0005, buy.fees());
        assertEquals(50, buy.latencyMillis());
    }

    @Test
    void testDefaultSpreadAndFee() {
        BrokerComparison paper = ExecutionRouter.score("p", Venue.PAPER, MarketData.of("AAPL", 200.0, 0),
            OrderSide.BUY, 100);

        assertEquals(0.04, paper.spread(), 1e-9, "0.02% of price without bid/ask");
        assertEquals(ExecutionRouter.DEFAULT_FEE, paper.fees());
        assertEquals(0.0008, ExecutionRouter.feeFor(Venue.TRADOVATE));
        assertEquals(0.001, ExecutionRouter.feeFor(Venue.BINANCE));
    }

    @Test
    void testBuyPrefersLowerPriceSellPrefersHigher() {
        List<MarketDataListener> feeds = trackTwoBrokers();
        feeds.get(0).onMarketData(MarketData.of("AAPL", 101.0, clock.millis()));
        feeds.get(1).onMarketData(MarketData.of("AAPL", 100.0, clock.millis()));

        List<BrokerComparison> buy = router.compare("AAPL", OrderSide.BUY);
        List<BrokerComparison> sell = router.compare("AAPL", OrderSide.SELL);

        assertEquals(2, buy.size());
        assertEquals("binance", buy.get(0).brokerId(), "Cheaper quote wins a buy");
        assertTrue(buy.get(0).score() <= buy.get(1).score());
        assertEquals("etrade", sell.get(0).brokerId(), "Higher quote wins a sell");
    }

    @Test
    void testStaleQuotesExcluded() {
        List<MarketDataListener> feeds = trackTwoBrokers();
        feeds.get(0).onMarketData(MarketData.of("AAPL", 101.0, clock.millis()));
        clock.advance(Duration.ofSeconds(4));
        feeds.get(1).onMarketData(MarketData.of("AAPL", 100.0, 0));
        clock.advance(Duration.ofSeconds(2));

        List<BrokerComparison> comparisons = router.compare("AAPL", OrderSide.BUY);

        assertEquals(1, comparisons.size(), "Age counts from receipt, not venue timestamp");
        assertEquals("binance", comparisons.get(0).brokerId());
    }

    @Test
    void testUntrackedSymbolHasNoComparisons() {
        assertTrue(router.compare("TSLA", OrderSide.BUY).isEmpty());
        assertTrue(router.findBest("TSLA", OrderSide.BUY).isEmpty());
    }

    @Test
    void testExecuteBestRoutesToWinner() {
        List<MarketDataListener> feeds = trackTwoBrokers();
        feeds.get(0).onMarketData(MarketData.of("AAPL", 99.0, clock.millis()));
        feeds.get(1).onMarketData(MarketData.of("AAPL", 100.0, clock.millis()));
        OrderRequest order = OrderRequest.market("AAPL", OrderSide.BUY, 5);
        when(aggregator.submitOrder("etrade", order)).thenReturn(OperationResult.success("E-77"));

        OperationResult<RoutedOrder> result = router.executeBest(order);

        assertTrue(result.success(), result.error());
        assertEquals("etrade", result.data().brokerId());
        assertEquals(Venue.ETRADE, result.data().venue());
        assertEquals("E-77", result.data().orderId());
        assertEquals(99.0, result.data().comparison().price());
    }

    @Test
    void testExecuteBestPropagatesFailure() {
        List<MarketDataListener> feeds = trackTwoBrokers();
        feeds.get(0).onMarketData(MarketData.of("AAPL", 99.0, clock.millis()));
        OrderRequest order = OrderRequest.market("AAPL", OrderSide.BUY, 5);
        when(aggregator.submitOrder("etrade", order)).thenReturn(OperationResult.failure("Broker etrade is not connected"));

        OperationResult<RoutedOrder> result = router.executeBest(order);

        assertFalse(result.success());
        assertEquals("Broker etrade is not connected", result.error());
    }

    @Test
    void testExecuteBestWithoutQuotes() {
        OperationResult<RoutedOrder> result = router.executeBest(OrderRequest.market("AAPL", OrderSide.BUY, 1));

        assertFalse(result.success());
        assertEquals("No broker with a fresh quote for AAPL", result.error());
        verify(aggregator, never()).submitOrder(any(), any());
    }

    @Test
    void testTrackSkipsBrokerThatCannotSubscribe() {
        when(aggregator.connectedBrokerIds()).thenReturn(new TreeSet<>(Set.of("binance", "etrade")));
        when(aggregator.getAdapter("binance")).thenReturn(Optional.of(binance));
        when(aggregator.getAdapter("etrade")).thenReturn(Optional.of(etrade));
        when(binance.subscribeToMarketData(eq("AAPL"), any()))
            .thenThrow(new NotConnectedException("BINANCE", "subscribe to market data"));
        when(etrade.subscribeToMarketData(eq("AAPL"), any())).thenReturn(subscription);
        when(subscription.isActive()).thenReturn(true);

        assertEquals(1, router.track("AAPL"));
        assertEquals(1, router.track("AAPL"), "Already subscribed broker is not subscribed twice");
        verify(etrade, times(1)).subscribeToMarketData(eq("AAPL"), any());
    }

    @Test
    void testTrackResubscribesWhenAdapterWasReplaced() {
        BrokerAdapter replacement = mock(BrokerAdapter.class);
        MarketDataSubscription fresh = mock(MarketDataSubscription.class);
        when(aggregator.connectedBrokerIds()).thenReturn(new TreeSet<>(Set.of("etrade")));
        when(aggregator.getAdapter("etrade")).thenReturn(Optional.of(etrade), Optional.of(replacement));
        when(etrade.subscribeToMarketData(eq("AAPL"), any())).thenReturn(subscription);
        when(replacement.subscribeToMarketData(eq("AAPL"), any())).thenReturn(fresh);
        // The old adapter was disposed, which deactivated its subscription
        when(subscription.isActive()).thenReturn(false);

        assertEquals(1, router.track("AAPL"));
        assertEquals(1, router.track("AAPL"));

        verify(etrade, times(1)).subscribeToMarketData(eq("AAPL"), any());
        verify(replacement, times(1)).subscribeToMarketData(eq("AAPL"), any());
    }

    @Test
    void testUntrackCancelsSubscriptions() {
        trackTwoBrokers();

        router.untrack("AAPL");

        verify(subscription, times(2)).cancel();
        assertTrue(router.compare("AAPL", OrderSide.BUY).isEmpty());
    }

    /**
     * Track AAPL on etrade and binance; returns their listeners in that order.
     */
    private List<MarketDataListener> trackTwoBrokers() {
        when(aggregator.connectedBrokerIds()).thenReturn(new TreeSet<>(Set.of("binance", "etrade")));
        when(aggregator.getAdapter("etrade")).thenReturn(Optional.of(etrade));
        when(aggregator.getAdapter("binance")).thenReturn(Optional.of(binance));
        lenient().when(etrade.isConnected()).thenReturn(true);
        lenient().when(binance.isConnected()).thenReturn(true);
        lenient().when(etrade.getVenue()).thenReturn(Venue.ETRADE);
        lenient().when(binance.getVenue()).thenReturn(Venue.BINANCE);
        lenient().when(aggregator.getConnectLatency(any())).thenReturn(Optional.of(Duration.ofMillis(50)));

        ArgumentCaptor<MarketDataListener> etradeFeed = ArgumentCaptor.forClass(MarketDataListener.class);
        ArgumentCaptor<MarketDataListener> binanceFeed = ArgumentCaptor.forClass(MarketDataListener.class);
        when(etrade.subscribeToMarketData(eq("AAPL"), etradeFeed.capture())).thenReturn(subscription);
        when(binance.subscribeToMarketData(eq("AAPL"), binanceFeed.capture())).thenReturn(subscription);

        assertEquals(2, router.track("AAPL"));
        return List.of(etradeFeed.getValue(), binanceFeed.getValue());
    }

    private static final class MutableClock extends Clock {
        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(Duration duration) {
            millis += duration.toMillis();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
