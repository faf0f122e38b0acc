package io.tradehybrid.brokerlink.infrastructure.broker.subscription;

import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PollingChannel.
 *
 * Tests:
 * - Periodic polling delivers ticks under the channel's symbol
 * - Failed and timed-out polls are reported and polling continues
 * - Nothing is delivered after stop
 */
class PollingChannelTest {

    private ScheduledExecutorService scheduler;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        sink = new RecordingSink();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testPollsAtInterval() throws InterruptedException {
        AtomicInteger polls = new AtomicInteger();
        PollingChannel channel = channel("AAPL",
            () -> CompletableFuture.completedFuture(MarketData.of("AAPL", 100 + polls.incrementAndGet(), 1L)),
            Duration.ofMillis(20));

        channel.start();
        assertTrue(sink.awaitTicks(3), "Should deliver repeated ticks");
        channel.stop();

        assertFalse(channel.isActive());
        assertEquals(101.0, sink.ticks.get(0).price(), "Ticks arrive in poll order");
        assertEquals(102.0, sink.ticks.get(1).price(), "Ticks arrive in poll order");
    }

    @Test
    void testTickSymbolRewrittenToChannelSymbol() {
        PollingChannel channel = channel("BTCUSD",
            () -> CompletableFuture.completedFuture(MarketData.of("BTCUSDT", 50000, 1L)), Duration.ofHours(1));
        channel.start();
        sink.ticks.clear();

        channel.pollOnce();

        assertEquals("BTCUSD", sink.ticks.get(0).symbol());
        channel.stop();
    }

    @Test
    void testFailedPollReportedAndPollingContinues() throws InterruptedException {
        AtomicInteger polls = new AtomicInteger();
        PollingChannel channel = channel("BTCUSD", () -> {
            if (polls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new VenueUnavailableException("TEST", 503, "quote unavailable"));
            }
            return CompletableFuture.completedFuture(MarketData.of("BTCUSD", 1, 1L));
        }, Duration.ofMillis(20));

        channel.start();

        assertTrue(sink.awaitTicks(1), "Polling should continue after a failure");
        channel.stop();
        assertInstanceOf(VenueUnavailableException.class, sink.failures.get(0), "Failure is unwrapped");
    }

    @Test
    void testThrowingFetcherDoesNotCancelSchedule() throws InterruptedException {
        AtomicInteger polls = new AtomicInteger();
        PollingChannel channel = channel("BTCUSD", () -> {
            if (polls.incrementAndGet() == 1) {
                throw new IllegalStateException("codec bug");
            }
            return CompletableFuture.completedFuture(MarketData.of("BTCUSD", 1, 1L));
        }, Duration.ofMillis(20));

        channel.start();

        assertTrue(sink.awaitTicks(1), "A throwing poll must not end the schedule");
        channel.stop();
        assertInstanceOf(IllegalStateException.class, sink.failures.get(0));
    }

    @Test
    void testPollTimeout() {
        PollingChannel channel = new PollingChannel("TEST", "BTCUSD", CompletableFuture::new,
            scheduler, Duration.ofHours(1), Duration.ofMillis(50), sink);
        channel.start();
        sink.failures.clear();

        channel.pollOnce();

        assertInstanceOf(TimeoutException.class, sink.failures.get(0));
        assertTrue(sink.ticks.isEmpty());
        channel.stop();
    }

    @Test
    void testNothingDeliveredAfterStop() {
        PollingChannel channel = channel("BTCUSD",
            () -> CompletableFuture.completedFuture(MarketData.of("BTCUSD", 1, 1L)), Duration.ofHours(1));
        channel.start();
        channel.stop();
        sink.ticks.clear();

        channel.pollOnce();

        assertTrue(sink.ticks.isEmpty(), "Stopped channel delivers nothing");
        channel.stop();
    }

    private PollingChannel channel(String symbol, Supplier<CompletableFuture<MarketData>> fetcher,
                                   Duration interval) {
        return new PollingChannel("TEST", symbol, fetcher, scheduler, interval, Duration.ofSeconds(1), sink);
    }

    private static final class RecordingSink implements ChannelSink {
        final List<MarketData> ticks = new CopyOnWriteArrayList<>();
        final List<Throwable> failures = new CopyOnWriteArrayList<>();

        boolean awaitTicks(int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (ticks.size() < count && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            return ticks.size() >= count;
        }

        @Override
        public void onTick(MarketData tick) {
            ticks.add(tick);
        }

        @Override
        public void onPollFailure(Throwable error) {
            failures.add(error);
        }

        @Override
        public void onStreamOpened() {
        }

        @Override
        public void onStreamClosed(Throwable error) {
        }
    }
}
