package io.tradehybrid.brokerlink.infrastructure.broker.subscription;

import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerExceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Polls a quote for one symbol at a fixed delay on the adapter's scheduler.
 *
 * Fixed delay means polls for a symbol never overlap, so ticks arrive in order. Each poll waits at
 * most {@code pollTimeout}; a failed poll is reported to the sink and the next one runs as usual.
 */
public class PollingChannel implements MarketDataChannel {
    private static final Logger log = LoggerFactory.getLogger(PollingChannel.class);

    private final String brokerCode;
    private final String symbol;
    private final Supplier<CompletableFuture<MarketData>> quoteFetcher;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration pollTimeout;
    private final ChannelSink sink;

    private volatile boolean active = false;
    private volatile ScheduledFuture<?> task;

    public PollingChannel(String brokerCode, String symbol, Supplier<CompletableFuture<MarketData>> quoteFetcher,
                          ScheduledExecutorService scheduler, Duration interval, Duration pollTimeout,
                          ChannelSink sink) {
        this.brokerCode = brokerCode;
        this.symbol = symbol;
        this.quoteFetcher = quoteFetcher;
        this.scheduler = scheduler;
        this.interval = interval;
        this.pollTimeout = pollTimeout;
        this.sink = sink;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public synchronized void start() {
        if (active) {
            return;
        }
        active = true;
        task = scheduler.scheduleWithFixedDelay(this::pollOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[{}] Polling {} every {}ms", brokerCode, symbol, interval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (!active) {
            return;
        }
        active = false;
        ScheduledFuture<?> t = task;
        if (t != null) {
            t.cancel(false);
            task = null;
        }
        log.info("[{}] Stopped polling {}", brokerCode, symbol);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    void pollOnce() {
        if (!active) {
            return;
        }
        try {
            MarketData tick = quoteFetcher.get().get(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (active && tick != null) {
                sink.onTick(tick.symbol().equals(symbol) ? tick : tick.withSymbol(symbol));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            if (active) {
                sink.onPollFailure(BrokerExceptions.unwrap(e));
            }
        } catch (RuntimeException e) {
            // A throwing task would cancel the periodic schedule
            if (active) {
                sink.onPollFailure(e);
            }
        }
    }
}
