package io.tradehybrid.brokerlink.infrastructure.broker.subscription;

import io.tradehybrid.brokerlink.broker.MarketDataListener;
import io.tradehybrid.brokerlink.broker.MarketDataSubscription;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.infrastructure.broker.common.ReconnectionPolicy;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics.ConnectionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-adapter symbol to listener fan-out with channel lifecycle.
 *
 * Per symbol: Unsubscribed -> Active -> Unsubscribed.
 * - The first listener for a symbol opens exactly one channel; later listeners share it.
 * - Removing the last listener stops the channel immediately.
 * - Ticks go to every registered listener in registration order on the channel's thread.
 *   A throwing listener is logged and skipped.
 * - Before fan-out, and again before each listener, the tick's channel must still be the
 *   symbol's current channel and the listener must still be registered.
 * - An unexpected stream close is retried with backoff; once the policy gives up the symbol
 *   is dropped along with its listeners.
 *
 * The map is mutated only under {@code lock}; fan-out and channel start/stop happen outside it.
 */
public class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final String brokerCode;
    private final ChannelFactory channelFactory;
    private final ScheduledExecutorService scheduler;
    private final Supplier<ReconnectionPolicy> reconnectionPolicies;
    private final BrokerMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    public SubscriptionRegistry(String brokerCode, ChannelFactory channelFactory,
                                ScheduledExecutorService scheduler,
                                Supplier<ReconnectionPolicy> reconnectionPolicies,
                                BrokerMetrics metrics) {
        this.brokerCode = brokerCode;
        this.channelFactory = channelFactory;
        this.scheduler = scheduler;
        this.reconnectionPolicies = reconnectionPolicies;
        this.metrics = metrics;
    }

    /**
     * Register a listener, opening the symbol's channel if this is the first one.
     */
    public MarketDataSubscription subscribe(String symbol, MarketDataListener listener) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        String key = symbol.trim();
        Registration registration = new Registration(key, listener);
        MarketDataChannel toStart = null;

        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("[" + brokerCode + "] Subscription registry is closed");
            }
            Entry entry = entries.get(key);
            if (entry == null) {
                entry = new Entry(key);
                entry.registrations.add(registration);
                entries.put(key, entry);
                toStart = entry.newChannel();
                log.info("[{}] Subscribed {} (new channel)", brokerCode, key);
            } else {
                entry.registrations.add(registration);
                log.debug("[{}] Subscribed {} ({} listeners)", brokerCode, key, entry.registrations.size());
            }
        }

        if (toStart != null) {
            toStart.start();
            metrics.setActiveSubscriptions(brokerCode, entries.size());
        }
        return registration;
    }

    /**
     * Remove one listener (every registration of it). Stops the channel when none remain.
     *
     * @return true if the listener was registered
     */
    public boolean unsubscribe(String symbol, MarketDataListener listener) {
        if (symbol == null) {
            return false;
        }
        String key = symbol.trim();
        MarketDataChannel toStop = null;
        boolean removed;

        synchronized (lock) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            for (Registration r : entry.registrations) {
                if (r.listener == listener) {
                    r.active = false;
                }
            }
            removed = entry.registrations.removeIf(r -> r.listener == listener);
            if (entry.registrations.isEmpty()) {
                entries.remove(key);
                toStop = entry.channel;
                entry.channel = null;
            }
        }

        if (toStop != null) {
            toStop.stop();
            metrics.setActiveSubscriptions(brokerCode, entries.size());
            log.info("[{}] Unsubscribed {} (last listener removed)", brokerCode, key);
        }
        return removed;
    }

    /**
     * Drop every listener for a symbol and stop its channel.
     */
    public void unsubscribeAll(String symbol) {
        if (symbol == null) {
            return;
        }
        String key = symbol.trim();
        Entry entry;
        synchronized (lock) {
            entry = entries.remove(key);
        }
        if (entry != null) {
            stopEntry(entry);
            metrics.setActiveSubscriptions(brokerCode, entries.size());
            log.info("[{}] Unsubscribed {}", brokerCode, key);
        }
    }

    /**
     * Stop every channel and refuse further subscriptions.
     */
    public void closeAll() {
        List<Entry> toStop;
        synchronized (lock) {
            closed = true;
            toStop = new ArrayList<>(entries.values());
            entries.clear();
        }
        for (Entry entry : toStop) {
            stopEntry(entry);
        }
        metrics.setActiveSubscriptions(brokerCode, 0);
        if (!toStop.isEmpty()) {
            log.info("[{}] Closed {} market data channels", brokerCode, toStop.size());
        }
    }

    public Set<String> symbols() {
        return new TreeSet<>(entries.keySet());
    }

    public int listenerCount(String symbol) {
        Entry entry = entries.get(symbol);
        return entry == null ? 0 : entry.registrations.size();
    }

    /**
     * Whether the symbol currently has a running channel.
     */
    public boolean hasActiveChannel(String symbol) {
        Entry entry = entries.get(symbol);
        MarketDataChannel channel = entry == null ? null : entry.channel;
        return channel != null && channel.isActive();
    }

    private void stopEntry(Entry entry) {
        MarketDataChannel channel;
        synchronized (lock) {
            channel = entry.channel;
            entry.channel = null;
            entry.registrations.forEach(r -> r.active = false);
            entry.registrations.clear();
        }
        if (channel != null) {
            channel.stop();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Channel callbacks
    // ═══════════════════════════════════════════════════════════════

    private void deliver(Sink sink, MarketData tick) {
        Entry entry = sink.entry;
        if (!sink.isCurrent()) {
            log.debug("[{}] Dropping stray tick for {}", brokerCode, entry.symbol);
            return;
        }
        metrics.recordMarketDataTick(brokerCode);
        resetBackoff(entry);

        for (Registration registration : entry.registrations) {
            if (!sink.isCurrent() || !registration.active) {
                continue;
            }
            try {
                registration.listener.onMarketData(tick);
            } catch (RuntimeException e) {
                log.warn("[{}] Listener for {} threw: {}", brokerCode, entry.symbol, e.toString(), e);
            }
        }
    }

    /**
     * A stream counts as recovered once it delivers data; a handshake followed by an immediate
     * close keeps counting against the reconnect budget.
     */
    private void resetBackoff(Entry entry) {
        ReconnectionPolicy policy = entry.policy;
        if (policy != null && policy.getAttemptCount() > 0) {
            policy.recordSuccess();
            log.debug("[{}] Stream for {} delivering again, backoff reset", brokerCode, entry.symbol);
        }
    }

    private void pollFailed(Sink sink, Throwable error) {
        if (!sink.isCurrent()) {
            return;
        }
        metrics.recordPollFailure(brokerCode);
        log.warn("[{}] Poll for {} failed: {}", brokerCode, sink.entry.symbol, error.getMessage());
    }

    private void streamOpened(Sink sink) {
        if (!sink.isCurrent()) {
            return;
        }
        Entry entry = sink.entry;
        ReconnectionPolicy policy = entry.policy;
        boolean wasReconnect = policy != null && policy.getAttemptCount() > 0;
        metrics.recordConnectionEvent(brokerCode, ConnectionEvent.STREAM_OPENED);
        if (wasReconnect) {
            metrics.recordStreamReconnect(brokerCode, true);
            log.info("[{}] Stream for {} reconnected", brokerCode, entry.symbol);
        }
    }

    private void streamClosed(Sink sink, Throwable error) {
        Entry entry = sink.entry;
        Duration delay = null;
        int attempt = 0;
        boolean abandoned = false;

        synchronized (lock) {
            if (!sink.isCurrent()) {
                return;
            }
            metrics.recordConnectionEvent(brokerCode, ConnectionEvent.STREAM_CLOSED);
            if (entry.policy == null) {
                entry.policy = reconnectionPolicies.get();
            }
            if (entry.policy.shouldRetry()) {
                delay = entry.policy.getNextDelay();
                entry.policy.recordFailure();
                attempt = entry.policy.getAttemptCount();
                // Retire the dead channel so late callbacks from it are ignored
                entry.currentSink = null;
            } else {
                entries.remove(entry.symbol);
                entry.channel = null;
                entry.registrations.forEach(r -> r.active = false);
                entry.registrations.clear();
                abandoned = true;
            }
        }

        if (abandoned) {
            metrics.recordStreamReconnect(brokerCode, false);
            metrics.recordConnectionEvent(brokerCode, ConnectionEvent.STREAM_ABANDONED);
            metrics.setActiveSubscriptions(brokerCode, entries.size());
            log.error("[{}] Stream for {} lost and reconnect attempts exhausted; symbol unsubscribed",
                brokerCode, entry.symbol, error);
            return;
        }

        log.warn("[{}] Stream for {} lost ({}); reconnect attempt {} in {}ms",
            brokerCode, entry.symbol, error == null ? "closed by venue" : error.toString(),
            attempt, delay.toMillis());
        try {
            scheduler.schedule(() -> reconnect(entry), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Scheduler stopped, not reconnecting {}", brokerCode, entry.symbol);
        }
    }

    private void reconnect(Entry entry) {
        MarketDataChannel channel;
        synchronized (lock) {
            if (closed || entries.get(entry.symbol) != entry || entry.registrations.isEmpty()) {
                return;
            }
            channel = entry.newChannel();
        }
        channel.start();
    }

    // ═══════════════════════════════════════════════════════════════
    // Inner types
    // ═══════════════════════════════════════════════════════════════

    private final class Entry {
        final String symbol;
        final List<Registration> registrations = new CopyOnWriteArrayList<>();
        volatile MarketDataChannel channel;
        volatile Sink currentSink;
        volatile ReconnectionPolicy policy;   // written under lock, created on first stream loss

        Entry(String symbol) {
            this.symbol = symbol;
        }

        /**
         * Create the next channel for this entry. Caller holds the lock.
         */
        MarketDataChannel newChannel() {
            Sink sink = new Sink(this);
            currentSink = sink;
            channel = channelFactory.create(symbol, sink);
            return channel;
        }
    }

    private final class Sink implements ChannelSink {
        final Entry entry;

        Sink(Entry entry) {
            this.entry = entry;
        }

        boolean isCurrent() {
            return !closed && entries.get(entry.symbol) == entry && entry.currentSink == this;
        }

        @Override
        public void onTick(MarketData tick) {
            deliver(this, tick);
        }

        @Override
        public void onPollFailure(Throwable error) {
            pollFailed(this, error);
        }

        @Override
        public void onStreamOpened() {
            streamOpened(this);
        }

        @Override
        public void onStreamClosed(Throwable error) {
            streamClosed(this, error);
        }
    }

    private final class Registration implements MarketDataSubscription {
        final String symbol;
        final MarketDataListener listener;
        volatile boolean active = true;

        Registration(String symbol, MarketDataListener listener) {
            this.symbol = symbol;
            this.listener = listener;
        }

        @Override
        public String symbol() {
            return symbol;
        }

        @Override
        public void cancel() {
            if (!active) {
                return;
            }
            active = false;
            removeRegistration(this);
        }

        @Override
        public boolean isActive() {
            return active && entries.containsKey(symbol);
        }
    }

    private void removeRegistration(Registration registration) {
        MarketDataChannel toStop = null;
        synchronized (lock) {
            Entry entry = entries.get(registration.symbol);
            if (entry == null || !entry.registrations.remove(registration)) {
                return;
            }
            if (entry.registrations.isEmpty()) {
                entries.remove(registration.symbol);
                toStop = entry.channel;
                entry.channel = null;
            }
        }
        if (toStop != null) {
            toStop.stop();
            metrics.setActiveSubscriptions(brokerCode, entries.size());
            log.info("[{}] Unsubscribed {} (last subscription cancelled)", brokerCode, registration.symbol);
        }
    }
}
