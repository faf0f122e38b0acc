package io.tradehybrid.brokerlink.infrastructure.broker.subscription;

import io.tradehybrid.brokerlink.domain.data.MarketData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * WebSocket stream for one symbol.
 *
 * Frames are decoded into ticks and pushed to the sink in arrival order. The decoder may return
 * null for frames that carry no tick. An unexpected close or error is reported to the sink, which
 * decides whether to reconnect with a fresh channel. After {@link #stop()} nothing is reported.
 */
public class StreamChannel implements MarketDataChannel {
    private static final Logger log = LoggerFactory.getLogger(StreamChannel.class);

    private final String brokerCode;
    private final String symbol;
    private final URI uri;
    private final BiFunction<URI, WebSocket.Listener, CompletableFuture<WebSocket>> connector;
    private final Function<String, MarketData> decoder;
    private final ChannelSink sink;

    private volatile boolean active = false;
    private volatile WebSocket webSocket;

    public StreamChannel(String brokerCode, String symbol, URI uri,
                         BiFunction<URI, WebSocket.Listener, CompletableFuture<WebSocket>> connector,
                         Function<String, MarketData> decoder, ChannelSink sink) {
        this.brokerCode = brokerCode;
        this.symbol = symbol;
        this.uri = uri;
        this.connector = connector;
        this.decoder = decoder;
        this.sink = sink;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public void start() {
        synchronized (this) {
            if (active) {
                return;
            }
            active = true;
        }
        log.info("[{}] Opening stream for {}: {}", brokerCode, symbol, uri);

        connector.apply(uri, new Listener()).whenComplete((ws, error) -> {
            if (error != null) {
                if (active) {
                    log.warn("[{}] Stream for {} failed to open: {}", brokerCode, symbol, error.toString());
                    active = false;
                    sink.onStreamClosed(error);
                }
                return;
            }
            webSocket = ws;
            if (!active) {
                // Stopped while the handshake was in flight
                closeQuietly(ws);
                return;
            }
            sink.onStreamOpened();
        });
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (!active) {
                return;
            }
            active = false;
        }
        WebSocket ws = webSocket;
        if (ws != null) {
            closeQuietly(ws);
        }
        log.info("[{}] Closed stream for {}", brokerCode, symbol);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    private void closeQuietly(WebSocket ws) {
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "unsubscribe")
            .whenComplete((w, e) -> {
                if (e != null) {
                    log.debug("[{}] Close handshake for {} failed, aborting: {}", brokerCode, symbol, e.toString());
                    ws.abort();
                }
            });
    }

    private void onEnded(Throwable error) {
        boolean wasActive;
        synchronized (this) {
            wasActive = active;
            active = false;
        }
        if (wasActive) {
            sink.onStreamClosed(error);
        }
    }

    private final class Listener implements WebSocket.Listener {
        private final StringBuilder buffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket ws) {
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String frame = buffer.toString();
                buffer.setLength(0);
                deliver(frame);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            log.info("[{}] Stream for {} closed by venue: {} {}", brokerCode, symbol, statusCode, reason);
            onEnded(null);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            log.warn("[{}] Stream for {} errored: {}", brokerCode, symbol, error.toString());
            onEnded(error);
        }

        private void deliver(String frame) {
            if (!active) {
                return;
            }
            MarketData tick;
            try {
                tick = decoder.apply(frame);
            } catch (RuntimeException e) {
                log.warn("[{}] Dropping undecodable frame for {}: {}", brokerCode, symbol, e.getMessage());
                return;
            }
            if (tick != null && active) {
                sink.onTick(tick.symbol().equals(symbol) ? tick : tick.withSymbol(symbol));
            }
        }
    }
}
