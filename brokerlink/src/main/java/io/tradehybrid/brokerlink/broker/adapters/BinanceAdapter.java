package io.tradehybrid.brokerlink.broker.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import io.tradehybrid.brokerlink.broker.codec.BinanceCodec;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.infrastructure.broker.common.VenueHttpClient;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerExceptions;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueRejectedException;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.ChannelSink;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.MarketDataChannel;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.StreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Binance spot adapter.
 *
 * Private endpoints are HMAC-SHA256 signed with the account secret and carry the key in
 * {@code X-MBX-APIKEY}. Ticks come from one {@code <symbol>@trade} WebSocket stream per symbol.
 */
public class BinanceAdapter extends AbstractVenueAdapter {
    private static final Logger log = LoggerFactory.getLogger(BinanceAdapter.class);

    private static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final VenueHttpClient http;
    private final BinanceCodec codec;

    // orderId -> caller symbol for orders placed here; Binance addresses orders by symbol and id
    private final Map<String, String> orderSymbols = new ConcurrentHashMap<>();

    public BinanceAdapter(BrokerCredentials credentials, GatewayConfig config, ScheduledExecutorService scheduler,
                          BrokerMetrics metrics, VenueHttpClient http) {
        super(Venue.BINANCE, credentials, config, scheduler, metrics);
        if (credentials.apiKey() == null || credentials.apiSecret() == null) {
            throw new IllegalArgumentException("Binance requires API key and secret");
        }
        this.http = http;
        this.codec = new BinanceCodec(http.objectMapper());
    }

    @Override
    protected CompletableFuture<String> doConnect() {
        return signedGet("account", "/api/v3/account", Map.of())
            .thenApply(body -> codec.parseAccountId(body, credentials.apiKey()));
    }

    /**
     * Account holdings valued at ticker prices. Stablecoins count as cash.
     */
    @Override
    protected CompletableFuture<AccountBalance> fetchBalance() {
        return signedGet("balance", "/api/v3/account", Map.of())
            .thenApply(codec::parseBalances)
            .thenCompose(holdings -> tickerPrices()
                .thenApply(prices -> codec.computeBalance(holdings, prices)));
    }

    @Override
    protected CompletableFuture<List<BrokerPosition>> fetchPositions() {
        return signedGet("positions", "/api/v3/account", Map.of())
            .thenApply(codec::parseBalances)
            .thenCompose(holdings -> tickerPrices()
                .thenApply(prices -> codec.positionsFrom(holdings, prices)));
    }

    @Override
    protected CompletableFuture<String> doPlaceOrder(OrderRequest request) {
        String clientOrderId = "bl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 20);
        URI uri = signedUri("/api/v3/order", codec.orderParams(request, clientOrderId));
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header("Accept", "application/json")
            .header(API_KEY_HEADER, credentials.apiKey())
            .POST(HttpRequest.BodyPublishers.noBody());
        return http.send("place_order", builder)
            .thenApply(codec::parseOrderId)
            .thenApply(orderId -> {
                orderSymbols.put(orderId, request.symbol());
                return orderId;
            });
    }

    @Override
    protected CompletableFuture<OrderHistoryRecord> fetchOrderStatus(String orderId) {
        return symbolOf(orderId).thenCompose(symbol -> signedGet("order_status", "/api/v3/order",
                orderParams(symbol, orderId))
            .thenApply(body -> codec.parseOrder(body, symbol)));
    }

    @Override
    protected CompletableFuture<Void> doCancelOrder(String orderId) {
        return symbolOf(orderId).thenCompose(symbol -> http.delete("cancel_order",
                signedUri("/api/v3/order", orderParams(symbol, orderId)), API_KEY_HEADER, credentials.apiKey()))
            .thenAccept(body -> {
                codec.checkCancelled(body, orderId);
                orderSymbols.remove(orderId);
            });
    }

    @Override
    protected CompletableFuture<MarketData> fetchQuote(String symbol) {
        URI uri = URI.create(baseUrl() + "/api/v3/ticker/bookTicker?symbol=" + BinanceCodec.toVenueSymbol(symbol));
        return http.get("quote", uri)
            .thenApply(body -> codec.parseBookTicker(body, symbol, System.currentTimeMillis()));
    }

    /**
     * Binance only lists orders per symbol: configured history symbols plus whatever is subscribed.
     * A symbol that fails is logged and skipped.
     */
    @Override
    protected CompletableFuture<List<OrderHistoryRecord>> fetchOrderHistory() {
        Map<String, String> symbols = new LinkedHashMap<>();
        for (String symbol : config.binanceHistorySymbols()) {
            symbols.putIfAbsent(BinanceCodec.toVenueSymbol(symbol), symbol);
        }
        for (String symbol : registry.symbols()) {
            symbols.putIfAbsent(BinanceCodec.toVenueSymbol(symbol), symbol);
        }

        List<CompletableFuture<List<OrderHistoryRecord>>> perSymbol = new ArrayList<>();
        symbols.forEach((venueSymbol, symbol) -> {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", venueSymbol);
            params.put("limit", Integer.toString(config.orderHistoryLimit()));
            perSymbol.add(signedGet("orders", "/api/v3/allOrders", params)
                .thenApply(body -> codec.parseOrders(body, symbol))
                .exceptionally(error -> {
                    log.warn("[{}] Skipping order history for {}: {}", getBrokerCode(), venueSymbol,
                        BrokerExceptions.unwrap(error).getMessage());
                    return List.of();
                }));
        });

        return CompletableFuture.allOf(perSymbol.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                List<OrderHistoryRecord> all = new ArrayList<>();
                perSymbol.forEach(f -> all.addAll(f.join()));
                return all;
            });
    }

    @Override
    protected MarketDataChannel createChannel(String symbol, ChannelSink sink) {
        String stream = BinanceCodec.toVenueSymbol(symbol).toLowerCase(Locale.ROOT) + "@trade";
        URI uri = URI.create(config.streamBaseUrl(venue, credentials.sandbox()) + "/" + stream);
        return new StreamChannel(getBrokerCode(), symbol, uri, http::openWebSocket,
            frame -> codec.parseTrade(frame, symbol), sink);
    }

    // ═══════════════════════════════════════════════════════════════
    // Transport
    // ═══════════════════════════════════════════════════════════════

    /**
     * Symbol of an order placed through this adapter, else of a currently open order.
     */
    private CompletableFuture<String> symbolOf(String orderId) {
        String known = orderSymbols.get(orderId);
        if (known != null) {
            return CompletableFuture.completedFuture(known);
        }
        return signedGet("open_orders", "/api/v3/openOrders", Map.of()).thenApply(body -> {
            String symbol = codec.findOpenOrderSymbol(body, orderId);
            if (symbol == null) {
                throw new VenueRejectedException(getBrokerCode(), 404,
                    "Order " + orderId + " is not open and was not placed through this connection");
            }
            orderSymbols.put(orderId, symbol);
            return symbol;
        });
    }

    private static Map<String, String> orderParams(String symbol, String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", BinanceCodec.toVenueSymbol(symbol));
        params.put("orderId", orderId);
        return params;
    }

    private CompletableFuture<Map<String, Double>> tickerPrices() {
        return http.get("ticker_prices", URI.create(baseUrl() + "/api/v3/ticker/price"))
            .thenApply(codec::parseTickerPrices);
    }

    private CompletableFuture<JsonNode> signedGet(String operation, String path, Map<String, String> params) {
        return http.get(operation, signedUri(path, params), API_KEY_HEADER, credentials.apiKey());
    }

    private URI signedUri(String path, Map<String, String> params) {
        String query = BinanceCodec.signedQuery(params, System.currentTimeMillis(),
            BinanceCodec.DEFAULT_RECV_WINDOW, credentials.apiSecret());
        return URI.create(baseUrl() + path + "?" + query);
    }
}
