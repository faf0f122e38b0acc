package io.tradehybrid.brokerlink.broker.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import io.tradehybrid.brokerlink.broker.codec.TradovateCodec;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.infrastructure.broker.common.TokenRefreshManager;
import io.tradehybrid.brokerlink.infrastructure.broker.common.TokenRefreshManager.TokenInfo;
import io.tradehybrid.brokerlink.infrastructure.broker.common.VenueHttpClient;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerExceptions;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.ChannelSink;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.MarketDataChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Tradovate adapter.
 *
 * Login exchanges username/password (plus app id and optional secret) for a bearer token that
 * {@link TokenRefreshManager} renews before expiry. Quotes are polled.
 */
public class TradovateAdapter extends AbstractVenueAdapter {
    private static final Logger log = LoggerFactory.getLogger(TradovateAdapter.class);

    private final VenueHttpClient http;
    private final TradovateCodec codec;
    private final TokenRefreshManager tokens;

    private volatile String accountSpec;

    public TradovateAdapter(BrokerCredentials credentials, GatewayConfig config, ScheduledExecutorService scheduler,
                            BrokerMetrics metrics, VenueHttpClient http) {
        super(Venue.TRADOVATE, credentials, config, scheduler, metrics);
        if (credentials.username() == null || credentials.password() == null || credentials.apiKey() == null) {
            throw new IllegalArgumentException("Tradovate requires username, password and app id");
        }
        this.http = http;
        this.codec = new TradovateCodec(http.objectMapper());
        this.tokens = new TokenRefreshManager(getBrokerCode(), this::renewToken,
            config.tokenRefreshWindow(), config.tokenRetryDelay(), scheduler);
    }

    @Override
    protected CompletableFuture<String> doConnect() {
        log.info("[{}] Requesting access token for {}", getBrokerCode(),
            BrokerCredentials.maskKey(credentials.username()));
        return http.postJson("auth", uri("/auth/accessTokenRequest"), codec.accessTokenRequest(credentials))
            .thenApply(body -> codec.parseAccessToken(body, Instant.now()))
            .thenCompose(token -> {
                tokens.start(token);
                return authedGet("accounts", "/account/list");
            })
            .thenApply(body -> {
                String id = codec.parseAccountId(body);
                accountSpec = codec.parseAccountSpec(body, id);
                return id;
            })
            .whenComplete((id, error) -> {
                if (error != null) {
                    tokens.shutdown();
                }
            });
    }

    /**
     * Two round trips: account item for net liquidation value, cash balance list for cash.
     */
    @Override
    protected CompletableFuture<AccountBalance> fetchBalance() {
        String accountId = getAccountId();
        return authedGet("account", "/account/item?id=" + accountId)
            .thenCompose(item -> authedGet("cash_balance", "/cashBalance/list")
                .thenApply(cash -> codec.parseBalance(item, cash, accountId)));
    }

    /**
     * Positions without a last price get one from a quote lookup.
     */
    @Override
    protected CompletableFuture<List<BrokerPosition>> fetchPositions() {
        return authedGet("positions", "/position/list")
            .thenApply(codec::parsePositions)
            .thenCompose(this::pricePositions);
    }

    @Override
    protected void validateForVenue(OrderRequest request) {
        TradovateCodec.requireWholeContracts(request);
    }

    @Override
    protected CompletableFuture<String> doPlaceOrder(OrderRequest request) {
        return authedPost("place_order", "/order/placeorder",
                codec.placeOrderRequest(request, getAccountId(), accountSpec))
            .thenApply(codec::parsePlacedOrderId);
    }

    @Override
    protected CompletableFuture<List<OrderHistoryRecord>> fetchOrderHistory() {
        return authedGet("orders", "/order/list").thenApply(codec::parseOrders);
    }

    @Override
    protected CompletableFuture<OrderHistoryRecord> fetchOrderStatus(String orderId) {
        return authedGet("order_status", "/order/item?id=" + URLEncoder.encode(orderId, StandardCharsets.UTF_8))
            .thenApply(body -> codec.parseOrder(body, orderId));
    }

    @Override
    protected CompletableFuture<Void> doCancelOrder(String orderId) {
        return authedPost("cancel_order", "/order/cancelorder", codec.cancelOrderRequest(orderId))
            .thenAccept(codec::checkCommandFailure);
    }

    @Override
    protected MarketDataChannel createChannel(String symbol, ChannelSink sink) {
        return pollingChannel(symbol, sink, () -> fetchQuote(symbol));
    }

    @Override
    protected void onDisconnect() {
        tokens.shutdown();
    }

    @Override
    protected CompletableFuture<MarketData> fetchQuote(String symbol) {
        return authedGet("quote", "/md/getQuote?symbol=" + URLEncoder.encode(symbol, StandardCharsets.UTF_8))
            .thenApply(body -> codec.parseQuote(body, symbol, System.currentTimeMillis()));
    }

    TokenRefreshManager tokens() {
        return tokens;
    }

    // ═══════════════════════════════════════════════════════════════
    // Transport
    // ═══════════════════════════════════════════════════════════════

    /**
     * Renewal for {@link TokenRefreshManager}; runs on the adapter scheduler.
     */
    private TokenInfo renewToken() {
        Instant start = Instant.now();
        try {
            TokenInfo renewed = authedGet("renew_token", "/auth/renewAccessToken")
                .thenApply(body -> codec.parseAccessToken(body, Instant.now()))
                .join();
            metrics.recordAuthentication(getBrokerCode(), true, Duration.between(start, Instant.now()));
            return renewed;
        } catch (RuntimeException e) {
            metrics.recordAuthentication(getBrokerCode(), false, Duration.between(start, Instant.now()));
            throw BrokerExceptions.normalize(getBrokerCode(), "Failed to renew Tradovate access token", e);
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl() + path);
    }

    private CompletableFuture<JsonNode> authedGet(String operation, String path) {
        String token;
        try {
            token = tokens.getToken();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return http.get(operation, uri(path), "Authorization", "Bearer " + token);
    }

    private CompletableFuture<JsonNode> authedPost(String operation, String path, JsonNode body) {
        String token;
        try {
            token = tokens.getToken();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return http.postJson(operation, uri(path), body, "Authorization", "Bearer " + token);
    }
}
