package io.tradehybrid.brokerlink.broker.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import io.tradehybrid.brokerlink.broker.codec.ETradeCodec;
import io.tradehybrid.brokerlink.broker.codec.OAuth1Signer;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.infrastructure.broker.common.VenueHttpClient;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.ChannelSink;
import io.tradehybrid.brokerlink.infrastructure.broker.subscription.MarketDataChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * E*TRADE adapter.
 *
 * Every request is signed with OAuth 1.0a (consumer key/secret plus access token/secret).
 * E*TRADE has no public price stream here, so quotes are polled.
 */
public class ETradeAdapter extends AbstractVenueAdapter {
    private static final Logger log = LoggerFactory.getLogger(ETradeAdapter.class);

    private final VenueHttpClient http;
    private final ETradeCodec codec;
    private final OAuth1Signer signer;

    public ETradeAdapter(BrokerCredentials credentials, GatewayConfig config, ScheduledExecutorService scheduler,
                         BrokerMetrics metrics, VenueHttpClient http) {
        super(Venue.ETRADE, credentials, config, scheduler, metrics);
        if (credentials.apiKey() == null || credentials.apiSecret() == null) {
            throw new IllegalArgumentException("E*TRADE requires consumer key and secret");
        }
        this.http = http;
        this.codec = new ETradeCodec(http.objectMapper());
        this.signer = new OAuth1Signer(credentials.apiKey(), credentials.apiSecret(),
            credentials.accessToken(), credentials.accessTokenSecret());
    }

    @Override
    protected CompletableFuture<String> doConnect() {
        return signedGet("accounts", "/accounts/list").thenApply(codec::parseAccountIdKey);
    }

    @Override
    protected CompletableFuture<AccountBalance> fetchBalance() {
        return signedGet("balance", accountPath("/balance?instType=BROKERAGE&realTimeNAV=true"))
            .thenApply(codec::parseBalance);
    }

    /**
     * Portfolio entries without a Quick view or market value are priced with a quote lookup.
     */
    @Override
    protected CompletableFuture<List<BrokerPosition>> fetchPositions() {
        return signedGet("positions", accountPath("/portfolio"))
            .thenApply(codec::parsePositions)
            .thenCompose(this::pricePositions);
    }

    /**
     * Preview then place; E*TRADE rejects a place request without the preview id.
     */
    @Override
    protected CompletableFuture<String> doPlaceOrder(OrderRequest request) {
        String clientOrderId = newClientOrderId();
        return signedPost("preview_order", accountPath("/orders/preview"),
                codec.previewOrderRequest(request, clientOrderId))
            .thenApply(codec::parsePreviewId)
            .thenCompose(previewId -> {
                log.debug("[{}] Preview {} accepted for {}", getBrokerCode(), previewId, clientOrderId);
                return signedPost("place_order", accountPath("/orders/place"),
                    codec.placeOrderRequest(request, clientOrderId, previewId));
            })
            .thenApply(codec::parsePlacedOrderId);
    }

    @Override
    protected CompletableFuture<List<OrderHistoryRecord>> fetchOrderHistory() {
        return signedGet("orders", accountPath("/orders?count=" + config.orderHistoryLimit()))
            .thenApply(codec::parseOrders);
    }

    @Override
    protected CompletableFuture<OrderHistoryRecord> fetchOrderStatus(String orderId) {
        return signedGet("order_status", accountPath("/orders/" + encode(orderId)))
            .thenApply(body -> codec.parseSingleOrder(body, orderId));
    }

    @Override
    protected CompletableFuture<Void> doCancelOrder(String orderId) {
        return signedPut("cancel_order", accountPath("/orders/cancel"), codec.cancelOrderRequest(orderId))
            .thenAccept(body -> codec.checkCancelled(body, orderId));
    }

    @Override
    protected MarketDataChannel createChannel(String symbol, ChannelSink sink) {
        return pollingChannel(symbol, sink, () -> fetchQuote(symbol));
    }

    @Override
    protected CompletableFuture<MarketData> fetchQuote(String symbol) {
        String path = "/market/quote/" + encode(symbol) + "?detailFlag=ALL";
        return signedGet("quote", path)
            .thenApply(body -> codec.parseQuote(body, symbol, System.currentTimeMillis()));
    }

    // ═══════════════════════════════════════════════════════════════
    // Transport
    // ═══════════════════════════════════════════════════════════════

    private String accountPath(String suffix) {
        return "/accounts/" + getAccountId() + suffix;
    }

    private CompletableFuture<JsonNode> signedGet(String operation, String path) {
        URI uri = URI.create(baseUrl() + path);
        return http.get(operation, uri, "Authorization", signer.authorizationHeader("GET", uri));
    }

    private CompletableFuture<JsonNode> signedPost(String operation, String path, JsonNode body) {
        URI uri = URI.create(baseUrl() + path);
        return http.postJson(operation, uri, body, "Authorization", signer.authorizationHeader("POST", uri));
    }

    private CompletableFuture<JsonNode> signedPut(String operation, String path, JsonNode body) {
        URI uri = URI.create(baseUrl() + path);
        return http.putJson(operation, uri, body, "Authorization", signer.authorizationHeader("PUT", uri));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * E*TRADE client order ids are at most 20 characters.
     */
    private static String newClientOrderId() {
        return Long.toString(System.currentTimeMillis(), 36)
            + Long.toString(ThreadLocalRandom.current().nextLong(1L << 40), 36);
    }
}
