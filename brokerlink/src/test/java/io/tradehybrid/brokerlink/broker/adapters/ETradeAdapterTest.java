package io.tradehybrid.brokerlink.broker.adapters;

import io.prometheus.client.CollectorRegistry;
import io.tradehybrid.brokerlink.broker.codec.JsonSupport;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryStatus;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.domain.order.OrderSide;
import io.tradehybrid.brokerlink.domain.order.OrderType;
import io.tradehybrid.brokerlink.infrastructure.broker.common.VenueHttpClient;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerAuthenticationException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerExceptions;
import io.tradehybrid.brokerlink.infrastructure.broker.data.InvalidOrderException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.MappingException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.NotConnectedException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueRejectedException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueUnavailableException;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.PrometheusBrokerMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ETradeAdapter against a stubbed E*TRADE API.
 *
 * Tests:
 * - OAuth-signed connect and account key resolution
 * - Balance, positions and order history mapping
 * - Positions priced from a quote when the portfolio has no price
 * - Preview-then-place order flow and local validation
 * - Cancel, order status, quote and close position
 * - Failure normalization
 * - Polled quotes
 */
class ETradeAdapterTest {

    private static final int TEST_PORT = 19130;
    private static final String KEY = "JIdOIAcSpwR1Jva7RQBraQ";

    private VenueStub venue;
    private ScheduledExecutorService scheduler;
    private CollectorRegistry registry;
    private ETradeAdapter adapter;

    @BeforeEach
    void setUp() {
        venue = new VenueStub(TEST_PORT);
        venue.on("GET", "/v1/accounts/list", """
            {"AccountListResponse":{"Accounts":{"Account":[{"accountId":"84010429","accountIdKey":"%s"}]}}}"""
            .formatted(KEY));

        scheduler = Executors.newScheduledThreadPool(2);
        registry = new CollectorRegistry();
        GatewayConfig config = GatewayConfig.builder()
            .restBaseUrl(Venue.ETRADE, venue.baseUrl() + "/v1/")
            .requestTimeout(Duration.ofSeconds(5))
            .pollInterval(Duration.ofMillis(50))
            .build();
        PrometheusBrokerMetrics metrics = new PrometheusBrokerMetrics(registry);
        adapter = new ETradeAdapter(
            BrokerCredentials.etrade("consumer-key-123", "consumer-secret", "access-token", "token-secret", true),
            config, scheduler, metrics,
            new VenueHttpClient("ETRADE", config, JsonSupport.newObjectMapper(), metrics));
    }

    @AfterEach
    void tearDown() {
        adapter.disconnect();
        venue.close();
    }

    @Test
    void testConnectResolvesAccountKey() throws Exception {
        adapter.connect().get(5, TimeUnit.SECONDS);

        assertTrue(adapter.isConnected());
        assertEquals(KEY, adapter.getAccountId());
        String authorization = venue.requests("GET", "/v1/accounts/list").get(0).header("Authorization");
        assertTrue(authorization.startsWith("OAuth "), authorization);
        assertTrue(authorization.contains("oauth_consumer_key=\"consumer-key-123\""), authorization);
        assertTrue(authorization.contains("oauth_token=\"access-token\""), authorization);
        assertTrue(authorization.contains("oauth_signature="), authorization);
        assertEquals(1.0, registry.getSampleValue("broker_authentications_total",
            new String[] {"broker", "status"}, new String[] {"ETRADE", "success"}));
    }

    @Test
    void testUnauthorizedConnect() {
        venue.on("GET", "/v1/accounts/list", 401, "{\"Error\":{\"message\":\"oauth_problem=token_rejected\"}}");

        Throwable failure = failureOf(adapter.connect());

        assertInstanceOf(BrokerAuthenticationException.class, failure);
        assertTrue(failure.getMessage().contains("Failed to connect to E*TRADE"), failure.getMessage());
        assertFalse(adapter.isConnected());
        assertEquals(1.0, registry.getSampleValue("broker_authentications_total",
            new String[] {"broker", "status"}, new String[] {"ETRADE", "failure"}));
    }

    @Test
    void testRejectedConnectIsAuthenticationFailure() {
        venue.on("GET", "/v1/accounts/list", 400, "{\"Error\":{\"message\":\"Invalid consumer key\"}}");

        assertInstanceOf(BrokerAuthenticationException.class, failureOf(adapter.connect()));
    }

    @Test
    void testOperationsRequireConnect() {
        assertInstanceOf(NotConnectedException.class, failureOf(adapter.getBalance()));
        assertInstanceOf(NotConnectedException.class,
            failureOf(adapter.placeOrder(OrderRequest.market("AAPL", OrderSide.BUY, 1))));
        assertTrue(venue.requests().isEmpty(), "Nothing should reach the venue");
    }

    @Test
    void testBalance() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/balance", """
            {"BalanceResponse":{"Computed":{"cashBalance":1000.0,"RealTimeValues":{"totalAccountValue":1000.0}}}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        AccountBalance balance = adapter.getBalance().get(5, TimeUnit.SECONDS);

        assertEquals(new AccountBalance(1000.0, 1000.0, 0.0), balance);
        String query = venue.requests("GET", "/v1/accounts/" + KEY + "/balance").get(0).query();
        assertTrue(query.contains("instType=BROKERAGE"), query);
        assertTrue(query.contains("realTimeNAV=true"), query);
    }

    @Test
    void testBalanceUnavailable() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/balance", 503, "down for maintenance");
        adapter.connect().get(5, TimeUnit.SECONDS);

        Throwable failure = failureOf(adapter.getBalance());

        assertInstanceOf(VenueUnavailableException.class, failure);
        assertTrue(failure.getMessage().contains("Failed to get balance from E*TRADE"), failure.getMessage());
    }

    @Test
    void testMalformedBalanceIsMappingError() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/balance", "{\"BalanceResponse\":{}}");
        adapter.connect().get(5, TimeUnit.SECONDS);

        assertInstanceOf(MappingException.class, failureOf(adapter.getBalance()));
    }

    @Test
    void testPositions() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/portfolio", """
            {"PortfolioResponse":{"AccountPortfolio":[{"Position":[
              {"Product":{"symbol":"AAPL","securityType":"EQ"},"quantity":10,"costPerShare":150.0,
               "Quick":{"lastTrade":160.0}}]}]}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        List<BrokerPosition> positions = adapter.getPositions().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(BrokerPosition.of("AAPL", 10, 150.0, 160.0)), positions);
        assertEquals(100.0, positions.get(0).pnl(), 1e-9);
    }

    @Test
    void testPositionWithoutPriceIsPricedFromQuote() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/portfolio", """
            {"PortfolioResponse":{"AccountPortfolio":[{"Position":[
              {"Product":{"symbol":"AAPL","securityType":"EQ"},"quantity":10,"costPerShare":150.0}]}]}}""");
        venue.on("GET", "/v1/market/quote/AAPL", """
            {"QuoteResponse":{"QuoteData":[{"All":{"lastTrade":160.0,"bid":159.9,"ask":160.1}}]}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        List<BrokerPosition> positions = adapter.getPositions().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(BrokerPosition.of("AAPL", 10, 150.0, 160.0)), positions);
        assertEquals(100.0, positions.get(0).pnl(), 1e-9);
        assertEquals(1, venue.requests("GET", "/v1/market/quote/AAPL").size());
    }

    @Test
    void testPositionQuoteFailureFailsPositions() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/portfolio", """
            {"PortfolioResponse":{"AccountPortfolio":[{"Position":[
              {"Product":{"symbol":"AAPL","securityType":"EQ"},"quantity":10,"costPerShare":150.0}]}]}}""");
        venue.on("GET", "/v1/market/quote/AAPL", 503, "quote service down");
        adapter.connect().get(5, TimeUnit.SECONDS);

        Throwable failure = failureOf(adapter.getPositions());

        assertInstanceOf(VenueUnavailableException.class, failure);
        assertTrue(failure.getMessage().contains("Failed to get positions from E*TRADE"), failure.getMessage());
    }

    @Test
    void testPlaceOrderPreviewsThenPlaces() throws Exception {
        venue.on("POST", "/v1/accounts/" + KEY + "/orders/preview",
            "{\"PreviewOrderResponse\":{\"PreviewIds\":[{\"previewId\":3429395279}]}}");
        venue.on("POST", "/v1/accounts/" + KEY + "/orders/place",
            "{\"PlaceOrderResponse\":{\"OrderIds\":[{\"orderId\":529}]}}");
        adapter.connect().get(5, TimeUnit.SECONDS);

        String orderId = adapter.placeOrder(OrderRequest.limit("AAPL", OrderSide.BUY, 10, 150.0))
            .get(5, TimeUnit.SECONDS);

        assertEquals("529", orderId);
        String placeBody = venue.requests("POST", "/v1/accounts/" + KEY + "/orders/place").get(0).body();
        assertTrue(placeBody.contains("3429395279"), "Place request should carry the preview id");
        assertTrue(placeBody.contains("\"limitPrice\":150.0"), placeBody);
    }

    @Test
    void testLimitOrderWithoutPriceNeverReachesVenue() throws Exception {
        adapter.connect().get(5, TimeUnit.SECONDS);
        int before = venue.requests().size();

        Throwable failure = failureOf(adapter.placeOrder(
            new OrderRequest("AAPL", OrderSide.BUY, 10, OrderType.LIMIT, null)));

        assertInstanceOf(InvalidOrderException.class, failure);
        assertEquals(before, venue.requests().size(), "No request for an invalid order");
        assertEquals(1.0, registry.getSampleValue("broker_orders_total",
            new String[] {"broker", "status"}, new String[] {"ETRADE", "failure"}));
    }

    @Test
    void testNullOrderFailsTheFuture() throws Exception {
        adapter.connect().get(5, TimeUnit.SECONDS);
        int before = venue.requests().size();

        CompletableFuture<String> future = adapter.placeOrder(null);

        assertInstanceOf(InvalidOrderException.class, failureOf(future));
        assertEquals(before, venue.requests().size());
    }

    @Test
    void testCancelOrder() throws Exception {
        venue.on("PUT", "/v1/accounts/" + KEY + "/orders/cancel", """
            {"CancelOrderResponse":{"accountId":"84010429","orderId":529,"cancelTime":1700000000000,
              "Messages":{"Message":[{"code":5011,"description":"Your request to cancel your order is being processed.","type":"WARNING"}]}}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        adapter.cancelOrder("529").get(5, TimeUnit.SECONDS);

        VenueStub.Recorded request = venue.requests("PUT", "/v1/accounts/" + KEY + "/orders/cancel").get(0);
        assertTrue(request.body().contains("\"orderId\":529"), request.body());
        assertTrue(request.header("Authorization").startsWith("OAuth "));
    }

    @Test
    void testCancelOrderRefused() throws Exception {
        venue.on("PUT", "/v1/accounts/" + KEY + "/orders/cancel", """
            {"CancelOrderResponse":{"orderId":529,
              "Messages":{"Message":[{"code":5001,"description":"This order is already executed.","type":"ERROR"}]}}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        Throwable failure = failureOf(adapter.cancelOrder("529"));

        assertInstanceOf(VenueRejectedException.class, failure);
        assertTrue(failure.getMessage().contains("Failed to cancel order 529 on E*TRADE"), failure.getMessage());
    }

    @Test
    void testOrderStatus() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/orders/529", """
            {"OrdersResponse":{"Order":[
              {"orderId":529,"OrderDetail":[{"placedTime":5000,"status":"EXECUTED",
                "Instrument":[{"Product":{"symbol":"AAPL"},"orderAction":"BUY","orderedQuantity":10,
                  "averageExecutionPrice":150.25}]}]}]}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        OrderHistoryRecord order = adapter.getOrderStatus("529").get(5, TimeUnit.SECONDS);

        assertEquals("529", order.orderId());
        assertEquals(OrderHistoryStatus.FILLED, order.status());
        assertEquals(150.25, order.price());
    }

    @Test
    void testQuote() throws Exception {
        venue.on("GET", "/v1/market/quote/AAPL", """
            {"QuoteResponse":{"QuoteData":[{"dateTimeUTC":1700000000,"All":{"lastTrade":171.25,"bid":171.2,"ask":171.3}}]}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        MarketData quote = adapter.getQuote("AAPL").get(5, TimeUnit.SECONDS);

        assertEquals(171.25, quote.price());
        assertEquals(171.2, quote.bid());
        assertEquals(1_700_000_000_000L, quote.timestamp());
    }

    @Test
    void testClosePositionSellsHolding() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/portfolio", """
            {"PortfolioResponse":{"AccountPortfolio":[{"Position":[
              {"Product":{"symbol":"AAPL","securityType":"EQ"},"quantity":10,"costPerShare":150.0,
               "Quick":{"lastTrade":160.0}}]}]}}""");
        venue.on("POST", "/v1/accounts/" + KEY + "/orders/preview",
            "{\"PreviewOrderResponse\":{\"PreviewIds\":[{\"previewId\":77}]}}");
        venue.on("POST", "/v1/accounts/" + KEY + "/orders/place",
            "{\"PlaceOrderResponse\":{\"OrderIds\":[{\"orderId\":530}]}}");
        adapter.connect().get(5, TimeUnit.SECONDS);

        String orderId = adapter.closePosition("AAPL", 4.0).get(5, TimeUnit.SECONDS);

        assertEquals("530", orderId);
        String body = venue.requests("POST", "/v1/accounts/" + KEY + "/orders/place").get(0).body();
        assertTrue(body.contains("\"orderAction\":\"SELL\""), body);
        assertTrue(body.contains("\"quantity\":4.0"), body);
        assertTrue(body.contains("\"priceType\":\"MARKET\""), body);
    }

    @Test
    void testClosePositionWithoutHolding() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/portfolio", "{\"PortfolioResponse\":{\"AccountPortfolio\":[]}}");
        adapter.connect().get(5, TimeUnit.SECONDS);

        Throwable failure = failureOf(adapter.closePosition("AAPL", null));

        assertInstanceOf(VenueRejectedException.class, failure);
        assertTrue(failure.getMessage().contains("No open position found for AAPL"), failure.getMessage());
        assertTrue(venue.requests("POST", "/v1/accounts/" + KEY + "/orders/preview").isEmpty());
    }

    @Test
    void testOrderHistoryNewestFirst() throws Exception {
        venue.on("GET", "/v1/accounts/" + KEY + "/orders", """
            {"OrdersResponse":{"Order":[
              {"orderId":1,"OrderDetail":[{"placedTime":1000,"status":"EXECUTED",
                "Instrument":[{"Product":{"symbol":"AAPL"},"orderAction":"BUY","orderedQuantity":1,
                  "averageExecutionPrice":150.0}]}]},
              {"orderId":2,"OrderDetail":[{"placedTime":3000,"status":"OPEN","limitPrice":140.0,
                "Instrument":[{"Product":{"symbol":"AAPL"},"orderAction":"BUY","orderedQuantity":1}]}]},
              {"orderId":3,"OrderDetail":[{"placedTime":2000,"status":"CANCELLED","limitPrice":130.0,
                "Instrument":[{"Product":{"symbol":"AAPL"},"orderAction":"SELL","orderedQuantity":1}]}]}]}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);

        List<OrderHistoryRecord> history = adapter.getOrderHistory().get(5, TimeUnit.SECONDS);

        assertEquals(List.of("2", "3", "1"), history.stream().map(OrderHistoryRecord::orderId).toList());
        assertEquals("count=50", venue.requests("GET", "/v1/accounts/" + KEY + "/orders").get(0).query());
    }

    @Test
    void testQuoteSubscriptionPolls() throws Exception {
        venue.on("GET", "/v1/market/quote/AAPL", """
            {"QuoteResponse":{"QuoteData":[{"dateTimeUTC":1700000000,"All":{"lastTrade":171.25,"bid":171.2,"ask":171.3}}]}}""");
        adapter.connect().get(5, TimeUnit.SECONDS);
        List<MarketData> ticks = new CopyOnWriteArrayList<>();

        adapter.subscribeToMarketData("AAPL", ticks::add);
        long deadline = System.currentTimeMillis() + 5000;
        while (ticks.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        adapter.unsubscribeFromMarketData("AAPL");

        assertTrue(ticks.size() >= 2, "Quotes should be polled repeatedly");
        assertEquals(171.25, ticks.get(0).price());
        assertEquals("detailFlag=ALL", venue.requests("GET", "/v1/market/quote/AAPL").get(0).query());
    }

    @Test
    void testRequiresConsumerKey() {
        GatewayConfig config = GatewayConfig.defaults();
        PrometheusBrokerMetrics metrics = new PrometheusBrokerMetrics(new CollectorRegistry());
        VenueHttpClient http = new VenueHttpClient("ETRADE", config, JsonSupport.newObjectMapper(), metrics);

        assertThrows(IllegalArgumentException.class, () -> new ETradeAdapter(
            BrokerCredentials.etrade(null, "secret", "t", "ts", true), config, scheduler, metrics, http));
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return BrokerExceptions.unwrap(e);
    }
}
