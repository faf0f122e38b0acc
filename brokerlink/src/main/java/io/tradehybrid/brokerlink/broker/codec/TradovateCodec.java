package io.tradehybrid.brokerlink.broker.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryStatus;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.domain.order.OrderSide;
import io.tradehybrid.brokerlink.infrastructure.broker.common.TokenRefreshManager.TokenInfo;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerAuthenticationException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.InvalidOrderException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.MappingException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueRejectedException;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.elements;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.number;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.optionalNumber;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.text;

/**
 * Tradovate v1 REST payloads.
 */
public class TradovateCodec {

    public static final String BROKER_CODE = "TRADOVATE";
    public static final String APP_VERSION = "1.0";
    public static final String DEVICE_ID = "brokerlink-gateway";

    /** Token lifetime assumed when the venue omits expirationTime. */
    private static final Duration DEFAULT_TOKEN_TTL = Duration.ofMinutes(80);

    private final ObjectMapper mapper;

    public TradovateCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Fixed Tradovate status table. Case-insensitive; null and unknown map to PENDING.
     */
    public static OrderHistoryStatus mapOrderStatus(String status) {
        if (status == null) {
            return OrderHistoryStatus.PENDING;
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "COMPLETED", "FILLED" -> OrderHistoryStatus.FILLED;
            case "REJECTED", "CANCELED", "CANCELLED", "EXPIRED" -> OrderHistoryStatus.CANCELLED;
            // PARTIAL, ACCEPTED, WORKING, OPEN, PENDINGNEW, PENDINGCANCEL, PENDINGREPLACE, SUSPENDED
            default -> OrderHistoryStatus.PENDING;
        };
    }

    // ═══════════════════════════════════════════════════════════════
    // Auth
    // ═══════════════════════════════════════════════════════════════

    /**
     * Body for {@code POST /auth/accessTokenRequest}. cid/sec are sent only when an app secret is configured.
     */
    public ObjectNode accessTokenRequest(BrokerCredentials credentials) {
        ObjectNode body = mapper.createObjectNode();
        body.put("name", credentials.username());
        body.put("password", credentials.password());
        body.put("appId", credentials.apiKey());
        body.put("appVersion", APP_VERSION);
        body.put("deviceId", DEVICE_ID);
        if (credentials.apiSecret() != null && !credentials.apiSecret().isBlank()) {
            body.put("cid", credentials.apiKey());
            body.put("sec", credentials.apiSecret());
        }
        return body;
    }

    /**
     * Access token from {@code accessTokenRequest} or {@code renewAccessToken}.
     * Tradovate reports bad credentials as HTTP 200 with {@code errorText}.
     */
    public TokenInfo parseAccessToken(JsonNode body, Instant now) {
        String errorText = text(body, "errorText");
        if (errorText != null && !errorText.isBlank()) {
            throw new BrokerAuthenticationException(BROKER_CODE, errorText);
        }
        String token = text(body, "accessToken");
        if (token == null || token.isBlank()) {
            throw new BrokerAuthenticationException(BROKER_CODE, "No access token in response");
        }
        Instant expiresAt = now.plus(DEFAULT_TOKEN_TTL);
        String expiration = text(body, "expirationTime");
        if (expiration != null) {
            try {
                expiresAt = Instant.parse(expiration);
            } catch (DateTimeParseException e) {
                throw new MappingException(BROKER_CODE, "Unparseable expirationTime: " + expiration, e);
            }
        }
        return new TokenInfo(token, expiresAt);
    }

    /**
     * First active account from {@code GET /account/list}, else the first account.
     */
    public String parseAccountId(JsonNode body) {
        List<JsonNode> accounts = elements(body);
        if (accounts.isEmpty()) {
            throw new BrokerAuthenticationException(BROKER_CODE, "No accounts found for user");
        }
        JsonNode chosen = accounts.stream()
            .filter(a -> a.path("active").asBoolean(false))
            .findFirst()
            .orElse(accounts.get(0));
        String id = text(chosen, "id");
        if (id == null) {
            throw new MappingException(BROKER_CODE, "Account entry has no id");
        }
        return id;
    }

    /**
     * Account name (Tradovate's accountSpec) of the given account, or the id itself when not listed.
     */
    public String parseAccountSpec(JsonNode body, String accountId) {
        for (JsonNode account : elements(body)) {
            if (accountId.equals(text(account, "id")) && text(account, "name") != null) {
                return text(account, "name");
            }
        }
        return accountId;
    }

    // ═══════════════════════════════════════════════════════════════
    // Balance and positions
    // ═══════════════════════════════════════════════════════════════

    /**
     * Balance from {@code GET /account/item} and {@code GET /cashBalance/list}.
     * Cash is the sum of the account's cash balance amounts; total is netLiq when reported, else cash.
     */
    public AccountBalance parseBalance(JsonNode accountItem, JsonNode cashBalances, String accountId) {
        if (!cashBalances.isArray()) {
            throw new MappingException(BROKER_CODE, "Cash balance list is not an array");
        }
        double cash = 0;
        for (JsonNode item : cashBalances) {
            String owner = text(item, "accountId");
            if (owner == null || owner.equals(accountId)) {
                cash += number(item, "amount", 0);
            }
        }
        Double netLiq = optionalNumber(accountItem, "netLiq");
        if (netLiq == null || netLiq == 0) {
            return AccountBalance.of(cash, 0);
        }
        return AccountBalance.fromTotal(netLiq, cash);
    }

    /**
     * {@code GET /position/list}. Flat positions (netPos 0) are dropped.
     */
    public List<PositionLine> parsePositions(JsonNode body) {
        List<PositionLine> out = new ArrayList<>();
        for (JsonNode pos : elements(body)) {
            double netPos = number(pos, "netPos", 0);
            if (netPos == 0) {
                continue;
            }
            String symbol = text(pos, "symbol");
            if (symbol == null) {
                symbol = text(pos, "contractId");
            }
            if (symbol == null) {
                throw new MappingException(BROKER_CODE, "Position without symbol or contractId");
            }
            Double average = optionalNumber(pos, "netPrice");
            if (average == null) {
                average = optionalNumber(pos, "avgPrice");
            }
            out.add(new PositionLine(symbol, netPos, average == null ? 0 : average, optionalNumber(pos, "lastPrice")));
        }
        return out;
    }

    // ═══════════════════════════════════════════════════════════════
    // Orders
    // ═══════════════════════════════════════════════════════════════

    /**
     * Futures trade in whole contracts.
     *
     * @throws InvalidOrderException if the quantity has a fractional part
     */
    public static void requireWholeContracts(OrderRequest request) {
        double quantity = request.quantity();
        if (quantity != Math.rint(quantity) || quantity > Long.MAX_VALUE) {
            throw new InvalidOrderException(BROKER_CODE, request,
                "Tradovate orders need a whole number of contracts, got " + quantity);
        }
    }

    /**
     * Body for {@code POST /order/placeorder}.
     *
     * @throws InvalidOrderException if the quantity is not a whole number of contracts
     */
    public ObjectNode placeOrderRequest(OrderRequest request, String accountId, String accountSpec) {
        requireWholeContracts(request);
        ObjectNode body = mapper.createObjectNode();
        body.put("accountSpec", accountSpec);
        if (accountId.chars().allMatch(Character::isDigit)) {
            body.put("accountId", Long.parseLong(accountId));
        } else {
            body.put("accountId", accountId);
        }
        body.put("action", request.side() == OrderSide.BUY ? "Buy" : "Sell");
        body.put("symbol", request.symbol());
        body.put("orderQty", (long) request.quantity());
        body.put("orderType", request.isLimit() ? "Limit" : "Market");
        if (request.isLimit()) {
            body.put("price", request.limitPrice());
        }
        body.put("isAutomated", true);
        return body;
    }

    public String parsePlacedOrderId(JsonNode body) {
        checkCommandFailure(body);
        String orderId = text(body, "orderId");
        if (orderId == null) {
            throw new MappingException(BROKER_CODE, "Place order response has no orderId");
        }
        return orderId;
    }

    /**
     * Body for {@code POST /order/cancelorder}.
     */
    public ObjectNode cancelOrderRequest(String orderId) {
        ObjectNode body = mapper.createObjectNode();
        if (!orderId.isEmpty() && orderId.chars().allMatch(Character::isDigit)) {
            body.put("orderId", Long.parseLong(orderId));
        } else {
            body.put("orderId", orderId);
        }
        body.put("isAutomated", true);
        return body;
    }

    /**
     * Command replies ({@code placeorder}, {@code cancelorder}) answer 200 and carry the refusal in
     * {@code failureText} or {@code failureReason}.
     */
    public void checkCommandFailure(JsonNode body) {
        String failure = text(body, "failureText");
        if (failure == null) {
            failure = text(body, "failureReason");
        }
        if (failure != null && !failure.isBlank() && !"Success".equalsIgnoreCase(failure)) {
            throw new VenueRejectedException(BROKER_CODE, 200, failure);
        }
    }

    /**
     * {@code GET /order/item?id=}: a single order entity.
     */
    public OrderHistoryRecord parseOrder(JsonNode body, String orderId) {
        if (!body.isObject() || body.isEmpty()) {
            throw new MappingException(BROKER_CODE, "Order " + orderId + " not found");
        }
        return parseOrders(body).get(0);
    }

    /**
     * {@code GET /order/list}.
     */
    public List<OrderHistoryRecord> parseOrders(JsonNode body) {
        List<OrderHistoryRecord> out = new ArrayList<>();
        for (JsonNode order : elements(body)) {
            String id = text(order, "id");
            OrderSide side = OrderSide.fromVenue(text(order, "action"));
            String symbol = text(order, "symbol");
            if (symbol == null) {
                symbol = text(order, "contractId");
            }
            if (id == null || side == null || symbol == null) {
                throw new MappingException(BROKER_CODE, "Order entry missing id, action or symbol");
            }
            Double qty = optionalNumber(order, "qty");
            if (qty == null) {
                qty = optionalNumber(order, "orderQty");
            }
            Double price = optionalNumber(order, "price");
            if (price == null) {
                price = optionalNumber(order, "stopPrice");
            }
            String status = text(order, "ordStatus");
            if (status == null) {
                status = text(order, "status");
            }
            out.add(new OrderHistoryRecord(id, symbol, side, qty == null ? 0 : qty, price == null ? 0 : price,
                mapOrderStatus(status), parseTimestamp(text(order, "timestamp")), BROKER_CODE));
        }
        return out;
    }

    // ═══════════════════════════════════════════════════════════════
    // Market data
    // ═══════════════════════════════════════════════════════════════

    /**
     * Quote snapshot from {@code GET /md/getQuote}. Price is last, else bid, else ask.
     */
    public MarketData parseQuote(JsonNode body, String symbol, long receivedAt) {
        Double last = optionalNumber(body, "last");
        Double bid = optionalNumber(body, "bid");
        Double ask = optionalNumber(body, "ask");
        Double price = last != null ? last : bid != null ? bid : ask;
        if (price == null) {
            throw new MappingException(BROKER_CODE, "Quote for " + symbol + " has no price");
        }
        long timestamp = parseTimestamp(text(body, "timestamp"));
        return new MarketData(symbol, price, timestamp > 0 ? timestamp : receivedAt,
            optionalNumber(body, "volume"),
            orElse(optionalNumber(body, "high"), last),
            orElse(optionalNumber(body, "low"), last),
            orElse(optionalNumber(body, "open"), last),
            last,
            bid,
            ask);
    }

    private static Double orElse(Double value, Double fallback) {
        return value != null ? value : fallback;
    }

    private long parseTimestamp(String iso) {
        if (iso == null || iso.isBlank()) {
            return 0;
        }
        try {
            return Instant.parse(iso).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new MappingException(BROKER_CODE, "Unparseable timestamp: " + iso, e);
        }
    }
}
