package io.tradehybrid.brokerlink.broker.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryStatus;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.domain.order.OrderSide;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerAuthenticationException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.MappingException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueRejectedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.elements;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.number;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.optionalNumber;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.text;

/**
 * E*TRADE v1 REST payloads.
 *
 * Accounts are addressed by {@code accountIdKey}. Orders go through preview then place;
 * the place request repeats the preview body plus the returned preview id.
 */
public class ETradeCodec {

    public static final String BROKER_CODE = "ETRADE";

    private static final Set<String> CASH_EQUIVALENT_TYPES = Set.of("MMF", "MF_MMF", "MONEY_MARKET");

    private final ObjectMapper mapper;

    public ETradeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Fixed E*TRADE status table. Case-insensitive; null and unknown map to PENDING.
     */
    public static OrderHistoryStatus mapOrderStatus(String status) {
        if (status == null) {
            return OrderHistoryStatus.PENDING;
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "EXECUTED", "FILLED" -> OrderHistoryStatus.FILLED;
            case "CANCELLED", "REJECTED", "EXPIRED" -> OrderHistoryStatus.CANCELLED;
            // OPEN, PARTIAL, INDIVIDUAL_FILLS, CANCEL_REQUESTED, DO_NOT_EXERCISE
            default -> OrderHistoryStatus.PENDING;
        };
    }

    // ═══════════════════════════════════════════════════════════════
    // Accounts
    // ═══════════════════════════════════════════════════════════════

    /**
     * First account's accountIdKey from {@code GET /accounts/list}.
     */
    public String parseAccountIdKey(JsonNode body) {
        List<JsonNode> accounts = elements(body.path("AccountListResponse").path("Accounts").path("Account"));
        if (accounts.isEmpty()) {
            throw new BrokerAuthenticationException(BROKER_CODE, "No accounts found");
        }
        JsonNode first = accounts.get(0);
        String key = text(first, "accountIdKey");
        if (key == null) {
            key = text(first, "accountId");
        }
        if (key == null) {
            throw new MappingException(BROKER_CODE, "Account entry has no accountIdKey");
        }
        return key;
    }

    /**
     * {@code GET /accounts/{key}/balance}: total is the real-time account value, cash the cash balance.
     */
    public AccountBalance parseBalance(JsonNode body) {
        JsonNode computed = body.path("BalanceResponse").path("Computed");
        if (computed.isMissingNode()) {
            throw new MappingException(BROKER_CODE, "Balance response has no Computed section");
        }
        Double total = optionalNumber(computed.path("RealTimeValues"), "totalAccountValue");
        Double cash = optionalNumber(computed, "cashBalance");
        if (cash == null) {
            cash = optionalNumber(computed, "cashAvailableForInvestment");
        }
        if (total == null || cash == null) {
            throw new MappingException(BROKER_CODE, "Balance response missing totalAccountValue or cashBalance");
        }
        return AccountBalance.fromTotal(total, cash);
    }

    /**
     * {@code GET /accounts/{key}/portfolio}. Money-market funds and zero quantities are dropped;
     * short positions get a negative quantity.
     */
    public List<PositionLine> parsePositions(JsonNode body) {
        List<PositionLine> out = new ArrayList<>();
        for (JsonNode portfolio : elements(body.path("PortfolioResponse").path("AccountPortfolio"))) {
            for (JsonNode pos : elements(portfolio.path("Position"))) {
                JsonNode product = pos.path("Product");
                String securityType = text(product, "securityType");
                if (securityType != null && CASH_EQUIVALENT_TYPES.contains(securityType.toUpperCase(Locale.ROOT))) {
                    continue;
                }
                double quantity = number(pos, "quantity", 0);
                if (quantity == 0) {
                    continue;
                }
                if ("SHORT".equalsIgnoreCase(text(pos, "positionType")) && quantity > 0) {
                    quantity = -quantity;
                }
                String symbol = text(product, "symbol");
                if (symbol == null) {
                    symbol = text(pos, "symbolDescription");
                }
                if (symbol == null) {
                    throw new MappingException(BROKER_CODE, "Position without symbol");
                }
                Double average = optionalNumber(pos, "costPerShare");
                if (average == null) {
                    average = optionalNumber(pos, "pricePaid");
                }
                Double last = optionalNumber(pos.path("Quick"), "lastTrade");
                if (last == null) {
                    Double marketValue = optionalNumber(pos, "marketValue");
                    if (marketValue != null) {
                        last = marketValue / quantity;
                    }
                }
                out.add(new PositionLine(symbol, quantity, average == null ? 0 : average, last));
            }
        }
        return out;
    }

    // ═══════════════════════════════════════════════════════════════
    // Orders
    // ═══════════════════════════════════════════════════════════════

    public ObjectNode previewOrderRequest(OrderRequest request, String clientOrderId) {
        ObjectNode root = mapper.createObjectNode();
        root.set("PreviewOrderRequest", orderBody(request, clientOrderId));
        return root;
    }

    public ObjectNode placeOrderRequest(OrderRequest request, String clientOrderId, long previewId) {
        ObjectNode body = orderBody(request, clientOrderId);
        ArrayNode previewIds = body.putArray("PreviewIds");
        previewIds.addObject().put("previewId", previewId);
        ObjectNode root = mapper.createObjectNode();
        root.set("PlaceOrderRequest", body);
        return root;
    }

    private ObjectNode orderBody(OrderRequest request, String clientOrderId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("orderType", "EQ");
        body.put("clientOrderId", clientOrderId);

        ObjectNode order = body.putArray("Order").addObject();
        order.put("allOrNone", false);
        order.put("priceType", request.isLimit() ? "LIMIT" : "MARKET");
        order.put("orderTerm", "GOOD_FOR_DAY");
        order.put("marketSession", "REGULAR");
        if (request.isLimit()) {
            order.put("limitPrice", request.limitPrice());
        }

        ObjectNode instrument = order.putArray("Instrument").addObject();
        ObjectNode product = instrument.putObject("Product");
        product.put("securityType", "EQ");
        product.put("symbol", request.symbol().toUpperCase(Locale.ROOT));
        instrument.put("orderAction", request.side() == OrderSide.BUY ? "BUY" : "SELL");
        instrument.put("quantityType", "QUANTITY");
        instrument.put("quantity", request.quantity());
        return body;
    }

    public long parsePreviewId(JsonNode body) {
        List<JsonNode> ids = elements(body.path("PreviewOrderResponse").path("PreviewIds"));
        if (ids.isEmpty() || !ids.get(0).hasNonNull("previewId")) {
            throw new MappingException(BROKER_CODE, "Preview response has no previewId");
        }
        return ids.get(0).get("previewId").asLong();
    }

    public String parsePlacedOrderId(JsonNode body) {
        JsonNode response = body.path("PlaceOrderResponse");
        List<JsonNode> ids = elements(response.path("OrderIds"));
        String orderId = ids.isEmpty() ? null : text(ids.get(0), "orderId");
        if (orderId == null) {
            orderId = text(response, "orderId");
        }
        if (orderId == null) {
            throw new MappingException(BROKER_CODE, "Place order response has no orderId");
        }
        return orderId;
    }

    /**
     * Body for {@code PUT /accounts/{key}/orders/cancel}.
     */
    public ObjectNode cancelOrderRequest(String orderId) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode request = root.putObject("CancelOrderRequest");
        if (!orderId.isEmpty() && orderId.chars().allMatch(Character::isDigit)) {
            request.put("orderId", Long.parseLong(orderId));
        } else {
            request.put("orderId", orderId);
        }
        return root;
    }

    /**
     * Cancel responses echo the order id; an ERROR message means the venue refused.
     */
    public void checkCancelled(JsonNode body, String orderId) {
        JsonNode response = body.path("CancelOrderResponse");
        if (response.isMissingNode()) {
            throw new MappingException(BROKER_CODE, "Cancel response for order " + orderId + " is empty");
        }
        for (JsonNode message : elements(response.path("Messages").path("Message"))) {
            if ("ERROR".equalsIgnoreCase(text(message, "type"))) {
                String description = text(message, "description");
                throw new VenueRejectedException(BROKER_CODE, 200,
                    description != null ? description : "Cancel of order " + orderId + " refused");
            }
        }
    }

    /**
     * {@code GET /accounts/{key}/orders/{orderId}}: the orders envelope holding the one order.
     */
    public OrderHistoryRecord parseSingleOrder(JsonNode body, String orderId) {
        return parseOrders(body).stream()
            .filter(o -> o.orderId().equals(orderId))
            .findFirst()
            .orElseThrow(() -> new MappingException(BROKER_CODE, "Order " + orderId + " not in response"));
    }

    /**
     * {@code GET /accounts/{key}/orders}. Each order carries its details in OrderDetail[0];
     * flattened payloads with the fields on the order itself are accepted too.
     */
    public List<OrderHistoryRecord> parseOrders(JsonNode body) {
        List<OrderHistoryRecord> out = new ArrayList<>();
        for (JsonNode order : elements(body.path("OrdersResponse").path("Order"))) {
            List<JsonNode> details = elements(order.path("OrderDetail"));
            JsonNode detail = details.isEmpty() ? order : details.get(0);
            List<JsonNode> instruments = elements(detail.path("Instrument"));
            JsonNode instrument = instruments.isEmpty() ? mapper.createObjectNode() : instruments.get(0);

            String orderId = text(order, "orderId");
            String symbol = text(instrument.path("Product"), "symbol");
            OrderSide side = OrderSide.fromVenue(text(instrument, "orderAction"));
            if (orderId == null || symbol == null || side == null) {
                throw new MappingException(BROKER_CODE, "Order entry missing orderId, symbol or orderAction");
            }

            Double quantity = optionalNumber(instrument, "orderedQuantity");
            if (quantity == null) {
                quantity = optionalNumber(instrument, "quantity");
            }
            Double price = optionalNumber(instrument, "averageExecutionPrice");
            if (price == null || price == 0) {
                price = optionalNumber(instrument, "filledPrice");
            }
            if (price == null || price == 0) {
                price = optionalNumber(detail, "limitPrice");
            }

            String status = text(detail, "status");
            if (status == null) {
                status = text(order, "orderStatus");
            }
            Double placed = optionalNumber(detail, "placedTime");
            if (placed == null) {
                placed = optionalNumber(order, "orderDate");
            }

            out.add(new OrderHistoryRecord(orderId, symbol, side,
                quantity == null ? 0 : quantity, price == null ? 0 : price,
                mapOrderStatus(status), placed == null ? 0 : placed.longValue(), BROKER_CODE));
        }
        return out;
    }

    // ═══════════════════════════════════════════════════════════════
    // Market data
    // ═══════════════════════════════════════════════════════════════

    /**
     * {@code GET /market/quote/{symbol}?detailFlag=ALL}.
     */
    public MarketData parseQuote(JsonNode body, String symbol, long receivedAt) {
        JsonNode response = body.path("QuoteResponse");
        List<JsonNode> quotes = elements(response.path("QuoteData"));
        if (quotes.isEmpty()) {
            String message = text(response.path("Messages").path("Message").path(0), "description");
            throw new MappingException(BROKER_CODE, "No quote for " + symbol + (message != null ? ": " + message : ""));
        }
        JsonNode quote = quotes.get(0);
        JsonNode all = quote.path("All");
        Double last = optionalNumber(all, "lastTrade");
        if (last == null) {
            throw new MappingException(BROKER_CODE, "Quote for " + symbol + " has no lastTrade");
        }
        Double epochSeconds = optionalNumber(quote, "dateTimeUTC");
        long timestamp = epochSeconds != null && epochSeconds > 0 ? epochSeconds.longValue() * 1000 : receivedAt;
        return new MarketData(symbol, last, timestamp,
            optionalNumber(all, "totalVolume"),
            optionalNumber(all, "high"),
            optionalNumber(all, "low"),
            optionalNumber(all, "open"),
            optionalNumber(all, "previousClose"),
            optionalNumber(all, "bid"),
            optionalNumber(all, "ask"));
    }
}
