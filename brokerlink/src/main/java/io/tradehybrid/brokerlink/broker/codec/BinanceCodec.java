package io.tradehybrid.brokerlink.broker.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tradehybrid.brokerlink.domain.broker.AccountBalance;
import io.tradehybrid.brokerlink.domain.broker.BrokerPosition;
import io.tradehybrid.brokerlink.domain.data.MarketData;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryRecord;
import io.tradehybrid.brokerlink.domain.order.OrderHistoryStatus;
import io.tradehybrid.brokerlink.domain.order.OrderRequest;
import io.tradehybrid.brokerlink.domain.order.OrderSide;
import io.tradehybrid.brokerlink.infrastructure.broker.data.MappingException;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.number;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.optionalNumber;
import static io.tradehybrid.brokerlink.broker.codec.JsonSupport.text;

/**
 * Binance spot REST and stream payloads.
 *
 * Signed endpoints carry {@code timestamp} and {@code recvWindow} in the query string,
 * followed by an HMAC-SHA256 {@code signature} over everything before it.
 */
public class BinanceCodec {

    public static final String BROKER_CODE = "BINANCE";
    public static final long DEFAULT_RECV_WINDOW = 5000;

    /** Assets counted as cash. */
    public static final Set<String> STABLECOINS = Set.of("USDT", "BUSD", "USDC", "DAI", "FDUSD", "TUSD");

    private final ObjectMapper mapper;

    public BinanceCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Fixed Binance status table. Case-insensitive; null and unknown map to PENDING.
     */
    public static OrderHistoryStatus mapOrderStatus(String status) {
        if (status == null) {
            return OrderHistoryStatus.PENDING;
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "FILLED" -> OrderHistoryStatus.FILLED;
            case "CANCELED", "REJECTED", "EXPIRED", "EXPIRED_IN_MATCH" -> OrderHistoryStatus.CANCELLED;
            // NEW, PARTIALLY_FILLED, PENDING_NEW, PENDING_CANCEL
            default -> OrderHistoryStatus.PENDING;
        };
    }

    /**
     * Venue symbol for a caller symbol: "btc/usd" becomes "BTCUSDT", "ETH-USDC" becomes "ETHUSDC".
     */
    public static String toVenueSymbol(String symbol) {
        String s = symbol.trim().toUpperCase(Locale.ROOT).replace("/", "").replace("-", "");
        if (s.endsWith("USDT") || s.endsWith("BUSD") || s.endsWith("USDC")) {
            return s;
        }
        if (s.endsWith("USD")) {
            return s + "T";
        }
        return s;
    }

    // ═══════════════════════════════════════════════════════════════
    // Signing
    // ═══════════════════════════════════════════════════════════════

    /**
     * Query string with timestamp, recvWindow and signature appended, parameters kept in insertion order.
     */
    public static String signedQuery(Map<String, String> params, long timestamp, long recvWindow, String secret) {
        Map<String, String> all = new LinkedHashMap<>(params);
        all.put("recvWindow", Long.toString(recvWindow));
        all.put("timestamp", Long.toString(timestamp));
        String query = query(all);
        return query + "&signature=" + HmacSigner.sha256Hex(secret, query);
    }

    public static String query(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    // ═══════════════════════════════════════════════════════════════
    // Account
    // ═══════════════════════════════════════════════════════════════

    /**
     * Account id from {@code GET /api/v3/account}: uid when present, else derived from the API key.
     */
    public String parseAccountId(JsonNode account, String apiKey) {
        String uid = text(account, "uid");
        if (uid != null && !uid.isBlank()) {
            return uid;
        }
        String key = apiKey == null ? "" : apiKey;
        return "key-" + key.substring(0, Math.min(8, key.length()));
    }

    /**
     * Non-zero holdings (free + locked) by asset.
     */
    public Map<String, Double> parseBalances(JsonNode account) {
        JsonNode balances = account.path("balances");
        if (!balances.isArray()) {
            throw new MappingException(BROKER_CODE, "Account response has no balances array");
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (JsonNode b : balances) {
            String asset = text(b, "asset");
            double amount = number(b, "free", 0) + number(b, "locked", 0);
            if (asset != null && amount > 0) {
                out.put(asset, amount);
            }
        }
        return out;
    }

    /**
     * Symbol to last price from {@code GET /api/v3/ticker/price} without a symbol parameter.
     */
    public Map<String, Double> parseTickerPrices(JsonNode body) {
        if (!body.isArray()) {
            throw new MappingException(BROKER_CODE, "Ticker price response is not an array");
        }
        Map<String, Double> out = new HashMap<>();
        for (JsonNode t : body) {
            String symbol = text(t, "symbol");
            Double price = optionalNumber(t, "price");
            if (symbol != null && price != null) {
                out.put(symbol, price);
            }
        }
        return out;
    }

    /**
     * Last price of one asset in USD terms: asset+USDT, else asset+BUSD, else 0.
     */
    public static double usdPrice(String asset, Map<String, Double> prices) {
        Double price = prices.get(asset + "USDT");
        if (price == null) {
            price = prices.get(asset + "BUSD");
        }
        return price != null ? price : 0;
    }

    public AccountBalance computeBalance(Map<String, Double> holdings, Map<String, Double> prices) {
        double cash = 0;
        double positions = 0;
        for (Map.Entry<String, Double> e : holdings.entrySet()) {
            if (STABLECOINS.contains(e.getKey())) {
                cash += e.getValue();
            } else {
                positions += e.getValue() * usdPrice(e.getKey(), prices);
            }
        }
        return AccountBalance.of(cash, positions);
    }

    /**
     * Non-stablecoin holdings as positions. Binance reports no cost basis, so average price is the current price.
     */
    public List<BrokerPosition> positionsFrom(Map<String, Double> holdings, Map<String, Double> prices) {
        List<BrokerPosition> out = new ArrayList<>();
        for (Map.Entry<String, Double> e : holdings.entrySet()) {
            if (STABLECOINS.contains(e.getKey())) {
                continue;
            }
            double price = usdPrice(e.getKey(), prices);
            out.add(BrokerPosition.of(e.getKey(), e.getValue(), price, price));
        }
        return out;
    }

    // ═══════════════════════════════════════════════════════════════
    // Orders
    // ═══════════════════════════════════════════════════════════════

    /**
     * Unsigned parameters for {@code POST /api/v3/order}.
     */
    public Map<String, String> orderParams(OrderRequest request, String clientOrderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toVenueSymbol(request.symbol()));
        params.put("side", request.side().name());
        params.put("type", request.type().name());
        params.put("quantity", plain(request.quantity()));
        if (request.isLimit()) {
            params.put("price", plain(request.limitPrice()));
            params.put("timeInForce", "GTC");
        }
        params.put("newClientOrderId", clientOrderId);
        return params;
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public String parseOrderId(JsonNode body) {
        String id = text(body, "orderId");
        if (id == null) {
            throw new MappingException(BROKER_CODE, "Order response has no orderId");
        }
        return id;
    }

    /**
     * {@code GET /api/v3/allOrders} for one venue symbol. Records carry the caller's symbol.
     */
    public List<OrderHistoryRecord> parseOrders(JsonNode body, String symbol) {
        if (!body.isArray()) {
            throw new MappingException(BROKER_CODE, "Order list is not an array");
        }
        List<OrderHistoryRecord> out = new ArrayList<>();
        for (JsonNode order : body) {
            out.add(parseOrder(order, symbol));
        }
        return out;
    }

    /**
     * One order object, as returned by {@code GET /api/v3/order} or inside {@code allOrders}.
     * Market orders report no price; the fill price is derived from the quote quantity.
     */
    public OrderHistoryRecord parseOrder(JsonNode order, String symbol) {
        String id = text(order, "orderId");
        OrderSide side = OrderSide.fromVenue(text(order, "side"));
        if (id == null || side == null) {
            throw new MappingException(BROKER_CODE, "Order entry missing orderId or side");
        }
        double qty = number(order, "origQty", 0);
        double price = number(order, "price", 0);
        if (price == 0) {
            double executed = number(order, "executedQty", 0);
            double quote = number(order, "cummulativeQuoteQty", 0);
            if (executed > 0) {
                price = quote / executed;
            }
        }
        long time = (long) number(order, "time", number(order, "transactTime", 0));
        return new OrderHistoryRecord(id, symbol, side, qty, price,
            mapOrderStatus(text(order, "status")), time, BROKER_CODE);
    }

    /**
     * Venue symbol of an order in {@code GET /api/v3/openOrders}, or null when it is not open.
     */
    public String findOpenOrderSymbol(JsonNode openOrders, String orderId) {
        if (!openOrders.isArray()) {
            throw new MappingException(BROKER_CODE, "Open order list is not an array");
        }
        for (JsonNode order : openOrders) {
            if (orderId.equals(text(order, "orderId"))) {
                return text(order, "symbol");
            }
        }
        return null;
    }

    /**
     * {@code DELETE /api/v3/order} answers with the cancelled order.
     */
    public void checkCancelled(JsonNode body, String orderId) {
        String status = text(body, "status");
        if (status == null) {
            throw new MappingException(BROKER_CODE, "Cancel response for order " + orderId + " has no status");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Market data
    // ═══════════════════════════════════════════════════════════════

    /**
     * {@code GET /api/v3/ticker/bookTicker?symbol=}. Price is the bid/ask midpoint.
     */
    public MarketData parseBookTicker(JsonNode body, String symbol, long receivedAt) {
        Double bid = optionalNumber(body, "bidPrice");
        Double ask = optionalNumber(body, "askPrice");
        if (bid == null || ask == null) {
            throw new MappingException(BROKER_CODE, "Book ticker for " + symbol + " has no bid/ask");
        }
        double price = bid > 0 && ask > 0 ? (bid + ask) / 2 : Math.max(bid, ask);
        return new MarketData(symbol, price, receivedAt, null, null, null, null, null, bid, ask);
    }

    /**
     * One {@code <symbol>@trade} stream frame. Control frames without a price yield null.
     */
    public MarketData parseTrade(String frame, String symbol) {
        JsonNode node;
        try {
            node = mapper.readTree(frame);
        } catch (IOException e) {
            throw new MappingException(BROKER_CODE, "Unparseable trade frame", e);
        }
        Double price = optionalNumber(node, "p");
        if (price == null) {
            return null;
        }
        long time = (long) number(node, "T", number(node, "E", System.currentTimeMillis()));
        return new MarketData(symbol, price, time, optionalNumber(node, "q"),
            null, null, null, null, null, null);
    }
}
