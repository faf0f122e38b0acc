package io.tradehybrid.brokerlink.domain.order;

/**
 * Order side.
 */
public enum OrderSide {
    BUY,
    SELL;

    /**
     * Parse a venue side string (BUY, Buy, buy).
     * Returns null when the value is not a known side.
     */
    public static OrderSide fromVenue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toUpperCase()) {
            case "BUY", "B" -> BUY;
            case "SELL", "S", "SELL_SHORT" -> SELL;
            default -> null;
        };
    }
}
