package io.tradehybrid.brokerlink.domain.broker;

/**
 * Account balance in the venue's base currency.
 *
 * Invariant: {@code total == cash + positions} within {@link #EPSILON}.
 * Built fresh on every fetch and never cached.
 */
public record AccountBalance(
    double total,
    double cash,
    double positions
) {
    public static final double EPSILON = 1e-6;

    public AccountBalance {
        if (Double.isNaN(total) || Double.isNaN(cash) || Double.isNaN(positions)) {
            throw new IllegalArgumentException("Balance values cannot be NaN");
        }
        if (Math.abs(total - (cash + positions)) > EPSILON * Math.max(1.0, Math.abs(total))) {
            throw new IllegalArgumentException(
                "Balance does not add up: total=" + total + " cash=" + cash + " positions=" + positions);
        }
    }

    /**
     * Balance from cash and the market value of open positions.
     */
    public static AccountBalance of(double cash, double positions) {
        return new AccountBalance(cash + positions, cash, positions);
    }

    /**
     * Balance from a venue-reported total (net liquidation / account value) and cash.
     * Positions are derived as the remainder.
     */
    public static AccountBalance fromTotal(double total, double cash) {
        return new AccountBalance(total, cash, total - cash);
    }
}
