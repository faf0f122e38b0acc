package io.tradehybrid.brokerlink.domain.broker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountBalanceTest {

    @Test
    void testFactoriesKeepTotalConsistent() {
        AccountBalance fromParts = AccountBalance.of(700.0, 300.0);
        AccountBalance fromTotal = AccountBalance.fromTotal(1000.0, 700.0);

        assertEquals(1000.0, fromParts.total());
        assertEquals(fromParts, fromTotal);
    }

    @Test
    void testNegativeCashAllowedWhenSumHolds() {
        AccountBalance margin = AccountBalance.of(-200.0, 1200.0);

        assertEquals(1000.0, margin.total());
    }

    @Test
    void testInconsistentTotalRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new AccountBalance(1000.0, 700.0, 200.0));
        assertTrue(e.getMessage().contains("does not add up"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new AccountBalance(Double.NaN, 0, 0));
    }

    @Test
    void testRoundingWithinTolerance() {
        assertDoesNotThrow(() -> new AccountBalance(0.3, 0.1, 0.2));
    }
}
