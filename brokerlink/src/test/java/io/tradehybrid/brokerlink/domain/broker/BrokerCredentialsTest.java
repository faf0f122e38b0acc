package io.tradehybrid.brokerlink.domain.broker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BrokerCredentialsTest {

    @Test
    void testToStringMasksSecrets() {
        BrokerCredentials credentials = BrokerCredentials.binance("ABCD1234EFGH5678", "super-secret-value", true);

        String text = credentials.toString();

        assertTrue(text.contains("ABCD****5678"), text);
        assertFalse(text.contains("super-secret-value"), text);
        assertFalse(text.contains("ABCD1234EFGH5678"), text);
    }

    @Test
    void testMaskKey() {
        assertEquals("***", BrokerCredentials.maskKey(null));
        assertEquals("***", BrokerCredentials.maskKey("short"));
        assertEquals("user****.com", BrokerCredentials.maskKey("username@example.com"));
    }

    @Test
    void testVenueRequired() {
        assertThrows(IllegalArgumentException.class,
            () -> new BrokerCredentials(null, "k", "s", null, null, null, null, false));
    }

    @Test
    void testFactoriesSetVenue() {
        assertEquals(Venue.ETRADE, BrokerCredentials.etrade("k", "s", "t", "ts", true).venue());
        assertEquals(Venue.TRADOVATE, BrokerCredentials.tradovate("app", null, "u", "p", true).venue());
        assertEquals(Venue.PAPER, BrokerCredentials.paper().venue());
        assertEquals(BrokerType.FUTURES, Venue.TRADOVATE.defaultType());
        assertEquals("E*TRADE", Venue.ETRADE.displayName());
    }
}
