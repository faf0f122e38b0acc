package io.tradehybrid.brokerlink.domain.broker;

/**
 * Venue credentials. Held only by the live adapter; never persisted.
 *
 * Field use per venue:
 * - ETRADE: apiKey (consumer key), apiSecret (consumer secret), accessToken, accessTokenSecret
 * - TRADOVATE: apiKey (app id), apiSecret (app secret, optional), username, password
 * - BINANCE: apiKey, apiSecret
 * - PAPER: none
 */
public record BrokerCredentials(
    Venue venue,
    String apiKey,
    String apiSecret,
    String accessToken,
    String accessTokenSecret,
    String username,
    String password,
    boolean sandbox
) {
    public BrokerCredentials {
        if (venue == null) {
            throw new IllegalArgumentException("Venue cannot be null");
        }
    }

    public static BrokerCredentials etrade(String consumerKey, String consumerSecret,
                                           String accessToken, String accessTokenSecret, boolean sandbox) {
        return new BrokerCredentials(Venue.ETRADE, consumerKey, consumerSecret, accessToken, accessTokenSecret,
            null, null, sandbox);
    }

    public static BrokerCredentials tradovate(String appId, String appSecret, String username,
                                              String password, boolean demo) {
        return new BrokerCredentials(Venue.TRADOVATE, appId, appSecret, null, null, username, password, demo);
    }

    public static BrokerCredentials binance(String apiKey, String apiSecret, boolean testnet) {
        return new BrokerCredentials(Venue.BINANCE, apiKey, apiSecret, null, null, null, null, testnet);
    }

    public static BrokerCredentials paper() {
        return new BrokerCredentials(Venue.PAPER, null, null, null, null, null, null, true);
    }

    @Override
    public String toString() {
        return "BrokerCredentials[venue=" + venue
            + ", apiKey=" + maskKey(apiKey)
            + ", username=" + (username == null ? null : maskKey(username))
            + ", sandbox=" + sandbox + "]";
    }

    /**
     * Mask a key for logging: first and last four characters only.
     */
    public static String maskKey(String key) {
        if (key == null || key.length() < 8) return "***";
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }
}
