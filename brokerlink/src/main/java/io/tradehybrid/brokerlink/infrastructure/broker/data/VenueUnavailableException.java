package io.tradehybrid.brokerlink.infrastructure.broker.data;

/**
 * Exception thrown when the venue cannot be reached, times out, or answers 5xx/429.
 * Callers may retry later.
 */
public class VenueUnavailableException extends BrokerException {

    private final int statusCode;

    public VenueUnavailableException(String brokerCode, String message, Throwable cause) {
        this(brokerCode, -1, message, cause);
    }

    public VenueUnavailableException(String brokerCode, int statusCode, String message) {
        super(brokerCode, message + " (HTTP " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public VenueUnavailableException(String brokerCode, int statusCode, String message, Throwable cause) {
        super(brokerCode, message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status the venue answered with, or -1 for I/O failures and timeouts.
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
