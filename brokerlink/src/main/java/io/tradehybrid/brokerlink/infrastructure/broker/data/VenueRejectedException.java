package io.tradehybrid.brokerlink.infrastructure.broker.data;

/**
 * Exception thrown when the venue refuses a well-formed request (4xx other than auth and rate limit).
 */
public class VenueRejectedException extends BrokerException {

    private final int statusCode;
    private final String venueMessage;

    public VenueRejectedException(String brokerCode, int statusCode, String venueMessage) {
        super(brokerCode, "Venue rejected request (HTTP " + statusCode + "): " + venueMessage);
        this.statusCode = statusCode;
        this.venueMessage = venueMessage;
    }

    public VenueRejectedException(String brokerCode, int statusCode, String venueMessage,
                                  String message, Throwable cause) {
        super(brokerCode, message + ": " + venueMessage, cause);
        this.statusCode = statusCode;
        this.venueMessage = venueMessage;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Error text reported by the venue (msg / errorText / message field).
     */
    public String getVenueMessage() {
        return venueMessage;
    }
}
