package io.tradehybrid.brokerlink.infrastructure.broker.data;

/**
 * Base for every failure raised by a broker adapter.
 * Unchecked; adapters complete their futures exceptionally with a subtype.
 */
public class BrokerException extends RuntimeException {

    private final String brokerCode;

    public BrokerException(String brokerCode, String message) {
        super(String.format("[%s] %s", brokerCode, message));
        this.brokerCode = brokerCode;
    }

    public BrokerException(String brokerCode, String message, Throwable cause) {
        super(String.format("[%s] %s", brokerCode, message), cause);
        this.brokerCode = brokerCode;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    /**
     * Whether the caller may retry the same request later.
     */
    public boolean isRetryable() {
        return false;
    }
}
