package io.tradehybrid.brokerlink.infrastructure.broker.data;

/**
 * Exception thrown when broker authentication fails.
 */
public class BrokerAuthenticationException extends BrokerException {

    public BrokerAuthenticationException(String brokerCode, String message) {
        super(brokerCode, message);
    }

    public BrokerAuthenticationException(String brokerCode, String message, Throwable cause) {
        super(brokerCode, message, cause);
    }
}
