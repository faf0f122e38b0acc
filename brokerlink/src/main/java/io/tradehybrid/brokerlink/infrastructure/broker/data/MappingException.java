package io.tradehybrid.brokerlink.infrastructure.broker.data;

/**
 * Exception thrown when a venue payload cannot be parsed into a normalized record.
 */
public class MappingException extends BrokerException {

    public MappingException(String brokerCode, String message) {
        super(brokerCode, message);
    }

    public MappingException(String brokerCode, String message, Throwable cause) {
        super(brokerCode, message, cause);
    }
}
