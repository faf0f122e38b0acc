package io.tradehybrid.brokerlink.infrastructure.broker.data;

/**
 * Exception thrown when an operation is attempted before connect() succeeded.
 */
public class NotConnectedException extends BrokerException {

    public NotConnectedException(String brokerCode, String operation) {
        super(brokerCode, "Not connected: cannot " + operation);
    }
}
