package io.tradehybrid.brokerlink.infrastructure.broker.data;

import io.tradehybrid.brokerlink.domain.order.OrderRequest;

/**
 * Exception thrown when an order fails local validation. Nothing was sent to the venue.
 */
public class InvalidOrderException extends BrokerException {

    private final OrderRequest request;

    public InvalidOrderException(String brokerCode, OrderRequest request, String message) {
        super(brokerCode, message);
        this.request = request;
    }

    public OrderRequest getRequest() {
        return request;
    }
}
