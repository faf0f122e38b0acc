package io.tradehybrid.brokerlink.infrastructure.broker.data;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Helpers for normalizing failures into the broker exception hierarchy.
 */
public final class BrokerExceptions {

    /**
     * Strip CompletionException / ExecutionException wrappers.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Re-raise a failure as the same category with a normalized message, keeping the original as cause.
     * Local failures (invalid order, not connected) pass through unchanged.
     */
    public static BrokerException normalize(String brokerCode, String message, Throwable failure) {
        Throwable cause = unwrap(failure);

        if (cause instanceof InvalidOrderException || cause instanceof NotConnectedException) {
            return (BrokerException) cause;
        }
        if (cause instanceof BrokerAuthenticationException) {
            return new BrokerAuthenticationException(brokerCode, message, cause);
        }
        if (cause instanceof VenueUnavailableException vu) {
            return new VenueUnavailableException(brokerCode, vu.getStatusCode(), message, cause);
        }
        if (cause instanceof VenueRejectedException vr) {
            return new VenueRejectedException(brokerCode, vr.getStatusCode(), vr.getVenueMessage(), message, cause);
        }
        if (cause instanceof MappingException) {
            return new MappingException(brokerCode, message, cause);
        }
        if (cause instanceof BrokerException) {
            return new BrokerException(brokerCode, message, cause);
        }
        if (cause instanceof IOException || cause instanceof TimeoutException) {
            return new VenueUnavailableException(brokerCode, message, cause);
        }
        // Anything else escaped a codec while reading a payload
        return new MappingException(brokerCode, message, cause);
    }

    private BrokerExceptions() {}
}
