package io.tradehybrid.brokerlink.domain.broker;

import java.time.Instant;

/**
 * Aggregator-level record of a configured broker connection.
 * Holds only non-secret metadata so it can be persisted.
 */
public record BrokerConnection(
    String id,
    String name,
    BrokerType type,
    Venue venue,
    boolean connected,
    Instant lastConnected
) {
    public BrokerConnection markConnected(Instant at) {
        return new BrokerConnection(id, name, type, venue, true, at);
    }

    public BrokerConnection markDisconnected() {
        return new BrokerConnection(id, name, type, venue, false, lastConnected);
    }
}
