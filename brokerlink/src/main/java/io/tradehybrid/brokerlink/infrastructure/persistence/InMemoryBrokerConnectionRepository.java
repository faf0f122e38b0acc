package io.tradehybrid.brokerlink.infrastructure.persistence;

import io.tradehybrid.brokerlink.application.port.output.BrokerConnectionRepository;
import io.tradehybrid.brokerlink.domain.broker.BrokerConnection;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store, used when no store path is configured and in tests.
 */
public final class InMemoryBrokerConnectionRepository implements BrokerConnectionRepository {
    private final Map<String, BrokerConnection> connections = new ConcurrentHashMap<>();

    @Override
    public List<BrokerConnection> findAll() {
        return List.copyOf(connections.values());
    }

    @Override
    public Optional<BrokerConnection> findById(String id) {
        return Optional.ofNullable(connections.get(id));
    }

    @Override
    public void save(BrokerConnection connection) {
        connections.put(connection.id(), connection);
    }

    @Override
    public boolean delete(String id) {
        return connections.remove(id) != null;
    }
}
