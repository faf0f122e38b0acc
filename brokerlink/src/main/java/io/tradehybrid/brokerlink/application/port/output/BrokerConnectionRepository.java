package io.tradehybrid.brokerlink.application.port.output;

import io.tradehybrid.brokerlink.domain.broker.BrokerConnection;

import java.util.List;
import java.util.Optional;

/**
 * Store for non-secret broker connection metadata.
 */
public interface BrokerConnectionRepository {
    List<BrokerConnection> findAll();

    Optional<BrokerConnection> findById(String id);

    /**
     * Insert or replace by id.
     */
    void save(BrokerConnection connection);

    boolean delete(String id);
}
