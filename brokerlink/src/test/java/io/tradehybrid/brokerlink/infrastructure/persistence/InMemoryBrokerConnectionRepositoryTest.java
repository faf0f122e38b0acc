package io.tradehybrid.brokerlink.infrastructure.persistence;

import io.tradehybrid.brokerlink.domain.broker.BrokerConnection;
import io.tradehybrid.brokerlink.domain.broker.BrokerType;
import io.tradehybrid.brokerlink.domain.broker.Venue;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBrokerConnectionRepositoryTest {

    @Test
    void testSaveFindDelete() {
        InMemoryBrokerConnectionRepository repo = new InMemoryBrokerConnectionRepository();
        BrokerConnection connection = new BrokerConnection("p1", "Paper", BrokerType.STOCKS, Venue.PAPER,
            true, Instant.now());

        repo.save(connection);
        repo.save(connection.markDisconnected());

        assertEquals(1, repo.findAll().size());
        assertFalse(repo.findById("p1").orElseThrow().connected());
        assertTrue(repo.delete("p1"));
        assertFalse(repo.delete("p1"));
        assertTrue(repo.findById("p1").isEmpty());
    }
}
