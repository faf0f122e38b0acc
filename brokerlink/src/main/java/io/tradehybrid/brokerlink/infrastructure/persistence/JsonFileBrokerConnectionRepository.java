package io.tradehybrid.brokerlink.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.tradehybrid.brokerlink.application.port.output.BrokerConnectionRepository;
import io.tradehybrid.brokerlink.domain.broker.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Broker connections kept in one JSON array file.
 *
 * The file is read once on construction and rewritten (temp file, then atomic move) on every change.
 */
public final class JsonFileBrokerConnectionRepository implements BrokerConnectionRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileBrokerConnectionRepository.class);
    private static final TypeReference<List<BrokerConnection>> LIST_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, BrokerConnection> connections = new LinkedHashMap<>();

    /**
     * @throws UncheckedIOException if an existing file cannot be read or parsed
     */
    public JsonFileBrokerConnectionRepository(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    @Override
    public synchronized List<BrokerConnection> findAll() {
        return List.copyOf(connections.values());
    }

    @Override
    public synchronized Optional<BrokerConnection> findById(String id) {
        return Optional.ofNullable(connections.get(id));
    }

    @Override
    public synchronized void save(BrokerConnection connection) {
        connections.put(connection.id(), connection);
        write();
    }

    @Override
    public synchronized boolean delete(String id) {
        if (connections.remove(id) == null) {
            return false;
        }
        write();
        return true;
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("[STORE] No connection store at {}, starting empty", file);
            return;
        }
        try {
            List<BrokerConnection> stored = mapper.readValue(file.toFile(), LIST_TYPE);
            stored.forEach(c -> connections.put(c.id(), c));
            log.info("[STORE] Loaded {} broker connections from {}", connections.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read connection store " + file, e);
        }
    }

    private void write() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), new ArrayList<>(connections.values()));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("[STORE] Failed to write connection store {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Cannot write connection store " + file, e);
        }
    }
}
