package io.tradehybrid.brokerlink.application.service;

import io.tradehybrid.brokerlink.domain.common.BrokerEvent;
import io.tradehybrid.brokerlink.domain.common.BrokerEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous publish/subscribe keyed by event type.
 *
 * Listeners run on the publishing thread in subscription order. A throwing listener is logged
 * and the remaining listeners still run.
 */
public class BrokerEventBus {
    private static final Logger log = LoggerFactory.getLogger(BrokerEventBus.class);

    private final Map<BrokerEventType, List<Consumer<BrokerEvent>>> listeners = new EnumMap<>(BrokerEventType.class);

    public BrokerEventBus() {
        for (BrokerEventType type : BrokerEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * @return handle that removes this subscription when run
     */
    public Runnable subscribe(BrokerEventType type, Consumer<BrokerEvent> listener) {
        if (type == null || listener == null) {
            throw new IllegalArgumentException("Event type and listener are required");
        }
        // Wrap so the same listener can be subscribed twice and removed once
        Consumer<BrokerEvent> registration = listener::accept;
        List<Consumer<BrokerEvent>> list = listeners.get(type);
        list.add(registration);
        return () -> list.remove(registration);
    }

    public void publish(BrokerEvent event) {
        List<Consumer<BrokerEvent>> list = listeners.get(event.type());
        log.debug("[EventBus] {} for {} -> {} listeners", event.type(), event.brokerId(), list.size());
        for (Consumer<BrokerEvent> listener : list) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("[EventBus] Listener for {} threw: {}", event.type(), e.toString(), e);
            }
        }
    }

    public int listenerCount(BrokerEventType type) {
        return listeners.get(type).size();
    }
}
