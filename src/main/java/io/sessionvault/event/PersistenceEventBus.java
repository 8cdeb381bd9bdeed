package io.sessionvault.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

public final class PersistenceEventBus {
    private static final Logger log = LoggerFactory.getLogger(PersistenceEventBus.class);

    private final Map<PersistenceEventType, CopyOnWriteArrayList<Consumer<PersistenceEvent>>> typed =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<PersistenceEvent>> global = new CopyOnWriteArrayList<>();

    public void publish(PersistenceEvent event) {
        log.debug("Publishing {} for session {}", event.type().wireName(), event.sessionId());
        List<Consumer<PersistenceEvent>> listeners = typed.get(event.type());
        if (listeners != null) {
            for (Consumer<PersistenceEvent> listener : listeners) {
                deliverSafely(listener, event);
            }
        }
        for (Consumer<PersistenceEvent> listener : global) {
            deliverSafely(listener, event);
        }
    }

    public Subscription subscribe(PersistenceEventType type, Consumer<PersistenceEvent> listener) {
        typed.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> {
            CopyOnWriteArrayList<Consumer<PersistenceEvent>> listeners = typed.get(type);
            if (listeners != null) {
                listeners.remove(listener);
            }
        };
    }

    public Subscription subscribeAll(Consumer<PersistenceEvent> listener) {
        global.add(listener);
        return () -> global.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PersistenceEvent> listener, PersistenceEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on event {}: {}", event.type().wireName(), e.getMessage(), e);
        }
    }
}
