package io.sessionvault.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PersistenceEvent(
        PersistenceEventType type,
        String sessionId,
        Map<String, Object> payload,
        Instant timestamp
) {
    public PersistenceEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object get(String key) {
        return payload.get(key);
    }
}
