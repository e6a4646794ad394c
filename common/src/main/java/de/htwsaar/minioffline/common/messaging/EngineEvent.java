package de.htwsaar.minioffline.common.messaging;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fire-and-forget-Ereignis der Engine an den Host.
 *
 * @param type      Ereignistyp
 * @param timestamp Zeitpunkt der Erzeugung
 * @param data      Kontextdaten (z. B. Version, Mutation-ID)
 */
public record EngineEvent(EngineEventType type, Instant timestamp, Map<String, Object> data) {

    public EngineEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
