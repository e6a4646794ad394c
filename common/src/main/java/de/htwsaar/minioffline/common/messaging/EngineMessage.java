package de.htwsaar.minioffline.common.messaging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Anfrage des Hosts an die Engine.
 *
 * @param correlationId eindeutige ID, die in der Antwort gespiegelt wird
 * @param type          Nachrichtentyp
 * @param data          typabhängige Nutzdaten (darf leer sein)
 */
public record EngineMessage(String correlationId, MessageType type, Map<String, Object> data) {

    public EngineMessage {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
