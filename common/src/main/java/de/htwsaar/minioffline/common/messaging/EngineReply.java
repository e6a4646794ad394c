package de.htwsaar.minioffline.common.messaging;

/**
 * Genau eine Antwort je {@link EngineMessage}.
 *
 * @param correlationId ID der beantworteten Nachricht
 * @param success       {@code true}, wenn die Engine die Nachricht verarbeitet hat
 * @param data          Ergebnisdaten (optional)
 * @param error         Fehlerbeschreibung bei {@code success == false}
 */
public record EngineReply(String correlationId, boolean success, Object data, String error) {

    public static EngineReply ok(String correlationId, Object data) {
        return new EngineReply(correlationId, true, data, null);
    }

    public static EngineReply failure(String correlationId, String error) {
        return new EngineReply(correlationId, false, null, error);
    }
}
