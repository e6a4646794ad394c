package de.htwsaar.minioffline.common.messaging;

import java.time.Duration;

/**
 * Die Engine hat innerhalb der Frist nicht auf eine Nachricht geantwortet.
 */
public class MessageTimeoutException extends RuntimeException {

    private final MessageType type;
    private final String correlationId;

    public MessageTimeoutException(MessageType type, String correlationId, Duration timeout) {
        super("No reply for " + type + " [" + correlationId + "] within " + timeout.toMillis() + " ms");
        this.type = type;
        this.correlationId = correlationId;
    }

    public MessageType getType() {
        return type;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
