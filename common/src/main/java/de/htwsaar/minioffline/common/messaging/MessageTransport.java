package de.htwsaar.minioffline.common.messaging;

import java.util.function.Consumer;

/**
 * Port für den Nachrichtenkanal zwischen Host und Engine.
 * HTTP heute, In-Process-Kanal in Tests; der {@link CorrelatingMessenger} bleibt unberührt.
 */
public interface MessageTransport {

    /**
     * Stellt eine Nachricht zu. Die Antwort wird asynchron an {@code replySink} gemeldet.
     *
     * @param message   zuzustellende Nachricht
     * @param replySink Empfänger der Antwort
     */
    void post(EngineMessage message, Consumer<EngineReply> replySink);
}
