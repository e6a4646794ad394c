package de.htwsaar.minioffline.engine.domain;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Port zur Abstraktion des Upstream-Zugriffs.
 *
 * <p>Jede HTTP-Antwort (auch 4xx/5xx) schließt das Future regulär ab. Verbindungsfehler und
 * Zeitüberschreitungen schließen es mit einer {@link NetworkException} ab.</p>
 */
public interface NetworkClient {

    /**
     * Führt die Anfrage gegen den Upstream aus.
     *
     * @param request Anfrage
     * @param timeout maximale Wartezeit
     * @return Future mit der Antwort (Quelle {@link ResponseSource#NETWORK})
     */
    CompletableFuture<ResourceResponse> fetch(ResourceRequest request, Duration timeout);
}
