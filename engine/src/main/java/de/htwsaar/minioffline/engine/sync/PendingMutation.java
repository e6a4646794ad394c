package de.htwsaar.minioffline.engine.sync;

import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Eine mutierende Anfrage, die wegen fehlender Konnektivität zurückgestellt wurde.
 *
 * @param id         eindeutige ID
 * @param url        Ziel (Pfad inkl. Query)
 * @param method     HTTP-Methode
 * @param headers    Request-Header
 * @param body       Request-Body
 * @param retryCount bisherige Fehlversuche beim Wiedereinspielen
 * @param createdAt  Zeitpunkt des Einreihens
 * @param sequence   Reihenfolge in der Queue
 * @param state      aktueller Zustand
 * @param lastError  letzter Fehlergrund (optional)
 */
public record PendingMutation(
        String id,
        String url,
        String method,
        Map<String, List<String>> headers,
        byte[] body,
        int retryCount,
        Instant createdAt,
        long sequence,
        MutationState state,
        String lastError) {

    public PendingMutation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(method, "method must not be null");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body;
        state = state == null ? MutationState.QUEUED : state;
    }

    /**
     * Neue Mutation aus einer gescheiterten Anfrage.
     */
    static PendingMutation of(String id, ResourceRequest request, Instant now, long sequence, String cause) {
        return new PendingMutation(id, request.target(), request.method(), request.headers(), request.body(),
                0, now, sequence, MutationState.QUEUED, cause);
    }

    /** @return die Anfrage zum Wiedereinspielen */
    public ResourceRequest toRequest() {
        return new ResourceRequest(method, url, headers, body);
    }

    PendingMutation withState(MutationState newState) {
        return new PendingMutation(id, url, method, headers, body, retryCount, createdAt, sequence, newState, lastError);
    }

    /** Zählt genau einen Fehlversuch. */
    PendingMutation failed(String reason, MutationState newState) {
        return new PendingMutation(id, url, method, headers, body, retryCount + 1, createdAt, sequence, newState, reason);
    }
}
