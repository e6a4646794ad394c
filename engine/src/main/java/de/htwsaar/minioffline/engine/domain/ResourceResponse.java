package de.htwsaar.minioffline.engine.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Antwort, die an den Host ausgeliefert wird.
 *
 * @param status  HTTP-Status
 * @param headers Response-Header
 * @param body    Response-Body
 * @param source  Herkunft der Antwort
 */
public record ResourceResponse(int status, Map<String, List<String>> headers, byte[] body, ResponseSource source) {

    public ResourceResponse {
        Objects.requireNonNull(source, "source must not be null");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body;
    }

    /**
     * Gleiche Antwort mit anderer Herkunft.
     *
     * @param newSource neue Herkunft
     * @return Kopie
     */
    public ResourceResponse withSource(ResponseSource newSource) {
        return new ResourceResponse(status, headers, body, newSource);
    }

    /** @return {@code true} für 2xx */
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /** @return {@code true} für 5xx */
    public boolean isServerError() {
        return status >= 500;
    }

    /**
     * Erster Wert eines Headers (Groß-/Kleinschreibung egal).
     *
     * @param name Header-Name
     * @return Wert oder {@code null}
     */
    public String firstHeader(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return e.getValue().get(0);
            }
        }
        return null;
    }
}
