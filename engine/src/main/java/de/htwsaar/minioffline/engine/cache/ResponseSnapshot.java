package de.htwsaar.minioffline.engine.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import de.htwsaar.minioffline.common.util.Sha256Util;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.domain.ResponseSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unveränderliche Kopie einer Antwort inklusive SHA-256 des Bodys.
 *
 * @param status  HTTP-Status
 * @param headers Header
 * @param body    Body
 * @param sha256  Hex-Hash des Bodys
 */
public record ResponseSnapshot(int status, Map<String, List<String>> headers, byte[] body, String sha256) {

    public ResponseSnapshot {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body.clone();
    }

    /**
     * Erstellt einen Snapshot und berechnet den Hash.
     *
     * @param response Quelle
     * @return Snapshot
     */
    public static ResponseSnapshot of(ResourceResponse response) {
        return new ResponseSnapshot(
                response.status(), response.headers(), response.body(), Sha256Util.sha256Hex(response.body()));
    }

    /** @return {@code true}, wenn der gespeicherte Hash zum Body passt */
    @JsonIgnore
    public boolean isIntact() {
        return Sha256Util.matches(body, sha256);
    }

    /**
     * Materialisiert den Snapshot als Antwort.
     *
     * @param source Herkunft
     * @return Antwort mit eigener Body-Kopie
     */
    public ResourceResponse toResponse(ResponseSource source) {
        return new ResourceResponse(status, headers, body.clone(), source);
    }
}
