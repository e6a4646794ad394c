package de.htwsaar.minioffline.engine.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Abgefangene Anfrage des Hosts.
 *
 * @param method  HTTP-Methode in Großbuchstaben
 * @param target  Pfad inkl. Query, z. B. {@code /api/items?page=2}
 * @param headers Request-Header
 * @param body    Request-Body (leer für GET)
 */
public record ResourceRequest(String method, String target, Map<String, List<String>> headers, byte[] body) {

    private static final Set<String> MUTATING = Set.of("POST", "PUT", "PATCH", "DELETE");

    public ResourceRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(target, "target must not be null");
        method = method.trim().toUpperCase(Locale.ROOT);
        target = target.startsWith("/") ? target : "/" + target;
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body;
    }

    /**
     * Kurzform für eine GET-Anfrage ohne Header.
     *
     * @param target Pfad inkl. Query
     * @return GET-Anfrage
     */
    public static ResourceRequest get(String target) {
        return new ResourceRequest("GET", target, Map.of(), null);
    }

    /**
     * Pfad ohne Query-String; Grundlage für Routing und Fallbacks.
     *
     * @return Pfad
     */
    public String path() {
        int q = target.indexOf('?');
        return q < 0 ? target : target.substring(0, q);
    }

    /**
     * Cache-Schlüssel: Pfad inklusive Query.
     *
     * @return Schlüssel
     */
    public String cacheKey() {
        return target;
    }

    /** @return {@code true} für POST, PUT, PATCH und DELETE */
    public boolean isMutating() {
        return MUTATING.contains(method);
    }
}
