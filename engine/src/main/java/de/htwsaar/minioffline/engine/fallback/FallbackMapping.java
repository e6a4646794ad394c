package de.htwsaar.minioffline.engine.fallback;

import java.util.Objects;

/**
 * Offline-Ersatzressource für ein Pfad-Präfix.
 *
 * @param pathPrefix Pfad-Präfix
 * @param resource   vorab gecachte Ressource, z. B. {@code /offline.html}
 */
public record FallbackMapping(String pathPrefix, String resource) {

    public FallbackMapping {
        Objects.requireNonNull(pathPrefix, "pathPrefix must not be null");
        Objects.requireNonNull(resource, "resource must not be null");
    }
}
