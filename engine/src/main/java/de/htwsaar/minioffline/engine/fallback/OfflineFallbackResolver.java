package de.htwsaar.minioffline.engine.fallback;

import de.htwsaar.minioffline.engine.cache.CacheEntry;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.domain.ResponseSource;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liefert die Offline-Ersatzantwort für einen Pfad.
 *
 * <p>Längster passender Prefix gewinnt. Die Ressource wird in allen Stores der aktiven Version
 * gesucht; fehlt sie dort, gibt es keinen Fallback.</p>
 */
public final class OfflineFallbackResolver {

    private static final Logger log = LoggerFactory.getLogger(OfflineFallbackResolver.class);

    private final List<FallbackMapping> mappings;
    private final CacheStoreManager caches;
    private final String storePrefix;

    /**
     * @param mappings    Fallback-Tabelle
     * @param caches      Cache-Store-Manager
     * @param storePrefix Store-Präfix der Version, z. B. {@code mini-offline-v3-}
     */
    public OfflineFallbackResolver(List<FallbackMapping> mappings, CacheStoreManager caches, String storePrefix) {
        this.mappings = List.copyOf(Objects.requireNonNull(mappings, "mappings must not be null"));
        this.caches = Objects.requireNonNull(caches, "caches must not be null");
        this.storePrefix = Objects.requireNonNull(storePrefix, "storePrefix must not be null");
    }

    /**
     * Bestimmt die Ersatzressource ohne Cache-Zugriff.
     *
     * @param requestPath Pfad
     * @return Ressource, falls ein Präfix passt
     */
    public Optional<String> fallbackResourceFor(String requestPath) {
        if (requestPath == null || requestPath.isBlank()) return Optional.empty();
        return mappings.stream()
                .filter(m -> requestPath.startsWith(m.pathPrefix()))
                .max(Comparator.comparingInt(m -> m.pathPrefix().length()))
                .map(FallbackMapping::resource);
    }

    /**
     * Sucht die gecachte Ersatzantwort.
     *
     * @param requestPath Pfad der gescheiterten Anfrage
     * @return Antwort mit Quelle {@link ResponseSource#FALLBACK} oder {@code null}
     */
    public ResourceResponse resolve(String requestPath) {
        Optional<String> resource = fallbackResourceFor(requestPath);
        if (resource.isEmpty()) return null;
        CacheEntry entry = caches.match(storePrefix, resource.get());
        if (entry == null) {
            log.debug("Fallback {} for {} is not cached", resource.get(), requestPath);
            return null;
        }
        return entry.snapshot().toResponse(ResponseSource.FALLBACK);
    }

    /** @return Fallback-Tabelle */
    public List<FallbackMapping> mappings() {
        return mappings;
    }
}
