package de.htwsaar.minioffline.engine.lifecycle;

import de.htwsaar.minioffline.engine.cache.CacheStoreConfig;
import de.htwsaar.minioffline.engine.fallback.FallbackMapping;
import de.htwsaar.minioffline.engine.routing.RouteStrategyMapping;
import java.util.List;
import java.util.Objects;

/**
 * Vollständige statische Konfiguration einer Engine-Version.
 *
 * @param version      Versionsnummer
 * @param stores       Store-Grenzen (Namen ohne Versionspräfix)
 * @param routes       Routentabelle
 * @param defaultStore Store für nicht gemappte Pfade und Precaching
 * @param fallbacks    Offline-Fallbacks
 * @param precacheUrls bei der Installation zu ladende Ressourcen
 */
public record EngineRelease(
        int version,
        List<CacheStoreConfig> stores,
        List<RouteStrategyMapping> routes,
        String defaultStore,
        List<FallbackMapping> fallbacks,
        List<String> precacheUrls) {

    public EngineRelease {
        Objects.requireNonNull(defaultStore, "defaultStore must not be null");
        stores = stores == null ? List.of() : List.copyOf(stores);
        routes = routes == null ? List.of() : List.copyOf(routes);
        fallbacks = fallbacks == null ? List.of() : List.copyOf(fallbacks);
        precacheUrls = precacheUrls == null ? List.of() : List.copyOf(precacheUrls);
    }

    public EngineVersion engineVersion() {
        return new EngineVersion(version);
    }

    /**
     * Grenzen eines Stores; unbekannte Stores sind unbegrenzt.
     *
     * @param store Store-Name ohne Präfix
     * @return Konfiguration
     */
    public CacheStoreConfig storeConfig(String store) {
        return stores.stream()
                .filter(s -> s.name().equals(store))
                .findFirst()
                .orElse(CacheStoreConfig.unlimited(store));
    }
}
