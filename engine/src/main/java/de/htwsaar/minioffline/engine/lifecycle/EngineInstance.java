package de.htwsaar.minioffline.engine.lifecycle;

import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.fallback.OfflineFallbackResolver;
import de.htwsaar.minioffline.engine.routing.StrategyRouter;
import java.util.Objects;

/**
 * Eine installierte Engine-Version mit eigenem Router und Fallback-Resolver.
 */
public final class EngineInstance {

    private final EngineRelease release;
    private final String cachePrefix;
    private final StrategyRouter router;
    private final OfflineFallbackResolver fallbackResolver;
    private volatile LifecycleState state = LifecycleState.INSTALLING;

    EngineInstance(EngineRelease release, String cachePrefix, CacheStoreManager caches) {
        this.release = Objects.requireNonNull(release, "release must not be null");
        this.cachePrefix = Objects.requireNonNull(cachePrefix, "cachePrefix must not be null");
        this.router = new StrategyRouter(release.routes(), release.defaultStore());
        this.fallbackResolver = new OfflineFallbackResolver(release.fallbacks(), caches, storePrefix());
    }

    public EngineVersion version() {
        return release.engineVersion();
    }

    public EngineRelease release() {
        return release;
    }

    public LifecycleState state() {
        return state;
    }

    void state(LifecycleState newState) {
        this.state = newState;
    }

    public StrategyRouter router() {
        return router;
    }

    public OfflineFallbackResolver fallbackResolver() {
        return fallbackResolver;
    }

    /** @return Präfix aller Stores dieser Version */
    public String storePrefix() {
        return version().storePrefix(cachePrefix);
    }

    /**
     * @param store Store-Name ohne Präfix
     * @return versionsqualifizierter Name
     */
    public String qualify(String store) {
        return version().storeName(cachePrefix, store);
    }

    /** @return versionsqualifizierter Default-Store */
    public String defaultStoreName() {
        return qualify(release.defaultStore());
    }

    @Override
    public String toString() {
        return "EngineInstance[v" + release.version() + ", " + state + "]";
    }
}
