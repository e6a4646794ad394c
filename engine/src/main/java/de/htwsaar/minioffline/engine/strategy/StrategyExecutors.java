package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import java.time.Duration;

/**
 * Registry der fünf Strategien; Auswahl per erschöpfendem {@code switch}.
 */
public final class StrategyExecutors {

    private final CacheFirstExecutor cacheFirst;
    private final NetworkFirstExecutor networkFirst;
    private final StaleWhileRevalidateExecutor staleWhileRevalidate;
    private final NetworkOnlyExecutor networkOnly;
    private final CacheOnlyExecutor cacheOnly;

    /**
     * @param caches  Cache-Store-Manager
     * @param network Netzwerk-Port
     * @param timeout Frist pro Netzwerkzugriff
     * @param events  Event-Bus für {@code cache-updated}
     */
    public StrategyExecutors(CacheStoreManager caches, NetworkClient network, Duration timeout, HostEventBus events) {
        this.cacheFirst = new CacheFirstExecutor(caches, network, timeout);
        this.networkFirst = new NetworkFirstExecutor(caches, network, timeout);
        this.staleWhileRevalidate = new StaleWhileRevalidateExecutor(caches, network, timeout, events);
        this.networkOnly = new NetworkOnlyExecutor(caches, network, timeout);
        this.cacheOnly = new CacheOnlyExecutor(caches, network, timeout);
    }

    /**
     * @param strategy gewünschte Strategie
     * @return zuständiger Executor
     */
    public StrategyExecutor forStrategy(Strategy strategy) {
        return switch (strategy) {
            case CACHE_FIRST -> cacheFirst;
            case NETWORK_FIRST -> networkFirst;
            case STALE_WHILE_REVALIDATE -> staleWhileRevalidate;
            case NETWORK_ONLY -> networkOnly;
            case CACHE_ONLY -> cacheOnly;
        };
    }
}
