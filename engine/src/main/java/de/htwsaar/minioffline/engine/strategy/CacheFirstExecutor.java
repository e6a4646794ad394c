package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.engine.cache.CacheEntry;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Frischer Cache-Eintrag gewinnt; nur bei Miss wird geladen und gespeichert.
 */
public final class CacheFirstExecutor extends AbstractStrategyExecutor {

    public CacheFirstExecutor(CacheStoreManager caches, NetworkClient network, Duration timeout) {
        super(caches, network, timeout);
    }

    @Override
    public Strategy strategy() {
        return Strategy.CACHE_FIRST;
    }

    @Override
    public CompletableFuture<ResourceResponse> execute(ResourceRequest request, String storeName) {
        CacheEntry hit = cached(storeName, request);
        if (hit != null) {
            return CompletableFuture.completedFuture(fromCache(hit));
        }
        return fetchHealthy(request).thenApply(resp -> {
            storeIfSuccessful(storeName, request, resp);
            return resp;
        });
    }
}
