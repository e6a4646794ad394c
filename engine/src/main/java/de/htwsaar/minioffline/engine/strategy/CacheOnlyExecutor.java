package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.engine.cache.CacheEntry;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Nur Cache; das Netzwerk wird nie berührt.
 */
public final class CacheOnlyExecutor extends AbstractStrategyExecutor {

    public CacheOnlyExecutor(CacheStoreManager caches, NetworkClient network, Duration timeout) {
        super(caches, network, timeout);
    }

    @Override
    public Strategy strategy() {
        return Strategy.CACHE_ONLY;
    }

    @Override
    public CompletableFuture<ResourceResponse> execute(ResourceRequest request, String storeName) {
        CacheEntry hit = cached(storeName, request);
        if (hit == null) {
            return CompletableFuture.failedFuture(new CacheMissException(storeName, request.cacheKey()));
        }
        return CompletableFuture.completedFuture(fromCache(hit));
    }
}
