package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Immer Netzwerk, nie Cache. Antworten und Fehler werden unverändert weitergereicht.
 */
public final class NetworkOnlyExecutor extends AbstractStrategyExecutor {

    public NetworkOnlyExecutor(CacheStoreManager caches, NetworkClient network, Duration timeout) {
        super(caches, network, timeout);
    }

    @Override
    public Strategy strategy() {
        return Strategy.NETWORK_ONLY;
    }

    @Override
    public CompletableFuture<ResourceResponse> execute(ResourceRequest request, String storeName) {
        return fetch(request);
    }
}
