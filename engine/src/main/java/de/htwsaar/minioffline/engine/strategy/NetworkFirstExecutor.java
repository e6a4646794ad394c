package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.engine.cache.CacheEntry;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netzwerk zuerst; bei Timeout, Verbindungsfehler oder 5xx dient der frische Cache-Eintrag als Ersatz.
 */
public final class NetworkFirstExecutor extends AbstractStrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(NetworkFirstExecutor.class);

    public NetworkFirstExecutor(CacheStoreManager caches, NetworkClient network, Duration timeout) {
        super(caches, network, timeout);
    }

    @Override
    public Strategy strategy() {
        return Strategy.NETWORK_FIRST;
    }

    @Override
    public CompletableFuture<ResourceResponse> execute(ResourceRequest request, String storeName) {
        return fetchHealthy(request)
                .handle((resp, ex) -> {
                    if (ex == null) {
                        storeIfSuccessful(storeName, request, resp);
                        return CompletableFuture.completedFuture(resp);
                    }
                    Throwable cause = unwrap(ex);
                    CacheEntry cached = cached(storeName, request);
                    if (cached != null) {
                        log.debug("Network failed for {} ({}), serving cached copy from {}",
                                request.target(), cause.getMessage(), storeName);
                        return CompletableFuture.completedFuture(fromCache(cached));
                    }
                    return CompletableFuture.<ResourceResponse>failedFuture(cause);
                })
                .thenCompose(Function.identity());
    }
}
