package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.engine.cache.CacheEntry;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.NetworkException;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.domain.ResponseSource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gemeinsame Bausteine der Strategien: Fetch mit Frist, Cache-Lookup und Speichern.
 */
abstract class AbstractStrategyExecutor implements StrategyExecutor {

    protected final CacheStoreManager caches;
    protected final NetworkClient network;
    protected final Duration timeout;

    protected AbstractStrategyExecutor(CacheStoreManager caches, NetworkClient network, Duration timeout) {
        this.caches = Objects.requireNonNull(caches, "caches must not be null");
        this.network = Objects.requireNonNull(network, "network must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Fetch mit Frist. Eine Zeitüberschreitung wird zu {@link NetworkException.Kind#TIMEOUT}.
     */
    protected CompletableFuture<ResourceResponse> fetch(ResourceRequest request) {
        CompletableFuture<ResourceResponse> result = new CompletableFuture<>();
        network.fetch(request, timeout)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((resp, ex) -> {
                    if (ex == null) {
                        result.complete(resp);
                    } else {
                        result.completeExceptionally(toNetworkFailure(unwrap(ex), request));
                    }
                });
        return result;
    }

    /**
     * Wie {@link #fetch}, wertet aber 5xx als Fehlschlag.
     */
    protected CompletableFuture<ResourceResponse> fetchHealthy(ResourceRequest request) {
        return fetch(request).thenApply(resp -> {
            if (resp.isServerError()) {
                throw new NetworkException("Upstream responded with " + resp.status()
                        + " for " + request.target(), resp.status());
            }
            return resp;
        });
    }

    protected CacheEntry cached(String storeName, ResourceRequest request) {
        return caches.get(storeName, request.cacheKey());
    }

    /** Speichert nur erfolgreiche (2xx) Antworten. */
    protected void storeIfSuccessful(String storeName, ResourceRequest request, ResourceResponse response) {
        if (response.isSuccessful()) {
            caches.put(storeName, request.cacheKey(), response);
        }
    }

    protected static ResourceResponse fromCache(CacheEntry entry) {
        return entry.snapshot().toResponse(ResponseSource.CACHE);
    }

    static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static Throwable toNetworkFailure(Throwable cause, ResourceRequest request) {
        if (cause instanceof TimeoutException) {
            return new NetworkException(NetworkException.Kind.TIMEOUT,
                    "Timed out fetching " + request.target(), cause);
        }
        return cause;
    }
}
