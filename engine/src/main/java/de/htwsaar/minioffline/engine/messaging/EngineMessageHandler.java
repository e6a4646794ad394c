package de.htwsaar.minioffline.engine.messaging;

import de.htwsaar.minioffline.common.messaging.EngineMessage;
import de.htwsaar.minioffline.common.messaging.EngineReply;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager.StoreStats;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.lifecycle.EngineInstance;
import de.htwsaar.minioffline.engine.lifecycle.LifecycleManager;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Beantwortet Host-Nachrichten; jede Nachricht erhält genau eine {@link EngineReply}.
 */
public class EngineMessageHandler {

    private static final Logger log = LoggerFactory.getLogger(EngineMessageHandler.class);

    private final LifecycleManager lifecycle;
    private final CacheStoreManager caches;
    private final NetworkClient network;
    private final Duration timeout;

    public EngineMessageHandler(
            LifecycleManager lifecycle, CacheStoreManager caches, NetworkClient network, Duration timeout) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.caches = Objects.requireNonNull(caches, "caches must not be null");
        this.network = Objects.requireNonNull(network, "network must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Verarbeitet eine Nachricht.
     *
     * @param message Nachricht des Hosts
     * @return Future mit genau einer Antwort; scheitert nie
     */
    public CompletableFuture<EngineReply> handle(EngineMessage message) {
        String id = message.correlationId();
        CompletableFuture<Object> result;
        try {
            result = switch (message.type()) {
                case SKIP_WAITING -> CompletableFuture.completedFuture(
                        Map.of("activated", lifecycle.skipWaiting(),
                                "version", lifecycle.active().version().number()));
                case CACHE_URLS -> cacheUrls(urlsOf(message.data()));
                case CLEAR_CACHE -> CompletableFuture.completedFuture(clearCache(message.data().get("cacheName")));
                case GET_CACHE_STATS -> CompletableFuture.completedFuture(cacheStats());
            };
        } catch (RuntimeException ex) {
            result = CompletableFuture.failedFuture(ex);
        }
        return result.handle((data, ex) -> {
            if (ex == null) {
                return EngineReply.ok(id, data);
            }
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                    ? ex.getCause()
                    : ex;
            log.warn("Message {} ({}) failed: {}", message.type(), id, cause.getMessage());
            return EngineReply.failure(id, cause.getMessage() != null ? cause.getMessage() : cause.toString());
        });
    }

    private CompletableFuture<Object> cacheUrls(List<String> urls) {
        EngineInstance active = lifecycle.active();
        String store = active.defaultStoreName();
        List<String> cached = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<CompletableFuture<Void>> loads = new ArrayList<>();
        for (String url : urls) {
            ResourceRequest request = ResourceRequest.get(url);
            loads.add(network.fetch(request, timeout)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((resp, ex) -> {
                        synchronized (cached) {
                            if (ex == null && resp.isSuccessful()
                                    && caches.put(store, request.cacheKey(), resp) != null) {
                                cached.add(request.cacheKey());
                            } else {
                                failed.add(request.cacheKey());
                            }
                        }
                        return null;
                    }));
        }
        return CompletableFuture.allOf(loads.toArray(new CompletableFuture[0])).thenApply(v -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("cacheName", store);
            out.put("cached", cached);
            out.put("failed", failed);
            return out;
        });
    }

    private Object clearCache(Object cacheName) {
        List<String> deleted = new ArrayList<>();
        if (cacheName == null || cacheName.toString().isBlank()) {
            for (String name : caches.storeNames()) {
                if (caches.deleteStore(name)) deleted.add(name);
            }
        } else {
            String name = cacheName.toString().trim();
            if (caches.deleteStore(name)) {
                deleted.add(name);
            } else {
                String qualified = lifecycle.active().qualify(name);
                if (caches.deleteStore(qualified)) deleted.add(qualified);
            }
        }
        return Map.of("deleted", deleted);
    }

    private Map<String, Object> cacheStats() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, StoreStats> e : caches.stats().entrySet()) {
            out.put(e.getKey(), Map.of("size", e.getValue().size(), "urls", e.getValue().urls()));
        }
        return out;
    }

    private static List<String> urlsOf(Map<String, Object> data) {
        Object raw = data.get("urls");
        if (!(raw instanceof List)) {
            throw new IllegalArgumentException("CACHE_URLS requires a 'urls' list");
        }
        List<String> urls = new ArrayList<>();
        for (Object o : (List<?>) raw) {
            if (o != null && !o.toString().isBlank()) urls.add(o.toString().trim());
        }
        return urls;
    }
}
