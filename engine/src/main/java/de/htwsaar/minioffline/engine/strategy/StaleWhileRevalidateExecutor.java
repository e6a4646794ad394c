package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.common.messaging.EngineEventType;
import de.htwsaar.minioffline.engine.cache.CacheEntry;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liefert einen vorhandenen Eintrag sofort und aktualisiert ihn im Hintergrund.
 *
 * <p>Gleichzeitige Revalidierungen desselben Schlüssels teilen sich ein Future. Das Schreiben in den
 * Store hängt am Fetch selbst, nicht am Future des Aufrufers; ein Abbruch durch den Aufrufer
 * verhindert die Aktualisierung daher nicht.</p>
 */
public final class StaleWhileRevalidateExecutor extends AbstractStrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(StaleWhileRevalidateExecutor.class);

    private final HostEventBus events;
    private final Map<String, CompletableFuture<ResourceResponse>> inFlight = new ConcurrentHashMap<>();

    public StaleWhileRevalidateExecutor(
            CacheStoreManager caches, NetworkClient network, Duration timeout, HostEventBus events) {
        super(caches, network, timeout);
        this.events = Objects.requireNonNull(events, "events must not be null");
    }

    @Override
    public Strategy strategy() {
        return Strategy.STALE_WHILE_REVALIDATE;
    }

    @Override
    public CompletableFuture<ResourceResponse> execute(ResourceRequest request, String storeName) {
        CacheEntry hit = cached(storeName, request);
        CompletableFuture<ResourceResponse> revalidation = revalidate(request, storeName);
        if (hit != null) {
            return CompletableFuture.completedFuture(fromCache(hit));
        }
        return revalidation.copy();
    }

    /**
     * Startet eine Revalidierung oder hängt sich an eine laufende an.
     *
     * @param request   Anfrage
     * @param storeName Ziel-Store
     * @return geteiltes Future der Revalidierung
     */
    CompletableFuture<ResourceResponse> revalidate(ResourceRequest request, String storeName) {
        String flightKey = storeName + "|" + request.cacheKey();
        CompletableFuture<ResourceResponse> created = new CompletableFuture<>();
        CompletableFuture<ResourceResponse> running = inFlight.putIfAbsent(flightKey, created);
        if (running != null) {
            return running;
        }
        fetchHealthy(request).whenComplete((resp, ex) -> {
            try {
                if (ex == null && resp.isSuccessful() && caches.put(storeName, request.cacheKey(), resp) != null) {
                    events.publish(EngineEventType.CACHE_UPDATED,
                            Map.of("cacheName", storeName, "url", request.cacheKey()));
                } else if (ex != null) {
                    log.debug("Background revalidation of {} failed: {}", request.target(), unwrap(ex).getMessage());
                }
            } catch (RuntimeException storeFailure) {
                log.warn("Could not store revalidated {}: {}", request.target(), storeFailure.getMessage());
            } finally {
                inFlight.remove(flightKey, created);
            }
            if (ex == null) {
                created.complete(resp);
            } else {
                created.completeExceptionally(unwrap(ex));
            }
        });
        return created;
    }

    /** @return Anzahl laufender Revalidierungen */
    public int inFlightCount() {
        return inFlight.size();
    }
}
