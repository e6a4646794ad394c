package de.htwsaar.minioffline.engine.support;

import de.htwsaar.minioffline.common.messaging.EngineEvent;
import de.htwsaar.minioffline.engine.EngineMetricsService;
import de.htwsaar.minioffline.engine.cache.CacheStoreConfig;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.fallback.FallbackMapping;
import de.htwsaar.minioffline.engine.lifecycle.EngineRelease;
import de.htwsaar.minioffline.engine.lifecycle.LifecycleManager;
import de.htwsaar.minioffline.engine.messaging.EngineMessageHandler;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import de.htwsaar.minioffline.engine.push.EventPublishingPresenter;
import de.htwsaar.minioffline.engine.push.PushNotificationDispatcher;
import de.htwsaar.minioffline.engine.routing.RouteStrategyMapping;
import de.htwsaar.minioffline.engine.service.RequestInterceptor;
import de.htwsaar.minioffline.engine.storage.InMemoryBlobStore;
import de.htwsaar.minioffline.engine.strategy.Strategy;
import de.htwsaar.minioffline.engine.strategy.StrategyExecutors;
import de.htwsaar.minioffline.engine.sync.BackgroundSyncQueue;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Verdrahtet die Engine wie {@code EngineBeans}, aber mit Fake-Upstream, In-Memory-Speicher und
 * synchronen Executoren. Für Controller-Tests ohne Spring-Kontext.
 */
public final class EngineFixture {

    public static final String CACHE_PREFIX = "app";
    private static final Duration TIMEOUT = Duration.ofMillis(200);

    public final InMemoryBlobStore blobs = new InMemoryBlobStore();
    public final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    public final HostEventBus bus = new HostEventBus(clock);
    public final List<EngineEvent> events = new CopyOnWriteArrayList<>();
    public final FakeNetworkClient network = new FakeNetworkClient()
            .respond("/offline-api.json", 200, "{\"offline\":true}")
            .respond("/offline.html", 200, "offline page");
    public final CacheStoreManager caches = new CacheStoreManager(blobs, clock);
    public final LifecycleManager lifecycle =
            new LifecycleManager(caches, network, blobs, bus, CACHE_PREFIX, TIMEOUT);
    public final BackgroundSyncQueue syncQueue =
            new BackgroundSyncQueue(blobs, network, bus, clock, TIMEOUT, 3, Runnable::run);
    public final EngineMetricsService metrics = new EngineMetricsService(clock);
    public final RequestInterceptor interceptor = new RequestInterceptor(
            lifecycle, new StrategyExecutors(caches, network, TIMEOUT, bus), network, syncQueue, metrics, TIMEOUT);
    public final EngineMessageHandler messageHandler =
            new EngineMessageHandler(lifecycle, caches, network, TIMEOUT);
    public final PushNotificationDispatcher pushDispatcher;

    public EngineFixture() {
        bus.subscribe(events::add);
        EventPublishingPresenter presenter = new EventPublishingPresenter(bus);
        pushDispatcher = new PushNotificationDispatcher(presenter, presenter, Runnable::run);
        lifecycle.install(release(1));
    }

    /**
     * Release mit {@code /api/} als network-first und Offline-Fallbacks für API und Dashboard.
     *
     * @param version Versionsnummer
     * @return Release
     */
    public static EngineRelease release(int version) {
        return new EngineRelease(
                version,
                List.of(new CacheStoreConfig("static", 0, 0), new CacheStoreConfig("api", 50, 300)),
                List.of(new RouteStrategyMapping("/api/", Strategy.NETWORK_FIRST, "api"),
                        new RouteStrategyMapping("/api/auth/", Strategy.NETWORK_ONLY, "api"),
                        new RouteStrategyMapping("/assets/", Strategy.STALE_WHILE_REVALIDATE, "static")),
                "static",
                List.of(new FallbackMapping("/api/", "/offline-api.json"),
                        new FallbackMapping("/dashboard/", "/offline.html")),
                List.of("/offline-api.json", "/offline.html"));
    }
}
