package de.htwsaar.minioffline.engine.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.minioffline.common.messaging.EngineEvent;
import de.htwsaar.minioffline.common.messaging.EngineEventType;
import de.htwsaar.minioffline.engine.cache.CacheStoreConfig;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.domain.ResponseSource;
import de.htwsaar.minioffline.engine.fallback.FallbackMapping;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import de.htwsaar.minioffline.engine.routing.RouteStrategyMapping;
import de.htwsaar.minioffline.engine.storage.InMemoryBlobStore;
import de.htwsaar.minioffline.engine.strategy.Strategy;
import de.htwsaar.minioffline.engine.strategy.StrategyExecutor;
import de.htwsaar.minioffline.engine.strategy.StrategyExecutors;
import de.htwsaar.minioffline.engine.support.FakeNetworkClient;
import de.htwsaar.minioffline.engine.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Installation, Wartephase, Aktivierung und Aufräumen alter Versionen.
 */
class LifecycleManagerTest {

    private InMemoryBlobStore blobs;
    private FakeNetworkClient network;
    private CacheStoreManager caches;
    private HostEventBus bus;
    private List<EngineEvent> events;
    private LifecycleManager lifecycle;

    @BeforeEach
    void setUp() {
        blobs = new InMemoryBlobStore();
        network = new FakeNetworkClient()
                .respond("/", 200, "<html>")
                .respond("/offline.html", 200, "offline");
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        caches = new CacheStoreManager(blobs, clock);
        bus = new HostEventBus(clock);
        events = new CopyOnWriteArrayList<>();
        bus.subscribe(events::add);
        lifecycle = newManager();
    }

    private LifecycleManager newManager() {
        return new LifecycleManager(caches, network, blobs, bus, "app", Duration.ofMillis(500));
    }

    @Test
    void firstInstallShouldActivateImmediatelyAndPrecache() {
        EngineInstance v1 = lifecycle.install(release(1));

        assertEquals(LifecycleState.ACTIVATED, v1.state());
        assertEquals(v1, lifecycle.active());
        assertNotNull(caches.get("app-v1-static", "/offline.html"), "Precache landet im Default-Store");
        assertTrue(caches.storeNames().contains("app-v1-api"));
        assertEquals(1, countOf(EngineEventType.ACTIVATED));
    }

    @Test
    @DisplayName("Neue Version wartet, solange ein Client angemeldet ist")
    void newVersionShouldWaitWhileClientsAreAttached() {
        lifecycle.install(release(1));
        LifecycleManager.ClientHandle client = lifecycle.attachClient();

        EngineInstance v2 = lifecycle.install(release(2));

        assertEquals(LifecycleState.INSTALLED, v2.state());
        assertEquals(1, lifecycle.active().version().number());
        assertTrue(lifecycle.waiting().isPresent());
        assertEquals(1, countOf(EngineEventType.UPDATE_AVAILABLE));
        assertTrue(caches.storeNames().contains("app-v1-static"), "Alte Stores bleiben bis zur Aktivierung");

        client.close();

        assertEquals(2, lifecycle.active().version().number());
        assertFalse(lifecycle.waiting().isPresent());
    }

    @Test
    void skipWaitingShouldActivateAndDeleteOldStores() {
        EngineInstance v1 = lifecycle.install(release(1));
        lifecycle.attachClient();
        lifecycle.install(release(2));

        assertTrue(lifecycle.skipWaiting());

        assertEquals(2, lifecycle.active().version().number());
        assertEquals(LifecycleState.REDUNDANT, v1.state());
        assertTrue(caches.storeNames().stream().allMatch(n -> n.startsWith("app-v2-")));
        EngineEvent activated = lastOf(EngineEventType.ACTIVATED);
        assertEquals(2, activated.data().get("version"));
        assertEquals(List.of("app-v1-api", "app-v1-static"), activated.data().get("deletedStores"));
        assertFalse(lifecycle.skipWaiting(), "Ohne wartende Version passiert nichts");
    }

    @Test
    void clientHandleShouldDetachOnlyOnce() {
        lifecycle.install(release(1));
        LifecycleManager.ClientHandle a = lifecycle.attachClient();
        lifecycle.attachClient();

        a.close();
        a.close();

        assertEquals(1, lifecycle.attachedClients());
    }

    @Test
    void olderOrEqualVersionShouldBeRejected() {
        lifecycle.install(release(2));

        ReleaseRejectedException ex = assertThrows(ReleaseRejectedException.class, () -> lifecycle.install(release(2)));

        assertEquals(2, ex.getVersion());
        assertEquals(2, lifecycle.active().version().number());
    }

    @Test
    void failedPrecacheShouldLeaveActiveVersionUntouched() {
        lifecycle.install(release(1));
        network.respond("/offline.html", 404, "gone");

        assertThrows(ReleaseRejectedException.class, () -> lifecycle.install(release(2)));

        assertEquals(1, lifecycle.active().version().number());
        assertTrue(caches.storeNames().stream().noneMatch(n -> n.startsWith("app-v2-")));
        assertNotNull(caches.get("app-v1-static", "/offline.html"));
    }

    @Test
    void newerInstallShouldSupersedeWaitingVersion() {
        lifecycle.install(release(1));
        lifecycle.attachClient();
        EngineInstance v2 = lifecycle.install(release(2));

        lifecycle.install(release(3));

        assertEquals(LifecycleState.REDUNDANT, v2.state());
        assertEquals(3, lifecycle.waiting().orElseThrow().version().number());
        assertTrue(caches.storeNames().stream().noneMatch(n -> n.startsWith("app-v2-")));
    }

    @Test
    void bootstrapShouldResumePersistedNewerVersion() {
        lifecycle.install(release(1));
        lifecycle.install(release(4));

        LifecycleManager restarted = newManager();
        EngineInstance resumed = restarted.bootstrap(release(2));

        assertEquals(4, resumed.version().number());
        assertEquals(LifecycleState.ACTIVATED, resumed.state());
    }

    @Test
    void bootstrapShouldInstallConfiguredVersionWhenNothingIsPersisted() {
        EngineInstance active = lifecycle.bootstrap(release(3));

        assertEquals(3, active.version().number());
        assertEquals("app-v3-", active.storePrefix());
    }

    @Test
    @DisplayName("Revalidierung der alten Version, die nach der Aktivierung eintrifft, legt keinen Store wieder an")
    void lateRevalidationShouldNotResurrectRetiredStores() throws Exception {
        lifecycle.install(release(1));
        lifecycle.attachClient();
        StrategyExecutor swr = new StrategyExecutors(caches, network, Duration.ofSeconds(5), bus)
                .forStrategy(Strategy.STALE_WHILE_REVALIDATE);
        CompletableFuture<ResourceResponse> upstream = network.hold("/");
        ResourceResponse served = swr.execute(ResourceRequest.get("/"), "app-v1-static").get(1, TimeUnit.SECONDS);

        lifecycle.install(release(2));
        assertTrue(lifecycle.skipWaiting());
        upstream.complete(FakeNetworkClient.response(200, "<html v1 fresh>"));

        assertEquals("<html>", FakeNetworkClient.bodyOf(served));
        assertTrue(caches.storeNames().stream().allMatch(n -> n.startsWith("app-v2-")), caches.storeNames().toString());
        assertTrue(blobs.list("cache/app-v1-static/").isEmpty());
        assertFalse(events.stream().anyMatch(e -> e.type() == EngineEventType.CACHE_UPDATED));
        assertNotNull(caches.get("app-v2-static", "/"));
    }

    @Test
    void responsesServedBeforeUpgradeShouldStayIntact() throws Exception {
        lifecycle.install(release(1));
        lifecycle.attachClient();
        StrategyExecutor cacheFirst = new StrategyExecutors(caches, network, Duration.ofSeconds(1), bus)
                .forStrategy(Strategy.CACHE_FIRST);
        ResourceResponse served = cacheFirst.execute(ResourceRequest.get("/offline.html"), "app-v1-static")
                .get(1, TimeUnit.SECONDS);

        network.respond("/offline.html", 200, "offline v2");
        lifecycle.install(release(2));
        lifecycle.skipWaiting();

        assertEquals(ResponseSource.CACHE, served.source());
        assertEquals(200, served.status());
        assertEquals("offline", FakeNetworkClient.bodyOf(served));
        assertEquals("offline v2", new String(caches.get("app-v2-static", "/offline.html").snapshot().body()));
    }

    @Test
    @DisplayName("Precaching blockiert weder An- und Abmeldung noch Statusabfragen")
    void precacheShouldNotHoldTheLifecycleLock() throws Exception {
        LifecycleManager slow = new LifecycleManager(caches, network, blobs, bus, "app", Duration.ofSeconds(5));
        slow.install(release(1));
        CompletableFuture<ResourceResponse> upstream = network.hold("/offline.html");

        CompletableFuture<EngineInstance> install = CompletableFuture.supplyAsync(() -> slow.install(release(2)));
        long deadline = System.currentTimeMillis() + 2000;
        while (network.calls("/offline.html") < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }

        LifecycleManager.ClientHandle client = assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            return slow.attachClient();
        });
        Optional<EngineInstance> waitingDuringPrecache = assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            return slow.waiting();
        });
        assertFalse(waitingDuringPrecache.isPresent());

        upstream.complete(FakeNetworkClient.response(200, "offline"));
        EngineInstance v2 = install.get(2, TimeUnit.SECONDS);

        assertEquals(LifecycleState.INSTALLED, v2.state(), "Während des Precachings angemeldeter Client hält v2 zurück");
        assertEquals(1, slow.active().version().number());
        client.close();
        assertEquals(2, slow.active().version().number());
    }

    @Test
    void activeShouldFailBeforeFirstActivation() {
        assertThrows(IllegalStateException.class, () -> lifecycle.active());
    }

    static EngineRelease release(int version) {
        return new EngineRelease(
                version,
                List.of(new CacheStoreConfig("static", 100, 0), new CacheStoreConfig("api", 10, 300)),
                List.of(new RouteStrategyMapping("/", Strategy.STALE_WHILE_REVALIDATE, "static"),
                        new RouteStrategyMapping("/api/", Strategy.NETWORK_FIRST, "api")),
                "static",
                List.of(new FallbackMapping("/", "/offline.html")),
                List.of("/", "/offline.html"));
    }

    private long countOf(EngineEventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private EngineEvent lastOf(EngineEventType type) {
        EngineEvent last = null;
        for (EngineEvent e : events) {
            if (e.type() == type) last = e;
        }
        return last;
    }
}
