package de.htwsaar.minioffline.engine.lifecycle;

import de.htwsaar.minioffline.common.messaging.EngineEventType;
import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import de.htwsaar.minioffline.common.serialization.MiniOfflineSerializationException;
import de.htwsaar.minioffline.engine.cache.CacheStoreConfig;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import de.htwsaar.minioffline.engine.storage.BlobStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Steuert Installation, Wartephase und Aktivierung von Engine-Versionen.
 *
 * <p>Genau eine Version ist aktiv. Eine neue Version wartet, solange Host-Clients an der alten
 * hängen, bis {@link #skipWaiting()} aufgerufen wird oder der letzte Client sich abmeldet.
 * Bei der Aktivierung werden alle Stores fremder Versionen gelöscht.</p>
 */
public class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    static final String ACTIVE_RELEASE_KEY = "engine/active-release";

    private final CacheStoreManager caches;
    private final NetworkClient network;
    private final BlobStore blobStore;
    private final HostEventBus events;
    private final String cachePrefix;
    private final Duration timeout;

    private volatile EngineInstance active;
    private EngineInstance waiting;
    private int attachedClients;

    /**
     * @param caches      Cache-Store-Manager
     * @param network     Netzwerk-Port für das Precaching
     * @param blobStore   speichert die aktive Version
     * @param events      Event-Bus
     * @param cachePrefix Anwendungspräfix der Store-Namen
     * @param timeout     Frist je Precache-Request
     */
    public LifecycleManager(
            CacheStoreManager caches,
            NetworkClient network,
            BlobStore blobStore,
            HostEventBus events,
            String cachePrefix,
            Duration timeout) {
        this.caches = Objects.requireNonNull(caches, "caches must not be null");
        this.network = Objects.requireNonNull(network, "network must not be null");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.cachePrefix = Objects.requireNonNull(cachePrefix, "cachePrefix must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Startet die Engine: übernimmt eine gespeicherte aktive Version, sofern sie mindestens so neu
     * ist wie die konfigurierte, und installiert sonst die konfigurierte.
     *
     * @param configured Release aus der Konfiguration
     * @return aktive Instanz
     */
    public synchronized EngineInstance bootstrap(EngineRelease configured) {
        EngineRelease persisted = readPersistedRelease();
        if (persisted != null && persisted.version() >= configured.version()) {
            EngineInstance restored = new EngineInstance(persisted, cachePrefix, caches);
            openStores(restored);
            restored.state(LifecycleState.ACTIVATED);
            active = restored;
            log.info("Resumed engine version {}", persisted.version());
            return restored;
        }
        install(configured);
        return active();
    }

    /**
     * Installiert eine neue Version. Das Precaching läuft ohne Sperre; vor dem Eintragen als
     * wartende oder aktive Version wird die Versionsprüfung wiederholt.
     *
     * @param release neue Version
     * @return installierte Instanz (aktiv oder wartend)
     * @throws ReleaseRejectedException wenn die Version nicht neuer ist oder das Precaching scheitert
     */
    public EngineInstance install(EngineRelease release) {
        synchronized (this) {
            requireNewer(release);
        }

        EngineInstance instance = new EngineInstance(release, cachePrefix, caches);
        log.info("Installing engine version {}", release.version());
        try {
            openStores(instance);
            precache(instance);
        } catch (RuntimeException ex) {
            discard(instance);
            log.error("Installation of version {} failed: {}", release.version(), ex.getMessage());
            throw new ReleaseRejectedException(release.version(),
                    "Precaching failed for version " + release.version() + ": " + ex.getMessage(), ex);
        }
        return commitInstalled(instance);
    }

    private synchronized EngineInstance commitInstalled(EngineInstance instance) {
        EngineRelease release = instance.release();
        try {
            requireNewer(release);
        } catch (ReleaseRejectedException ex) {
            discard(instance);
            log.warn("Installation of version {} overtaken: {}", release.version(), ex.getMessage());
            throw ex;
        }
        instance.state(LifecycleState.INSTALLED);

        if (waiting != null) {
            log.info("Version {} supersedes waiting version {}", release.version(), waiting.version().number());
            waiting.state(LifecycleState.REDUNDANT);
            deleteStoresOf(waiting);
        }

        if (active == null || attachedClients == 0) {
            waiting = null;
            activate(instance);
        } else {
            waiting = instance;
            log.info("Version {} installed and waiting ({} client(s) attached)", release.version(), attachedClients);
            events.publish(EngineEventType.UPDATE_AVAILABLE, Map.of("version", release.version()));
        }
        return instance;
    }

    private void requireNewer(EngineRelease release) {
        EngineVersion version = release.engineVersion();
        EngineInstance current = active;
        if (current != null && !version.isNewerThan(current.version())) {
            throw new ReleaseRejectedException(release.version(),
                    "Version " + release.version() + " is not newer than active version " + current.version().number());
        }
        if (waiting != null && !version.isNewerThan(waiting.version())) {
            throw new ReleaseRejectedException(release.version(),
                    "Version " + release.version() + " is not newer than waiting version " + waiting.version().number());
        }
    }

    /** Verwirft eine gescheiterte Installation; Stores derselben Version bleiben, wenn sie aktiv oder wartend ist. */
    private synchronized void discard(EngineInstance instance) {
        instance.state(LifecycleState.REDUNDANT);
        int number = instance.version().number();
        boolean shared = (active != null && active.version().number() == number)
                || (waiting != null && waiting.version().number() == number);
        if (!shared) {
            deleteStoresOf(instance);
        }
    }

    /**
     * Befördert die wartende Version sofort.
     *
     * @return {@code true}, wenn eine Version aktiviert wurde
     */
    public synchronized boolean skipWaiting() {
        if (waiting == null) {
            log.debug("skipWaiting without waiting version");
            return false;
        }
        EngineInstance promote = waiting;
        waiting = null;
        activate(promote);
        return true;
    }

    /**
     * Meldet einen Host-Client an. Schließen des Handles meldet ihn (einmalig) ab.
     *
     * @return Handle
     */
    public synchronized ClientHandle attachClient() {
        attachedClients++;
        AtomicBoolean closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                detachClient();
            }
        };
    }

    private synchronized void detachClient() {
        attachedClients = Math.max(0, attachedClients - 1);
        if (attachedClients == 0 && waiting != null) {
            log.info("Last client detached, promoting waiting version {}", waiting.version().number());
            EngineInstance promote = waiting;
            waiting = null;
            activate(promote);
        }
    }

    private void activate(EngineInstance instance) {
        instance.state(LifecycleState.ACTIVATING);
        List<String> deleted = caches.deleteStoresExcept(instance.storePrefix());
        EngineInstance previous = active;
        instance.state(LifecycleState.ACTIVATED);
        active = instance;
        if (previous != null) {
            previous.state(LifecycleState.REDUNDANT);
        }
        blobStore.put(ACTIVE_RELEASE_KEY, JacksonCodec.toBytes(instance.release()));
        log.info("Activated engine version {} (deleted stores: {})", instance.version().number(), deleted);
        events.publish(EngineEventType.ACTIVATED, Map.of(
                "version", instance.version().number(),
                "deletedStores", deleted));
    }

    private void openStores(EngineInstance instance) {
        EngineRelease release = instance.release();
        List<String> names = new ArrayList<>();
        for (CacheStoreConfig cfg : release.stores()) names.add(cfg.name());
        if (!names.contains(release.defaultStore())) names.add(release.defaultStore());
        release.routes().forEach(r -> {
            if (!names.contains(r.storeName())) names.add(r.storeName());
        });
        for (String store : names) {
            caches.open(instance.qualify(store), release.storeConfig(store));
        }
    }

    private void deleteStoresOf(EngineInstance instance) {
        for (String name : caches.storeNames()) {
            if (name.startsWith(instance.storePrefix())) {
                caches.retireStore(name);
            }
        }
    }

    private void precache(EngineInstance instance) {
        String store = instance.defaultStoreName();
        List<CompletableFuture<Void>> loads = new ArrayList<>();
        for (String url : instance.release().precacheUrls()) {
            ResourceRequest request = ResourceRequest.get(url);
            loads.add(network.fetch(request, timeout)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .thenAccept(resp -> storePrecached(store, request, resp)));
        }
        try {
            CompletableFuture.allOf(loads.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException ex) {
            throw ex.getCause() instanceof RuntimeException ? (RuntimeException) ex.getCause() : ex;
        }
        log.info("Precached {} resource(s) into {}", loads.size(), store);
    }

    private void storePrecached(String store, ResourceRequest request, ResourceResponse resp) {
        if (!resp.isSuccessful()) {
            throw new IllegalStateException("Precache of " + request.target() + " returned " + resp.status());
        }
        if (caches.put(store, request.cacheKey(), resp) == null) {
            throw new IllegalStateException("Cache store " + store + " was retired during precaching");
        }
    }

    private EngineRelease readPersistedRelease() {
        byte[] raw = blobStore.get(ACTIVE_RELEASE_KEY);
        if (raw == null) return null;
        try {
            return JacksonCodec.fromBytes(raw, EngineRelease.class);
        } catch (MiniOfflineSerializationException ex) {
            log.warn("Ignoring unreadable persisted release: {}", ex.getMessage());
            return null;
        }
    }

    /**
     * @return aktive Instanz
     * @throws IllegalStateException vor der ersten Aktivierung
     */
    public EngineInstance active() {
        EngineInstance a = active;
        if (a == null) throw new IllegalStateException("No active engine version");
        return a;
    }

    /** @return wartende Instanz, falls vorhanden */
    public synchronized Optional<EngineInstance> waiting() {
        return Optional.ofNullable(waiting);
    }

    /** @return Anzahl angemeldeter Host-Clients */
    public synchronized int attachedClients() {
        return attachedClients;
    }

    /** Handle eines angemeldeten Host-Clients. */
    @FunctionalInterface
    public interface ClientHandle extends AutoCloseable {
        @Override
        void close();
    }
}
