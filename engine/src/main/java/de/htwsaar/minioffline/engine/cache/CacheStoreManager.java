package de.htwsaar.minioffline.engine.cache;

import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import de.htwsaar.minioffline.common.serialization.MiniOfflineSerializationException;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.storage.BlobStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verwaltet alle benannten Cache-Stores und schreibt jede Änderung in den {@link BlobStore} durch.
 *
 * <p>Layout im Blob-Store: {@code stores/<name>} enthält die Grenzen eines Stores,
 * {@code cache/<name>/<key>} je einen Eintrag. Operationen auf einem Store sperren nur diesen Store.</p>
 *
 * <p>Die Grenzen eines geöffneten Stores bleiben bekannt, bis er mit {@link #retireStore(String)}
 * aufgegeben wird. Ein geleerter Store wird beim nächsten Schreiben mit denselben Grenzen neu angelegt;
 * Schreibzugriffe auf unbekannte oder aufgegebene Stores werden verworfen.</p>
 */
public class CacheStoreManager {

    private static final Logger log = LoggerFactory.getLogger(CacheStoreManager.class);

    static final String STORE_PREFIX = "stores/";
    static final String ENTRY_PREFIX = "cache/";

    private final BlobStore blobStore;
    private final Clock clock;
    private final Map<String, CacheStore> stores = new ConcurrentHashMap<>();
    private final Map<String, CacheStoreConfig> configured = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param blobStore dauerhafter Speicher
     * @param clock     Zeitquelle für Schreibzeitpunkte und Frische
     */
    public CacheStoreManager(BlobStore blobStore, Clock clock) {
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Öffnet einen Store oder gibt den bereits geöffneten zurück.
     *
     * @param storeName versionsqualifizierter Name
     * @param config    Grenzen (gelten nur beim ersten Öffnen)
     * @return Store
     */
    public CacheStore open(String storeName, CacheStoreConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        configured.putIfAbsent(storeName, config.renamed(storeName));
        return stores.computeIfAbsent(storeName, this::createConfigured);
    }

    /** Legt einen Store mit seinen bekannten Grenzen an; {@code null}, wenn keine bekannt sind. */
    private CacheStore createConfigured(String name) {
        CacheStoreConfig persisted = configured.get(name);
        if (persisted == null) return null;
        blobStore.put(STORE_PREFIX + name, JacksonCodec.toBytes(persisted));
        log.debug("Opened cache store {} (maxEntries={}, maxAgeSeconds={})",
                name, persisted.maxEntries(), persisted.maxAgeSeconds());
        return new FifoCacheStore(name, persisted);
    }

    /**
     * Öffnet einen Store mit seinen bekannten Grenzen, ohne Grenzen falls keine bekannt sind.
     *
     * @param storeName versionsqualifizierter Name
     * @return Store
     */
    public CacheStore open(String storeName) {
        CacheStore existing = stores.get(storeName);
        if (existing != null) return existing;
        return open(storeName, configured.getOrDefault(storeName, CacheStoreConfig.unlimited(storeName)));
    }

    /**
     * Liest einen frischen Eintrag.
     *
     * @param storeName Store
     * @param key       Request-Schlüssel
     * @return Eintrag oder {@code null} bei Miss, abgelaufenem Eintrag oder unbekanntem Store
     */
    public CacheEntry get(String storeName, String key) {
        CacheStore store = stores.get(storeName);
        return store == null ? null : store.getFresh(key, clock.millis());
    }

    /**
     * Speichert eine Antwort und erzwingt danach die Grenzen des Stores.
     *
     * @param storeName Store; ein geleerter Store wird mit seinen Grenzen neu geöffnet
     * @param key       Request-Schlüssel
     * @param response  zu speichernde Antwort
     * @return gespeicherter Eintrag oder {@code null}, wenn der Store unbekannt oder aufgegeben ist
     */
    public CacheEntry put(String storeName, String key, ResourceResponse response) {
        CacheStore store = stores.computeIfAbsent(storeName, this::createConfigured);
        if (store == null) {
            log.debug("Dropping write of {} to unknown cache store {}", key, storeName);
            return null;
        }
        CacheEntry entry = new CacheEntry(
                key, ResponseSnapshot.of(response), clock.millis(), sequence.incrementAndGet());
        synchronized (store) {
            if (stores.get(storeName) != store) {
                log.debug("Dropping write of {} to deleted cache store {}", key, storeName);
                return null;
            }
            List<String> evicted = store.put(entry);
            blobStore.put(entryKey(storeName, key), JacksonCodec.toBytes(entry));
            deleteEntryBlobs(storeName, evicted);
        }
        return entry;
    }

    /**
     * Entfernt einen Eintrag.
     *
     * @param storeName Store
     * @param key       Request-Schlüssel
     * @return {@code true}, wenn ein Eintrag entfernt wurde
     */
    public boolean delete(String storeName, String key) {
        CacheStore store = stores.get(storeName);
        if (store == null) return false;
        synchronized (store) {
            boolean removed = store.remove(key);
            blobStore.delete(entryKey(storeName, key));
            return removed;
        }
    }

    /**
     * Verdrängt die ältesten Einträge, bis die Grenze des Stores eingehalten ist.
     *
     * @param storeName Store
     * @return verdrängte Schlüssel
     */
    public List<String> enforceLimits(String storeName) {
        CacheStore store = stores.get(storeName);
        if (store == null) return List.of();
        synchronized (store) {
            List<String> evicted = store.enforceLimits();
            deleteEntryBlobs(storeName, evicted);
            return evicted;
        }
    }

    /**
     * Löscht einen Store samt aller Einträge. Seine Grenzen bleiben für ein erneutes Öffnen bekannt.
     *
     * @param storeName Store
     * @return {@code true}, wenn der Store existierte
     */
    public boolean deleteStore(String storeName) {
        CacheStore removed = stores.remove(storeName);
        boolean persisted;
        if (removed != null) {
            synchronized (removed) {
                persisted = deleteBlobsOf(storeName);
            }
        } else {
            persisted = deleteBlobsOf(storeName);
        }
        if (removed != null || persisted) {
            log.info("Deleted cache store {}", storeName);
            return true;
        }
        return false;
    }

    /**
     * Löscht einen Store und vergisst seine Grenzen; spätere Schreibzugriffe werden verworfen.
     *
     * @param storeName Store
     * @return {@code true}, wenn der Store existierte
     */
    public boolean retireStore(String storeName) {
        configured.remove(storeName);
        return deleteStore(storeName);
    }

    private boolean deleteBlobsOf(String storeName) {
        boolean persisted = blobStore.delete(STORE_PREFIX + storeName);
        for (String blobKey : blobStore.list(ENTRY_PREFIX + storeName + "/")) {
            blobStore.delete(blobKey);
        }
        return persisted;
    }

    /**
     * Gibt alle Stores auf, deren Name nicht mit {@code prefix} beginnt.
     *
     * @param prefix zu behaltendes Präfix (z. B. {@code mini-offline-v2-})
     * @return gelöschte Store-Namen
     */
    public List<String> deleteStoresExcept(String prefix) {
        List<String> deleted = new ArrayList<>();
        for (String name : storeNames()) {
            if (!name.startsWith(prefix) && retireStore(name)) {
                deleted.add(name);
            }
        }
        return deleted;
    }

    /** @return alle bekannten Store-Namen, sortiert */
    public List<String> storeNames() {
        TreeSet<String> names = new TreeSet<>(stores.keySet());
        for (String blobKey : blobStore.list(STORE_PREFIX)) {
            names.add(blobKey.substring(STORE_PREFIX.length()));
        }
        return new ArrayList<>(names);
    }

    /**
     * Sucht einen frischen Eintrag in allen Stores mit dem Präfix.
     *
     * @param storePrefix Präfix der aktiven Version
     * @param key         Request-Schlüssel
     * @return erster Treffer (Stores alphabetisch) oder {@code null}
     */
    public CacheEntry match(String storePrefix, String key) {
        for (String name : storeNames()) {
            if (!name.startsWith(storePrefix)) continue;
            CacheEntry e = get(name, key);
            if (e != null) return e;
        }
        return null;
    }

    /**
     * Momentaufnahme aller geöffneten Stores.
     *
     * @return Store-Name → Größe und Schlüssel
     */
    public Map<String, StoreStats> stats() {
        Map<String, StoreStats> out = new LinkedHashMap<>();
        for (String name : new TreeSet<>(stores.keySet())) {
            CacheStore store = stores.get(name);
            if (store == null) continue;
            List<String> keys = store.keys();
            out.put(name, new StoreStats(keys.size(), keys));
        }
        return out;
    }

    /**
     * Lädt alle dauerhaft gespeicherten Stores und Einträge in Einfügereihenfolge.
     * Beschädigte Snapshots werden verworfen.
     *
     * @return Anzahl wiederhergestellter Einträge
     */
    public int restore() {
        int restored = 0;
        long maxSeq = sequence.get();
        for (String metaKey : blobStore.list(STORE_PREFIX)) {
            String name = metaKey.substring(STORE_PREFIX.length());
            CacheStoreConfig config = readConfig(metaKey, name);
            configured.putIfAbsent(name, config);
            CacheStore store = stores.computeIfAbsent(name, n -> new FifoCacheStore(n, config));
            synchronized (store) {
                for (String blobKey : blobStore.list(ENTRY_PREFIX + name + "/")) {
                    CacheEntry entry = readEntry(blobKey);
                    if (entry == null) {
                        blobStore.delete(blobKey);
                        continue;
                    }
                    store.put(entry);
                    maxSeq = Math.max(maxSeq, entry.sequence());
                    restored++;
                }
                deleteEntryBlobs(name, store.enforceLimits());
            }
        }
        sequence.set(maxSeq);
        log.info("Restored {} cache entries in {} stores", restored, stores.size());
        return restored;
    }

    private CacheStoreConfig readConfig(String metaKey, String name) {
        byte[] raw = blobStore.get(metaKey);
        if (raw == null) return CacheStoreConfig.unlimited(name);
        try {
            return JacksonCodec.fromBytes(raw, CacheStoreConfig.class).renamed(name);
        } catch (MiniOfflineSerializationException ex) {
            log.warn("Unreadable store config {}, using unlimited store: {}", metaKey, ex.getMessage());
            return CacheStoreConfig.unlimited(name);
        }
    }

    private CacheEntry readEntry(String blobKey) {
        byte[] raw = blobStore.get(blobKey);
        if (raw == null) return null;
        try {
            CacheEntry entry = JacksonCodec.fromBytes(raw, CacheEntry.class);
            if (entry.snapshot() == null || !entry.snapshot().isIntact()) {
                log.warn("Dropping corrupted cache snapshot {}", blobKey);
                return null;
            }
            return entry;
        } catch (MiniOfflineSerializationException ex) {
            log.warn("Dropping unreadable cache snapshot {}: {}", blobKey, ex.getMessage());
            return null;
        }
    }

    private void deleteEntryBlobs(String storeName, List<String> keys) {
        for (String key : keys) {
            blobStore.delete(entryKey(storeName, key));
        }
    }

    static String entryKey(String storeName, String key) {
        return ENTRY_PREFIX + storeName + "/" + key;
    }

    /**
     * Größe und Schlüssel eines Stores.
     *
     * @param size Eintragsanzahl
     * @param urls Request-Schlüssel in Einfügereihenfolge
     */
    public record StoreStats(int size, List<String> urls) {}
}
