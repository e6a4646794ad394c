package de.htwsaar.minioffline.engine.cache;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FIFO Cache-Store via {@link LinkedHashMap} in Einfügereihenfolge.
 *
 * <p>Lesezugriffe verändern die Reihenfolge nicht; ein Überschreiben zählt als neue Einfügung.
 * Thread-Safety: {@code synchronized} pro Store, andere Stores bleiben unberührt.</p>
 */
public final class FifoCacheStore implements CacheStore {

    private final String name;
    private final CacheStoreConfig config;
    private final Map<String, CacheEntry> map = new LinkedHashMap<>();

    /**
     * @param name   versionsqualifizierter Name
     * @param config Grenzen
     */
    public FifoCacheStore(String name, CacheStoreConfig config) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CacheStoreConfig config() {
        return config;
    }

    @Override
    public synchronized CacheEntry getFresh(String key, long nowMs) {
        if (key == null || key.isBlank()) return null;
        CacheEntry e = map.get(key);
        if (e == null || !e.isFresh(nowMs, config.maxAgeSeconds())) return null;
        return e;
    }

    @Override
    public synchronized List<String> put(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        map.remove(entry.requestKey());
        map.put(entry.requestKey(), entry);
        return enforceLimits();
    }

    @Override
    public synchronized boolean remove(String key) {
        if (key == null) return false;
        return map.remove(key) != null;
    }

    @Override
    public synchronized List<String> enforceLimits() {
        List<String> evicted = new ArrayList<>();
        int max = config.maxEntries();
        if (max <= 0) return evicted;
        Iterator<String> it = map.keySet().iterator();
        while (map.size() > max && it.hasNext()) {
            evicted.add(it.next());
            it.remove();
        }
        return evicted;
    }

    @Override
    public synchronized List<String> keys() {
        return new ArrayList<>(map.keySet());
    }

    @Override
    public synchronized int size() {
        return map.size();
    }
}
