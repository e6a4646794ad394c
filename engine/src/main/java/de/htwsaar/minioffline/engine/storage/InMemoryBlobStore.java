package de.htwsaar.minioffline.engine.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flüchtiger {@link BlobStore} für Tests und {@code engine.storage.type=memory}.
 *
 * <p>Thread-Safety: einfaches {@code synchronized}.</p>
 */
public final class InMemoryBlobStore implements BlobStore {

    private final Map<String, byte[]> blobs = new LinkedHashMap<>();

    @Override
    public synchronized byte[] get(String key) {
        byte[] v = blobs.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        // Überschreiben zählt als neuer Schreibvorgang
        blobs.remove(key);
        blobs.put(key, value.clone());
    }

    @Override
    public synchronized boolean delete(String key) {
        return blobs.remove(key) != null;
    }

    @Override
    public synchronized List<String> list(String prefix) {
        String p = prefix == null ? "" : prefix;
        List<String> keys = new ArrayList<>();
        for (String k : blobs.keySet()) {
            if (k.startsWith(p)) keys.add(k);
        }
        return keys;
    }

    /**
     * Anzahl gespeicherter Werte.
     *
     * @return Eintragsanzahl
     */
    public synchronized int size() {
        return blobs.size();
    }
}
