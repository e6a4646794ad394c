package de.htwsaar.minioffline.engine.cache;

import java.util.Objects;

/**
 * Grenzen eines benannten Cache-Stores.
 *
 * @param name          Store-Name (ohne Versionspräfix, z. B. {@code static})
 * @param maxEntries    maximale Einträge (0 = unbegrenzt)
 * @param maxAgeSeconds maximales Alter in Sekunden (0 = unbegrenzt)
 */
public record CacheStoreConfig(String name, int maxEntries, long maxAgeSeconds) {

    public CacheStoreConfig {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank() || name.contains("/")) {
            throw new IllegalArgumentException("Invalid store name: '" + name + "'");
        }
        maxEntries = Math.max(0, maxEntries);
        maxAgeSeconds = Math.max(0, maxAgeSeconds);
    }

    /**
     * Store ohne Grenzen.
     *
     * @param name Store-Name
     * @return unbegrenzte Konfiguration
     */
    public static CacheStoreConfig unlimited(String name) {
        return new CacheStoreConfig(name, 0, 0);
    }

    /**
     * Gleiche Grenzen unter anderem Namen (z. B. versionsqualifiziert).
     *
     * @param newName neuer Name
     * @return Kopie
     */
    public CacheStoreConfig renamed(String newName) {
        return new CacheStoreConfig(newName, maxEntries, maxAgeSeconds);
    }
}
