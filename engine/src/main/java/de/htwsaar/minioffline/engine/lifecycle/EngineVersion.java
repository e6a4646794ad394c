package de.htwsaar.minioffline.engine.lifecycle;

/**
 * Monoton steigende Engine-Version; Teil jedes Store-Namens.
 *
 * @param number Versionsnummer (&gt;= 1)
 */
public record EngineVersion(int number) implements Comparable<EngineVersion> {

    public EngineVersion {
        if (number < 1) throw new IllegalArgumentException("version must be >= 1, got " + number);
    }

    /**
     * @param cachePrefix Anwendungspräfix, z. B. {@code mini-offline}
     * @return Präfix aller Stores dieser Version, z. B. {@code mini-offline-v3-}
     */
    public String storePrefix(String cachePrefix) {
        return cachePrefix + "-v" + number + "-";
    }

    /**
     * @param cachePrefix Anwendungspräfix
     * @param store       Store-Name ohne Präfix
     * @return versionsqualifizierter Name, z. B. {@code mini-offline-v3-static}
     */
    public String storeName(String cachePrefix, String store) {
        return storePrefix(cachePrefix) + store;
    }

    public boolean isNewerThan(EngineVersion other) {
        return other == null || number > other.number;
    }

    @Override
    public int compareTo(EngineVersion o) {
        return Integer.compare(number, o.number);
    }
}
