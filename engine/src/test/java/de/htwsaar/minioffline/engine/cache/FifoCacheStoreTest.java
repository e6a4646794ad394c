package de.htwsaar.minioffline.engine.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verhalten des FIFO-Stores: Verdrängung, Überschreiben und lazy Ablauf.
 */
class FifoCacheStoreTest {

    @Test
    void shouldEvictOldestEntryWhenLimitIsExceeded() {
        FifoCacheStore store = new FifoCacheStore("s", new CacheStoreConfig("s", 3, 0));

        store.put(entry("/a", 0));
        store.put(entry("/b", 0));
        store.put(entry("/c", 0));
        List<String> evicted = store.put(entry("/d", 0));

        assertEquals(List.of("/a"), evicted);
        assertEquals(List.of("/b", "/c", "/d"), store.keys());
    }

    @Test
    void readsShouldNotChangeEvictionOrder() {
        FifoCacheStore store = new FifoCacheStore("s", new CacheStoreConfig("s", 2, 0));
        store.put(entry("/a", 0));
        store.put(entry("/b", 0));

        assertNotNull(store.getFresh("/a", 0));
        store.put(entry("/c", 0));

        assertNull(store.getFresh("/a", 0), "/a ist trotz Lesezugriff der älteste Eintrag");
        assertEquals(List.of("/b", "/c"), store.keys());
    }

    @Test
    void overwriteShouldMoveEntryToNewestPosition() {
        FifoCacheStore store = new FifoCacheStore("s", new CacheStoreConfig("s", 2, 0));
        store.put(entry("/a", 0));
        store.put(entry("/b", 0));
        store.put(entry("/a", 10));

        store.put(entry("/c", 20));

        assertEquals(List.of("/a", "/c"), store.keys());
    }

    @Test
    void expiredEntryShouldBeInvisibleButStayUntilEvicted() {
        FifoCacheStore store = new FifoCacheStore("s", new CacheStoreConfig("s", 0, 60));
        store.put(entry("/a", 1_000));

        assertNotNull(store.getFresh("/a", 60_999));
        assertNull(store.getFresh("/a", 61_000), "Eintrag ist nach maxAge abgelaufen");
        assertEquals(1, store.size());
    }

    @Test
    void zeroLimitsShouldMeanUnlimited() {
        FifoCacheStore store = new FifoCacheStore("s", CacheStoreConfig.unlimited("s"));
        for (int i = 0; i < 500; i++) {
            store.put(entry("/r" + i, 0));
        }

        assertEquals(500, store.size());
        assertNotNull(store.getFresh("/r0", Long.MAX_VALUE / 2));
    }

    private static CacheEntry entry(String key, long storedAtMs) {
        ResponseSnapshot snapshot = new ResponseSnapshot(200, Map.of(), key.getBytes(), null);
        return new CacheEntry(key, snapshot, storedAtMs, storedAtMs);
    }
}
