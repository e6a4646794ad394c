package de.htwsaar.minioffline.engine.cache;

/**
 * Gespeicherte Antwort zu einem Request-Schlüssel.
 *
 * @param requestKey Pfad inkl. Query
 * @param snapshot   Antwort-Snapshot
 * @param storedAtMs Schreibzeitpunkt
 * @param sequence   globale Einfügereihenfolge
 */
public record CacheEntry(String requestKey, ResponseSnapshot snapshot, long storedAtMs, long sequence) {

    /**
     * Prüft die Frische gegen das maximale Alter.
     *
     * @param nowMs         aktueller Zeitpunkt
     * @param maxAgeSeconds maximales Alter (0 = unbegrenzt)
     * @return {@code true}, wenn frisch
     */
    public boolean isFresh(long nowMs, long maxAgeSeconds) {
        return maxAgeSeconds <= 0 || nowMs - storedAtMs < maxAgeSeconds * 1000L;
    }
}
