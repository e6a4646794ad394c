package de.htwsaar.minioffline.common.messaging;

/**
 * Geschlossene Menge der Nachrichten, die der Host an die Engine senden kann.
 *
 * <p>Neue Typen erzwingen eine Anpassung des Handlers in der Engine,
 * da dort per erschöpfendem {@code switch} verzweigt wird.</p>
 */
public enum MessageType {
    /** Wartende Engine-Version sofort aktivieren. */
    SKIP_WAITING,
    /** URLs in den Default-Store der aktiven Version laden ({@code data.urls}). */
    CACHE_URLS,
    /** Einen Store ({@code data.cacheName}) oder alle Stores löschen. */
    CLEAR_CACHE,
    /** Statistik je Store: {@code {storeName: {size, urls}}}. */
    GET_CACHE_STATS
}
