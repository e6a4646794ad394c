package de.htwsaar.minioffline.engine.storage;

import java.util.List;

/**
 * Port für dauerhaften Zustand der Engine (Cache-Einträge, Sync-Queue, aktive Version).
 *
 * <p>Schlüssel sind hierarchische Strings wie {@code cache/<store>/<key>} oder
 * {@code sync/queue/<id>}; Werte sind rohe Bytes (typischerweise JSON).</p>
 */
public interface BlobStore {

    /**
     * Liest einen Wert.
     *
     * @param key Schlüssel
     * @return gespeicherte Bytes oder {@code null}, wenn nicht vorhanden
     */
    byte[] get(String key);

    /**
     * Schreibt oder überschreibt einen Wert.
     *
     * @param key   Schlüssel
     * @param value Bytes (darf nicht {@code null} sein)
     */
    void put(String key, byte[] value);

    /**
     * Entfernt einen Wert.
     *
     * @param key Schlüssel
     * @return {@code true}, wenn ein Wert entfernt wurde
     */
    boolean delete(String key);

    /**
     * Listet alle Schlüssel mit dem Präfix in Schreibreihenfolge.
     *
     * @param prefix Schlüssel-Präfix
     * @return Schlüssel, älteste zuerst
     */
    List<String> list(String prefix);
}
