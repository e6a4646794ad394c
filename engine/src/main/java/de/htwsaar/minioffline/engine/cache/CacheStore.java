package de.htwsaar.minioffline.engine.cache;

import java.util.List;

/**
 * Ein benannter, begrenzter Cache-Store.
 */
public interface CacheStore {

    /** @return versionsqualifizierter Name */
    String name();

    /** @return Grenzen dieses Stores */
    CacheStoreConfig config();

    /**
     * Gibt einen frischen Eintrag zurück oder {@code null} wenn abgelaufen/nicht vorhanden.
     * Abgelaufene Einträge bleiben liegen, bis sie verdrängt oder überschrieben werden.
     *
     * @param key   Cache-Schlüssel
     * @param nowMs aktueller Zeitstempel in ms
     * @return frischer Eintrag oder {@code null}
     */
    CacheEntry getFresh(String key, long nowMs);

    /**
     * Speichert einen Eintrag und erzwingt danach die Grenzen.
     *
     * @param entry Eintrag
     * @return Schlüssel der dabei verdrängten Einträge
     */
    List<String> put(CacheEntry entry);

    /**
     * Entfernt einen einzelnen Eintrag.
     *
     * @param key Cache-Schlüssel
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    boolean remove(String key);

    /**
     * Verdrängt die ältesten Einträge, bis {@code maxEntries} eingehalten ist.
     *
     * @return verdrängte Schlüssel
     */
    List<String> enforceLimits();

    /** @return Schlüssel in Einfügereihenfolge */
    List<String> keys();

    /** @return Eintragsanzahl */
    int size();
}
