package de.htwsaar.minioffline.engine.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Caching-Strategien; die Wire-ID entspricht der Schreibweise in Routentabellen.
 */
public enum Strategy {
    CACHE_FIRST("cache-first"),
    NETWORK_FIRST("network-first"),
    STALE_WHILE_REVALIDATE("stale-while-revalidate"),
    NETWORK_ONLY("network-only"),
    CACHE_ONLY("cache-only");

    private final String id;

    Strategy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Akzeptiert Wire-ID ({@code cache-first}) und Enum-Namen ({@code CACHE_FIRST}).
     *
     * @param value Eingabe
     * @return Strategie
     * @throws IllegalArgumentException bei unbekanntem Wert
     */
    @JsonCreator
    public static Strategy fromId(String value) {
        if (value == null) throw new IllegalArgumentException("Strategy must not be null");
        String v = value.trim();
        for (Strategy s : values()) {
            if (s.id.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v.replace('-', '_').toUpperCase(Locale.ROOT))) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
