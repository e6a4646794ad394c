package de.htwsaar.minioffline.engine.domain;

/**
 * Herkunft einer ausgelieferten Antwort; wird als {@code X-Cache}-Header gespiegelt.
 */
public enum ResponseSource {
    NETWORK("MISS"),
    CACHE("HIT"),
    FALLBACK("FALLBACK"),
    QUEUED("QUEUED");

    private final String headerValue;

    ResponseSource(String headerValue) {
        this.headerValue = headerValue;
    }

    /** @return Wert für den {@code X-Cache}-Header */
    public String headerValue() {
        return headerValue;
    }
}
