package de.htwsaar.minioffline.engine.strategy;

/**
 * Die Strategie {@code cache-only} fand keinen Eintrag.
 */
public class CacheMissException extends RuntimeException {

    private final String storeName;
    private final String requestKey;

    public CacheMissException(String storeName, String requestKey) {
        super("No cached entry for " + requestKey + " in " + storeName);
        this.storeName = storeName;
        this.requestKey = requestKey;
    }

    public String getStoreName() {
        return storeName;
    }

    public String getRequestKey() {
        return requestKey;
    }
}
