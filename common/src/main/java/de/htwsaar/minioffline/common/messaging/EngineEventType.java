package de.htwsaar.minioffline.common.messaging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ereignisse, die die Engine an den Host meldet.
 * Die Darstellung (Banner, Reload-Prompt, ...) ist Sache des Hosts.
 */
public enum EngineEventType {
    UPDATE_AVAILABLE("update-available"),
    ACTIVATED("activated"),
    OFFLINE_MODE("offline-mode"),
    ONLINE_MODE("online-mode"),
    CACHE_UPDATED("cache-updated"),
    SYNC_COMPLETED("sync-completed"),
    SYNC_FAILED("sync-failed"),
    REPLAY_EXHAUSTED("replay-exhausted"),
    SHOW_NOTIFICATION("show-notification"),
    OPEN_VIEW("open-view");

    private final String id;

    EngineEventType(String id) {
        this.id = id;
    }

    /**
     * Wire-Name des Ereignisses (z. B. {@code offline-mode}).
     *
     * @return Wire-Name
     */
    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static EngineEventType fromId(String id) {
        for (EngineEventType t : values()) {
            if (t.id.equalsIgnoreCase(id) || t.name().equalsIgnoreCase(id)) return t;
        }
        throw new IllegalArgumentException("Unknown engine event: " + id);
    }
}
