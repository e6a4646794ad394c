package de.htwsaar.minioffline.engine.messaging;

import de.htwsaar.minioffline.common.messaging.EngineEventType;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verfolgt den Online-/Offline-Zustand anhand beobachteter Netzwerkzugriffe.
 *
 * <p>Nur Übergänge erzeugen Ereignisse: {@code offline-mode} beim ersten Verbindungsfehler,
 * {@code online-mode} bei der ersten Antwort danach. Beim Übergang nach online laufen die
 * registrierten Reconnect-Aktionen (z. B. das Sync-Replay).</p>
 */
public class ConnectivityMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

    private final HostEventBus events;
    private final AtomicBoolean online = new AtomicBoolean(true);
    private final List<Runnable> reconnectActions = new CopyOnWriteArrayList<>();

    public ConnectivityMonitor(HostEventBus events) {
        this.events = Objects.requireNonNull(events, "events must not be null");
    }

    /**
     * Registriert eine Aktion für den Übergang nach online.
     *
     * @param action Aktion
     */
    public void onReconnect(Runnable action) {
        reconnectActions.add(Objects.requireNonNull(action, "action must not be null"));
    }

    /**
     * Meldet einen Verbindungsfehler.
     *
     * @param reason Grund (für Log und Ereignis)
     */
    public void reportFailure(String reason) {
        if (online.compareAndSet(true, false)) {
            log.warn("Upstream unreachable, switching to offline mode: {}", reason);
            events.publish(EngineEventType.OFFLINE_MODE, Map.of("reason", reason == null ? "" : reason));
        }
    }

    /** Meldet eine erhaltene Antwort. */
    public void reportSuccess() {
        if (online.compareAndSet(false, true)) {
            log.info("Upstream reachable again, switching to online mode");
            events.publish(EngineEventType.ONLINE_MODE, Map.of());
            for (Runnable action : reconnectActions) {
                try {
                    action.run();
                } catch (RuntimeException ex) {
                    log.warn("Reconnect action failed: {}", ex.getMessage());
                }
            }
        }
    }

    public boolean isOnline() {
        return online.get();
    }
}
