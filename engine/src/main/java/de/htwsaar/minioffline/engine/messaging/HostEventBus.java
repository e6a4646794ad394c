package de.htwsaar.minioffline.engine.messaging;

import de.htwsaar.minioffline.common.messaging.EngineEvent;
import de.htwsaar.minioffline.common.messaging.EngineEventType;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verteilt Engine-Ereignisse fire-and-forget an alle angemeldeten Host-Listener.
 *
 * <p>Ein fehlerhafter Listener blockiert die übrigen nicht.</p>
 */
public class HostEventBus {

    private static final Logger log = LoggerFactory.getLogger(HostEventBus.class);

    private final List<Consumer<EngineEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public HostEventBus(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Meldet einen Listener an.
     *
     * @param listener Empfänger
     * @return Handle zum Abmelden
     */
    public Subscription subscribe(Consumer<EngineEvent> listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Veröffentlicht ein Ereignis.
     *
     * @param type Typ
     * @param data Kontextdaten (darf {@code null} sein)
     * @return das veröffentlichte Ereignis
     */
    public EngineEvent publish(EngineEventType type, Map<String, Object> data) {
        EngineEvent event = new EngineEvent(type, clock.instant(), data);
        log.debug("Publishing {} to {} listener(s)", type.id(), listeners.size());
        for (Consumer<EngineEvent> l : listeners) {
            try {
                l.accept(event);
            } catch (RuntimeException ex) {
                log.warn("Event listener failed for {}: {}", type.id(), ex.getMessage());
            }
        }
        return event;
    }

    /** @return Anzahl angemeldeter Listener */
    public int listenerCount() {
        return listeners.size();
    }

    /** Abmelde-Handle. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
