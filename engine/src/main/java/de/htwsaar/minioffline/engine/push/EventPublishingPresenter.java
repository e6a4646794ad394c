package de.htwsaar.minioffline.engine.push;

import de.htwsaar.minioffline.common.messaging.EngineEventType;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Standard-Adapter beider Push-Ports: leitet Anzeige und Navigation als Host-Ereignisse weiter.
 */
public final class EventPublishingPresenter implements NotificationPresenter, ClientNavigator {

    private final HostEventBus events;

    public EventPublishingPresenter(HostEventBus events) {
        this.events = Objects.requireNonNull(events, "events must not be null");
    }

    @Override
    public void show(NotificationPayload payload) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", payload.title());
        data.put("body", payload.body());
        data.put("icon", payload.icon());
        data.put("badge", payload.badge());
        data.put("tag", payload.tag());
        data.put("actions", payload.actions());
        data.put("data", payload.data());
        data.put("requireInteraction", payload.requireInteraction());
        data.put("silent", payload.silent());
        events.publish(EngineEventType.SHOW_NOTIFICATION, data);
    }

    @Override
    public void openOrFocus(String url) {
        events.publish(EngineEventType.OPEN_VIEW, Map.of("url", url));
    }
}
