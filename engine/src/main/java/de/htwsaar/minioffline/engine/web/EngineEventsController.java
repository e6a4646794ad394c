package de.htwsaar.minioffline.engine.web;

import de.htwsaar.minioffline.common.messaging.EngineEvent;
import de.htwsaar.minioffline.engine.lifecycle.LifecycleManager;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Ereignisstrom Engine → Host als Server-Sent Events.
 *
 * <p>Jeder Abonnent zählt als angemeldeter Host-Client; endet der Strom, meldet er sich ab.</p>
 */
@RestController
@RequestMapping("/_engine")
public class EngineEventsController {

    private static final Logger log = LoggerFactory.getLogger(EngineEventsController.class);

    private final HostEventBus events;
    private final LifecycleManager lifecycle;

    public EngineEventsController(HostEventBus events, LifecycleManager lifecycle) {
        this.events = events;
        this.lifecycle = lifecycle;
    }

    /**
     * Öffnet einen Ereignisstrom ohne Zeitlimit.
     *
     * @return SSE-Emitter
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        LifecycleManager.ClientHandle client = lifecycle.attachClient();
        HostEventBus.Subscription[] subscription = new HostEventBus.Subscription[1];
        Runnable detach = () -> {
            if (subscription[0] != null) subscription[0].close();
            client.close();
        };
        subscription[0] = events.subscribe(event -> send(emitter, event, detach));
        emitter.onCompletion(detach);
        emitter.onTimeout(detach);
        emitter.onError(ex -> detach.run());
        return emitter;
    }

    private static void send(SseEmitter emitter, EngineEvent event, Runnable detach) {
        try {
            emitter.send(SseEmitter.event().name(event.type().id()).data(event, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException ex) {
            log.debug("Dropping event subscriber: {}", ex.getMessage());
            detach.run();
            emitter.completeWithError(ex);
        }
    }
}
