package de.htwsaar.minioffline.engine.web;

import de.htwsaar.minioffline.engine.push.NotificationPayload;
import de.htwsaar.minioffline.engine.push.PushNotificationDispatcher;
import java.util.HashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Push-Eingang und Benachrichtigungs-Interaktionen.
 *
 * <ul>
 *   <li>POST /_engine/push – Push-Nachricht</li>
 *   <li>POST /_engine/notifications/actions – Klick oder Aktion</li>
 * </ul>
 */
@RestController
@RequestMapping("/_engine")
public class PushController {

    private final PushNotificationDispatcher dispatcher;

    public PushController(PushNotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * @param payload Push-Inhalt (leer wird ignoriert)
     * @return 202 mit Status
     */
    @PostMapping("/push")
    public ResponseEntity<Map<String, Object>> push(@RequestBody(required = false) NotificationPayload payload) {
        boolean accepted = payload != null && !payload.isEmpty();
        dispatcher.onPush(payload);
        return ResponseEntity.accepted().body(Map.of("accepted", accepted));
    }

    /**
     * @param interaction {@code {"action": "...", "data": {...}}}
     * @return geöffnete URL (oder {@code null} bei dismiss)
     */
    @PostMapping("/notifications/actions")
    public ResponseEntity<Map<String, Object>> action(@RequestBody NotificationInteraction interaction) {
        String opened = dispatcher.onNotificationAction(interaction.action(), interaction.data());
        Map<String, Object> body = new HashMap<>();
        body.put("opened", opened);
        return ResponseEntity.ok(body);
    }

    /**
     * @param action Aktions-ID oder leer für einen einfachen Klick
     * @param data   Daten der Benachrichtigung
     */
    public record NotificationInteraction(String action, Map<String, Object> data) {}
}
