package de.htwsaar.minioffline.engine.push;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inhalt einer Push-Nachricht.
 *
 * @param title              Titel
 * @param body               Text
 * @param icon               Icon-URL
 * @param badge              Badge-URL
 * @param tag                Gruppierungs-Tag
 * @param actions            Schaltflächen
 * @param data               freie Daten, z. B. {@code url}
 * @param requireInteraction bleibt bis zur Interaktion sichtbar
 * @param silent             ohne Ton/Vibration
 */
public record NotificationPayload(
        String title,
        String body,
        String icon,
        String badge,
        String tag,
        List<NotificationAction> actions,
        Map<String, Object> data,
        boolean requireInteraction,
        boolean silent) {

    public static final String DEFAULT_ICON = "/icon-192x192.png";
    public static final String DEFAULT_BADGE = "/badge-72x72.png";

    public NotificationPayload {
        actions = actions == null ? List.of() : List.copyOf(actions);
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /** @return {@code true}, wenn weder Titel noch Text gesetzt sind */
    public boolean isEmpty() {
        return isBlank(title) && isBlank(body);
    }

    /** @return Kopie mit Standard-Icon und -Badge, wo nichts gesetzt ist */
    public NotificationPayload withDefaults() {
        return new NotificationPayload(
                title,
                body,
                isBlank(icon) ? DEFAULT_ICON : icon,
                isBlank(badge) ? DEFAULT_BADGE : badge,
                tag,
                actions,
                data,
                requireInteraction,
                silent);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
