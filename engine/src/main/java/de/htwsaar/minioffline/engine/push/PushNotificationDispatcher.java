package de.htwsaar.minioffline.engine.push;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nimmt Push-Nachrichten und Benachrichtigungs-Interaktionen entgegen.
 *
 * <p>Die Anzeige läuft fire-and-forget auf dem Engine-Executor. Jede Interaktion führt zu genau
 * einer Reaktion: {@code view} und ein einfacher Klick öffnen {@code data.url} (Standard {@code /}),
 * {@code dismiss} verwirft, unbekannte Aktionen öffnen die Startansicht.</p>
 */
public class PushNotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationDispatcher.class);

    static final String ROOT_VIEW = "/";

    private final NotificationPresenter presenter;
    private final ClientNavigator navigator;
    private final Executor executor;

    /**
     * @param presenter Anzeige-Port
     * @param navigator Navigations-Port
     * @param executor  Engine-Executor
     */
    public PushNotificationDispatcher(NotificationPresenter presenter, ClientNavigator navigator, Executor executor) {
        this.presenter = Objects.requireNonNull(presenter, "presenter must not be null");
        this.navigator = Objects.requireNonNull(navigator, "navigator must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Verarbeitet eine Push-Nachricht.
     *
     * @param payload Inhalt (leere Nachrichten werden ignoriert)
     * @return Future, das nach der Übergabe an den Presenter abschließt; {@code null}-Wert bei leerer Nachricht
     */
    public CompletableFuture<NotificationPayload> onPush(NotificationPayload payload) {
        if (payload == null || payload.isEmpty()) {
            log.debug("Ignoring empty push payload");
            return CompletableFuture.completedFuture(null);
        }
        NotificationPayload effective = payload.withDefaults();
        return CompletableFuture.supplyAsync(() -> {
            try {
                presenter.show(effective);
            } catch (RuntimeException ex) {
                log.warn("Presenting notification '{}' failed: {}", effective.title(), ex.getMessage());
            }
            return effective;
        }, executor);
    }

    /**
     * Reagiert auf eine Interaktion mit einer Benachrichtigung.
     *
     * @param action Aktions-ID oder {@code null}/leer für einen einfachen Klick
     * @param data   Daten der Benachrichtigung
     * @return geöffnete URL oder {@code null} bei {@code dismiss}
     */
    public String onNotificationAction(String action, Map<String, Object> data) {
        String a = action == null ? "" : action.trim();
        String target;
        switch (a) {
            case "dismiss" -> {
                log.debug("Notification dismissed");
                return null;
            }
            case "view", "" -> target = urlOf(data);
            default -> target = ROOT_VIEW;
        }
        navigator.openOrFocus(target);
        return target;
    }

    private static String urlOf(Map<String, Object> data) {
        Object url = data == null ? null : data.get("url");
        return url instanceof String && !((String) url).isBlank() ? (String) url : ROOT_VIEW;
    }
}
