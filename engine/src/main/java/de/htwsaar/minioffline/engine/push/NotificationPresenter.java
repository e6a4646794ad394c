package de.htwsaar.minioffline.engine.push;

/**
 * Port zur Anzeige von Benachrichtigungen durch den Host.
 */
public interface NotificationPresenter {

    /**
     * Zeigt eine Benachrichtigung an.
     *
     * @param payload Inhalt inkl. Standardwerten
     */
    void show(NotificationPayload payload);
}
