package de.htwsaar.minioffline.engine.push;

/**
 * Schaltfläche einer Benachrichtigung.
 *
 * @param action Aktions-ID ({@code view}, {@code dismiss}, ...)
 * @param title  Beschriftung
 * @param icon   optionales Icon
 */
public record NotificationAction(String action, String title, String icon) {}
