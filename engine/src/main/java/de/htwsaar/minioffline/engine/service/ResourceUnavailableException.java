package de.htwsaar.minioffline.engine.service;

import de.htwsaar.minioffline.engine.strategy.Strategy;

/**
 * Fachliche Exception an der Host-Grenze: die Ressource ist weder live noch als Ersatz verfügbar.
 * Wird im Web-Layer in HTTP-Statuscodes gemappt.
 */
public class ResourceUnavailableException extends RuntimeException {

    /** Grund der Nichtverfügbarkeit. */
    public enum Reason {
        OFFLINE,
        UPSTREAM_ERROR
    }

    private final Reason reason;
    private final String url;
    private final Strategy strategy;
    private final int upstreamStatus;

    /**
     * @param reason         Grund
     * @param url            angefragte URL
     * @param strategy       angewandte Strategie
     * @param message        Fehlerbeschreibung
     * @param upstreamStatus Status des Upstreams (0, wenn keiner vorlag)
     * @param cause          Ursache
     */
    public ResourceUnavailableException(
            Reason reason, String url, Strategy strategy, String message, int upstreamStatus, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.url = url;
        this.strategy = strategy;
        this.upstreamStatus = upstreamStatus;
    }

    public Reason getReason() {
        return reason;
    }

    public String getUrl() {
        return url;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    /**
     * Gibt den zugehörigen HTTP-Statuscode zurück.
     *
     * @return 503 für {@code OFFLINE}, sonst der Upstream-Status (Standard 502)
     */
    public int getStatusCode() {
        if (reason == Reason.OFFLINE) return 503;
        return upstreamStatus >= 500 ? upstreamStatus : 502;
    }
}
