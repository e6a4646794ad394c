package de.htwsaar.minioffline.engine.domain;

/**
 * Fachliche Exception für gescheiterte Netzwerkzugriffe.
 */
public class NetworkException extends RuntimeException {

    /** Art des Fehlschlags. */
    public enum Kind {
        /** Upstream nicht erreichbar. */
        OFFLINE,
        /** Keine Antwort innerhalb der Frist. */
        TIMEOUT,
        /** Upstream hat mit einem Fehlerstatus geantwortet. */
        UPSTREAM_STATUS
    }

    private final Kind kind;
    private final int statusCode;

    public NetworkException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = 0;
    }

    public NetworkException(String message, int statusCode) {
        super(message);
        this.kind = Kind.UPSTREAM_STATUS;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * HTTP-Status des Upstreams.
     *
     * @return Status oder {@code 0}, wenn keine Antwort vorlag
     */
    public int getStatusCode() {
        return statusCode;
    }

    /** @return {@code true} bei Offline oder Timeout */
    public boolean isConnectivityFailure() {
        return kind != Kind.UPSTREAM_STATUS;
    }
}
