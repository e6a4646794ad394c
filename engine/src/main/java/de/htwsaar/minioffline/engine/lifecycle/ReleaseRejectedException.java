package de.htwsaar.minioffline.engine.lifecycle;

/**
 * Installation abgelehnt, weil die Version nicht neuer als die aktive ist,
 * oder weil das Precaching scheiterte.
 */
public class ReleaseRejectedException extends RuntimeException {

    private final int version;

    public ReleaseRejectedException(int version, String message) {
        super(message);
        this.version = version;
    }

    public ReleaseRejectedException(int version, String message, Throwable cause) {
        super(message, cause);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
