package de.htwsaar.minioffline.engine.lifecycle;

/** Lebenszyklus einer Engine-Version. */
public enum LifecycleState {
    INSTALLING,
    /** Installiert und wartend. */
    INSTALLED,
    ACTIVATING,
    ACTIVATED,
    /** Ersetzt oder fehlgeschlagen. */
    REDUNDANT
}
