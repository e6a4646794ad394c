package de.htwsaar.minioffline.engine.sync;

/**
 * Ergebnis eines Replay-Durchlaufs.
 *
 * @param completed erfolgreich eingespielte Mutationen
 * @param requeued  zurückgestellte Mutationen (0 oder 1)
 * @param abandoned aufgegebene Mutationen (0 oder 1)
 * @param remaining danach noch wartende Mutationen
 */
public record ReplayReport(int completed, int requeued, int abandoned, int remaining) {}
