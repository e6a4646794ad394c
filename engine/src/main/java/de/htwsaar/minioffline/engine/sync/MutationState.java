package de.htwsaar.minioffline.engine.sync;

/** Zustände einer zurückgestellten Mutation. */
public enum MutationState {
    QUEUED,
    REPLAYING,
    COMPLETED,
    REQUEUED,
    ABANDONED
}
