package de.htwsaar.minioffline.engine.sync;

/**
 * Eine Mutation wurde nach Erreichen der maximalen Versuche aufgegeben.
 * Wird als Host-Ereignis gemeldet, nie an Aufrufer geworfen.
 */
public class ReplayExhaustedException extends RuntimeException {

    private final transient PendingMutation mutation;

    public ReplayExhaustedException(PendingMutation mutation) {
        super("Giving up on " + mutation.method() + " " + mutation.url() + " after "
                + mutation.retryCount() + " attempts: " + mutation.lastError());
        this.mutation = mutation;
    }

    public PendingMutation getMutation() {
        return mutation;
    }
}
