package de.htwsaar.minioffline.engine.sync;

import java.util.Objects;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodischer Auslöser für das Wiedereinspielen der Sync-Queue.
 */
public class SyncScheduler {

    private final BackgroundSyncQueue queue;

    public SyncScheduler(BackgroundSyncQueue queue) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
    }

    /** Startet einen Durchlauf, sofern Mutationen warten. */
    @Scheduled(
            initialDelayString = "${engine.sync.interval-ms:60000}",
            fixedDelayString = "${engine.sync.interval-ms:60000}")
    public void tick() {
        if (!queue.isEmpty()) {
            queue.replayNow();
        }
    }
}
