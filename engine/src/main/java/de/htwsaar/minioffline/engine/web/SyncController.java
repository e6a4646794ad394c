package de.htwsaar.minioffline.engine.web;

import de.htwsaar.minioffline.engine.sync.BackgroundSyncQueue;
import de.htwsaar.minioffline.engine.sync.PendingMutation;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Einsicht und manuelle Steuerung der Background-Sync-Queue.
 *
 * <ul>
 *   <li>GET /_engine/sync/pending – wartende Mutationen</li>
 *   <li>GET /_engine/sync/abandoned – aufgegebene Mutationen</li>
 *   <li>DELETE /_engine/sync/abandoned/{id} – aufgegebene Mutation verwerfen</li>
 *   <li>POST /_engine/sync/replay – Durchlauf anstoßen</li>
 * </ul>
 */
@RestController
@RequestMapping("/_engine/sync")
public class SyncController {

    private final BackgroundSyncQueue queue;

    public SyncController(BackgroundSyncQueue queue) {
        this.queue = queue;
    }

    @GetMapping("/pending")
    public ResponseEntity<List<PendingMutation>> pending() {
        return ResponseEntity.ok(queue.pending());
    }

    @GetMapping("/abandoned")
    public ResponseEntity<List<PendingMutation>> abandoned() {
        return ResponseEntity.ok(queue.abandoned());
    }

    @DeleteMapping("/abandoned/{id}")
    public ResponseEntity<Map<String, Object>> discard(@PathVariable("id") String id) {
        boolean removed = queue.discardAbandoned(id);
        if (!removed) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("id", id, "status", "discarded"));
    }

    /** Stößt einen Durchlauf an, ohne auf ihn zu warten. */
    @PostMapping("/replay")
    public ResponseEntity<Map<String, Object>> replay() {
        queue.replayNow();
        return ResponseEntity.accepted().body(Map.of("pending", queue.size()));
    }
}
