package de.htwsaar.minioffline.engine.web;

import de.htwsaar.minioffline.engine.EngineMetricsService;
import de.htwsaar.minioffline.engine.lifecycle.LifecycleManager;
import de.htwsaar.minioffline.engine.sync.BackgroundSyncQueue;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health-/Readiness-Probes und Metriken der Engine.
 */
@RestController
@RequestMapping("/_engine")
public class EngineProbeController {

    private final LifecycleManager lifecycle;
    private final EngineMetricsService metricsService;
    private final BackgroundSyncQueue syncQueue;

    public EngineProbeController(
            LifecycleManager lifecycle, EngineMetricsService metricsService, BackgroundSyncQueue syncQueue) {
        this.lifecycle = lifecycle;
        this.metricsService = metricsService;
        this.syncQueue = syncQueue;
    }

    /** @return HTTP 200 "ok" */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /** @return HTTP 200 "ready" sobald eine Version aktiv ist, sonst 503 */
    @GetMapping("/ready")
    public ResponseEntity<String> ready() {
        try {
            lifecycle.active();
            return ResponseEntity.ok("ready");
        } catch (IllegalStateException ex) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("not ready");
        }
    }

    /**
     * Liefert einen Metriken-Snapshot.
     *
     * @param windowSec Zeitfenster in Sekunden für Request-Rate (Standard: 60)
     * @return Metriken-Snapshot
     */
    @GetMapping("/stats")
    public ResponseEntity<EngineMetricsService.EngineStatsSnapshot> stats(
            @RequestParam(value = "windowSec", defaultValue = "60") int windowSec) {
        return ResponseEntity.ok(metricsService.snapshot(windowSec, syncQueue.size()));
    }
}
