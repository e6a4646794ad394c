package de.htwsaar.minioffline.engine.web;

import de.htwsaar.minioffline.engine.lifecycle.EngineInstance;
import de.htwsaar.minioffline.engine.lifecycle.EngineRelease;
import de.htwsaar.minioffline.engine.lifecycle.LifecycleManager;
import de.htwsaar.minioffline.engine.lifecycle.ReleaseRejectedException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Versionsverwaltung der Engine.
 *
 * <ul>
 *   <li>POST /_engine/releases – neue Version installieren</li>
 *   <li>GET /_engine/releases/active – aktive und wartende Version</li>
 * </ul>
 */
@RestController
@RequestMapping("/_engine/releases")
public class ReleaseController {

    private final LifecycleManager lifecycle;

    public ReleaseController(LifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * @param release vollständige Release-Konfiguration
     * @return 201 mit Version und Zustand, 409 bei Ablehnung
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> install(@RequestBody EngineRelease release) {
        try {
            EngineInstance instance = lifecycle.install(release);
            return ResponseEntity.status(HttpStatus.CREATED).body(describe(instance));
        } catch (ReleaseRejectedException ex) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("version", ex.getVersion(), "error", ex.getMessage()));
        }
    }

    /** @return aktive Version und ggf. wartende Version */
    @GetMapping("/active")
    public ResponseEntity<Map<String, Object>> active() {
        Map<String, Object> body = new LinkedHashMap<>(describe(lifecycle.active()));
        lifecycle.waiting().ifPresent(w -> body.put("waiting", describe(w)));
        body.put("attachedClients", lifecycle.attachedClients());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> describe(EngineInstance instance) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("version", instance.version().number());
        m.put("state", instance.state().name());
        m.put("storePrefix", instance.storePrefix());
        return m;
    }
}
