package io.agenthub.server;

import io.agenthub.AgentHub;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {
    private static final String READY_CHECK_COLLECTION = "health_check";

    private final AgentHub hub;

    public HealthController(AgentHub hub) {
        this.hub = hub;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    /**
     * Ready once the store answers a write followed by a read. A store failure surfaces
     * as 503 through {@link ApiExceptionHandler}.
     */
    @GetMapping("/ready")
    public Map<String, String> ready() {
        String at = Instant.now().toString();
        hub.store().put(READY_CHECK_COLLECTION, "ready", Map.of("at", at));
        hub.store().get(READY_CHECK_COLLECTION, "ready").orElseThrow(
            () -> new IllegalStateException("Readiness record not readable"));
        return Map.of("status", "ready", "store", hub.store().name());
    }
}
