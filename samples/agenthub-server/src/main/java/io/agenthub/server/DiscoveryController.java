package io.agenthub.server;

import io.agenthub.AgentHub;
import io.agenthub.DiscoveryDocument;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class DiscoveryController {

    private final AgentHub hub;

    public DiscoveryController(AgentHub hub) {
        this.hub = hub;
    }

    @GetMapping({"/.well-known/agenthub-matrix", "/api/v1/discovery"})
    public ResponseEntity<Map<String, Object>> discovery() {
        DiscoveryDocument document = hub.discovery();
        return ResponseEntity.ok(document.toMap());
    }
}
