package com.flagship.tool_ledger.health;

import com.flagship.tool_ledger.store.DocumentStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain liveness/readiness endpoint for load balancers that cannot use the actuator.
 */
@RestController
public class HealthController {

    private final DocumentStore store;

    public HealthController(DocumentStore store) {
        this.store = store;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean storeHealthy = store.ping();
        response.put("status", storeHealthy ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());
        response.put("documentStore", storeHealthy ? "UP" : "DOWN");

        if (!storeHealthy) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
