package com.phillippitts.champ.service.health;

import com.phillippitts.champ.service.ensemble.EnsembleOrchestrator;
import com.phillippitts.champ.service.ensemble.EnsemblePerformance;
import com.phillippitts.champ.service.ensemble.ModelClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the model endpoints.
 *
 * <ul>
 *   <li>UP: every endpoint healthy</li>
 *   <li>DEGRADED: at least one endpoint healthy</li>
 *   <li>DOWN: no endpoint healthy</li>
 * </ul>
 */
@Component
public class EnsembleHealthIndicator implements HealthIndicator {

    private final EnsembleOrchestrator orchestrator;

    public EnsembleHealthIndicator(EnsembleOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        for (ModelClient client : orchestrator.getClients()) {
            endpoints.put(client.getName(), client.isHealthy() ? "ready" : "unhealthy");
        }
        EnsemblePerformance performance = orchestrator.getPerformanceMetrics();
        int total = endpoints.size();
        Health.Builder builder;
        if (total > 0 && performance.activeClients() == total) {
            builder = Health.up().withDetail("status", "All endpoints operational");
        } else if (performance.activeClients() > 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Partial endpoint availability");
        } else {
            builder = Health.down().withDetail("status", "No endpoints available");
        }
        return builder
                .withDetail("endpoints", endpoints)
                .withDetails(performance.toMap())
                .build();
    }
}
