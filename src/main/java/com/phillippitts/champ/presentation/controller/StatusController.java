package com.phillippitts.champ.presentation.controller;

import com.phillippitts.champ.service.ensemble.EnsembleOrchestrator;
import com.phillippitts.champ.service.ledger.ChainedRoundLog;
import com.phillippitts.champ.service.stream.StreamManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only operational view: stream health, ensemble performance and the current chain root.
 */
@RestController
class StatusController {

    private static final Logger LOG = LogManager.getLogger(StatusController.class);

    private final StreamManager streamManager;
    private final EnsembleOrchestrator orchestrator;
    private final ChainedRoundLog ledger;
    private final Clock clock;

    StatusController(StreamManager streamManager,
                     EnsembleOrchestrator orchestrator,
                     ChainedRoundLog ledger,
                     Clock clock) {
        this.streamManager = streamManager;
        this.orchestrator = orchestrator;
        this.ledger = ledger;
        this.clock = clock;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stream", streamManager.getHealthSnapshot().toMap());
        body.put("ensemble", orchestrator.getPerformanceMetrics().toMap());
        body.put("chain_root", ledger.getCurrentRoot().orElse(null));
        body.put("round_history_size", orchestrator.historySize());
        body.put("timestamp", clock.instant().toString());
        LOG.debug("Status requested");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", clock.instant().toString()
        ));
    }
}
