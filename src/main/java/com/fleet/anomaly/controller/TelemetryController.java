package com.fleet.anomaly.controller;

import com.fleet.anomaly.model.Anomaly;
import com.fleet.anomaly.model.TelemetryMessage;
import com.fleet.anomaly.service.TelemetryDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/telemetry")
@Tag(name = "Telemetry", description = "Submit decoded vehicle telemetry for anomaly detection")
public class TelemetryController {

    private final TelemetryDetectionService detectionService;

    public TelemetryController(TelemetryDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Evaluate a telemetry message",
            description = "Runs one decoded message through the detection pipeline: vehicle state update, " +
                    "isolation forest check (once the models are trained), temporal, geography and " +
                    "signal threshold rules. Returns the anomalies produced, which are also forwarded to the sinks.")
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody TelemetryMessage message) {
        try {
            List<Anomaly> anomalies = detectionService.handle(message);
            return ResponseEntity.ok(anomalies);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
