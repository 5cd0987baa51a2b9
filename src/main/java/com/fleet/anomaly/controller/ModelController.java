package com.fleet.anomaly.controller;

import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.ModelStatus;
import com.fleet.anomaly.service.OutlierModelManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Isolation Forest model lifecycle and training progress")
public class ModelController {

    private final OutlierModelManager modelManager;

    public ModelController(OutlierModelManager modelManager) {
        this.modelManager = modelManager;
    }

    @Operation(summary = "List model status",
            description = "Lifecycle state, collection progress and training metadata for each message type.")
    @GetMapping
    public ResponseEntity<List<ModelStatus>> listModels() {
        return ResponseEntity.ok(modelManager.status());
    }

    @Operation(summary = "Get model status for one message type")
    @GetMapping("/{messageType}")
    public ResponseEntity<?> getModel(
            @Parameter(description = "Message type", example = "EngineData")
            @PathVariable String messageType) {
        try {
            return ResponseEntity.ok(modelManager.status(MessageType.fromName(messageType)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Discard the models and collect again",
            description = "Resets every message type to COLLECTING. Isolation forest predictions stop " +
                    "until enough new samples arrive and the next training pass completes.")
    @PostMapping("/retrain")
    public ResponseEntity<Map<String, String>> retrain() {
        try {
            modelManager.retrain();
            return ResponseEntity.accepted().body(Map.of("status", "Collecting samples for retraining"));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }
}
