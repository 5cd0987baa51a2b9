package com.fleet.anomaly.service;

import com.fleet.anomaly.config.MetricsConfig;
import com.fleet.anomaly.engine.EvaluationContext;
import com.fleet.anomaly.engine.RuleEngine;
import com.fleet.anomaly.engine.VehicleStateStore;
import com.fleet.anomaly.model.Anomaly;
import com.fleet.anomaly.model.AnomalyType;
import com.fleet.anomaly.model.Geography;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.Prediction;
import com.fleet.anomaly.model.Severity;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.model.TelemetryMessage;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detection pipeline for one decoded message:
 * 1. Update the vehicle's state and fetch the previous snapshot of the same type
 * 2. Feed the outlier models, and once trained ask them for a verdict
 * 3. Run the rule families
 * 4. Publish everything found to the sinks
 */
@Service
public class TelemetryDetectionService {

    private static final Logger log = LoggerFactory.getLogger(TelemetryDetectionService.class);

    private final VehicleStateStore stateStore;
    private final OutlierModelManager modelManager;
    private final RuleEngine ruleEngine;
    private final AnomalyPublisher publisher;
    private final MetricsConfig metricsConfig;

    public TelemetryDetectionService(VehicleStateStore stateStore,
                                     OutlierModelManager modelManager,
                                     RuleEngine ruleEngine,
                                     AnomalyPublisher publisher,
                                     MetricsConfig metricsConfig) {
        this.stateStore = stateStore;
        this.modelManager = modelManager;
        this.ruleEngine = ruleEngine;
        this.publisher = publisher;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Validate a raw message and run it through the pipeline.
     *
     * @throws IllegalArgumentException if the vehicle id is missing or the message type or
     *                                  geography is unknown
     */
    @Observed(name = "telemetry.handle", contextualName = "handle-telemetry")
    public List<Anomaly> handle(TelemetryMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("Telemetry message is required");
        }
        if (message.getVehicleId() == null || message.getVehicleId().isBlank()) {
            throw new IllegalArgumentException("vehicleId is required");
        }
        MessageType messageType = MessageType.fromName(message.getMessageType());
        Geography geography = Geography.fromValue(message.getGeography());

        return handle(message.getVehicleId(), messageType, knownSignals(messageType, message.getSignals()), geography);
    }

    public List<Anomaly> handle(String vehicleId, MessageType messageType,
                                SignalSnapshot snapshot, Geography geography) {
        long now = System.currentTimeMillis();
        metricsConfig.recordTelemetry(messageType.getWireName());

        Optional<SignalSnapshot> previous = stateStore.update(vehicleId, messageType, snapshot, geography, now);

        List<Anomaly> anomalies = new ArrayList<>();

        modelManager.observe(messageType, snapshot);
        if (modelManager.isTrained()) {
            outlierAnomaly(vehicleId, messageType, snapshot, geography, now).ifPresent(anomalies::add);
        }

        EvaluationContext context = EvaluationContext.builder()
                .vehicleId(vehicleId)
                .messageType(messageType)
                .geography(geography)
                .current(snapshot)
                .previous(previous.orElse(null))
                .build();
        anomalies.addAll(ruleEngine.evaluateAll(context, now));

        for (Anomaly anomaly : anomalies) {
            metricsConfig.recordAnomaly(anomaly.getAnomalyType().getTag(), messageType.getWireName());
            log.warn("Anomaly detected: vehicle={}, type={}, message={}, geography={}, severity={}, detail={}",
                    vehicleId, anomaly.getAnomalyType().getTag(), messageType.getWireName(),
                    geography.getValue(), anomaly.getSeverity().getValue(), anomaly.getDetail());
        }

        if (!anomalies.isEmpty()) {
            publisher.publishAll(anomalies);
        }
        return anomalies;
    }

    private Optional<Anomaly> outlierAnomaly(String vehicleId, MessageType messageType,
                                             SignalSnapshot snapshot, Geography geography, long now) {
        Prediction prediction;
        try {
            prediction = modelManager.predict(messageType, snapshot);
        } catch (IllegalStateException e) {
            // models were reset between the check and the call
            log.debug("Skipping outlier check for {}: {}", vehicleId, e.getMessage());
            return Optional.empty();
        }
        if (prediction != Prediction.ANOMALY) {
            return Optional.empty();
        }
        return Optional.of(Anomaly.builder()
                .vehicleId(vehicleId)
                .anomalyType(AnomalyType.ISOLATION_FOREST)
                .messageType(messageType)
                .geography(geography)
                .severity(Severity.WARNING)
                .signals(snapshot)
                .detail(modelManager.explain(messageType, snapshot))
                .detectedAt(now)
                .build());
    }

    // Keys outside the message type's signal set are dropped before they reach state or sinks.
    private static SignalSnapshot knownSignals(MessageType messageType, Map<String, Double> raw) {
        if (raw == null || raw.isEmpty()) {
            return SignalSnapshot.empty();
        }
        Map<String, Double> known = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            if (messageType.getSignals().contains(name)) {
                known.put(name, value);
            } else {
                log.debug("Ignoring unknown signal {} on {} message", name, messageType.getWireName());
            }
        });
        return SignalSnapshot.of(known);
    }
}
