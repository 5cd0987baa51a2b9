package com.fleet.anomaly.engine;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.evaluators.GeographyContextEvaluator;
import com.fleet.anomaly.engine.evaluators.SignalThresholdEvaluator;
import com.fleet.anomaly.engine.evaluators.TemporalDeltaEvaluator;
import com.fleet.anomaly.model.*;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fleet.anomaly.testutil.TestDataFactory.context;
import static com.fleet.anomaly.testutil.TestDataFactory.vehicle;
import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest {

    private DetectionConfig config;
    private RuleEngine ruleEngine;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        ruleEngine = new RuleEngine(
                List.of(new TemporalDeltaEvaluator(), new GeographyContextEvaluator(), new SignalThresholdEvaluator()),
                Tracer.NOOP, config);
    }

    @Test
    void evaluateAll_noPrevious_skipsTemporalRules() {
        List<Anomaly> anomalies = ruleEngine.evaluateAll(
                context(MessageType.VEHICLE_DATA, Geography.HIGHWAY, vehicle(100, 4, 400), null), 42L);

        assertThat(anomalies).isEmpty();
    }

    @Test
    void evaluateAll_withPrevious_runsAllFamilies() {
        List<Anomaly> anomalies = ruleEngine.evaluateAll(
                context(MessageType.VEHICLE_DATA, Geography.RAINY, vehicle(90, 1, 400), vehicle(60, 1, 400)), 42L);

        assertThat(anomalies).extracting(Anomaly::getAnomalyType).containsExactly(
                AnomalyType.SUDDEN_SPEED_CHANGE,
                AnomalyType.HIGH_SPEED_IN_RAIN,
                AnomalyType.GEAR_SPEED_MISMATCH);
        assertThat(anomalies).allSatisfy(anomaly -> {
            assertThat(anomaly.getVehicleId()).isEqualTo("VHC_01");
            assertThat(anomaly.getGeography()).isEqualTo(Geography.RAINY);
            assertThat(anomaly.getMessageType()).isEqualTo(MessageType.VEHICLE_DATA);
            assertThat(anomaly.getDetectedAt()).isEqualTo(42L);
            assertThat(anomaly.getSignals()).isEqualTo(vehicle(90, 1, 400));
        });
    }

    @Test
    void evaluateAll_diagnosticsNotForwarded_keepsOnlyBaseAnomalies() {
        config.getRules().setForwardDiagnostics(false);

        List<Anomaly> anomalies = ruleEngine.evaluateAll(
                context(MessageType.VEHICLE_DATA, Geography.RAINY, vehicle(90, 1, 400), vehicle(60, 1, 400)), 42L);

        assertThat(anomalies).extracting(Anomaly::getAnomalyType)
                .containsExactly(AnomalyType.SUDDEN_SPEED_CHANGE, AnomalyType.HIGH_SPEED_IN_RAIN);
    }

    @Test
    void evaluateAll_failingEvaluator_doesNotBlockOthers() {
        RuleEvaluator broken = new RuleEvaluator() {
            @Override
            public RuleFamily getFamily() {
                return RuleFamily.SIGNAL_THRESHOLD;
            }

            @Override
            public List<RuleFinding> evaluate(EvaluationContext context) {
                throw new IllegalStateException("boom");
            }
        };
        RuleEngine engine = new RuleEngine(List.of(new GeographyContextEvaluator(), broken), Tracer.NOOP, config);

        List<Anomaly> anomalies = engine.evaluateAll(
                context(MessageType.VEHICLE_DATA, Geography.RAINY, vehicle(90, 1, 400), null), 42L);

        assertThat(anomalies).extracting(Anomaly::getAnomalyType).containsExactly(AnomalyType.HIGH_SPEED_IN_RAIN);
    }
}
