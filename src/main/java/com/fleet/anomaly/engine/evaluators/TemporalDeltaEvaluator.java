package com.fleet.anomaly.engine.evaluators;

import com.fleet.anomaly.engine.EvaluationContext;
import com.fleet.anomaly.engine.RuleEvaluator;
import com.fleet.anomaly.model.AnomalyType;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.RuleFamily;
import com.fleet.anomaly.model.RuleFinding;
import com.fleet.anomaly.model.Severity;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.model.Signals;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags sudden jumps between a vehicle's previous and current snapshot of the same
 * message type.
 *
 * Rules:
 *   VehicleData     Speed         |Δ| > 20 km/h  → sudden_speed_change
 *   VehicleData     GearPosition  |Δ| > 1        → sudden_gear_change (diagnostic)
 *   EngineData      EngineTemp    |Δ| > 15 °C    → sudden_temperature_change
 *   EngineData      EngineSpeed   |Δ| > 2000 rpm → sudden_engine_speed_change (diagnostic)
 *   EngineData      BatteryLevel  drop > 10 pts  → sudden_battery_drop (diagnostic)
 *   ClimateControl  CabinTemp     |Δ| > 5 °C     → sudden_cabin_temperature_change (diagnostic)
 *
 * A rule is skipped when either snapshot lacks its signal.
 */
@Component
public class TemporalDeltaEvaluator implements RuleEvaluator {

    static final List<DeltaRule> RULES = List.of(
            new DeltaRule(MessageType.VEHICLE_DATA, Signals.SPEED, 20, false,
                    AnomalyType.SUDDEN_SPEED_CHANGE, "Sudden speed change: %.1f km/h (%.1f -> %.1f)"),
            new DeltaRule(MessageType.VEHICLE_DATA, Signals.GEAR_POSITION, 1, false,
                    AnomalyType.SUDDEN_GEAR_CHANGE, "Skipped gears: %.0f (%.0f -> %.0f)"),
            new DeltaRule(MessageType.ENGINE_DATA, Signals.ENGINE_TEMP, 15, false,
                    AnomalyType.SUDDEN_TEMPERATURE_CHANGE, "Sudden engine temperature change: %.1f°C (%.1f -> %.1f)"),
            new DeltaRule(MessageType.ENGINE_DATA, Signals.ENGINE_SPEED, 2000, false,
                    AnomalyType.SUDDEN_ENGINE_SPEED_CHANGE, "Sudden engine speed change: %.1f RPM (%.1f -> %.1f)"),
            new DeltaRule(MessageType.ENGINE_DATA, Signals.BATTERY_LEVEL, 10, true,
                    AnomalyType.SUDDEN_BATTERY_DROP, "Sudden battery drop: %.1f%% (%.1f -> %.1f)"),
            new DeltaRule(MessageType.CLIMATE_CONTROL, Signals.CABIN_TEMP, 5, false,
                    AnomalyType.SUDDEN_CABIN_TEMPERATURE_CHANGE, "Sudden cabin temperature change: %.2f°C (%.2f -> %.2f)")
    );

    @Override
    public RuleFamily getFamily() {
        return RuleFamily.TEMPORAL;
    }

    @Override
    public List<RuleFinding> evaluate(EvaluationContext context) {
        if (!context.hasPrevious()) {
            return List.of();
        }

        List<RuleFinding> findings = new ArrayList<>();
        for (DeltaRule rule : RULES) {
            if (rule.messageType() != context.getMessageType()) {
                continue;
            }
            rule.check(context.getPrevious(), context.getCurrent()).ifPresent(findings::add);
        }
        return findings;
    }

    /**
     * @param decreaseOnly when true only a drop (previous - current) counts, otherwise the absolute change
     */
    record DeltaRule(MessageType messageType, String signal, double threshold, boolean decreaseOnly,
                     AnomalyType anomalyType, String detailFormat) {

        Optional<RuleFinding> check(SignalSnapshot previous, SignalSnapshot current) {
            if (!previous.has(signal) || !current.has(signal)) {
                return Optional.empty();
            }
            double before = previous.valueOrZero(signal);
            double after = current.valueOrZero(signal);
            double delta = decreaseOnly ? before - after : Math.abs(after - before);
            if (delta <= threshold) {
                return Optional.empty();
            }
            return Optional.of(RuleFinding.of(anomalyType, Severity.WARNING,
                    String.format(Locale.ROOT, detailFormat, delta, before, after)));
        }
    }
}
