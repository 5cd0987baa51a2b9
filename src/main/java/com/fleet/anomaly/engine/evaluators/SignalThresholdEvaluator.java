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

/**
 * Absolute and cross-signal checks, independent of history and geography.
 *
 * EngineData:
 *   EngineTemp > 120                         → critical_engine_temperature
 *   BatteryLevel < 20                        → critical_battery_level
 *   20 <= BatteryLevel < 30                  → low_battery_level
 * VehicleData (only while moving):
 *   |expected gear - gear| > 1               → gear_speed_mismatch
 *   speed > 100 and gear <= 2, or
 *   speed < 20 and gear >= 3                 → critical_gear_mismatch
 * ClimateControl:
 *   CabinTemp < 10                           → critical_low_cabin_temperature
 *   CabinTemp > 30                           → critical_high_cabin_temperature
 *   (both qualified when ACStatus reports the AC off)
 */
@Component
public class SignalThresholdEvaluator implements RuleEvaluator {

    static final double CRITICAL_ENGINE_TEMP = 120;
    static final double CRITICAL_BATTERY_LEVEL = 20;
    static final double LOW_BATTERY_LEVEL = 30;
    static final int GEAR_TOLERANCE = 1;
    static final double CRITICAL_LOW_CABIN_TEMP = 10;
    static final double CRITICAL_HIGH_CABIN_TEMP = 30;

    @Override
    public RuleFamily getFamily() {
        return RuleFamily.SIGNAL_THRESHOLD;
    }

    @Override
    public List<RuleFinding> evaluate(EvaluationContext context) {
        return check(context.getMessageType(), context.getCurrent());
    }

    /**
     * Run the checks of one message type against a snapshot. Also used to explain outlier
     * model verdicts.
     */
    public List<RuleFinding> check(MessageType messageType, SignalSnapshot snapshot) {
        List<RuleFinding> findings = new ArrayList<>();
        switch (messageType) {
            case ENGINE_DATA -> checkEngine(snapshot, findings);
            case VEHICLE_DATA -> checkGear(snapshot, findings);
            case CLIMATE_CONTROL -> checkCabin(snapshot, findings);
        }
        return findings;
    }

    private void checkEngine(SignalSnapshot snapshot, List<RuleFinding> findings) {
        snapshot.find(Signals.ENGINE_TEMP).ifPresent(temp -> {
            if (temp > CRITICAL_ENGINE_TEMP) {
                findings.add(RuleFinding.of(AnomalyType.CRITICAL_ENGINE_TEMPERATURE, Severity.CRITICAL,
                        format("Critical engine temperature: %.1f°C (limit %.0f)", temp, CRITICAL_ENGINE_TEMP)));
            }
        });

        snapshot.find(Signals.BATTERY_LEVEL).ifPresent(level -> {
            if (level < CRITICAL_BATTERY_LEVEL) {
                findings.add(RuleFinding.of(AnomalyType.CRITICAL_BATTERY_LEVEL, Severity.CRITICAL,
                        format("Critical battery level: %.1f%%, charging required", level)));
            } else if (level < LOW_BATTERY_LEVEL) {
                findings.add(RuleFinding.of(AnomalyType.LOW_BATTERY_LEVEL, Severity.WARNING,
                        format("Low battery level: %.1f%%", level)));
            }
        });
    }

    private void checkGear(SignalSnapshot snapshot, List<RuleFinding> findings) {
        if (!snapshot.has(Signals.SPEED) || !snapshot.has(Signals.GEAR_POSITION)) {
            return;
        }
        double speed = snapshot.valueOrZero(Signals.SPEED);
        if (speed <= 0) {
            return;
        }
        int gear = (int) snapshot.valueOrZero(Signals.GEAR_POSITION);
        int expected = ExpectedGear.forSpeed(speed);

        if (Math.abs(expected - gear) > GEAR_TOLERANCE) {
            findings.add(RuleFinding.of(AnomalyType.GEAR_SPEED_MISMATCH, Severity.WARNING,
                    format("Gear does not match speed: %.1f km/h in gear %d, expected gear %d", speed, gear, expected)));
        }

        if (speed > 100 && gear <= 2) {
            findings.add(RuleFinding.of(AnomalyType.CRITICAL_GEAR_MISMATCH, Severity.CRITICAL,
                    format("Dangerously low gear at high speed: %.1f km/h in gear %d, shift up", speed, gear)));
        } else if (speed < 20 && gear >= 3) {
            findings.add(RuleFinding.of(AnomalyType.CRITICAL_GEAR_MISMATCH, Severity.CRITICAL,
                    format("Dangerously high gear at low speed: %.1f km/h in gear %d, shift down", speed, gear)));
        }
    }

    private void checkCabin(SignalSnapshot snapshot, List<RuleFinding> findings) {
        if (!snapshot.has(Signals.CABIN_TEMP)) {
            return;
        }
        double cabinTemp = snapshot.valueOrZero(Signals.CABIN_TEMP);
        boolean acOff = snapshot.has(Signals.AC_STATUS) && (int) snapshot.valueOrZero(Signals.AC_STATUS) == 0;

        if (cabinTemp < CRITICAL_LOW_CABIN_TEMP) {
            findings.add(RuleFinding.of(AnomalyType.CRITICAL_LOW_CABIN_TEMPERATURE, Severity.CRITICAL,
                    format("Critically low cabin temperature: %.1f°C", cabinTemp)
                            + (acOff ? ". AC is off, turn on climate control and heating" : "")));
        } else if (cabinTemp > CRITICAL_HIGH_CABIN_TEMP) {
            findings.add(RuleFinding.of(AnomalyType.CRITICAL_HIGH_CABIN_TEMPERATURE, Severity.CRITICAL,
                    format("Critically high cabin temperature: %.1f°C", cabinTemp)
                            + (acOff ? ". AC is off, turn on climate control and cooling" : "")));
        }
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
