package com.fleet.anomaly.engine.isolationforest;

import com.fleet.anomaly.engine.evaluators.SignalThresholdEvaluator;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.RuleFinding;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.model.Signals;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns an outlier verdict into readable reasons: the absolute thresholds of the message type,
 * a few softer hints, and, when nothing named applies, the feature that drove the score.
 */
@Component
public class AnomalyExplainer {

    static final double HIGH_ENGINE_SPEED = 5000;
    static final double HIGH_SPEED = 120;
    static final double LOW_GEAR_SPEED = 60;
    static final double MIN_BATTERY_VOLTAGE = 370;
    static final double MAX_BATTERY_VOLTAGE = 410;
    static final double WARM_CABIN_TEMP = 30;

    private final SignalThresholdEvaluator thresholds;

    public AnomalyExplainer(SignalThresholdEvaluator thresholds) {
        this.thresholds = thresholds;
    }

    public String explain(MessageType messageType, SignalSnapshot snapshot, IsolationForest forest) {
        List<String> reasons = new ArrayList<>();
        for (RuleFinding finding : thresholds.check(messageType, snapshot)) {
            reasons.add(finding.getDetail());
        }
        reasons.addAll(hints(messageType, snapshot));

        if (reasons.isEmpty() && forest != null && forest.isFitted()) {
            reasons.add(strongestFeature(messageType, snapshot, forest));
        }
        if (reasons.isEmpty()) {
            reasons.add("Unusual combination of " + String.join(", ", messageType.getSignals()));
        }
        return "Isolation forest outlier: " + String.join("; ", reasons);
    }

    List<String> hints(MessageType messageType, SignalSnapshot snapshot) {
        List<String> hints = new ArrayList<>();
        switch (messageType) {
            case ENGINE_DATA -> snapshot.find(Signals.ENGINE_SPEED).ifPresent(rpm -> {
                if (rpm > HIGH_ENGINE_SPEED) {
                    hints.add(format("High engine speed: %.0f rpm", rpm));
                }
            });
            case VEHICLE_DATA -> {
                snapshot.find(Signals.SPEED).ifPresent(speed -> {
                    if (speed > HIGH_SPEED) {
                        hints.add(format("Very high speed: %.1f km/h", speed));
                    } else if (speed > LOW_GEAR_SPEED && snapshot.has(Signals.GEAR_POSITION)
                            && snapshot.valueOrZero(Signals.GEAR_POSITION) <= 2) {
                        hints.add(format("Low gear at speed: %.1f km/h in gear %d",
                                speed, (int) snapshot.valueOrZero(Signals.GEAR_POSITION)));
                    }
                });
                snapshot.find(Signals.BATTERY_VOLTAGE).ifPresent(voltage -> {
                    if (voltage < MIN_BATTERY_VOLTAGE || voltage > MAX_BATTERY_VOLTAGE) {
                        hints.add(format("Battery voltage out of range: %.1f V", voltage));
                    }
                });
            }
            case CLIMATE_CONTROL -> {
                if (!snapshot.has(Signals.FAN_SPEED) || (int) snapshot.valueOrZero(Signals.FAN_SPEED) != 0) {
                    break;
                }
                if (snapshot.has(Signals.AC_STATUS) && (int) snapshot.valueOrZero(Signals.AC_STATUS) == 1) {
                    hints.add("AC is on but the fan is stopped");
                }
                snapshot.find(Signals.CABIN_TEMP).ifPresent(cabinTemp -> {
                    if (cabinTemp > WARM_CABIN_TEMP) {
                        hints.add(format("Warm cabin with the fan stopped: %.1f°C", cabinTemp));
                    }
                });
            }
        }
        return hints;
    }

    private String strongestFeature(MessageType messageType, SignalSnapshot snapshot, IsolationForest forest) {
        double[] features = FeatureExtractor.project(messageType, snapshot);
        double[] contributions = forest.featureContributions(features);
        int strongest = 0;
        for (int i = 1; i < contributions.length; i++) {
            if (contributions[i] > contributions[strongest]) {
                strongest = i;
            }
        }
        return format("Unusual %s value %.1f", FeatureExtractor.featureNames(messageType).get(strongest),
                features[strongest]);
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
