package com.fleet.anomaly.engine.isolationforest;

import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.model.Signals;

import java.util.List;

/**
 * Projects a snapshot onto the fixed 3-dimensional feature vector of its message type.
 *
 * Features, in {@link MessageType#getSignals()} order:
 *   EngineData:     [EngineSpeed, EngineTemp, BatteryLevel]
 *   VehicleData:    [Speed, GearPosition, BatteryVoltage]
 *   ClimateControl: [CabinTemp, FanSpeed, ACStatus]  (FanSpeed and ACStatus truncated to integers)
 *
 * Missing signals project to 0.
 */
public final class FeatureExtractor {

    public static final int FEATURE_COUNT = 3;

    private FeatureExtractor() {}

    public static double[] project(MessageType messageType, SignalSnapshot snapshot) {
        List<String> signals = messageType.getSignals();
        double[] features = new double[FEATURE_COUNT];
        for (int i = 0; i < FEATURE_COUNT; i++) {
            String signal = signals.get(i);
            double value = snapshot.valueOrZero(signal);
            features[i] = isDiscrete(signal) ? (int) value : value;
        }
        return features;
    }

    public static List<String> featureNames(MessageType messageType) {
        return messageType.getSignals();
    }

    private static boolean isDiscrete(String signal) {
        return Signals.FAN_SPEED.equals(signal) || Signals.AC_STATUS.equals(signal);
    }
}
