package com.fleet.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The closed set of telemetry message types. Each type carries a fixed list of signals,
 * which is also the order of the outlier model's feature vector.
 */
public enum MessageType {

    ENGINE_DATA("EngineData", "engine_model",
            List.of(Signals.ENGINE_SPEED, Signals.ENGINE_TEMP, Signals.BATTERY_LEVEL)),

    VEHICLE_DATA("VehicleData", "vehicle_model",
            List.of(Signals.SPEED, Signals.GEAR_POSITION, Signals.BATTERY_VOLTAGE)),

    CLIMATE_CONTROL("ClimateControl", "climate_model",
            List.of(Signals.CABIN_TEMP, Signals.FAN_SPEED, Signals.AC_STATUS));

    private final String wireName;
    private final String artifactName;
    private final List<String> signals;

    MessageType(String wireName, String artifactName, List<String> signals) {
        this.wireName = wireName;
        this.artifactName = artifactName;
        this.signals = signals;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Base name of the persisted model artifact for this type. */
    public String getArtifactName() {
        return artifactName;
    }

    public List<String> getSignals() {
        return signals;
    }

    /**
     * Resolves a message type from its wire name ("EngineData") or enum name ("ENGINE_DATA").
     *
     * @throws IllegalArgumentException if the name is not one of the known types
     */
    @JsonCreator
    public static MessageType fromName(String name) {
        if (name != null) {
            for (MessageType type : values()) {
                if (type.wireName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + name + ". Valid types: " +
                Arrays.stream(values()).map(MessageType::getWireName).collect(Collectors.joining(", ")));
    }
}
