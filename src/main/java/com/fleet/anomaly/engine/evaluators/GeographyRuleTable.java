package com.fleet.anomaly.engine.evaluators;

import com.fleet.anomaly.model.AnomalyType;
import com.fleet.anomaly.model.Geography;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.Signals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.fleet.anomaly.engine.evaluators.GeographyRule.Comparison.EQUAL_TO;
import static com.fleet.anomaly.engine.evaluators.GeographyRule.Comparison.GREATER_THAN;
import static com.fleet.anomaly.engine.evaluators.GeographyRule.Comparison.LESS_THAN;

/**
 * Lookup table of geography-dependent rules keyed by (geography, message type).
 */
public final class GeographyRuleTable {

    private static final Map<Geography, Map<MessageType, List<GeographyRule>>> TABLE = new EnumMap<>(Geography.class);

    static {
        add(Geography.RAINY, new GeographyRule(MessageType.VEHICLE_DATA, Signals.SPEED, GREATER_THAN, 70,
                AnomalyType.HIGH_SPEED_IN_RAIN, "High speed in rain: %.1f km/h (limit %.0f)"));

        add(Geography.MOUNTAINOUS, new GeographyRule(MessageType.ENGINE_DATA, Signals.ENGINE_TEMP, GREATER_THAN, 95,
                AnomalyType.HIGH_TEMPERATURE_IN_MOUNTAINOUS, "High engine temperature in mountainous area: %.1f°C (limit %.0f)"));
        add(Geography.MOUNTAINOUS, new GeographyRule(MessageType.VEHICLE_DATA, Signals.SPEED, GREATER_THAN, 70,
                AnomalyType.HIGH_SPEED_IN_MOUNTAINOUS, "High speed in mountainous area: %.1f km/h (limit %.0f)"));

        add(Geography.HOT, new GeographyRule(MessageType.ENGINE_DATA, Signals.ENGINE_TEMP, GREATER_THAN, 100,
                AnomalyType.HIGH_TEMPERATURE_IN_HOT, "High engine temperature in hot weather: %.1f°C (limit %.0f)"));
        add(Geography.HOT, new GeographyRule(MessageType.CLIMATE_CONTROL, Signals.CABIN_TEMP, GREATER_THAN, 28,
                AnomalyType.HIGH_CABIN_TEMPERATURE, "High cabin temperature: %.1f°C (limit %.0f)"));
        add(Geography.HOT, new GeographyRule(MessageType.CLIMATE_CONTROL, Signals.AC_STATUS, EQUAL_TO, 0,
                AnomalyType.AC_OFF_IN_HOT, "AC is off in hot weather (ACStatus=%.0f)"));

        add(Geography.SNOWY, new GeographyRule(MessageType.VEHICLE_DATA, Signals.SPEED, GREATER_THAN, 50,
                AnomalyType.HIGH_SPEED_IN_SNOW, "High speed in snow: %.1f km/h (limit %.0f)"));
        add(Geography.SNOWY, new GeographyRule(MessageType.CLIMATE_CONTROL, Signals.CABIN_TEMP, LESS_THAN, 18,
                AnomalyType.LOW_CABIN_TEMPERATURE, "Low cabin temperature: %.1f°C (minimum %.0f)"));

        add(Geography.URBAN, new GeographyRule(MessageType.VEHICLE_DATA, Signals.SPEED, GREATER_THAN, 60,
                AnomalyType.HIGH_SPEED_IN_URBAN, "Urban speed limit exceeded: %.1f km/h (limit %.0f)"));
        add(Geography.URBAN, new GeographyRule(MessageType.ENGINE_DATA, Signals.ENGINE_SPEED, GREATER_THAN, 4000,
                AnomalyType.HIGH_ENGINE_SPEED, "High engine speed in urban area: %.1f RPM (limit %.0f)"));

        add(Geography.HIGHWAY, new GeographyRule(MessageType.VEHICLE_DATA, Signals.SPEED, LESS_THAN, 60,
                AnomalyType.LOW_SPEED_IN_HIGHWAY, "Low speed on highway: %.1f km/h (minimum %.0f)"));
    }

    private GeographyRuleTable() {}

    private static void add(Geography geography, GeographyRule rule) {
        TABLE.computeIfAbsent(geography, g -> new EnumMap<>(MessageType.class))
                .computeIfAbsent(rule.messageType(), t -> new ArrayList<>())
                .add(rule);
    }

    public static List<GeographyRule> rulesFor(Geography geography, MessageType messageType) {
        Map<MessageType, List<GeographyRule>> byType = TABLE.get(geography);
        if (byType == null) {
            return List.of();
        }
        return Collections.unmodifiableList(byType.getOrDefault(messageType, List.of()));
    }

    /** Every rule in the table, in declaration order per geography. */
    public static List<GeographyRule> allRules() {
        List<GeographyRule> all = new ArrayList<>();
        TABLE.values().forEach(byType -> byType.values().forEach(all::addAll));
        return all;
    }
}
