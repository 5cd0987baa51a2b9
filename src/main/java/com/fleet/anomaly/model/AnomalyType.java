package com.fleet.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed vocabulary of anomaly tags. The tag strings are consumed by downstream dashboards
 * and alerting and must not change.
 *
 * Types flagged as diagnostic were log-only checks historically; they reach the sink only
 * when {@code detection.rules.forward-diagnostics} is enabled.
 */
public enum AnomalyType {

    // Temporal
    SUDDEN_SPEED_CHANGE("sudden_speed_change", false),
    SUDDEN_GEAR_CHANGE("sudden_gear_change", true),
    SUDDEN_TEMPERATURE_CHANGE("sudden_temperature_change", false),
    SUDDEN_ENGINE_SPEED_CHANGE("sudden_engine_speed_change", true),
    SUDDEN_BATTERY_DROP("sudden_battery_drop", true),
    SUDDEN_CABIN_TEMPERATURE_CHANGE("sudden_cabin_temperature_change", true),

    // Geography
    HIGH_SPEED_IN_RAIN("high_speed_in_rain", false),
    HIGH_TEMPERATURE_IN_MOUNTAINOUS("high_temperature_in_mountainous", false),
    HIGH_SPEED_IN_MOUNTAINOUS("high_speed_in_mountainous", false),
    HIGH_TEMPERATURE_IN_HOT("high_temperature_in_hot", false),
    HIGH_CABIN_TEMPERATURE("high_cabin_temperature", false),
    AC_OFF_IN_HOT("ac_off_in_hot", false),
    HIGH_SPEED_IN_SNOW("high_speed_in_snow", false),
    LOW_CABIN_TEMPERATURE("low_cabin_temperature", false),
    HIGH_SPEED_IN_URBAN("high_speed_in_urban", false),
    HIGH_ENGINE_SPEED("high_engine_speed", false),
    LOW_SPEED_IN_HIGHWAY("low_speed_in_highway", false),

    // Absolute / cross-signal
    CRITICAL_ENGINE_TEMPERATURE("critical_engine_temperature", true),
    CRITICAL_BATTERY_LEVEL("critical_battery_level", true),
    LOW_BATTERY_LEVEL("low_battery_level", true),
    GEAR_SPEED_MISMATCH("gear_speed_mismatch", true),
    CRITICAL_GEAR_MISMATCH("critical_gear_mismatch", true),
    CRITICAL_LOW_CABIN_TEMPERATURE("critical_low_cabin_temperature", true),
    CRITICAL_HIGH_CABIN_TEMPERATURE("critical_high_cabin_temperature", true),

    // Outlier model
    ISOLATION_FOREST("isolation_forest", false);

    private final String tag;
    private final boolean diagnostic;

    AnomalyType(String tag, boolean diagnostic) {
        this.tag = tag;
        this.diagnostic = diagnostic;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public boolean isDiagnostic() {
        return diagnostic;
    }
}
