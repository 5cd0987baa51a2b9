package com.fleet.anomaly.model;

/**
 * Signal names carried by the decoded telemetry messages.
 */
public final class Signals {

    // EngineData
    public static final String ENGINE_SPEED = "EngineSpeed";
    public static final String ENGINE_TEMP = "EngineTemp";
    public static final String BATTERY_LEVEL = "BatteryLevel";

    // VehicleData
    public static final String SPEED = "Speed";
    public static final String GEAR_POSITION = "GearPosition";
    public static final String BATTERY_VOLTAGE = "BatteryVoltage";

    // ClimateControl
    public static final String CABIN_TEMP = "CabinTemp";
    public static final String FAN_SPEED = "FanSpeed";
    public static final String AC_STATUS = "ACStatus";

    private Signals() {}
}
