package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A decoded telemetry message delivered for anomaly detection")
public class TelemetryMessage {

    @Schema(description = "Vehicle identifier", example = "VHC_01")
    private String vehicleId;

    @Schema(description = "Message type", example = "VehicleData",
            allowableValues = {"EngineData", "VehicleData", "ClimateControl"})
    private String messageType;

    @Schema(description = "Current geography of the vehicle", example = "rainy",
            allowableValues = {"rainy", "mountainous", "urban", "highway", "hot", "snowy"})
    private String geography;

    @Schema(description = "Decoded signal values keyed by signal name",
            example = "{\"Speed\": 90.0, \"GearPosition\": 1, \"BatteryVoltage\": 400.0}")
    private Map<String, Double> signals;
}
