package com.fleet.anomaly.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * A detected abnormal condition. Produced once per triggering evaluation and handed to the
 * sinks; the engine keeps no reference to it. Field names are serialized in snake case,
 * which is the contract downstream consumers read.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "A detected anomaly for a vehicle")
public class Anomaly {

    @Schema(description = "Vehicle identifier", example = "VHC_01")
    String vehicleId;

    @Schema(description = "Anomaly tag from the closed vocabulary", example = "high_speed_in_rain")
    AnomalyType anomalyType;

    @Schema(description = "Message type that triggered the anomaly", example = "VehicleData")
    MessageType messageType;

    @Schema(description = "Geography of the vehicle at detection time", example = "rainy")
    Geography geography;

    @Schema(description = "Severity", example = "warning")
    Severity severity;

    @Schema(description = "Signal values of the triggering message", example = "{\"Speed\": 90.0, \"GearPosition\": 1.0}")
    SignalSnapshot signals;

    @Schema(description = "Human-readable explanation", example = "High speed in rain: 90.0 km/h (limit 70)")
    String detail;

    @Schema(description = "Detection timestamp in epoch milliseconds", example = "1739886764000")
    long detectedAt;
}
