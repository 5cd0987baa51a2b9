package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Latest observed state of a vehicle, per message type")
public class VehicleState {

    @Schema(description = "Vehicle identifier", example = "VHC_01")
    private String vehicleId;

    @Schema(description = "Last time a compared (non-first) sample was recorded, epoch milliseconds",
            example = "1739886764000")
    private long lastUpdate;

    @Schema(description = "Most recent snapshot per message type")
    @Builder.Default
    private Map<MessageType, SignalSnapshot> lastValues = new EnumMap<>(MessageType.class);

    @Schema(description = "Geography reported with the most recent message", example = "urban")
    private Geography geography;

    /** Detached copy, safe to hand out while the original keeps being mutated. */
    public VehicleState copy() {
        Map<MessageType, SignalSnapshot> values = new EnumMap<>(MessageType.class);
        values.putAll(lastValues);
        return new VehicleState(vehicleId, lastUpdate, values, geography);
    }
}
