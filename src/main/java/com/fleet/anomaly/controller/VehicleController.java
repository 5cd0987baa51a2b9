package com.fleet.anomaly.controller;

import com.fleet.anomaly.engine.VehicleStateStore;
import com.fleet.anomaly.model.VehicleState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/vehicles")
@Tag(name = "Vehicles", description = "Inspect the last known state of a vehicle")
public class VehicleController {

    private final VehicleStateStore stateStore;

    public VehicleController(VehicleStateStore stateStore) {
        this.stateStore = stateStore;
    }

    @Operation(summary = "Get vehicle state",
            description = "Returns the last snapshot per message type, current geography and last update time.")
    @GetMapping("/{vehicleId}")
    public ResponseEntity<VehicleState> getVehicle(
            @Parameter(description = "Vehicle ID", example = "VHC_01")
            @PathVariable String vehicleId) {
        return stateStore.find(vehicleId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
