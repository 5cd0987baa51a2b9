package com.fleet.anomaly.engine;

import com.fleet.anomaly.model.Geography;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.model.VehicleState;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of vehicle states, the source of previous values for temporal rules.
 *
 * Each state's monitor guards its own mutation, so updates for one vehicle are serialized
 * while different vehicles proceed in parallel. States are never evicted.
 */
@Component
public class VehicleStateStore {

    private final ConcurrentHashMap<String, VehicleState> states = new ConcurrentHashMap<>();

    public VehicleState getOrCreate(String vehicleId) {
        return states.computeIfAbsent(vehicleId, id -> VehicleState.builder()
                .vehicleId(id)
                .lastUpdate(System.currentTimeMillis())
                .build());
    }

    /**
     * Record a new snapshot for the vehicle.
     *
     * @return the previous snapshot of the same message type, or empty when this is the
     *         vehicle's first sample of that type (nothing to compare against)
     */
    public Optional<SignalSnapshot> update(String vehicleId, MessageType messageType,
                                           SignalSnapshot snapshot, Geography geography, long now) {
        VehicleState state = getOrCreate(vehicleId);
        synchronized (state) {
            state.setGeography(geography);

            SignalSnapshot previous = state.getLastValues().put(messageType, snapshot);
            if (previous == null) {
                return Optional.empty();
            }

            state.setLastUpdate(Math.max(state.getLastUpdate(), now));
            return Optional.of(previous);
        }
    }

    /**
     * A detached copy of the vehicle's state, if the vehicle has been seen.
     */
    public Optional<VehicleState> find(String vehicleId) {
        VehicleState state = states.get(vehicleId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(state.copy());
        }
    }

    public int size() {
        return states.size();
    }
}
