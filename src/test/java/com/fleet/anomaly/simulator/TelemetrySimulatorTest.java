package com.fleet.anomaly.simulator;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.model.Geography;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.model.Signals;
import com.fleet.anomaly.service.TelemetryDetectionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TelemetrySimulatorTest {

    @Mock
    private TelemetryDetectionService detectionService;

    private TelemetrySimulator simulator;

    @BeforeEach
    void setUp() {
        simulator = new TelemetrySimulator(detectionService, new DetectionConfig());
    }

    @Test
    void emit_visitsVehiclesAndTypesRoundRobin() {
        for (int i = 0; i < 6; i++) {
            simulator.emit();
        }

        ArgumentCaptor<String> vehicles = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<MessageType> types = ArgumentCaptor.forClass(MessageType.class);
        verify(detectionService, times(6)).handle(vehicles.capture(), types.capture(), any(SignalSnapshot.class),
                any(Geography.class));
        assertThat(vehicles.getAllValues())
                .containsExactly("VHC_01", "VHC_02", "VHC_03", "VHC_04", "VHC_05", "VHC_01");
        assertThat(types.getAllValues()).containsExactly(
                MessageType.ENGINE_DATA, MessageType.VEHICLE_DATA, MessageType.CLIMATE_CONTROL,
                MessageType.ENGINE_DATA, MessageType.VEHICLE_DATA, MessageType.CLIMATE_CONTROL);
    }

    @Test
    void generate_staysWithinSignalRanges() {
        for (int i = 0; i < 500; i++) {
            SignalSnapshot engine = simulator.generate(MessageType.ENGINE_DATA);
            assertThat(engine.valueOrZero(Signals.ENGINE_SPEED)).isBetween(800.0, 6000.0);
            assertThat(engine.valueOrZero(Signals.ENGINE_TEMP)).isBetween(60.0, 120.0);
            assertThat(engine.valueOrZero(Signals.BATTERY_LEVEL)).isBetween(0.0, 100.0);

            SignalSnapshot vehicle = simulator.generate(MessageType.VEHICLE_DATA);
            assertThat(vehicle.valueOrZero(Signals.SPEED)).isBetween(0.0, 240.0);
            assertThat(vehicle.valueOrZero(Signals.GEAR_POSITION)).isBetween(1.0, 6.0);
            assertThat(vehicle.valueOrZero(Signals.BATTERY_VOLTAGE)).isBetween(360.0, 420.0);
        }
    }

    @Test
    void generate_climateFanFollowsAc() {
        for (int i = 0; i < 500; i++) {
            SignalSnapshot climate = simulator.generate(MessageType.CLIMATE_CONTROL);
            double fan = climate.valueOrZero(Signals.FAN_SPEED);
            boolean acOn = climate.valueOrZero(Signals.AC_STATUS) == 1.0;

            assertThat(climate.valueOrZero(Signals.CABIN_TEMP)).isBetween(10.0, 35.0);
            if (acOn) {
                assertThat(fan).isBetween(1.0, 5.0);
            } else {
                assertThat(fan).isZero();
            }
        }
    }
}
