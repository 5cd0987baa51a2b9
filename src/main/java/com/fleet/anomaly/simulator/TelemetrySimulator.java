package com.fleet.anomaly.simulator;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.evaluators.ExpectedGear;
import com.fleet.anomaly.model.Geography;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.model.Signals;
import com.fleet.anomaly.service.TelemetryDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates decoded telemetry for a small simulated fleet and feeds it to the detection
 * pipeline. Used to warm up the outlier models locally.
 * Only runs when {@code detection.simulator.enabled=true}.
 *
 * Vehicles and message types are visited round robin; geography is random per message.
 * Signal ranges follow the CAN database of the test bench:
 *   EngineSpeed 800-6000 rpm, EngineTemp 60-120 °C, BatteryLevel 0-100 %,
 *   Speed 0-240 km/h, GearPosition 1-6, BatteryVoltage 360-420 V,
 *   CabinTemp 10-35 °C, FanSpeed 0-5, ACStatus 0/1
 */
@Component
@ConditionalOnProperty(prefix = "detection.simulator", name = "enabled", havingValue = "true")
public class TelemetrySimulator {

    private static final Logger log = LoggerFactory.getLogger(TelemetrySimulator.class);

    private static final MessageType[] MESSAGE_TYPES = MessageType.values();
    private static final Geography[] GEOGRAPHIES = Geography.values();

    private final TelemetryDetectionService detectionService;
    private final List<String> vehicleIds;
    private final Random random;
    private long tick;

    public TelemetrySimulator(TelemetryDetectionService detectionService, DetectionConfig config) {
        this.detectionService = detectionService;
        this.vehicleIds = config.getSimulator().getVehicleIds();
        this.random = new Random(config.getSimulator().getSeed());
        log.info("Telemetry simulator enabled for {} vehicles, every {} ms",
                vehicleIds.size(), config.getSimulator().getIntervalMs());
    }

    @Scheduled(fixedDelayString = "${detection.simulator.interval-ms:200}")
    public synchronized void emit() {
        String vehicleId = vehicleIds.get((int) (tick % vehicleIds.size()));
        MessageType messageType = MESSAGE_TYPES[(int) (tick % MESSAGE_TYPES.length)];
        Geography geography = GEOGRAPHIES[random.nextInt(GEOGRAPHIES.length)];
        tick++;

        try {
            detectionService.handle(vehicleId, messageType, generate(messageType), geography);
        } catch (RuntimeException e) {
            log.error("Simulated {} message for {} failed: {}", messageType.getWireName(), vehicleId, e.getMessage(), e);
        }
    }

    SignalSnapshot generate(MessageType messageType) {
        Map<String, Double> signals = new LinkedHashMap<>();
        switch (messageType) {
            case ENGINE_DATA -> {
                signals.put(Signals.ENGINE_SPEED, uniform(800, 6000));
                signals.put(Signals.ENGINE_TEMP, uniform(60, 120));
                signals.put(Signals.BATTERY_LEVEL, uniform(0, 100));
            }
            case VEHICLE_DATA -> {
                double speed = uniform(0, 240);
                // mostly the expected gear, sometimes one off
                int gear = ExpectedGear.forSpeed(speed) + random.nextInt(3) - 1;
                signals.put(Signals.SPEED, speed);
                signals.put(Signals.GEAR_POSITION, (double) Math.max(1, Math.min(6, gear)));
                signals.put(Signals.BATTERY_VOLTAGE, uniform(360, 420));
            }
            case CLIMATE_CONTROL -> generateClimate(signals);
        }
        return SignalSnapshot.of(signals);
    }

    private void generateClimate(Map<String, Double> signals) {
        double cabinTemp = Math.round(uniform(10, 35) * 10) / 10.0;

        double acOnChance = cabinTemp > 25 ? 0.9 : cabinTemp < 15 ? 0.8 : 0.7;
        boolean acOn = random.nextDouble() < acOnChance;

        // fan follows the AC: off with it, faster the warmer the cabin
        int fanSpeed = 0;
        if (acOn) {
            if (cabinTemp > 30) {
                fanSpeed = 4 + random.nextInt(2);
            } else if (cabinTemp > 25) {
                fanSpeed = 3 + random.nextInt(2);
            } else {
                fanSpeed = 1 + random.nextInt(3);
            }
        }

        signals.put(Signals.CABIN_TEMP, cabinTemp);
        signals.put(Signals.FAN_SPEED, (double) fanSpeed);
        signals.put(Signals.AC_STATUS, acOn ? 1.0 : 0.0);
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
