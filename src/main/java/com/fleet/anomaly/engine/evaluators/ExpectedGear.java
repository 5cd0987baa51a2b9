package com.fleet.anomaly.engine.evaluators;

/**
 * Gear a vehicle is expected to be in at a given speed.
 *
 * <pre>
 *   0-20 km/h   → 1
 *   21-40 km/h  → 2
 *   41-70 km/h  → 3
 *   71-100 km/h → 4
 *   101-150 km/h → 5
 *   150+ km/h   → 6
 * </pre>
 */
public final class ExpectedGear {

    private ExpectedGear() {}

    public static int forSpeed(double speed) {
        if (speed <= 20) return 1;
        if (speed <= 40) return 2;
        if (speed <= 70) return 3;
        if (speed <= 100) return 4;
        if (speed <= 150) return 5;
        return 6;
    }
}
