package com.fleet.anomaly.model;

public enum RuleFamily {
    /** Deltas against the previous snapshot of the same message type. */
    TEMPORAL,
    /** Thresholds that depend on the vehicle's current geography. */
    GEOGRAPHY,
    /** Absolute and cross-signal thresholds, independent of history and geography. */
    SIGNAL_THRESHOLD
}
