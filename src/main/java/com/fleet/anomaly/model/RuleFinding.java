package com.fleet.anomaly.model;

import lombok.Value;

/**
 * What a single rule reports before it is turned into an {@link Anomaly} with the vehicle's
 * context attached.
 */
@Value(staticConstructor = "of")
public class RuleFinding {
    AnomalyType anomalyType;
    Severity severity;
    String detail;
}
