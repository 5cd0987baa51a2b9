package com.fleet.anomaly.engine.evaluators;

import com.fleet.anomaly.model.AnomalyType;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.RuleFinding;
import com.fleet.anomaly.model.Severity;
import com.fleet.anomaly.model.SignalSnapshot;

import java.util.Locale;
import java.util.Optional;

/**
 * One row of the geography rule table: a single signal compared against a fixed threshold.
 * The detail format receives the observed value followed by the threshold.
 */
public record GeographyRule(MessageType messageType, String signal, Comparison comparison,
                            double threshold, AnomalyType anomalyType, String detailFormat) {

    public enum Comparison {
        GREATER_THAN {
            @Override
            boolean test(double value, double threshold) { return value > threshold; }
        },
        LESS_THAN {
            @Override
            boolean test(double value, double threshold) { return value < threshold; }
        },
        EQUAL_TO {
            @Override
            boolean test(double value, double threshold) { return value == threshold; }
        };

        abstract boolean test(double value, double threshold);
    }

    /**
     * Signals absent from the snapshot never trigger the rule.
     */
    public Optional<RuleFinding> check(SignalSnapshot snapshot) {
        if (!snapshot.has(signal)) {
            return Optional.empty();
        }
        double value = snapshot.valueOrZero(signal);
        if (!comparison.test(value, threshold)) {
            return Optional.empty();
        }
        return Optional.of(RuleFinding.of(anomalyType, Severity.WARNING,
                String.format(Locale.ROOT, detailFormat, value, threshold)));
    }
}
