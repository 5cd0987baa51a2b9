package com.fleet.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * The named numeric values of one decoded message. Immutable.
 *
 * Missing signals read as 0 through {@link #valueOrZero(String)} for computation, but are
 * never added to {@link #values()}, so displayed and persisted snapshots only ever carry
 * what the vehicle actually sent.
 */
public final class SignalSnapshot {

    private static final SignalSnapshot EMPTY = new SignalSnapshot(Collections.emptyMap());

    private final Map<String, Double> values;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public SignalSnapshot(Map<String, ? extends Number> values) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name, value.doubleValue());
                }
            });
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static SignalSnapshot of(Map<String, ? extends Number> values) {
        return values == null || values.isEmpty() ? EMPTY : new SignalSnapshot(values);
    }

    public static SignalSnapshot empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, Double> values() {
        return values;
    }

    public boolean has(String signal) {
        return values.containsKey(signal);
    }

    public OptionalDouble find(String signal) {
        Double value = values.get(signal);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public double valueOrZero(String signal) {
        return values.getOrDefault(signal, 0.0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalSnapshot)) return false;
        return values.equals(((SignalSnapshot) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
