package com.fleet.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Road/environment context a vehicle is currently in. Supplied by the caller with every
 * message, never inferred.
 */
public enum Geography {
    RAINY("rainy"),
    MOUNTAINOUS("mountainous"),
    URBAN("urban"),
    HIGHWAY("highway"),
    HOT("hot"),
    SNOWY("snowy");

    private final String value;

    Geography(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException if the value is not one of the known geographies
     */
    @JsonCreator
    public static Geography fromValue(String value) {
        if (value != null) {
            for (Geography geography : values()) {
                if (geography.value.equalsIgnoreCase(value)) {
                    return geography;
                }
            }
        }
        throw new IllegalArgumentException("Unknown geography: " + value + ". Valid values: " +
                Arrays.stream(values()).map(Geography::getValue).collect(Collectors.joining(", ")));
    }
}
