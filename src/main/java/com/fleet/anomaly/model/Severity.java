package com.fleet.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
