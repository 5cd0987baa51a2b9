package com.fleet.anomaly.model;

public enum Prediction {
    NORMAL,
    ANOMALY
}
