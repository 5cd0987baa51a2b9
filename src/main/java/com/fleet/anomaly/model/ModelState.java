package com.fleet.anomaly.model;

/**
 * Lifecycle of one message type's outlier model.
 */
public enum ModelState {
    /** Nothing loaded and nothing collected yet. */
    UNINITIALIZED,
    /** Accumulating feature vectors until the training threshold is met. */
    COLLECTING,
    /** Fitted (or loaded) and frozen; only used for inference. */
    TRAINED
}
