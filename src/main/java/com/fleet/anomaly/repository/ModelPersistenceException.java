package com.fleet.anomaly.repository;

/**
 * Raised when a model artifact cannot be written, read or decoded.
 */
public class ModelPersistenceException extends RuntimeException {

    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
