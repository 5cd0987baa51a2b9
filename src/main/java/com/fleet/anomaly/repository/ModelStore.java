package com.fleet.anomaly.repository;

import com.fleet.anomaly.model.MessageType;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable byte storage for one serialized outlier model per message type.
 */
public interface ModelStore {

    void save(MessageType messageType, byte[] artifact) throws IOException;

    /** Returns empty when no artifact has been saved for the type. */
    Optional<byte[]> load(MessageType messageType) throws IOException;
}
