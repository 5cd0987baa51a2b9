package com.fleet.anomaly.sink;

import com.fleet.anomaly.model.Anomaly;

/**
 * Destination for detected anomalies. Implementations may block or fail; callers run them
 * off the ingestion path and never retry.
 */
public interface AnomalySink {

    /** Name used in logs and the {@code sink} metric tag. */
    String getName();

    void write(Anomaly anomaly) throws Exception;
}
