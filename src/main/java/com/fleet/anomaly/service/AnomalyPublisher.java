package com.fleet.anomaly.service;

import com.fleet.anomaly.config.MetricsConfig;
import com.fleet.anomaly.model.Anomaly;
import com.fleet.anomaly.sink.AnomalySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hands anomalies to every registered sink off the ingestion thread. A failing sink is
 * logged and counted; it does not affect the other sinks and is not retried.
 */
@Service
public class AnomalyPublisher {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPublisher.class);

    private final List<AnomalySink> sinks;
    private final MetricsConfig metricsConfig;

    public AnomalyPublisher(List<AnomalySink> sinks, MetricsConfig metricsConfig) {
        this.sinks = sinks;
        this.metricsConfig = metricsConfig;
    }

    @Async("anomalySinkExecutor")
    public void publishAll(List<Anomaly> anomalies) {
        for (Anomaly anomaly : anomalies) {
            publish(anomaly);
        }
    }

    void publish(Anomaly anomaly) {
        for (AnomalySink sink : sinks) {
            try {
                sink.write(anomaly);
            } catch (Exception e) {
                metricsConfig.recordSinkFailure(sink.getName());
                log.error("Sink {} failed to write {} for vehicle {}: {}", sink.getName(),
                        anomaly.getAnomalyType().getTag(), anomaly.getVehicleId(), e.getMessage(), e);
            }
        }
    }
}
