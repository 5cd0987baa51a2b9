package com.fleet.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger modelTrained;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.modelTrained = registry.gauge("model.trained", new AtomicInteger(0));
    }

    public void recordTelemetry(String messageType) {
        Counter.builder("telemetry.received.count")
                .tag("message_type", messageType)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String anomalyType, String messageType) {
        Counter.builder("anomaly.detected.count")
                .tag("anomaly_type", anomalyType)
                .tag("message_type", messageType)
                .register(registry)
                .increment();
    }

    public void recordSinkFailure(String sink) {
        Counter.builder("anomaly.sink.failure.count")
                .tag("sink", sink)
                .register(registry)
                .increment();
    }

    public void recordModelTraining(String messageType, String status) {
        Counter.builder("model.training.count")
                .tag("message_type", messageType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateModelTrained(boolean trained) {
        modelTrained.set(trained ? 1 : 0);
    }
}
