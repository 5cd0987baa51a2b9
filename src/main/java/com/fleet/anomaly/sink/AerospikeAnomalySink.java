package com.fleet.anomaly.sink;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleet.anomaly.config.AerospikeConfig;
import com.fleet.anomaly.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Persists every anomaly as one record in the {@code anomalies} set.
 */
@Component
public class AerospikeAnomalySink implements AnomalySink {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAnomalySink.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AerospikeAnomalySink(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getName() {
        return "aerospike";
    }

    @Override
    public void write(Anomaly anomaly) throws JsonProcessingException {
        String anomalyId = UUID.randomUUID().toString();
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);

        client.put(writePolicy, key, toBins(anomalyId, anomaly));

        log.debug("Stored anomaly {} ({}) for vehicle {}",
                anomalyId, anomaly.getAnomalyType().getTag(), anomaly.getVehicleId());
    }

    // Aerospike bin names are limited to 15 characters
    Bin[] toBins(String anomalyId, Anomaly anomaly) throws JsonProcessingException {
        return new Bin[]{
                new Bin("anomalyId", anomalyId),
                new Bin("vehicleId", anomaly.getVehicleId()),
                new Bin("anomalyType", anomaly.getAnomalyType().getTag()),
                new Bin("messageType", anomaly.getMessageType().getWireName()),
                new Bin("geography", anomaly.getGeography().getValue()),
                new Bin("severity", anomaly.getSeverity().getValue()),
                new Bin("signals", objectMapper.writeValueAsString(anomaly.getSignals())),
                new Bin("detail", anomaly.getDetail()),
                new Bin("detectedAt", anomaly.getDetectedAt())
        };
    }
}
