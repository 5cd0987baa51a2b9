package com.fleet.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Feature vectors every message type must collect before the models are trained.
    private int minSamplesPerType = 500;

    // Directory holding one serialized model per message type.
    private String modelStorePath = "trained_models";

    private Model model = new Model();

    private Rules rules = new Rules();

    private Simulator simulator = new Simulator();

    @Data
    public static class Model {
        // Expected share of outliers in the training data; sets the decision threshold.
        private double contamination = 0.05;
        private int numEstimators = 100;
        // Sub-sampling size per tree, capped at the number of collected samples.
        private int maxSamples = 256;
        private long randomSeed = 42L;
    }

    @Data
    public static class Rules {
        // When false, diagnostic-only findings are logged and never reach the sinks.
        private boolean forwardDiagnostics = true;
    }

    @Data
    public static class Simulator {
        private boolean enabled = false;
        private long intervalMs = 200;
        private long seed = 42L;
        private List<String> vehicleIds = List.of("VHC_01", "VHC_02", "VHC_03", "VHC_04", "VHC_05");
    }
}
