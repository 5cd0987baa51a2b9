package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Lifecycle status of the outlier model for one message type")
public class ModelStatus {

    @Schema(description = "Message type", example = "EngineData")
    private MessageType messageType;

    @Schema(description = "Lifecycle state", example = "COLLECTING")
    private ModelState state;

    @Schema(description = "Feature vectors collected so far", example = "312")
    private int samplesCollected;

    @Schema(description = "Samples required before training", example = "500")
    private int samplesRequired;

    @Schema(description = "Collection progress in percent (capped at 100)", example = "62.4")
    private double progressPct;

    @Schema(description = "Samples the current model was fitted on (0 when untrained)", example = "500")
    private int trainingSamples;

    @Schema(description = "Training time in epoch milliseconds (0 when untrained)", example = "1739886764000")
    private long trainedAt;

    @Schema(description = "Number of isolation trees", example = "100")
    private int treeCount;

    @Schema(description = "Expected share of outliers in the training data", example = "0.05")
    private double contamination;

    @Schema(description = "Random seed used for training", example = "42")
    private long randomSeed;
}
