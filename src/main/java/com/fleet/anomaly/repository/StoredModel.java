package com.fleet.anomaly.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fleet.anomaly.engine.isolationforest.IsolationForest;
import com.fleet.anomaly.model.MessageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * On-disk envelope around a fitted forest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredModel {

    private MessageType messageType;
    private long trainedAt;
    private int trainingSamples;
    private List<String> featureNames;
    private IsolationForest forest;
}
