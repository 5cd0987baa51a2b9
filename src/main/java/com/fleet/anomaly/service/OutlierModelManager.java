package com.fleet.anomaly.service;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.config.MetricsConfig;
import com.fleet.anomaly.engine.isolationforest.AnomalyExplainer;
import com.fleet.anomaly.engine.isolationforest.FeatureExtractor;
import com.fleet.anomaly.engine.isolationforest.IsolationForest;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.ModelState;
import com.fleet.anomaly.model.ModelStatus;
import com.fleet.anomaly.model.Prediction;
import com.fleet.anomaly.model.SignalSnapshot;
import com.fleet.anomaly.repository.IsolationForestModelRepository;
import com.fleet.anomaly.repository.ModelPersistenceException;
import com.fleet.anomaly.repository.StoredModel;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one Isolation Forest per message type through its lifecycle:
 * load or collect, train once when every collecting type has enough samples, then freeze.
 *
 * The models only serve predictions after all three types are trained. The global flag is
 * written after the fitted models are installed, so a reader that sees it also sees them.
 */
@Service
public class OutlierModelManager {

    private static final Logger log = LoggerFactory.getLogger(OutlierModelManager.class);

    private final DetectionConfig config;
    private final IsolationForestModelRepository repository;
    private final AnomalyExplainer explainer;
    private final MetricsConfig metricsConfig;
    private final Executor trainingExecutor;

    private final Map<MessageType, ModelSlot> slots = new EnumMap<>(MessageType.class);
    private final AtomicBoolean trainingScheduled = new AtomicBoolean(false);
    private volatile boolean trained;

    public OutlierModelManager(DetectionConfig config,
                               IsolationForestModelRepository repository,
                               AnomalyExplainer explainer,
                               MetricsConfig metricsConfig,
                               @Qualifier("modelTrainingExecutor") Executor trainingExecutor) {
        this.config = config;
        this.repository = repository;
        this.explainer = explainer;
        this.metricsConfig = metricsConfig;
        this.trainingExecutor = trainingExecutor;
        for (MessageType type : MessageType.values()) {
            slots.put(type, new ModelSlot());
        }
    }

    /**
     * Load persisted models. A type whose artifact is missing or unreadable starts collecting.
     */
    @PostConstruct
    public void initialize() {
        validateHyperparameters();
        for (MessageType type : MessageType.values()) {
            ModelSlot slot = slots.get(type);
            synchronized (slot) {
                try {
                    Optional<StoredModel> loaded = repository.load(type);
                    if (loaded.isPresent()) {
                        slot.install(loaded.get());
                        log.info("Loaded {} model: {} trees, trained on {} samples",
                                type.getWireName(), loaded.get().getForest().getTrees().size(),
                                loaded.get().getTrainingSamples());
                        continue;
                    }
                    log.info("No saved {} model. Collecting {} samples before training.",
                            type.getWireName(), config.getMinSamplesPerType());
                } catch (ModelPersistenceException e) {
                    log.error("Could not load {} model, collecting fresh samples instead",
                            type.getWireName(), e);
                }
                slot.startCollecting();
            }
        }

        if (slots.values().stream().allMatch(slot -> slot.state == ModelState.TRAINED)) {
            trainingScheduled.set(true);
            markTrained();
        }
    }

    /**
     * Record a sample for training. No-op once the models are trained.
     */
    public void observe(MessageType messageType, SignalSnapshot snapshot) {
        if (trained) {
            return;
        }
        ModelSlot slot = slots.get(messageType);
        double[] features = FeatureExtractor.project(messageType, snapshot);
        synchronized (slot) {
            if (slot.state != ModelState.COLLECTING) {
                return;
            }
            slot.buffer.add(features);
        }

        if (readyToTrain() && trainingScheduled.compareAndSet(false, true)) {
            log.info("Enough samples collected for every message type. Scheduling model training.");
            try {
                trainingExecutor.execute(this::trainCollected);
            } catch (RejectedExecutionException e) {
                trainingScheduled.set(false);
                log.error("Model training could not be scheduled", e);
            }
        }
    }

    public boolean isTrained() {
        return trained;
    }

    /**
     * @throws IllegalStateException when the models are not trained yet
     */
    public Prediction predict(MessageType messageType, SignalSnapshot snapshot) {
        IsolationForest forest = trainedForest(messageType);
        return forest.predict(FeatureExtractor.project(messageType, snapshot));
    }

    public String explain(MessageType messageType, SignalSnapshot snapshot) {
        StoredModel model = slots.get(messageType).model;
        return explainer.explain(messageType, snapshot, model == null ? null : model.getForest());
    }

    public List<ModelStatus> status() {
        List<ModelStatus> statuses = new ArrayList<>();
        for (MessageType type : MessageType.values()) {
            statuses.add(status(type));
        }
        return statuses;
    }

    public ModelStatus status(MessageType messageType) {
        ModelSlot slot = slots.get(messageType);
        DetectionConfig.Model hyper = config.getModel();
        int required = config.getMinSamplesPerType();
        synchronized (slot) {
            int collected = slot.buffer.size();
            StoredModel model = slot.model;
            double progress = slot.state == ModelState.TRAINED ? 100.0
                    : required <= 0 ? 100.0 : Math.min(100.0, collected * 100.0 / required);
            return ModelStatus.builder()
                    .messageType(messageType)
                    .state(slot.state)
                    .samplesCollected(collected)
                    .samplesRequired(required)
                    .progressPct(Math.round(progress * 10) / 10.0)
                    .trainingSamples(model == null ? 0 : model.getTrainingSamples())
                    .trainedAt(model == null ? 0 : model.getTrainedAt())
                    .treeCount(model == null ? 0 : model.getForest().getTrees().size())
                    .contamination(hyper.getContamination())
                    .randomSeed(hyper.getRandomSeed())
                    .build();
        }
    }

    /**
     * Drop the current models and collect again from scratch. Predictions stop until the
     * next training pass completes.
     *
     * @throws IllegalStateException while a training pass is running
     */
    public synchronized void retrain() {
        if (trainingScheduled.get() && !trained) {
            throw new IllegalStateException("Model training is already in progress");
        }
        trained = false;
        metricsConfig.updateModelTrained(false);
        for (ModelSlot slot : slots.values()) {
            synchronized (slot) {
                slot.model = null;
                slot.startCollecting();
            }
        }
        trainingScheduled.set(false);
        log.info("Outlier models reset. Collecting {} samples per message type.", config.getMinSamplesPerType());
    }

    private boolean readyToTrain() {
        boolean anyCollecting = false;
        for (ModelSlot slot : slots.values()) {
            synchronized (slot) {
                if (slot.state == ModelState.COLLECTING) {
                    anyCollecting = true;
                    if (slot.buffer.size() < config.getMinSamplesPerType()) {
                        return false;
                    }
                }
            }
        }
        return anyCollecting;
    }

    /**
     * Fit every collecting type on its buffer, then persist and install the models and flip
     * the global flag. Nothing is persisted unless every fit succeeded. Runs once, on the
     * training executor.
     */
    void trainCollected() {
        Map<MessageType, StoredModel> fitted = new EnumMap<>(MessageType.class);
        try {
            for (Map.Entry<MessageType, ModelSlot> entry : slots.entrySet()) {
                double[][] data;
                synchronized (entry.getValue()) {
                    if (entry.getValue().state != ModelState.COLLECTING) {
                        continue;
                    }
                    data = entry.getValue().buffer.toArray(new double[0][]);
                }
                fitted.put(entry.getKey(), fitModel(entry.getKey(), data));
            }
        } catch (RuntimeException e) {
            log.error("Model training failed. Collection continues and training will be retried.", e);
            metricsConfig.recordModelTraining("all", "error");
            trainingScheduled.set(false);
            return;
        }

        for (StoredModel model : fitted.values()) {
            try {
                repository.save(model);
            } catch (ModelPersistenceException e) {
                log.error("Could not persist {} model. It stays active in memory.",
                        model.getMessageType().getWireName(), e);
            }
        }

        for (Map.Entry<MessageType, StoredModel> entry : fitted.entrySet()) {
            ModelSlot slot = slots.get(entry.getKey());
            synchronized (slot) {
                slot.install(entry.getValue());
            }
        }
        markTrained();
        log.info("All outlier models trained. Isolation forest predictions are now active.");
    }

    StoredModel fitModel(MessageType type, double[][] data) {
        DetectionConfig.Model hyper = config.getModel();
        long start = System.currentTimeMillis();
        IsolationForest forest = new IsolationForest();
        forest.fit(data, hyper.getNumEstimators(), hyper.getMaxSamples(),
                hyper.getContamination(), hyper.getRandomSeed());

        metricsConfig.recordModelTraining(type.getWireName(), "success");
        log.info("Trained {} model on {} samples in {} ms",
                type.getWireName(), data.length, System.currentTimeMillis() - start);
        return StoredModel.builder()
                .messageType(type)
                .trainedAt(System.currentTimeMillis())
                .trainingSamples(data.length)
                .featureNames(FeatureExtractor.featureNames(type))
                .forest(forest)
                .build();
    }

    private void validateHyperparameters() {
        DetectionConfig.Model hyper = config.getModel();
        if (hyper.getContamination() <= 0 || hyper.getContamination() > 0.5) {
            throw new IllegalStateException(
                    "detection.model.contamination must be in (0, 0.5], got " + hyper.getContamination());
        }
        if (hyper.getNumEstimators() < 1) {
            throw new IllegalStateException(
                    "detection.model.num-estimators must be at least 1, got " + hyper.getNumEstimators());
        }
        if (hyper.getMaxSamples() < 1) {
            throw new IllegalStateException(
                    "detection.model.max-samples must be at least 1, got " + hyper.getMaxSamples());
        }
        if (config.getMinSamplesPerType() < 1) {
            throw new IllegalStateException(
                    "detection.min-samples-per-type must be at least 1, got " + config.getMinSamplesPerType());
        }
    }

    private void markTrained() {
        trained = true;
        metricsConfig.updateModelTrained(true);
    }

    private IsolationForest trainedForest(MessageType messageType) {
        if (!trained) {
            throw new IllegalStateException("Outlier models are not trained yet");
        }
        StoredModel model = slots.get(messageType).model;
        if (model == null) {
            throw new IllegalStateException("No trained model for " + messageType.getWireName());
        }
        return model.getForest();
    }

    /** Per-type state. Mutated under its own monitor. */
    private static final class ModelSlot {
        volatile ModelState state = ModelState.UNINITIALIZED;
        volatile StoredModel model;
        final List<double[]> buffer = new ArrayList<>();

        void install(StoredModel stored) {
            model = stored;
            state = ModelState.TRAINED;
            buffer.clear();
        }

        void startCollecting() {
            buffer.clear();
            state = ModelState.COLLECTING;
        }
    }
}
