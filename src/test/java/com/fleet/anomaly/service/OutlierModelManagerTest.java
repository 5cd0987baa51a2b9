package com.fleet.anomaly.service;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.config.MetricsConfig;
import com.fleet.anomaly.engine.evaluators.SignalThresholdEvaluator;
import com.fleet.anomaly.engine.isolationforest.AnomalyExplainer;
import com.fleet.anomaly.model.*;
import com.fleet.anomaly.repository.FileSystemModelStore;
import com.fleet.anomaly.repository.IsolationForestModelRepository;
import com.fleet.anomaly.repository.ModelPersistenceException;
import com.fleet.anomaly.repository.StoredModel;
import com.fleet.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.fleet.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutlierModelManagerTest {

    private static final int MIN_SAMPLES = 40;

    @TempDir
    Path modelDir;

    @Mock
    private MetricsConfig metricsConfig;

    private DetectionConfig config;
    private IsolationForestModelRepository repository;
    private AnomalyExplainer explainer;
    private final Random random = new Random(5);

    @BeforeEach
    void setUp() {
        config = TestDataFactory.detectionConfig(MIN_SAMPLES);
        repository = new IsolationForestModelRepository(new FileSystemModelStore(modelDir));
        explainer = new AnomalyExplainer(new SignalThresholdEvaluator());
    }

    @Test
    void initialize_noArtifacts_allTypesCollecting() {
        OutlierModelManager manager = newManager(Runnable::run);

        assertThat(manager.isTrained()).isFalse();
        assertThat(manager.status()).extracting(ModelStatus::getState).containsOnly(ModelState.COLLECTING);
    }

    @Test
    void predict_beforeTraining_throws() {
        OutlierModelManager manager = newManager(Runnable::run);
        feed(manager, MessageType.ENGINE_DATA, MIN_SAMPLES);

        assertThatThrownBy(() -> manager.predict(MessageType.ENGINE_DATA, engine(3000, 90, 70)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void observe_oneTypeShort_doesNotTrain() {
        OutlierModelManager manager = newManager(Runnable::run);
        feed(manager, MessageType.ENGINE_DATA, MIN_SAMPLES);
        feed(manager, MessageType.VEHICLE_DATA, MIN_SAMPLES);
        feed(manager, MessageType.CLIMATE_CONTROL, MIN_SAMPLES - 1);

        assertThat(manager.isTrained()).isFalse();
        assertThat(manager.status(MessageType.CLIMATE_CONTROL).getProgressPct()).isEqualTo(97.5);
    }

    @Test
    void observe_allTypesReady_trainsPersistsAndServes() {
        OutlierModelManager manager = newManager(Runnable::run);
        feedAll(manager, MIN_SAMPLES);

        assertThat(manager.isTrained()).isTrue();
        assertThat(modelDir.resolve("engine_model.json")).exists();
        assertThat(modelDir.resolve("vehicle_model.json")).exists();
        assertThat(modelDir.resolve("climate_model.json")).exists();
        assertThat(manager.status()).allSatisfy(status -> {
            assertThat(status.getState()).isEqualTo(ModelState.TRAINED);
            assertThat(status.getTrainingSamples()).isEqualTo(MIN_SAMPLES);
            assertThat(status.getTreeCount()).isEqualTo(50);
        });
        assertThat(manager.predict(MessageType.ENGINE_DATA, engine(3000, 90, 70))).isEqualTo(Prediction.NORMAL);
        assertThat(manager.predict(MessageType.ENGINE_DATA, engine(20000, 300, -50))).isEqualTo(Prediction.ANOMALY);
        verify(metricsConfig).updateModelTrained(true);
    }

    @Test
    void observe_pastThreshold_schedulesTrainingExactlyOnce() {
        List<Runnable> submitted = new ArrayList<>();
        OutlierModelManager manager = newManager(submitted::add);

        feedAll(manager, MIN_SAMPLES * 3);

        assertThat(submitted).hasSize(1);
        assertThat(manager.isTrained()).isFalse();

        submitted.get(0).run();

        assertThat(manager.isTrained()).isTrue();
        assertThat(manager.status(MessageType.VEHICLE_DATA).getTrainingSamples()).isGreaterThanOrEqualTo(MIN_SAMPLES);
    }

    @Test
    void observe_afterTraining_isIgnored() {
        OutlierModelManager manager = newManager(Runnable::run);
        feedAll(manager, MIN_SAMPLES);

        feed(manager, MessageType.ENGINE_DATA, 10);

        assertThat(manager.status(MessageType.ENGINE_DATA).getSamplesCollected()).isZero();
    }

    @Test
    void initialize_persistedModels_areReadyWithoutCollecting() {
        OutlierModelManager first = newManager(Runnable::run);
        feedAll(first, MIN_SAMPLES);
        double[][] probes = {{3000, 90, 70}, {6000, 120, 1}};

        OutlierModelManager second = newManager(Runnable::run);

        assertThat(second.isTrained()).isTrue();
        for (double[] probe : probes) {
            SignalSnapshot snapshot = engine(probe[0], probe[1], probe[2]);
            assertThat(second.predict(MessageType.ENGINE_DATA, snapshot))
                    .isEqualTo(first.predict(MessageType.ENGINE_DATA, snapshot));
        }
    }

    @Test
    void initialize_partialArtifacts_trainsOnlyMissingTypes() throws Exception {
        OutlierModelManager first = newManager(Runnable::run);
        feedAll(first, MIN_SAMPLES);
        Files.delete(modelDir.resolve("climate_model.json"));

        OutlierModelManager second = newManager(Runnable::run);
        assertThat(second.isTrained()).isFalse();
        assertThat(second.status(MessageType.ENGINE_DATA).getState()).isEqualTo(ModelState.TRAINED);

        feed(second, MessageType.CLIMATE_CONTROL, MIN_SAMPLES);

        assertThat(second.isTrained()).isTrue();
        assertThat(modelDir.resolve("climate_model.json")).exists();
    }

    @Test
    void initialize_corruptArtifact_fallsBackToCollecting() throws Exception {
        OutlierModelManager first = newManager(Runnable::run);
        feedAll(first, MIN_SAMPLES);
        Files.write(modelDir.resolve("vehicle_model.json"), "garbage".getBytes(StandardCharsets.UTF_8));

        OutlierModelManager second = newManager(Runnable::run);

        assertThat(second.isTrained()).isFalse();
        assertThat(second.status(MessageType.VEHICLE_DATA).getState()).isEqualTo(ModelState.COLLECTING);
    }

    @Test
    void training_persistFailure_keepsModelsInMemory() {
        IsolationForestModelRepository failing = mock(IsolationForestModelRepository.class);
        when(failing.load(any())).thenReturn(Optional.empty());
        doThrow(new ModelPersistenceException("read-only", null)).when(failing).save(any(StoredModel.class));
        OutlierModelManager manager = new OutlierModelManager(config, failing, explainer, metricsConfig, Runnable::run);
        manager.initialize();

        feedAll(manager, MIN_SAMPLES);

        assertThat(manager.isTrained()).isTrue();
        verify(failing, times(3)).save(any(StoredModel.class));
    }

    @Test
    void retrain_resetsToCollecting() {
        OutlierModelManager manager = newManager(Runnable::run);
        feedAll(manager, MIN_SAMPLES);

        manager.retrain();

        assertThat(manager.isTrained()).isFalse();
        assertThat(manager.status()).extracting(ModelStatus::getState).containsOnly(ModelState.COLLECTING);
        assertThatThrownBy(() -> manager.predict(MessageType.VEHICLE_DATA, vehicle(50, 3, 400)))
                .isInstanceOf(IllegalStateException.class);

        feedAll(manager, MIN_SAMPLES);
        assertThat(manager.isTrained()).isTrue();
    }

    @Test
    void retrain_whileTrainingPending_isRejected() {
        List<Runnable> submitted = new ArrayList<>();
        OutlierModelManager manager = newManager(submitted::add);
        feedAll(manager, MIN_SAMPLES);

        assertThatThrownBy(manager::retrain).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void initialize_contaminationOutOfRange_failsFast() {
        config.getModel().setContamination(0.7);
        OutlierModelManager manager = new OutlierModelManager(config, repository, explainer, metricsConfig, Runnable::run);

        assertThatThrownBy(manager::initialize)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("contamination");
    }

    @Test
    void training_laterFitFails_persistsAndInstallsNothing() {
        IsolationForestModelRepository store = mock(IsolationForestModelRepository.class);
        when(store.load(any())).thenReturn(Optional.empty());
        List<Runnable> submitted = new ArrayList<>();
        OutlierModelManager manager = spy(new OutlierModelManager(config, store, explainer, metricsConfig, submitted::add));
        doThrow(new IllegalArgumentException("fit failed"))
                .when(manager).fitModel(eq(MessageType.CLIMATE_CONTROL), any());
        manager.initialize();
        feedAll(manager, MIN_SAMPLES);

        submitted.get(0).run();

        verify(store, never()).save(any(StoredModel.class));
        verify(metricsConfig).recordModelTraining("all", "error");
        assertThat(manager.isTrained()).isFalse();
        assertThat(manager.status()).extracting(ModelStatus::getState).containsOnly(ModelState.COLLECTING);
    }

    @Test
    void concurrentObservers_trainOnceAndReadersOnlySeeCompleteModels() throws Exception {
        ExecutorService trainer = Executors.newSingleThreadExecutor();
        AtomicInteger submissions = new AtomicInteger();
        OutlierModelManager manager = newManager(task -> {
            submissions.incrementAndGet();
            trainer.execute(task);
        });

        int writers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean stopReading = new AtomicBoolean(false);
        AtomicInteger trainedReads = new AtomicInteger();
        Queue<Throwable> readerErrors = new ConcurrentLinkedQueue<>();

        Thread reader = new Thread(() -> {
            while (!stopReading.get()) {
                if (!manager.isTrained()) {
                    continue;
                }
                try {
                    manager.predict(MessageType.ENGINE_DATA, engine(3000, 90, 70));
                    manager.predict(MessageType.VEHICLE_DATA, vehicle(60, 3, 400));
                    manager.predict(MessageType.CLIMATE_CONTROL, climate(22, 2, 1));
                    trainedReads.incrementAndGet();
                } catch (Throwable t) {
                    readerErrors.add(t);
                }
            }
        });
        reader.start();

        for (int w = 0; w < writers; w++) {
            pool.submit(() -> {
                start.await();
                feedAll(manager, MIN_SAMPLES);
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        trainer.shutdown();
        assertThat(trainer.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        long deadline = System.currentTimeMillis() + 5000;
        while (trainedReads.get() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        stopReading.set(true);
        reader.join(5000);

        assertThat(submissions).hasValue(1);
        assertThat(readerErrors).isEmpty();
        assertThat(trainedReads.get()).isPositive();
        assertThat(manager.isTrained()).isTrue();
        assertThat(manager.status()).extracting(ModelStatus::getState).containsOnly(ModelState.TRAINED);
        assertThat(modelDir.resolve("engine_model.json")).exists();
        assertThat(modelDir.resolve("vehicle_model.json")).exists();
        assertThat(modelDir.resolve("climate_model.json")).exists();
    }

    private OutlierModelManager newManager(Executor executor) {
        OutlierModelManager manager = new OutlierModelManager(config, repository, explainer, metricsConfig, executor);
        manager.initialize();
        return manager;
    }

    private void feedAll(OutlierModelManager manager, int count) {
        for (int i = 0; i < count; i++) {
            for (MessageType type : MessageType.values()) {
                manager.observe(type, randomSnapshot(type));
            }
        }
    }

    private void feed(OutlierModelManager manager, MessageType type, int count) {
        for (int i = 0; i < count; i++) {
            manager.observe(type, randomSnapshot(type));
        }
    }

    private SignalSnapshot randomSnapshot(MessageType type) {
        return switch (type) {
            case ENGINE_DATA -> engine(3000 + random.nextGaussian() * 200, 90 + random.nextGaussian() * 3,
                    70 + random.nextGaussian() * 5);
            case VEHICLE_DATA -> vehicle(60 + random.nextGaussian() * 5, 3, 400 + random.nextGaussian() * 4);
            case CLIMATE_CONTROL -> climate(22 + random.nextGaussian(), 1 + random.nextInt(3), 1);
        };
    }
}
