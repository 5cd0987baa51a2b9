package com.fleet.anomaly.engine.isolationforest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleet.anomaly.model.Prediction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    private double[][] data;

    @BeforeEach
    void setUp() {
        // tight cluster around (3000 rpm, 90 °C, 70 %)
        Random random = new Random(7);
        data = new double[500][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[]{
                    3000 + random.nextGaussian() * 200,
                    90 + random.nextGaussian() * 3,
                    70 + random.nextGaussian() * 5
            };
        }
    }

    @Test
    void fit_flagsFarOutlierAndAcceptsCentre() {
        IsolationForest forest = new IsolationForest();
        forest.fit(data, 100, 256, 0.05, 42L);

        assertThat(forest.predict(new double[]{3000, 90, 70})).isEqualTo(Prediction.NORMAL);
        assertThat(forest.predict(new double[]{6000, 120, 5})).isEqualTo(Prediction.ANOMALY);
        assertThat(forest.decisionFunction(new double[]{6000, 120, 5})).isNegative();
    }

    @Test
    void fit_thresholdFlagsRoughlyContaminationShareOfTrainingData() {
        IsolationForest forest = new IsolationForest();
        forest.fit(data, 100, 256, 0.05, 42L);

        long flagged = 0;
        for (double[] row : data) {
            if (forest.predict(row) == Prediction.ANOMALY) flagged++;
        }
        assertThat(flagged).isBetween(15L, 30L);
    }

    @Test
    void fit_sameSeed_sameScores() {
        IsolationForest first = new IsolationForest();
        first.fit(data, 50, 256, 0.05, 42L);
        IsolationForest second = new IsolationForest();
        second.fit(data, 50, 256, 0.05, 42L);

        double[] probe = {4200, 101, 40};
        assertThat(second.anomalyScore(probe)).isEqualTo(first.anomalyScore(probe));
        assertThat(second.getThreshold()).isEqualTo(first.getThreshold());
    }

    @Test
    void fit_sampleSizeCappedAtRowCount() {
        IsolationForest forest = new IsolationForest();
        forest.fit(Arrays.copyOf(data, 100), 10, 256, 0.05, 42L);

        assertThat(forest.getSampleSize()).isEqualTo(100);
        assertThat(forest.getTrees()).hasSize(10);
    }

    @Test
    void fit_rejectsInvalidInput() {
        IsolationForest forest = new IsolationForest();

        assertThatThrownBy(() -> forest.fit(new double[0][], 10, 256, 0.05, 42L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> forest.fit(data, 10, 256, 0.0, 42L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unfitted_scoringFails() {
        IsolationForest forest = new IsolationForest();

        assertThat(forest.isFitted()).isFalse();
        assertThatThrownBy(() -> forest.anomalyScore(new double[]{1, 2, 3}))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void jsonRoundTrip_preservesDecisions() throws Exception {
        IsolationForest forest = new IsolationForest();
        forest.fit(data, 50, 256, 0.05, 42L);
        ObjectMapper mapper = new ObjectMapper();

        IsolationForest restored = mapper.readValue(mapper.writeValueAsString(forest), IsolationForest.class);

        double[] outlier = {6000, 120, 5};
        double[] normal = {3000, 90, 70};
        assertThat(restored.predict(outlier)).isEqualTo(forest.predict(outlier));
        assertThat(restored.predict(normal)).isEqualTo(forest.predict(normal));
        assertThat(restored.anomalyScore(outlier)).isCloseTo(forest.anomalyScore(outlier), within(1e-12));
    }

    @Test
    void featureContributions_pointAtTheDeviatingFeature() {
        IsolationForest forest = new IsolationForest();
        forest.fit(data, 100, 256, 0.05, 42L);

        double[] contributions = forest.featureContributions(new double[]{3000, 90, 5});

        assertThat(contributions[2]).isGreaterThan(contributions[0]);
        assertThat(contributions[2]).isGreaterThan(contributions[1]);
    }

    @Test
    void averagePathLength_knownValues() {
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    @Test
    void quantile_interpolatesLinearly() {
        assertThat(IsolationForest.quantile(new double[]{4, 1, 3, 2}, 0.5)).isEqualTo(2.5);
        assertThat(IsolationForest.quantile(new double[]{1, 2, 3, 4, 5}, 0.95)).isCloseTo(4.8, within(1e-9));
    }
}
