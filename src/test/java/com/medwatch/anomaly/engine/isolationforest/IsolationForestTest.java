package com.medwatch.anomaly.engine.isolationforest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    private static double[][] cluster;
    private static IsolationForest forest;

    @BeforeAll
    static void trainOnTightCluster() {
        Random random = new Random(7);
        cluster = new double[300][3];
        for (double[] row : cluster) {
            row[0] = 1.0 + random.nextGaussian() * 0.05;
            row[1] = 5.0 + random.nextGaussian() * 0.05;
            row[2] = 10.0 + random.nextGaussian() * 0.05;
        }
        forest = IsolationForest.train(cluster, 100, 128, 42L);
    }

    @Test
    void outlier_scoresHigherThanClusterMember() {
        double inlier = forest.score(new double[]{1.0, 5.0, 10.0});
        double outlier = forest.score(new double[]{4.0, 8.0, 13.0});

        assertThat(outlier).isGreaterThan(0.6);
        assertThat(inlier).isLessThan(0.5);
        assertThat(outlier).isGreaterThan(inlier);
    }

    @Test
    void train_sameSeed_isReproducible() {
        IsolationForest again = IsolationForest.train(cluster, 100, 128, 42L);
        double[] probe = {2.0, 5.5, 9.0};

        assertThat(again.score(probe)).isEqualTo(forest.score(probe));
    }

    @Test
    void train_sampleSizeCappedAtDataSize() {
        IsolationForest small = IsolationForest.train(new double[][]{{1, 1}, {2, 2}, {3, 3}}, 10, 256, 1L);

        assertThat(small.getSampleSize()).isEqualTo(3);
        assertThat(small.getTrees()).hasSize(10);
    }

    @Test
    void train_noData_rejected() {
        assertThatThrownBy(() -> IsolationForest.train(new double[0][], 10, 16, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void featureContributions_pointAtTheDeviatingFeature() {
        double[] contributions = forest.featureContributions(new double[]{4.0, 5.0, 10.0});

        assertThat(contributions[0]).isGreaterThan(contributions[1]);
        assertThat(contributions[0]).isGreaterThan(contributions[2]);
    }

    @Test
    void jsonRoundTrip_preservesScores() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        IsolationForest restored = mapper.readValue(mapper.writeValueAsString(forest), IsolationForest.class);
        double[] probe = {4.0, 5.0, 10.0};

        assertThat(restored.score(probe)).isCloseTo(forest.score(probe), within(1e-12));
    }

    @Test
    void expectedPathLength_knownValues() {
        assertThat(IsolationNode.expectedPathLength(1)).isZero();
        assertThat(IsolationNode.expectedPathLength(2)).isEqualTo(1.0);
        assertThat(IsolationNode.expectedPathLength(256)).isCloseTo(10.24, within(0.01));
    }
}
