package com.medwatch.anomaly.engine;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.engine.isolationforest.IsolationForest;
import com.medwatch.anomaly.engine.isolationforest.MedicineFeatureExtractor;
import com.medwatch.anomaly.exception.DetectorLoadException;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.ModelPrediction;
import com.medwatch.anomaly.repository.IsolationForestModelRepository;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IsolationForestModelDetectorTest {

    private static IsolationForest trainedForest;

    @Mock private IsolationForestModelRepository modelRepository;

    private AnomalyEngineConfig engineConfig;
    private IsolationForestModelDetector detector;

    @BeforeAll
    static void trainOnHealthyCatalogue() {
        Random random = new Random(11);
        double[][] rows = new double[200][];
        for (int i = 0; i < rows.length; i++) {
            long stock = 800 + random.nextInt(400);
            double consumption = 15 + random.nextInt(10);
            DataPoint dp = TestDataFactory.healthyMedicine("MED-" + i)
                    .currentStock(stock)
                    .dailyConsumption(consumption)
                    .daysOfCover(stock / consumption)
                    .currentDeclineRate(consumption * (0.8 + random.nextDouble() * 0.4))
                    .currentPrice(10.0 + random.nextDouble())
                    .supplierDelay(random.nextInt(2))
                    .build();
            rows[i] = MedicineFeatureExtractor.extract(dp);
        }
        trainedForest = IsolationForest.train(rows, 100, 128, 99L);
    }

    @BeforeEach
    void setUp() {
        engineConfig = new AnomalyEngineConfig();
        engineConfig.getModel().setScoreThreshold(0.55);
        detector = new IsolationForestModelDetector(modelRepository, engineConfig);
    }

    @Test
    void loadModels_noTrainedModel_reportsFalse() {
        when(modelRepository.load("global")).thenReturn(null);

        assertThat(detector.loadModels()).isFalse();
        assertThat(detector.isModelLoaded()).isFalse();
    }

    @Test
    void loadModels_unreadableModel_propagatesLoadError() {
        when(modelRepository.load("global")).thenThrow(new DetectorLoadException("corrupt model"));

        assertThatThrownBy(() -> detector.loadModels()).isInstanceOf(DetectorLoadException.class);
    }

    @Test
    void loadModels_storeFailure_wrappedAsLoadError() {
        when(modelRepository.load("global")).thenThrow(new IllegalStateException("timeout"));

        assertThatThrownBy(() -> detector.loadModels())
                .isInstanceOf(DetectorLoadException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void predict_withoutModel_everyPointNormal() {
        List<ModelPrediction> predictions = detector.predict(List.of(
                TestDataFactory.createDataPoint("MED-1"),
                TestDataFactory.createDataPoint("MED-2")));

        assertThat(predictions).hasSize(2).noneMatch(ModelPrediction::isAnomaly);
    }

    @Test
    void predict_flagsOnlyTheUnusualMedicine() {
        when(modelRepository.load("global")).thenReturn(trainedForest);
        detector.loadModels();

        DataPoint normal = TestDataFactory.healthyMedicine("MED-OK").currentPrice(10.5).build();
        DataPoint unusual = TestDataFactory.healthyMedicine("MED-ODD")
                .currentStock(5)
                .currentPrice(60.0)
                .daysOfCover(0.25)
                .currentDeclineRate(200.0)
                .priceHistory(List.of(60.0, 12.0, 10.0))
                .supplierDelay(25)
                .build();

        List<ModelPrediction> predictions = detector.predict(List.of(normal, unusual));

        assertThat(predictions).hasSize(2);
        assertThat(predictions.get(0).isAnomaly()).isFalse();
        ModelPrediction flagged = predictions.get(1);
        assertThat(flagged.isAnomaly()).isTrue();
        assertThat(flagged.confidence()).isGreaterThan(0.55);
        assertThat(flagged.type()).isEqualTo("supply-pattern");
        assertThat(flagged.message()).contains("Amoxil 500mg");
        Map<String, Object> details = flagged.details();
        assertThat(details).containsEntry("model", "isolation-forest")
                .containsEntry("modelId", "global")
                .containsKeys("score", "threshold", "features", "topFactors");
    }

    @Test
    void severityFor_scoreBands() {
        assertThat(IsolationForestModelDetector.severityFor(0.9)).isEqualTo("critical");
        assertThat(IsolationForestModelDetector.severityFor(0.85)).isEqualTo("critical");
        assertThat(IsolationForestModelDetector.severityFor(0.7)).isEqualTo("high");
        assertThat(IsolationForestModelDetector.severityFor(0.62)).isEqualTo("medium");
    }
}
