package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.engine.isolationforest.IsolationForest;
import com.medwatch.anomaly.engine.isolationforest.MedicineFeatureExtractor;
import com.medwatch.anomaly.engine.spi.DataPreprocessor;
import com.medwatch.anomaly.engine.spi.ModelDetector;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.repository.IsolationForestModelRepository;
import com.medwatch.anomaly.repository.MedicineDataRepository;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelTrainingServiceTest {

    @Mock private MedicineDataRepository medicineDataRepository;
    @Mock private DataPreprocessor preprocessor;
    @Mock private IsolationForestModelRepository modelRepository;
    @Mock private ModelDetector modelDetector;

    private AnomalyEngineConfig engineConfig;
    private ModelTrainingService service;

    @BeforeEach
    void setUp() {
        engineConfig = new AnomalyEngineConfig();
        engineConfig.getModel().setMinTrainingSamples(20);
        service = new ModelTrainingService(medicineDataRepository, preprocessor, modelRepository,
                modelDetector, engineConfig);
    }

    private List<DataPoint> catalogue(int size) {
        return IntStream.range(0, size)
                .mapToObj(i -> TestDataFactory.healthyMedicine("MED-" + i).currentStock(500 + i * 10L).build())
                .toList();
    }

    @Test
    void train_enoughData_savesModelAndReloadsDetector() {
        List<DataPoint> medicines = catalogue(40);
        when(medicineDataRepository.findAll()).thenReturn(medicines);
        when(preprocessor.preprocess(medicines)).thenReturn(medicines);

        Map<String, Object> result = service.train(25, 32);

        ArgumentCaptor<IsolationForest> forest = ArgumentCaptor.forClass(IsolationForest.class);
        verify(modelRepository).save(eq("global"), forest.capture(), eq(40));
        assertThat(forest.getValue().getTrees()).hasSize(25);
        verify(modelDetector).loadModels();
        assertThat(result)
                .containsEntry("modelId", "global")
                .containsEntry("treeCount", 25)
                .containsEntry("sampleSize", 32)
                .containsEntry("trainingSamples", 40)
                .containsEntry("featureCount", MedicineFeatureExtractor.FEATURE_COUNT);
    }

    @Test
    void train_tooFewMedicines_rejectedBeforeTraining() {
        List<DataPoint> medicines = catalogue(5);
        when(medicineDataRepository.findAll()).thenReturn(medicines);
        when(preprocessor.preprocess(medicines)).thenReturn(medicines);

        assertThatThrownBy(() -> service.train(100, 256))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("5 medicines");
        verifyNoInteractions(modelRepository, modelDetector);
    }

    @Test
    void listModels_delegatesToRepository() {
        List<Map<String, Object>> metadata = List.of(Map.of("modelId", "global"));
        when(modelRepository.findAllMetadata()).thenReturn(metadata);

        assertThat(service.listModels()).isEqualTo(metadata);
    }
}
