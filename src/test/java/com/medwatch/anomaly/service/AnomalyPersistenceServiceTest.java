package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.engine.spi.AnomalySink;
import com.medwatch.anomaly.event.AnomalyPersistFailedEvent;
import com.medwatch.anomaly.exception.AnomalyPersistenceException;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyPersistenceServiceTest {

    @Mock private AnomalySink anomalySink;
    @Mock private ApplicationEventPublisher eventPublisher;
    @Mock private MetricsConfig metricsConfig;

    private AnomalyPersistenceService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyPersistenceService(anomalySink, eventPublisher, metricsConfig);
    }

    @Test
    void persist_success_writesToSink() {
        Anomaly anomaly = TestDataFactory.createAnomaly("A-1", 0.8);

        service.persist(anomaly);

        verify(anomalySink).saveAnomaly(anomaly);
        verifyNoInteractions(eventPublisher, metricsConfig);
    }

    @Test
    void persist_sinkFails_countsAndPublishesFailure() {
        Anomaly anomaly = TestDataFactory.createAnomaly("A-2", 0.8);
        AnomalyPersistenceException failure = new AnomalyPersistenceException("write timeout");
        doThrow(failure).when(anomalySink).saveAnomaly(anomaly);

        assertThatCode(() -> service.persist(anomaly)).doesNotThrowAnyException();

        verify(metricsConfig).recordPersistFailure();
        ArgumentCaptor<AnomalyPersistFailedEvent> captor = ArgumentCaptor.forClass(AnomalyPersistFailedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().anomaly()).isSameAs(anomaly);
        assertThat(captor.getValue().cause()).isSameAs(failure);
    }
}
