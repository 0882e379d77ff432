package com.medwatch.anomaly.service;

import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.PagedResponse;
import com.medwatch.anomaly.repository.AnomalyRepository;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyServiceTest {

    @Mock private AnomalyRepository anomalyRepository;

    private AnomalyService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyService(anomalyRepository,
                Clock.fixed(Instant.parse("2026-10-19T09:15:00Z"), ZoneOffset.UTC));
    }

    @Test
    void listAnomalies_delegatesToRepository() {
        PagedResponse<Anomaly> expected = new PagedResponse<>(
                List.of(TestDataFactory.createAnomaly("A-1", 0.9)), true, "1760000000000");
        when(anomalyRepository.findByFilters("active", "high", "MED-0001", 50, null)).thenReturn(expected);

        assertThat(service.listAnomalies("active", "high", "MED-0001", 50, null)).isEqualTo(expected);
    }

    @Test
    void review_updatesStatusAssigneeAndTimestamp() {
        when(anomalyRepository.findById("A-1")).thenReturn(TestDataFactory.createAnomaly("A-1", 0.9));

        Anomaly reviewed = service.review("A-1", "RESOLVED", "pharmacist.jane");

        assertThat(reviewed.getStatus()).isEqualTo("resolved");
        assertThat(reviewed.getAssignedTo()).isEqualTo("pharmacist.jane");
        assertThat(reviewed.getReviewedAt()).isEqualTo("2026-10-19T09:15:00Z");
        verify(anomalyRepository).updateReview("A-1", "resolved", "pharmacist.jane", "2026-10-19T09:15:00Z");
    }

    @Test
    void review_withoutAssignee_keepsCurrentOne() {
        Anomaly anomaly = TestDataFactory.createAnomaly("A-1", 0.9);
        anomaly.setAssignedTo("duty.desk");
        when(anomalyRepository.findById("A-1")).thenReturn(anomaly);

        Anomaly reviewed = service.review("A-1", "acknowledged", null);

        assertThat(reviewed.getAssignedTo()).isEqualTo("duty.desk");
        assertThat(reviewed.getStatus()).isEqualTo("acknowledged");
    }

    @Test
    void review_unknownAnomaly_returnsNull() {
        when(anomalyRepository.findById("MISSING")).thenReturn(null);

        assertThat(service.review("MISSING", "dismissed", null)).isNull();
        verify(anomalyRepository, never()).updateReview(any(), any(), any(), any());
    }

    @Test
    void review_invalidStatus_rejectedBeforeLookup() {
        assertThatThrownBy(() -> service.review("A-1", "escalated", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(anomalyRepository);
    }
}
