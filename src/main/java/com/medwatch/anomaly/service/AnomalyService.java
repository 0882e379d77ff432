package com.medwatch.anomaly.service;

import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.AnomalyStatus;
import com.medwatch.anomaly.model.PagedResponse;
import com.medwatch.anomaly.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Read side and review workflow for persisted anomalies.
 */
@Service
public class AnomalyService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyService.class);

    private final AnomalyRepository anomalyRepository;
    private final Clock clock;

    public AnomalyService(AnomalyRepository anomalyRepository, Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.clock = clock;
    }

    public Anomaly getAnomaly(String anomalyId) {
        return anomalyRepository.findById(anomalyId);
    }

    public PagedResponse<Anomaly> listAnomalies(String status, String severity, String medicineId,
                                                int limit, Long before) {
        return anomalyRepository.findByFilters(status, severity, medicineId, limit, before);
    }

    /**
     * Move an anomaly out of (or back into) the active state.
     *
     * @param assignedTo optional; the current assignee is kept when null
     * @return the updated anomaly, or null if it does not exist
     * @throws IllegalArgumentException if status is not a known anomaly status
     */
    public Anomaly review(String anomalyId, String status, String assignedTo) {
        AnomalyStatus newStatus = AnomalyStatus.fromLabel(status);

        Anomaly anomaly = anomalyRepository.findById(anomalyId);
        if (anomaly == null) {
            return null;
        }

        anomaly.setStatus(newStatus.getLabel());
        if (assignedTo != null) {
            anomaly.setAssignedTo(assignedTo);
        }
        anomaly.setReviewedAt(clock.instant().toString());

        anomalyRepository.updateReview(anomalyId, anomaly.getStatus(), anomaly.getAssignedTo(), anomaly.getReviewedAt());
        log.info("Anomaly {} reviewed: status={}, assignedTo={}", anomalyId, anomaly.getStatus(), anomaly.getAssignedTo());
        return anomaly;
    }
}
