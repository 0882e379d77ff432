package com.medwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.config.AerospikeConfig;
import com.medwatch.anomaly.engine.spi.AnomalySink;
import com.medwatch.anomaly.exception.AnomalyPersistenceException;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.PagedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class AnomalyRepository implements AnomalySink {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRepository.class);

    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnomalyRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void saveAnomaly(Anomaly anomaly) {
        String detailsJson;
        try {
            detailsJson = objectMapper.writeValueAsString(anomaly.getDetails());
        } catch (JsonProcessingException e) {
            throw new AnomalyPersistenceException("Anomaly details for " + anomaly.getAnomalyId()
                    + " cannot be serialized", e);
        }

        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomaly.getAnomalyId());
        try {
            client.put(writePolicy, key,
                    new Bin("anomalyId", anomaly.getAnomalyId()),
                    new Bin("detectionType", anomaly.getDetectionType()),
                    new Bin("severity", anomaly.getSeverity()),
                    new Bin("message", anomaly.getMessage()),
                    new Bin("description", anomaly.getDescription()),
                    new Bin("confidence", anomaly.getConfidence()),
                    new Bin("type", anomaly.getType()),
                    new Bin("details", detailsJson),
                    new Bin("medicineDataId", anomaly.getMedicineDataId()),
                    new Bin("disease", anomaly.getDisease()),
                    new Bin("assignedTo", anomaly.getAssignedTo()),
                    new Bin("status", anomaly.getStatus()),
                    new Bin("timestamp", anomaly.getTimestamp()),
                    new Bin("reviewedAt", anomaly.getReviewedAt()),
                    new Bin("createdAtMs", toEpochMillis(anomaly.getTimestamp())));
        } catch (Exception e) {
            throw new AnomalyPersistenceException("Failed to write anomaly " + anomaly.getAnomalyId(), e);
        }
    }

    public Anomaly findById(String anomalyId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Newest first. The cursor is the creation time (epoch ms) of the last item of the previous page.
     */
    public PagedResponse<Anomaly> findByFilters(String status, String severity, String medicineId,
                                                int limit, Long before) {
        List<StoredAnomaly> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    try {
                        if (status != null && !status.isEmpty()
                                && !status.equalsIgnoreCase(record.getString("status"))) return;
                        if (severity != null && !severity.isEmpty()
                                && !severity.equalsIgnoreCase(record.getString("severity"))) return;
                        if (medicineId != null && !medicineId.isEmpty()
                                && !medicineId.equals(record.getString("medicineDataId"))) return;
                        long createdAt = record.getLong("createdAtMs");
                        if (before != null && createdAt >= before) return;

                        StoredAnomaly item = new StoredAnomaly(createdAt, mapRecord(record));
                        synchronized (results) {
                            results.add(item);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to filter anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(StoredAnomaly::createdAt).reversed());
        boolean hasMore = results.size() > limit;
        List<StoredAnomaly> page = hasMore ? results.subList(0, limit) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).createdAt()) : null;
        return new PagedResponse<>(page.stream().map(StoredAnomaly::anomaly).toList(), hasMore, nextCursor);
    }

    public void updateReview(String anomalyId, String status, String assignedTo, String reviewedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
        client.put(writePolicy, key,
                new Bin("status", status),
                new Bin("assignedTo", assignedTo),
                new Bin("reviewedAt", reviewedAt));
    }

    private Anomaly mapRecord(Record record) {
        return Anomaly.builder()
                .anomalyId(record.getString("anomalyId"))
                .detectionType(record.getString("detectionType"))
                .severity(record.getString("severity"))
                .message(record.getString("message"))
                .description(record.getString("description"))
                .confidence(record.getDouble("confidence"))
                .type(record.getString("type"))
                .details(deserializeDetails(record.getString("details")))
                .medicineDataId(record.getString("medicineDataId"))
                .disease(record.getString("disease"))
                .assignedTo(record.getString("assignedTo"))
                .status(record.getString("status"))
                .timestamp(record.getString("timestamp"))
                .reviewedAt(record.getString("reviewedAt"))
                .build();
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (Exception e) {
            log.warn("Ignoring unreadable anomaly details: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private long toEpochMillis(String timestamp) {
        if (timestamp == null) return System.currentTimeMillis();
        try {
            return Instant.parse(timestamp).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable anomaly timestamp '{}', indexing at current time", timestamp);
            return System.currentTimeMillis();
        }
    }

    private record StoredAnomaly(long createdAt, Anomaly anomaly) {}
}
