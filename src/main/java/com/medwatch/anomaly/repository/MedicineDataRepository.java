package com.medwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.config.AerospikeConfig;
import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.engine.spi.MedicineDataSource;
import com.medwatch.anomaly.exception.DataFetchException;
import com.medwatch.anomaly.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Medicine supply records. Every upsert marks the record pending; the batch pipeline
 * picks pending records up oldest first and acknowledges them once detection has run.
 * Acknowledgement is conditional on the record generation seen at fetch time, so an upsert
 * landing mid-batch keeps its record pending for the next tick.
 */
@Repository
public class MedicineDataRepository implements MedicineDataSource {

    private static final Logger log = LoggerFactory.getLogger(MedicineDataRepository.class);

    private static final TypeReference<List<Long>> LONG_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Double>> DOUBLE_LIST = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final AnomalyEngineConfig engineConfig;
    private final ObjectMapper objectMapper;
    private final Map<String, Integer> fetchedGenerations = new ConcurrentHashMap<>();

    public MedicineDataRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy,
                                  AnomalyEngineConfig engineConfig) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.engineConfig = engineConfig;
        this.objectMapper = new ObjectMapper();
    }

    public void save(DataPoint dataPoint) {
        Key key = new Key(namespace, AerospikeConfig.SET_MEDICINE_DATA, dataPoint.getMedicineId());

        client.put(writePolicy, key,
                new Bin("medicineId", dataPoint.getMedicineId()),
                new Bin("medicineName", dataPoint.getMedicineName()),
                new Bin("genericName", dataPoint.getGenericName()),
                new Bin("company", dataPoint.getCompany()),
                new Bin("disease", dataPoint.getDisease()),
                new Bin("currentStock", dataPoint.getCurrentStock()),
                new Bin("currentPrice", dataPoint.getCurrentPrice()),
                new Bin("avgMarketPrice", dataPoint.getAverageMarketPrice()),
                new Bin("critThreshold", dataPoint.getCriticalThreshold()),
                new Bin("dailyConsume", dataPoint.getDailyConsumption()),
                new Bin("stockHistory", serialize(dataPoint.getStockHistory())),
                new Bin("priceHistory", serialize(dataPoint.getPriceHistory())),
                new Bin("supplier", dataPoint.getSupplier()),
                new Bin("supplierDelay", dataPoint.getSupplierDelay()),
                new Bin("location", dataPoint.getLocation()),
                new Bin("lastUpdatedAt", dataPoint.getLastUpdatedAt()),
                new Bin("description", dataPoint.getDescription()),
                new Bin("shortageCauses", dataPoint.getCausesOfShortage()),
                new Bin("pending", 1),
                new Bin("ingestedAt", System.currentTimeMillis()));
    }

    public DataPoint findById(String medicineId) {
        Key key = new Key(namespace, AerospikeConfig.SET_MEDICINE_DATA, medicineId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Scan every stored medicine, processed or not. Used for model training.
     */
    public List<DataPoint> findAll() {
        List<DataPoint> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MEDICINE_DATA,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read medicine record: {}", e.getMessage());
                    }
                });
        return results;
    }

    @Override
    public List<DataPoint> fetchPendingDataPoints() {
        List<PendingRecord> pending = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MEDICINE_DATA,
                    (key, record) -> {
                        if (record.getInt("pending") != 1) return;
                        try {
                            PendingRecord item = new PendingRecord(
                                    record.getLong("ingestedAt"), record.generation, mapRecord(record));
                            synchronized (pending) {
                                pending.add(item);
                            }
                        } catch (Exception e) {
                            log.warn("Skipping unreadable pending medicine record: {}", e.getMessage());
                        }
                    });
        } catch (Exception e) {
            throw new DataFetchException("Failed to scan pending medicine data", e);
        }

        List<PendingRecord> batch = pending.stream()
                .sorted(Comparator.comparingLong(PendingRecord::ingestedAt))
                .limit(engineConfig.getBatchSize())
                .toList();
        batch.forEach(item -> fetchedGenerations.put(item.dataPoint().getMedicineId(), item.generation()));
        return batch.stream().map(PendingRecord::dataPoint).toList();
    }

    @Override
    public void acknowledge(List<DataPoint> dataPoints) {
        long processedAt = System.currentTimeMillis();
        int superseded = 0;
        for (DataPoint dataPoint : dataPoints) {
            if (dataPoint == null || dataPoint.getMedicineId() == null) continue;
            Key key = new Key(namespace, AerospikeConfig.SET_MEDICINE_DATA, dataPoint.getMedicineId());
            WritePolicy ackPolicy = new WritePolicy(writePolicy);
            Integer generation = fetchedGenerations.remove(dataPoint.getMedicineId());
            if (generation != null) {
                ackPolicy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
                ackPolicy.generation = generation;
            }
            try {
                client.put(ackPolicy, key,
                        new Bin("pending", 0),
                        new Bin("processedAt", processedAt));
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) {
                    throw e;
                }
                superseded++;
                log.info("Medicine {} was updated during the batch, leaving it pending", dataPoint.getMedicineId());
            }
        }
        log.debug("Acknowledged {} medicine data points ({} superseded)", dataPoints.size() - superseded, superseded);
    }

    private DataPoint mapRecord(Record record) {
        return DataPoint.builder()
                .medicineId(record.getString("medicineId"))
                .medicineName(record.getString("medicineName"))
                .genericName(record.getString("genericName"))
                .company(record.getString("company"))
                .disease(record.getString("disease"))
                .currentStock(record.getLong("currentStock"))
                .currentPrice(record.getDouble("currentPrice"))
                .averageMarketPrice(record.getDouble("avgMarketPrice"))
                .criticalThreshold(record.getLong("critThreshold"))
                .dailyConsumption(record.getDouble("dailyConsume"))
                .stockHistory(deserialize(record.getString("stockHistory"), LONG_LIST))
                .priceHistory(deserialize(record.getString("priceHistory"), DOUBLE_LIST))
                .supplier(record.getString("supplier"))
                .supplierDelay(record.getInt("supplierDelay"))
                .location(record.getString("location"))
                .lastUpdatedAt(record.getString("lastUpdatedAt"))
                .description(record.getString("description"))
                .causesOfShortage(record.getString("shortageCauses"))
                .build();
    }

    private String serialize(List<?> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize history", e);
            return "[]";
        }
    }

    private <T> List<T> deserialize(String json, TypeReference<List<T>> type) {
        if (json == null || json.isEmpty()) return List.of();
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.warn("Ignoring unreadable history: {}", e.getMessage());
            return List.of();
        }
    }

    private record PendingRecord(long ingestedAt, int generation, DataPoint dataPoint) {}
}
