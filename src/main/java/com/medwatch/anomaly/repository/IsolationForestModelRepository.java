package com.medwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.config.AerospikeConfig;
import com.medwatch.anomaly.engine.isolationforest.IsolationForest;
import com.medwatch.anomaly.engine.isolationforest.MedicineFeatureExtractor;
import com.medwatch.anomaly.exception.DetectorLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trained isolation forests, stored whole as a JSON bin keyed by model id.
 */
@Repository
public class IsolationForestModelRepository {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestModelRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public IsolationForestModelRepository(AerospikeClient client,
                                          @Qualifier("aerospikeNamespace") String namespace,
                                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(String modelId, IsolationForest forest, int trainingSamples) {
        String modelJson;
        try {
            modelJson = objectMapper.writeValueAsString(forest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize model " + modelId, e);
        }

        Key key = new Key(namespace, AerospikeConfig.SET_IF_MODELS, modelId);
        client.put(writePolicy, key,
                new Bin("modelId", modelId),
                new Bin("modelJson", modelJson),
                new Bin("featureCount", MedicineFeatureExtractor.FEATURE_COUNT),
                new Bin("treeCount", forest.getTrees().size()),
                new Bin("trainedAt", System.currentTimeMillis()),
                new Bin("trainSamples", trainingSamples));

        log.info("Saved IF model {}: {} trees, {} samples", modelId, forest.getTrees().size(), trainingSamples);
    }

    /**
     * @return the stored model, or null if none has been trained under this id
     * @throws DetectorLoadException if a model is stored but cannot be read back
     */
    public IsolationForest load(String modelId) {
        Key key = new Key(namespace, AerospikeConfig.SET_IF_MODELS, modelId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        try {
            return objectMapper.readValue(record.getString("modelJson"), IsolationForest.class);
        } catch (JsonProcessingException e) {
            throw new DetectorLoadException("Stored IF model " + modelId + " is unreadable", e);
        }
    }

    public Map<String, Object> getModelMetadata(String modelId) {
        Key key = new Key(namespace, AerospikeConfig.SET_IF_MODELS, modelId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return toMetadata(record);
    }

    public List<Map<String, Object>> findAllMetadata() {
        List<Map<String, Object>> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_IF_MODELS,
                (key, record) -> {
                    try {
                        Map<String, Object> metadata = toMetadata(record);
                        synchronized (results) {
                            results.add(metadata);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read model metadata: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Map<String, Object> toMetadata(Record record) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("modelId", record.getString("modelId"));
        metadata.put("treeCount", record.getInt("treeCount"));
        metadata.put("featureCount", record.getInt("featureCount"));
        metadata.put("trainingSamples", record.getInt("trainSamples"));
        metadata.put("trainedAt", record.getLong("trainedAt"));
        return metadata;
    }
}
