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
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class RuleRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public RuleRepository(AerospikeClient client,
                          @Qualifier("aerospikeNamespace") String namespace,
                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Scan all rules, enabled or not. Aerospike failures propagate to the caller.
     */
    public List<SupplyRule> findAll() {
        List<SupplyRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUPPLY_RULES,
                (key, record) -> {
                    try {
                        String ruleId = record.getString("ruleId");
                        if (ruleId != null) {
                            synchronized (rules) {
                                rules.add(mapRecordToRule(ruleId, record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize rule record: {}", e.getMessage());
                    }
                });
        return rules;
    }

    public SupplyRule findById(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SUPPLY_RULES, ruleId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecordToRule(ruleId, record);
    }

    public void save(SupplyRule rule) {
        Key key = new Key(namespace, AerospikeConfig.SET_SUPPLY_RULES, rule.getRuleId());

        client.put(writePolicy, key,
                new Bin("ruleId", rule.getRuleId()),
                new Bin("name", rule.getName()),
                new Bin("description", rule.getDescription()),
                new Bin("ruleType", rule.getRuleType().name()),
                new Bin("threshold", rule.getThreshold()),
                new Bin("severity", rule.getSeverity()),
                new Bin("enabled", rule.isEnabled()),
                new Bin("params", serializeParams(rule.getParams())));
    }

    public boolean delete(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SUPPLY_RULES, ruleId);
        return client.delete(writePolicy, key);
    }

    private SupplyRule mapRecordToRule(String ruleId, Record record) {
        return SupplyRule.builder()
                .ruleId(ruleId)
                .name(record.getString("name"))
                .description(record.getString("description"))
                .ruleType(RuleType.valueOf(record.getString("ruleType")))
                .threshold(record.getDouble("threshold"))
                .severity(record.getString("severity"))
                .enabled(record.getBoolean("enabled"))
                .params(deserializeParams(record.getString("params")))
                .build();
    }

    private String serializeParams(Map<String, String> params) {
        try {
            return objectMapper.writeValueAsString(params != null ? params : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rule params", e);
        }
    }

    private Map<String, String> deserializeParams(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (Exception e) {
            log.warn("Ignoring unreadable rule params: {}", e.getMessage());
            return new HashMap<>();
        }
    }
}
