package com.medwatch.anomaly.service;

import com.medwatch.anomaly.engine.spi.RuleDetector;
import com.medwatch.anomaly.model.SupplyRule;
import com.medwatch.anomaly.repository.RuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Service layer for managing supply rules.
 * Every change is followed by a rule reload so the next batch sees it.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final RuleRepository ruleRepository;
    private final RuleDetector ruleDetector;

    public RuleService(RuleRepository ruleRepository, RuleDetector ruleDetector) {
        this.ruleRepository = ruleRepository;
        this.ruleDetector = ruleDetector;
    }

    public List<SupplyRule> getAllRules() {
        return ruleRepository.findAll();
    }

    public SupplyRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId);
    }

    public SupplyRule createRule(SupplyRule rule) {
        if (rule.getRuleId() == null || rule.getRuleId().isEmpty()) {
            rule.setRuleId(UUID.randomUUID().toString());
        }
        ruleRepository.save(rule);
        reloadRules();
        return rule;
    }

    public SupplyRule updateRule(String ruleId, SupplyRule updated) {
        SupplyRule existing = ruleRepository.findById(ruleId);
        if (existing == null) {
            return null;
        }

        if (updated.getName() != null) existing.setName(updated.getName());
        if (updated.getDescription() != null) existing.setDescription(updated.getDescription());
        if (updated.getRuleType() != null) existing.setRuleType(updated.getRuleType());
        if (updated.getSeverity() != null) existing.setSeverity(updated.getSeverity());
        existing.setThreshold(updated.getThreshold());
        existing.setEnabled(updated.isEnabled());
        if (updated.getParams() != null) existing.setParams(updated.getParams());

        ruleRepository.save(existing);
        reloadRules();
        return existing;
    }

    public boolean deleteRule(String ruleId) {
        boolean deleted = ruleRepository.delete(ruleId);
        if (deleted) {
            reloadRules();
        }
        return deleted;
    }

    private void reloadRules() {
        int active = ruleDetector.loadRules();
        log.info("Rule set reloaded: {} active rules", active);
    }
}
