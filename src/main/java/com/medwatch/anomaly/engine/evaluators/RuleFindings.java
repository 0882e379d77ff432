package com.medwatch.anomaly.engine.evaluators;

import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;
import com.medwatch.anomaly.model.SupplyRule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common finding scaffolding shared by the supply rule evaluators.
 */
final class RuleFindings {

    private RuleFindings() {}

    static RawFinding.RawFindingBuilder triggered(DataPoint dataPoint, SupplyRule rule, String type) {
        return RawFinding.builder()
                .severity(rule.getSeverity())
                .type(type)
                .causesOfShortages(dataPoint.getCausesOfShortage())
                .dataPoint(dataPoint);
    }

    static Map<String, Object> details(SupplyRule rule) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ruleId", rule.getRuleId());
        details.put("ruleName", rule.getName());
        details.put("ruleType", rule.getRuleType().name());
        return details;
    }

    static String displayName(DataPoint dataPoint) {
        return dataPoint.getMedicineName() != null ? dataPoint.getMedicineName() : dataPoint.getMedicineId();
    }
}
