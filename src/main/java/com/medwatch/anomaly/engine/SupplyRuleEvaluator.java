package com.medwatch.anomaly.engine;

import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;

import java.util.Optional;

/**
 * Interface for all supply rule evaluators.
 * Each implementation handles a specific RuleType.
 */
public interface SupplyRuleEvaluator {

    /**
     * The rule type this evaluator handles.
     */
    RuleType getSupportedRuleType();

    /**
     * Check one data point against a rule.
     *
     * @param dataPoint the preprocessed data point
     * @param rule      the rule configuration (threshold, severity, params)
     * @return a finding if the rule fired, empty otherwise
     */
    Optional<RawFinding> evaluate(DataPoint dataPoint, SupplyRule rule);
}
