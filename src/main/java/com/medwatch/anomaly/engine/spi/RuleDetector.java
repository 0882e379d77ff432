package com.medwatch.anomaly.engine.spi;

import com.medwatch.anomaly.exception.DetectorLoadException;
import com.medwatch.anomaly.exception.RuleEvaluationException;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;

import java.util.List;

/**
 * Declarative rule-based detection, evaluated one data point at a time.
 */
public interface RuleDetector {

    /**
     * Load (or reload) rule definitions.
     *
     * @return number of rules loaded
     * @throws DetectorLoadException if the definitions cannot be read
     */
    int loadRules();

    /**
     * Evaluate every active rule against one data point.
     * Confidence on the returned findings is left unset; the pipeline derives it from severity.
     *
     * @throws RuleEvaluationException if the data point cannot be evaluated at all
     */
    List<RawFinding> evaluate(DataPoint dataPoint);
}
