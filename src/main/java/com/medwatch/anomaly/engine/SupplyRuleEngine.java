package com.medwatch.anomaly.engine;

import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.engine.spi.RuleDetector;
import com.medwatch.anomaly.exception.DetectorLoadException;
import com.medwatch.anomaly.exception.RuleEvaluationException;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import com.medwatch.anomaly.repository.RuleRepository;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rule detector that evaluates all loaded supply rules against a data point.
 * Uses the Strategy pattern: each RuleType is handled by a registered SupplyRuleEvaluator.
 *
 * Rules are held as an immutable snapshot that {@link #loadRules()} swaps atomically,
 * so a batch in progress always sees one consistent rule set.
 */
@Component
public class SupplyRuleEngine implements RuleDetector {

    private static final Logger log = LoggerFactory.getLogger(SupplyRuleEngine.class);

    private final RuleRepository ruleRepository;
    private final Map<RuleType, SupplyRuleEvaluator> evaluatorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<List<SupplyRule>> activeRules = new AtomicReference<>(List.of());

    public SupplyRuleEngine(RuleRepository ruleRepository, List<SupplyRuleEvaluator> evaluators,
                            Tracer tracer, MetricsConfig metricsConfig) {
        this.ruleRepository = ruleRepository;
        this.evaluatorMap = new EnumMap<>(RuleType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (SupplyRuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedRuleType(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedRuleType(), evaluator.getClass().getSimpleName());
        }
    }

    @Override
    public int loadRules() {
        List<SupplyRule> loaded;
        try {
            loaded = ruleRepository.findAll();
        } catch (Exception e) {
            throw new DetectorLoadException("Failed to load supply rules", e);
        }

        List<SupplyRule> enabled = loaded.stream()
                .filter(SupplyRule::isEnabled)
                .toList();
        activeRules.set(enabled);
        log.info("Loaded {} supply rules ({} enabled)", loaded.size(), enabled.size());
        return enabled.size();
    }

    public List<SupplyRule> getActiveRules() {
        return activeRules.get();
    }

    /**
     * Evaluate every active rule against the data point.
     * A rule that throws is logged and skipped so it cannot block the other rules.
     */
    @Override
    public List<RawFinding> evaluate(DataPoint dataPoint) {
        if (dataPoint == null || dataPoint.getMedicineId() == null) {
            throw new RuleEvaluationException("Cannot evaluate rules for a data point without a medicine ID");
        }

        List<RawFinding> findings = new ArrayList<>();

        for (SupplyRule rule : activeRules.get()) {
            SupplyRuleEvaluator evaluator = evaluatorMap.get(rule.getRuleType());
            if (evaluator == null) {
                log.warn("No evaluator registered for rule type: {}, rule: {}",
                        rule.getRuleType(), rule.getRuleId());
                continue;
            }

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + rule.getRuleType())
                    .tag("rule.id", rule.getRuleId())
                    .tag("rule.type", rule.getRuleType().name())
                    .tag("medicine.id", dataPoint.getMedicineId())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                Optional<RawFinding> finding = evaluator.evaluate(dataPoint, rule);
                ruleSpan.tag("rule.triggered", String.valueOf(finding.isPresent()));

                finding.ifPresent(f -> {
                    findings.add(f);
                    metricsConfig.recordRuleTriggered(rule.getRuleType().name());
                    log.debug("Rule triggered: {} for medicine {} - severity={}, message={}",
                            rule.getName(), dataPoint.getMedicineId(), f.getSeverity(), f.getMessage());
                });
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating rule {} for medicine {}: {}",
                        rule.getRuleId(), dataPoint.getMedicineId(), e.getMessage(), e);
            } finally {
                ruleSpan.end();
            }
        }

        return findings;
    }
}
