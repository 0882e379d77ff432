package com.medwatch.anomaly.engine.evaluators;

import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SupplierDelayEvaluatorTest {

    private final SupplierDelayEvaluator evaluator = new SupplierDelayEvaluator();
    private final SupplyRule rule = TestDataFactory.createSupplyRule("RULE-SUPPLIER-DELAY", RuleType.SUPPLIER_DELAY, 3);

    @Test
    void delayWithinTolerance_noFinding() {
        DataPoint dp = TestDataFactory.healthyMedicine("MED-1").supplierDelay(3).build();

        assertThat(evaluator.evaluate(dp, rule)).isEmpty();
    }

    @Test
    void longDelayWithEnoughStock_usesRuleSeverity() {
        DataPoint dp = TestDataFactory.healthyMedicine("MED-1").supplierDelay(10).build();

        Optional<RawFinding> finding = evaluator.evaluate(dp, rule);

        assertThat(finding).isPresent();
        assertThat(finding.get().getType()).isEqualTo("supplier-delay");
        assertThat(finding.get().getSeverity()).isEqualTo("medium");
        assertThat(finding.get().getMessage()).contains("MedSupply Ltd").contains("10 days");
    }

    @Test
    void stockRunsOutBeforeDelivery_escalatesToCritical() {
        DataPoint dp = TestDataFactory.healthyMedicine("MED-1").supplierDelay(10).daysOfCover(6.0).build();

        Optional<RawFinding> finding = evaluator.evaluate(dp, rule);

        assertThat(finding).get().extracting(RawFinding::getSeverity).isEqualTo("critical");
        assertThat(finding.get().getDescription()).contains("before the delayed delivery");
    }
}
