package com.medwatch.anomaly.service;

import com.medwatch.anomaly.engine.spi.RuleDetector;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import com.medwatch.anomaly.repository.RuleRepository;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleServiceTest {

    @Mock private RuleRepository ruleRepository;
    @Mock private RuleDetector ruleDetector;

    private RuleService service;

    @BeforeEach
    void setUp() {
        service = new RuleService(ruleRepository, ruleDetector);
    }

    @Test
    void createRule_withoutId_generatesIdAndReloads() {
        SupplyRule rule = TestDataFactory.createSupplyRule(null, RuleType.LOW_STOCK, 1.0);

        SupplyRule created = service.createRule(rule);

        assertThat(created.getRuleId()).isNotBlank();
        verify(ruleRepository).save(rule);
        verify(ruleDetector).loadRules();
    }

    @Test
    void createRule_withId_keepsIt() {
        SupplyRule rule = TestDataFactory.createSupplyRule("RULE-CUSTOM", RuleType.PRICE_SPIKE, 25);

        assertThat(service.createRule(rule).getRuleId()).isEqualTo("RULE-CUSTOM");
    }

    @Test
    void updateRule_mergesNonNullFields() {
        SupplyRule existing = TestDataFactory.createSupplyRule("R1", RuleType.DAYS_OF_COVER, 7);
        when(ruleRepository.findById("R1")).thenReturn(existing);
        SupplyRule changes = SupplyRule.builder()
                .threshold(10)
                .severity("high")
                .enabled(false)
                .params(Map.of("criticalDays", "3"))
                .build();

        SupplyRule updated = service.updateRule("R1", changes);

        assertThat(updated.getName()).isEqualTo("Test Rule R1");
        assertThat(updated.getRuleType()).isEqualTo(RuleType.DAYS_OF_COVER);
        assertThat(updated.getThreshold()).isEqualTo(10.0);
        assertThat(updated.getSeverity()).isEqualTo("high");
        assertThat(updated.isEnabled()).isFalse();
        assertThat(updated.getParams()).containsEntry("criticalDays", "3");
        verify(ruleRepository).save(existing);
        verify(ruleDetector).loadRules();
    }

    @Test
    void updateRule_missing_returnsNullWithoutReload() {
        when(ruleRepository.findById("NOPE")).thenReturn(null);

        assertThat(service.updateRule("NOPE", new SupplyRule())).isNull();
        verify(ruleRepository, never()).save(any());
        verifyNoInteractions(ruleDetector);
    }

    @Test
    void deleteRule_reloadsOnlyWhenSomethingWasDeleted() {
        when(ruleRepository.delete("R1")).thenReturn(true);
        when(ruleRepository.delete("R2")).thenReturn(false);

        assertThat(service.deleteRule("R1")).isTrue();
        assertThat(service.deleteRule("R2")).isFalse();

        verify(ruleDetector, times(1)).loadRules();
    }
}
