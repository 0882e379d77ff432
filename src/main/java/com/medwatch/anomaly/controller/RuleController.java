package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.model.SupplyRule;
import com.medwatch.anomaly.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Manage supply anomaly rules (CRUD + enable/disable)")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all supply rules",
            description = "Returns every configured rule, enabled or not, with its threshold, severity and parameters.")
    @GetMapping
    public ResponseEntity<List<SupplyRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<SupplyRule> getRule(
            @Parameter(description = "Rule ID", example = "RULE-LOW-STOCK")
            @PathVariable String ruleId) {
        SupplyRule rule = ruleService.getRule(ruleId);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }

    @Operation(summary = "Create a new supply rule",
            description = "Creates a rule and reloads the engine's rule set, so it applies from the next batch.")
    @PostMapping
    public ResponseEntity<SupplyRule> createRule(@RequestBody SupplyRule rule) {
        if (rule.getName() == null || rule.getRuleType() == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(ruleService.createRule(rule));
    }

    @Operation(summary = "Update an existing rule",
            description = "Change thresholds, severity, parameters, or enable/disable the rule.")
    @PutMapping("/{ruleId}")
    public ResponseEntity<SupplyRule> updateRule(
            @Parameter(description = "Rule ID", example = "RULE-LOW-STOCK")
            @PathVariable String ruleId,
            @RequestBody SupplyRule updated) {
        SupplyRule result = ruleService.updateRule(ruleId, updated);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Delete a rule")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @Parameter(description = "Rule ID", example = "RULE-PRICE-SPIKE")
            @PathVariable String ruleId) {
        if (!ruleService.deleteRule(ruleId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
