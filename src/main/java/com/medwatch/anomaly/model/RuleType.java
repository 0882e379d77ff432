package com.medwatch.anomaly.model;

public enum RuleType {
    LOW_STOCK,
    DAYS_OF_COVER,
    PRICE_SPIKE,
    SUPPLIER_DELAY,
    RAPID_DEPLETION
}
