package com.di.starnova.exception;

import java.util.List;

/**
 * Thrown by the runner in fail-fast mode when at least one data quality rule failed.
 * The validator itself never throws it.
 */
public class DataQualityViolationException extends StarNovaException {

    private final List<String> failedRuleIds;

    public DataQualityViolationException(List<String> failedRuleIds) {
        super("Data quality rules failed: " + failedRuleIds);
        this.failedRuleIds = List.copyOf(failedRuleIds);
    }

    public List<String> getFailedRuleIds() {
        return failedRuleIds;
    }
}
