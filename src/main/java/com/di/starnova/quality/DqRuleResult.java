package com.di.starnova.quality;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one data quality rule over one table snapshot.
 * {@code violationCount} counts offending rows, {@code distinctViolationCount} offending values;
 * {@code samples} holds at most the configured sample size of them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DqRuleResult implements Serializable {
    private String ruleId;
    private RuleType type;
    private String targetTable;
    private String column;
    private String description;
    private RuleOutcome outcome;
    private long violationCount;
    private long distinctViolationCount;
    @Builder.Default
    private List<ViolationSample> samples = new ArrayList<>();

    public boolean failed() {
        return outcome == RuleOutcome.FAIL;
    }
}
