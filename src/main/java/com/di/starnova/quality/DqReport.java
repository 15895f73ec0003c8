package com.di.starnova.quality;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * All rule results of one run, in battery order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DqReport {
    private String pipelineName;
    private String runId;
    private Instant generatedAt;
    private int rulesEvaluated;
    private int rulesFailed;
    @Builder.Default
    private List<DqRuleResult> results = new ArrayList<>();

    public boolean hasFailures() {
        return results.stream().anyMatch(DqRuleResult::failed);
    }

    @JsonIgnore
    public List<String> getFailedRuleIds() {
        return results.stream().filter(DqRuleResult::failed).map(DqRuleResult::getRuleId).collect(Collectors.toList());
    }
}
