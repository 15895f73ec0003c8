package com.di.starnova.quality;

import com.di.starnova.transform.Tables;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.transforms.Flatten;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionList;
import org.apache.beam.sdk.values.PCollectionTuple;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates a battery of {@link DataQualityRule}s over one table snapshot.
 *
 * <p>Each rule is evaluated independently and always yields exactly one {@link DqRuleResult};
 * a failing rule never stops the others. Deciding whether failures abort the run is left
 * to the caller.
 */
@Slf4j
public class DataQualityValidator {

    private final List<DataQualityRule> rules;
    private final int sampleSize;

    public DataQualityValidator(List<DataQualityRule> rules, int sampleSize) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one data quality rule is required");
        }
        Set<String> ids = new HashSet<>();
        for (DataQualityRule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate data quality rule id: " + rule.id());
            }
        }
        this.rules = List.copyOf(rules);
        this.sampleSize = sampleSize;
    }

    /**
     * Applies every rule to {@code tables}.
     *
     * @return one result per rule, in no particular order
     */
    public PCollection<DqRuleResult> evaluate(PCollectionTuple tables) {
        for (DataQualityRule rule : rules) {
            for (String table : rule.requiredTables()) {
                Tables.get(tables, table);
            }
        }
        PCollectionList<DqRuleResult> results = PCollectionList.empty(tables.getPipeline());
        for (DataQualityRule rule : rules) {
            PCollection<DqRuleResult> result = rule.violations(tables)
                    .apply(rule.id() + "/Summarize", Combine.globally(new RuleResultCombineFn(rule, sampleSize)))
                    .setCoder(SerializableCoder.of(DqRuleResult.class));
            results = results.and(result);
        }
        return results.apply("CollectRuleResults", Flatten.pCollections())
                .setCoder(SerializableCoder.of(DqRuleResult.class));
    }

    /**
     * Orders evaluated results by battery position and logs each outcome.
     *
     * @throws IllegalStateException if a rule of the battery has no result
     */
    public DqReport report(String pipelineName, String runId, Collection<DqRuleResult> evaluated) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            position.put(rules.get(i).id(), i);
        }
        List<DqRuleResult> ordered = new ArrayList<>();
        for (DqRuleResult result : evaluated) {
            if (position.containsKey(result.getRuleId())) {
                ordered.add(result);
            } else {
                log.warn("[DQ] Ignoring result of unknown rule {}", result.getRuleId());
            }
        }
        ordered.sort(Comparator.comparing(r -> position.get(r.getRuleId())));
        if (ordered.size() != rules.size()) {
            throw new IllegalStateException(String.format(
                    "Expected %d rule results, got %d", rules.size(), ordered.size()));
        }

        int failed = 0;
        for (DqRuleResult r : ordered) {
            if (r.failed()) {
                failed++;
                log.warn("[DQ] {}: {} violations ({} distinct) on {} -> FAIL, e.g. {}",
                        r.getRuleId(), r.getViolationCount(), r.getDistinctViolationCount(), r.getDescription(),
                        r.getSamples().isEmpty() ? "-" : r.getSamples().get(0).getValue());
            } else {
                log.info("[DQ] {}: {} -> PASS", r.getRuleId(), r.getDescription());
            }
        }
        log.info("[DQ] {} rules evaluated, {} failed", ordered.size(), failed);

        return DqReport.builder()
                .pipelineName(pipelineName)
                .runId(runId)
                .generatedAt(Instant.now())
                .rulesEvaluated(ordered.size())
                .rulesFailed(failed)
                .results(ordered)
                .build();
    }
}
