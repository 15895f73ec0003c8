package com.di.starnova.quality;

import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CoderRegistry;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.values.KV;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds a rule's {@code (value, rows)} violations into its {@link DqRuleResult}: totals plus the
 * top samples by {@link ViolationSample#ORDER}. Merging order does not affect the result.
 */
public class RuleResultCombineFn extends Combine.CombineFn<KV<String, Long>, RuleResultCombineFn.Accum, DqRuleResult> {

    private final DqRuleResult template;
    private final int sampleSize;

    public RuleResultCombineFn(DataQualityRule rule, int sampleSize) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1, was " + sampleSize);
        }
        this.template = DqRuleResult.builder()
                .ruleId(rule.id())
                .type(rule.type())
                .targetTable(rule.targetTable())
                .column(rule.column())
                .description(rule.description())
                .build();
        this.sampleSize = sampleSize;
    }

    public static class Accum implements Serializable {
        long rows;
        long distinct;
        List<ViolationSample> samples = new ArrayList<>();
    }

    @Override
    public Accum createAccumulator() {
        return new Accum();
    }

    @Override
    public Accum addInput(Accum acc, KV<String, Long> violation) {
        long count = violation.getValue() == null ? 0L : violation.getValue();
        acc.rows += count;
        acc.distinct++;
        acc.samples.add(new ViolationSample(violation.getKey(), count));
        if (acc.samples.size() > 2 * sampleSize) {
            trim(acc.samples);
        }
        return acc;
    }

    @Override
    public Accum mergeAccumulators(Iterable<Accum> accumulators) {
        Accum merged = new Accum();
        for (Accum acc : accumulators) {
            merged.rows += acc.rows;
            merged.distinct += acc.distinct;
            merged.samples.addAll(acc.samples);
        }
        trim(merged.samples);
        return merged;
    }

    @Override
    public DqRuleResult extractOutput(Accum acc) {
        List<ViolationSample> samples = new ArrayList<>(acc.samples);
        trim(samples);
        return template.toBuilder()
                .outcome(acc.rows > 0 || acc.distinct > 0 ? RuleOutcome.FAIL : RuleOutcome.PASS)
                .violationCount(acc.rows)
                .distinctViolationCount(acc.distinct)
                .samples(samples)
                .build();
    }

    @Override
    public Coder<Accum> getAccumulatorCoder(CoderRegistry registry, Coder<KV<String, Long>> inputCoder) {
        return SerializableCoder.of(Accum.class);
    }

    @Override
    public Coder<DqRuleResult> getDefaultOutputCoder(CoderRegistry registry, Coder<KV<String, Long>> inputCoder) {
        return SerializableCoder.of(DqRuleResult.class);
    }

    private void trim(List<ViolationSample> samples) {
        samples.sort(ViolationSample.ORDER);
        if (samples.size() > sampleSize) {
            samples.subList(sampleSize, samples.size()).clear();
        }
    }
}
