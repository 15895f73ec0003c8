package com.di.starnova.profile;

import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CoderRegistry;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.values.Row;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Count, nulls, mean, sample standard deviation, min and max of one numeric column.
 * Sums are exact, so the result does not depend on how rows are bundled.
 */
public class NumericProfileFn extends Combine.CombineFn<Row, NumericProfileFn.Accum, ColumnProfile> {

    private final String column;

    public NumericProfileFn(String column) {
        this.column = column;
    }

    public static class Accum implements Serializable {
        long count;
        long nulls;
        BigDecimal sum = BigDecimal.ZERO;
        BigDecimal sumOfSquares = BigDecimal.ZERO;
        Double min;
        Double max;
    }

    @Override
    public Accum createAccumulator() {
        return new Accum();
    }

    @Override
    public Accum addInput(Accum acc, Row row) {
        Object value = row.getValue(column);
        if (!(value instanceof Number)) {
            acc.nulls++;
            return acc;
        }
        double d = ((Number) value).doubleValue();
        BigDecimal v = new BigDecimal(d);
        acc.count++;
        acc.sum = acc.sum.add(v);
        acc.sumOfSquares = acc.sumOfSquares.add(v.multiply(v));
        acc.min = acc.min == null ? d : Math.min(acc.min, d);
        acc.max = acc.max == null ? d : Math.max(acc.max, d);
        return acc;
    }

    @Override
    public Accum mergeAccumulators(Iterable<Accum> accumulators) {
        Accum merged = new Accum();
        for (Accum acc : accumulators) {
            merged.count += acc.count;
            merged.nulls += acc.nulls;
            merged.sum = merged.sum.add(acc.sum);
            merged.sumOfSquares = merged.sumOfSquares.add(acc.sumOfSquares);
            if (acc.min != null) {
                merged.min = merged.min == null ? acc.min : Math.min(merged.min, acc.min);
            }
            if (acc.max != null) {
                merged.max = merged.max == null ? acc.max : Math.max(merged.max, acc.max);
            }
        }
        return merged;
    }

    @Override
    public ColumnProfile extractOutput(Accum acc) {
        ColumnProfile.ColumnProfileBuilder profile = ColumnProfile.builder()
                .column(column)
                .kind(ColumnProfile.Kind.NUMERIC)
                .count(acc.count)
                .nullCount(acc.nulls);
        if (acc.count == 0) {
            return profile.build();
        }
        BigDecimal n = BigDecimal.valueOf(acc.count);
        profile.mean(acc.sum.divide(n, MathContext.DECIMAL128).doubleValue())
                .min(acc.min)
                .max(acc.max);
        if (acc.count > 1) {
            // (sum(x^2) - sum(x)^2 / n) / (n - 1)
            BigDecimal squaredSumOverN = acc.sum.multiply(acc.sum).divide(n, MathContext.DECIMAL128);
            BigDecimal variance = acc.sumOfSquares.subtract(squaredSumOverN)
                    .divide(BigDecimal.valueOf(acc.count - 1), MathContext.DECIMAL128);
            profile.stddev(Math.sqrt(Math.max(0.0, variance.doubleValue())));
        }
        return profile.build();
    }

    @Override
    public Coder<Accum> getAccumulatorCoder(CoderRegistry registry, Coder<Row> inputCoder) {
        return SerializableCoder.of(Accum.class);
    }

    @Override
    public Coder<ColumnProfile> getDefaultOutputCoder(CoderRegistry registry, Coder<Row> inputCoder) {
        return SerializableCoder.of(ColumnProfile.class);
    }
}
