package com.di.starnova.profile;

import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CoderRegistry;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.values.Row;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-null count, null count and the frequency of every accepted value of one column.
 * Accepted values that never occur are reported with 0.
 */
public class CategoricalProfileFn extends Combine.CombineFn<Row, CategoricalProfileFn.Accum, ColumnProfile> {

    private final String column;
    private final ArrayList<String> acceptedValues;

    public CategoricalProfileFn(String column, List<String> acceptedValues) {
        this.column = column;
        this.acceptedValues = new ArrayList<>(acceptedValues);
    }

    public static class Accum implements Serializable {
        long count;
        long nulls;
        HashMap<String, Long> frequencies = new HashMap<>();
    }

    @Override
    public Accum createAccumulator() {
        return new Accum();
    }

    @Override
    public Accum addInput(Accum acc, Row row) {
        Object value = row.getValue(column);
        if (value == null) {
            acc.nulls++;
        } else {
            acc.count++;
            acc.frequencies.merge(String.valueOf(value), 1L, Long::sum);
        }
        return acc;
    }

    @Override
    public Accum mergeAccumulators(Iterable<Accum> accumulators) {
        Accum merged = new Accum();
        for (Accum acc : accumulators) {
            merged.count += acc.count;
            merged.nulls += acc.nulls;
            for (Map.Entry<String, Long> e : acc.frequencies.entrySet()) {
                merged.frequencies.merge(e.getKey(), e.getValue(), Long::sum);
            }
        }
        return merged;
    }

    @Override
    public ColumnProfile extractOutput(Accum acc) {
        LinkedHashMap<String, Long> frequencies = new LinkedHashMap<>();
        for (String value : acceptedValues) {
            frequencies.put(value, acc.frequencies.getOrDefault(value, 0L));
        }
        return ColumnProfile.builder()
                .column(column)
                .kind(ColumnProfile.Kind.CATEGORICAL)
                .count(acc.count)
                .nullCount(acc.nulls)
                .frequencies(frequencies)
                .build();
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
