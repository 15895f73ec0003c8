package com.di.starnova.transform;

import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.RowCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.transforms.Values;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;

import java.util.Objects;

/**
 * Keeps one row per natural key: the first seen in input order, i.e. the smallest
 * {@code source_ordinal}. The choice does not depend on bundle or worker order.
 */
public class FirstSeen extends PTransform<PCollection<Row>, PCollection<Row>> {

    private final String label;
    private final SerializableFunction<Row, String> keyFn;
    private final KeyByField.NullKeys nullKeys;

    private FirstSeen(String label, SerializableFunction<Row, String> keyFn, KeyByField.NullKeys nullKeys) {
        this.label = label;
        this.keyFn = keyFn;
        this.nullKeys = nullKeys;
    }

    /** Deduplicates by one field; a null natural key fails the run. */
    public static FirstSeen byField(String label, String fieldName) {
        return new FirstSeen(label, KeyByField.field(fieldName), KeyByField.NullKeys.FAIL);
    }

    public static FirstSeen byKey(String label, SerializableFunction<Row, String> keyFn, KeyByField.NullKeys nullKeys) {
        return new FirstSeen(label, keyFn, nullKeys);
    }

    /** Same key, but rows with a null key are dropped instead of failing the run. */
    public FirstSeen droppingNullKeys() {
        return new FirstSeen(label, keyFn, KeyByField.NullKeys.DROP);
    }

    @Override
    public PCollection<Row> expand(PCollection<Row> input) {
        Schema schema = Objects.requireNonNull(input.getSchema(), "FirstSeen input must have a schema");
        return input
                .apply("KeyByNaturalKey", ParDo.of(new KeyByField(label, keyFn, nullKeys)))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), RowCoder.of(schema)))
                .apply("KeepEarliest", Combine.perKey(new EarliestRowFn()))
                .apply("DropKeys", Values.create())
                .setRowSchema(schema);
    }

    static class EarliestRowFn extends Combine.BinaryCombineFn<Row> {
        @Override
        public Row apply(Row left, Row right) {
            return RowOrder.earlier(left, right);
        }
    }
}
