package com.di.starnova.dimension;

import com.di.starnova.exception.KeyDerivationException;
import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.RowCoder;
import org.apache.beam.sdk.coders.VarLongCoder;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.GroupByKey;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;

import java.util.Objects;
import java.util.TreeSet;

/**
 * Pass-through that fails with {@link KeyDerivationException} when two rows of a dimension
 * share a surrogate key (a hash collision between distinct natural keys, or a missed dedup).
 */
public class SurrogateKeyCheck extends PTransform<PCollection<Row>, PCollection<Row>> {

    private final String tableName;
    private final String keyField;
    private final String naturalKeyField;

    public SurrogateKeyCheck(String tableName, String keyField, String naturalKeyField) {
        this.tableName = tableName;
        this.keyField = keyField;
        this.naturalKeyField = naturalKeyField;
    }

    @Override
    public PCollection<Row> expand(PCollection<Row> input) {
        Schema schema = Objects.requireNonNull(input.getSchema());
        return input
                .apply("KeyBySurrogate", ParDo.of(new KeyBySurrogateFn(tableName, keyField)))
                .setCoder(KvCoder.of(VarLongCoder.of(), RowCoder.of(schema)))
                .apply("GroupBySurrogate", GroupByKey.create())
                .apply("RejectCollisions", ParDo.of(new RejectCollisionsFn(tableName, naturalKeyField)))
                .setRowSchema(schema);
    }

    static class KeyBySurrogateFn extends DoFn<Row, KV<Long, Row>> {
        private final String tableName;
        private final String keyField;

        KeyBySurrogateFn(String tableName, String keyField) {
            this.tableName = tableName;
            this.keyField = keyField;
        }

        @ProcessElement
        public void processElement(@Element Row row, OutputReceiver<KV<Long, Row>> out) {
            Long key = row.getInt64(keyField);
            if (key == null) {
                throw new KeyDerivationException(tableName + ": null " + keyField + " in " + RowFormatting.formatAllFields(row));
            }
            out.output(KV.of(key, row));
        }
    }

    static class RejectCollisionsFn extends DoFn<KV<Long, Iterable<Row>>, Row> {
        private final String tableName;
        private final String naturalKeyField;

        RejectCollisionsFn(String tableName, String naturalKeyField) {
            this.tableName = tableName;
            this.naturalKeyField = naturalKeyField;
        }

        @ProcessElement
        public void processElement(@Element KV<Long, Iterable<Row>> group, OutputReceiver<Row> out) {
            TreeSet<String> naturalKeys = new TreeSet<>();
            int rows = 0;
            for (Row row : group.getValue()) {
                naturalKeys.add(RowFormatting.valueToken(row.getValue(naturalKeyField)));
                rows++;
            }
            if (rows > 1) {
                throw new KeyDerivationException(String.format(
                        "%s: surrogate key %d is shared by %d rows (%s %s)",
                        tableName, group.getKey(), rows, naturalKeyField, naturalKeys));
            }
            for (Row row : group.getValue()) {
                out.output(row);
            }
        }
    }
}
