package com.di.starnova.dimension;

import com.di.starnova.keys.KeyDeriver;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.KeyByField;
import com.di.starnova.transform.RowOrder;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.RowCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.GroupByKey;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * One row per zip-code prefix. Coordinates are the mean of the group's non-null values,
 * summed in source order; city and state come from the first record of the group.
 */
public class GeolocationDimensionBuilder extends DimensionBuilder {

    static final String ZIP = "geolocation_zip_code_prefix";

    @Override
    public String tableName() {
        return TableNames.DIM_GEOLOCATION;
    }

    @Override
    public List<String> inputTables() {
        return List.of(TableNames.GEOLOCATION);
    }

    @Override
    protected String surrogateKeyField() {
        return "geolocation_key";
    }

    @Override
    protected String naturalKeyField() {
        return "zip_code_prefix";
    }

    @Override
    protected PCollection<Row> build(PCollectionTuple inputs) {
        PCollection<Row> raw = Tables.get(inputs, TableNames.GEOLOCATION);
        Schema schema = outputSchema();
        return raw
                .apply("KeyByZip", ParDo.of(new KeyByField(tableName(), KeyByField.field(ZIP), KeyByField.NullKeys.FAIL)))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), RowCoder.of(raw.getSchema())))
                .apply("GroupByZip", GroupByKey.create())
                .apply("Aggregate", ParDo.of(new AggregateZipFn(schema)))
                .setRowSchema(schema);
    }

    static class AggregateZipFn extends DoFn<KV<String, Iterable<Row>>, Row> {
        private final Schema schema;

        AggregateZipFn(Schema schema) {
            this.schema = schema;
        }

        @ProcessElement
        public void processElement(@Element KV<String, Iterable<Row>> group, OutputReceiver<Row> out) {
            List<Row> rows = new ArrayList<>();
            group.getValue().forEach(rows::add);
            rows.sort(RowOrder.INSTANCE);
            Row first = rows.get(0);
            Integer zip = first.getInt32(ZIP);
            out.output(Row.withSchema(schema).addValues(
                    KeyDeriver.surrogateKey(KeyDeriver.GEOLOCATION, zip),
                    zip,
                    mean(rows, "geolocation_lat"),
                    mean(rows, "geolocation_lng"),
                    first.getString("geolocation_city"),
                    first.getString("geolocation_state")).build());
        }

        private static Double mean(List<Row> ordered, String field) {
            double sum = 0.0;
            long count = 0;
            for (Row row : ordered) {
                Double v = row.getDouble(field);
                if (v != null) {
                    sum += v;
                    count++;
                }
            }
            return count == 0 ? null : sum / count;
        }
    }
}
