package com.di.starnova.dimension;

import com.di.starnova.keys.KeyDeriver;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.FirstSeen;
import com.di.starnova.transform.LookupJoin;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;

import java.util.List;

/**
 * One row per {@code customer_unique_id}, first-seen attributes, geolocation resolved by zip prefix.
 */
public class CustomerDimensionBuilder extends DimensionBuilder {

    @Override
    public String tableName() {
        return TableNames.DIM_CUSTOMER;
    }

    @Override
    public List<String> inputTables() {
        return List.of(TableNames.CUSTOMERS, TableNames.DIM_GEOLOCATION);
    }

    @Override
    protected String surrogateKeyField() {
        return "customer_key";
    }

    @Override
    protected String naturalKeyField() {
        return "customer_unique_id";
    }

    @Override
    protected PCollection<Row> build(PCollectionTuple inputs) {
        Schema schema = outputSchema();
        return Tables.get(inputs, TableNames.CUSTOMERS)
                .apply("FirstSeenCustomer", FirstSeen.byField(tableName(), "customer_unique_id"))
                .apply("ToCustomerRow", ParDo.of(new ToCustomerRowFn(schema)))
                .setRowSchema(schema)
                .apply("LookupGeolocation", LookupJoin.onField(Tables.get(inputs, TableNames.DIM_GEOLOCATION), "zip_code_prefix", schema)
                        .copy("geolocation_key", "geolocation_key"));
    }

    static class ToCustomerRowFn extends DoFn<Row, Row> {
        private final Schema schema;

        ToCustomerRowFn(Schema schema) {
            this.schema = schema;
        }

        @ProcessElement
        public void processElement(@Element Row raw, OutputReceiver<Row> out) {
            String uniqueId = raw.getString("customer_unique_id");
            out.output(Row.withSchema(schema).addValues(
                    KeyDeriver.surrogateKey(KeyDeriver.CUSTOMER, uniqueId),
                    uniqueId,
                    raw.getString("customer_city"),
                    raw.getString("customer_state"),
                    raw.getInt32("customer_zip_code_prefix"),
                    null).build());
        }
    }
}
