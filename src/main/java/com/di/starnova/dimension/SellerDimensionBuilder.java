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
 * One row per seller, first-seen attributes. Sellers without a known zip prefix keep a null geolocation_key.
 */
public class SellerDimensionBuilder extends DimensionBuilder {

    @Override
    public String tableName() {
        return TableNames.DIM_SELLER;
    }

    @Override
    public List<String> inputTables() {
        return List.of(TableNames.SELLERS, TableNames.DIM_GEOLOCATION);
    }

    @Override
    protected String surrogateKeyField() {
        return "seller_key";
    }

    @Override
    protected String naturalKeyField() {
        return "seller_id";
    }

    @Override
    protected PCollection<Row> build(PCollectionTuple inputs) {
        Schema schema = outputSchema();
        return Tables.get(inputs, TableNames.SELLERS)
                .apply("FirstSeenSeller", FirstSeen.byField(tableName(), "seller_id"))
                .apply("ToSellerRow", ParDo.of(new ToSellerRowFn(schema)))
                .setRowSchema(schema)
                .apply("LookupGeolocation", LookupJoin.onField(Tables.get(inputs, TableNames.DIM_GEOLOCATION), "zip_code_prefix", schema)
                        .copy("geolocation_key", "geolocation_key"));
    }

    static class ToSellerRowFn extends DoFn<Row, Row> {
        private final Schema schema;

        ToSellerRowFn(Schema schema) {
            this.schema = schema;
        }

        @ProcessElement
        public void processElement(@Element Row raw, OutputReceiver<Row> out) {
            String sellerId = raw.getString("seller_id");
            out.output(Row.withSchema(schema).addValues(
                    KeyDeriver.surrogateKey(KeyDeriver.SELLER, sellerId),
                    sellerId,
                    raw.getString("seller_city"),
                    raw.getString("seller_state"),
                    raw.getInt32("seller_zip_code_prefix"),
                    null).build());
        }
    }
}
