package com.di.starnova;

import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.schema.TableNames;
import org.apache.beam.runners.direct.DirectRunner;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.coders.RowCoder;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Row factories and pipeline helpers shared by the tests.
 */
public final class StarNovaTestData {

    private StarNovaTestData() {}

    public static Pipeline newPipeline() {
        PipelineOptions options = PipelineOptionsFactory.create();
        options.setRunner(DirectRunner.class);
        return Pipeline.create(options);
    }

    /** Rows of a registered table as a bounded PCollection. */
    public static PCollection<Row> table(Pipeline pipeline, String tableName, Row... rows) {
        return rows(pipeline, "Create " + tableName, SchemaRegistry.schemaFor(tableName), Arrays.asList(rows));
    }

    public static PCollection<Row> rows(Pipeline pipeline, String stepName, Schema schema, List<Row> rows) {
        if (rows.isEmpty()) {
            return pipeline.apply(stepName, Create.empty(RowCoder.of(schema))).setRowSchema(schema);
        }
        return pipeline.apply(stepName, Create.of(rows).withRowSchema(schema));
    }

    public static Row row(String tableName, Object... values) {
        return Row.withSchema(SchemaRegistry.schemaFor(tableName)).addValues(values).build();
    }

    public static List<Row> list(Row... rows) {
        return new ArrayList<>(Arrays.asList(rows));
    }

    public static DateTime utc(int year, int month, int day, int hour, int minute) {
        return new DateTime(year, month, day, hour, minute, DateTimeZone.UTC);
    }

    // ============================================================================
    // Raw rows (source_ordinal last)
    // ============================================================================

    public static Row customer(long ordinal, String customerId, String uniqueId, Integer zip, String city, String state) {
        return row(TableNames.CUSTOMERS, customerId, uniqueId, zip, city, state, ordinal);
    }

    public static Row seller(long ordinal, String sellerId, Integer zip, String city, String state) {
        return row(TableNames.SELLERS, sellerId, zip, city, state, ordinal);
    }

    public static Row product(long ordinal, String productId, String category, Integer nameLength, Integer descriptionLength, Integer photos) {
        return row(TableNames.PRODUCTS, productId, category, nameLength, descriptionLength, photos, ordinal);
    }

    public static Row order(long ordinal, String orderId, String customerId, String status, DateTime purchasedAt) {
        return row(TableNames.ORDERS, orderId, customerId, status, purchasedAt, ordinal);
    }

    public static Row orderItem(long ordinal, String orderId, Integer itemId, String productId, String sellerId, Double price, Double freight) {
        return row(TableNames.ORDER_ITEMS, orderId, itemId, productId, sellerId, price, freight, ordinal);
    }

    public static Row translation(long ordinal, String category, String english) {
        return row(TableNames.TRANSLATION, category, english, ordinal);
    }

    public static Row geolocation(long ordinal, Integer zip, Double lat, Double lng, String city, String state) {
        return row(TableNames.GEOLOCATION, zip, lat, lng, city, state, ordinal);
    }

    // ============================================================================
    // Output rows
    // ============================================================================

    public static Row factSale(Long productKey, Long customerKey, Long sellerKey, Long timeKey,
                               String orderId, Integer itemId, Double price, Double freight, String status) {
        return row(TableNames.FACT_SALES, productKey, customerKey, sellerKey, timeKey, orderId, itemId, price, freight, status);
    }
}
