package com.di.starnova.fact;

import com.di.starnova.dimension.TimeDimensionBuilder;
import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.FirstSeen;
import com.di.starnova.transform.KeyByField;
import com.di.starnova.transform.LookupJoin;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.schemas.Schema.FieldType;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@code fact_sales} at order-item grain.
 *
 * <p>order_items is left-joined with orders (first-seen order per id) and customers
 * ({@code customer_id} to {@code customer_unique_id}); each dimension's surrogate key is then
 * looked up by its natural key. Every order item yields exactly one fact row. A missing natural
 * key or a failed lookup leaves the foreign key null.
 */
public class FactBuilder extends PTransform<PCollectionTuple, PCollection<Row>> {

    public static final List<String> INPUT_TABLES = List.of(
            TableNames.ORDER_ITEMS, TableNames.ORDERS, TableNames.CUSTOMERS,
            TableNames.DIM_PRODUCT, TableNames.DIM_CUSTOMER, TableNames.DIM_SELLER, TableNames.DIM_TIME);

    /** Order item columns widened with everything the lookups fill in. */
    static final Schema ENRICHED = Schema.builder()
            .addFields(SchemaRegistry.schemaFor(TableNames.ORDER_ITEMS).getFields())
            .addNullableField("customer_id", FieldType.STRING)
            .addNullableField("order_status", FieldType.STRING)
            .addNullableField("order_purchase_timestamp", FieldType.DATETIME)
            .addNullableField("customer_unique_id", FieldType.STRING)
            .addNullableField("product_key", FieldType.INT64)
            .addNullableField("customer_key", FieldType.INT64)
            .addNullableField("seller_key", FieldType.INT64)
            .addNullableField("time_key", FieldType.INT64)
            .build();

    @Override
    public PCollection<Row> expand(PCollectionTuple input) {
        for (String table : INPUT_TABLES) {
            SchemaRegistry.requireConforms(table, Tables.get(input, table).getSchema());
        }
        PCollection<Row> orders = Tables.get(input, TableNames.ORDERS)
                .apply("FirstSeenOrder", FirstSeen.byField(TableNames.ORDERS, "order_id").droppingNullKeys());
        PCollection<Row> customers = Tables.get(input, TableNames.CUSTOMERS)
                .apply("FirstSeenCustomerId", FirstSeen.byField(TableNames.CUSTOMERS, "customer_id").droppingNullKeys());

        Schema factSchema = SchemaRegistry.schemaFor(TableNames.FACT_SALES);
        PCollection<Row> facts = Tables.get(input, TableNames.ORDER_ITEMS)
                .apply("JoinOrders", LookupJoin.onField(orders, "order_id", ENRICHED)
                        .copy("customer_id", "customer_id")
                        .copy("order_status", "order_status")
                        .copy("order_purchase_timestamp", "order_purchase_timestamp"))
                .apply("JoinCustomers", LookupJoin.onField(customers, "customer_id", ENRICHED)
                        .copy("customer_unique_id", "customer_unique_id"))
                .apply("LookupProductKey", LookupJoin.onField(Tables.get(input, TableNames.DIM_PRODUCT), "product_id", ENRICHED)
                        .copy("product_key", "product_key"))
                .apply("LookupCustomerKey", LookupJoin.onField(Tables.get(input, TableNames.DIM_CUSTOMER), "customer_unique_id", ENRICHED)
                        .copy("customer_key", "customer_key"))
                .apply("LookupSellerKey", LookupJoin.onField(Tables.get(input, TableNames.DIM_SELLER), "seller_id", ENRICHED)
                        .copy("seller_key", "seller_key"))
                .apply("LookupTimeKey", LookupJoin.against(Tables.get(input, TableNames.DIM_TIME),
                                TimeDimensionBuilder.purchaseDateKey(), KeyByField.field("time_key"), ENRICHED)
                        .copy("time_key", "time_key"))
                .apply("ProjectFact", ParDo.of(new ProjectFn(factSchema)))
                .setRowSchema(factSchema);
        SchemaRegistry.requireConforms(TableNames.FACT_SALES, facts.getSchema());
        return facts;
    }

    /** Keeps the fact columns, by name, in fact_sales order. */
    static class ProjectFn extends DoFn<Row, Row> {
        private final Schema schema;

        ProjectFn(Schema schema) {
            this.schema = schema;
        }

        @ProcessElement
        public void processElement(@Element Row row, OutputReceiver<Row> out) {
            List<Object> values = new ArrayList<>(schema.getFieldCount());
            for (String name : schema.getFieldNames()) {
                values.add(row.getValue(name));
            }
            out.output(Row.withSchema(schema).addValues(values).build());
        }
    }
}
