package com.di.starnova.transform;

import com.di.starnova.StarNovaTestData;
import com.di.starnova.schema.TableNames;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.di.starnova.StarNovaTestData.customer;
import static com.di.starnova.StarNovaTestData.order;
import static com.di.starnova.StarNovaTestData.table;
import static com.di.starnova.StarNovaTestData.utc;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LookupJoin Tests")
class LookupJoinTest {

    private static final Schema OUT = Schema.builder()
            .addNullableField("order_id", Schema.FieldType.STRING)
            .addNullableField("customer_id", Schema.FieldType.STRING)
            .addNullableField("unique_id", Schema.FieldType.STRING)
            .addNullableField("zip", Schema.FieldType.INT32)
            .build();

    private static Row out(String orderId, String customerId, String uniqueId, Integer zip) {
        return Row.withSchema(OUT).addValues(orderId, customerId, uniqueId, zip).build();
    }

    private static LookupJoin customerLookup(PCollection<Row> customers) {
        return LookupJoin.onField(customers, "customer_id", OUT)
                .copy("customer_unique_id", "unique_id")
                .copy("customer_zip_code_prefix", "zip");
    }

    // ============================================================================
    // Matching
    // ============================================================================

    @Test
    @DisplayName("Should emit exactly one row per main row, matched or not")
    void testLeftLookup() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> orders = table(p, TableNames.ORDERS,
                order(0, "o1", "c1", "delivered", utc(2017, 1, 1, 0, 0)),
                order(1, "o2", "c1", "shipped", utc(2017, 1, 2, 0, 0)),
                order(2, "o3", "missing", "created", utc(2017, 1, 3, 0, 0)),
                order(3, "o4", null, "created", null));
        PCollection<Row> customers = table(p, TableNames.CUSTOMERS, customer(0, "c1", "u1", 1000, "a", "SP"));

        PCollection<Row> joined = orders.apply(customerLookup(customers));

        PAssert.that(joined).containsInAnyOrder(
                out("o1", "c1", "u1", 1000),
                out("o2", "c1", "u1", 1000),
                out("o3", "missing", null, null),
                out("o4", null, null, null));
        p.run().waitUntilFinish();
    }

    @Test
    @DisplayName("Should use the earliest lookup row when keys repeat")
    void testDuplicateLookupKeys() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> orders = table(p, TableNames.ORDERS,
                order(0, "o1", "c1", "delivered", utc(2017, 1, 1, 0, 0)));
        PCollection<Row> customers = table(p, TableNames.CUSTOMERS,
                customer(5, "c1", "late", 5000, "b", "RJ"),
                customer(1, "c1", "early", 1000, "a", "SP"));

        PAssert.that(orders.apply(customerLookup(customers))).containsInAnyOrder(out("o1", "c1", "early", 1000));
        p.run().waitUntilFinish();
    }

    // ============================================================================
    // Configuration errors
    // ============================================================================

    @Test
    @DisplayName("Should reject copy targets missing from the output schema")
    void testCopy_UnknownOutputField() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> customers = table(p, TableNames.CUSTOMERS);
        assertThrows(IllegalArgumentException.class,
                () -> LookupJoin.onField(customers, "customer_id", OUT).copy("customer_city", "city"));
    }

    @Test
    @DisplayName("Should reject copy sources missing from the lookup schema")
    void testCopy_UnknownLookupField() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> orders = table(p, TableNames.ORDERS);
        LookupJoin join = LookupJoin.onField(table(p, TableNames.CUSTOMERS), "customer_id", OUT).copy("no_such_field", "zip");
        assertThrows(IllegalArgumentException.class, () -> orders.apply(join));
    }
}
