package com.di.starnova.quality;

import com.di.starnova.StarNovaTestData;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.Tables;
import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.di.starnova.StarNovaTestData.factSale;
import static com.di.starnova.StarNovaTestData.row;
import static com.di.starnova.StarNovaTestData.table;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Data Quality Rule Tests")
class DataQualityRulesTest {

    private static final List<String> ORDER_STATUSES = List.of(
            "delivered", "shipped", "canceled", "invoiced", "processing", "unavailable", "approved", "created");

    private static Row sale(Long productKey, Double price, String status) {
        return factSale(productKey, 1L, 1L, 20170101L, "o", 1, price, 0.0, status);
    }

    private static Row seller(long key, String id, Long geolocationKey) {
        return row(TableNames.DIM_SELLER, key, id, null, null, null, geolocationKey);
    }

    private static PCollectionTuple facts(Pipeline p, Row... rows) {
        return Tables.of(p, Map.of(TableNames.FACT_SALES, table(p, TableNames.FACT_SALES, rows)));
    }

    // ============================================================================
    // Identity
    // ============================================================================

    @Test
    @DisplayName("Should derive rule ids from type, table and column")
    void testRuleIds() {
        assertEquals("key_integrity.dim_time.time_key", new KeyIntegrityRule(TableNames.DIM_TIME, "time_key").id());
        assertEquals("numeric_range.fact_sales.price",
                new NumericRangeRule(TableNames.FACT_SALES, "price", NumericPredicate.nonNegative()).id());
        ReferentialIntegrityRule rule = new ReferentialIntegrityRule(
                TableNames.FACT_SALES, "seller_key", TableNames.DIM_SELLER, "seller_key", true);
        assertEquals("referential_integrity.fact_sales.seller_key", rule.id());
        assertEquals(List.of(TableNames.FACT_SALES, TableNames.DIM_SELLER), rule.requiredTables());
        assertEquals(TableNames.DIM_SELLER, rule.referencedTable());
        assertTrue(rule.flagsUnresolved());
    }

    @Test
    @DisplayName("Should describe numeric predicates")
    void testNumericPredicate() {
        assertTrue(NumericPredicate.nonNegative().test(0.0));
        assertFalse(NumericPredicate.nonNegative().test(-0.01));
        assertEquals(">= 0", NumericPredicate.nonNegative().describe());
        assertTrue(NumericPredicate.between(1, 5).test(5));
        assertFalse(NumericPredicate.between(1, 5).test(5.5));
        assertThrows(IllegalArgumentException.class, () -> NumericPredicate.between(5, 1));
    }

    // ============================================================================
    // Accepted values
    // ============================================================================

    @Test
    @DisplayName("Should flag values outside the accepted set and ignore nulls")
    void testAcceptedValues() {
        Pipeline p = StarNovaTestData.newPipeline();
        AcceptedValuesRule rule = new AcceptedValuesRule(TableNames.FACT_SALES, "order_status", ORDER_STATUSES);

        PCollection<KV<String, Long>> violations = rule.violations(facts(p,
                sale(1L, 1.0, "delivered"),
                sale(1L, 1.0, "refunded"),
                sale(1L, 1.0, "shipped"),
                sale(1L, 1.0, null)));

        PAssert.that(violations).containsInAnyOrder(KV.of("refunded", 1L));
        p.run().waitUntilFinish();
    }

    @Test
    @DisplayName("Should report no violation when every status is accepted")
    void testAcceptedValues_AllAccepted() {
        Pipeline p = StarNovaTestData.newPipeline();
        AcceptedValuesRule rule = new AcceptedValuesRule(TableNames.FACT_SALES, "order_status", ORDER_STATUSES);

        PCollection<KV<String, Long>> violations = rule.violations(facts(p,
                sale(1L, 1.0, "delivered"),
                sale(1L, 1.0, "shipped"),
                sale(1L, 1.0, "canceled"),
                sale(1L, 1.0, "invoiced"),
                sale(1L, 1.0, "processing"),
                sale(1L, 1.0, "unavailable"),
                sale(1L, 1.0, "approved"),
                sale(1L, 1.0, "created"),
                sale(1L, 1.0, "delivered")));

        PAssert.that(violations).empty();
        p.run().waitUntilFinish();
    }

    // ============================================================================
    // Numeric range
    // ============================================================================

    @Test
    @DisplayName("Should flag exactly the negative price")
    void testNumericRange() {
        Pipeline p = StarNovaTestData.newPipeline();
        NumericRangeRule rule = new NumericRangeRule(TableNames.FACT_SALES, "price", NumericPredicate.nonNegative());
        Row negative = sale(1L, -5.00, "delivered");

        PCollection<KV<String, Long>> violations = rule.violations(facts(p,
                sale(1L, 10.50, "delivered"),
                negative,
                sale(1L, 0.0, "delivered"),
                sale(1L, 99.99, "delivered"),
                sale(1L, null, "delivered")));

        PAssert.that(violations).containsInAnyOrder(KV.of(RowFormatting.formatAllFields(negative), 1L));
        p.run().waitUntilFinish();
    }

    // ============================================================================
    // Key integrity
    // ============================================================================

    @Test
    @DisplayName("Should flag duplicated keys with their row count")
    void testKeyIntegrity() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollectionTuple tables = Tables.of(p, Map.of(TableNames.DIM_SELLER, table(p, TableNames.DIM_SELLER,
                seller(1L, "s1", null), seller(1L, "s2", null), seller(1L, "s3", null), seller(2L, "s4", null))));

        PCollection<KV<String, Long>> violations = new KeyIntegrityRule(TableNames.DIM_SELLER, "seller_key").violations(tables);

        PAssert.that(violations).containsInAnyOrder(KV.of("1", 3L));
        p.run().waitUntilFinish();
    }

    @Test
    @DisplayName("Should flag null keys")
    void testKeyIntegrity_Nulls() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollectionTuple tables = facts(p, sale(null, 1.0, "delivered"), sale(5L, 1.0, "delivered"));

        PCollection<KV<String, Long>> violations = new KeyIntegrityRule(TableNames.FACT_SALES, "product_key").violations(tables);

        PAssert.that(violations).containsInAnyOrder(KV.of(RowFormatting.NULL_TOKEN, 1L));
        p.run().waitUntilFinish();
    }

    // ============================================================================
    // Referential integrity
    // ============================================================================

    @Test
    @DisplayName("Should flag unmatched and, when asked, null foreign keys")
    void testReferentialIntegrity_FlagUnresolved() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollectionTuple tables = Tables.of(p, Map.of(
                TableNames.FACT_SALES, table(p, TableNames.FACT_SALES,
                        sale(10L, 1.0, "delivered"), sale(99L, 1.0, "delivered"),
                        sale(99L, 2.0, "delivered"), sale(null, 1.0, "delivered")),
                TableNames.DIM_PRODUCT, table(p, TableNames.DIM_PRODUCT,
                        row(TableNames.DIM_PRODUCT, 10L, "p10", null, "N/A", null, null, null))));

        PCollection<KV<String, Long>> violations = new ReferentialIntegrityRule(
                TableNames.FACT_SALES, "product_key", TableNames.DIM_PRODUCT, "product_key", true).violations(tables);

        PAssert.that(violations).containsInAnyOrder(KV.of("99", 2L), KV.of(RowFormatting.NULL_TOKEN, 1L));
        p.run().waitUntilFinish();
    }

    @Test
    @DisplayName("Should skip null foreign keys when they are legitimate")
    void testReferentialIntegrity_NullsAllowed() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollectionTuple tables = Tables.of(p, Map.of(
                TableNames.DIM_SELLER, table(p, TableNames.DIM_SELLER,
                        seller(1L, "s1", null), seller(2L, "s2", 7L), seller(3L, "s3", 8L)),
                TableNames.DIM_GEOLOCATION, table(p, TableNames.DIM_GEOLOCATION,
                        row(TableNames.DIM_GEOLOCATION, 7L, 1037, null, null, null, null))));

        PCollection<KV<String, Long>> violations = new ReferentialIntegrityRule(
                TableNames.DIM_SELLER, "geolocation_key", TableNames.DIM_GEOLOCATION, "geolocation_key", false).violations(tables);

        PAssert.that(violations).containsInAnyOrder(KV.of("8", 1L));
        p.run().waitUntilFinish();
    }
}
