package com.di.starnova.dimension;

import com.di.starnova.StarNovaTestData;
import com.di.starnova.keys.KeyDeriver;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.di.starnova.StarNovaTestData.product;
import static com.di.starnova.StarNovaTestData.row;
import static com.di.starnova.StarNovaTestData.table;
import static com.di.starnova.StarNovaTestData.translation;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductDimensionBuilder Tests")
class ProductDimensionBuilderTest {

    private static Row dimProduct(String productId, String categoryName, String category, Integer photos, Integer nameLength, Integer descriptionLength) {
        return row(TableNames.DIM_PRODUCT, KeyDeriver.surrogateKey(KeyDeriver.PRODUCT, productId),
                productId, categoryName, category, photos, nameLength, descriptionLength);
    }

    // ============================================================================
    // Category formatting
    // ============================================================================

    @Test
    @DisplayName("Should title-case translated category names")
    void testFormatCategory() {
        assertEquals("Health Beauty", ProductDimensionBuilder.formatCategory("health_beauty"));
        assertEquals("Bed Bath Table", ProductDimensionBuilder.formatCategory("bed_bath_table"));
        assertEquals("Fashio Female Clothing", ProductDimensionBuilder.formatCategory("fashio_female_clothing"));
        assertEquals("Home Appliances 2", ProductDimensionBuilder.formatCategory("home_appliances_2"));
        assertEquals("Toys", ProductDimensionBuilder.formatCategory("TOYS"));
    }

    @Test
    @DisplayName("Should use N/A for a missing translation")
    void testFormatCategory_Missing() {
        assertEquals("N/A", ProductDimensionBuilder.formatCategory(null));
        assertEquals("N/A", ProductDimensionBuilder.formatCategory("  "));
    }

    // ============================================================================
    // Build
    // ============================================================================

    @Test
    @DisplayName("Should translate categories and keep the first record per product")
    void testBuild() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> products = table(p, TableNames.PRODUCTS,
                product(0, "p1", "beleza_saude", 40, 300, 2),
                product(1, "p1", "brinquedos", 10, 10, 1),
                product(2, "p2", "sem_traducao", 20, 100, 1),
                product(3, "p3", null, null, null, null));
        PCollection<Row> translations = table(p, TableNames.TRANSLATION,
                translation(0, "beleza_saude", "health_beauty"),
                translation(1, "beleza_saude", "ignored_duplicate"),
                translation(2, "brinquedos", "toys"),
                translation(3, null, "orphan"));

        PCollection<Row> dim = Tables.of(p, Map.of(TableNames.PRODUCTS, products, TableNames.TRANSLATION, translations))
                .apply(new ProductDimensionBuilder());

        PAssert.that(dim).containsInAnyOrder(
                dimProduct("p1", "beleza_saude", "Health Beauty", 2, 40, 300),
                dimProduct("p2", "sem_traducao", "N/A", 1, 20, 100),
                dimProduct("p3", null, "N/A", null, null, null));
        p.run().waitUntilFinish();
    }
}
