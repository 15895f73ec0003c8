package com.di.starnova.handler.csv;

import com.di.starnova.StarNovaTestData;
import com.di.starnova.config.DataConfig;
import com.di.starnova.exception.ErrorCategory;
import com.di.starnova.exception.SourceNotFoundException;
import com.di.starnova.exception.UnknownTableException;
import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.schema.TableNames;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static com.di.starnova.StarNovaTestData.orderItem;
import static com.di.starnova.StarNovaTestData.order;
import static com.di.starnova.StarNovaTestData.translation;
import static com.di.starnova.StarNovaTestData.utc;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvSourceHandler Tests")
class CsvSourceHandlerTest {

    @TempDir
    Path sourceDir;

    private final CsvSourceHandler handler = new CsvSourceHandler();

    private DataConfig config() {
        DataConfig config = new DataConfig();
        config.setSourcePath(sourceDir.toString());
        config.setOutputPath(sourceDir.resolve("out").toString());
        config.setProfilingPath(sourceDir.resolve("profiling").toString());
        return config;
    }

    private void write(String fileName, String content) throws IOException {
        Files.writeString(sourceDir.resolve(fileName), content, StandardCharsets.UTF_8);
    }

    // ============================================================================
    // Parsing
    // ============================================================================

    @Test
    @DisplayName("Should parse typed rows with source ordinals in file order")
    void testRead_TypedRowsWithOrdinals() throws IOException {
        write("olist_order_items_dataset.csv",
                "order_id,order_item_id,product_id,seller_id,shipping_limit_date,price,freight_value\n"
                        + "o1,1,p1,s1,2017-09-19 09:45:35,58.90,13.29\n"
                        + "\n"
                        + "o1,2,p2,s1,2017-09-19 09:45:35,,0\n");
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> rows = handler.read(p, TableNames.ORDER_ITEMS, config());

        PAssert.that(rows).containsInAnyOrder(
                orderItem(0, "o1", 1, "p1", "s1", 58.90, 13.29),
                orderItem(1, "o1", 2, "p2", "s1", null, 0.0));
        p.run().waitUntilFinish();
    }

    @Test
    @DisplayName("Should map columns by header name, strip a BOM and handle quoted commas")
    void testRead_HeaderByNameWithBom() throws IOException {
        write("product_category_name_translation.csv",
                "\uFEFFproduct_category_name_english,product_category_name\n"
                        + "\"health_beauty\",beleza_saude\n"
                        + "\"bed, bath\",cama_mesa_banho\n");
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> rows = handler.read(p, TableNames.TRANSLATION, config());

        PAssert.that(rows).containsInAnyOrder(
                translation(0, "beleza_saude", "health_beauty"),
                translation(1, "cama_mesa_banho", "bed, bath"));
        p.run().waitUntilFinish();
    }

    @Test
    @DisplayName("Should honour source file overrides and parse timestamps")
    void testRead_SourceFileOverride() throws IOException {
        write("my_orders.csv",
                "order_id,customer_id,order_status,order_purchase_timestamp\n"
                        + "o1,c1,delivered,2017-10-02 10:56:33\n"
                        + "o2,c2,created,\n");
        DataConfig config = config();
        config.setSourceFiles(Map.of(TableNames.ORDERS, "my_orders.csv"));
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> rows = handler.read(p, TableNames.ORDERS, config);

        assertEquals(SchemaRegistry.schemaFor(TableNames.ORDERS), rows.getSchema());
        PAssert.that(rows).containsInAnyOrder(
                order(0, "o1", "c1", "delivered", utc(2017, 10, 2, 10, 56).plusSeconds(33)),
                order(1, "o2", "c2", "created", null));
        p.run().waitUntilFinish();
    }

    // ============================================================================
    // Failures
    // ============================================================================

    @Test
    @DisplayName("Should fail fast for a missing source file")
    void testRead_MissingFile() {
        Pipeline p = StarNovaTestData.newPipeline();
        assertThrows(SourceNotFoundException.class, () -> handler.read(p, TableNames.CUSTOMERS, config()));
    }

    @Test
    @DisplayName("Should reject tables that are not raw sources")
    void testRead_NotRawTable() {
        Pipeline p = StarNovaTestData.newPipeline();
        assertThrows(UnknownTableException.class, () -> handler.read(p, TableNames.FACT_SALES, config()));
    }

    @Test
    @DisplayName("Should fail the run for an unparseable value")
    void testRead_MalformedValue() throws IOException {
        write("olist_sellers_dataset.csv",
                "seller_id,seller_zip_code_prefix,seller_city,seller_state\n"
                        + "s1,not-a-zip,campinas,SP\n");
        Pipeline p = StarNovaTestData.newPipeline();
        handler.read(p, TableNames.SELLERS, config());

        Pipeline.PipelineExecutionException e = assertThrows(Pipeline.PipelineExecutionException.class,
                () -> p.run().waitUntilFinish());
        assertEquals(ErrorCategory.MALFORMED_RECORD, ErrorCategory.categorize(e));
    }

    @Test
    @DisplayName("Should fail the run for a missing header column")
    void testRead_MissingColumn() throws IOException {
        write("olist_sellers_dataset.csv",
                "seller_id,seller_city,seller_state\n"
                        + "s1,campinas,SP\n");
        Pipeline p = StarNovaTestData.newPipeline();
        handler.read(p, TableNames.SELLERS, config());

        Pipeline.PipelineExecutionException e = assertThrows(Pipeline.PipelineExecutionException.class,
                () -> p.run().waitUntilFinish());
        assertEquals(ErrorCategory.MALFORMED_RECORD, ErrorCategory.categorize(e));
    }

    @Test
    @DisplayName("Should fail the run for bytes that are not valid UTF-8")
    void testRead_InvalidUtf8() throws IOException {
        byte[] header = "seller_id,seller_zip_code_prefix,seller_city,seller_state\ns1,13041,".getBytes(StandardCharsets.UTF_8);
        byte[] city = {(byte) 0xC3, (byte) 0x28};
        byte[] tail = ",SP\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[header.length + city.length + tail.length];
        System.arraycopy(header, 0, content, 0, header.length);
        System.arraycopy(city, 0, content, header.length, city.length);
        System.arraycopy(tail, 0, content, header.length + city.length, tail.length);
        Files.write(sourceDir.resolve("olist_sellers_dataset.csv"), content);
        Pipeline p = StarNovaTestData.newPipeline();
        handler.read(p, TableNames.SELLERS, config());

        Pipeline.PipelineExecutionException e = assertThrows(Pipeline.PipelineExecutionException.class,
                () -> p.run().waitUntilFinish());
        assertEquals(ErrorCategory.MALFORMED_RECORD, ErrorCategory.categorize(e));
    }

    @Test
    @DisplayName("Should resolve default file names under the source path")
    void testResolveFile_Default() {
        Path file = handler.resolveFile(TableNames.GEOLOCATION, config());
        assertEquals(sourceDir.resolve("olist_geolocation_dataset.csv").toAbsolutePath().normalize(), file);
    }
}
