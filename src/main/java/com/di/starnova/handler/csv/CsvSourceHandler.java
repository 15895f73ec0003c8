package com.di.starnova.handler.csv;

import com.di.starnova.config.DataConfig;
import com.di.starnova.exception.SourceNotFoundException;
import com.di.starnova.exception.UnknownTableException;
import com.di.starnova.handler.SourceHandler;
import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.schema.TableNames;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Reads the Olist CSV exports. One file per raw table under {@code data.source_path};
 * file names default to the dataset's own names and can be overridden with {@code data.source_files}.
 */
@Slf4j
@Component
public class CsvSourceHandler implements SourceHandler {

    static final Map<String, String> DEFAULT_FILES = Map.of(
            TableNames.CUSTOMERS, "olist_customers_dataset.csv",
            TableNames.SELLERS, "olist_sellers_dataset.csv",
            TableNames.PRODUCTS, "olist_products_dataset.csv",
            TableNames.ORDERS, "olist_orders_dataset.csv",
            TableNames.ORDER_ITEMS, "olist_order_items_dataset.csv",
            TableNames.TRANSLATION, "product_category_name_translation.csv",
            TableNames.GEOLOCATION, "olist_geolocation_dataset.csv");

    @Override
    public String type() {
        return "csv";
    }

    @Override
    public PCollection<Row> read(Pipeline pipeline, String tableName, DataConfig config) {
        if (!TableNames.RAW_TABLES.contains(tableName)) {
            throw new UnknownTableException("'" + tableName + "' is not a raw source table");
        }
        Path file = resolveFile(tableName, config);
        if (!Files.isRegularFile(file)) {
            throw new SourceNotFoundException("Source file for table '" + tableName + "' not found: " + file);
        }
        Schema schema = SchemaRegistry.schemaFor(tableName);
        log.info("[EXTRACT] {} <- {}", tableName, file);

        PCollection<Row> rows = pipeline
                .apply("Match/" + tableName, FileIO.match()
                        .filepattern(file.toString())
                        .withEmptyMatchTreatment(EmptyMatchTreatment.DISALLOW))
                .apply("ReadMatches/" + tableName, FileIO.readMatches())
                .apply("ParseCsv/" + tableName, ParDo.of(new ParseCsvFileFn(tableName, schema)))
                .setRowSchema(schema);
        SchemaRegistry.requireConforms(tableName, rows.getSchema());
        return rows;
    }

    Path resolveFile(String tableName, DataConfig config) {
        String fileName = null;
        if (config.getSourceFiles() != null) {
            fileName = config.getSourceFiles().get(tableName);
        }
        if (fileName == null || fileName.isBlank()) {
            fileName = DEFAULT_FILES.get(tableName);
        }
        return Paths.get(config.getSourcePath()).resolve(fileName.trim()).toAbsolutePath().normalize();
    }
}
