package com.di.starnova.load;

import com.di.starnova.schema.SchemaRegistry;
import org.apache.avro.generic.GenericRecord;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;
import org.apache.beam.sdk.extensions.avro.schemas.utils.AvroUtils;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.io.parquet.ParquetIO;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TypeDescriptor;
import org.apache.beam.sdk.values.TypeDescriptors;

import java.nio.file.Path;

/**
 * Registered tables as Parquet: one directory per table holding a single {@code .parquet} file.
 * The Avro schema is derived from the registry schema, so reading back yields rows
 * that conform to the registry.
 */
public final class ParquetTableStore {

    public static final String FILE_SUFFIX = ".parquet";

    private ParquetTableStore() {}

    public static Path tableDir(Path root, String tableName) {
        return root.resolve(tableName);
    }

    /** Writes {@code rows} to {@code <root>/<table>/}. An empty table still gets one (empty) file. */
    public static void write(PCollection<Row> rows, String tableName, Path root) {
        SchemaRegistry.requireConforms(tableName, rows.getSchema());
        org.apache.avro.Schema avroSchema = AvroUtils.toAvroSchema(SchemaRegistry.schemaFor(tableName));
        rows.apply("ToAvro/" + tableName, MapElements
                        .into(TypeDescriptor.of(GenericRecord.class))
                        .via(AvroUtils.getRowToGenericRecordFunction(avroSchema)))
                .setCoder(AvroCoder.of(GenericRecord.class, avroSchema))
                .apply("WriteParquet/" + tableName, FileIO.<GenericRecord>write()
                        .via(ParquetIO.sink(avroSchema))
                        .to(tableDir(root, tableName).toString())
                        .withPrefix(tableName)
                        .withSuffix(FILE_SUFFIX)
                        .withNumShards(1));
    }

    /** Reads {@code <root>/<table>/*.parquet} back as registry-conforming rows. */
    public static PCollection<Row> read(Pipeline pipeline, String tableName, Path root) {
        Schema schema = SchemaRegistry.schemaFor(tableName);
        org.apache.avro.Schema avroSchema = AvroUtils.toAvroSchema(schema);
        String pattern = tableDir(root, tableName).resolve("*" + FILE_SUFFIX).toString();
        return pipeline
                .apply("ReadParquet/" + tableName, ParquetIO.read(avroSchema).from(pattern))
                .apply("ToRow/" + tableName, MapElements
                        .into(TypeDescriptors.rows())
                        .via(AvroUtils.getGenericRecordToRowFunction(schema)))
                .setRowSchema(schema);
    }
}
