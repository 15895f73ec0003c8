package com.di.starnova.handler.csv;

import com.di.starnova.exception.MalformedRecordException;
import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.util.TypeConverter;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.Row;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses one CSV file into rows of the registered raw schema.
 * Columns are matched by header name; extra columns are ignored, a missing one is malformed input,
 * as is a byte sequence that is not UTF-8.
 * Each record gets its zero-based position as {@code source_ordinal}. Files are read sequentially,
 * so the ordinal is the record's natural input order.
 */
class ParseCsvFileFn extends DoFn<FileIO.ReadableFile, Row> {

    private static final char BOM = '\uFEFF';

    private final String tableName;
    private final Schema schema;
    private final Counter rowsRead;

    ParseCsvFileFn(String tableName, Schema schema) {
        this.tableName = tableName;
        this.schema = schema;
        this.rowsRead = Metrics.counter("starnova.extract", "rows_" + tableName);
    }

    @ProcessElement
    public void processElement(@Element FileIO.ReadableFile file, OutputReceiver<Row> out) throws IOException {
        String source = file.getMetadata().resourceId().toString();
        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (BufferedReader reader = new BufferedReader(Channels.newReader(file.open(), utf8, -1));
             CSVReader csv = new CSVReaderBuilder(reader).build()) {
            String[] header = csv.readNext();
            if (header == null) {
                throw new MalformedRecordException(tableName + ": source " + source + " has no header line");
            }
            int[] columnIndex = mapColumns(header, source);

            long ordinal = 0;
            String[] record;
            while ((record = csv.readNext()) != null) {
                if (record.length == 1 && record[0].isEmpty()) {
                    continue;
                }
                out.output(toRow(record, columnIndex, ordinal));
                ordinal++;
            }
            rowsRead.inc(ordinal);
        } catch (CsvValidationException e) {
            throw new MalformedRecordException(tableName + ": invalid CSV in " + source + ": " + e.getMessage(), e);
        } catch (CharacterCodingException e) {
            throw new MalformedRecordException(tableName + ": " + source + " is not valid UTF-8", e);
        }
    }

    private int[] mapColumns(String[] header, String source) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            positions.putIfAbsent(name, i);
        }
        List<Schema.Field> fields = schema.getFields();
        int[] index = new int[fields.size()];
        for (int f = 0; f < fields.size(); f++) {
            String name = fields.get(f).getName();
            if (SchemaRegistry.SOURCE_ORDINAL.equals(name)) {
                index[f] = -1;
                continue;
            }
            Integer pos = positions.get(name);
            if (pos == null) {
                throw new MalformedRecordException(String.format(
                        "%s: column '%s' missing from header of %s", tableName, name, source));
            }
            index[f] = pos;
        }
        return index;
    }

    private Row toRow(String[] record, int[] columnIndex, long ordinal) {
        List<Schema.Field> fields = schema.getFields();
        List<Object> values = new ArrayList<>(fields.size());
        String context = tableName + " record " + ordinal;
        for (int f = 0; f < fields.size(); f++) {
            if (columnIndex[f] < 0) {
                values.add(ordinal);
                continue;
            }
            int pos = columnIndex[f];
            if (pos >= record.length) {
                throw new MalformedRecordException(String.format(
                        "%s: has %d cells, column '%s' expected at position %d", context, record.length, fields.get(f).getName(), pos));
            }
            values.add(TypeConverter.convertToSchemaType(record[pos], fields.get(f), context));
        }
        return Row.withSchema(schema).addValues(values).build();
    }
}
