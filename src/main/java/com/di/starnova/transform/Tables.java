package com.di.starnova.transform;

import com.di.starnova.exception.UnknownTableException;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TupleTag;

import java.util.Map;

/**
 * Named tables as a {@link PCollectionTuple}: the tag id is the table name.
 */
public final class Tables {

    private Tables() {}

    public static TupleTag<Row> tag(String tableName) {
        return new TupleTag<>(tableName);
    }

    public static PCollectionTuple of(Pipeline pipeline, Map<String, PCollection<Row>> tables) {
        PCollectionTuple tuple = PCollectionTuple.empty(pipeline);
        for (Map.Entry<String, PCollection<Row>> e : tables.entrySet()) {
            tuple = tuple.and(tag(e.getKey()), e.getValue());
        }
        return tuple;
    }

    public static PCollectionTuple with(PCollectionTuple tables, String tableName, PCollection<Row> rows) {
        return tables.and(tag(tableName), rows);
    }

    /**
     * @throws UnknownTableException if the tuple holds no table of that name
     */
    public static PCollection<Row> get(PCollectionTuple tables, String tableName) {
        TupleTag<Row> tag = tag(tableName);
        if (!tables.has(tag)) {
            throw new UnknownTableException("Table '" + tableName + "' is not available here; present: " + tables.getAll().keySet());
        }
        return tables.get(tag);
    }
}
