package com.di.starnova.dimension;

import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;

import java.util.List;

/**
 * Composite transform producing one dimension table from named input tables.
 *
 * <p>Subclasses implement {@link #build}; this class verifies every input against the registry
 * before anything is applied, verifies the produced schema, and appends the surrogate-key
 * uniqueness check. Inputs are only read.
 */
public abstract class DimensionBuilder extends PTransform<PCollectionTuple, PCollection<Row>> {

    /** Name of the produced table. */
    public abstract String tableName();

    /** Tables read from the input tuple. */
    public abstract List<String> inputTables();

    protected abstract String surrogateKeyField();

    protected abstract String naturalKeyField();

    protected abstract PCollection<Row> build(PCollectionTuple inputs);

    protected Schema outputSchema() {
        return SchemaRegistry.schemaFor(tableName());
    }

    @Override
    public final PCollection<Row> expand(PCollectionTuple input) {
        for (String table : inputTables()) {
            SchemaRegistry.requireConforms(table, Tables.get(input, table).getSchema());
        }
        PCollection<Row> rows = build(input);
        SchemaRegistry.requireConforms(tableName(), rows.getSchema());
        return rows.apply("CheckSurrogateKeys", new SurrogateKeyCheck(tableName(), surrogateKeyField(), naturalKeyField()));
    }
}
