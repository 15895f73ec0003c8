package com.di.starnova.handler;

import com.di.starnova.config.DataConfig;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;

/**
 * Interface for raw source handlers (extraction).
 */
public interface SourceHandler {
    /** The source format handled, e.g. "csv" */
    String type();

    /**
     * Reads one raw table. The returned rows carry the registry schema of {@code tableName}.
     *
     * @throws com.di.starnova.exception.SourceNotFoundException if the table's source is absent
     */
    PCollection<Row> read(Pipeline pipeline, String tableName, DataConfig config);
}
