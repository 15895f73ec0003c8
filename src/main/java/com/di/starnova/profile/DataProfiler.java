package com.di.starnova.profile;

import com.di.starnova.config.DataQualityConfig;
import com.di.starnova.schema.TableNames;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.transforms.Flatten;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionList;
import org.apache.beam.sdk.values.Row;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary statistics of selected columns of one table. Profiling only reads its input;
 * a column the table does not have is skipped with a warning.
 */
@Slf4j
public class DataProfiler {

    private final String table;
    private final List<String> numericColumns;
    private final Map<String, List<String>> categoricalColumns;

    public DataProfiler(String table, List<String> numericColumns, Map<String, List<String>> categoricalColumns) {
        this.table = table;
        this.numericColumns = List.copyOf(numericColumns);
        this.categoricalColumns = new LinkedHashMap<>(categoricalColumns);
    }

    /** price and freight_value, plus order_status against the accepted statuses. */
    public static DataProfiler factSales(DataQualityConfig config) {
        Map<String, List<String>> categorical = new LinkedHashMap<>();
        categorical.put("order_status", config.getAcceptedOrderStatus());
        return new DataProfiler(TableNames.FACT_SALES, List.of("price", "freight_value"), categorical);
    }

    public String table() {
        return table;
    }

    /** One profile per profiled column present in {@code rows}. */
    public PCollection<ColumnProfile> profile(PCollection<Row> rows) {
        Schema schema = Objects.requireNonNull(rows.getSchema(), "Profiled table must have a schema");
        PCollectionList<ColumnProfile> profiles = PCollectionList.empty(rows.getPipeline());
        for (String column : numericColumns) {
            if (present(schema, column)) {
                profiles = profiles.and(rows
                        .apply("Profile/" + column, Combine.globally(new NumericProfileFn(column)))
                        .setCoder(SerializableCoder.of(ColumnProfile.class)));
            }
        }
        for (Map.Entry<String, List<String>> e : categoricalColumns.entrySet()) {
            if (present(schema, e.getKey())) {
                profiles = profiles.and(rows
                        .apply("Profile/" + e.getKey(), Combine.globally(new CategoricalProfileFn(e.getKey(), e.getValue())))
                        .setCoder(SerializableCoder.of(ColumnProfile.class)));
            }
        }
        return profiles.apply("CollectProfiles", Flatten.pCollections())
                .setCoder(SerializableCoder.of(ColumnProfile.class));
    }

    /** Arranges column profiles in configured order. */
    public ProfileReport report(String runId, Collection<ColumnProfile> profiles) {
        Map<String, ColumnProfile> byColumn = new HashMap<>();
        for (ColumnProfile p : profiles) {
            byColumn.put(p.getColumn(), p);
        }
        Map<String, ColumnProfile> ordered = new LinkedHashMap<>();
        for (String column : numericColumns) {
            if (byColumn.containsKey(column)) ordered.put(column, byColumn.get(column));
        }
        for (String column : categoricalColumns.keySet()) {
            if (byColumn.containsKey(column)) ordered.put(column, byColumn.get(column));
        }
        long rowCount = ordered.values().stream().findFirst().map(p -> p.getCount() + p.getNullCount()).orElse(0L);
        for (ColumnProfile p : ordered.values()) {
            log.info("[PROFILE] {}.{}: count={} nulls={} mean={} stddev={} min={} max={}{}",
                    table, p.getColumn(), p.getCount(), p.getNullCount(), p.getMean(), p.getStddev(), p.getMin(), p.getMax(),
                    p.getFrequencies() == null ? "" : " frequencies=" + p.getFrequencies());
        }
        return ProfileReport.builder()
                .table(table)
                .runId(runId)
                .generatedAt(Instant.now())
                .rowCount(rowCount)
                .columns(ordered)
                .build();
    }

    private boolean present(Schema schema, String column) {
        if (schema.hasField(column)) {
            return true;
        }
        log.warn("[PROFILE] {} has no column '{}'; skipped", table, column);
        return false;
    }
}
