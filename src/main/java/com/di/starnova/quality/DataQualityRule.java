package com.di.starnova.quality;

import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;

import java.io.Serializable;
import java.util.List;

/**
 * A read-only check over named tables.
 *
 * <p>{@link #violations} yields one {@code (value, rows)} pair per distinct offending value;
 * an empty result means the rule passes. Rules never modify or filter their inputs and
 * never throw for bad data.
 */
public interface DataQualityRule extends Serializable {

    String id();

    RuleType type();

    String targetTable();

    String column();

    /** Human-readable condition, e.g. {@code fact_sales.price >= 0}. */
    String description();

    /** Tables the rule reads. */
    List<String> requiredTables();

    PCollection<KV<String, Long>> violations(PCollectionTuple tables);
}
