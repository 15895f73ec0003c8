package com.di.starnova.quality;

import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TypeDescriptors;

import java.util.List;
import java.util.Locale;

/** Common identity of the standard rules. */
abstract class AbstractRule implements DataQualityRule {

    private final RuleType type;
    private final String targetTable;
    private final String column;

    AbstractRule(RuleType type, String targetTable, String column) {
        this.type = type;
        this.targetTable = targetTable;
        this.column = column;
    }

    @Override
    public String id() {
        return type.name().toLowerCase(Locale.ROOT) + "." + targetTable + "." + column;
    }

    @Override
    public RuleType type() {
        return type;
    }

    @Override
    public String targetTable() {
        return targetTable;
    }

    @Override
    public String column() {
        return column;
    }

    @Override
    public List<String> requiredTables() {
        return List.of(targetTable);
    }

    @Override
    public String toString() {
        return id();
    }

    /** Value tokens of one column, {@code <null>} for null. */
    static PCollection<String> tokens(PCollection<Row> rows, String column, String stepName) {
        SerializableFunction<Row, String> token = (Row r) -> RowFormatting.valueToken(r.getValue(column));
        return rows.apply(stepName, MapElements.into(TypeDescriptors.strings()).via(token));
    }
}
