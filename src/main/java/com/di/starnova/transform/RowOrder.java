package com.di.starnova.transform;

import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.values.Row;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Deterministic total order over rows of one schema: {@code source_ordinal} when the schema has it,
 * otherwise the rendered row text. Used wherever one row has to be chosen among equals.
 */
public final class RowOrder implements Comparator<Row>, Serializable {

    public static final RowOrder INSTANCE = new RowOrder();

    private RowOrder() {}

    @Override
    public int compare(Row a, Row b) {
        if (a.getSchema().hasField(SchemaRegistry.SOURCE_ORDINAL) && b.getSchema().hasField(SchemaRegistry.SOURCE_ORDINAL)) {
            int byOrdinal = Long.compare(a.getInt64(SchemaRegistry.SOURCE_ORDINAL), b.getInt64(SchemaRegistry.SOURCE_ORDINAL));
            if (byOrdinal != 0) {
                return byOrdinal;
            }
        }
        return RowFormatting.formatAllFields(a).compareTo(RowFormatting.formatAllFields(b));
    }

    public static Row earlier(Row a, Row b) {
        return INSTANCE.compare(a, b) <= 0 ? a : b;
    }
}
