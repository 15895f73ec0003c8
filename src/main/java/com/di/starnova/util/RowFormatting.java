package com.di.starnova.util;

import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.Row;

import java.util.List;
import java.util.Objects;

/**
 * Renders rows as compact {@code {field=value, ...}} strings for violation samples and logs.
 */
public final class RowFormatting {
    private RowFormatting() {}

    public static final String NULL_TOKEN = "<null>";
    private static final String MISSING_TOKEN = "<missing>";

    /** Build a formatter that renders selected fields with truncation. */
    public static SerializableFunction<Row, String> formatSelectedFields(List<String> names, int maxChars) {
        final String[] fields = names.toArray(new String[0]);
        return (Row r) -> {
            Schema s = Objects.requireNonNull(r.getSchema(), "Row has no schema");
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < fields.length; i++) {
                String f = fields[i];
                int idx = s.hasField(f) ? s.indexOf(f) : -1;
                Object v = (idx >= 0) ? r.getValue(idx) : null;
                String vs;
                if (v == null) {
                    vs = (idx >= 0) ? NULL_TOKEN : MISSING_TOKEN;
                } else {
                    vs = String.valueOf(v);
                    if (maxChars > 0 && vs.length() > maxChars) vs = vs.substring(0, maxChars) + "...";
                }
                if (i > 0) sb.append(", ");
                sb.append(f).append("=").append(vs);
            }
            return sb.append("}").toString();
        };
    }

    /** Renders every field of the row in schema order. */
    public static String formatAllFields(Row row) {
        return formatSelectedFields(row.getSchema().getFieldNames(), 200).apply(row);
    }

    /** String form of a single value, {@link #NULL_TOKEN} for null. */
    public static String valueToken(Object value) {
        return value == null ? NULL_TOKEN : String.valueOf(value);
    }
}
