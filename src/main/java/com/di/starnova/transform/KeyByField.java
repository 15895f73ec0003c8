package com.di.starnova.transform;

import com.di.starnova.exception.KeyDerivationException;
import com.di.starnova.schema.SchemaRegistry;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.Row;

/**
 * Keys rows by a natural-key string. Rows whose key is null are either dropped or rejected
 * with {@link KeyDerivationException}, depending on {@link NullKeys}.
 */
public class KeyByField extends DoFn<Row, KV<String, Row>> {

    public enum NullKeys { FAIL, DROP }

    private final String label;
    private final SerializableFunction<Row, String> keyFn;
    private final NullKeys nullKeys;

    public KeyByField(String label, SerializableFunction<Row, String> keyFn, NullKeys nullKeys) {
        this.label = label;
        this.keyFn = keyFn;
        this.nullKeys = nullKeys;
    }

    /** Key function reading one field as a string; null or blank values give a null key. */
    public static SerializableFunction<Row, String> field(String fieldName) {
        return (Row r) -> {
            Object v = r.getValue(fieldName);
            if (v == null) {
                return null;
            }
            String s = String.valueOf(v);
            return s.isBlank() ? null : s;
        };
    }

    @ProcessElement
    public void processElement(@Element Row row, OutputReceiver<KV<String, Row>> out) {
        String key = keyFn.apply(row);
        if (key == null) {
            if (nullKeys == NullKeys.DROP) {
                return;
            }
            Object ordinal = row.getSchema().hasField(SchemaRegistry.SOURCE_ORDINAL)
                    ? row.getValue(SchemaRegistry.SOURCE_ORDINAL) : "?";
            throw new KeyDerivationException(String.format(
                    "%s: natural key is null for record %s", label, ordinal));
        }
        out.output(KV.of(key, row));
    }
}
