package com.di.starnova.quality;

import com.di.starnova.transform.Tables;
import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.transforms.Count;
import org.apache.beam.sdk.transforms.Filter;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;

/**
 * A key column must be non-null and unique. Every null and every duplicated key value is
 * a violation, counted with all rows that carry it.
 */
public class KeyIntegrityRule extends AbstractRule {

    public KeyIntegrityRule(String table, String keyColumn) {
        super(RuleType.KEY_INTEGRITY, table, keyColumn);
    }

    @Override
    public String description() {
        return targetTable() + "." + column() + " is non-null and unique";
    }

    @Override
    public PCollection<KV<String, Long>> violations(PCollectionTuple tables) {
        SerializableFunction<KV<String, Long>, Boolean> offending =
                kv -> RowFormatting.NULL_TOKEN.equals(kv.getKey()) || kv.getValue() > 1;
        return tokens(Tables.get(tables, targetTable()), column(), id() + "/Keys")
                .apply(id() + "/CountKeys", Count.perElement())
                .apply(id() + "/NullOrDuplicated", Filter.by(offending));
    }
}
