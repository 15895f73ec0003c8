package com.di.starnova.quality;

import com.di.starnova.transform.Tables;
import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.transforms.Count;
import org.apache.beam.sdk.transforms.Filter;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Non-null values outside the allow-list are violations. Null is not a value here.
 */
public class AcceptedValuesRule extends AbstractRule {

    private final TreeSet<String> accepted;

    public AcceptedValuesRule(String table, String column, Collection<String> accepted) {
        super(RuleType.ACCEPTED_VALUES, table, column);
        if (accepted == null || accepted.isEmpty()) {
            throw new IllegalArgumentException("Accepted values for " + table + "." + column + " must not be empty");
        }
        this.accepted = new TreeSet<>(accepted);
    }

    public List<String> acceptedValues() {
        return new ArrayList<>(accepted);
    }

    @Override
    public String description() {
        return targetTable() + "." + column() + " in " + accepted;
    }

    @Override
    public PCollection<KV<String, Long>> violations(PCollectionTuple tables) {
        TreeSet<String> allowed = accepted;
        SerializableFunction<String, Boolean> notAccepted =
                v -> !RowFormatting.NULL_TOKEN.equals(v) && !allowed.contains(v);
        return tokens(Tables.get(tables, targetTable()), column(), id() + "/Values")
                .apply(id() + "/NotAccepted", Filter.by(notAccepted))
                .apply(id() + "/Count", Count.perElement());
    }
}
